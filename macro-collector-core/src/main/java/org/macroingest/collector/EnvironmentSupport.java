package org.macroingest.collector;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.function.Function;

/**
 * Source credentials ({@code FRED_API_KEY}, {@code GCP_PROJECT_ID},
 * {@code GOOGLE_OAUTH_ACCESS_TOKEN}) are never provisioned by the collector; they are read
 * from the system environment, then a {@code .env} file in the working directory, then a
 * {@code .env} file in the user's home directory. Both files are loaded once per process.
 */
public final class EnvironmentSupport {

	private static final Dotenv WORKING_DIR_DOTENV = Dotenv.configure()
		.ignoreIfMissing()
		.ignoreIfMalformed()
		.load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private EnvironmentSupport() {
	}

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return WORKING_DIR_DOTENV;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	/**
	 * Look up a variable.
	 * @param name the variable name
	 * @return the value, or {@code null} if no file or environment defines it
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIR_DOTENV.get(name);
		return value != null ? value : HOME_DOTENV.get(name);
	}

	/**
	 * Look up a credential that must be present.
	 * @param name the variable name
	 * @param hint how to obtain the credential, appended to the error message
	 * @return the non-blank value
	 * @throws IllegalStateException if the variable is unset or blank
	 */
	public static String require(String name, String hint) {
		return require(EnvironmentSupport::get, name, hint);
	}

	/**
	 * Same as {@link #require(String, String)} against another lookup, e.g. a map in tests.
	 * @param environment variable name to value, {@code null} when unset
	 * @param name the variable name
	 * @param hint how to obtain the credential
	 * @return the non-blank value
	 * @throws IllegalStateException if the variable is unset or blank
	 */
	public static String require(Function<String, @Nullable String> environment, String name, String hint) {
		String value = environment.apply(name);
		if (value == null || value.isBlank()) {
			throw new IllegalStateException(name + " environment variable is required. " + hint);
		}
		return value;
	}

}
