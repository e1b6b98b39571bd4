package org.macroingest.collector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The {@code User-agent: *} group of a {@code robots.txt} file.
 *
 * <p>
 * The longest matching {@code Allow}/{@code Disallow} prefix decides; on a tie
 * {@code Allow} wins. Paths without a matching rule are allowed.
 */
public final class RobotsRules {

	private static final RobotsRules ALLOW_ALL = new RobotsRules(List.of(), List.of());

	private final List<String> allowed;

	private final List<String> disallowed;

	private RobotsRules(List<String> allowed, List<String> disallowed) {
		this.allowed = List.copyOf(allowed);
		this.disallowed = List.copyOf(disallowed);
	}

	public static RobotsRules allowAll() {
		return ALLOW_ALL;
	}

	/**
	 * Rules made of known disallowed prefixes, used when {@code robots.txt} cannot be
	 * loaded.
	 * @param disallowedPrefixes path prefixes that must not be fetched
	 * @return the rules
	 */
	public static RobotsRules disallowing(List<String> disallowedPrefixes) {
		return new RobotsRules(List.of(), disallowedPrefixes);
	}

	public static RobotsRules parse(String robotsTxt) {
		List<String> allowed = new ArrayList<>();
		List<String> disallowed = new ArrayList<>();
		boolean inWildcardGroup = false;
		boolean lastWasAgent = false;

		for (String rawLine : robotsTxt.split("\\r?\\n")) {
			String line = rawLine;
			int comment = line.indexOf('#');
			if (comment >= 0) {
				line = line.substring(0, comment);
			}
			int colon = line.indexOf(':');
			if (colon < 0) {
				continue;
			}
			String field = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
			String value = line.substring(colon + 1).trim();

			if (field.equals("user-agent")) {
				boolean wildcard = value.equals("*");
				// consecutive User-agent lines share one group
				inWildcardGroup = lastWasAgent ? inWildcardGroup || wildcard : wildcard;
				lastWasAgent = true;
				continue;
			}
			lastWasAgent = false;
			if (!inWildcardGroup || value.isEmpty()) {
				continue;
			}
			if (field.equals("disallow")) {
				disallowed.add(value);
			}
			else if (field.equals("allow")) {
				allowed.add(value);
			}
		}
		return new RobotsRules(allowed, disallowed);
	}

	/**
	 * Whether a path may be fetched.
	 * @param path URL path, starting with {@code /}
	 * @return true if allowed
	 */
	public boolean isAllowed(String path) {
		int allowMatch = longestMatch(allowed, path);
		int disallowMatch = longestMatch(disallowed, path);
		return disallowMatch < 0 || allowMatch >= disallowMatch;
	}

	private static int longestMatch(List<String> prefixes, String path) {
		int longest = -1;
		for (String prefix : prefixes) {
			if (path.startsWith(prefix) && prefix.length() > longest) {
				longest = prefix.length();
			}
		}
		return longest;
	}

}
