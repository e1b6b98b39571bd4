package org.macroingest.collector;

import org.macroingest.collector.sources.FredAdapter;
import org.macroingest.collector.sources.GdeltAdapter;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line argument parser for the macro data collector. Plain Java, no framework.
 */
public class ArgumentParser {

	private final CollectionProperties defaultProperties;

	private final Clock clock;

	public ArgumentParser(CollectionProperties defaultProperties) {
		this(defaultProperties, Clock.systemUTC());
	}

	ArgumentParser(CollectionProperties defaultProperties, Clock clock) {
		this.defaultProperties = defaultProperties;
		this.clock = clock;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object, with both dates resolved
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-s", "--source", "--sources":
					String sourceStr = getRequiredValue(args, i, "source").toLowerCase(Locale.ROOT);
					config.sources = "all".equals(sourceStr) ? new ArrayList<>(MacroCollectorBuilder.SOURCES)
							: Arrays.stream(sourceStr.split(","))
								.map(String::trim)
								.filter(s -> !s.isEmpty())
								.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
					i++; // Skip next argument since we consumed it
					break;

				case "--start":
					config.startDate = parseDate(getRequiredValue(args, i, "start"));
					i++;
					break;

				case "--end":
					config.endDate = parseDate(getRequiredValue(args, i, "end"));
					i++;
					break;

				case "-i", "--incremental":
					config.incremental = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-o", "--output-dir":
					config.outputDir = getRequiredValue(args, i, "output-dir");
					i++; // Skip next argument since we consumed it
					break;

				case "--state-dir":
					config.stateDir = getRequiredValue(args, i, "state-dir");
					i++;
					break;

				case "--max-attempts":
					config.maxAttempts = parsePositiveInt(getRequiredValue(args, i, "max-attempts"), "max attempts");
					i++;
					break;

				case "--deadline":
					config.deadlineMinutes = parsePositiveInt(getRequiredValue(args, i, "deadline"), "deadline");
					i++;
					break;

				case "--max-gb":
					String maxGbStr = getRequiredValue(args, i, "max-gb");
					try {
						double maxGb = Double.parseDouble(maxGbStr);
						if (maxGb <= 0) {
							throw new IllegalArgumentException("Max GB must be positive: " + maxGbStr);
						}
						config.gdeltCostLimitBytes = (long) (maxGb * CostGuard.GIB);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException("Invalid max GB '" + maxGbStr + "': must be a positive number");
					}
					i++;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					break;
			}
		}

		if (config.endDate == null) {
			config.endDate = LocalDate.now(clock);
		}
		if (config.startDate == null) {
			config.startDate = config.endDate.minusDays(defaultProperties.getDefaultLookbackDays());
		}

		// Validate configuration
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: macro-collector [OPTIONS]\n");
		help.append("\n");
		help.append("Collect macro-economic series and documents into the raw store.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -s, --source LIST       Comma-separated sources, or 'all' (default: ")
			.append(String.join(",", defaultProperties.getDefaultSources()))
			.append(")\n");
		help.append("                           Known sources: ")
			.append(String.join(", ", MacroCollectorBuilder.SOURCES))
			.append("\n");
		help.append("    --start DATE            First day to collect, YYYY-MM-DD (default: end minus ")
			.append(defaultProperties.getDefaultLookbackDays())
			.append(" days)\n");
		help.append("    --end DATE              Last day to collect, YYYY-MM-DD (default: today)\n");
		help.append("    -i, --incremental       Resume each dataset from its stored watermark\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("STORAGE OPTIONS:\n");
		help.append("    -o, --output-dir DIR    Raw store root (default: ")
			.append(defaultProperties.getOutputDir())
			.append(")\n");
		help.append("    --state-dir DIR         Watermark directory (default: ")
			.append(defaultProperties.getStateDir())
			.append(")\n");
		help.append("\n");
		help.append("RESILIENCE OPTIONS:\n");
		help.append("    --max-attempts N        Attempts per request (default: ")
			.append(defaultProperties.getMaxAttempts())
			.append(")\n");
		help.append("    --deadline MINUTES      Cancel units still running after MINUTES per source\n");
		help.append("    --max-gb GB             Largest GDELT query allowed, in GB (default: ")
			.append(defaultProperties.getGdeltCostLimitBytes() / CostGuard.GIB)
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT:\n");
		help.append("    ").append(FredAdapter.API_KEY_VARIABLE).append("            Required for fred\n");
		help.append("    ").append(GdeltAdapter.PROJECT_ID_VARIABLE).append("           Required for gdelt\n");
		help.append("    ").append(GdeltAdapter.ACCESS_TOKEN_VARIABLE).append(" Required for gdelt\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    # Everything for January 2024\n");
		help.append("    macro-collector --start 2024-01-01 --end 2024-01-31\n");
		help.append("\n");
		help.append("    # Daily incremental update of two sources\n");
		help.append("    macro-collector --source ecb,fred --incremental\n");
		help.append("\n");
		help.append("    # GDELT with a tighter cost limit\n");
		help.append("    macro-collector --source gdelt --start 2024-03-01 --end 2024-03-02 --max-gb 2\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  every unit succeeded\n");
		help.append("    1  a source was unavailable or a run failed\n");
		help.append("    2  some units were skipped (see the run manifest)\n");

		return help.toString();
	}

	/**
	 * Validate that the credentials of the selected sources are available.
	 * @param sources selected sources
	 * @throws IllegalStateException if a credential is missing
	 */
	public void validateEnvironment(List<String> sources) {
		if (sources.contains(FredAdapter.SOURCE_ID)) {
			EnvironmentSupport.require(FredAdapter.API_KEY_VARIABLE,
					"Please set your FRED API key: export FRED_API_KEY=your_key_here");
		}
		if (sources.contains(GdeltAdapter.SOURCE_ID)) {
			EnvironmentSupport.require(GdeltAdapter.PROJECT_ID_VARIABLE,
					"Please set the Google Cloud project billed for BigQuery.");
			EnvironmentSupport.require(GdeltAdapter.ACCESS_TOKEN_VARIABLE,
					"Please set an OAuth token, e.g. from 'gcloud auth print-access-token'.");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static LocalDate parseDate(String value) {
		try {
			return LocalDate.parse(value);
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid date '" + value + "': must be YYYY-MM-DD format");
		}
	}

	private static int parsePositiveInt(String value, String name) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException(
						Character.toUpperCase(name.charAt(0)) + name.substring(1) + " must be positive: " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		// Validate sources
		if (config.sources.isEmpty()) {
			errors.add("At least one source is required");
		}
		for (String source : config.sources) {
			if (!MacroCollectorBuilder.SOURCES.contains(source)) {
				errors.add("Unknown source: " + source + " (must be one of " + MacroCollectorBuilder.SOURCES + ")");
			}
		}

		// Validate range
		if (config.startDate != null && config.endDate != null && config.endDate.isBefore(config.startDate)) {
			errors.add("End date " + config.endDate + " is before start date " + config.startDate);
		}
		if (config.endDate != null && config.endDate.isAfter(LocalDate.now(clock))) {
			errors.add("End date " + config.endDate + " is in the future");
		}

		// Validate directories
		if (config.outputDir == null || config.outputDir.isBlank()) {
			errors.add("Output directory cannot be empty");
		}
		if (config.stateDir == null || config.stateDir.isBlank()) {
			errors.add("State directory cannot be empty");
		}

		if (config.maxAttempts > 10) {
			errors.add("Max attempts too large (got: " + config.maxAttempts + ", max: 10)");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
