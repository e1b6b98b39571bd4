package org.macroingest.collector.cli;

import org.macroingest.collector.ArgumentParser;
import org.macroingest.collector.CollectionOrchestrator;
import org.macroingest.collector.CollectionProperties;
import org.macroingest.collector.CollectionRange;
import org.macroingest.collector.ExportedFile;
import org.macroingest.collector.MacroCollectorBuilder;
import org.macroingest.collector.ManifestEntry;
import org.macroingest.collector.ParsedConfiguration;
import org.macroingest.collector.RunReport;
import org.macroingest.collector.TotalSourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Macro Collector CLI Application
 *
 * Plain Java command-line application collecting one or more sources into the raw store.
 * Uses MacroCollectorBuilder for wiring.
 *
 * Usage: java -jar macro-collector-cli.jar [OPTIONS]
 *
 * Environment Variables: FRED_API_KEY for fred; GCP_PROJECT_ID and
 * GOOGLE_OAUTH_ACCESS_TOKEN for gdelt.
 *
 * Examples: java -jar macro-collector-cli.jar --start 2024-01-01 --end 2024-01-31 java
 * -jar macro-collector-cli.jar --source ecb,fred --incremental
 */
public class MacroCollectorCli {

	private static final Logger logger = LoggerFactory.getLogger(MacroCollectorCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILED = 1;

	static final int EXIT_PARTIAL = 2;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Collection failed: {}", e.getMessage());
			System.exit(EXIT_FAILED);
		}
	}

	public static int run(String[] args) throws Exception {
		return run(args, MacroCollectorBuilder.create(), true);
	}

	static int run(String[] args, MacroCollectorBuilder builder, boolean checkEnvironment) {
		// Create argument parser with default properties
		CollectionProperties properties = new CollectionProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		// Parse and validate arguments
		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		if (checkEnvironment) {
			argumentParser.validateEnvironment(config.sources);
		}
		logConfiguration(config);

		builder.properties(config.applyTo(properties));
		CollectionOrchestrator orchestrator = builder.buildOrchestrator();
		CollectionRange range = config.toCollectionRange();

		boolean failed = false;
		boolean partial = false;
		for (String source : config.sources) {
			try {
				RunReport report = orchestrator.run(builder.buildAdapter(source), range);
				logResults(source, report, config.verbose);
				partial |= report.isPartial();
			}
			catch (TotalSourceUnavailableException e) {
				logger.error("Source {} unavailable: {}", e.getSourceId(), e.getMessage());
				failed = true;
			}
		}

		if (failed) {
			return EXIT_FAILED;
		}
		return partial ? EXIT_PARTIAL : EXIT_OK;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Sources: {}", config.sources);
		logger.info("  Range: {}..{}", config.startDate, config.endDate);
		logger.info("  Incremental: {}", config.incremental);
		logger.info("  Output directory: {}", config.outputDir);
		logger.info("  State directory: {}", config.stateDir);
		logger.info("  Max attempts: {}", config.maxAttempts);
		logger.info("  Deadline: {}", config.deadlineMinutes > 0 ? config.deadlineMinutes + " min" : "none");
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResults(String source, RunReport report, boolean verbose) {
		logger.info("Collection of {} completed{}", source, report.isPartial() ? " with skipped units" : "");
		logger.info("Units succeeded: {}", report.manifest().succeededUnits().size());
		logger.info("Units skipped: {}", report.manifest().skippedUnits().size());
		logger.info("Records written: {}", report.recordCount());
		logger.info("Files created: {}", report.exportedFiles().size());

		for (ManifestEntry skipped : report.manifest().skippedUnits()) {
			logger.warn("  skipped {} ({}): {}", skipped.unitKey(), skipped.errorType(), skipped.message());
		}
		if (verbose && !report.exportedFiles().isEmpty()) {
			logger.info("Files:");
			for (ExportedFile file : report.exportedFiles()) {
				logger.info("  - {} ({} records)", file.path(), file.recordCount());
			}
		}
	}

}
