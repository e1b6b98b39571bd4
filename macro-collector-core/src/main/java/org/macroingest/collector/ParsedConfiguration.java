package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Sources and range
	public List<String> sources = new ArrayList<>();

	@Nullable
	public LocalDate startDate; // null = end date minus the lookback

	@Nullable
	public LocalDate endDate; // null = today

	// Mode flags
	public boolean incremental = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	// Storage
	public String outputDir;

	public String stateDir;

	// Resilience
	public int maxAttempts;

	public int deadlineMinutes; // 0 = no deadline

	public long gdeltCostLimitBytes;

	public ParsedConfiguration(CollectionProperties defaultProperties) {
		// Initialize with defaults
		this.sources = new ArrayList<>(defaultProperties.getDefaultSources());
		this.outputDir = defaultProperties.getOutputDir();
		this.stateDir = defaultProperties.getStateDir();
		this.maxAttempts = defaultProperties.getMaxAttempts();
		this.deadlineMinutes = defaultProperties.getRunDeadlineMinutes();
		this.gdeltCostLimitBytes = defaultProperties.getGdeltCostLimitBytes();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * The range to collect. Only valid after {@link ArgumentParser#parseAndValidate}
	 * resolved both dates.
	 * @return the collection range
	 */
	public CollectionRange toCollectionRange() {
		if (startDate == null || endDate == null) {
			throw new IllegalStateException("Dates have not been resolved");
		}
		return new CollectionRange(startDate, endDate, incremental);
	}

	/**
	 * Copy the command-line overrides onto a properties instance.
	 * @param properties properties to update
	 * @return the same instance
	 */
	public CollectionProperties applyTo(CollectionProperties properties) {
		properties.setOutputDir(outputDir);
		properties.setStateDir(stateDir);
		properties.setMaxAttempts(maxAttempts);
		properties.setRunDeadlineMinutes(deadlineMinutes);
		properties.setGdeltCostLimitBytes(gdeltCostLimitBytes);
		properties.setVerbose(verbose);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "sources=" + sources + ", startDate=" + startDate + ", endDate=" + endDate
				+ ", incremental=" + incremental + ", verbose=" + verbose + ", helpRequested=" + helpRequested
				+ ", outputDir='" + outputDir + '\'' + ", stateDir='" + stateDir + '\'' + ", maxAttempts=" + maxAttempts
				+ ", deadlineMinutes=" + deadlineMinutes + ", gdeltCostLimitBytes=" + gdeltCostLimitBytes + '}';
	}

}
