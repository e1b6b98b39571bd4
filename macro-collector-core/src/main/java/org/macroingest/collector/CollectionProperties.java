package org.macroingest.collector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for macro data collection.
 *
 * <p>
 * This class provides configuration options for output locations, retries, timeouts,
 * politeness and cost limits. Properties can be set directly via setters or passed to
 * {@link MacroCollectorBuilder}.
 *
 * <p>
 * Default values are provided for all properties and are suitable for most use cases.
 * Per-source request intervals are fixed by each source's published limits; only the
 * fallback interval for other sources is configurable.
 */
public class CollectionProperties {

	/**
	 * Root directory of the raw (bronze) store.
	 */
	private String outputDir = "data/raw";

	/**
	 * Directory holding incremental watermarks.
	 */
	private String stateDir = "data/state";

	/**
	 * Sources collected when none is given on the command line.
	 */
	private List<String> defaultSources = new ArrayList<>(List.of("ecb", "fred", "fed", "gdelt", "calendar"));

	/**
	 * Number of days collected back from today when no start date is given.
	 */
	private int defaultLookbackDays = 30;

	/**
	 * Maximum number of attempts for a request, the first one included.
	 */
	private int maxAttempts = 3;

	/**
	 * Backoff after the first failed attempt, in milliseconds.
	 */
	private long baseBackoffMillis = 1500;

	/**
	 * Factor applied to the backoff after every further failure.
	 */
	private double backoffMultiplier = 2.0;

	/**
	 * Upper bound for any single backoff or Retry-After wait, in seconds.
	 */
	private int maxBackoffSeconds = 60;

	/**
	 * HTTP connect timeout in seconds.
	 */
	private int connectTimeoutSeconds = 10;

	/**
	 * HTTP request timeout in seconds.
	 */
	private int requestTimeoutSeconds = 30;

	/**
	 * Minimum interval between two requests to a source without a dedicated policy.
	 */
	private long defaultMinIntervalMillis = 1000;

	/**
	 * Maximum duration of one source run in minutes (0 = no deadline).
	 */
	private int runDeadlineMinutes = 0;

	/**
	 * Bytes a single GDELT query may scan (default: 5 GiB).
	 */
	private long gdeltCostLimitBytes = CostGuard.DEFAULT_LIMIT_BYTES;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getOutputDir() {
		return outputDir;
	}

	public void setOutputDir(String outputDir) {
		this.outputDir = outputDir;
	}

	public String getStateDir() {
		return stateDir;
	}

	public void setStateDir(String stateDir) {
		this.stateDir = stateDir;
	}

	public List<String> getDefaultSources() {
		return defaultSources;
	}

	public void setDefaultSources(List<String> defaultSources) {
		this.defaultSources = defaultSources;
	}

	public int getDefaultLookbackDays() {
		return defaultLookbackDays;
	}

	public void setDefaultLookbackDays(int defaultLookbackDays) {
		this.defaultLookbackDays = defaultLookbackDays;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	public long getBaseBackoffMillis() {
		return baseBackoffMillis;
	}

	public void setBaseBackoffMillis(long baseBackoffMillis) {
		this.baseBackoffMillis = baseBackoffMillis;
	}

	public double getBackoffMultiplier() {
		return backoffMultiplier;
	}

	public void setBackoffMultiplier(double backoffMultiplier) {
		this.backoffMultiplier = backoffMultiplier;
	}

	public int getMaxBackoffSeconds() {
		return maxBackoffSeconds;
	}

	public void setMaxBackoffSeconds(int maxBackoffSeconds) {
		this.maxBackoffSeconds = maxBackoffSeconds;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public long getDefaultMinIntervalMillis() {
		return defaultMinIntervalMillis;
	}

	public void setDefaultMinIntervalMillis(long defaultMinIntervalMillis) {
		this.defaultMinIntervalMillis = defaultMinIntervalMillis;
	}

	public int getRunDeadlineMinutes() {
		return runDeadlineMinutes;
	}

	public void setRunDeadlineMinutes(int runDeadlineMinutes) {
		this.runDeadlineMinutes = runDeadlineMinutes;
	}

	public long getGdeltCostLimitBytes() {
		return gdeltCostLimitBytes;
	}

	public void setGdeltCostLimitBytes(long gdeltCostLimitBytes) {
		this.gdeltCostLimitBytes = gdeltCostLimitBytes;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/**
	 * Retry policy described by these properties.
	 * @return the policy
	 */
	public RetryPolicy toRetryPolicy() {
		return new RetryPolicy(maxAttempts, Duration.ofMillis(baseBackoffMillis), backoffMultiplier,
				Duration.ofSeconds(maxBackoffSeconds), RetryPolicy.DEFAULT_RETRYABLE_STATUSES, true);
	}

}
