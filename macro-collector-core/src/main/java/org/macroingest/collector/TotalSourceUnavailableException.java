package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

/**
 * Run-level failure: the source failed its health check, or every enumerated unit
 * failed. This is the only failure that escapes {@link CollectionOrchestrator}.
 */
public class TotalSourceUnavailableException extends RuntimeException {

	private final String sourceId;

	@Nullable
	private final RunReport report;

	public TotalSourceUnavailableException(String sourceId, String message) {
		this(sourceId, message, null);
	}

	public TotalSourceUnavailableException(String sourceId, String message, @Nullable RunReport report) {
		super(message);
		this.sourceId = sourceId;
		this.report = report;
	}

	public String getSourceId() {
		return sourceId;
	}

	/**
	 * Returns the report of the failed run.
	 * @return the report, or {@code null} when the run never started (failed health
	 * check)
	 */
	@Nullable
	public RunReport getReport() {
		return report;
	}

}
