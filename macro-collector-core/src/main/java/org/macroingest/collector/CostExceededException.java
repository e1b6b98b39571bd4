package org.macroingest.collector;

/**
 * Thrown by {@link CostGuard#enforce(CostEstimate, long)} when a query would scan more
 * bytes than allowed.
 */
public class CostExceededException extends RuntimeException {

	private final CostEstimate estimate;

	private final long limitBytes;

	public CostExceededException(CostEstimate estimate, long limitBytes) {
		super(CostGuard.describe(estimate, limitBytes));
		this.estimate = estimate;
		this.limitBytes = limitBytes;
	}

	public CostEstimate getEstimate() {
		return estimate;
	}

	public long getLimitBytes() {
		return limitBytes;
	}

}
