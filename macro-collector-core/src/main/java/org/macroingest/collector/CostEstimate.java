package org.macroingest.collector;

/**
 * Bytes a metered query would process, as reported by a dry run.
 *
 * @param bytesProcessed estimated bytes scanned
 */
public record CostEstimate(long bytesProcessed) {

	public CostEstimate {
		if (bytesProcessed < 0) {
			throw new IllegalArgumentException("bytesProcessed must not be negative");
		}
	}

	public double gibibytes() {
		return bytesProcessed / (double) CostGuard.GIB;
	}

}
