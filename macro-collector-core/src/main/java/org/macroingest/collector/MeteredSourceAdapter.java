package org.macroingest.collector;

/**
 * A source whose queries are billed by bytes scanned. The orchestrator asks for a dry-run
 * estimate before every fetch and refuses units above {@link #costLimitBytes()}.
 */
public interface MeteredSourceAdapter extends SourceAdapter {

	/**
	 * Dry-run estimate for a unit. Read-only, executed through the
	 * {@link ResilienceEngine}.
	 * @param unit the unit
	 * @return bytes the real query would process
	 */
	CostEstimate estimateCost(CollectionUnit unit);

	default long costLimitBytes() {
		return CostGuard.DEFAULT_LIMIT_BYTES;
	}

}
