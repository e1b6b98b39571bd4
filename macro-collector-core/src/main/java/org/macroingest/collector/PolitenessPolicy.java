package org.macroingest.collector;

import java.time.Duration;

/**
 * Minimum spacing between two consecutive requests to one source.
 *
 * <p>
 * The effective gap is {@code minInterval + jitter}, where jitter is drawn uniformly from
 * {@code [jitterMin, jitterMax]} for every request.
 *
 * @param minInterval minimum interval between permits
 * @param jitterMin lower bound of the random extra delay
 * @param jitterMax upper bound of the random extra delay
 */
public record PolitenessPolicy(Duration minInterval, Duration jitterMin, Duration jitterMax) {

	public PolitenessPolicy {
		if (minInterval.isNegative() || jitterMin.isNegative() || jitterMax.isNegative()) {
			throw new IllegalArgumentException("Politeness durations must not be negative");
		}
		if (jitterMax.compareTo(jitterMin) < 0) {
			throw new IllegalArgumentException(
					"jitterMax (" + jitterMax + ") must not be smaller than jitterMin (" + jitterMin + ")");
		}
	}

	/**
	 * A fixed interval without jitter.
	 * @param minInterval minimum interval between permits
	 * @return the policy
	 */
	public static PolitenessPolicy fixed(Duration minInterval) {
		return new PolitenessPolicy(minInterval, Duration.ZERO, Duration.ZERO);
	}

	/**
	 * No spacing at all.
	 * @return the policy
	 */
	public static PolitenessPolicy none() {
		return fixed(Duration.ZERO);
	}

}
