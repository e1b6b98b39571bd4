package org.macroingest.collector;

import java.time.Duration;
import java.util.Set;

/**
 * Retry configuration applied by the {@link ResilienceEngine}.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseBackoff wait after the first retryable failure
 * @param multiplier growth factor of the wait for every further failure
 * @param maxBackoff upper bound for any single wait, including {@code Retry-After}
 * @param retryableStatuses HTTP statuses that are worth retrying
 * @param honorRetryAfter whether a server supplied {@code Retry-After} replaces the
 * computed backoff
 */
public record RetryPolicy(int maxAttempts, Duration baseBackoff, double multiplier, Duration maxBackoff,
		Set<Integer> retryableStatuses, boolean honorRetryAfter) {

	/**
	 * Statuses retried by default: rate limiting and transient server errors.
	 */
	public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
		}
		if (multiplier < 1.0) {
			throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
		}
		if (baseBackoff.isNegative() || maxBackoff.isNegative()) {
			throw new IllegalArgumentException("Backoff durations must not be negative");
		}
		retryableStatuses = Set.copyOf(retryableStatuses);
	}

	/**
	 * Three attempts, 1.5s base backoff doubling up to one minute.
	 * @return the default policy
	 */
	public static RetryPolicy defaults() {
		return new RetryPolicy(3, Duration.ofMillis(1500), 2.0, Duration.ofMinutes(1), DEFAULT_RETRYABLE_STATUSES,
				true);
	}

	/**
	 * Copy of this policy with a different attempt budget.
	 * @param attempts total attempts
	 * @return the new policy
	 */
	public RetryPolicy withMaxAttempts(int attempts) {
		return new RetryPolicy(attempts, baseBackoff, multiplier, maxBackoff, retryableStatuses, honorRetryAfter);
	}

	/**
	 * Copy of this policy with a different base backoff.
	 * @param backoff the base backoff
	 * @return the new policy
	 */
	public RetryPolicy withBaseBackoff(Duration backoff) {
		return new RetryPolicy(maxAttempts, backoff, multiplier, maxBackoff, retryableStatuses, honorRetryAfter);
	}

	/**
	 * Wait after the given failed attempt: {@code base * multiplier^(attempt - 1)},
	 * capped at {@link #maxBackoff()}.
	 * @param attempt the 1-based attempt that just failed
	 * @return the backoff
	 */
	public Duration backoffAfter(int attempt) {
		double millis = baseBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
		if (millis >= maxBackoff.toMillis()) {
			return maxBackoff;
		}
		return Duration.ofMillis((long) millis);
	}

	public boolean isRetryableStatus(int status) {
		return retryableStatuses.contains(status);
	}

}
