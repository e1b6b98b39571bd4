package org.macroingest.collector;

import java.time.Duration;
import java.time.Instant;

/**
 * One network call made on behalf of a unit.
 *
 * @param unitKey key of the unit (or description of the operation)
 * @param attemptNumber 1-based attempt number
 * @param outcome how the attempt ended
 * @param latency time spent in the call, excluding politeness waits
 * @param timestamp when the call started
 */
public record FetchAttempt(String unitKey, int attemptNumber, Outcome outcome, Duration latency, Instant timestamp) {

	public enum Outcome {

		SUCCESS, RETRYABLE_FAILURE, TERMINAL_FAILURE

	}

}
