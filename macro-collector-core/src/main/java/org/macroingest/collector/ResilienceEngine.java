package org.macroingest.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes idempotent operations against a source with classification-driven retries.
 *
 * <p>
 * Every attempt first passes through {@link RateGovernor#acquire(String)}. Failures are
 * classified by {@link ErrorClassifier}:
 * <ul>
 * <li>retryable failures wait {@code base * multiplier^(attempt-1)} (or the server's
 * {@code Retry-After}, capped) and try again</li>
 * <li>terminal failures end the operation immediately</li>
 * <li>after {@code maxAttempts} retryable failures the result is
 * {@link ErrorType#EXHAUSTED_RETRIES} carrying the last error</li>
 * </ul>
 * Nothing is thrown across the retry loop: the outcome is always a {@link Result} holding
 * every {@link FetchAttempt}. Interruption, at any suspension point, yields
 * {@link ErrorType#CANCELLED} and leaves the interrupt flag set.
 */
public final class ResilienceEngine {

	private static final Logger logger = LoggerFactory.getLogger(ResilienceEngine.class);

	private final RateGovernor governor;

	private final Sleeper sleeper;

	private final Clock clock;

	public ResilienceEngine(RateGovernor governor, Sleeper sleeper, Clock clock) {
		this.governor = governor;
		this.sleeper = sleeper;
		this.clock = clock;
	}

	public ResilienceEngine(RateGovernor governor) {
		this(governor, Sleeper.SYSTEM, Clock.systemUTC());
	}

	public RateGovernor getGovernor() {
		return governor;
	}

	/**
	 * Run an operation with retries.
	 * @param <T> result type
	 * @param sourceId source the operation talks to, used for politeness
	 * @param description short description used in attempts and log messages
	 * @param operation the idempotent operation (GET or read-only query)
	 * @param policy retry policy
	 * @return success with the value, or failure with the classified error
	 */
	public <T> Result<T> execute(String sourceId, String description, Operation<T> operation, RetryPolicy policy) {
		List<FetchAttempt> attempts = new ArrayList<>();
		Exception lastFailure = null;

		for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
			Instant started;
			try {
				governor.acquire(sourceId);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return Result.failure(CollectionError.of(ErrorType.CANCELLED, description + " was cancelled", e),
						attempts);
			}
			started = clock.instant();

			try {
				T value = operation.call();
				attempts.add(attempt(description, attempt, FetchAttempt.Outcome.SUCCESS, started));
				if (attempt > 1) {
					logger.info("{} succeeded on attempt {}/{}", description, attempt, policy.maxAttempts());
				}
				return Result.success(value, attempts);
			}
			catch (Exception e) {
				if (e instanceof InterruptedException || ErrorClassifier.isInterruption(e)
						|| Thread.currentThread().isInterrupted()) {
					Thread.currentThread().interrupt();
					return Result.failure(CollectionError.of(ErrorType.CANCELLED, description + " was cancelled", e),
							attempts);
				}

				if (ErrorClassifier.classify(e, policy) == ErrorKind.TERMINAL) {
					attempts.add(attempt(description, attempt, FetchAttempt.Outcome.TERMINAL_FAILURE, started));
					logger.warn("{} failed with terminal error: {}", description, e.getMessage());
					return Result.failure(
							CollectionError.of(ErrorClassifier.terminalTypeOf(e), describe(description, e), e), attempts);
				}

				attempts.add(attempt(description, attempt, FetchAttempt.Outcome.RETRYABLE_FAILURE, started));
				lastFailure = e;

				if (attempt < policy.maxAttempts()) {
					Duration wait = computeWait(e, attempt, policy);
					logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt,
							policy.maxAttempts(), e.getMessage(), wait.toMillis());
					try {
						sleeper.sleep(wait);
					}
					catch (InterruptedException ie) {
						Thread.currentThread().interrupt();
						return Result.failure(
								CollectionError.of(ErrorType.CANCELLED, description + " was cancelled", ie), attempts);
					}
				}
			}
		}

		logger.error("{} failed after {} attempts", description, policy.maxAttempts());
		return Result.failure(CollectionError.of(ErrorType.EXHAUSTED_RETRIES,
				describe(description, lastFailure) + " (after " + policy.maxAttempts() + " attempts)", lastFailure),
				attempts);
	}

	private Duration computeWait(Exception failure, int attempt, RetryPolicy policy) {
		if (policy.honorRetryAfter()) {
			Duration hinted = ErrorClassifier.retryAfterOf(failure).orElse(null);
			if (hinted != null && !hinted.isNegative()) {
				if (hinted.compareTo(policy.maxBackoff()) > 0) {
					logger.warn("Retry-After of {}s exceeds cap, waiting {}s instead", hinted.toSeconds(),
							policy.maxBackoff().toSeconds());
					return policy.maxBackoff();
				}
				return hinted;
			}
		}
		return policy.backoffAfter(attempt);
	}

	private FetchAttempt attempt(String description, int number, FetchAttempt.Outcome outcome, Instant started) {
		return new FetchAttempt(description, number, outcome, Duration.between(started, clock.instant()), started);
	}

	private static String describe(String description, Exception failure) {
		return description + " failed: " + failure.getMessage();
	}

	/**
	 * An idempotent operation that may fail with any exception.
	 *
	 * @param <T> result type
	 */
	@FunctionalInterface
	public interface Operation<T> {

		T call() throws Exception;

	}

}
