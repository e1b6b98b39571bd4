package org.macroingest.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Refuses metered work whose estimated scan size is above a limit. Cost overruns are never
 * retried.
 */
public final class CostGuard {

	private static final Logger logger = LoggerFactory.getLogger(CostGuard.class);

	static final long GIB = 1024L * 1024L * 1024L;

	/**
	 * Default per-query limit: 5 GiB.
	 */
	public static final long DEFAULT_LIMIT_BYTES = 5 * GIB;

	private CostGuard() {
	}

	/**
	 * Check an estimate against a limit.
	 * @param estimate the dry-run estimate
	 * @param limitBytes maximum bytes allowed
	 * @return success, or failure with {@link ErrorType#COST_EXCEEDED} iff the estimate is
	 * strictly above the limit
	 */
	public static Result<Void> guard(CostEstimate estimate, long limitBytes) {
		if (estimate.bytesProcessed() > limitBytes) {
			String message = describe(estimate, limitBytes);
			logger.warn("Refusing query: {}", message);
			return Result.failure(CollectionError.of(ErrorType.COST_EXCEEDED, message));
		}
		logger.debug("Query estimate {} within limit", String.format(Locale.ROOT, "%.2f GiB", estimate.gibibytes()));
		return Result.success(null);
	}

	/**
	 * Run the operation only when the estimate passes the guard.
	 * @param <T> result type
	 * @param estimate the dry-run estimate
	 * @param limitBytes maximum bytes allowed
	 * @param operation the real query; never invoked when the guard fails
	 * @return the guard failure, or the operation's result
	 */
	public static <T> Result<T> guardAndRun(CostEstimate estimate, long limitBytes, Supplier<Result<T>> operation) {
		Result<Void> verdict = guard(estimate, limitBytes);
		if (verdict.isFailure()) {
			return Result.failure(verdict.errorOrThrow());
		}
		return operation.get();
	}

	/**
	 * Exception flavour of {@link #guard(CostEstimate, long)} for code that signals with
	 * exceptions.
	 * @param estimate the dry-run estimate
	 * @param limitBytes maximum bytes allowed
	 * @throws CostExceededException if the estimate is above the limit
	 */
	public static void enforce(CostEstimate estimate, long limitBytes) {
		if (estimate.bytesProcessed() > limitBytes) {
			throw new CostExceededException(estimate, limitBytes);
		}
	}

	static String describe(CostEstimate estimate, long limitBytes) {
		return String.format(Locale.ROOT, "estimated %.2f GiB exceeds limit of %.2f GiB", estimate.gibibytes(),
				limitBytes / (double) GIB);
	}

}
