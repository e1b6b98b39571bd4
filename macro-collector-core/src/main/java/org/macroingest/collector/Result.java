package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.function.Function;

/**
 * Explicit success or failure returned by the {@link ResilienceEngine} and the
 * {@link CostGuard}. Exactly one of {@code value} and {@code error} is set, except for a
 * successful {@code Result<Void>} where both are {@code null}.
 *
 * @param <T> type of the success value
 * @param value the value on success
 * @param error the error on failure
 * @param attempts every attempt made to produce this result
 */
public record Result<T>(@Nullable T value, @Nullable CollectionError error, List<FetchAttempt> attempts) {

	public Result {
		attempts = List.copyOf(attempts);
	}

	public static <T> Result<T> success(@Nullable T value) {
		return new Result<>(value, null, List.of());
	}

	public static <T> Result<T> success(@Nullable T value, List<FetchAttempt> attempts) {
		return new Result<>(value, null, attempts);
	}

	public static <T> Result<T> failure(CollectionError error) {
		return new Result<>(null, error, List.of());
	}

	public static <T> Result<T> failure(CollectionError error, List<FetchAttempt> attempts) {
		return new Result<>(null, error, attempts);
	}

	public boolean isSuccess() {
		return error == null;
	}

	public boolean isFailure() {
		return error != null;
	}

	/**
	 * Returns the success value.
	 * @return the value
	 * @throws IllegalStateException if this result is a failure
	 */
	public T getOrThrow() {
		if (error != null) {
			throw new IllegalStateException("Result is a failure: " + error, error.cause());
		}
		return value;
	}

	/**
	 * Returns the error of a failed result.
	 * @return the error
	 * @throws IllegalStateException if this result is a success
	 */
	public CollectionError errorOrThrow() {
		if (error == null) {
			throw new IllegalStateException("Result is a success");
		}
		return error;
	}

	/**
	 * Transform the success value, keeping failures and attempts as they are.
	 * @param <R> new value type
	 * @param mapper function applied to the success value
	 * @return the mapped result
	 */
	public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
		if (error != null) {
			return new Result<>(null, error, attempts);
		}
		return new Result<>(mapper.apply(value), null, attempts);
	}

}
