package org.macroingest.collector;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;

/**
 * Pure classification of failures into {@link ErrorKind}s.
 *
 * <p>
 * Retryable: HTTP statuses listed in {@link RetryPolicy#retryableStatuses()}, request
 * and connect timeouts, connection resets and other transport {@link IOException}s.
 * Terminal: every other HTTP status, parse errors, cost overruns and programming errors.
 */
public final class ErrorClassifier {

	private ErrorClassifier() {
	}

	public static ErrorKind classify(Throwable error, RetryPolicy policy) {
		if (error instanceof PayloadParseException || error instanceof CostExceededException
				|| error instanceof JsonProcessingException) {
			return ErrorKind.TERMINAL;
		}
		if (error instanceof SourceRequestException) {
			SourceRequestException sre = (SourceRequestException) error;
			if (sre.hasStatus()) {
				return policy.isRetryableStatus(sre.getStatusCode()) ? ErrorKind.RETRYABLE : ErrorKind.TERMINAL;
			}
		}
		return isTransportFailure(error) ? ErrorKind.RETRYABLE : ErrorKind.TERMINAL;
	}

	/**
	 * Map a terminal failure to the error type recorded for the unit.
	 * @param error the failure
	 * @return the error type
	 */
	public static ErrorType terminalTypeOf(Throwable error) {
		if (error instanceof CostExceededException) {
			return ErrorType.COST_EXCEEDED;
		}
		if (error instanceof PayloadParseException || error instanceof JsonProcessingException) {
			return ErrorType.PARSE_ERROR;
		}
		return ErrorType.TERMINAL_REQUEST;
	}

	/**
	 * Server supplied wait hint, if the failure carries one.
	 * @param error the failure
	 * @return the {@code Retry-After} duration
	 */
	public static Optional<Duration> retryAfterOf(Throwable error) {
		if (error instanceof SourceRequestException) {
			return ((SourceRequestException) error).getRetryAfter();
		}
		return Optional.empty();
	}

	/**
	 * Whether the failure was caused by thread interruption.
	 * @param error the failure
	 * @return true if an {@link InterruptedException} is in the cause chain
	 */
	public static boolean isInterruption(Throwable error) {
		for (Throwable t = error; t != null; t = t.getCause()) {
			if (t instanceof InterruptedException) {
				return true;
			}
			if (t instanceof InterruptedIOException && !(t instanceof SocketTimeoutException)) {
				return true;
			}
			if (t.getCause() == t) {
				break;
			}
		}
		return false;
	}

	private static boolean isTransportFailure(Throwable error) {
		for (Throwable t = error; t != null; t = t.getCause()) {
			if (t instanceof HttpTimeoutException || t instanceof UncheckedIOException) {
				return true;
			}
			if (t instanceof IOException && !(t instanceof JsonProcessingException)) {
				return true;
			}
			if (t.getCause() == t) {
				break;
			}
		}
		return false;
	}

}
