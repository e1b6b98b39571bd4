package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;

/**
 * Exception thrown when a request to a source fails.
 *
 * <p>
 * Carries the HTTP status when the server answered, and the server's
 * {@code Retry-After} hint when one was sent. Transport failures have status
 * {@code 0} and keep the original {@link java.io.IOException} as cause, which lets
 * {@link ErrorClassifier} tell them apart.
 */
public class SourceRequestException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	@Nullable
	private final Duration retryAfter;

	public SourceRequestException(String message, int statusCode, @Nullable String responseBody,
			@Nullable Duration retryAfter) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.retryAfter = retryAfter;
	}

	public SourceRequestException(String message, int statusCode) {
		this(message, statusCode, null, null);
	}

	public SourceRequestException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = 0;
		this.responseBody = null;
		this.retryAfter = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public Optional<Duration> getRetryAfter() {
		return Optional.ofNullable(retryAfter);
	}

	/**
	 * Whether the server answered at all.
	 * @return true if a status code is available
	 */
	public boolean hasStatus() {
		return statusCode > 0;
	}

}
