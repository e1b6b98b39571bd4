package org.macroingest.collector;

/**
 * Thrown when a payload cannot be parsed into records. Never retried.
 */
public class PayloadParseException extends RuntimeException {

	public PayloadParseException(String message) {
		super(message);
	}

	public PayloadParseException(String message, Throwable cause) {
		super(message, cause);
	}

}
