package org.macroingest.collector;

/**
 * Outcome of classifying a failure.
 */
public enum ErrorKind {

	/**
	 * Transient failure, the same request may succeed later.
	 */
	RETRYABLE,

	/**
	 * Permanent failure, repeating the request cannot help.
	 */
	TERMINAL

}
