package org.macroingest.collector;

/**
 * Category of a {@link CollectionError}.
 */
public enum ErrorType {

	RETRYABLE_NETWORK,

	/**
	 * Every attempt of the retry budget failed with a retryable error.
	 */
	EXHAUSTED_RETRIES,

	TERMINAL_REQUEST,

	COST_EXCEEDED,

	PARSE_ERROR,

	/**
	 * Work was interrupted, typically by the run deadline.
	 */
	CANCELLED

}
