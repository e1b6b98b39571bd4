package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

/**
 * Failure of a unit of work, carried as a value instead of an exception.
 *
 * @param type category of the failure
 * @param message human readable description
 * @param cause underlying exception, if any
 */
public record CollectionError(ErrorType type, String message, @Nullable Throwable cause) {

	public static CollectionError of(ErrorType type, String message) {
		return new CollectionError(type, message, null);
	}

	public static CollectionError of(ErrorType type, String message, @Nullable Throwable cause) {
		return new CollectionError(type, message, cause);
	}

	public static CollectionError cancelled(String what) {
		return new CollectionError(ErrorType.CANCELLED, what + " was cancelled", null);
	}

	@Override
	public String toString() {
		return type + ": " + message;
	}

}
