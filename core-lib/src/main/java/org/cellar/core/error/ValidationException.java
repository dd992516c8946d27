package org.cellar.core.error;

/**
 * Thrown when a query or request refers to something the catalog does not know, or carries an illegal value.
 * Never retried; surfaced to the caller as-is.
 */
public class ValidationException extends IllegalArgumentException {
	public ValidationException(String message) {
		super(message);
	}

	public ValidationException(String message, Throwable cause) {
		super(message, cause);
	}
}
