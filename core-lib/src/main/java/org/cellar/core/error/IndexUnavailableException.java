package org.cellar.core.error;

import java.io.IOException;

/**
 * Thrown when the mirror search engine cannot be reached or fails to serve a request.
 */
public class IndexUnavailableException extends IOException {
	public IndexUnavailableException(String message) {
		super(message);
	}

	public IndexUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
