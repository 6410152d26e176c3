package org.springaicommunity.github.triage;

/**
 * Thrown when a collection cannot be read, written or locked.
 */
public class CollectionStoreException extends RuntimeException {

	public CollectionStoreException(String message) {
		super(message);
	}

	public CollectionStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}
