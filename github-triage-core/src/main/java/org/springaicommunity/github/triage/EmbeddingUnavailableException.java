package org.springaicommunity.github.triage;

/**
 * Thrown when an embedding could not be produced for a piece of text, after retries or
 * because of a timeout. During enrichment this only affects the one record.
 */
public class EmbeddingUnavailableException extends RuntimeException {

	public EmbeddingUnavailableException(String message) {
		super(message);
	}

	public EmbeddingUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

}
