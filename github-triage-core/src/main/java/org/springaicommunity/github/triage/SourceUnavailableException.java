package org.springaicommunity.github.triage;

/**
 * Thrown when the upstream source could not deliver a fetch window after all retries.
 * The window's checkpoint does not advance and the run aborts.
 */
public class SourceUnavailableException extends RuntimeException {

	public SourceUnavailableException(String message) {
		super(message);
	}

	public SourceUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

}
