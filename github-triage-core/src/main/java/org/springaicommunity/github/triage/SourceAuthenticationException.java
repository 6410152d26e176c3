package org.springaicommunity.github.triage;

/**
 * Thrown when the upstream source rejects the configured credentials. Never retried.
 */
public class SourceAuthenticationException extends RuntimeException {

	public SourceAuthenticationException(String message, Throwable cause) {
		super(message, cause);
	}

}
