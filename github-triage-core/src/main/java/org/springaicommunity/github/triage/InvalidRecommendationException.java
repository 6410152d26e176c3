package org.springaicommunity.github.triage;

import java.util.List;

/**
 * Thrown when a recommendation request fails validation. Carries every validation error,
 * not just the first.
 */
public class InvalidRecommendationException extends RuntimeException {

	private final List<String> errors;

	public InvalidRecommendationException(List<String> errors) {
		super("Validation failed: " + String.join("; ", errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

}
