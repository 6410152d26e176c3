package org.springaicommunity.github.triage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Triage action recommended for an issue.
 */
public enum RecommendationKind {

	CLOSE_COMPLETED, CLOSE_MERGE, CLOSE_NOT_PLANNED, CLOSE_INVALID, ALMOST_DONE, PRIORITY_HIGH, PRIORITY_MEDIUM,
	PRIORITY_LOW, NEEDS_MORE_INFO;

	@JsonValue
	public String id() {
		return name().toLowerCase(Locale.ROOT);
	}

	@JsonCreator
	public static RecommendationKind fromId(String id) {
		return valueOf(id.trim().toUpperCase(Locale.ROOT));
	}

}
