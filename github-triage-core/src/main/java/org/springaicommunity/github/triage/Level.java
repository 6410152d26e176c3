package org.springaicommunity.github.triage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Three-step scale used by recommendation confidence and analysis fields.
 */
public enum Level {

	LOW, MEDIUM, HIGH;

	@JsonValue
	public String id() {
		return name().toLowerCase(Locale.ROOT);
	}

	@JsonCreator
	public static Level fromId(String id) {
		return valueOf(id.trim().toUpperCase(Locale.ROOT));
	}

	/**
	 * Score where a higher level counts more (1..3).
	 */
	public int score() {
		return ordinal() + 1;
	}

	/**
	 * Score where a higher level counts less (3..1), used for complexity and risk.
	 */
	public int invertedScore() {
		return 3 - ordinal();
	}

}
