package org.springaicommunity.github.triage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of tracked items. Each item type keeps its own {@link FetchCheckpoint} inside a
 * collection.
 */
public enum ItemType {

	ISSUE("issues", "is:issue"),

	PULL_REQUEST("prs", "is:pr");

	private final String id;

	private final String searchQualifier;

	ItemType(String id, String searchQualifier) {
		this.id = id;
		this.searchQualifier = searchQualifier;
	}

	/**
	 * Returns the short identifier used in files and on the command line.
	 * @return "issues" or "prs"
	 */
	@JsonValue
	public String id() {
		return id;
	}

	/**
	 * Returns the GitHub search qualifier selecting this item type.
	 * @return e.g. "is:issue"
	 */
	public String searchQualifier() {
		return searchQualifier;
	}

	@JsonCreator
	public static ItemType fromId(String id) {
		return Arrays.stream(values())
			.filter(t -> t.id.equalsIgnoreCase(id) || t.name().equalsIgnoreCase(id))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Unknown item type: " + id));
	}

}
