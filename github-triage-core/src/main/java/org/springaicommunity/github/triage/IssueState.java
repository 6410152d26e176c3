package org.springaicommunity.github.triage;

import java.util.Locale;

/**
 * State of an issue or pull request.
 */
public enum IssueState {

	OPEN, CLOSED, MERGED;

	/**
	 * Parse an upstream state string (case-insensitive).
	 * @param value e.g. "OPEN", "closed"
	 * @return the matching state
	 * @throws IllegalArgumentException if the value is not a known state
	 */
	public static IssueState parse(String value) {
		return valueOf(value.trim().toUpperCase(Locale.ROOT));
	}

	/**
	 * Whether this state matches a status filter. Merged pull requests count as closed.
	 * @param status the filter
	 * @return true if the state passes the filter
	 */
	public boolean matches(IssueState status) {
		if (status == CLOSED) {
			return this == CLOSED || this == MERGED;
		}
		return this == status;
	}

}
