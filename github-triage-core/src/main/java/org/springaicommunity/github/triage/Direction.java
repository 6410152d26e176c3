package org.springaicommunity.github.triage;

/**
 * Sort direction of a ranking.
 */
public enum Direction {

	ASCENDING, DESCENDING;

	public static Direction of(boolean descending) {
		return descending ? DESCENDING : ASCENDING;
	}

}
