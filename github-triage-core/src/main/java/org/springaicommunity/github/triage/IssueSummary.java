package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

/**
 * Compact view of a record returned by queries.
 */
public record IssueSummary(int number, ItemType type, String title, IssueState state, String url,
		@Nullable String summary) {

	public static IssueSummary of(IssueRecord record) {
		return new IssueSummary(record.number(), record.type(), record.title(), record.state(), record.url(),
				record.summary());
	}

}
