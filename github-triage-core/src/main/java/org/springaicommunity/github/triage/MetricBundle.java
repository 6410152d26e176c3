package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

/**
 * Derived numeric fields of a single record, recomputed on every enrichment pass.
 *
 * @param commentCount number of comments
 * @param positiveReactions positive reactions on the body and all comments
 * @param negativeReactions negative reactions on the body and all comments
 * @param bodyReactions reactions of any kind on the issue body
 * @param commentReactions reactions of any kind on comments
 * @param totalReactions body + comment reactions
 * @param engagements comments + total reactions
 * @param ageDays whole days between creation and last update
 * @param daysSinceUpdate whole days between last update and the enrichment time
 * @param engagementsPerDay engagements divided by age (0 when age is 0)
 * @param activityScore recency and engagement combined, higher is more active
 * @param knnDistance mean cosine distance to the nearest embedded neighbours, null when
 * the record has no embedding or the index is too small
 */
public record MetricBundle(int commentCount, int positiveReactions, int negativeReactions, int bodyReactions,
		int commentReactions, int totalReactions, int engagements, long ageDays, long daysSinceUpdate,
		double engagementsPerDay, double activityScore, @Nullable Double knnDistance) {
}
