package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary counts of a collection.
 *
 * @param key the collection
 * @param issues number of issues
 * @param pullRequests number of pull requests
 * @param open records in the open state
 * @param closed records in the closed state
 * @param merged records in the merged state
 * @param withEmbedding records carrying an embedding
 * @param withMetrics records carrying metrics
 * @param withRecommendation records with at least one recommendation
 * @param recommendations latest recommendation per record, counted by kind
 * @param latestUpdate most recent upstream update, null for an empty collection
 * @param checkpoints the fetch checkpoints
 */
public record CollectionStats(CollectionKey key, int issues, int pullRequests, int open, int closed, int merged,
		int withEmbedding, int withMetrics, int withRecommendation, Map<String, Integer> recommendations,
		@Nullable Instant latestUpdate, List<FetchCheckpoint> checkpoints) {

	public CollectionStats {
		recommendations = Collections.unmodifiableMap(new TreeMap<>(recommendations));
		checkpoints = List.copyOf(checkpoints);
	}

	public static CollectionStats of(IssueCollection collection) {
		int issues = 0;
		int pullRequests = 0;
		int open = 0;
		int closed = 0;
		int merged = 0;
		int withEmbedding = 0;
		int withMetrics = 0;
		int withRecommendation = 0;
		Map<String, Integer> recommendations = new TreeMap<>();
		Instant latestUpdate = null;

		for (IssueRecord record : collection.records()) {
			if (record.type() == ItemType.ISSUE) {
				issues++;
			}
			else {
				pullRequests++;
			}
			switch (record.state()) {
				case OPEN -> open++;
				case CLOSED -> closed++;
				case MERGED -> merged++;
			}
			if (record.hasEmbedding()) {
				withEmbedding++;
			}
			if (record.metrics() != null) {
				withMetrics++;
			}
			if (!record.recommendations().isEmpty()) {
				withRecommendation++;
				Recommendation latest = record.recommendations().get(record.recommendations().size() - 1);
				recommendations.merge(latest.recommendation().id(), 1, Integer::sum);
			}
			if (latestUpdate == null || record.updatedAt().isAfter(latestUpdate)) {
				latestUpdate = record.updatedAt();
			}
		}
		return new CollectionStats(collection.key(), issues, pullRequests, open, closed, merged, withEmbedding,
				withMetrics, withRecommendation, recommendations, latestUpdate, collection.checkpoints());
	}

	public int total() {
		return issues + pullRequests;
	}

}
