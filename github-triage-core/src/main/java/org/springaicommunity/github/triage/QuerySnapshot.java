package org.springaicommunity.github.triage;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable state the query service answers from: the records of one collection and the
 * structures derived from them. Replaced as a whole on refresh.
 *
 * @param key the collection key
 * @param records records by number, ascending
 * @param index similarity index over the embedded records
 * @param graph cross-reference graph
 * @param builtAt when the snapshot was built
 */
public record QuerySnapshot(CollectionKey key, Map<Integer, IssueRecord> records, SimilarityIndex index,
		CrossReferenceGraph graph, Instant builtAt) {

	public static QuerySnapshot of(IssueCollection collection, Instant builtAt) {
		return new QuerySnapshot(collection.key(), collection.byNumber(), SimilarityIndex.build(collection.records()),
				CrossReferenceGraph.build(collection.records()), builtAt);
	}

	public QuerySnapshot {
		records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
	}

}
