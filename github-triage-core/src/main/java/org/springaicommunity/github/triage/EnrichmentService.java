package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings the derived fields of a collection up to date.
 *
 * <p>
 * A pass embeds the records in scope (the changed hint plus every record whose embedding
 * is missing or no longer matches its text), rebuilds the similarity index, and then
 * recomputes metrics and quartiles for the whole collection. Without an
 * {@link EmbeddingEngine} nothing is embedded: embeddings that still match their record's
 * text are kept and the others are dropped, so the index never holds a stale vector.
 */
public class EnrichmentService {

	private static final Logger logger = LoggerFactory.getLogger(EnrichmentService.class);

	private final CollectionStore store;

	private final @Nullable EmbeddingEngine embeddingEngine;

	private final MetricEngine metricEngine;

	private final QuartileEngine quartileEngine;

	private final Clock clock;

	private final int knnNeighbors;

	public EnrichmentService(CollectionStore store, @Nullable EmbeddingEngine embeddingEngine,
			MetricEngine metricEngine, QuartileEngine quartileEngine, Clock clock, int knnNeighbors) {
		if (knnNeighbors <= 0) {
			throw new IllegalArgumentException("knnNeighbors must be positive, got: " + knnNeighbors);
		}
		this.store = store;
		this.embeddingEngine = embeddingEngine;
		this.metricEngine = metricEngine;
		this.quartileEngine = quartileEngine;
		this.clock = clock;
		this.knnNeighbors = knnNeighbors;
	}

	/**
	 * Enrich a collection.
	 * @param key the collection
	 * @param changedHint numbers whose text changed since the last pass, typically
	 * {@link PullResult#contentChanged()}
	 * @return counters of the pass
	 */
	public EnrichmentResult enrich(CollectionKey key, Set<Integer> changedHint) {
		try (CollectionLock lock = store.lock(key)) {
			IssueCollection collection = store.load(key);
			if (collection.size() == 0) {
				logger.info("Collection {} is empty, nothing to enrich", key);
				return new EnrichmentResult(key, 0, 0, 0, 0, 0, 0, false);
			}

			Map<Integer, IssueRecord> records = collection.byNumber();
			EmbeddingEngine.Result embedded = embed(records, changedHint);

			SimilarityIndex index = SimilarityIndex.build(records.values());
			Instant now = clock.instant();
			List<IssueRecord> ordered = new ArrayList<>(records.values());
			List<MetricBundle> bundles = new ArrayList<>(ordered.size());
			for (IssueRecord record : ordered) {
				bundles.add(metricEngine.compute(record, now, index.knnDistance(record.number(), knnNeighbors)));
			}
			List<Map<String, Quartile>> quartiles = quartileEngine.assignAll(bundles);
			List<IssueRecord> enriched = new ArrayList<>(ordered.size());
			for (int i = 0; i < ordered.size(); i++) {
				enriched.add(ordered.get(i).withMetrics(bundles.get(i), quartiles.get(i)));
			}

			IssueCollection updated = collection.withRecords(enriched);
			boolean written = !updated.equals(collection);
			if (written) {
				store.save(updated);
			}
			EnrichmentResult result = new EnrichmentResult(key, enriched.size(), embedded.records().size(),
					embedded.cacheHits(), embedded.computed(), embedded.failed(), index.size(), written);
			logger.info("Enriched {}: {} records, {} embedded ({} cached, {} failed), {} indexed", key,
					result.records(), result.computed(), result.cacheHits(), result.failed(), result.indexed());
			return result;
		}
	}

	private EmbeddingEngine.Result embed(Map<Integer, IssueRecord> records, Set<Integer> changedHint) {
		EmbeddingEngine engine = this.embeddingEngine;
		if (engine == null) {
			List<IssueRecord> stale = records.values()
				.stream()
				.filter(r -> r.hasEmbedding() && !EmbeddingText.isCurrent(r))
				.map(IssueRecord::withoutEmbedding)
				.toList();
			stale.forEach(r -> records.put(r.number(), r));
			logger.warn("No embedding provider configured, keeping current embeddings and dropping {} stale ones",
					stale.size());
			return new EmbeddingEngine.Result(stale, 0, 0, stale.size(), 0);
		}
		List<IssueRecord> scope = records.values()
			.stream()
			.filter(r -> changedHint.contains(r.number()) || engine.isStale(r))
			.toList();
		if (scope.isEmpty()) {
			return new EmbeddingEngine.Result(List.of(), 0, 0, 0, 0);
		}
		EmbeddingEngine.Result result = engine.embed(scope);
		result.records().forEach(r -> records.put(r.number(), r));
		return result;
	}

}
