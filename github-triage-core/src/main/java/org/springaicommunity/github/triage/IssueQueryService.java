package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntPredicate;
import java.util.function.Supplier;

/**
 * Read façade over one collection for the serving layer.
 *
 * <p>
 * Queries run against an immutable {@link QuerySnapshot}. {@link #refresh()} loads the
 * collection, builds a new snapshot and swaps it in; queries running at that moment
 * finish on the old one. The only write is {@link #addRecommendation}, which goes
 * through {@link CollectionStore#upsert} under the collection lock and then refreshes.
 */
public class IssueQueryService {

	private static final Logger logger = LoggerFactory.getLogger(IssueQueryService.class);

	private final CollectionStore store;

	private final CollectionKey key;

	private final @Nullable EmbeddingEngine embeddingEngine;

	private final Clock clock;

	private final Supplier<String> reviewIds;

	private final AtomicReference<QuerySnapshot> snapshot = new AtomicReference<>();

	public IssueQueryService(CollectionStore store, CollectionKey key, @Nullable EmbeddingEngine embeddingEngine) {
		this(store, key, embeddingEngine, Clock.systemUTC(), () -> UUID.randomUUID().toString());
	}

	IssueQueryService(CollectionStore store, CollectionKey key, @Nullable EmbeddingEngine embeddingEngine,
			Clock clock, Supplier<String> reviewIds) {
		this.store = store;
		this.key = key;
		this.embeddingEngine = embeddingEngine;
		this.clock = clock;
		this.reviewIds = reviewIds;
	}

	/**
	 * Reload the collection and publish a new snapshot.
	 * @return the new snapshot
	 */
	public QuerySnapshot refresh() {
		QuerySnapshot fresh = QuerySnapshot.of(store.load(key), clock.instant());
		snapshot.set(fresh);
		logger.debug("Query snapshot for {}: {} records, {} embedded, {} cross-reference links", key,
				fresh.records().size(), fresh.index().size(), fresh.graph().edgeCount());
		return fresh;
	}

	/**
	 * The current snapshot, loading it on first use.
	 */
	public QuerySnapshot snapshot() {
		QuerySnapshot current = snapshot.get();
		return current != null ? current : refresh();
	}

	/**
	 * Look up one issue.
	 * @param number the issue number
	 * @param status optional state filter; closed also matches merged
	 * @return the issue, or empty if absent or filtered out
	 */
	public Optional<IssueRecord> getIssue(int number, @Nullable IssueState status) {
		IssueRecord record = snapshot().records().get(number);
		if (record == null || (status != null && !record.state().matches(status))) {
			return Optional.empty();
		}
		return Optional.of(record);
	}

	public List<SimilarIssue> findSimilarIssues(int number, int k) {
		return findSimilarIssues(number, k, -1.0, null);
	}

	/**
	 * Nearest neighbours of an issue by embedding.
	 * @param number the issue number
	 * @param k maximum number of results
	 * @param minSimilarity hits below this cosine similarity are dropped
	 * @param status optional state filter
	 * @throws IssueNotFoundException if the issue is unknown or has no embedding
	 */
	public List<SimilarIssue> findSimilarIssues(int number, int k, double minSimilarity,
			@Nullable IssueState status) {
		QuerySnapshot current = snapshot();
		if (!current.records().containsKey(number)) {
			throw IssueNotFoundException.missing(number);
		}
		return toSimilarIssues(current,
				current.index().findSimilar(number, k, statusFilter(current, status)), minSimilarity);
	}

	public List<SimilarIssue> findSimilarIssuesByText(String text, int k) {
		return findSimilarIssuesByText(text, k, -1.0, null);
	}

	/**
	 * Nearest neighbours of free text. The text is embedded through the embedding cache, so
	 * repeating a query does not call the provider again.
	 * @throws EmbeddingUnavailableException if no provider is configured or it fails
	 */
	public List<SimilarIssue> findSimilarIssuesByText(String text, int k, double minSimilarity,
			@Nullable IssueState status) {
		if (embeddingEngine == null) {
			throw new EmbeddingUnavailableException("No embedding provider configured (set MISTRAL_API_KEY)");
		}
		Optional<List<Double>> embedded = embeddingEngine.embedText(text);
		if (embedded.isEmpty()) {
			return List.of();
		}
		List<Double> vector = embedded.get();
		QuerySnapshot current = snapshot();
		return toSimilarIssues(current, current.index().search(vector, k, statusFilter(current, status)),
				minSimilarity);
	}

	/**
	 * Issues that reference, or are referenced by, an issue and are in the collection.
	 * @throws IssueNotFoundException if the issue is unknown
	 */
	public List<IssueSummary> findCrossReferencedIssues(int number, @Nullable IssueState status) {
		QuerySnapshot current = snapshot();
		if (!current.records().containsKey(number)) {
			throw IssueNotFoundException.missing(number);
		}
		List<IssueSummary> result = new ArrayList<>();
		for (int linked : current.graph().linkedTo(number)) {
			IssueRecord record = current.records().get(linked);
			if (record != null && (status == null || record.state().matches(status))) {
				result.add(IssueSummary.of(record));
			}
		}
		return result;
	}

	/**
	 * @throws IssueNotFoundException if the issue is unknown
	 */
	public IssueMetrics getIssueMetrics(int number) {
		IssueRecord record = snapshot().records().get(number);
		if (record == null) {
			throw IssueNotFoundException.missing(number);
		}
		return new IssueMetrics(number, record.metrics(), record.quartiles());
	}

	/**
	 * The {@code n} issues ranking highest (or lowest) by a metric. Issues without a value
	 * for the metric are left out; ties go to the lower issue number.
	 * @param metricName one of {@link #availableMetrics()}
	 * @throws InvalidMetricException if the metric name is unknown
	 */
	public List<RankedIssue> getTopIssues(String metricName, int n, Direction direction) {
		Metric metric = Metric.fromName(metricName);
		Comparator<RankedIssue> byValue = Comparator.comparingDouble(RankedIssue::value);
		if (direction == Direction.DESCENDING) {
			byValue = byValue.reversed();
		}
		return snapshot().records()
			.values()
			.stream()
			.filter(r -> r.metrics() != null && metric.valueOf(r.metrics()) != null)
			.map(r -> new RankedIssue(IssueSummary.of(r), metric.metricName(), metric.valueOf(r.metrics())))
			.sorted(byValue.thenComparingInt(r -> r.issue().number()))
			.limit(Math.max(n, 0))
			.toList();
	}

	public List<String> availableMetrics() {
		return Metric.names();
	}

	/**
	 * Validate and attach a recommendation to an issue, persisting only that record.
	 * @return the stored recommendation
	 * @throws InvalidRecommendationException if the request is invalid
	 * @throws IssueNotFoundException if the issue is unknown
	 */
	public Recommendation addRecommendation(int number, RecommendationRequest request) {
		Recommendation recommendation = request.toRecommendation(clock.instant(), reviewIds.get());
		try (CollectionLock lock = store.lock(key)) {
			IssueRecord record = store.load(key).find(number).orElseThrow(() -> IssueNotFoundException.missing(number));
			IssueRecord annotated = record.withRecommendation(recommendation);
			store.upsert(key, annotated);
			logger.info("Added recommendation {} ({}) to #{} in {}, priority score {}",
					recommendation.recommendation().id(), recommendation.meta().reviewId(), number, key,
					recommendation.priorityScore());
		}
		refresh();
		return recommendation;
	}

	/**
	 * The lowest-numbered issue without any recommendation.
	 * @param status optional state filter
	 */
	public Optional<IssueRecord> firstIssueWithoutRecommendation(@Nullable IssueState status) {
		return snapshot().records()
			.values()
			.stream()
			.filter(r -> status == null || r.state().matches(status))
			.filter(r -> r.recommendations().isEmpty())
			.findFirst();
	}

	/**
	 * The most reacted-to issue whose latest recommendation has the given difficulty.
	 * @param difficulty "easy", "medium" or "hard"
	 * @throws IllegalArgumentException for any other difficulty
	 */
	public Optional<IssueRecord> issueByDifficulty(String difficulty) {
		if (!Set.of("easy", "medium", "hard").contains(difficulty)) {
			throw new IllegalArgumentException("difficulty must be one of: easy, medium, hard");
		}
		return snapshot().records()
			.values()
			.stream()
			.filter(r -> !r.recommendations().isEmpty())
			.filter(r -> difficulty
				.equals(r.recommendations().get(r.recommendations().size() - 1).analysis().difficulty()))
			.max(Comparator.comparingInt((IssueRecord r) -> r.allReactions().total())
				.thenComparing(IssueRecord::number, Comparator.reverseOrder()));
	}

	private static IntPredicate statusFilter(QuerySnapshot snapshot, @Nullable IssueState status) {
		if (status == null) {
			return n -> true;
		}
		return n -> {
			IssueRecord record = snapshot.records().get(n);
			return record != null && record.state().matches(status);
		};
	}

	private static List<SimilarIssue> toSimilarIssues(QuerySnapshot snapshot, List<SimilarityIndex.Neighbor> hits,
			double minSimilarity) {
		List<SimilarIssue> result = new ArrayList<>();
		for (SimilarityIndex.Neighbor hit : hits) {
			IssueRecord record = snapshot.records().get(hit.number());
			if (record != null && hit.similarity() >= minSimilarity) {
				result.add(new SimilarIssue(IssueSummary.of(record), hit.similarity()));
			}
		}
		return result;
	}

}
