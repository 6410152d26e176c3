package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One tracked GitHub issue or pull request, with its locally derived enrichment.
 *
 * <p>
 * Source fields (everything up to {@code references}) are owned by the upstream API and
 * replaced wholesale when a newer version is merged. Derived fields (embedding, metrics,
 * quartiles, summary, recommendations) are owned by this system and survive merges until
 * the next enrichment pass recomputes them.
 *
 * @param number the unique issue number within the repository (immutable key)
 * @param type issue or pull request
 * @param title the title
 * @param body the body/description (may be null if not provided)
 * @param state open, closed or merged
 * @param url the HTML URL
 * @param author the user who opened the item
 * @param labels labels assigned to the item
 * @param assignees logins of the assignees
 * @param createdAt when the item was created
 * @param updatedAt when the item was last updated upstream
 * @param reactions reactions on the body
 * @param comments comments in conversation order
 * @param references issue numbers mentioned in the body or comments, sorted ascending
 * @param embedding semantic vector of title, body and comments, null until enriched
 * @param embeddingKey content address of the text the embedding was computed from
 * @param metrics derived metrics, null until enriched
 * @param quartiles quartile label per metric name
 * @param summary AI-generated summary, if any
 * @param recommendations triage recommendations, oldest first
 */
public record IssueRecord(int number, ItemType type, String title, @Nullable String body, IssueState state,
		String url, Author author, List<Label> labels, List<String> assignees, Instant createdAt, Instant updatedAt,
		Reactions reactions, List<Comment> comments, List<Integer> references, @Nullable List<Double> embedding,
		@Nullable String embeddingKey, @Nullable MetricBundle metrics, Map<String, Quartile> quartiles,
		@Nullable String summary, List<Recommendation> recommendations) {

	public IssueRecord {
		if (number <= 0) {
			throw new IllegalArgumentException("Issue number must be positive, got: " + number);
		}
		Objects.requireNonNull(title, "title");
		Objects.requireNonNull(createdAt, "createdAt");
		Objects.requireNonNull(updatedAt, "updatedAt");
		type = type == null ? ItemType.ISSUE : type;
		state = state == null ? IssueState.OPEN : state;
		url = url == null ? "" : url;
		author = author == null ? Author.GHOST : author;
		reactions = reactions == null ? Reactions.NONE : reactions;
		labels = labels == null ? List.of() : List.copyOf(labels);
		assignees = assignees == null ? List.of() : List.copyOf(assignees);
		comments = comments == null ? List.of() : List.copyOf(comments);
		references = references == null ? List.of() : references.stream().distinct().sorted().toList();
		embedding = embedding == null ? null : List.copyOf(embedding);
		quartiles = quartiles == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(quartiles));
		recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
	}

	/**
	 * Create a record carrying only source fields.
	 */
	public static IssueRecord fromSource(int number, ItemType type, String title, @Nullable String body,
			IssueState state, String url, Author author, List<Label> labels, List<String> assignees,
			Instant createdAt, Instant updatedAt, Reactions reactions, List<Comment> comments,
			List<Integer> references) {
		return new IssueRecord(number, type, title, body, state, url, author, labels, assignees, createdAt, updatedAt,
				reactions, comments, references, null, null, null, Map.of(), null, List.of());
	}

	public boolean hasEmbedding() {
		return embedding != null && !embedding.isEmpty();
	}

	/**
	 * Whether the text that drives the embedding (title, body, comment bodies) differs
	 * between this record and {@code other}. State, label, assignee and reaction changes
	 * do not count.
	 * @param other the record to compare with
	 * @return true if the textual content differs
	 */
	public boolean contentDiffers(IssueRecord other) {
		if (!title.equals(other.title) || !Objects.equals(nullToEmpty(body), nullToEmpty(other.body))) {
			return true;
		}
		if (comments.size() != other.comments.size()) {
			return true;
		}
		for (int i = 0; i < comments.size(); i++) {
			if (!comments.get(i).body().equals(other.comments.get(i).body())) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Take the source fields of {@code incoming} while keeping the derived fields of this
	 * record.
	 * @param incoming a newer upstream version of the same issue
	 * @return merged record
	 */
	public IssueRecord withSourceFieldsOf(IssueRecord incoming) {
		if (incoming.number != number) {
			throw new IllegalArgumentException("Cannot merge #" + incoming.number + " into #" + number);
		}
		return new IssueRecord(number, incoming.type, incoming.title, incoming.body, incoming.state, incoming.url,
				incoming.author, incoming.labels, incoming.assignees, incoming.createdAt, incoming.updatedAt,
				incoming.reactions, incoming.comments, incoming.references, embedding, embeddingKey, metrics,
				quartiles, summary, recommendations);
	}

	public IssueRecord withEmbedding(List<Double> vector, String key) {
		return new IssueRecord(number, type, title, body, state, url, author, labels, assignees, createdAt, updatedAt,
				reactions, comments, references, vector, key, metrics, quartiles, summary, recommendations);
	}

	public IssueRecord withoutEmbedding() {
		return new IssueRecord(number, type, title, body, state, url, author, labels, assignees, createdAt, updatedAt,
				reactions, comments, references, null, null, metrics, quartiles, summary, recommendations);
	}

	public IssueRecord withMetrics(MetricBundle bundle, Map<String, Quartile> quartileLabels) {
		return new IssueRecord(number, type, title, body, state, url, author, labels, assignees, createdAt, updatedAt,
				reactions, comments, references, embedding, embeddingKey, bundle, quartileLabels, summary,
				recommendations);
	}

	public IssueRecord withRecommendation(Recommendation recommendation) {
		List<Recommendation> updated = new ArrayList<>(recommendations);
		updated.add(recommendation);
		return new IssueRecord(number, type, title, body, state, url, author, labels, assignees, createdAt, updatedAt,
				reactions, comments, references, embedding, embeddingKey, metrics, quartiles, summary, updated);
	}

	/**
	 * Reactions on the body plus reactions on every comment.
	 */
	public Reactions allReactions() {
		Reactions total = reactions;
		for (Comment comment : comments) {
			total = total.plus(comment.reactions());
		}
		return total;
	}

	private static String nullToEmpty(@Nullable String value) {
		return value == null ? "" : value;
	}

}
