package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Unvalidated recommendation as submitted by a reviewer (human or model). Enumerated
 * fields arrive as their lowercase ids, e.g. {@code "priority_high"} or {@code "low"}.
 *
 * @param recommendation recommended action id
 * @param confidence confidence level id
 * @param summary one-line summary, required
 * @param rationale short explanation, required
 * @param report full markdown report, required
 * @param severity severity level id
 * @param frequency frequency level id
 * @param prevalence prevalence level id
 * @param solutionComplexity complexity level id
 * @param solutionRisk risk level id
 * @param affectedPackages affected packages, may be null
 * @param affectedPaths affected paths, may be null
 * @param affectedComponents affected components, may be null
 * @param mergeWith issue numbers to merge with, may be null
 * @param relevantIssues related issues, may be null
 * @param reviewer reviewer name, defaults to "ai"
 * @param modelVersion model that produced the recommendation, if any
 */
public record RecommendationRequest(@Nullable String recommendation, @Nullable String confidence,
		@Nullable String summary, @Nullable String rationale, @Nullable String report, @Nullable String severity,
		@Nullable String frequency, @Nullable String prevalence, @Nullable String solutionComplexity,
		@Nullable String solutionRisk, @Nullable List<String> affectedPackages, @Nullable List<String> affectedPaths,
		@Nullable List<String> affectedComponents, @Nullable List<Integer> mergeWith,
		@Nullable List<Recommendation.RelevantIssue> relevantIssues, @Nullable String reviewer,
		@Nullable String modelVersion) {

	/**
	 * Validate the request and turn it into a {@link Recommendation}.
	 * @param timestamp review time
	 * @param reviewId unique review id
	 * @return the recommendation with its computed priority score
	 * @throws InvalidRecommendationException listing every problem found
	 */
	public Recommendation toRecommendation(Instant timestamp, String reviewId) {
		List<String> errors = new ArrayList<>();
		RecommendationKind kind = parse("recommendation", recommendation, RecommendationKind::fromId,
				RecommendationKind.values(), errors);
		Level confidenceLevel = parseLevel("confidence", confidence, errors);
		Level severityLevel = parseLevel("severity", severity, errors);
		Level frequencyLevel = parseLevel("frequency", frequency, errors);
		Level prevalenceLevel = parseLevel("prevalence", prevalence, errors);
		Level complexityLevel = parseLevel("solution_complexity", solutionComplexity, errors);
		Level riskLevel = parseLevel("solution_risk", solutionRisk, errors);
		requireText("summary", summary, errors);
		requireText("rationale", rationale, errors);
		requireText("report", report, errors);
		if (mergeWith != null && mergeWith.stream().anyMatch(n -> n == null || n <= 0)) {
			errors.add("merge_with must be a list of positive issue numbers");
		}
		if (relevantIssues != null && relevantIssues.stream()
			.anyMatch(i -> i == null || i.number() <= 0 || i.title() == null || i.url() == null)) {
			errors.add("relevant_issues must be a list of entries with keys: number, title, url");
		}
		if (!errors.isEmpty()) {
			throw new InvalidRecommendationException(errors);
		}

		Recommendation.Analysis analysis = new Recommendation.Analysis(severityLevel, frequencyLevel,
				prevalenceLevel, complexityLevel, riskLevel);
		Recommendation.Context context = new Recommendation.Context(affectedPackages, affectedPaths,
				affectedComponents, mergeWith, relevantIssues);
		String reviewerName = reviewer == null || reviewer.isBlank() ? "ai" : reviewer;
		return new Recommendation(kind, confidenceLevel, summary.strip(), rationale.strip(), report.strip(), analysis,
				analysis.priorityScore(), context, new Recommendation.Meta(reviewerName, timestamp, modelVersion,
						reviewId));
	}

	private static void requireText(String field, @Nullable String value, List<String> errors) {
		if (value == null || value.isBlank()) {
			errors.add(field + " must be a non-empty string");
		}
	}

	private static @Nullable Level parseLevel(String field, @Nullable String value, List<String> errors) {
		return parse(field, value, Level::fromId, Level.values(), errors);
	}

	private static <E extends Enum<E>> @Nullable E parse(String field, @Nullable String value,
			Function<String, E> parser, E[] allowed, List<String> errors) {
		try {
			if (value != null) {
				return parser.apply(value);
			}
		}
		catch (IllegalArgumentException e) {
			errors.add(field + " must be one of: " + ids(allowed) + ", got: " + value);
			return null;
		}
		errors.add(field + " must be one of: " + ids(allowed));
		return null;
	}

	private static String ids(Enum<?>[] allowed) {
		return Arrays.stream(allowed)
			.map(v -> v.name().toLowerCase(Locale.ROOT))
			.sorted()
			.collect(Collectors.joining(", "));
	}

}
