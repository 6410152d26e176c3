package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * An AI or human triage recommendation attached to an issue. Recommendations are local
 * annotations: merges never overwrite them.
 *
 * @param recommendation the recommended action
 * @param confidence confidence in the recommendation
 * @param summary one-line summary
 * @param rationale short explanation
 * @param report full markdown report
 * @param analysis structured impact/effort analysis
 * @param priorityScore score in 5..15 derived from the analysis
 * @param context affected code and related issues
 * @param meta reviewer metadata
 */
public record Recommendation(RecommendationKind recommendation, Level confidence, String summary, String rationale,
		String report, Analysis analysis, int priorityScore, Context context, Meta meta) {

	/**
	 * @param severity impact on users or the system
	 * @param frequency how often the problem occurs
	 * @param prevalence how many users are affected
	 * @param solutionComplexity estimated development effort
	 * @param solutionRisk risk of implementing a fix
	 */
	public record Analysis(Level severity, Level frequency, Level prevalence, Level solutionComplexity,
			Level solutionRisk) {

		/**
		 * Higher severity, frequency and prevalence raise the score; higher complexity and
		 * risk lower it.
		 * @return priority score between 5 and 15
		 */
		public int priorityScore() {
			return severity.score() + frequency.score() + prevalence.score() + solutionComplexity.invertedScore()
					+ solutionRisk.invertedScore();
		}

		/**
		 * Difficulty bucket: easy when complexity and risk are both low, hard when either
		 * is high, medium otherwise.
		 */
		public String difficulty() {
			if (solutionComplexity == Level.LOW && solutionRisk == Level.LOW) {
				return "easy";
			}
			if (solutionComplexity == Level.HIGH || solutionRisk == Level.HIGH) {
				return "hard";
			}
			return "medium";
		}

	}

	public record Context(List<String> affectedPackages, List<String> affectedPaths, List<String> affectedComponents,
			List<Integer> mergeWith, List<RelevantIssue> relevantIssues) {

		public Context {
			affectedPackages = affectedPackages == null ? List.of() : List.copyOf(affectedPackages);
			affectedPaths = affectedPaths == null ? List.of() : List.copyOf(affectedPaths);
			affectedComponents = affectedComponents == null ? List.of() : List.copyOf(affectedComponents);
			mergeWith = mergeWith == null ? List.of() : List.copyOf(mergeWith);
			relevantIssues = relevantIssues == null ? List.of() : List.copyOf(relevantIssues);
		}

	}

	public record RelevantIssue(int number, String title, String url) {
	}

	public record Meta(String reviewer, Instant timestamp, @Nullable String modelVersion, String reviewId) {
	}

}
