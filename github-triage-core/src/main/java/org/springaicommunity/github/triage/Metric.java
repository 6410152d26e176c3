package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Named, rankable metrics. The name is the key used in quartile bundles and in
 * {@code get_top_issues} requests.
 */
public enum Metric {

	COMMENT_COUNT("comment_count", m -> (double) m.commentCount()),

	AGE_DAYS("age_days", m -> (double) m.ageDays()),

	DAYS_SINCE_UPDATE("days_since_update", m -> (double) m.daysSinceUpdate()),

	ENGAGEMENTS("engagements", m -> (double) m.engagements()),

	ENGAGEMENTS_PER_DAY("engagements_per_day", MetricBundle::engagementsPerDay),

	POSITIVE_REACTIONS("positive_reactions", m -> (double) m.positiveReactions()),

	NEGATIVE_REACTIONS("negative_reactions", m -> (double) m.negativeReactions()),

	BODY_REACTIONS("body_reactions", m -> (double) m.bodyReactions()),

	COMMENT_REACTIONS("comment_reactions", m -> (double) m.commentReactions()),

	TOTAL_REACTIONS("total_reactions", m -> (double) m.totalReactions()),

	ACTIVITY_SCORE("activity_score", MetricBundle::activityScore),

	KNN_DISTANCE("knn_distance", MetricBundle::knnDistance);

	private final String metricName;

	private final Function<MetricBundle, @Nullable Double> extractor;

	Metric(String metricName, Function<MetricBundle, @Nullable Double> extractor) {
		this.metricName = metricName;
		this.extractor = extractor;
	}

	public String metricName() {
		return metricName;
	}

	/**
	 * Read this metric from a bundle.
	 * @param bundle the metric bundle
	 * @return the value, or null when the bundle carries none (e.g. no k-NN distance)
	 */
	public @Nullable Double valueOf(MetricBundle bundle) {
		return extractor.apply(bundle);
	}

	/**
	 * Look up a metric by its name.
	 * @param name metric name such as "comment_count"
	 * @return the metric
	 * @throws InvalidMetricException if the name is not recognized
	 */
	public static Metric fromName(String name) {
		return Arrays.stream(values())
			.filter(m -> m.metricName.equals(name))
			.findFirst()
			.orElseThrow(() -> new InvalidMetricException(name, names()));
	}

	public static List<String> names() {
		return Arrays.stream(values()).map(Metric::metricName).toList();
	}

}
