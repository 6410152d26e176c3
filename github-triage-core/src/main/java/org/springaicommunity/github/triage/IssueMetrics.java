package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Metrics of one issue with their collection-relative quartiles.
 *
 * @param number the issue number
 * @param metrics the metric bundle, null if the issue has not been enriched yet
 * @param quartiles quartile label per metric name
 */
public record IssueMetrics(int number, @Nullable MetricBundle metrics, Map<String, Quartile> quartiles) {
}
