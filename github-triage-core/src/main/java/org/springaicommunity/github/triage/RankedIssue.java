package org.springaicommunity.github.triage;

/**
 * An entry of a top-N ranking by metric.
 */
public record RankedIssue(IssueSummary issue, String metric, double value) {
}
