package org.springaicommunity.github.triage;

/**
 * A similarity query hit.
 *
 * @param issue the matching issue
 * @param similarity cosine similarity to the query
 */
public record SimilarIssue(IssueSummary issue, double similarity) {
}
