package org.springaicommunity.github.triage;

import java.time.Instant;

/**
 * Represents a comment on a GitHub issue or pull request.
 *
 * <p>
 * A comment is owned by its parent {@link IssueRecord}; its identity is the pair (issue
 * number, comment id).
 *
 * @param id the upstream comment id (GraphQL node id or REST database id)
 * @param author the user who wrote the comment
 * @param body the comment text content
 * @param createdAt when the comment was created
 * @param reactions reactions on the comment
 */
public record Comment(String id, Author author, String body, Instant createdAt, Reactions reactions) {
}
