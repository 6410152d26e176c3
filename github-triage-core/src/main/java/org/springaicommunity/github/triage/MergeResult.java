package org.springaicommunity.github.triage;

import java.util.Set;

/**
 * Outcome of merging one batch of upstream records into a collection.
 *
 * @param collection the merged collection (the input collection is left untouched)
 * @param inserted numbers of records that were not present before
 * @param updated numbers of existing records replaced by a newer version
 * @param contentChanged numbers of inserted or updated records whose embedding text
 * (title, body, comment bodies) differs from before; every insert counts
 * @param rejected number of raw records skipped as malformed
 */
public record MergeResult(IssueCollection collection, Set<Integer> inserted, Set<Integer> updated,
		Set<Integer> contentChanged, int rejected) {

	public MergeResult {
		inserted = Set.copyOf(inserted);
		updated = Set.copyOf(updated);
		contentChanged = Set.copyOf(contentChanged);
	}

	/**
	 * Whether the merge changed anything that needs to be persisted.
	 */
	public boolean changed() {
		return !inserted.isEmpty() || !updated.isEmpty();
	}

}
