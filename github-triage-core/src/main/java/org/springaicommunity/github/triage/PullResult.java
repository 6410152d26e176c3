package org.springaicommunity.github.triage;

import java.util.Set;

/**
 * Outcome of {@link IngestionService#pull(IngestionRequest)}.
 *
 * @param key the collection pulled into
 * @param windows windows fetched and merged
 * @param fetched raw records received from the source
 * @param inserted records added to the collection
 * @param updated records replaced by a newer version
 * @param rejected malformed records skipped
 * @param contentChanged numbers of records whose embedding text changed
 * @param interrupted whether the pull stopped early on interruption
 */
public record PullResult(CollectionKey key, int windows, int fetched, int inserted, int updated, int rejected,
		Set<Integer> contentChanged, boolean interrupted) {

	public PullResult {
		contentChanged = Set.copyOf(contentChanged);
	}

}
