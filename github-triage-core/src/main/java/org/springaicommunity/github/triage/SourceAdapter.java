package org.springaicommunity.github.triage;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Fetches raw issue data from an upstream source.
 *
 * <p>
 * Records are returned loosely typed; {@link IssueRecordParser} validates their shape at
 * the merge boundary.
 */
public interface SourceAdapter {

	/**
	 * Fetch every item of the given types updated within [windowStart, windowEnd).
	 * Pagination is handled internally.
	 * @param repository repository in "owner/repo" format
	 * @param itemTypes the item types to fetch
	 * @param windowStart inclusive start of the update window
	 * @param windowEnd exclusive end of the update window
	 * @return raw records, possibly empty
	 * @throws SourceUnavailableException when the source fails after retries
	 * @throws SourceAuthenticationException when the credentials are rejected
	 */
	List<JsonNode> fetch(String repository, Set<ItemType> itemTypes, Instant windowStart, Instant windowEnd);

}
