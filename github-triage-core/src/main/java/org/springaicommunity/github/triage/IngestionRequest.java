package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Parameters of one pull.
 *
 * @param key the collection to pull into
 * @param itemTypes the item types to fetch, each with its own checkpoint
 * @param forced refetch from the start date, ignoring stored progress
 * @param startDate overrides the start date of checkpoints, null keeps the stored one
 */
public record IngestionRequest(CollectionKey key, Set<ItemType> itemTypes, boolean forced,
		@Nullable LocalDate startDate) {

	public IngestionRequest {
		if (itemTypes.isEmpty()) {
			throw new IllegalArgumentException("At least one item type is required");
		}
		itemTypes = Collections.unmodifiableSet(EnumSet.copyOf(itemTypes));
	}

	/**
	 * An incremental pull of issues and pull requests.
	 */
	public static IngestionRequest incremental(CollectionKey key) {
		return new IngestionRequest(key, EnumSet.allOf(ItemType.class), false, null);
	}

}
