package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Durable marker of fetch progress for one item type of one collection.
 *
 * <p>
 * {@code lastWindowEnd} only ever moves forward and only after the window ending there
 * has been merged and written together with the collection.
 *
 * @param itemType the item type this checkpoint tracks
 * @param startDate the configured start date of the collection
 * @param lastWindowEnd end of the last fully committed window, null before the first one
 */
public record FetchCheckpoint(ItemType itemType, LocalDate startDate, @Nullable Instant lastWindowEnd) {

	public static FetchCheckpoint initial(ItemType itemType, LocalDate startDate) {
		return new FetchCheckpoint(itemType, startDate, null);
	}

	/**
	 * Where the next incremental fetch starts.
	 * @return the last committed window end, or the start of the start date (UTC)
	 */
	public Instant resumeFrom() {
		return lastWindowEnd != null ? lastWindowEnd : startDate.atStartOfDay(ZoneOffset.UTC).toInstant();
	}

	/**
	 * Advance to the end of a committed window. Never moves backwards.
	 * @param windowEnd end of the committed window
	 * @return the advanced checkpoint, or this one if {@code windowEnd} is not later
	 */
	public FetchCheckpoint advancedTo(Instant windowEnd) {
		if (lastWindowEnd != null && !windowEnd.isAfter(lastWindowEnd)) {
			return this;
		}
		return new FetchCheckpoint(itemType, startDate, windowEnd);
	}

}
