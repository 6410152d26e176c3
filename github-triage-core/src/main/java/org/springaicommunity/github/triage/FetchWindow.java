package org.springaicommunity.github.triage;

import java.time.Duration;
import java.time.Instant;

/**
 * A half-open time range [start, end) of upstream "updated at" timestamps.
 *
 * @param start inclusive start
 * @param end exclusive end
 * @param complete true when the window has its full planned width; only complete
 * windows advance a checkpoint
 */
public record FetchWindow(Instant start, Instant end, boolean complete) {

	public FetchWindow {
		if (!end.isAfter(start)) {
			throw new IllegalArgumentException("Window end " + end + " must be after start " + start);
		}
	}

	public Duration width() {
		return Duration.between(start, end);
	}

	@Override
	public String toString() {
		return start + " .. " + end + (complete ? "" : " (partial)");
	}

}
