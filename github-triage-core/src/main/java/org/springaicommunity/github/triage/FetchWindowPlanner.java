package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Plans fixed-width time windows for incremental collection.
 *
 * <p>
 * Windows start at the checkpoint's last committed window end (or at midnight UTC of the
 * configured start date on the first run, or always when forced) and cover the range up
 * to {@code now}. All windows have the configured width except possibly the last one,
 * which ends exactly at {@code now} and is marked partial.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * var planner = new FetchWindowPlanner(Duration.ofDays(7));
 * planner.plan(checkpoint, Instant.now(), false)
 *     .forEach(window -> ingest(window));
 * }</pre>
 *
 * The returned stream is lazy, so a caller that stops early (interruption, source
 * failure) never plans windows it will not process.
 */
public class FetchWindowPlanner {

	private static final Logger logger = LoggerFactory.getLogger(FetchWindowPlanner.class);

	/**
	 * Default window width.
	 */
	public static final Duration DEFAULT_WINDOW = Duration.ofDays(7);

	private final Duration windowWidth;

	public FetchWindowPlanner() {
		this(DEFAULT_WINDOW);
	}

	public FetchWindowPlanner(Duration windowWidth) {
		if (windowWidth.isZero() || windowWidth.isNegative()) {
			throw new IllegalArgumentException("windowWidth must be positive, got: " + windowWidth);
		}
		this.windowWidth = windowWidth;
	}

	public Duration getWindowWidth() {
		return windowWidth;
	}

	/**
	 * Plan the windows still to fetch for a checkpoint.
	 * @param checkpoint the stored checkpoint
	 * @param now the upper bound of the range
	 * @param forced restart from the checkpoint's start date, ignoring progress
	 * @return ordered, non-overlapping windows; empty if {@code now} is not after the
	 * starting boundary
	 */
	public Stream<FetchWindow> plan(FetchCheckpoint checkpoint, Instant now, boolean forced) {
		Instant from = forced ? checkpoint.startDate().atStartOfDay(ZoneOffset.UTC).toInstant()
				: checkpoint.resumeFrom();
		if (!now.isAfter(from)) {
			logger.debug("Nothing to plan for {}: {} is not after {}", checkpoint.itemType().id(), now, from);
			return Stream.empty();
		}
		logger.debug("Planning {} windows of {} from {} to {}", checkpoint.itemType().id(), windowWidth, from, now);
		return Stream.iterate(windowStarting(from, now), Objects::nonNull, w -> next(w, now));
	}

	private @Nullable FetchWindow next(FetchWindow previous, Instant now) {
		return previous.end().isBefore(now) ? windowStarting(previous.end(), now) : null;
	}

	private FetchWindow windowStarting(Instant start, Instant now) {
		Instant fullEnd = start.plus(windowWidth);
		if (fullEnd.isAfter(now)) {
			return new FetchWindow(start, now, false);
		}
		return new FetchWindow(start, fullEnd, true);
	}

}
