package org.springaicommunity.github.triage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FetchWindowPlanner Tests")
class FetchWindowPlannerTest {

	private static final LocalDate START = LocalDate.of(2025, 1, 1);

	private static final Instant START_INSTANT = Instant.parse("2025-01-01T00:00:00Z");

	private final FetchWindowPlanner planner = new FetchWindowPlanner();

	@Nested
	@DisplayName("Construction")
	class ConstructionTest {

		@Test
		@DisplayName("Should default to seven day windows")
		void shouldDefaultToSevenDays() {
			assertThat(new FetchWindowPlanner().getWindowWidth()).isEqualTo(Duration.ofDays(7));
		}

		@Test
		@DisplayName("Should reject non-positive window width")
		void shouldRejectNonPositiveWidth() {
			assertThatThrownBy(() -> new FetchWindowPlanner(Duration.ZERO))
				.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new FetchWindowPlanner(Duration.ofDays(-1)))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Fresh checkpoint")
	class FreshCheckpointTest {

		@Test
		@DisplayName("Should cover the range with contiguous windows and a trailing partial one")
		void shouldCoverRangeContiguously() {
			Instant now = Instant.parse("2025-01-20T12:00:00Z");

			List<FetchWindow> windows = planner.plan(FetchCheckpoint.initial(ItemType.ISSUE, START), now, false)
				.toList();

			assertThat(windows).hasSize(3);
			assertThat(windows.get(0).start()).isEqualTo(START_INSTANT);
			for (int i = 1; i < windows.size(); i++) {
				assertThat(windows.get(i).start()).isEqualTo(windows.get(i - 1).end());
			}
			assertThat(windows.get(2).end()).isEqualTo(now);
			assertThat(windows).extracting(FetchWindow::complete).containsExactly(true, true, false);
		}

		@Test
		@DisplayName("Should mark the last window complete when the range is an exact multiple")
		void shouldEndWithCompleteWindowOnExactMultiple() {
			Instant now = START_INSTANT.plus(Duration.ofDays(14));

			List<FetchWindow> windows = planner.plan(FetchCheckpoint.initial(ItemType.ISSUE, START), now, false)
				.toList();

			assertThat(windows).hasSize(2).allMatch(FetchWindow::complete);
			assertThat(windows.get(1).end()).isEqualTo(now);
		}

		@Test
		@DisplayName("Should plan nothing when now is not after the start")
		void shouldPlanNothingWhenNowBeforeStart() {
			assertThat(planner.plan(FetchCheckpoint.initial(ItemType.ISSUE, START), START_INSTANT, false)).isEmpty();
			assertThat(planner.plan(FetchCheckpoint.initial(ItemType.ISSUE, START), START_INSTANT.minusSeconds(1),
					false))
				.isEmpty();
		}

	}

	@Nested
	@DisplayName("Resuming")
	class ResumingTest {

		@Test
		@DisplayName("Should resume from the last committed window end")
		void shouldResumeFromLastWindowEnd() {
			Instant lastEnd = Instant.parse("2025-03-01T00:00:00Z");
			FetchCheckpoint checkpoint = new FetchCheckpoint(ItemType.ISSUE, START, lastEnd);

			List<FetchWindow> windows = planner.plan(checkpoint, lastEnd.plus(Duration.ofDays(3)), false).toList();

			assertThat(windows).singleElement().satisfies(w -> {
				assertThat(w.start()).isEqualTo(lastEnd);
				assertThat(w.complete()).isFalse();
			});
		}

		@Test
		@DisplayName("Should restart from the start date when forced")
		void shouldRestartWhenForced() {
			Instant lastEnd = Instant.parse("2025-01-15T00:00:00Z");
			FetchCheckpoint checkpoint = new FetchCheckpoint(ItemType.ISSUE, START, lastEnd);

			List<FetchWindow> windows = planner.plan(checkpoint, Instant.parse("2025-01-16T00:00:00Z"), true)
				.toList();

			assertThat(windows.get(0).start()).isEqualTo(START_INSTANT);
			assertThat(windows).hasSize(3);
		}

		@Test
		@DisplayName("Should not produce overlapping windows")
		void shouldNotOverlap() {
			Instant now = Instant.parse("2025-06-30T08:15:00Z");

			List<FetchWindow> windows = new FetchWindowPlanner(Duration.ofDays(3))
				.plan(FetchCheckpoint.initial(ItemType.PULL_REQUEST, START), now, false)
				.toList();

			for (int i = 1; i < windows.size(); i++) {
				assertThat(windows.get(i).start()).isEqualTo(windows.get(i - 1).end());
				assertThat(windows.get(i - 1).complete()).isTrue();
			}
		}

	}

	@Nested
	@DisplayName("Checkpoint")
	class CheckpointTest {

		@Test
		@DisplayName("Should never move backwards")
		void shouldNeverMoveBackwards() {
			Instant later = Instant.parse("2025-02-01T00:00:00Z");
			FetchCheckpoint checkpoint = new FetchCheckpoint(ItemType.ISSUE, START, later);

			assertThat(checkpoint.advancedTo(later.minusSeconds(60))).isSameAs(checkpoint);
			assertThat(checkpoint.advancedTo(later.plusSeconds(60)).lastWindowEnd()).isEqualTo(later.plusSeconds(60));
		}

		@Test
		@DisplayName("Should resume from the start of the start date before the first window")
		void shouldResumeFromStartDate() {
			assertThat(FetchCheckpoint.initial(ItemType.ISSUE, START).resumeFrom()).isEqualTo(START_INSTANT);
		}

	}

}
