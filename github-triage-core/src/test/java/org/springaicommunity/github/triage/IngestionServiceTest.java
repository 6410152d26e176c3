package org.springaicommunity.github.triage;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springaicommunity.github.triage.TestRecords.*;

/**
 * Unit tests for {@link IngestionService}.
 *
 * The clock is fixed at 2025-01-20T12:00Z and windows are seven days wide, so a fresh
 * pull from 2025-01-01 plans two complete windows and one partial window per item type.
 */
@DisplayName("IngestionService Tests")
class IngestionServiceTest {

	private static final Instant NOW = Instant.parse("2025-01-20T12:00:00Z");

	private static final LocalDate START = LocalDate.of(2025, 1, 1);

	private static final Instant FIRST_WINDOW_END = Instant.parse("2025-01-08T00:00:00Z");

	private static final Instant SECOND_WINDOW_END = Instant.parse("2025-01-15T00:00:00Z");

	@TempDir
	Path tempDir;

	private ScriptedSource source;

	private FileSystemCollectionStore store;

	private IngestionService service;

	@BeforeEach
	void setUp() {
		source = new ScriptedSource();
		store = spy(new FileSystemCollectionStore(tempDir, ObjectMapperFactory.create()));
		service = new IngestionService(source, new MergeEngine(), store, new FetchWindowPlanner(), Clock.fixed(NOW,
				ZoneOffset.UTC), START);
	}

	@AfterEach
	void clearInterrupt() {
		Thread.interrupted();
	}

	private static IngestionRequest issuesOnly() {
		return new IngestionRequest(KEY, EnumSet.of(ItemType.ISSUE), false, null);
	}

	@Nested
	@DisplayName("Fresh pull")
	class FreshPullTest {

		@Test
		@DisplayName("Should fetch every window and merge the records")
		void shouldFetchEveryWindow() {
			source.respond(FIRST_WINDOW_END, w -> batch(raw(1, "First", "2025-01-03T00:00:00Z")));
			source.respond(SECOND_WINDOW_END, w -> batch(raw(2, "Second", "2025-01-10T00:00:00Z")));
			source.respond(NOW, w -> batch(raw(3, "Third", "2025-01-19T00:00:00Z")));

			PullResult result = service.pull(issuesOnly());

			assertThat(result.windows()).isEqualTo(3);
			assertThat(result.fetched()).isEqualTo(3);
			assertThat(result.inserted()).isEqualTo(3);
			assertThat(result.contentChanged()).containsExactly(1, 2, 3);
			assertThat(result.interrupted()).isFalse();
			assertThat(store.load(KEY).records()).extracting(IssueRecord::number).containsExactly(1, 2, 3);
			assertThat(source.calls).extracting(Call::start)
				.containsExactly(START.atStartOfDay(ZoneOffset.UTC).toInstant(), FIRST_WINDOW_END,
						SECOND_WINDOW_END);
		}

		@Test
		@DisplayName("Should advance the checkpoint only to the last complete window")
		void shouldAdvanceCheckpointToCompleteWindows() {
			service.pull(issuesOnly());

			assertThat(store.load(KEY).checkpoint(ItemType.ISSUE))
				.hasValueSatisfying(c -> assertThat(c.lastWindowEnd()).isEqualTo(SECOND_WINDOW_END));
		}

		@Test
		@DisplayName("Should fetch each item type with its own checkpoint")
		void shouldFetchItemTypesSeparately() {
			service.pull(IngestionRequest.incremental(KEY));

			assertThat(source.calls).extracting(Call::itemTypes)
				.containsOnly(Set.of(ItemType.ISSUE), Set.of(ItemType.PULL_REQUEST));
			assertThat(store.load(KEY).checkpoints()).extracting(FetchCheckpoint::itemType)
				.containsExactly(ItemType.ISSUE, ItemType.PULL_REQUEST);
		}

		@Test
		@DisplayName("Should start from the requested start date")
		void shouldUseRequestedStartDate() {
			service.pull(new IngestionRequest(KEY, EnumSet.of(ItemType.ISSUE), false, LocalDate.of(2025, 1, 10)));

			assertThat(source.calls.get(0).start()).isEqualTo(Instant.parse("2025-01-10T00:00:00Z"));
			assertThat(store.load(KEY).checkpoint(ItemType.ISSUE))
				.hasValueSatisfying(c -> assertThat(c.startDate()).isEqualTo(LocalDate.of(2025, 1, 10)));
		}

		@Test
		@DisplayName("Should count rejected records")
		void shouldCountRejected() {
			source.respond(FIRST_WINDOW_END, w -> {
				var broken = raw(9, "Broken", "2025-01-03T00:00:00Z");
				broken.remove("createdAt");
				return batch(broken, raw(1, "Fine", "2025-01-03T00:00:00Z"));
			});

			PullResult result = service.pull(issuesOnly());

			assertThat(result.rejected()).isEqualTo(1);
			assertThat(result.inserted()).isEqualTo(1);
		}

	}

	@Nested
	@DisplayName("Incremental pull")
	class IncrementalPullTest {

		@Test
		@DisplayName("Should resume from the checkpoint")
		void shouldResumeFromCheckpoint() {
			service.pull(issuesOnly());
			source.calls.clear();

			PullResult result = service.pull(issuesOnly());

			assertThat(result.windows()).isEqualTo(1);
			assertThat(source.calls).singleElement().satisfies(call -> {
				assertThat(call.start()).isEqualTo(SECOND_WINDOW_END);
				assertThat(call.end()).isEqualTo(NOW);
			});
			assertThat(store.load(KEY).checkpoint(ItemType.ISSUE))
				.hasValueSatisfying(c -> assertThat(c.lastWindowEnd()).isEqualTo(SECOND_WINDOW_END));
		}

		@Test
		@DisplayName("Should not write when nothing changed")
		void shouldNotWriteWithoutChanges() {
			source.respond(NOW, w -> batch(raw(3, "Third", "2025-01-19T00:00:00Z")));
			service.pull(issuesOnly());
			clearInvocations(store);

			PullResult result = service.pull(issuesOnly());

			assertThat(result.inserted()).isZero();
			assertThat(result.updated()).isZero();
			assertThat(result.contentChanged()).isEmpty();
			verify(store, never()).save(any());
		}

		@Test
		@DisplayName("Should restart from the start date when forced")
		void shouldRestartWhenForced() {
			service.pull(issuesOnly());
			source.calls.clear();

			PullResult result = service.pull(new IngestionRequest(KEY, EnumSet.of(ItemType.ISSUE), true, null));

			assertThat(result.windows()).isEqualTo(3);
			assertThat(source.calls.get(0).start()).isEqualTo(START.atStartOfDay(ZoneOffset.UTC).toInstant());
		}

	}

	@Nested
	@DisplayName("Failures")
	class FailureTest {

		@Test
		@DisplayName("Should keep the progress of earlier windows when a window fails")
		void shouldKeepEarlierProgress() {
			source.respond(FIRST_WINDOW_END, w -> batch(raw(1, "First", "2025-01-03T00:00:00Z")));
			source.respond(SECOND_WINDOW_END, w -> {
				throw new SourceUnavailableException("GitHub is down");
			});

			assertThatThrownBy(() -> service.pull(issuesOnly())).isInstanceOf(SourceUnavailableException.class);

			IssueCollection stored = store.load(KEY);
			assertThat(stored.records()).extracting(IssueRecord::number).containsExactly(1);
			assertThat(stored.checkpoint(ItemType.ISSUE))
				.hasValueSatisfying(c -> assertThat(c.lastWindowEnd()).isEqualTo(FIRST_WINDOW_END));
		}

		@Test
		@DisplayName("Should resume after the last committed window on the next pull")
		void shouldResumeAfterFailure() {
			source.respond(SECOND_WINDOW_END, w -> {
				throw new SourceUnavailableException("GitHub is down");
			});
			assertThatThrownBy(() -> service.pull(issuesOnly())).isInstanceOf(SourceUnavailableException.class);
			source.responses.clear();
			source.calls.clear();

			service.pull(issuesOnly());

			assertThat(source.calls.get(0).start()).isEqualTo(FIRST_WINDOW_END);
		}

		@Test
		@DisplayName("Should propagate authentication failures")
		void shouldPropagateAuthenticationFailure() {
			source.respond(FIRST_WINDOW_END, w -> {
				throw new SourceAuthenticationException("Bad credentials", new RuntimeException("401"));
			});

			assertThatThrownBy(() -> service.pull(issuesOnly())).isInstanceOf(SourceAuthenticationException.class);
			assertThat(store.exists(KEY)).isFalse();
		}

		@Test
		@DisplayName("Should stop cleanly when interrupted while waiting to retry")
		void shouldStopWhenInterrupted() {
			source.respond(FIRST_WINDOW_END, w -> batch(raw(1, "First", "2025-01-03T00:00:00Z")));
			source.respond(SECOND_WINDOW_END, w -> {
				throw new Retrier.RetryInterruptedException(new InterruptedException());
			});

			PullResult result = service.pull(IngestionRequest.incremental(KEY));

			assertThat(result.interrupted()).isTrue();
			assertThat(result.windows()).isEqualTo(1);
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
			assertThat(source.calls).extracting(Call::itemTypes).containsOnly(Set.of(ItemType.ISSUE));
			assertThat(store.load(KEY).checkpoint(ItemType.ISSUE))
				.hasValueSatisfying(c -> assertThat(c.lastWindowEnd()).isEqualTo(FIRST_WINDOW_END));
		}

	}

	record Call(Set<ItemType> itemTypes, Instant start, Instant end) {
	}

	/**
	 * Source whose responses are keyed by window end; unscripted windows are empty.
	 */
	static class ScriptedSource implements SourceAdapter {

		final List<Call> calls = new ArrayList<>();

		final Map<Instant, Function<Call, List<JsonNode>>> responses = new HashMap<>();

		void respond(Instant windowEnd, Function<Call, List<JsonNode>> response) {
			responses.put(windowEnd, response);
		}

		@Override
		public List<JsonNode> fetch(String repository, Set<ItemType> itemTypes, Instant windowStart,
				Instant windowEnd) {
			Call call = new Call(itemTypes, windowStart, windowEnd);
			calls.add(call);
			return responses.getOrDefault(windowEnd, c -> List.of()).apply(call);
		}

	}

}
