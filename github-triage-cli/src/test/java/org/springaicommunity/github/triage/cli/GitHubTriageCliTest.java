package org.springaicommunity.github.triage.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.github.triage.*;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs CLI commands end to end against a temporary data directory and a canned source.
 */
@DisplayName("GitHubTriageCli Tests")
class GitHubTriageCliTest {

	private static final CollectionKey KEY = CollectionKey.of("owner/repo");

	private static final Instant CREATED = Instant.parse("2025-01-02T00:00:00Z");

	private static final Instant NOW = Instant.parse("2025-01-20T12:00:00Z");

	private final ObjectMapper mapper = new ObjectMapper();

	@TempDir
	Path dataDir;

	private CollectionStore store;

	private List<Instant> fetchedWindows;

	private GitHubTriageBuilder builder;

	@BeforeEach
	void setUp() {
		store = new FileSystemCollectionStore(dataDir, ObjectMapperFactory.create());
		fetchedWindows = new ArrayList<>();
		builder = GitHubTriageBuilder.create()
			.collectionStore(store)
			.sourceAdapter(this::fetch)
			.clock(Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private List<JsonNode> fetch(String repository, Set<ItemType> itemTypes, Instant start, Instant end) {
		fetchedWindows.add(end);
		Instant updatedAt = Instant.parse("2025-01-03T10:00:00Z");
		if (!itemTypes.contains(ItemType.ISSUE) || updatedAt.isBefore(start) || !updatedAt.isBefore(end)) {
			return List.of();
		}
		return List.of(rawIssue(1, updatedAt), rawIssue(2, updatedAt));
	}

	private JsonNode rawIssue(int number, Instant updatedAt) {
		var node = mapper.createObjectNode();
		node.put("__typename", "Issue");
		node.put("number", number);
		node.put("title", "Issue " + number);
		node.put("body", "Body " + number);
		node.put("state", "OPEN");
		node.put("url", "https://github.com/owner/repo/issues/" + number);
		node.put("createdAt", CREATED.toString());
		node.put("updatedAt", updatedAt.toString());
		node.putObject("author").put("login", "alice");
		return node;
	}

	private static IssueRecord record(int number, String title) {
		return IssueRecord.fromSource(number, ItemType.ISSUE, title, "Body", IssueState.OPEN,
				"https://github.com/owner/repo/issues/" + number, new Author("alice", null), List.of(), List.of(),
				CREATED, CREATED, Reactions.NONE, List.of(), List.of());
	}

	private int run(String... args) {
		return GitHubTriageCli.run(args, builder, false);
	}

	@Nested
	@DisplayName("Argument handling")
	class ArgumentHandlingTest {

		@Test
		@DisplayName("Should print help and succeed without arguments")
		void shouldShowHelp() {
			assertThat(run()).isEqualTo(GitHubTriageCli.EXIT_OK);
			assertThat(run("pull", "--help")).isEqualTo(GitHubTriageCli.EXIT_OK);
		}

		@Test
		@DisplayName("Should fail on invalid arguments")
		void shouldFailOnBadArguments() {
			assertThat(run("pull", "not-a-repo")).isEqualTo(GitHubTriageCli.EXIT_ERROR);
			assertThat(run("explode", "owner/repo")).isEqualTo(GitHubTriageCli.EXIT_ERROR);
		}

	}

	@Nested
	@DisplayName("Pull and enrich")
	class PullTest {

		@Test
		@DisplayName("Should pull into the data directory")
		void shouldPull() {
			int exitCode = run("pull", "owner/repo", "--start-date", "2025-01-01", "--item-types", "issues");

			assertThat(exitCode).isEqualTo(GitHubTriageCli.EXIT_OK);
			assertThat(fetchedWindows).isNotEmpty();
			IssueCollection collection = store.load(KEY);
			assertThat(collection.records()).extracting(IssueRecord::number).containsExactly(1, 2);
			assertThat(collection.checkpoint(ItemType.ISSUE)).isPresent();
		}

		@Test
		@DisplayName("Should compute metrics on update without an embedding provider")
		void shouldUpdate() {
			int exitCode = run("update", "owner/repo", "--start-date", "2025-01-01");

			assertThat(exitCode).isEqualTo(GitHubTriageCli.EXIT_OK);
			assertThat(store.load(KEY).records()).allSatisfy(r -> assertThat(r.metrics()).isNotNull());
		}

	}

	@Nested
	@DisplayName("Maintenance commands")
	class MaintenanceTest {

		@Test
		@DisplayName("Should fail stats for a missing collection")
		void shouldFailStatsWhenMissing() {
			assertThat(run("stats", "owner/repo")).isEqualTo(GitHubTriageCli.EXIT_ERROR);
		}

		@Test
		@DisplayName("Should report stats for an existing collection")
		void shouldReportStats() {
			store.save(IssueCollection.empty(KEY).withRecord(record(1, "Fine")));

			assertThat(run("stats", "owner/repo")).isEqualTo(GitHubTriageCli.EXIT_OK);
		}

		@Test
		@DisplayName("Should pass validation of a consistent collection")
		void shouldPassValidation() {
			store.save(IssueCollection.empty(KEY).withRecord(record(1, "Fine")));

			assertThat(run("validate", "owner/repo")).isEqualTo(GitHubTriageCli.EXIT_OK);
		}

		@Test
		@DisplayName("Should return the validation exit code for an inconsistent collection")
		void shouldFailValidation() {
			store.save(IssueCollection.empty(KEY).withRecord(record(1, "Fine")).withRecord(record(2, " ")));

			assertThat(run("validate", "owner/repo")).isEqualTo(GitHubTriageCli.EXIT_VALIDATION_FAILED);
			assertThat(store.load(KEY).records()).hasSize(2);
		}

		@Test
		@DisplayName("Should delete invalid records when asked")
		void shouldDeleteInvalid() {
			store.save(IssueCollection.empty(KEY).withRecord(record(1, "Fine")).withRecord(record(2, " ")));

			assertThat(run("validate", "owner/repo", "--delete-invalid")).isEqualTo(GitHubTriageCli.EXIT_OK);
			assertThat(store.load(KEY).records()).extracting(IssueRecord::number).containsExactly(1);
		}

		@Test
		@DisplayName("Should delete the collection on clean")
		void shouldClean() {
			store.save(IssueCollection.empty(KEY).withRecord(record(1, "Fine")));

			assertThat(run("clean", "owner/repo")).isEqualTo(GitHubTriageCli.EXIT_OK);
			assertThat(store.exists(KEY)).isFalse();
			assertThat(run("clean", "owner/repo")).isEqualTo(GitHubTriageCli.EXIT_OK);
		}

	}

}
