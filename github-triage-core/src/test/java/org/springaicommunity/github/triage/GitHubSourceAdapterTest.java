package org.springaicommunity.github.triage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.triage.TestRecords.*;

/**
 * Unit tests for {@link GitHubSourceAdapter} against an in-memory GitHub that answers
 * search queries from a fixed set of items.
 */
@DisplayName("GitHubSourceAdapter Tests")
class GitHubSourceAdapterTest {

	private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

	private static final Instant END = Instant.parse("2025-01-08T00:00:00Z");

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private FakeGitHub github;

	@BeforeEach
	void setUp() {
		github = new FakeGitHub(objectMapper);
	}

	private List<Integer> fetchNumbers(GitHubSourceAdapter adapter) {
		return adapter.fetch(REPOSITORY, Set.of(ItemType.ISSUE), START, END)
			.stream()
			.map(node -> node.path("number").asInt())
			.toList();
	}

	@Test
	@DisplayName("Should reject a non-positive query cap")
	void shouldRejectInvalidCap() {
		assertThatThrownBy(() -> new GitHubSourceAdapter(github, objectMapper, 0))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Nested
	@DisplayName("Search")
	class SearchTest {

		@Test
		@DisplayName("Should page through every result")
		void shouldPaginate() {
			github.pageSize = 2;
			for (int n = 1; n <= 5; n++) {
				github.items.add(raw(n, "Issue " + n, "2025-01-0" + (n + 1) + "T10:00:00Z"));
			}

			assertThat(fetchNumbers(new GitHubSourceAdapter(github, objectMapper)))
				.containsExactlyInAnyOrder(1, 2, 3, 4, 5);
			assertThat(github.searchRequests).isEqualTo(3);
		}

		@Test
		@DisplayName("Should include the window start and exclude the window end")
		void shouldApplyHalfOpenWindow() {
			github.items.add(raw(1, "At start", "2025-01-01T00:00:00Z"));
			github.items.add(raw(2, "At end", "2025-01-08T00:00:00Z"));

			assertThat(fetchNumbers(new GitHubSourceAdapter(github, objectMapper))).containsExactly(1);
		}

		@Test
		@DisplayName("Should split ranges with too many results")
		void shouldSplitLargeRanges() {
			for (int n = 1; n <= 6; n++) {
				github.items.add(raw(n, "Issue " + n, "2025-01-0" + (n + 1) + "T12:00:00Z"));
			}

			List<Integer> numbers = fetchNumbers(new GitHubSourceAdapter(github, objectMapper, 2));

			assertThat(numbers).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6);
			assertThat(github.countRequests).isGreaterThan(1);
			assertThat(github.largestSearchResult).isLessThanOrEqualTo(2);
		}

		@Test
		@DisplayName("Should build an inclusive, second-granular search qualifier")
		void shouldBuildSearchQualifier() {
			assertThat(GitHubSourceAdapter.searchQuery(REPOSITORY, ItemType.ISSUE, START, END))
				.isEqualTo("repo:owner/repo is:issue updated:2025-01-01T00:00:00Z..2025-01-08T00:00:00Z");
			assertThat(GitHubSourceAdapter.searchQuery(REPOSITORY, ItemType.PULL_REQUEST, START,
					Instant.parse("2025-01-08T00:00:00.250Z")))
				.endsWith("is:pr updated:2025-01-01T00:00:00Z..2025-01-08T00:00:01Z");
		}

	}

	@Nested
	@DisplayName("Comment completion")
	class CommentCompletionTest {

		@Test
		@DisplayName("Should fetch the remaining comments through REST")
		void shouldCompleteComments() {
			ObjectNode item = addComment(raw(7, "Busy issue", "2025-01-03T00:00:00Z"), "first", "first comment");
			((ObjectNode) item.path("comments")).put("totalCount", 102);
			github.items.add(item);
			github.restComments = 102;

			List<JsonNode> nodes = new GitHubSourceAdapter(github, objectMapper).fetch(REPOSITORY,
					Set.of(ItemType.ISSUE), START, END);

			JsonNode comments = nodes.get(0).path("comments").path("nodes");
			assertThat(comments).hasSize(102);
			assertThat(comments.get(0).path("id").asText()).isEqualTo("IC_0");
			assertThat(comments.get(0).path("author").path("login").asText()).isEqualTo("bob");
			assertThat(comments.get(0).path("reactionGroups").get(0).path("content").asText()).isEqualTo("+1");
			assertThat(github.restPaths).containsExactly("/repos/owner/repo/issues/7/comments?per_page=100&page=1",
					"/repos/owner/repo/issues/7/comments?per_page=100&page=2");

			IssueRecord record = new IssueRecordParser(REPOSITORY).parse(nodes.get(0));
			assertThat(record.comments()).hasSize(102);
			assertThat(record.comments().get(0).reactions().positive()).isEqualTo(2);
		}

	}

	@Nested
	@DisplayName("Failures")
	class FailureTest {

		@Test
		@DisplayName("Should report rejected credentials as an authentication failure")
		void shouldTranslateAuthenticationError() {
			github.failure = new GitHubHttpClient.GitHubApiException("Bad credentials", 401, "{}");

			assertThatThrownBy(() -> fetchNumbers(new GitHubSourceAdapter(github, objectMapper)))
				.isInstanceOf(SourceAuthenticationException.class);
		}

		@Test
		@DisplayName("Should report other API errors as an unavailable source")
		void shouldTranslateApiError() {
			github.failure = new GitHubHttpClient.GitHubApiException("Server Error", 502, "");

			assertThatThrownBy(() -> fetchNumbers(new GitHubSourceAdapter(github, objectMapper)))
				.isInstanceOf(SourceUnavailableException.class)
				.hasMessageContaining("issues of owner/repo");
		}

		@Test
		@DisplayName("Should fail on GraphQL errors without data")
		void shouldFailOnGraphQLErrors() {
			github.rawResponse = "{\"errors\":[{\"message\":\"Something went wrong\"}]}";

			assertThatThrownBy(() -> fetchNumbers(new GitHubSourceAdapter(github, objectMapper)))
				.isInstanceOf(SourceUnavailableException.class)
				.hasMessageContaining("Something went wrong");
		}

		@Test
		@DisplayName("Should fail on unparseable responses")
		void shouldFailOnUnparseableResponse() {
			github.rawResponse = "<html>";

			assertThatThrownBy(() -> fetchNumbers(new GitHubSourceAdapter(github, objectMapper)))
				.isInstanceOf(SourceUnavailableException.class)
				.hasMessageContaining("Unparseable");
		}

	}

	/**
	 * Answers count and search queries by filtering {@link #items} on the
	 * {@code updated:from..to} qualifier, inclusive on both ends like GitHub.
	 */
	static class FakeGitHub implements GitHubClient {

		private static final Pattern UPDATED = Pattern.compile("updated:(\\S+)\\.\\.(\\S+)");

		private final ObjectMapper objectMapper;

		final List<ObjectNode> items = new ArrayList<>();

		final List<String> restPaths = new ArrayList<>();

		int pageSize = 100;

		int restComments;

		int countRequests;

		int searchRequests;

		int largestSearchResult;

		GitHubHttpClient.GitHubApiException failure;

		String rawResponse;

		FakeGitHub(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
		}

		@Override
		public String postGraphQL(String body) {
			if (failure != null) {
				throw failure;
			}
			if (rawResponse != null) {
				return rawResponse;
			}
			JsonNode variables = readTree(body).path("variables");
			List<ObjectNode> matching = matching(variables.path("query").asText());
			ObjectNode response = objectMapper.createObjectNode();
			ObjectNode search = response.putObject("data").putObject("search");
			search.put("issueCount", matching.size());
			if (!variables.has("first")) {
				countRequests++;
				return response.toString();
			}
			searchRequests++;
			largestSearchResult = Math.max(largestSearchResult, matching.size());
			int from = variables.path("after").isNull() ? 0 : Integer.parseInt(variables.path("after").asText());
			int to = Math.min(from + pageSize, matching.size());
			ArrayNode nodes = search.putArray("nodes");
			matching.subList(from, to).forEach(item -> nodes.add(item.deepCopy()));
			ObjectNode pageInfo = search.putObject("pageInfo");
			pageInfo.put("hasNextPage", to < matching.size());
			pageInfo.put("endCursor", String.valueOf(to));
			return response.toString();
		}

		@Override
		public String get(String path) {
			restPaths.add(path);
			int page = Integer.parseInt(path.substring(path.lastIndexOf('=') + 1));
			ArrayNode comments = objectMapper.createArrayNode();
			for (int i = (page - 1) * 100; i < Math.min(page * 100, restComments); i++) {
				ObjectNode comment = comments.addObject();
				comment.put("id", 1000 + i);
				comment.put("node_id", "IC_" + i);
				comment.put("body", "comment " + i);
				comment.put("created_at", "2025-01-02T00:00:00Z");
				comment.putObject("user").put("login", "bob");
				ObjectNode reactions = comment.putObject("reactions");
				reactions.put("total_count", 3);
				reactions.put("+1", 2);
				reactions.put("eyes", 1);
				reactions.put("url", "https://api.github.com/reactions");
			}
			return comments.toString();
		}

		private List<ObjectNode> matching(String query) {
			Matcher matcher = UPDATED.matcher(query);
			if (!matcher.find()) {
				throw new IllegalArgumentException("No updated qualifier in " + query);
			}
			Instant from = Instant.parse(matcher.group(1));
			Instant to = Instant.parse(matcher.group(2));
			Map<Integer, ObjectNode> byNumber = new HashMap<>();
			for (ObjectNode item : items) {
				Instant updated = Instant.parse(item.path("updatedAt").asText());
				if (!updated.isBefore(from) && !updated.isAfter(to)) {
					byNumber.put(item.path("number").asInt(), item);
				}
			}
			return byNumber.values()
				.stream()
				.sorted(Comparator.comparingInt(item -> item.path("number").asInt()))
				.toList();
		}

		private JsonNode readTree(String body) {
			try {
				return objectMapper.readTree(body);
			}
			catch (JsonProcessingException e) {
				throw new IllegalArgumentException(e);
			}
		}

	}

}
