package org.springaicommunity.github.triage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link SourceAdapter} backed by the GitHub GraphQL search API.
 *
 * <p>
 * Each item type is searched with {@code repo:owner/repo is:issue updated:start..end}
 * and paged with cursors, 100 items per page. The search API caps every query at 1,000
 * results, so a range whose count exceeds {@code maxPerQuery} is split in half
 * recursively. Items with more comments than the first GraphQL page are completed
 * through the REST comments endpoint.
 *
 * <p>
 * The returned nodes keep the GraphQL shape ({@code createdAt}, {@code reactionGroups},
 * {@code comments.nodes}, ...) and are parsed by {@link IssueRecordParser}.
 */
public class GitHubSourceAdapter implements SourceAdapter {

	private static final Logger logger = LoggerFactory.getLogger(GitHubSourceAdapter.class);

	/**
	 * Default maximum items per search query (safety margin below the 1,000 hard cap).
	 */
	public static final int DEFAULT_MAX_PER_QUERY = 900;

	private static final int PAGE_SIZE = 100;

	private static final Duration MIN_SPLIT = Duration.ofMinutes(1);

	private static final String ITEM_FIELDS = """
			__typename
			number
			title
			body
			state
			url
			createdAt
			updatedAt
			author { login ... on User { name } }
			labels(first: 50) { nodes { name color } }
			assignees(first: 20) { nodes { login } }
			reactionGroups { content reactors { totalCount } }
			comments(first: 100) {
			    totalCount
			    nodes {
			        id
			        body
			        createdAt
			        author { login ... on User { name } }
			        reactionGroups { content reactors { totalCount } }
			    }
			}
			timelineItems(first: 100, itemTypes: [CROSS_REFERENCED_EVENT]) {
			    nodes {
			        ... on CrossReferencedEvent {
			            source {
			                ... on Issue { number repository { nameWithOwner } }
			                ... on PullRequest { number repository { nameWithOwner } }
			            }
			        }
			    }
			}
			""";

	private static final String SEARCH_QUERY = """
			query($query: String!, $first: Int!, $after: String) {
			    search(query: $query, type: ISSUE, first: $first, after: $after) {
			        issueCount
			        pageInfo { hasNextPage endCursor }
			        nodes {
			            ... on Issue { %s }
			            ... on PullRequest { %s }
			        }
			    }
			}
			""".formatted(ITEM_FIELDS, ITEM_FIELDS);

	private static final String COUNT_QUERY = """
			query($query: String!) {
			    search(query: $query, type: ISSUE, first: 1) { issueCount }
			}
			""";

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final int maxPerQuery;

	public GitHubSourceAdapter(GitHubClient client, ObjectMapper objectMapper) {
		this(client, objectMapper, DEFAULT_MAX_PER_QUERY);
	}

	public GitHubSourceAdapter(GitHubClient client, ObjectMapper objectMapper, int maxPerQuery) {
		if (maxPerQuery <= 0) {
			throw new IllegalArgumentException("maxPerQuery must be positive, got: " + maxPerQuery);
		}
		this.client = client;
		this.objectMapper = objectMapper;
		this.maxPerQuery = maxPerQuery;
	}

	@Override
	public List<JsonNode> fetch(String repository, Set<ItemType> itemTypes, Instant windowStart, Instant windowEnd) {
		List<JsonNode> items = new ArrayList<>();
		for (ItemType itemType : itemTypes) {
			try {
				fetchRange(repository, itemType, windowStart, windowEnd, items, 0);
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (e.isAuthenticationError()) {
					throw new SourceAuthenticationException("GitHub rejected the credentials for " + repository, e);
				}
				throw new SourceUnavailableException("Failed to fetch " + itemType.id() + " of " + repository
						+ " updated " + windowStart + " .. " + windowEnd + ": " + e.getMessage(), e);
			}
		}
		return items;
	}

	private void fetchRange(String repository, ItemType itemType, Instant start, Instant end, List<JsonNode> sink,
			int depth) {
		String searchQuery = searchQuery(repository, itemType, start, end);
		int count = execute(COUNT_QUERY, Map.of("query", searchQuery)).path("data")
			.path("search")
			.path("issueCount")
			.asInt(0);
		String indent = "  ".repeat(depth + 1);
		logger.debug("{}{} {} to {}: {} items", indent, itemType.id(), start, end, count);
		if (count == 0) {
			return;
		}
		if (count > maxPerQuery && Duration.between(start, end).compareTo(MIN_SPLIT.multipliedBy(2)) >= 0) {
			Instant mid = start.plus(Duration.between(start, end).dividedBy(2)).truncatedTo(ChronoUnit.SECONDS);
			logger.info("{}Splitting {} .. {} at {} ({} items > {})", indent, start, end, mid, count, maxPerQuery);
			fetchRange(repository, itemType, start, mid, sink, depth + 1);
			fetchRange(repository, itemType, mid, end, sink, depth + 1);
			return;
		}
		if (count > maxPerQuery) {
			logger.warn("{}Cannot split further ({} .. {}, {} items > {}); results may be truncated", indent, start,
					end, count, maxPerQuery);
		}
		paginate(repository, searchQuery, start, end, sink);
	}

	private void paginate(String repository, String searchQuery, Instant start, Instant end, List<JsonNode> sink) {
		@Nullable
		String cursor = null;
		do {
			Map<String, Object> variables = new HashMap<>();
			variables.put("query", searchQuery);
			variables.put("first", PAGE_SIZE);
			variables.put("after", cursor);
			JsonNode search = execute(SEARCH_QUERY, variables).path("data").path("search");

			for (JsonNode node : search.path("nodes")) {
				if (node.isObject() && node.has("number") && isWithin(node, start, end)) {
					completeComments(repository, (ObjectNode) node);
					sink.add(node);
				}
			}
			JsonNode pageInfo = search.path("pageInfo");
			cursor = pageInfo.path("hasNextPage").asBoolean(false) ? pageInfo.path("endCursor").asText(null) : null;
		}
		while (cursor != null);
	}

	/**
	 * The search qualifier is inclusive on both ends and second-granular, so the exact
	 * half-open window is enforced here.
	 */
	private boolean isWithin(JsonNode node, Instant start, Instant end) {
		String updatedAt = node.path("updatedAt").asText("");
		try {
			Instant updated = Instant.parse(updatedAt);
			return !updated.isBefore(start) && updated.isBefore(end);
		}
		catch (RuntimeException e) {
			// Let the parser reject it with a proper message
			return true;
		}
	}

	private void completeComments(String repository, ObjectNode node) {
		JsonNode comments = node.path("comments");
		int total = comments.path("totalCount").asInt(0);
		JsonNode nodes = comments.path("nodes");
		if (!nodes.isArray() || total <= nodes.size()) {
			return;
		}
		int number = node.path("number").asInt();
		logger.debug("Issue #{} has {} comments, fetching the rest through REST", number, total);
		ArrayNode all = objectMapper.createArrayNode();
		for (int page = 1;; page++) {
			JsonNode batch = readTree(
					client.get("/repos/" + repository + "/issues/" + number + "/comments?per_page=100&page=" + page));
			if (!batch.isArray() || batch.isEmpty()) {
				break;
			}
			batch.forEach(restComment -> all.add(toGraphQLComment(restComment)));
			if (batch.size() < PAGE_SIZE) {
				break;
			}
		}
		((ObjectNode) comments).set("nodes", all);
	}

	private ObjectNode toGraphQLComment(JsonNode restComment) {
		ObjectNode comment = objectMapper.createObjectNode();
		comment.put("id", restComment.path("node_id").asText(restComment.path("id").asText()));
		comment.put("body", restComment.path("body").asText(""));
		comment.put("createdAt", restComment.path("created_at").asText());
		ObjectNode author = comment.putObject("author");
		author.put("login", restComment.path("user").path("login").asText(Author.GHOST.login()));
		ArrayNode groups = comment.putArray("reactionGroups");
		restComment.path("reactions").fields().forEachRemaining(entry -> {
			if (entry.getValue().isInt() && !"total_count".equals(entry.getKey())) {
				ObjectNode group = groups.addObject();
				group.put("content", entry.getKey());
				group.putObject("reactors").put("totalCount", entry.getValue().asInt());
			}
		});
		return comment;
	}

	static String searchQuery(String repository, ItemType itemType, Instant start, Instant end) {
		Instant from = start.truncatedTo(ChronoUnit.SECONDS);
		Instant to = end.truncatedTo(ChronoUnit.SECONDS);
		if (to.isBefore(end)) {
			to = to.plusSeconds(1);
		}
		return "repo:" + repository + " " + itemType.searchQualifier() + " updated:" + from + ".." + to;
	}

	private JsonNode execute(String query, Map<String, ?> variables) {
		String requestBody;
		try {
			requestBody = objectMapper.writeValueAsString(Map.of("query", query, "variables", variables));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize GraphQL request", e);
		}
		JsonNode response = readTree(client.postGraphQL(requestBody));
		JsonNode errors = response.path("errors");
		if (errors.isArray() && !errors.isEmpty() && response.path("data").path("search").isMissingNode()) {
			throw new SourceUnavailableException("GraphQL errors: " + errors);
		}
		return response;
	}

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new SourceUnavailableException("Unparseable response from GitHub: " + e.getOriginalMessage(), e);
		}
	}

}
