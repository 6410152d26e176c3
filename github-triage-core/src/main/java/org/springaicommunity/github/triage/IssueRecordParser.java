package org.springaicommunity.github.triage;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns raw upstream records (GraphQL node shape) into {@link IssueRecord}s.
 *
 * <p>
 * All JSON handling for upstream data happens here, at the merge boundary. A record
 * without a positive {@code number} or with a missing or unparseable {@code createdAt} /
 * {@code updatedAt} is rejected as a whole with a {@link MalformedRecordException}.
 * Optional parts (author, labels, reactions) fall back to empty values.
 */
public class IssueRecordParser {

	private final ReferenceExtractor referenceExtractor;

	/**
	 * @param repository the repository the records belong to, used to resolve references
	 */
	public IssueRecordParser(String repository) {
		this.referenceExtractor = new ReferenceExtractor(repository);
	}

	public IssueRecord parse(JsonNode node) {
		if (node == null || !node.isObject()) {
			throw new MalformedRecordException("Record is not a JSON object: " + node);
		}
		JsonNode numberNode = node.path("number");
		if (!numberNode.canConvertToInt() || !numberNode.isIntegralNumber() || numberNode.asInt() <= 0) {
			throw new MalformedRecordException("Record has no valid number: " + numberNode);
		}
		int number = numberNode.asInt();
		Instant createdAt = requireInstant(node, "createdAt", number);
		Instant updatedAt = requireInstant(node, "updatedAt", number);

		ItemType type = "PullRequest".equals(node.path("__typename").asText()) ? ItemType.PULL_REQUEST
				: ItemType.ISSUE;
		IssueState state;
		try {
			state = IssueState.parse(node.path("state").asText("OPEN"));
		}
		catch (IllegalArgumentException e) {
			throw new MalformedRecordException("Issue #" + number + " has unknown state: " + node.path("state"), e);
		}

		String body = textOrNull(node.path("body"));
		List<Comment> comments = parseComments(node.path("comments").path("nodes"), number);

		List<@Nullable String> texts = new ArrayList<>();
		texts.add(body);
		comments.forEach(c -> texts.add(c.body()));
		Set<Integer> references = referenceExtractor.extract(texts);
		for (JsonNode event : node.path("timelineItems").path("nodes")) {
			JsonNode source = event.path("source");
			if (referenceExtractor.isSameRepository(source.path("repository").path("nameWithOwner").asText(null))
					&& source.path("number").asInt(0) > 0) {
				references.add(source.path("number").asInt());
			}
		}
		references.remove(number);

		return IssueRecord.fromSource(number, type, node.path("title").asText(""), body, state,
				node.path("url").asText(""), parseAuthor(node.path("author")), parseLabels(node.path("labels")),
				parseAssignees(node.path("assignees")), createdAt, updatedAt,
				parseReactions(node.path("reactionGroups")), comments, new ArrayList<>(references));
	}

	private List<Comment> parseComments(JsonNode nodes, int number) {
		List<Comment> comments = new ArrayList<>();
		int index = 0;
		for (JsonNode node : nodes) {
			String id = node.path("id").asText("");
			if (id.isEmpty()) {
				id = number + "-" + index;
			}
			comments.add(new Comment(id, parseAuthor(node.path("author")), node.path("body").asText(""),
					requireInstant(node, "createdAt", number), parseReactions(node.path("reactionGroups"))));
			index++;
		}
		return comments;
	}

	private Author parseAuthor(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return Author.GHOST;
		}
		return new Author(node.path("login").asText(Author.GHOST.login()), textOrNull(node.path("name")));
	}

	private List<Label> parseLabels(JsonNode labels) {
		List<Label> result = new ArrayList<>();
		for (JsonNode node : labels.path("nodes")) {
			String name = node.path("name").asText("");
			if (!name.isEmpty()) {
				result.add(new Label(name, textOrNull(node.path("color"))));
			}
		}
		return result;
	}

	private List<String> parseAssignees(JsonNode assignees) {
		List<String> result = new ArrayList<>();
		for (JsonNode node : assignees.path("nodes")) {
			String login = node.path("login").asText("");
			if (!login.isEmpty()) {
				result.add(login);
			}
		}
		return result;
	}

	private Reactions parseReactions(JsonNode groups) {
		Reactions reactions = Reactions.NONE;
		for (JsonNode group : groups) {
			JsonNode counter = group.has("reactors") ? group.path("reactors") : group.path("users");
			int count = counter.path("totalCount").asInt(0);
			if (count > 0) {
				reactions = reactions.withReaction(group.path("content").asText(""), count);
			}
		}
		return reactions;
	}

	private static Instant requireInstant(JsonNode node, String field, int number) {
		String value = node.path(field).asText("");
		if (value.isEmpty()) {
			throw new MalformedRecordException("Issue #" + number + " has no " + field);
		}
		try {
			return Instant.parse(value);
		}
		catch (DateTimeParseException e) {
			throw new MalformedRecordException("Issue #" + number + " has invalid " + field + ": " + value, e);
		}
	}

	private static @Nullable String textOrNull(JsonNode node) {
		return node.isTextual() ? node.asText() : null;
	}

}
