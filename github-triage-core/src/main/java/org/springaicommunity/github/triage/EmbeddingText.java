package org.springaicommunity.github.triage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds the text an issue is embedded from, and its content address. The address is
 * taken over the sanitized payload, so texts differing only in whitespace or control
 * characters share one cache entry.
 *
 * <p>
 * The text is the title, the body (truncated to {@value #MAX_BODY_LENGTH} characters)
 * and the comment bodies (up to {@value #MAX_COMMENTS_LENGTH} characters in total), one
 * per line. Before it is sent to a provider it is sanitized: control characters become
 * spaces, whitespace runs collapse and the result is capped at
 * {@value #MAX_PAYLOAD_LENGTH} characters.
 */
public final class EmbeddingText {

	static final int MAX_BODY_LENGTH = 15_000;

	static final int MAX_COMMENTS_LENGTH = 8_000;

	static final int MAX_PAYLOAD_LENGTH = 50_000;

	private EmbeddingText() {
	}

	/**
	 * The raw embedding text of a record.
	 */
	public static String of(IssueRecord record) {
		StringBuilder text = new StringBuilder(record.title()).append('\n');
		String body = record.body() == null ? "" : record.body();
		if (body.length() > MAX_BODY_LENGTH) {
			body = body.substring(0, MAX_BODY_LENGTH) + "... [truncated]";
		}
		text.append(body).append('\n');

		int commentsLength = 0;
		StringBuilder comments = new StringBuilder();
		for (Comment comment : record.comments()) {
			if (commentsLength + comment.body().length() > MAX_COMMENTS_LENGTH) {
				comments.append("[... more comments truncated]");
				break;
			}
			comments.append(comment.body()).append('\n');
			commentsLength += comment.body().length();
		}
		text.append(comments);
		return text.toString().strip();
	}

	/**
	 * Make text safe for an embedding API request.
	 * @param content raw text
	 * @return sanitized, whitespace-normalized text
	 */
	public static String sanitize(String content) {
		StringBuilder cleaned = new StringBuilder(content.length());
		for (int i = 0; i < content.length(); i++) {
			char c = content.charAt(i);
			if (c == '\0' || c == '\uFEFF') {
				continue;
			}
			cleaned.append(c < 32 ? ' ' : c);
		}
		String sanitized = cleaned.toString().strip().replaceAll("\\s+", " ");
		if (sanitized.length() > MAX_PAYLOAD_LENGTH) {
			sanitized = sanitized.substring(0, MAX_PAYLOAD_LENGTH) + "...";
		}
		return sanitized;
	}

	/**
	 * Content address of a text for a model: {@code model + ":" + sha256(content)}.
	 */
	public static String key(String model, String content) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return model + ":" + HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

	/**
	 * The sanitized text sent to the provider for a record.
	 */
	public static String payload(IssueRecord record) {
		return sanitize(of(record));
	}

	/**
	 * Content address of a record's current payload.
	 */
	public static String key(String model, IssueRecord record) {
		return key(model, payload(record));
	}

	/**
	 * Whether a record's stored embedding was computed from its current payload. The
	 * model is taken from the stored key, so no provider is needed to tell.
	 */
	public static boolean isCurrent(IssueRecord record) {
		String stored = record.embeddingKey();
		if (!record.hasEmbedding() || stored == null) {
			return false;
		}
		int separator = stored.lastIndexOf(':');
		return separator > 0 && key(stored.substring(0, separator), record).equals(stored);
	}

}
