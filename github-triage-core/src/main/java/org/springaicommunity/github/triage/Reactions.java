package org.springaicommunity.github.triage;

/**
 * Reaction counts on an issue body or a comment, folded into positive, negative and
 * neutral buckets.
 *
 * <p>
 * GitHub reaction groups map as follows: THUMBS_UP, HEART, HOORAY, ROCKET and LAUGH are
 * positive; THUMBS_DOWN and CONFUSED are negative; EYES is neutral.
 *
 * @param positive number of positive reactions
 * @param negative number of negative reactions
 * @param neutral number of neutral reactions
 */
public record Reactions(int positive, int negative, int neutral) {

	public static final Reactions NONE = new Reactions(0, 0, 0);

	public Reactions {
		if (positive < 0 || negative < 0 || neutral < 0) {
			throw new IllegalArgumentException("Reaction counts must not be negative");
		}
	}

	/**
	 * Returns the total number of reactions of any kind.
	 * @return positive + negative + neutral
	 */
	public int total() {
		return positive + negative + neutral;
	}

	/**
	 * Add another set of reaction counts to this one.
	 * @param other the counts to add
	 * @return the summed counts
	 */
	public Reactions plus(Reactions other) {
		return new Reactions(positive + other.positive, negative + other.negative, neutral + other.neutral);
	}

	/**
	 * Classify a GitHub reaction content name and add {@code count} to the matching
	 * bucket.
	 * @param content reaction content, e.g. "THUMBS_UP"
	 * @param count number of users who reacted
	 * @return updated counts
	 */
	public Reactions withReaction(String content, int count) {
		return switch (content.toUpperCase()) {
			case "THUMBS_UP", "+1", "HEART", "HOORAY", "ROCKET", "LAUGH" ->
				new Reactions(positive + count, negative, neutral);
			case "THUMBS_DOWN", "-1", "CONFUSED" -> new Reactions(positive, negative + count, neutral);
			default -> new Reactions(positive, negative, neutral + count);
		};
	}

}
