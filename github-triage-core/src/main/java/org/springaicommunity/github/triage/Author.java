package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

/**
 * Represents the GitHub user who wrote an issue, pull request or comment.
 *
 * @param login the GitHub login ("ghost" when the account was deleted)
 * @param name the display name, if the upstream payload carried one
 */
public record Author(String login, @Nullable String name) {

	/**
	 * Placeholder for items whose author is no longer available upstream.
	 */
	public static final Author GHOST = new Author("ghost", null);

}
