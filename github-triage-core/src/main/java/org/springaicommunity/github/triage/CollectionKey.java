package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Identifies a collection: a repository plus an optional prefix that isolates, for
 * example, test data from production data.
 *
 * @param repository repository in "owner/repo" format
 * @param prefix optional collection prefix, null for the default collection
 */
public record CollectionKey(String repository, @Nullable String prefix) {

	private static final Pattern REPOSITORY_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$");

	private static final Pattern PREFIX_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");

	public CollectionKey {
		if (repository == null || !REPOSITORY_PATTERN.matcher(repository).matches()) {
			throw new IllegalArgumentException(
					"Repository must be in format 'owner/repo' (e.g., 'jupyterlab/jupyterlab'), got: " + repository);
		}
		if (prefix != null && prefix.isBlank()) {
			prefix = null;
		}
		if (prefix != null && !PREFIX_PATTERN.matcher(prefix).matches()) {
			throw new IllegalArgumentException("Prefix may only contain letters, digits, '-' and '_', got: " + prefix);
		}
	}

	public static CollectionKey of(String repository) {
		return new CollectionKey(repository, null);
	}

	public String owner() {
		return repository.substring(0, repository.indexOf('/'));
	}

	public String name() {
		return repository.substring(repository.indexOf('/') + 1);
	}

	/**
	 * Directory name of this collection below the owner directory.
	 * @return "repo" or "repo--prefix"
	 */
	public String directoryName() {
		return prefix == null ? name() : name() + "--" + prefix;
	}

	@Override
	public String toString() {
		return prefix == null ? repository : repository + " [" + prefix + "]";
	}

}
