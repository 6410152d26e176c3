package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds same-repository issue references in free text: {@code #123},
 * {@code owner/repo#123} and full {@code https://github.com/owner/repo/issues/123} or
 * {@code .../pull/123} links. References to other repositories are ignored.
 */
public class ReferenceExtractor {

	private static final Pattern SHORT_REFERENCE = Pattern
		.compile("(?<![\\w/#&])(?:([\\w.-]+/[\\w.-]+))?#(\\d{1,9})\\b");

	private static final Pattern URL_REFERENCE = Pattern
		.compile("https?://github\\.com/([\\w.-]+/[\\w.-]+)/(?:issues|pull)/(\\d{1,9})\\b");

	private final String repository;

	/**
	 * @param repository the repository references must point into, "owner/repo"
	 */
	public ReferenceExtractor(String repository) {
		this.repository = repository;
	}

	/**
	 * Extract referenced numbers from several texts.
	 * @param texts body and comment texts, null entries are skipped
	 * @return sorted, distinct issue numbers
	 */
	public Set<Integer> extract(Collection<@Nullable String> texts) {
		Set<Integer> numbers = new TreeSet<>();
		for (String text : texts) {
			if (text != null && !text.isEmpty()) {
				collect(URL_REFERENCE.matcher(text), numbers, true);
				collect(SHORT_REFERENCE.matcher(text), numbers, false);
			}
		}
		return numbers;
	}

	private void collect(Matcher matcher, Set<Integer> numbers, boolean repositoryRequired) {
		while (matcher.find()) {
			String repo = matcher.group(1);
			boolean sameRepository = repo == null ? !repositoryRequired : repo.equalsIgnoreCase(repository);
			if (sameRepository) {
				int number = Integer.parseInt(matcher.group(2));
				if (number > 0) {
					numbers.add(number);
				}
			}
		}
	}

	public boolean isSameRepository(@Nullable String nameWithOwner) {
		return nameWithOwner != null && nameWithOwner.equalsIgnoreCase(repository);
	}

}
