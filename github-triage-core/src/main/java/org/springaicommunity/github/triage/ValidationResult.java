package org.springaicommunity.github.triage;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Results of validating a collection.
 *
 * @param key the validated collection
 * @param recordsScanned number of records checked
 * @param problems every problem found, in record order
 */
public record ValidationResult(CollectionKey key, int recordsScanned, List<Problem> problems) {

	public ValidationResult {
		problems = List.copyOf(problems);
	}

	/**
	 * Returns true if no record has a problem.
	 */
	public boolean passed() {
		return problems.isEmpty();
	}

	/**
	 * Numbers of the records with at least one problem, ascending.
	 */
	public Set<Integer> invalidNumbers() {
		Set<Integer> numbers = new TreeSet<>();
		problems.forEach(p -> numbers.add(p.number()));
		return numbers;
	}

	/**
	 * A single problem with a record.
	 *
	 * @param number the issue number
	 * @param check the check that failed
	 * @param detail human-readable description
	 */
	public record Problem(int number, Check check, String detail) {
	}

	public enum Check {

		MISSING_TITLE, MISSING_URL, COMMENT_COUNT_MISMATCH, SELF_REFERENCE, EMBEDDING_DIMENSION,
		QUARTILES_WITHOUT_METRICS

	}

}
