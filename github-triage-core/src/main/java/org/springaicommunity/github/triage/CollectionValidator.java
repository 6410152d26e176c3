package org.springaicommunity.github.triage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the records of a collection for inconsistencies that enrichment or queries
 * would trip over.
 *
 * <p>
 * Embeddings are expected to share the dimension of the similarity index, which is the
 * dimension of the lowest-numbered embedded record.
 */
public class CollectionValidator {

	private static final Logger logger = LoggerFactory.getLogger(CollectionValidator.class);

	public ValidationResult validate(IssueCollection collection) {
		SimilarityIndex index = SimilarityIndex.build(collection.records());
		List<ValidationResult.Problem> problems = new ArrayList<>();

		for (IssueRecord record : collection.records()) {
			int number = record.number();
			if (record.title().isBlank()) {
				problems.add(problem(number, ValidationResult.Check.MISSING_TITLE, "title is blank"));
			}
			if (record.url().isBlank()) {
				problems.add(problem(number, ValidationResult.Check.MISSING_URL, "url is blank"));
			}
			MetricBundle metrics = record.metrics();
			if (metrics != null && metrics.commentCount() != record.comments().size()) {
				problems.add(problem(number, ValidationResult.Check.COMMENT_COUNT_MISMATCH, "metrics count "
						+ metrics.commentCount() + " comments, record has " + record.comments().size()));
			}
			if (record.references().contains(number)) {
				problems.add(problem(number, ValidationResult.Check.SELF_REFERENCE, "references itself"));
			}
			List<Double> embedding = record.embedding();
			if (embedding != null && index.size() > 0 && embedding.size() != index.dimension()) {
				problems.add(problem(number, ValidationResult.Check.EMBEDDING_DIMENSION,
						"embedding has " + embedding.size() + " dimensions, expected " + index.dimension()));
			}
			if (metrics == null && !record.quartiles().isEmpty()) {
				problems.add(problem(number, ValidationResult.Check.QUARTILES_WITHOUT_METRICS,
						"has quartile labels but no metrics"));
			}
		}

		ValidationResult result = new ValidationResult(collection.key(), collection.size(), problems);
		if (result.passed()) {
			logger.info("Validated {} records of {}: no problems", collection.size(), collection.key());
		}
		else {
			logger.warn("Validated {} records of {}: {} problems in {} records", collection.size(),
					collection.key(), problems.size(), result.invalidNumbers().size());
		}
		return result;
	}

	private static ValidationResult.Problem problem(int number, ValidationResult.Check check, String detail) {
		return new ValidationResult.Problem(number, check, detail);
	}

}
