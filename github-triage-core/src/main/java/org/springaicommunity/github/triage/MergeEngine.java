package org.springaicommunity.github.triage;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges fetched deltas into a collection, keyed by issue number.
 *
 * <p>
 * For each incoming record: absent numbers are inserted; present numbers are replaced
 * only when the incoming {@code updatedAt} is strictly newer, and the replacement keeps
 * the locally derived fields (embedding, metrics, quartiles, summary, recommendations);
 * anything else is a no-op. Merging the same batch twice therefore yields the same
 * collection, and batches may arrive in any order.
 */
public class MergeEngine {

	private static final Logger logger = LoggerFactory.getLogger(MergeEngine.class);

	/**
	 * Parse and merge a batch of raw upstream records.
	 * @param collection the current collection, not modified
	 * @param batch raw records as returned by a {@link SourceAdapter}
	 * @return the merge outcome
	 */
	public MergeResult merge(IssueCollection collection, List<JsonNode> batch) {
		IssueRecordParser parser = new IssueRecordParser(collection.key().repository());
		List<IssueRecord> parsed = new ArrayList<>(batch.size());
		int rejected = 0;
		for (JsonNode raw : batch) {
			try {
				parsed.add(parser.parse(raw));
			}
			catch (MalformedRecordException e) {
				rejected++;
				logger.warn("Skipping malformed record in {}: {}", collection.key(), e.getMessage());
			}
		}
		return mergeRecords(collection, parsed, rejected);
	}

	/**
	 * Merge already parsed records.
	 * @param collection the current collection, not modified
	 * @param incoming parsed records; duplicates within the batch resolve to the newest
	 * @return the merge outcome with no rejections
	 */
	public MergeResult mergeRecords(IssueCollection collection, List<IssueRecord> incoming) {
		return mergeRecords(collection, incoming, 0);
	}

	private MergeResult mergeRecords(IssueCollection collection, List<IssueRecord> incoming, int rejected) {
		Map<Integer, IssueRecord> records = collection.byNumber();
		Set<Integer> inserted = new HashSet<>();
		Set<Integer> updated = new HashSet<>();
		Set<Integer> contentChanged = new HashSet<>();
		Map<Integer, IssueRecord> original = new LinkedHashMap<>(records);

		for (IssueRecord record : incoming) {
			IssueRecord existing = records.get(record.number());
			if (existing == null) {
				records.put(record.number(), record);
				inserted.add(record.number());
				contentChanged.add(record.number());
			}
			else if (record.updatedAt().isAfter(existing.updatedAt())) {
				records.put(record.number(), existing.withSourceFieldsOf(record));
				if (!inserted.contains(record.number())) {
					updated.add(record.number());
					IssueRecord before = original.get(record.number());
					if (before != null && before.contentDiffers(record)) {
						contentChanged.add(record.number());
					}
				}
			}
		}

		if (inserted.isEmpty() && updated.isEmpty()) {
			logger.debug("Merged {} records into {}: no changes", incoming.size(), collection.key());
			return new MergeResult(collection, inserted, updated, contentChanged, rejected);
		}
		logger.debug("Merged {} records into {}: {} inserted, {} updated, {} content changed", incoming.size(),
				collection.key(), inserted.size(), updated.size(), contentChanged.size());
		return new MergeResult(collection.withRecords(new ArrayList<>(records.values())), inserted, updated,
				contentChanged, rejected);
	}

}
