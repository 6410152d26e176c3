package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The full set of records of one collection together with its fetch checkpoints. Both
 * are persisted in one atomic write.
 *
 * <p>
 * Instances are immutable; every change produces a new collection. Records are kept
 * sorted by number, which makes the serialized form deterministic.
 *
 * @param key the collection key
 * @param checkpoints one checkpoint per item type that has been fetched
 * @param records the records, unique by number
 */
public record IssueCollection(CollectionKey key, List<FetchCheckpoint> checkpoints, List<IssueRecord> records) {

	public IssueCollection {
		Set<Integer> seen = new HashSet<>();
		for (IssueRecord record : records) {
			if (!seen.add(record.number())) {
				throw new IllegalArgumentException("Duplicate issue number in collection " + key + ": " + record.number());
			}
		}
		records = records.stream().sorted(Comparator.comparingInt(IssueRecord::number)).toList();
		checkpoints = checkpoints.stream().sorted(Comparator.comparing(FetchCheckpoint::itemType)).toList();
	}

	public static IssueCollection empty(CollectionKey key) {
		return new IssueCollection(key, List.of(), List.of());
	}

	public int size() {
		return records.size();
	}

	public Optional<IssueRecord> find(int number) {
		return records.stream().filter(r -> r.number() == number).findFirst();
	}

	/**
	 * Records keyed by number, in ascending order.
	 */
	public Map<Integer, IssueRecord> byNumber() {
		Map<Integer, IssueRecord> map = new LinkedHashMap<>();
		records.forEach(r -> map.put(r.number(), r));
		return map;
	}

	public Optional<FetchCheckpoint> checkpoint(ItemType itemType) {
		return checkpoints.stream().filter(c -> c.itemType() == itemType).findFirst();
	}

	/**
	 * The stored checkpoint for an item type, or a fresh one starting at
	 * {@code defaultStart}.
	 */
	public FetchCheckpoint checkpointOrInitial(ItemType itemType, LocalDate defaultStart) {
		return checkpoint(itemType).orElseGet(() -> FetchCheckpoint.initial(itemType, defaultStart));
	}

	public IssueCollection withRecords(List<IssueRecord> newRecords) {
		return new IssueCollection(key, checkpoints, newRecords);
	}

	public IssueCollection withCheckpoint(FetchCheckpoint checkpoint) {
		List<FetchCheckpoint> updated = new ArrayList<>();
		for (FetchCheckpoint existing : checkpoints) {
			if (existing.itemType() != checkpoint.itemType()) {
				updated.add(existing);
			}
		}
		updated.add(checkpoint);
		return new IssueCollection(key, updated, records);
	}

	/**
	 * Replace (or add) a single record.
	 */
	public IssueCollection withRecord(IssueRecord record) {
		Map<Integer, IssueRecord> map = byNumber();
		map.put(record.number(), record);
		return withRecords(new ArrayList<>(map.values()));
	}

	/**
	 * Remove records by number. Unknown numbers are ignored.
	 */
	public IssueCollection without(Set<Integer> numbers) {
		return withRecords(records.stream().filter(r -> !numbers.contains(r.number())).toList());
	}

	public @Nullable IssueRecord get(int number) {
		return find(number).orElse(null);
	}

}
