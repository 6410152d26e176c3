package org.springaicommunity.github.triage;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Symmetric adjacency of issue references: if #1 mentions #2, each is linked to the
 * other. Rebuilt from the records whenever they change.
 */
public final class CrossReferenceGraph {

	private final Map<Integer, SortedSet<Integer>> links;

	private CrossReferenceGraph(Map<Integer, SortedSet<Integer>> links) {
		this.links = links;
	}

	public static CrossReferenceGraph build(Collection<IssueRecord> records) {
		Map<Integer, SortedSet<Integer>> links = new HashMap<>();
		for (IssueRecord record : records) {
			for (int reference : record.references()) {
				if (reference != record.number()) {
					links.computeIfAbsent(record.number(), n -> new TreeSet<>()).add(reference);
					links.computeIfAbsent(reference, n -> new TreeSet<>()).add(record.number());
				}
			}
		}
		links.replaceAll((number, set) -> Collections.unmodifiableSortedSet(set));
		return new CrossReferenceGraph(links);
	}

	/**
	 * Numbers linked to {@code number} in either direction, ascending.
	 */
	public SortedSet<Integer> linkedTo(int number) {
		return links.getOrDefault(number, Collections.emptySortedSet());
	}

	public int edgeCount() {
		return links.values().stream().mapToInt(SortedSet::size).sum() / 2;
	}

}
