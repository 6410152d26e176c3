package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.function.IntPredicate;

/**
 * Exact nearest-neighbour index over record embeddings, by cosine similarity.
 *
 * <p>
 * An index is an immutable snapshot built from a set of records; it is rebuilt, never
 * updated. Queries scan every vector and keep the best {@code k} in a bounded heap.
 * Results are ordered by similarity descending, ties by ascending issue number.
 * Records whose vector dimension differs from the first embedded record are left out.
 */
public final class SimilarityIndex {

	private static final Logger logger = LoggerFactory.getLogger(SimilarityIndex.class);

	private static final Comparator<Neighbor> BEST_FIRST = Comparator.comparingDouble(Neighbor::similarity)
		.reversed()
		.thenComparingInt(Neighbor::number);

	private static final SimilarityIndex EMPTY = new SimilarityIndex(new int[0], new double[0][], 0);

	private final int[] numbers;

	private final double[][] vectors;

	private final Map<Integer, Integer> positions;

	private final int dimension;

	private SimilarityIndex(int[] numbers, double[][] vectors, int dimension) {
		this.numbers = numbers;
		this.vectors = vectors;
		this.dimension = dimension;
		this.positions = new HashMap<>();
		for (int i = 0; i < numbers.length; i++) {
			positions.put(numbers[i], i);
		}
	}

	public static SimilarityIndex empty() {
		return EMPTY;
	}

	/**
	 * Build an index over the records that carry an embedding.
	 */
	public static SimilarityIndex build(Collection<IssueRecord> records) {
		List<IssueRecord> embedded = records.stream()
			.filter(IssueRecord::hasEmbedding)
			.sorted(Comparator.comparingInt(IssueRecord::number))
			.toList();
		if (embedded.isEmpty()) {
			return EMPTY;
		}
		int dimension = embedded.get(0).embedding().size();
		List<Integer> numbers = new ArrayList<>();
		List<double[]> vectors = new ArrayList<>();
		for (IssueRecord record : embedded) {
			List<Double> embedding = record.embedding();
			if (embedding.size() != dimension) {
				logger.warn("Skipping #{}: embedding has {} dimensions, index has {}", record.number(),
						embedding.size(), dimension);
				continue;
			}
			numbers.add(record.number());
			vectors.add(normalize(embedding));
		}
		return new SimilarityIndex(numbers.stream().mapToInt(Integer::intValue).toArray(),
				vectors.toArray(new double[0][]), dimension);
	}

	public int size() {
		return numbers.length;
	}

	public int dimension() {
		return dimension;
	}

	public boolean contains(int number) {
		return positions.containsKey(number);
	}

	/**
	 * The {@code k} records most similar to an indexed record, excluding itself.
	 * @throws IssueNotFoundException if the record is not in the index
	 */
	public List<Neighbor> findSimilar(int number, int k) {
		return findSimilar(number, k, n -> true);
	}

	/**
	 * Like {@link #findSimilar(int, int)}, considering only numbers accepted by
	 * {@code filter}.
	 */
	public List<Neighbor> findSimilar(int number, int k, IntPredicate filter) {
		Integer position = positions.get(number);
		if (position == null) {
			throw IssueNotFoundException.withoutEmbedding(number);
		}
		return nearest(vectors[position], k, n -> n != number && filter.test(n));
	}

	/**
	 * The {@code k} records most similar to an arbitrary vector.
	 * @throws IllegalArgumentException if the vector dimension does not match
	 */
	public List<Neighbor> search(List<Double> vector, int k) {
		return search(vector, k, n -> true);
	}

	public List<Neighbor> search(List<Double> vector, int k, IntPredicate filter) {
		if (numbers.length > 0 && vector.size() != dimension) {
			throw new IllegalArgumentException(
					"Query vector has " + vector.size() + " dimensions, index has " + dimension);
		}
		return nearest(normalize(vector), k, filter);
	}

	/**
	 * Mean cosine distance from an indexed record to its {@code k} nearest neighbours.
	 * @return the distance, or null if the record is not indexed or fewer than {@code k}
	 * other records are
	 */
	public @Nullable Double knnDistance(int number, int k) {
		if (!contains(number) || numbers.length <= k) {
			return null;
		}
		List<Neighbor> neighbors = findSimilar(number, k);
		return neighbors.stream().mapToDouble(n -> 1.0 - n.similarity()).average().orElse(0.0);
	}

	private List<Neighbor> nearest(double[] query, int k, IntPredicate filter) {
		if (k <= 0) {
			return List.of();
		}
		// Worst of the current best k at the head
		PriorityQueue<Neighbor> best = new PriorityQueue<>(k + 1, BEST_FIRST.reversed());
		for (int i = 0; i < numbers.length; i++) {
			if (!filter.test(numbers[i])) {
				continue;
			}
			Neighbor candidate = new Neighbor(numbers[i], dot(query, vectors[i]));
			if (best.size() < k) {
				best.add(candidate);
			}
			else if (BEST_FIRST.compare(candidate, best.peek()) < 0) {
				best.poll();
				best.add(candidate);
			}
		}
		List<Neighbor> result = new ArrayList<>(best);
		result.sort(BEST_FIRST);
		return result;
	}

	private static double[] normalize(List<Double> vector) {
		double[] result = new double[vector.size()];
		double norm = 0;
		for (int i = 0; i < result.length; i++) {
			result[i] = vector.get(i);
			norm += result[i] * result[i];
		}
		norm = Math.sqrt(norm);
		if (norm > 0) {
			for (int i = 0; i < result.length; i++) {
				result[i] /= norm;
			}
		}
		return result;
	}

	private static double dot(double[] a, double[] b) {
		double sum = 0;
		for (int i = 0; i < a.length; i++) {
			sum += a[i] * b[i];
		}
		return sum;
	}

	/**
	 * A search hit.
	 *
	 * @param number the issue number
	 * @param similarity cosine similarity in [-1, 1]; 0 for zero vectors
	 */
	public record Neighbor(int number, double similarity) {
	}

}
