package org.springaicommunity.github.triage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Distribution-relative bucket of a metric value within the whole collection. Constants
 * are declared in ascending order, so {@link #ordinal()} is the bucket rank.
 */
public enum Quartile {

	BOTTOM_25("Bottom25%"), BOTTOM_50("Bottom50%"), TOP_50("Top50%"), TOP_25("Top25%");

	private final String label;

	Quartile(String label) {
		this.label = label;
	}

	@JsonValue
	public String label() {
		return label;
	}

	@JsonCreator
	public static Quartile fromLabel(String label) {
		return Arrays.stream(values())
			.filter(q -> q.label.equals(label) || q.name().equals(label))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Unknown quartile label: " + label));
	}

	/**
	 * Bucket for the element at {@code rank} (0-based) in a sorted population of
	 * {@code size} elements.
	 * @param rank position in ascending order
	 * @param size population size
	 * @return the quartile containing that position
	 */
	public static Quartile forRank(int rank, int size) {
		if (size <= 0 || rank < 0 || rank >= size) {
			throw new IllegalArgumentException("rank " + rank + " out of range for size " + size);
		}
		return values()[(int) ((long) rank * 4 / size)];
	}

}
