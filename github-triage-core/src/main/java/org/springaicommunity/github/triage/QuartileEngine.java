package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assigns quartile labels relative to the whole collection.
 *
 * <p>
 * Values are sorted ascending with a stable sort, so ties keep their input order, and the
 * element at rank {@code r} of {@code n} lands in bucket {@code r * 4 / n}. A higher value
 * therefore never gets a lower quartile than a smaller one. Missing values get no label.
 */
public class QuartileEngine {

	/**
	 * Label a population of values.
	 * @param values one value per element, null where the element has no value
	 * @return labels in input order, null where the value was null
	 */
	public List<@Nullable Quartile> assign(List<@Nullable Double> values) {
		List<Integer> present = new ArrayList<>();
		for (int i = 0; i < values.size(); i++) {
			Double value = values.get(i);
			if (value != null && !value.isNaN()) {
				present.add(i);
			}
		}
		present.sort(Comparator.comparingDouble(values::get));

		Quartile[] labels = new Quartile[values.size()];
		for (int rank = 0; rank < present.size(); rank++) {
			labels[present.get(rank)] = Quartile.forRank(rank, present.size());
		}
		return Arrays.asList(labels);
	}

	/**
	 * Label every {@link Metric} of every bundle.
	 * @param bundles metric bundles in collection order
	 * @return per bundle, a map of metric name to quartile
	 */
	public List<Map<String, Quartile>> assignAll(List<MetricBundle> bundles) {
		List<Map<String, Quartile>> result = new ArrayList<>(bundles.size());
		bundles.forEach(b -> result.add(new TreeMap<>()));
		for (Metric metric : Metric.values()) {
			List<@Nullable Double> values = bundles.stream().map(metric::valueOf).toList();
			List<@Nullable Quartile> labels = assign(values);
			for (int i = 0; i < labels.size(); i++) {
				Quartile label = labels.get(i);
				if (label != null) {
					result.get(i).put(metric.metricName(), label);
				}
			}
		}
		return result;
	}

}
