package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes the {@link MetricBundle} of a single record.
 *
 * <p>
 * {@code activityScore = recencyWeight / (1 + daysSinceUpdate / halfLifeDays)
 * + engagementWeight * ln(1 + engagements)}. It never decreases when a record becomes
 * more recent or gains engagements.
 */
public class MetricEngine {

	private static final double MINUTES_PER_DAY = 24 * 60;

	private final double recencyWeight;

	private final double engagementWeight;

	private final double recencyHalfLifeDays;

	public MetricEngine() {
		this(1.0, 1.0, 30.0);
	}

	public MetricEngine(double recencyWeight, double engagementWeight, double recencyHalfLifeDays) {
		if (recencyWeight < 0 || engagementWeight < 0) {
			throw new IllegalArgumentException("Activity weights must not be negative");
		}
		if (recencyHalfLifeDays <= 0) {
			throw new IllegalArgumentException("recencyHalfLifeDays must be positive, got: " + recencyHalfLifeDays);
		}
		this.recencyWeight = recencyWeight;
		this.engagementWeight = engagementWeight;
		this.recencyHalfLifeDays = recencyHalfLifeDays;
	}

	/**
	 * Compute the metrics of one record.
	 * @param record the record
	 * @param now the enrichment time
	 * @param knnDistance mean distance to the nearest neighbours, null if unknown
	 * @return the metric bundle
	 */
	public MetricBundle compute(IssueRecord record, Instant now, @Nullable Double knnDistance) {
		Reactions body = record.reactions();
		Reactions all = record.allReactions();
		int commentCount = record.comments().size();
		int commentReactions = all.total() - body.total();
		int engagements = commentCount + all.total();

		long ageDays = Math.max(0, Duration.between(record.createdAt(), record.updatedAt()).toDays());
		Duration sinceUpdate = Duration.between(record.updatedAt(), now);
		if (sinceUpdate.isNegative()) {
			sinceUpdate = Duration.ZERO;
		}
		double engagementsPerDay = ageDays > 0 ? (double) engagements / ageDays : 0.0;

		return new MetricBundle(commentCount, all.positive(), all.negative(), body.total(), commentReactions,
				all.total(), engagements, ageDays, sinceUpdate.toDays(), engagementsPerDay,
				activityScore(sinceUpdate.toMinutes() / MINUTES_PER_DAY, engagements), knnDistance);
	}

	double activityScore(double daysSinceUpdate, int engagements) {
		return recencyWeight / (1 + daysSinceUpdate / recencyHalfLifeDays)
				+ engagementWeight * Math.log1p(engagements);
	}

}
