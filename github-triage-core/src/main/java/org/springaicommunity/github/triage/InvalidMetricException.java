package org.springaicommunity.github.triage;

import java.util.List;

/**
 * Thrown when a query names a metric that does not exist.
 */
public class InvalidMetricException extends RuntimeException {

	private final String metricName;

	public InvalidMetricException(String metricName, List<String> available) {
		super("Unknown metric '" + metricName + "'. Available metrics: " + available);
		this.metricName = metricName;
	}

	public String getMetricName() {
		return metricName;
	}

}
