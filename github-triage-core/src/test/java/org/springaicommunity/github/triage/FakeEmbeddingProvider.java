package org.springaicommunity.github.triage;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic provider: the vector depends only on the text. Texts containing one of
 * the failing markers throw.
 */
class FakeEmbeddingProvider implements EmbeddingProvider {

	final AtomicInteger calls = new AtomicInteger();

	final Set<String> failingMarkers = ConcurrentHashMap.newKeySet();

	@Override
	public String model() {
		return "fake-embed";
	}

	@Override
	public List<Double> embed(String text) {
		calls.incrementAndGet();
		for (String marker : failingMarkers) {
			if (text.contains(marker)) {
				throw new EmbeddingUnavailableException("Simulated failure for " + marker);
			}
		}
		double a = text.length() % 7 + 1;
		double b = text.chars().filter(c -> c == 'e').count() + 1;
		return List.of(a, b, 1.0);
	}

}
