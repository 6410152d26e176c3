package org.springaicommunity.github.triage;

import java.util.List;
import java.util.Optional;

/**
 * Content-addressed store of embedding vectors, keyed by
 * {@link EmbeddingText#key(String, String)}. Entries are never evicted.
 */
public interface EmbeddingCache {

	Optional<List<Double>> get(String key);

	void put(String key, List<Double> vector);

}
