package org.springaicommunity.github.triage;

/**
 * Outcome of {@link EnrichmentService#enrich}.
 *
 * @param key the enriched collection
 * @param records records in the collection
 * @param embeddingScope records that were (re-)embedded or looked up in the cache
 * @param cacheHits embeddings served from the cache
 * @param computed embeddings computed by the provider
 * @param failed records left without embedding
 * @param indexed records in the rebuilt similarity index
 * @param written whether the collection was saved
 */
public record EnrichmentResult(CollectionKey key, int records, int embeddingScope, int cacheHits, int computed,
		int failed, int indexed, boolean written) {

}
