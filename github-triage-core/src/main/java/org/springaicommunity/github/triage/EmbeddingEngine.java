package org.springaicommunity.github.triage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes embeddings for a set of records.
 *
 * <p>
 * The cache is consulted first; misses go to the {@link EmbeddingProvider} on a bounded
 * worker pool, at most {@code workers} requests at a time, each bounded by
 * {@code timeout}. A record whose embedding cannot be produced loses its previous (now
 * stale) embedding and the pass carries on with the others.
 */
public class EmbeddingEngine {

	private static final Logger logger = LoggerFactory.getLogger(EmbeddingEngine.class);

	private final EmbeddingProvider provider;

	private final EmbeddingCache cache;

	private final int workers;

	private final Duration timeout;

	public EmbeddingEngine(EmbeddingProvider provider, EmbeddingCache cache, int workers, Duration timeout) {
		if (workers <= 0) {
			throw new IllegalArgumentException("workers must be positive, got: " + workers);
		}
		this.provider = provider;
		this.cache = cache;
		this.workers = workers;
		this.timeout = timeout;
	}

	public String model() {
		return provider.model();
	}

	/**
	 * Whether a record needs a (new) embedding: it has none, or its stored content
	 * address no longer matches its text.
	 */
	public boolean isStale(IssueRecord record) {
		return !record.hasEmbedding() || !EmbeddingText.key(provider.model(), record).equals(record.embeddingKey());
	}

	/**
	 * Embed records.
	 * @param records the records to (re-)embed
	 * @return the updated records and counters
	 */
	public Result embed(List<IssueRecord> records) {
		Map<Integer, IssueRecord> updated = new LinkedHashMap<>();
		List<Pending> misses = new ArrayList<>();
		int cacheHits = 0;
		int skipped = 0;

		for (IssueRecord record : records) {
			String payload = EmbeddingText.payload(record);
			if (payload.isEmpty()) {
				updated.put(record.number(), record.withoutEmbedding());
				skipped++;
				continue;
			}
			String key = EmbeddingText.key(provider.model(), payload);
			Optional<List<Double>> cached = cache.get(key);
			if (cached.isPresent()) {
				updated.put(record.number(), record.withEmbedding(cached.get(), key));
				cacheHits++;
			}
			else {
				misses.add(new Pending(record, key, payload));
			}
		}

		int computed = 0;
		int failed = 0;
		if (!misses.isEmpty()) {
			logger.info("Embedding {} records ({} cache hits) with {} workers", misses.size(), cacheHits, workers);
			ExecutorService executor = Executors.newFixedThreadPool(workers, new EmbeddingThreadFactory());
			try {
				for (int from = 0; from < misses.size(); from += workers) {
					if (Thread.currentThread().isInterrupted()) {
						logger.warn("Interrupted, {} records left without embedding", misses.size() - from);
						for (Pending pending : misses.subList(from, misses.size())) {
							updated.put(pending.record().number(), pending.record().withoutEmbedding());
							failed++;
						}
						break;
					}
					List<Pending> chunk = misses.subList(from, Math.min(from + workers, misses.size()));
					List<Future<List<Double>>> futures = new ArrayList<>(chunk.size());
					for (Pending pending : chunk) {
						futures.add(executor.submit(() -> provider.embed(pending.text())));
					}
					for (int i = 0; i < chunk.size(); i++) {
						Pending pending = chunk.get(i);
						Optional<List<Double>> vector = await(futures.get(i), pending.record().number());
						if (vector.isPresent()) {
							cache.put(pending.key(), vector.get());
							updated.put(pending.record().number(), pending.record().withEmbedding(vector.get(),
									pending.key()));
							computed++;
						}
						else {
							updated.put(pending.record().number(), pending.record().withoutEmbedding());
							failed++;
						}
					}
				}
			}
			finally {
				executor.shutdownNow();
			}
		}
		return new Result(new ArrayList<>(updated.values()), cacheHits, computed, failed, skipped);
	}

	/**
	 * Embed a single free text on the calling thread, through the cache.
	 * @param text raw text, sanitized before keying
	 * @return the vector, or empty if the text is blank after sanitizing
	 * @throws EmbeddingUnavailableException if the provider fails
	 */
	public Optional<List<Double>> embedText(String text) {
		String payload = EmbeddingText.sanitize(text);
		if (payload.isEmpty()) {
			return Optional.empty();
		}
		String key = EmbeddingText.key(provider.model(), payload);
		Optional<List<Double>> cached = cache.get(key);
		if (cached.isPresent()) {
			return cached;
		}
		List<Double> vector = provider.embed(payload);
		cache.put(key, vector);
		return Optional.of(vector);
	}

	private Optional<List<Double>> await(Future<List<Double>> future, int number) {
		try {
			return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
		}
		catch (TimeoutException e) {
			future.cancel(true);
			logger.warn("Embedding for #{} timed out after {}", number, timeout);
		}
		catch (ExecutionException e) {
			logger.warn("Embedding for #{} failed: {}", number, e.getCause().getMessage());
		}
		catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			logger.warn("Embedding for #{} interrupted", number);
		}
		return Optional.empty();
	}

	private record Pending(IssueRecord record, String key, String text) {
	}

	/**
	 * Outcome of an embedding pass.
	 *
	 * @param records the updated records, one per input record
	 * @param cacheHits embeddings served from the cache
	 * @param computed embeddings computed by the provider
	 * @param failed records left without embedding because the provider failed
	 * @param skipped records without any text to embed
	 */
	public record Result(List<IssueRecord> records, int cacheHits, int computed, int failed, int skipped) {

		public Result {
			records = List.copyOf(records);
		}

	}

	private static final class EmbeddingThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "embedding-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
