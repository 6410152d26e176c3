package org.springaicommunity.github.triage;

import java.util.List;

/**
 * Decorator adding exponential backoff retries to an {@link EmbeddingProvider}. After
 * the last attempt the failure surfaces as an {@link EmbeddingUnavailableException}.
 */
public final class RetryingEmbeddingProvider implements EmbeddingProvider {

	private final EmbeddingProvider delegate;

	private final Retrier retrier;

	public RetryingEmbeddingProvider(EmbeddingProvider delegate, int maxRetries, long initialDelayMs) {
		this(delegate, new Retrier(maxRetries, initialDelayMs));
	}

	RetryingEmbeddingProvider(EmbeddingProvider delegate, Retrier retrier) {
		this.delegate = delegate;
		this.retrier = retrier;
	}

	@Override
	public String model() {
		return delegate.model();
	}

	@Override
	public List<Double> embed(String text) {
		try {
			return retrier.execute("Embedding (" + text.length() + " chars)", () -> delegate.embed(text),
					RetryingEmbeddingProvider::computeWaitTime);
		}
		catch (EmbeddingUnavailableException e) {
			throw e;
		}
		catch (Retrier.RetryInterruptedException e) {
			throw new EmbeddingUnavailableException("Embedding interrupted", e);
		}
		catch (RuntimeException e) {
			throw new EmbeddingUnavailableException("Embedding failed: " + e.getMessage(), e);
		}
	}

	private static long computeWaitTime(RuntimeException failure, long backoffMs) {
		if (failure instanceof MistralEmbeddingProvider.EmbeddingApiException e && !e.isRetryable()) {
			return Retrier.GIVE_UP;
		}
		if (Thread.currentThread().isInterrupted()) {
			return Retrier.GIVE_UP;
		}
		return backoffMs;
	}

}
