package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Decorator that adds retries with smart backoff to a {@link GitHubClient}.
 *
 * <ul>
 * <li>Exponential backoff for transient errors (5xx, network)</li>
 * <li>Reset-aware waits for rate limit errors: sleeps until {@code X-RateLimit-Reset}
 * instead of a blind exponential delay</li>
 * <li>Proactive pacing when the remaining rate limit runs low</li>
 * <li>No retries for other client errors (401, 404, ...)</li>
 * </ul>
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	/**
	 * Longest wait for a rate limit reset; beyond this, exponential backoff is used.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private final GitHubClient delegate;

	private final Retrier retrier;

	private final int pacingThreshold;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.retrier = new Retrier(builder.maxRetries, builder.initialDelayMs, builder.sleeper);
		this.pacingThreshold = builder.pacingThreshold;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return execute(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String postGraphQL(String body) {
		return execute(() -> delegate.postGraphQL(body), "POST GraphQL");
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String execute(Retrier.Attempt<String> attempt, String description) {
		String result = retrier.execute(description, attempt, this::computeWaitTime);
		paceIfNeeded(description);
		return result;
	}

	private long computeWaitTime(RuntimeException failure, long defaultDelay) {
		if (!(failure instanceof GitHubHttpClient.GitHubApiException e)) {
			return defaultDelay;
		}
		if (!e.isRetryable()) {
			return Retrier.GIVE_UP;
		}
		if (e.isRateLimitError() && e.getResetEpochSeconds() > 0) {
			long waitSeconds = e.getResetEpochSeconds() - Instant.now().getEpochSecond() + 1;
			if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
						e.getResetEpochSeconds());
				return waitSeconds * 1000;
			}
			if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
				logger.warn("Rate limit reset is {} seconds away (> 1hr), using exponential backoff instead",
						waitSeconds);
			}
		}
		return defaultDelay;
	}

	/**
	 * After a successful request, spread the remaining requests evenly until the reset
	 * once fewer than {@code pacingThreshold} remain.
	 */
	private void paceIfNeeded(String description) {
		RateLimitInfo info = delegate.getLastRateLimitInfo();
		if (info == null || info.remaining() <= 0 || info.remaining() >= pacingThreshold) {
			return;
		}
		long secondsUntilReset = info.reset() - Instant.now().getEpochSecond();
		if (secondsUntilReset > 0) {
			long paceMs = (secondsUntilReset * 1000) / info.remaining();
			paceMs = Math.max(Math.min(paceMs, 10_000), 100);
			logger.debug("Pacing: {}/{} remaining, sleeping {}ms ({})", info.remaining(), info.limit(), paceMs,
					description);
			retrier.sleep(paceMs);
		}
	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Defaults: 3 retries, 1 second initial
	 * delay, pacing below 100 remaining requests.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private int pacingThreshold = 100;

		private Retrier.Sleeper sleeper = Thread::sleep;

		private Builder() {
		}

		/**
		 * Set the client to wrap (required).
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Initial delay between retries; doubles on each retry.
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Remaining-request threshold below which requests are paced.
		 */
		public Builder pacingThreshold(int threshold) {
			this.pacingThreshold = threshold;
			return this;
		}

		Builder sleeper(Retrier.Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the client.
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
