package org.springaicommunity.github.triage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential backoff loop shared by the retrying decorators.
 *
 * <p>
 * Each failed attempt is handed to a {@link Policy} that either vetoes the retry or
 * chooses how long to wait (usually the current backoff delay, or a longer reset-aware
 * wait for rate limits). The backoff delay doubles after every retry. When attempts are
 * exhausted the last exception is rethrown unchanged.
 */
public final class Retrier {

	private static final Logger logger = LoggerFactory.getLogger(Retrier.class);

	/**
	 * Returned by a {@link Policy} to stop retrying immediately.
	 */
	public static final long GIVE_UP = -1;

	private final int maxRetries;

	private final long initialDelayMs;

	private final Sleeper sleeper;

	public Retrier(int maxRetries, long initialDelayMs) {
		this(maxRetries, initialDelayMs, Thread::sleep);
	}

	public Retrier(int maxRetries, long initialDelayMs, Sleeper sleeper) {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative");
		}
		if (initialDelayMs <= 0) {
			throw new IllegalArgumentException("initialDelay must be positive");
		}
		this.maxRetries = maxRetries;
		this.initialDelayMs = initialDelayMs;
		this.sleeper = sleeper;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Run {@code attempt} until it succeeds, the policy gives up or retries run out.
	 * @param description used in log messages, e.g. "POST GraphQL"
	 * @param attempt the operation
	 * @param policy decides whether and how long to wait after a failure
	 * @return the first successful result
	 */
	public <T> T execute(String description, Attempt<T> attempt, Policy policy) {
		long delay = initialDelayMs;
		for (int attemptNo = 0;; attemptNo++) {
			try {
				return attempt.call();
			}
			catch (RuntimeException e) {
				long waitMs = attemptNo < maxRetries ? policy.waitMillis(e, delay) : GIVE_UP;
				if (waitMs == GIVE_UP) {
					if (attemptNo >= maxRetries && maxRetries > 0) {
						logger.error("{} failed after {} attempts", description, attemptNo + 1);
					}
					throw e;
				}
				logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attemptNo + 1,
						maxRetries + 1, e.getMessage(), waitMs);
				sleep(waitMs);
				delay *= 2;
			}
		}
	}

	/**
	 * Sleep through the configured {@link Sleeper}, translating interruption.
	 * @param ms milliseconds to sleep
	 */
	public void sleep(long ms) {
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RetryInterruptedException(e);
		}
	}

	@FunctionalInterface
	public interface Attempt<T> {

		T call();

	}

	@FunctionalInterface
	public interface Policy {

		/**
		 * @param failure the exception of the failed attempt
		 * @param backoffMs the current exponential backoff delay
		 * @return milliseconds to wait before the next attempt, or {@link #GIVE_UP}
		 */
		long waitMillis(RuntimeException failure, long backoffMs);

	}

	@FunctionalInterface
	public interface Sleeper {

		void sleep(long ms) throws InterruptedException;

	}

	/**
	 * Thrown when the thread is interrupted while waiting between attempts. The interrupt
	 * flag is left set.
	 */
	public static class RetryInterruptedException extends RuntimeException {

		RetryInterruptedException(InterruptedException cause) {
			super("Retry interrupted", cause);
		}

	}

}
