package org.springaicommunity.github.triage;

import java.time.Instant;

/**
 * Rate limit status reported by the GitHub API in response headers.
 *
 * @param limit the maximum number of requests allowed per window
 * @param remaining requests left in the current window
 * @param reset when the window resets (epoch seconds)
 * @param used requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	public Instant resetTime() {
		return Instant.ofEpochSecond(reset);
	}

	public boolean isExceeded() {
		return remaining <= 0;
	}

}
