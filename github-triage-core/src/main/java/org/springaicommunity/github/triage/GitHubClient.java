package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

/**
 * HTTP operations against the GitHub API.
 *
 * <p>
 * Abstracts the transport so the source adapter can be tested with mocks and decorated
 * (see {@link RetryingGitHubClient}).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return response body
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a POST request to the GitHub GraphQL API.
	 * @param body request body (JSON)
	 * @return response body
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String postGraphQL(String body);

	/**
	 * Rate limit status from the most recent response, or null if none was observed yet.
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
