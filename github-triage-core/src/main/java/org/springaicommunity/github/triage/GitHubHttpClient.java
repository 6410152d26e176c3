package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link GitHubClient} on top of the JDK {@link HttpClient}.
 *
 * <p>
 * Rate limit headers are read from every response and exposed through
 * {@link #getLastRateLimitInfo()} for pacing.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final String GITHUB_API_BASE = "https://api.github.com";

	private static final String USER_AGENT = "github-triage";

	private final HttpClient httpClient;

	private final String token;

	private final String apiBase;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(token, GITHUB_API_BASE, Duration.ofSeconds(30));
	}

	/**
	 * Create a client for a custom API base, e.g. a GitHub Enterprise server.
	 * @param token the access token
	 * @param apiBase base URL without trailing slash
	 * @param connectTimeout connect timeout
	 */
	public GitHubHttpClient(String token, String apiBase, Duration connectTimeout) {
		this.token = token;
		this.apiBase = apiBase;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : apiBase + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "token " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", USER_AGENT)
			.GET()
			.build();

		String response = executeRequest(request);
		logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
				response.length());
		return response;
	}

	@Override
	public String postGraphQL(String body) {
		logger.debug("POST GraphQL ({} bytes)", body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(apiBase + "/graphql"))
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		String response = executeRequest(request);
		logger.debug("POST GraphQL completed in {}ms ({} bytes)", System.currentTimeMillis() - start,
				response.length());
		return response;
	}

	private String executeRequest(HttpRequest request) {
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.debug("HTTP request to {} failed: {}", request.uri(), e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}

		int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
		long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
		if (remaining >= 0) {
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			this.lastRateLimitInfo = new RateLimitInfo(limit, remaining,
					reset, parseIntHeader(response, "X-RateLimit-Used", -1));
			if (remaining < 100) {
				logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
			}
		}

		int statusCode = response.statusCode();
		if (statusCode >= 200 && statusCode < 300) {
			return response.body();
		}
		String message = switch (statusCode) {
			case 401 -> "Unauthorized: Bad credentials. Check your GITHUB_TOKEN.";
			case 403 -> remaining == 0 ? "Rate limit exceeded. Resets at epoch: " + reset
					: "Forbidden: " + response.body();
			case 404 -> "Not found: " + request.uri();
			case 429 -> "Too Many Requests (429). Resets at epoch: " + reset;
			default -> "GitHub API error: " + statusCode;
		};
		throw new GitHubApiException(message, statusCode, response.body(), remaining, reset);
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return (int) parseLongHeader(response, headerName, defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Thrown when a GitHub API call fails. Carries the status code and rate limit state
	 * so {@link RetryingGitHubClient} can decide whether and how long to wait.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		/**
		 * True for 429 and for 403 with no remaining requests.
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

		public boolean isAuthenticationError() {
			return statusCode == 401;
		}

		/**
		 * Client errors other than rate limiting are not worth retrying.
		 */
		public boolean isRetryable() {
			return !(statusCode >= 400 && statusCode < 500) || isRateLimitError();
		}

	}

}
