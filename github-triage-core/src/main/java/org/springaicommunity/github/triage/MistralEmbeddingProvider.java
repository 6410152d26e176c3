package org.springaicommunity.github.triage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link EmbeddingProvider} calling the Mistral embeddings API.
 *
 * <p>
 * Sends {@code {"model": ..., "input": [text]}} and reads {@code data[0].embedding}.
 * Failures surface as {@link EmbeddingApiException}, whose {@link
 * EmbeddingApiException#isRetryable()} tells {@link RetryingEmbeddingProvider} whether
 * another attempt makes sense.
 */
public class MistralEmbeddingProvider implements EmbeddingProvider {

	private static final Logger logger = LoggerFactory.getLogger(MistralEmbeddingProvider.class);

	public static final String DEFAULT_ENDPOINT = "https://api.mistral.ai/v1/embeddings";

	public static final String DEFAULT_MODEL = "mistral-embed";

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final String apiKey;

	private final String model;

	private final URI endpoint;

	private final Duration requestTimeout;

	public MistralEmbeddingProvider(String apiKey, ObjectMapper objectMapper) {
		this(apiKey, DEFAULT_MODEL, URI.create(DEFAULT_ENDPOINT), Duration.ofSeconds(30), objectMapper);
	}

	public MistralEmbeddingProvider(String apiKey, String model, URI endpoint, Duration requestTimeout,
			ObjectMapper objectMapper) {
		this.apiKey = apiKey;
		this.model = model;
		this.endpoint = endpoint;
		this.requestTimeout = requestTimeout;
		this.objectMapper = objectMapper;
		this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
	}

	@Override
	public String model() {
		return model;
	}

	@Override
	public List<Double> embed(String text) {
		if (text.isBlank()) {
			throw new EmbeddingApiException("Cannot embed empty text", 400);
		}
		String body;
		try {
			body = objectMapper.writeValueAsString(Map.of("model", model, "input", List.of(text)));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize embedding request", e);
		}
		HttpRequest request = HttpRequest.newBuilder(endpoint)
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + apiKey)
			.header("Content-Type", "application/json")
			.header("Accept", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		long start = System.currentTimeMillis();
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			throw new EmbeddingApiException("Embedding request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EmbeddingUnavailableException("Embedding request interrupted", e);
		}

		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new EmbeddingApiException("Embedding API error " + response.statusCode() + " for content length "
					+ text.length(), response.statusCode());
		}
		List<Double> vector = parseVector(response.body());
		logger.debug("Embedded {} chars in {}ms ({} dimensions)", text.length(), System.currentTimeMillis() - start,
				vector.size());
		return vector;
	}

	private List<Double> parseVector(String responseBody) {
		JsonNode embedding;
		try {
			embedding = objectMapper.readTree(responseBody).path("data").path(0).path("embedding");
		}
		catch (JsonProcessingException e) {
			throw new EmbeddingApiException("Unparseable embedding response: " + e.getOriginalMessage(), e);
		}
		if (!embedding.isArray() || embedding.isEmpty()) {
			throw new EmbeddingApiException("Embedding response has no vector", 502);
		}
		List<Double> vector = new ArrayList<>(embedding.size());
		embedding.forEach(value -> vector.add(value.asDouble()));
		return vector;
	}

	/**
	 * Failure of a single embedding API call.
	 */
	public static class EmbeddingApiException extends EmbeddingUnavailableException {

		private final int statusCode;

		public EmbeddingApiException(String message, int statusCode) {
			super(message);
			this.statusCode = statusCode;
		}

		public EmbeddingApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		/**
		 * Network errors, 429 and server errors are retryable; other client errors are
		 * not.
		 */
		public boolean isRetryable() {
			return statusCode == -1 || statusCode == 429 || statusCode >= 500;
		}

	}

}
