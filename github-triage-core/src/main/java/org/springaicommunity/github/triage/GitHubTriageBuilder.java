package org.springaicommunity.github.triage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Builder wiring the triage services together without a container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * GitHubTriageBuilder builder = GitHubTriageBuilder.create()
 *     .tokenFromEnv()
 *     .embeddingApiKeyFromEnv()
 *     .properties(props);
 *
 * PullResult pulled = builder.buildIngestionService()
 *     .pull(IngestionRequest.incremental(CollectionKey.of("spring-projects/spring-ai")));
 * builder.buildEnrichmentService().enrich(pulled.key(), pulled.contentChanged());
 *
 * // For testing with a stub source and an in-memory embedding provider
 * IngestionService ingestion = GitHubTriageBuilder.create()
 *     .sourceAdapter(stubSource)
 *     .collectionStore(store)
 *     .buildIngestionService();
 * }
 * </pre>
 */
public class GitHubTriageBuilder {

	private @Nullable String token;

	private @Nullable String embeddingApiKey;

	private TriageProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable SourceAdapter sourceAdapter;

	private @Nullable CollectionStore collectionStore;

	private @Nullable EmbeddingProvider embeddingProvider;

	private @Nullable EmbeddingCache embeddingCache;

	private Clock clock = Clock.systemUTC();

	private GitHubTriageBuilder() {
		this.properties = new TriageProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubTriageBuilder
	 */
	public static GitHubTriageBuilder create() {
		return new GitHubTriageBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubTriageBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from GITHUB_TOKEN (environment or .env file).
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubTriageBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		if (this.token == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		return this;
	}

	/**
	 * Set the embedding API key directly.
	 * @param apiKey Mistral API key (null to disable embeddings)
	 * @return this builder
	 */
	public GitHubTriageBuilder embeddingApiKey(@Nullable String apiKey) {
		this.embeddingApiKey = apiKey;
		return this;
	}

	/**
	 * Read the embedding API key from MISTRAL_API_KEY. A missing key is not an error:
	 * enrichment then runs without embeddings.
	 * @return this builder
	 */
	public GitHubTriageBuilder embeddingApiKeyFromEnv() {
		this.embeddingApiKey = EnvironmentSupport.get(EnvironmentSupport.MISTRAL_API_KEY);
		return this;
	}

	/**
	 * Set triage properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubTriageBuilder properties(@Nullable TriageProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubTriageBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. It is still wrapped in a
	 * {@link RetryingGitHubClient}. When a custom client is provided, the token is not
	 * required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubTriageBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom SourceAdapter, bypassing the GitHub client entirely.
	 * @param sourceAdapter custom SourceAdapter (null to use default)
	 * @return this builder
	 */
	public GitHubTriageBuilder sourceAdapter(@Nullable SourceAdapter sourceAdapter) {
		this.sourceAdapter = sourceAdapter;
		return this;
	}

	/**
	 * Set a custom CollectionStore implementation.
	 * @param collectionStore custom store (null to use the file system store under the
	 * data directory)
	 * @return this builder
	 */
	public GitHubTriageBuilder collectionStore(@Nullable CollectionStore collectionStore) {
		this.collectionStore = collectionStore;
		return this;
	}

	/**
	 * Set a custom EmbeddingProvider. It is used as is, without retry decoration.
	 * @param embeddingProvider custom provider (null to use Mistral when a key is set)
	 * @return this builder
	 */
	public GitHubTriageBuilder embeddingProvider(@Nullable EmbeddingProvider embeddingProvider) {
		this.embeddingProvider = embeddingProvider;
		return this;
	}

	/**
	 * Set a custom EmbeddingCache implementation.
	 * @param embeddingCache custom cache (null to use the file system cache)
	 * @return this builder
	 */
	public GitHubTriageBuilder embeddingCache(@Nullable EmbeddingCache embeddingCache) {
		this.embeddingCache = embeddingCache;
		return this;
	}

	public GitHubTriageBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build an IngestionService.
	 * @return configured IngestionService
	 */
	public IngestionService buildIngestionService() {
		ObjectMapper mapper = objectMapper();
		SourceAdapter source = this.sourceAdapter != null ? this.sourceAdapter
				: new GitHubSourceAdapter(buildGitHubClient(), mapper, properties.getMaxPerQuery());
		return new IngestionService(source, new MergeEngine(), buildCollectionStore(),
				new FetchWindowPlanner(Duration.ofDays(properties.getWindowDays())), clock, properties.getStartDate());
	}

	/**
	 * Build an EnrichmentService. Without an embedding provider or API key the service
	 * only computes metrics.
	 * @return configured EnrichmentService
	 */
	public EnrichmentService buildEnrichmentService() {
		EmbeddingEngine engine = buildEmbeddingEngine();
		MetricEngine metricEngine = new MetricEngine(properties.getRecencyWeight(), properties.getEngagementWeight(),
				properties.getRecencyHalfLifeDays());
		return new EnrichmentService(buildCollectionStore(), engine, metricEngine, new QuartileEngine(), clock,
				properties.getKnnNeighbors());
	}

	/**
	 * Build an IssueQueryService over one collection.
	 * @param key the collection to query
	 * @return configured IssueQueryService
	 */
	public IssueQueryService buildQueryService(CollectionKey key) {
		return new IssueQueryService(buildCollectionStore(), key, buildEmbeddingEngine());
	}

	private @Nullable EmbeddingEngine buildEmbeddingEngine() {
		EmbeddingProvider provider = buildEmbeddingProvider();
		if (provider == null) {
			return null;
		}
		EmbeddingCache cache = this.embeddingCache != null ? this.embeddingCache
				: new FileSystemEmbeddingCache(Path.of(properties.getEmbeddingCacheDirectory()), objectMapper());
		return new EmbeddingEngine(provider, cache, properties.getEmbeddingWorkers(),
				Duration.ofSeconds(properties.getEmbeddingTimeoutSeconds()));
	}

	/**
	 * Build the CollectionStore directly (for advanced usage).
	 * @return configured CollectionStore
	 */
	public CollectionStore buildCollectionStore() {
		if (this.collectionStore == null) {
			this.collectionStore = new FileSystemCollectionStore(Path.of(properties.getDataDirectory()),
					objectMapper());
		}
		return this.collectionStore;
	}

	private GitHubClient buildGitHubClient() {
		GitHubClient client = this.httpClient;
		if (client == null) {
			String githubToken = this.token;
			if (githubToken == null || githubToken.isBlank()) {
				throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
			}
			client = new GitHubHttpClient(githubToken);
		}
		return RetryingGitHubClient.builder()
			.wrapping(client)
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryDelayMs())
			.pacingThreshold(properties.getPacingThreshold())
			.build();
	}

	private @Nullable EmbeddingProvider buildEmbeddingProvider() {
		if (this.embeddingProvider != null) {
			return this.embeddingProvider;
		}
		String apiKey = this.embeddingApiKey;
		if (apiKey == null || apiKey.isBlank()) {
			return null;
		}
		MistralEmbeddingProvider mistral = new MistralEmbeddingProvider(apiKey, properties.getEmbeddingModel(),
				URI.create(MistralEmbeddingProvider.DEFAULT_ENDPOINT),
				Duration.ofSeconds(properties.getEmbeddingTimeoutSeconds()), objectMapper());
		return new RetryingEmbeddingProvider(mistral, properties.getMaxRetries(), properties.getRetryDelayMs());
	}

	private ObjectMapper objectMapper() {
		if (this.objectMapper == null) {
			this.objectMapper = ObjectMapperFactory.create();
		}
		return this.objectMapper;
	}

}
