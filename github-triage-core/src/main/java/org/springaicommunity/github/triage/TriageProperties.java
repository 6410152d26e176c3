package org.springaicommunity.github.triage;

import java.time.LocalDate;

/**
 * Configuration properties for ingestion, enrichment and storage.
 *
 * <p>
 * Properties can be set through setters or from the command line and are passed to
 * {@link GitHubTriageBuilder}. The defaults suit a medium-sized repository; large ones
 * mainly benefit from a narrower window and more embedding workers.
 */
public class TriageProperties {

	/**
	 * Root directory of stored collections.
	 */
	private String dataDirectory = "data";

	/**
	 * Directory of the embedding cache. Shared by all collections, since entries are
	 * content-addressed.
	 */
	private String embeddingCacheDirectory = "data/.embedding-cache";

	/**
	 * First day fetched for a new collection.
	 */
	private LocalDate startDate = LocalDate.of(2025, 1, 1);

	/**
	 * Width of a fetch window in days.
	 */
	private int windowDays = 7;

	/**
	 * Maximum number of search results per query before a window is split.
	 */
	private int maxPerQuery = GitHubSourceAdapter.DEFAULT_MAX_PER_QUERY;

	/**
	 * Maximum number of retry attempts for failed API requests.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay in milliseconds between retries; doubles on each retry.
	 */
	private long retryDelayMs = 1000;

	/**
	 * Remaining GitHub requests below which requests are paced.
	 */
	private int pacingThreshold = 100;

	/**
	 * Embedding model name.
	 */
	private String embeddingModel = MistralEmbeddingProvider.DEFAULT_MODEL;

	/**
	 * Number of parallel embedding requests.
	 */
	private int embeddingWorkers = 4;

	/**
	 * Per-record embedding timeout in seconds, retries included.
	 */
	private int embeddingTimeoutSeconds = 120;

	/**
	 * Number of neighbours averaged for the k-NN distance metric.
	 */
	private int knnNeighbors = 4;

	/**
	 * Weight of recency in the activity score.
	 */
	private double recencyWeight = 1.0;

	/**
	 * Weight of engagement in the activity score.
	 */
	private double engagementWeight = 1.0;

	/**
	 * Days since the last update at which the recency part of the activity score halves.
	 */
	private double recencyHalfLifeDays = 30.0;

	/**
	 * Enable debug-level logging output.
	 */
	private boolean debug = false;

	public String getDataDirectory() {
		return dataDirectory;
	}

	public void setDataDirectory(String dataDirectory) {
		this.dataDirectory = dataDirectory;
	}

	public String getEmbeddingCacheDirectory() {
		return embeddingCacheDirectory;
	}

	public void setEmbeddingCacheDirectory(String embeddingCacheDirectory) {
		this.embeddingCacheDirectory = embeddingCacheDirectory;
	}

	public LocalDate getStartDate() {
		return startDate;
	}

	public void setStartDate(LocalDate startDate) {
		this.startDate = startDate;
	}

	public int getWindowDays() {
		return windowDays;
	}

	public void setWindowDays(int windowDays) {
		this.windowDays = windowDays;
	}

	public int getMaxPerQuery() {
		return maxPerQuery;
	}

	public void setMaxPerQuery(int maxPerQuery) {
		this.maxPerQuery = maxPerQuery;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(long retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public int getPacingThreshold() {
		return pacingThreshold;
	}

	public void setPacingThreshold(int pacingThreshold) {
		this.pacingThreshold = pacingThreshold;
	}

	public String getEmbeddingModel() {
		return embeddingModel;
	}

	public void setEmbeddingModel(String embeddingModel) {
		this.embeddingModel = embeddingModel;
	}

	public int getEmbeddingWorkers() {
		return embeddingWorkers;
	}

	public void setEmbeddingWorkers(int embeddingWorkers) {
		this.embeddingWorkers = embeddingWorkers;
	}

	public int getEmbeddingTimeoutSeconds() {
		return embeddingTimeoutSeconds;
	}

	public void setEmbeddingTimeoutSeconds(int embeddingTimeoutSeconds) {
		this.embeddingTimeoutSeconds = embeddingTimeoutSeconds;
	}

	public int getKnnNeighbors() {
		return knnNeighbors;
	}

	public void setKnnNeighbors(int knnNeighbors) {
		this.knnNeighbors = knnNeighbors;
	}

	public double getRecencyWeight() {
		return recencyWeight;
	}

	public void setRecencyWeight(double recencyWeight) {
		this.recencyWeight = recencyWeight;
	}

	public double getEngagementWeight() {
		return engagementWeight;
	}

	public void setEngagementWeight(double engagementWeight) {
		this.engagementWeight = engagementWeight;
	}

	public double getRecencyHalfLifeDays() {
		return recencyHalfLifeDays;
	}

	public void setRecencyHalfLifeDays(double recencyHalfLifeDays) {
		this.recencyHalfLifeDays = recencyHalfLifeDays;
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(boolean debug) {
		this.debug = debug;
	}

}
