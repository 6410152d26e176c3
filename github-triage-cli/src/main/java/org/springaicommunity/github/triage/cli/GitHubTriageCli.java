package org.springaicommunity.github.triage.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.triage.*;

import java.util.Map;
import java.util.Set;

/**
 * GitHub Triage CLI Application
 *
 * Plain Java command-line application that pulls GitHub issues and pull requests into a
 * local collection, enriches them and checks their consistency. No framework
 * dependencies - uses GitHubTriageBuilder for service wiring.
 *
 * Usage: java -jar github-triage-cli.jar &lt;command&gt; &lt;owner/repo&gt; [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token (pull, update);
 * MISTRAL_API_KEY - embedding API key (optional)
 *
 * Exit codes: 0 on success, 1 on error, 2 when validation fails.
 */
public class GitHubTriageCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubTriageCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_ERROR = 1;

	static final int EXIT_VALIDATION_FAILED = 2;

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, GitHubTriageBuilder.create().embeddingApiKeyFromEnv(), true);
	}

	/**
	 * Run a command with a pre-configured builder.
	 * @param args command-line arguments
	 * @param builder the builder, possibly carrying custom components
	 * @param requireToken whether pull and update need GITHUB_TOKEN
	 * @return the exit code
	 */
	static int run(String[] args, GitHubTriageBuilder builder, boolean requireToken) {
		TriageProperties properties = new TriageProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			logger.error("Run with --help for usage");
			return EXIT_ERROR;
		}

		if (config.verbose) {
			enableDebugLogging();
		}
		builder.properties(config.applyTo(properties));
		logConfiguration(config);

		try {
			CollectionKey key = config.collectionKey();
			String command = config.command != null ? config.command : "";
			return switch (command) {
				case "pull" -> {
					requireToken(argumentParser, builder, requireToken);
					pull(builder, config, key);
					yield EXIT_OK;
				}
				case "update" -> {
					requireToken(argumentParser, builder, requireToken);
					PullResult pulled = pull(builder, config, key);
					if (!pulled.interrupted()) {
						logEnrichment(builder.buildEnrichmentService().enrich(key, pulled.contentChanged()));
					}
					yield EXIT_OK;
				}
				case "enrich" -> {
					logEnrichment(builder.buildEnrichmentService().enrich(key, Set.of()));
					yield EXIT_OK;
				}
				case "validate" -> validate(builder.buildCollectionStore(), key, config.deleteInvalid);
				case "clean" -> clean(builder.buildCollectionStore(), key);
				case "stats" -> stats(builder.buildCollectionStore(), key);
				default -> throw new IllegalStateException("Unhandled command: " + command);
			};
		}
		catch (SourceAuthenticationException e) {
			logger.error("Authentication failed: {}", e.getMessage());
			return EXIT_ERROR;
		}
		catch (RuntimeException e) {
			logger.error("{} failed: {}", config.command, e.getMessage(), e);
			return EXIT_ERROR;
		}
	}

	private static void requireToken(ArgumentParser argumentParser, GitHubTriageBuilder builder,
			boolean requireToken) {
		if (requireToken) {
			argumentParser.validateEnvironment();
			builder.tokenFromEnv();
		}
	}

	private static PullResult pull(GitHubTriageBuilder builder, ParsedConfiguration config, CollectionKey key) {
		IngestionRequest request = new IngestionRequest(key, config.itemTypes, config.force, config.startDate);
		PullResult result = builder.buildIngestionService().pull(request);
		logger.info("Pull completed{}", result.interrupted() ? " (interrupted, rerun to resume)" : "");
		logger.info("  Windows: {}", result.windows());
		logger.info("  Fetched: {}", result.fetched());
		logger.info("  Inserted: {}", result.inserted());
		logger.info("  Updated: {}", result.updated());
		logger.info("  Rejected: {}", result.rejected());
		logger.info("  Content changed: {}", result.contentChanged().size());
		return result;
	}

	private static void logEnrichment(EnrichmentResult result) {
		logger.info("Enrichment completed{}", result.written() ? "" : " (no changes)");
		logger.info("  Records: {}", result.records());
		logger.info("  Embedding scope: {}", result.embeddingScope());
		logger.info("  Cache hits: {}", result.cacheHits());
		logger.info("  Computed: {}", result.computed());
		logger.info("  Failed: {}", result.failed());
		logger.info("  Indexed: {}", result.indexed());
	}

	private static int validate(CollectionStore store, CollectionKey key, boolean deleteInvalid) {
		CollectionValidator validator = new CollectionValidator();
		ValidationResult result = validator.validate(store.load(key));
		logValidationResult(result);
		if (result.passed()) {
			logger.info("Validation PASSED");
			return EXIT_OK;
		}

		if (deleteInvalid) {
			int removed = store.purge(key, result.invalidNumbers());
			logger.info("Deleted {} invalid records", removed);
			ValidationResult recheck = validator.validate(store.load(key));
			if (recheck.passed()) {
				logger.info("Validation PASSED after deleting invalid records");
				return EXIT_OK;
			}
			logValidationResult(recheck);
		}

		logger.warn("Validation FAILED");
		return EXIT_VALIDATION_FAILED;
	}

	private static int clean(CollectionStore store, CollectionKey key) {
		if (store.delete(key)) {
			logger.info("Deleted collection {}", key);
		}
		else {
			logger.info("No collection {} to delete", key);
		}
		return EXIT_OK;
	}

	private static int stats(CollectionStore store, CollectionKey key) {
		if (!store.exists(key)) {
			logger.warn("No collection {} found", key);
			return EXIT_ERROR;
		}
		CollectionStats stats = CollectionStats.of(store.load(key));
		logger.info("Collection {}:", key);
		logger.info("  Total: {}", stats.total());
		logger.info("  Issues: {}", stats.issues());
		logger.info("  Pull requests: {}", stats.pullRequests());
		logger.info("  Open / closed / merged: {} / {} / {}", stats.open(), stats.closed(), stats.merged());
		logger.info("  With embedding: {}", stats.withEmbedding());
		logger.info("  With metrics: {}", stats.withMetrics());
		logger.info("  With recommendation: {}", stats.withRecommendation());
		for (Map.Entry<String, Integer> entry : stats.recommendations().entrySet()) {
			logger.info("    {}: {}", entry.getKey(), entry.getValue());
		}
		logger.info("  Latest update: {}", stats.latestUpdate() != null ? stats.latestUpdate() : "(none)");
		for (FetchCheckpoint checkpoint : stats.checkpoints()) {
			logger.info("  Checkpoint {}: {}", checkpoint.itemType().id(),
					checkpoint.lastWindowEnd() != null ? checkpoint.lastWindowEnd() : "(not started)");
		}
		return EXIT_OK;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.debug("Configuration:");
		logger.debug("  Command: {}", config.command);
		logger.debug("  Repository: {}", config.repository);
		logger.debug("  Prefix: {}", config.prefix != null ? config.prefix : "(none)");
		logger.debug("  Item types: {}", config.itemTypes);
		logger.debug("  Force: {}", config.force);
		logger.debug("  Start date: {}", config.startDate != null ? config.startDate : "(stored)");
		logger.debug("  Data directory: {}", config.dataDirectory);
		logger.debug("  Window days: {}", config.windowDays);
		logger.debug("  Embedding workers: {}", config.embeddingWorkers);
	}

	private static void logValidationResult(ValidationResult result) {
		logger.info("Validation summary:");
		logger.info("  Records scanned: {}", result.recordsScanned());
		logger.info("  Problems: {}", result.problems().size());
		logger.info("  Invalid records: {}", result.invalidNumbers().size());
		for (ValidationResult.Problem problem : result.problems()) {
			logger.info("  {}: #{} {}", problem.check(), problem.number(), problem.detail());
		}
	}

	private static void enableDebugLogging() {
		Logger triage = LoggerFactory.getLogger("org.springaicommunity.github.triage");
		if (triage instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
		}
	}

}
