package org.springaicommunity.github.triage;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Command-line argument parser for the triage commands. Plain Java, no framework, so it
 * can be tested in isolation.
 *
 * <p>
 * The first non-option argument is the command, the second the repository (which may
 * also be given with {@code --repo}).
 */
public class ArgumentParser {

	public static final List<String> COMMANDS = List.of("pull", "update", "enrich", "validate", "clean", "stats");

	private static final Pattern REPOSITORY_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$");

	private final TriageProperties defaultProperties;

	public ArgumentParser(TriageProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repo");
					i++;
					break;

				case "-p", "--prefix":
					config.prefix = getRequiredValue(args, i, "prefix");
					i++;
					break;

				case "--item-types":
					String itemTypes = getRequiredValue(args, i, "item-types").toLowerCase(Locale.ROOT);
					config.itemTypes = switch (itemTypes) {
						case "issues" -> EnumSet.of(ItemType.ISSUE);
						case "prs" -> EnumSet.of(ItemType.PULL_REQUEST);
						case "both" -> EnumSet.allOf(ItemType.class);
						default -> throw new IllegalArgumentException(
								"Invalid item types '" + itemTypes + "': must be 'issues', 'prs', or 'both'");
					};
					i++;
					break;

				case "-f", "--force":
					config.force = true;
					break;

				case "--start-date":
					String startDate = getRequiredValue(args, i, "start-date");
					try {
						config.startDate = LocalDate.parse(startDate);
					}
					catch (DateTimeParseException e) {
						throw new IllegalArgumentException(
								"Invalid date '" + startDate + "': must be YYYY-MM-DD format");
					}
					i++;
					break;

				case "--delete-invalid":
					config.deleteInvalid = true;
					break;

				case "-d", "--data-dir":
					config.dataDirectory = getRequiredValue(args, i, "data-dir");
					i++;
					break;

				case "--window-days":
					config.windowDays = parsePositive(getRequiredValue(args, i, "window-days"), "window days");
					i++;
					break;

				case "--workers":
					config.embeddingWorkers = parsePositive(getRequiredValue(args, i, "workers"), "workers");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.command == null) {
						config.command = arg.toLowerCase(Locale.ROOT);
					}
					else if (config.repository == null) {
						config.repository = arg;
					}
					else {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					break;
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested or no arguments are given
	 */
	public boolean isHelpRequested(String[] args) {
		if (args.length == 0) {
			return true;
		}
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-triage <command> <owner/repo> [OPTIONS]\n");
		help.append("\n");
		help.append("Pull GitHub issues and pull requests into a local collection and enrich them\n");
		help.append("with embeddings and metrics for triage.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    pull                    Fetch new and updated items since the last checkpoint\n");
		help.append("    update                  pull, then enrich what changed\n");
		help.append("    enrich                  Recompute embeddings, metrics and quartiles\n");
		help.append("    validate                Check the collection for inconsistent records\n");
		help.append("    clean                   Delete the collection\n");
		help.append("    stats                   Show collection statistics\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -r, --repo REPO         Repository in format owner/repo (or as second argument)\n");
		help.append("    -p, --prefix NAME       Collection prefix for isolating data (e.g. test runs)\n");
		help.append("    -d, --data-dir DIR      Data directory (default: ")
			.append(defaultProperties.getDataDirectory())
			.append(")\n");
		help.append("    -v, --verbose           Enable debug logging\n");
		help.append("\n");
		help.append("PULL OPTIONS:\n");
		help.append("    --item-types TYPES      What to fetch: issues, prs, both (default: both)\n");
		help.append("    --start-date DATE       First day to fetch for a new collection, YYYY-MM-DD (default: ")
			.append(defaultProperties.getStartDate())
			.append(")\n");
		help.append("    -f, --force             Refetch everything since the start date\n");
		help.append("    --window-days DAYS      Width of a fetch window (default: ")
			.append(defaultProperties.getWindowDays())
			.append(")\n");
		help.append("\n");
		help.append("ENRICH OPTIONS:\n");
		help.append("    --workers COUNT         Parallel embedding requests (default: ")
			.append(defaultProperties.getEmbeddingWorkers())
			.append(")\n");
		help.append("\n");
		help.append("VALIDATE OPTIONS:\n");
		help.append("    --delete-invalid        Remove records that fail validation\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES (also read from .env):\n");
		help.append("    GITHUB_TOKEN            GitHub personal access token (required for pull and update)\n");
		help.append("    MISTRAL_API_KEY         Mistral API key (embeddings are skipped without it)\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0 success, 1 error, 2 validation failed\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-triage pull jupyterlab/jupyterlab --start-date 2025-01-01\n");
		help.append("    github-triage update jupyterlab/jupyterlab\n");
		help.append("    github-triage pull owner/repo --prefix test --item-types issues\n");
		help.append("    github-triage validate owner/repo --delete-invalid\n");
		help.append("\n");
		return help.toString();
	}

	/**
	 * Validate environment for commands that talk to GitHub.
	 * @throws IllegalStateException if GITHUB_TOKEN is missing
	 */
	public void validateEnvironment() {
		if (EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN) == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositive(String value, String name) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be positive");
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("A command is required (one of " + String.join(", ", COMMANDS) + ")");
		}
		else if (!COMMANDS.contains(config.command)) {
			errors.add("Unknown command: " + config.command + " (must be one of " + String.join(", ", COMMANDS) + ")");
		}

		String repository = config.repository;
		if (repository == null || repository.isBlank()) {
			errors.add("Repository cannot be empty");
		}
		else if (!REPOSITORY_PATTERN.matcher(repository).matches()) {
			errors.add("Repository must be in format 'owner/repo' (e.g., 'jupyterlab/jupyterlab')");
		}

		String prefix = config.prefix;
		if (prefix != null && !prefix.matches("[a-zA-Z0-9_-]+")) {
			errors.add("Prefix may only contain letters, digits, '-' and '_'");
		}

		if (config.deleteInvalid && !"validate".equals(config.command)) {
			errors.add("--delete-invalid only applies to the validate command");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
