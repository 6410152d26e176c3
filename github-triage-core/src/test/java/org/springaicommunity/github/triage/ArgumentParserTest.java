package org.springaicommunity.github.triage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only.
 */
@DisplayName("ArgumentParser Tests - Plain JUnit Only")
class ArgumentParserTest {

	private TriageProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new TriageProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Command and Repository Tests")
	class CommandAndRepositoryTest {

		@Test
		@DisplayName("Should parse positional command and repository")
		void shouldParsePositionalArguments() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "pull", "jupyterlab/jupyterlab" });

			assertThat(config.command).isEqualTo("pull");
			assertThat(config.repository).isEqualTo("jupyterlab/jupyterlab");
			assertThat(config.collectionKey()).isEqualTo(CollectionKey.of("jupyterlab/jupyterlab"));
		}

		@Test
		@DisplayName("Should accept the repository as an option")
		void shouldParseRepoOption() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "stats", "--repo", "microsoft/vscode", "--prefix", "test-run" });

			assertThat(config.repository).isEqualTo("microsoft/vscode");
			assertThat(config.collectionKey().prefix()).isEqualTo("test-run");
		}

		@Test
		@DisplayName("Should normalise the command to lower case")
		void shouldLowerCaseCommand() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "UPDATE", "owner/repo" });

			assertThat(config.command).isEqualTo("update");
		}

		@ParameterizedTest
		@ValueSource(strings = { "pull", "update", "enrich", "validate", "clean", "stats" })
		@DisplayName("Should accept every known command")
		void shouldAcceptKnownCommands(String command) {
			assertThat(argumentParser.parseAndValidate(new String[] { command, "owner/repo" }).command)
				.isEqualTo(command);
		}

		@Test
		@DisplayName("Should reject an unknown command")
		void shouldRejectUnknownCommand() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "archive", "owner/repo" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Configuration validation failed:")
				.hasMessageContaining("Unknown command: archive");
		}

		@Test
		@DisplayName("Should require a command and a repository")
		void shouldRequireCommandAndRepository() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--verbose" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("A command is required")
				.hasMessageContaining("Repository cannot be empty");
		}

		@ParameterizedTest
		@ValueSource(strings = { "no-slash", "owner/repo/extra", "owner/", "/repo", "own er/repo" })
		@DisplayName("Should reject malformed repositories")
		void shouldRejectMalformedRepository(String repository) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "pull", repository }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Repository must be in format 'owner/repo'");
		}

		@Test
		@DisplayName("Should reject a prefix with path characters")
		void shouldRejectBadPrefix() {
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "pull", "owner/repo", "--prefix", "../x" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Prefix may only contain");
		}

		@Test
		@DisplayName("Should reject a third positional argument")
		void shouldRejectExtraArgument() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "pull", "owner/repo", "extra" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unexpected argument: extra");
		}

		@Test
		@DisplayName("Should reject unknown options")
		void shouldRejectUnknownOption() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "pull", "owner/repo", "--zip" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown option: --zip");
		}

	}

	@Nested
	@DisplayName("Pull Option Tests")
	class PullOptionTest {

		@Test
		@DisplayName("Should default to both item types and no start date override")
		void shouldUseDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "pull", "owner/repo" });

			assertThat(config.itemTypes).containsExactlyInAnyOrder(ItemType.ISSUE, ItemType.PULL_REQUEST);
			assertThat(config.startDate).isNull();
			assertThat(config.force).isFalse();
			assertThat(config.windowDays).isEqualTo(7);
		}

		@Test
		@DisplayName("Should parse item types")
		void shouldParseItemTypes() {
			assertThat(argumentParser
				.parseAndValidate(new String[] { "pull", "owner/repo", "--item-types", "issues" }).itemTypes)
				.containsExactly(ItemType.ISSUE);
			assertThat(argumentParser
				.parseAndValidate(new String[] { "pull", "owner/repo", "--item-types", "PRS" }).itemTypes)
				.containsExactly(ItemType.PULL_REQUEST);
		}

		@Test
		@DisplayName("Should reject invalid item types")
		void shouldRejectInvalidItemTypes() {
			assertThatThrownBy(() -> argumentParser
				.parseAndValidate(new String[] { "pull", "owner/repo", "--item-types", "discussions" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must be 'issues', 'prs', or 'both'");
		}

		@Test
		@DisplayName("Should parse start date, force and window width")
		void shouldParsePullOptions() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "pull", "owner/repo",
					"--start-date", "2024-06-01", "--force", "--window-days", "14" });

			assertThat(config.startDate).isEqualTo(LocalDate.of(2024, 6, 1));
			assertThat(config.force).isTrue();
			assertThat(config.windowDays).isEqualTo(14);
		}

		@Test
		@DisplayName("Should reject dates not in YYYY-MM-DD format")
		void shouldRejectInvalidDate() {
			assertThatThrownBy(() -> argumentParser
				.parseAndValidate(new String[] { "pull", "owner/repo", "--start-date", "01/06/2024" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must be YYYY-MM-DD format");
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-3", "seven" })
		@DisplayName("Should reject non-positive window and worker counts")
		void shouldRejectNonPositiveCounts(String value) {
			assertThatThrownBy(() -> argumentParser
				.parseAndValidate(new String[] { "pull", "owner/repo", "--window-days", value }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid window days");
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "enrich", "owner/repo", "--workers", value }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid workers");
		}

		@Test
		@DisplayName("Should report a missing option value")
		void shouldReportMissingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "pull", "owner/repo", "--repo" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Missing value for repo option");
		}

	}

	@Nested
	@DisplayName("Validate Option Tests")
	class ValidateOptionTest {

		@Test
		@DisplayName("Should accept --delete-invalid with validate")
		void shouldAcceptDeleteInvalidWithValidate() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "validate", "owner/repo", "--delete-invalid" });

			assertThat(config.deleteInvalid).isTrue();
		}

		@Test
		@DisplayName("Should reject --delete-invalid with other commands")
		void shouldRejectDeleteInvalidElsewhere() {
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "pull", "owner/repo", "--delete-invalid" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("--delete-invalid only applies to the validate command");
		}

	}

	@Nested
	@DisplayName("Properties Tests")
	class PropertiesTest {

		@Test
		@DisplayName("Should copy overrides onto properties")
		void shouldApplyOverrides() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "update", "owner/repo",
					"--data-dir", "/tmp/triage", "--workers", "8", "--start-date", "2024-01-01", "-v" });

			TriageProperties properties = config.applyTo(new TriageProperties());

			assertThat(properties.getDataDirectory()).isEqualTo("/tmp/triage");
			assertThat(properties.getEmbeddingWorkers()).isEqualTo(8);
			assertThat(properties.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 1));
			assertThat(properties.isDebug()).isTrue();
		}

		@Test
		@DisplayName("Should keep the default start date when none is given")
		void shouldKeepDefaultStartDate() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "pull", "owner/repo" });

			assertThat(config.applyTo(new TriageProperties()).getStartDate()).isEqualTo(LocalDate.of(2025, 1, 1));
		}

	}

	@Nested
	@DisplayName("Help Tests")
	class HelpTest {

		@Test
		@DisplayName("Should detect help flags and empty arguments")
		void shouldDetectHelp() {
			assertThat(argumentParser.isHelpRequested(new String[] {})).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "pull", "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "--help" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "pull", "owner/repo" })).isFalse();
		}

		@Test
		@DisplayName("Should skip validation when help is requested")
		void shouldSkipValidationForHelp() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--help" });

			assertThat(config.helpRequested).isTrue();
		}

		@Test
		@DisplayName("Should list commands and defaults in help text")
		void shouldGenerateHelpText() {
			String help = argumentParser.generateHelpText();

			assertThat(help).contains("Usage: github-triage <command> <owner/repo>");
			for (String command : ArgumentParser.COMMANDS) {
				assertThat(help).contains("    " + command + " ");
			}
			assertThat(help).contains("default: " + defaultProperties.getStartDate())
				.contains("GITHUB_TOKEN")
				.contains("--delete-invalid");
		}

	}

}
