package org.springaicommunity.scvs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser. Parsing never touches the file system.
 */
@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private ScvsProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new ScvsProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Option Parsing")
	class OptionParsingTest {

		@Test
		@DisplayName("Should fall back to the default properties")
		void shouldUseDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[0]);

			assertThat(config.dataDirectory).isEqualTo(".scvs");
			assertThat(config.user).isEqualTo(defaultProperties.getUser());
			assertThat(config.autosave).isTrue();
			assertThat(config.enforcePermissions).isTrue();
			assertThat(config.logLimit).isEqualTo(20);
			assertThat(config.repository).isNull();
			assertThat(config.hasCommand()).isFalse();
		}

		@Test
		@DisplayName("Should parse value options in short and long form")
		void shouldParseValueOptions() {
			String[] args = { "-d", "/tmp/scvs", "--user", " ana@example.com ", "-r", "proyect", "--log-limit", "5" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.dataDirectory).isEqualTo("/tmp/scvs");
			assertThat(config.user).isEqualTo("ana@example.com");
			assertThat(config.repository).isEqualTo("proyect");
			assertThat(config.logLimit).isEqualTo(5);
		}

		@Test
		@DisplayName("Should parse boolean flags correctly")
		void shouldParseBooleanFlags() {
			String[] args = { "--no-autosave", "--no-permissions", "--verbose" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.autosave).isFalse();
			assertThat(config.enforcePermissions).isFalse();
			assertThat(config.verbose).isTrue();
		}

		@Test
		@DisplayName("Should treat everything after the first plain token as the command")
		void shouldCollectCommand() {
			String[] args = { "-r", "proyect", "commit", "-v", "fix", "bug" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.command).containsExactly("commit", "-v", "fix", "bug");
			assertThat(config.verbose).isFalse();
			assertThat(config.hasCommand()).isTrue();
		}

		@Test
		@DisplayName("Should copy parsed values onto properties")
		void shouldApplyToProperties() {
			String[] args = { "-d", "data", "-u", "luis@example.com", "--no-autosave", "--log-limit", "3" };

			ScvsProperties properties = argumentParser.parseAndValidate(args).applyTo(new ScvsProperties());

			assertThat(properties.getDataDirectory()).isEqualTo("data");
			assertThat(properties.getUser()).isEqualTo("luis@example.com");
			assertThat(properties.isAutosave()).isFalse();
			assertThat(properties.getLogLimit()).isEqualTo(3);
		}

	}

	@Nested
	@DisplayName("Validation")
	class ValidationTest {

		@Test
		@DisplayName("Should reject unknown options")
		void shouldRejectUnknownOption() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--force" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown option: --force");
		}

		@Test
		@DisplayName("Should require a value after value options")
		void shouldRequireValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--user" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing value for user");
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-3", "many" })
		@DisplayName("Should reject log limits that are not positive integers")
		void shouldRejectInvalidLogLimit(String limit) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--log-limit", limit }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("og limit");
		}

		@Test
		@DisplayName("Should reject blank users and repositories")
		void shouldRejectBlankValues() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-u", "  " }))
				.hasMessage("User cannot be empty");
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-r", " " }))
				.hasMessage("Repository name cannot be empty");
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-d", "" }))
				.hasMessage("Data directory cannot be empty");
		}

	}

	@Nested
	@DisplayName("Help")
	class HelpTest {

		@Test
		@DisplayName("Should detect help before the command starts")
		void shouldDetectHelp() {
			assertThat(argumentParser.isHelpRequested(new String[] { "-v", "--help" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "pr", "--help" })).isFalse();
			assertThat(argumentParser.parseAndValidate(new String[] { "-h" }).helpRequested).isTrue();
		}

		@Test
		@DisplayName("Should describe options and environment variables")
		void shouldGenerateHelpText() {
			String help = argumentParser.generateHelpText();

			assertThat(help).startsWith("Usage: scvs [OPTIONS] [COMMAND [ARGS...]]")
				.contains("--data-dir", "--no-permissions", "--log-limit", EnvironmentSupport.USER_VARIABLE,
						EnvironmentSupport.DATA_DIRECTORY_VARIABLE);
		}

	}

}
