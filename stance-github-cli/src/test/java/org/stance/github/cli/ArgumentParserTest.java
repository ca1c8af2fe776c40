package org.stance.github.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only.
 */
@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		argumentParser = new ArgumentParser();
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@Test
		@DisplayName("Should use defaults when no arguments are given")
		void shouldUseDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[0]);

			assertThat(config.baseUrl).isNull();
			assertThat(config.organizations).isEmpty();
			assertThat(config.debug).isFalse();
			assertThat(config.help).isFalse();
		}

		@Test
		@DisplayName("Should parse base URL argument correctly")
		void shouldParseBaseUrl() {
			String[] args = { "--base-url", "https://ghe.example.com/api/v3" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.baseUrl).isEqualTo("https://ghe.example.com/api/v3");
		}

		@Test
		@DisplayName("Should collect repeated organization filters")
		void shouldCollectOrganizations() {
			String[] args = { "-o", "stance", "--org", "acme", "-d" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.organizations).containsExactly("stance", "acme");
			assertThat(config.debug).isTrue();
			assertThat(config.includes("acme")).isTrue();
			assertThat(config.includes("other")).isFalse();
			assertThat(config.includes(null)).isFalse();
		}

		@Test
		@DisplayName("Should include every organization without a filter")
		void shouldIncludeAllWithoutFilter() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[0]);

			assertThat(config.includes("anything")).isTrue();
		}

		@ParameterizedTest
		@ValueSource(strings = { "-h", "--help" })
		@DisplayName("Should detect help requests")
		void shouldDetectHelp(String flag) {
			assertThat(argumentParser.isHelpRequested(new String[] { "-d", flag })).isTrue();
			assertThat(argumentParser.generateHelpText()).contains("GITHUB_TOKEN").contains("STANCE_GITHUB_DEBUG");
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@Test
		@DisplayName("Should reject a base URL that is not http(s)")
		void shouldRejectInvalidBaseUrl() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--base-url", "ftp://x" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid base URL");
		}

		@Test
		@DisplayName("Should reject an option without its value")
		void shouldRejectMissingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--org" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("requires a value");
		}

		@Test
		@DisplayName("Should reject unknown options")
		void shouldRejectUnknownOption() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--repo", "o/r" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown option: --repo");
		}

	}

}
