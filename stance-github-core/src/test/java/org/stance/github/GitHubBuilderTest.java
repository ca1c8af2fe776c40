package org.stance.github;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

/**
 * Tests for {@link GitHubBuilder} using plain JUnit only.
 */
@DisplayName("GitHubBuilder Tests")
class GitHubBuilderTest {

	static boolean isGitHubTokenAvailable() {
		String token = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		return token != null && !token.isBlank();
	}

	@Test
	@DisplayName("Should build an anonymous client against the public API by default")
	void shouldBuildDefaults() {
		GitHub github = GitHubBuilder.create().build();

		assertThat(github.getBaseAddress()).isEqualTo("https://api.github.com");
		assertThat(github.isAuthenticated()).isFalse();
		assertThat(github.isDebug()).isFalse();
	}

	@Test
	@DisplayName("Should authenticate with the given token through the custom transport")
	void shouldUseTokenAndTransport() {
		StubGitHubClient client = new StubGitHubClient().respond("https://ghe.example.com/api/v3/user/orgs", 200,
				"[]");

		GitHub github = GitHubBuilder.create()
			.baseAddress("https://ghe.example.com/api/v3/")
			.token("ghp_secret")
			.httpClient(client)
			.build();
		github.orgs();

		assertThat(github.isAuthenticated()).isTrue();
		assertThat(client.requests()).singleElement()
			.satisfies(request -> assertThat(request.header("Authorization")).isEqualTo("token ghp_secret"));
	}

	@Test
	@DisplayName("Should ignore a blank token")
	void shouldIgnoreBlankToken() {
		GitHub github = GitHubBuilder.create().token("  ").httpClient(new StubGitHubClient()).build();

		assertThat(github.isAuthenticated()).isFalse();
	}

	@Test
	@DisplayName("Should write traces to the configured stream when debug is on")
	void shouldTraceToConfiguredStream() {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		GitHub github = GitHubBuilder.create()
			.debug(true)
			.trace(new PrintStream(buffer, true, StandardCharsets.UTF_8))
			.httpClient(new StubGitHubClient())
			.build();

		github.get("/zen");

		assertThat(github.isDebug()).isTrue();
		assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("=====[ GET /zen ]").contains("HTTP 404");
	}

	@Test
	@DisplayName("Should take base address and debug flag from properties")
	void shouldApplyProperties() {
		GitHubProperties properties = new GitHubProperties();
		properties.setBaseAddress("https://ghe.example.com/api/v3");
		properties.setDebug(true);

		GitHub github = GitHubBuilder.create().properties(properties).properties(null).build();

		assertThat(github.getBaseAddress()).isEqualTo("https://ghe.example.com/api/v3");
		assertThat(github.isDebug()).isTrue();
	}

	@Test
	@DisplayName("Should have correct default properties")
	void shouldHaveDefaultProperties() {
		GitHubProperties properties = new GitHubProperties();

		assertThat(properties.getBaseAddress()).isEqualTo(GitHubProperties.DEFAULT_BASE_ADDRESS);
		assertThat(properties.isDebug()).isFalse();
		assertThat(properties.getUserAgent()).isEqualTo("stance-github/1.0.0");
		assertThat(properties.getConnectTimeoutSeconds()).isEqualTo(30);
	}

	@Test
	@DisplayName("Should require GITHUB_TOKEN when reading the token from the environment")
	void shouldRequireTokenFromEnv() {
		assumeFalse(isGitHubTokenAvailable(), "GITHUB_TOKEN is set in this environment");

		assertThatThrownBy(() -> GitHubBuilder.create().tokenFromEnv()).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("GITHUB_TOKEN");
	}

	@Test
	@DisplayName("Should only treat 'on' as enabling the debug switch")
	void shouldOnlyAcceptOn() {
		assertThat(EnvironmentSupport.isOn("on")).isTrue();
		assertThat(EnvironmentSupport.isOn("ON")).isFalse();
		assertThat(EnvironmentSupport.isOn("1")).isFalse();
		assertThat(EnvironmentSupport.isOn(null)).isFalse();
	}

}
