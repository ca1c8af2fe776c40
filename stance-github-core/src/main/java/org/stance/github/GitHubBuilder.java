package org.stance.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.PrintStream;

/**
 * Builder for {@link GitHub} clients.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token and debug switch taken from the environment
 * GitHub github = GitHubBuilder.create()
 *     .tokenFromEnv()
 *     .debugFromEnv()
 *     .build();
 *
 * // GitHub Enterprise
 * GitHub github = GitHubBuilder.create()
 *     .baseAddress("https://github.example.com/api/v3")
 *     .token("ghp_xxxxx")
 *     .build();
 *
 * // For testing with a mock transport
 * GitHubClient mockClient = mock(GitHubClient.class);
 * GitHub testGitHub = GitHubBuilder.create()
 *     .httpClient(mockClient)
 *     .build();
 * }
 * </pre>
 *
 * <p>
 * The environment is only consulted when {@link #tokenFromEnv()} or
 * {@link #debugFromEnv()} is called; the client never reads it on its own.
 */
public class GitHubBuilder {

	private GitHubProperties properties;

	@Nullable
	private String token;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private GitHubClient httpClient;

	private PrintStream trace = System.err;

	private GitHubBuilder() {
		this.properties = new GitHubProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubBuilder
	 */
	public static GitHubBuilder create() {
		return new GitHubBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubBuilder token(@Nullable String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from the GITHUB_TOKEN environment variable.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubBuilder tokenFromEnv() {
		String value = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		if (value == null || value.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		this.token = value;
		return this;
	}

	/**
	 * Enable tracing when STANCE_GITHUB_DEBUG is set to {@code on}. Leaves the current
	 * setting alone otherwise.
	 * @return this builder
	 */
	public GitHubBuilder debugFromEnv() {
		if (EnvironmentSupport.isDebugEnabled()) {
			this.properties.setDebug(true);
		}
		return this;
	}

	/**
	 * Set the API base address.
	 * @param baseAddress base address, a trailing slash is ignored
	 * @return this builder
	 */
	public GitHubBuilder baseAddress(String baseAddress) {
		this.properties.setBaseAddress(baseAddress);
		return this;
	}

	/**
	 * Turn request/response tracing on or off.
	 * @param debug whether to trace
	 * @return this builder
	 */
	public GitHubBuilder debug(boolean debug) {
		this.properties.setDebug(debug);
		return this;
	}

	/**
	 * Set client properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubBuilder properties(@Nullable GitHubProperties properties) {
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
	public GitHubBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the stream that request/response traces are written to.
	 * @param trace trace stream (default: standard error)
	 * @return this builder
	 */
	public GitHubBuilder trace(PrintStream trace) {
		this.trace = trace;
		return this;
	}

	/**
	 * Build the client.
	 * @return configured GitHub client, authenticated when a token was given
	 */
	public GitHub build() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient client = this.httpClient != null ? this.httpClient : new GitHubHttpClient(properties);

		GitHub github = new GitHub(properties.getBaseAddress(), client, mapper, trace, properties.isDebug());
		if (token != null && !token.isBlank()) {
			github.authenticate(GitHub.TOKEN_AUTH, token);
		}
		return github;
	}

}
