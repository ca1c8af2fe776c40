package org.stance.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration exposing a ready-to-use {@link GitHub} client.
 *
 * <p>
 * Reads {@code GITHUB_TOKEN}, {@code STANCE_GITHUB_DEBUG} and
 * {@code stance.github.base-url} from the Spring environment. Spring is an optional
 * dependency; the library works without it through {@link GitHubBuilder}.
 */
@Configuration
public class GitHubConfig {

	@Value("${GITHUB_TOKEN:}")
	private String githubToken;

	@Value("${STANCE_GITHUB_DEBUG:off}")
	private String debug;

	@Value("${stance.github.base-url:" + GitHubProperties.DEFAULT_BASE_ADDRESS + "}")
	private String baseUrl;

	@Bean
	public GitHubProperties gitHubProperties() {
		GitHubProperties properties = new GitHubProperties();
		properties.setBaseAddress(baseUrl);
		properties.setDebug(EnvironmentSupport.isOn(debug));
		return properties;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public GitHubClient gitHubClient(GitHubProperties properties) {
		return new GitHubHttpClient(properties);
	}

	@Bean
	public GitHub gitHub(GitHubProperties properties, GitHubClient gitHubClient, ObjectMapper objectMapper) {
		return GitHubBuilder.create()
			.properties(properties)
			.httpClient(gitHubClient)
			.objectMapper(objectMapper)
			.token(githubToken)
			.build();
	}

}
