package org.stance.github.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.stance.github.GitHub;
import org.stance.github.GitHubClient;
import org.stance.github.GitHubRequest;
import org.stance.github.GitHubResponse;
import org.stance.github.Issue;
import org.stance.github.ObjectMapperFactory;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link IssueReport} with a mocked transport.
 */
@DisplayName("IssueReport Tests")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IssueReportTest {

	private static final String API = "https://api.github.com";

	@Mock
	private GitHubClient mockClient;

	private final Map<String, GitHubResponse> responses = new HashMap<>();

	private ByteArrayOutputStream output;

	private IssueReport report;

	@BeforeEach
	void setUp() {
		when(mockClient.send(any())).thenAnswer(invocation -> {
			GitHubRequest request = invocation.getArgument(0);
			return responses.getOrDefault(request.url(), GitHubResponse.of(404, "{\"message\":\"Not Found\"}"));
		});
		output = new ByteArrayOutputStream();
		GitHub github = new GitHub(API, mockClient, ObjectMapperFactory.create()).authenticate("token", "t");
		report = new IssueReport(github, new PrintStream(output, true, StandardCharsets.UTF_8));
	}

	private void respond(String url, String body) {
		responses.put(url, GitHubResponse.of(200, body));
	}

	private String output() {
		return output.toString(StandardCharsets.UTF_8);
	}

	@Test
	@DisplayName("Should print one block per repository with one line per issue")
	void shouldPrintReport() {
		respond(API + "/user/orgs", """
				[{"login": "stance", "url": "https://api.github.com/orgs/stance",
				  "repos_url": "https://api.github.com/orgs/stance/repos"}]
				""");
		respond(API + "/orgs/stance/repos", """
				[{"name": "deploy", "url": "https://api.github.com/repos/stance/deploy",
				  "issues_url": "https://api.github.com/repos/stance/deploy/issues{/number}", "has_issues": true}]
				""");
		respond(API + "/repos/stance/deploy/issues", """
				[{"number": 12, "title": "Deployment hangs when the target cluster is unreachable",
				  "user": {"login": "octocat-the-great"}, "updated_at": "2024-05-01T12:00:00Z"},
				 {"number": 11, "title": "Add retries", "user": {"login": "hubot"},
				  "updated_at": "2024-04-30T08:15:00Z", "pull_request": {}}]
				""");

		int exitCode = report.write(login -> true);

		assertThat(exitCode).isZero();
		assertThat(output()).startsWith("stance / deploy:" + System.lineSeparator())
			.contains("12     Deployment hangs when the targ  octocat-th  [2024-05-01T12:00:00Z]")
			.contains("11     Add retries                     hubot       [2024-04-30T08:15:00Z]");
	}

	@Test
	@DisplayName("Should skip organizations rejected by the filter")
	void shouldSkipFilteredOrganizations() {
		respond(API + "/user/orgs", """
				[{"login": "acme", "repos_url": "https://api.github.com/orgs/acme/repos"}]
				""");

		int exitCode = report.write(login -> login.equals("stance"));

		assertThat(exitCode).isZero();
		assertThat(output()).isEmpty();
		verify(mockClient, times(1)).send(any());
	}

	@Test
	@DisplayName("Should return 2 when organizations cannot be listed")
	void shouldFailWhenOrganizationsUnavailable() {
		responses.put(API + "/user/orgs", GitHubResponse.of(401, "{\"message\":\"Bad credentials\"}"));

		int exitCode = report.write(login -> true);

		assertThat(exitCode).isEqualTo(2);
		assertThat(output()).isEmpty();
	}

	@Test
	@DisplayName("Should format an issue with missing fields")
	void shouldFormatSparseIssue() throws Exception {
		Issue issue = new Issue(ObjectMapperFactory.create().readTree("{\"number\": 3}"));

		assertThat(IssueReport.formatLine(issue)).isEqualTo("3" + " ".repeat(50) + "[]" + System.lineSeparator());
	}

}
