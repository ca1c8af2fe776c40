package org.stance.github.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stance.github.GitHub;
import org.stance.github.Issue;
import org.stance.github.JsonNodeUtils;
import org.stance.github.Organization;
import org.stance.github.Repository;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Prints every issue of every repository of every organization visible to a client.
 *
 * <pre>
 * spring-projects / spring-ai:
 * 42     Fix NPE in advisor chain        octocat     [2024-05-01T12:00:00Z]
 * </pre>
 */
public class IssueReport {

	private static final Logger logger = LoggerFactory.getLogger(IssueReport.class);

	static final String LINE_FORMAT = "%-5s  %-30.30s  %-10.10s  [%s]%n";

	private final GitHub github;

	private final PrintStream out;

	public IssueReport(GitHub github, PrintStream out) {
		this.github = github;
		this.out = out;
	}

	/**
	 * Writes the report.
	 * @param includeOrg selects organizations by login
	 * @return 0 on success, 2 when the organization list could not be fetched
	 */
	public int write(Predicate<String> includeOrg) {
		List<Organization> orgs = github.orgs();
		if (orgs.isEmpty() && github.lastError().isPresent()) {
			logger.error("Unable to list organizations: {}", describe(github.lastError().get()));
			return 2;
		}

		for (Organization org : orgs) {
			String login = Optional.ofNullable(org.login()).orElse("?");
			if (!includeOrg.test(login)) {
				logger.debug("Skipping organization {}", login);
				continue;
			}
			for (Repository repo : org.repos()) {
				out.printf("%s / %s:%n", login, repo.name().orElse("?"));
				for (Issue issue : repo.issues()) {
					out.print(formatLine(issue));
				}
				out.println();
			}
		}
		out.flush();
		return 0;
	}

	static String formatLine(Issue issue) {
		return String.format(LINE_FORMAT, issue.number().map(String::valueOf).orElse(""), issue.title().orElse(""),
				issue.userLogin().orElse(""), JsonNodeUtils.getString(issue.raw(), "updated_at").orElse(""));
	}

	private static String describe(JsonNode error) {
		return JsonNodeUtils.getString(error, "message").orElse(error.toString());
	}

}
