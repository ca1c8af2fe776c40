package org.stance.github.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stance.github.GitHub;
import org.stance.github.GitHubBuilder;
import org.stance.github.GitHubException;

/**
 * Stance GitHub CLI
 *
 * Walks every organization visible to the token, every repository in it and every issue
 * (pull requests included) in those, and prints one line per issue.
 *
 * Usage: java -jar stance-github-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication,
 * STANCE_GITHUB_DEBUG - set to "on" to trace HTTP traffic to standard error
 */
public class StanceGitHubCli {

	private static final Logger logger = LoggerFactory.getLogger(StanceGitHubCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (IllegalArgumentException | IllegalStateException | GitHubException e) {
			logger.error("Report failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		ArgumentParser argumentParser = new ArgumentParser();

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);

		GitHubBuilder builder = GitHubBuilder.create().tokenFromEnv().debugFromEnv();
		if (config.baseUrl != null) {
			builder.baseAddress(config.baseUrl);
		}
		if (config.debug) {
			builder.debug(true);
		}
		GitHub github = builder.build();

		logger.info("Listing issues from {}", github.getBaseAddress());
		return new IssueReport(github, System.out).write(config::includes);
	}

}
