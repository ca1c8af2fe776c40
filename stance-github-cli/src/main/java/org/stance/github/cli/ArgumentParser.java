package org.stance.github.cli;

/**
 * Command-line argument parser for the issue report.
 */
public class ArgumentParser {

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-u", "--base-url":
					String baseUrl = getRequiredValue(args, i, "base-url");
					if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
						throw new IllegalArgumentException(
								"Invalid base URL '" + baseUrl + "': must start with http:// or https://");
					}
					config.baseUrl = baseUrl;
					i++; // Skip next argument since we consumed it
					break;

				case "-o", "--org":
					String org = getRequiredValue(args, i, "org").trim();
					if (org.isEmpty()) {
						throw new IllegalArgumentException("Organization login must not be empty");
					}
					config.organizations.add(org);
					i++; // Skip next argument since we consumed it
					break;

				case "-d", "--debug":
					config.debug = true;
					break;

				case "-h", "--help":
					config.help = true;
					break;

				default:
					throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}

		return config;
	}

	/**
	 * Returns true if help was requested anywhere in the arguments.
	 * @param args Command-line arguments
	 * @return whether -h or --help is present
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	public String generateHelpText() {
		return """
				Stance GitHub - list issues and pull requests across your organizations

				Usage: java -jar stance-github-cli.jar [OPTIONS]

				Options:
				  -u, --base-url <url>   GitHub API base address (default: https://api.github.com)
				  -o, --org <login>      Only report this organization (repeatable)
				  -d, --debug            Trace HTTP requests and responses to standard error
				  -h, --help             Show this help text

				Environment Variables:
				  GITHUB_TOKEN           Personal access token (required)
				  STANCE_GITHUB_DEBUG    Set to 'on' to trace HTTP requests and responses
				""";
	}

	private String getRequiredValue(String[] args, int index, String optionName) {
		if (index + 1 >= args.length || args[index + 1].startsWith("-")) {
			throw new IllegalArgumentException("Option --" + optionName + " requires a value");
		}
		return args[index + 1];
	}

}
