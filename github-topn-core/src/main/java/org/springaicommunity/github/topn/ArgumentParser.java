package org.springaicommunity.github.topn;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the top-n repository ranking. Pure Java, no framework
 * dependencies, for maximum testability.
 */
public class ArgumentParser {

	private final RankingProperties defaultProperties;

	public ArgumentParser(RankingProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-o", "--org":
					config.organization = getRequiredValue(args, i, "org");
					i++;
					break;

				case "-n", "--n":
					config.n = parseInt(getRequiredValue(args, i, "n"), "n");
					i++;
					break;

				case "-m", "--metric":
					config.metric = Metric.fromKey(getRequiredValue(args, i, "metric"));
					i++;
					break;

				case "-s", "--strategy":
					config.strategy = RetrievalStrategy.fromKey(getRequiredValue(args, i, "strategy"));
					i++;
					break;

				case "-c", "--concurrency":
					config.concurrency = parseInt(getRequiredValue(args, i, "concurrency"), "concurrency");
					i++;
					break;

				case "--max-retries":
					config.maxRetries = parseInt(getRequiredValue(args, i, "max-retries"), "max-retries");
					i++;
					break;

				case "--api-url":
					config.apiUrl = getRequiredValue(args, i, "api-url");
					i++;
					break;

				case "-f", "--format":
					config.format = getRequiredValue(args, i, "format").toLowerCase();
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-topn --org ORG --n N [OPTIONS]\n");
		help.append("\n");
		help.append("List the top-n repositories of a GitHub organization by a metric.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                 Show this help message\n");
		help.append("    -o, --org ORG              Organization to rank repositories for (required)\n");
		help.append("    -n, --n N                  Number of repositories to list (required, > 0)\n");
		help.append("    -m, --metric METRIC        Metric: ")
			.append(Metric.keys())
			.append(" (default: ")
			.append(defaultProperties.getDefaultMetric().key())
			.append(")\n");
		help.append("    -s, --strategy STRATEGY    Retrieval: rest, graphql (default: ")
			.append(defaultProperties.getDefaultStrategy().key())
			.append(")\n");
		help.append("                               graphql fetches pull request totals in the same query\n");
		help.append("    -c, --concurrency C        Concurrent pull request lookups for prs/contribs with rest\n");
		help.append("                               (default: ")
			.append(defaultProperties.getPullRequestConcurrency())
			.append(")\n");
		help.append("    --max-retries K            Retries per failed request, 0 to disable (default: ")
			.append(defaultProperties.getMaxRetries())
			.append(")\n");
		help.append("    --api-url URL              REST API base URL (default: ")
			.append(defaultProperties.getApiBaseUrl())
			.append(")\n");
		help.append("    -f, --format FORMAT        Output format: text, json (default: text)\n");
		help.append("    -v, --verbose              Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN               GitHub token; optional for rest (higher rate limit),\n");
		help.append("                               required for graphql\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-topn --org netflix --n 10\n");
		help.append("    github-topn --org netflix --n 5 --metric forks\n");
		help.append("    github-topn --org netflix --n 5 --metric contribs --concurrency 20\n");
		help.append("    github-topn --org netflix --n 5 --metric prs --strategy graphql --format json\n");
		help.append("\n");
		return help.toString();
	}

	/**
	 * Validate the environment for the parsed configuration.
	 * @param config parsed configuration
	 * @throws IllegalStateException if the GraphQL strategy is chosen without a token
	 */
	public void validateEnvironment(ParsedConfiguration config) {
		if (config.strategy == RetrievalStrategy.GRAPHQL && EnvironmentSupport.githubToken() == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required for the graphql strategy. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parseInt(String value, String optionName) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be an integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		if (config.organization == null || config.organization.trim().isEmpty()) {
			errors.add("--org is required");
		}
		else if (!config.organization.matches("^[a-zA-Z0-9][a-zA-Z0-9-]*$")) {
			errors.add("Invalid organization: " + config.organization);
		}

		if (config.n == null) {
			errors.add("--n is required");
		}
		else if (config.n <= 0) {
			errors.add("n must be positive (got: " + config.n + ")");
		}

		if (config.concurrency <= 0) {
			errors.add("Concurrency must be positive (got: " + config.concurrency + ")");
		}

		if (config.maxRetries < 0) {
			errors.add("Max retries must be non-negative (got: " + config.maxRetries + ")");
		}

		if (!config.apiUrl.startsWith("http://") && !config.apiUrl.startsWith("https://")) {
			errors.add("API URL must start with http:// or https:// (got: " + config.apiUrl + ")");
		}

		if (!List.of("text", "json").contains(config.format)) {
			errors.add("Invalid format: " + config.format + " (must be 'text' or 'json')");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
