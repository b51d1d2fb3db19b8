package org.springaicommunity.github.topn.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.topn.*;

import java.io.PrintStream;
import java.time.Duration;

/**
 * GitHub top-n CLI Application
 *
 * Plain Java command-line application listing the top-n repositories of a GitHub
 * organization by stars, forks, pull requests or contribution ratio. Uses
 * GitHubTopNBuilder for service wiring.
 *
 * Usage: java -jar github-topn-cli.jar --org ORG --n N [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub token (optional for rest, required for
 * graphql)
 *
 * Examples: java -jar github-topn-cli.jar --org netflix --n 10 java -jar
 * github-topn-cli.jar --org netflix --n 5 --metric contribs --concurrency 20
 */
public class GitHubTopNCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubTopNCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		int exitCode = run(args, System.out);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	/**
	 * Run the CLI without exiting the JVM.
	 * @param args command-line arguments
	 * @param out destination of the ranking output
	 * @return process exit code
	 */
	public static int run(String[] args, PrintStream out) {
		RankingProperties properties = new RankingProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
			argumentParser.validateEnvironment(config);
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			logger.error(e.getMessage());
			System.err.println(argumentParser.generateHelpText());
			return EXIT_USAGE;
		}

		if (config.verbose) {
			setLogLevel(Level.DEBUG);
		}
		logConfiguration(config);

		GitHubTopNBuilder builder = GitHubTopNBuilder.create().tokenFromEnv().properties(config.applyTo(properties));
		if (!builder.hasToken()) {
			logger.warn("GITHUB_TOKEN not set, using unauthenticated requests with a lower rate limit");
		}
		return rank(builder.buildRankingService(), config, out);
	}

	static int rank(TopRepositoriesService service, ParsedConfiguration config, PrintStream out) {
		RankingRequest request = config.toRequest();
		RankingPrinter printer = new RankingPrinter(ObjectMapperFactory.create());
		boolean text = "text".equals(config.format);
		long start = System.nanoTime();

		if (text) {
			out.printf("Listing top %d repos for org \"%s\" by \"%s\"...%n", request.n(), request.organization(),
					request.metric().key());
		}

		RankedResult result;
		try {
			result = service.rank(request);
		}
		catch (RuntimeException e) {
			logger.error("Error listing top {} repos for org \"{}\" by \"{}\": {}", request.n(),
					request.organization(), request.metric().key(), e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return EXIT_FAILURE;
		}

		if (text) {
			printer.printText(result, out);
			out.println("Took " + Duration.ofNanos(System.nanoTime() - start));
		}
		else {
			printer.printJson(result, out);
			logger.info("Took {}", Duration.ofNanos(System.nanoTime() - start));
		}
		return EXIT_OK;
	}

	private static void setLogLevel(Level level) {
		Logger topn = LoggerFactory.getLogger("org.springaicommunity.github.topn");
		if (topn instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) topn).setLevel(level);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.debug("Configuration:");
		logger.debug("  Organization: {}", config.organization);
		logger.debug("  N: {}", config.n);
		logger.debug("  Metric: {}", config.metric.key());
		logger.debug("  Strategy: {}", config.strategy.key());
		logger.debug("  Concurrency: {}", config.concurrency);
		logger.debug("  Max retries: {}", config.maxRetries);
		logger.debug("  API URL: {}", config.apiUrl);
		logger.debug("  Format: {}", config.format);
	}

}
