package org.springaicommunity.github.topn.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.github.topn.ArgumentParser;
import org.springaicommunity.github.topn.GitHubHttpClient;
import org.springaicommunity.github.topn.Metric;
import org.springaicommunity.github.topn.ParsedConfiguration;
import org.springaicommunity.github.topn.RankedRepository;
import org.springaicommunity.github.topn.RankedResult;
import org.springaicommunity.github.topn.RankingProperties;
import org.springaicommunity.github.topn.RankingRequest;
import org.springaicommunity.github.topn.RepositorySnapshot;
import org.springaicommunity.github.topn.RetrievalStrategy;
import org.springaicommunity.github.topn.TopRepositoriesService;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * CLI tests. No real GitHub API calls: ranking runs against a mocked service.
 */
@DisplayName("GitHubTopNCli Tests")
class GitHubTopNCliTest {

	private ByteArrayOutputStream buffer;

	private PrintStream out;

	@BeforeEach
	void setUp() {
		buffer = new ByteArrayOutputStream();
		out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
	}

	private String output() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Nested
	@DisplayName("Argument Handling")
	class ArgumentHandlingTest {

		@Test
		@DisplayName("Should print help and succeed")
		void shouldPrintHelp() {
			int exitCode = GitHubTopNCli.run(new String[] { "--help" }, out);

			assertThat(exitCode).isEqualTo(GitHubTopNCli.EXIT_OK);
			assertThat(output()).startsWith("Usage: github-topn");
		}

		@Test
		@DisplayName("Should return usage error for missing arguments")
		void shouldFailOnMissingArguments() {
			int exitCode = GitHubTopNCli.run(new String[] { "--org", "netflix" }, out);

			assertThat(exitCode).isEqualTo(GitHubTopNCli.EXIT_USAGE);
			assertThat(output()).isEmpty();
		}

		@Test
		@DisplayName("Should return usage error for an unknown metric")
		void shouldFailOnUnknownMetric() {
			int exitCode = GitHubTopNCli.run(new String[] { "--org", "netflix", "--n", "3", "--metric", "issues" },
					out);

			assertThat(exitCode).isEqualTo(GitHubTopNCli.EXIT_USAGE);
		}

	}

	@Nested
	@DisplayName("Ranking Output")
	@ExtendWith(MockitoExtension.class)
	class RankingOutputTest {

		@Mock
		private TopRepositoriesService service;

		private ParsedConfiguration parse(String... args) {
			return new ArgumentParser(new RankingProperties()).parseAndValidate(args);
		}

		private RankedResult stars() {
			return new RankedResult("netflix", Metric.STARS, RetrievalStrategy.REST,
					List.of(RankedRepository.of(new RepositorySnapshot("metaflow", 20787, 2963, true)),
							RankedRepository.of(new RepositorySnapshot("Hystrix", 10248, 728, true))));
		}

		@Test
		@DisplayName("Should print header, ranked lines and elapsed time")
		void shouldPrintTextRanking() {
			when(service.rank(RankingRequest.rest("netflix", 2, Metric.STARS))).thenReturn(stars());

			int exitCode = GitHubTopNCli.rank(service, parse("--org", "netflix", "--n", "2"), out);

			assertThat(exitCode).isEqualTo(GitHubTopNCli.EXIT_OK);
			List<String> lines = output().lines().toList();
			assertThat(lines).hasSize(4);
			assertThat(lines.get(0)).isEqualTo("Listing top 2 repos for org \"netflix\" by \"stars\"...");
			assertThat(lines.get(1)).isEqualTo("1) repo: \"metaflow\", stars: 20787");
			assertThat(lines.get(2)).isEqualTo("2) repo: \"Hystrix\", stars: 10248");
			assertThat(lines.get(3)).startsWith("Took PT");
		}

		@Test
		@DisplayName("Should print only JSON in json format")
		void shouldPrintJsonRanking() {
			when(service.rank(RankingRequest.rest("netflix", 2, Metric.STARS))).thenReturn(stars());

			int exitCode = GitHubTopNCli.rank(service, parse("--org", "netflix", "--n", "2", "--format", "json"), out);

			assertThat(exitCode).isEqualTo(GitHubTopNCli.EXIT_OK);
			assertThat(output().trim()).startsWith("{").endsWith("}").contains("\"metaflow\"");
		}

		@Test
		@DisplayName("Should return failure when ranking fails")
		void shouldReturnFailureOnError() {
			when(service.rank(any())).thenThrow(new GitHubHttpClient.GitHubApiException("Not found", 404, "{}"));

			int exitCode = GitHubTopNCli.rank(service, parse("--org", "nope", "--n", "2", "-s", "graphql"), out);

			assertThat(exitCode).isEqualTo(GitHubTopNCli.EXIT_FAILURE);
			assertThat(output()).doesNotContain("repo:");
		}

	}

}
