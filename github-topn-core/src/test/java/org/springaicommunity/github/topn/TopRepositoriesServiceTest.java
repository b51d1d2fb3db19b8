package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end ranking over the in-memory fixture organization.
 */
@DisplayName("TopRepositoriesService Tests")
class TopRepositoriesServiceTest {

	private static TopRepositoriesService service(FakeGitHub gitHub, int pageSize, int concurrency) {
		return new TopRepositoriesService(new RepositoryFetcher(gitHub, gitHub, pageSize),
				new PullRequestEnricher(gitHub, concurrency), new RepositoryRanker());
	}

	private static List<String> names(RankedResult result) {
		return result.repositories().stream().map(RankedRepository::name).toList();
	}

	@Nested
	@DisplayName("REST Strategy")
	class RestStrategyTest {

		@Test
		@DisplayName("Should rank top 3 by contribution ratio")
		void shouldRankByContribs() {
			RankedResult result = service(FakeGitHub.netflix(), 100, 10)
				.rank(RankingRequest.rest("netflix", 3, Metric.CONTRIBS));

			assertThat(names(result)).containsExactly("metaflow", "SimianArmy", "boqboqboq");
			assertThat(result.repositories().get(0).contributionRatio().getAsDouble()).isCloseTo(11.66,
					within(0.01));
			assertThat(result.repositories().get(1).contributionRatio().getAsDouble()).isCloseTo(9.36, within(0.01));
			assertThat(result.repositories().get(2).contributionRatio().getAsDouble()).isCloseTo(0.11, within(0.01));
		}

		@Test
		@DisplayName("Should rank top 3 by stars without looking up pull requests")
		void shouldRankByStars() {
			FakeGitHub gitHub = FakeGitHub.netflix();

			RankedResult result = service(gitHub, 100, 10).rank(RankingRequest.rest("netflix", 3, Metric.STARS));

			assertThat(names(result)).containsExactly("metaflow", "Hystrix", "security_monkey");
			assertThat(result.repositories()).allSatisfy(r -> assertThat(r.pullRequests()).isEmpty());
			assertThat(gitHub.lookedUp()).isEmpty();
		}

		@Test
		@DisplayName("Should rank top 3 by forks")
		void shouldRankByForks() {
			RankedResult result = service(FakeGitHub.netflix(), 100, 10)
				.rank(RankingRequest.rest("netflix", 3, Metric.FORKS));

			assertThat(names(result)).containsExactly("SimianArmy", "metaflow", "chaosmonkey");
		}

		@Test
		@DisplayName("Should rank top 3 by pull requests with a present total")
		void shouldRankByPullRequests() {
			RankedResult result = service(FakeGitHub.netflix(), 2, 3)
				.rank(RankingRequest.rest("netflix", 3, Metric.PRS));

			assertThat(names(result)).containsExactly("SimianArmy", "metaflow", "zuul");
			assertThat(result.repositories().get(0).pullRequests()).hasValue(39811);
		}

		@Test
		@DisplayName("Should return all 7 repositories when n exceeds the organization size")
		void shouldReturnAllForLargeN() {
			RankedResult result = service(FakeGitHub.netflix(), 100, 10)
				.rank(RankingRequest.rest("netflix", 9999, Metric.CONTRIBS));

			assertThat(result.size()).isEqualTo(7);
		}

		@ParameterizedTest
		@EnumSource(value = Metric.class, names = { "STARS", "FORKS" })
		@DisplayName("Should match a full fetch and local sort when stopping early")
		void shouldMatchFullSortWhenStoppingEarly(Metric metric) {
			FakeGitHub gitHub = FakeGitHub.netflix();

			RankedResult result = service(gitHub, 2, 10).rank(RankingRequest.rest("netflix", 3, metric));

			List<String> expected = NetflixFixture.sortedBy(metric)
				.stream()
				.limit(3)
				.map(RepositorySnapshot::name)
				.toList();
			assertThat(names(result)).isEqualTo(expected);
			assertThat(gitHub.searchRequests()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should propagate a failed lookup without a partial result")
		void shouldPropagateFailure() {
			FakeGitHub gitHub = FakeGitHub.netflix().failingOn("zuul");

			assertThatThrownBy(() -> service(gitHub, 100, 2).rank(RankingRequest.rest("netflix", 3, Metric.PRS)))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
		}

	}

	@Nested
	@DisplayName("GraphQL Strategy")
	class GraphQLStrategyTest {

		@Test
		@DisplayName("Should agree with the REST strategy for every metric")
		void shouldAgreeWithRest() {
			for (Metric metric : Metric.values()) {
				RankedResult rest = service(FakeGitHub.netflix(), 3, 2)
					.rank(RankingRequest.rest("netflix", 5, metric));
				RankedResult graphQL = service(FakeGitHub.netflix(), 3, 2)
					.rank(RankingRequest.graphQL("netflix", 5, metric));

				assertThat(names(graphQL)).as("metric %s", metric).isEqualTo(names(rest));
			}
		}

		@Test
		@DisplayName("Should always carry pull request totals and make no per-repository lookups")
		void shouldCarryPullRequestTotals() {
			FakeGitHub gitHub = FakeGitHub.netflix();

			RankedResult result = service(gitHub, 100, 10).rank(RankingRequest.graphQL("netflix", 3, Metric.STARS));

			assertThat(names(result)).containsExactly("metaflow", "Hystrix", "security_monkey");
			assertThat(result.repositories()).allSatisfy(r -> assertThat(r.pullRequests()).isPresent());
			assertThat(result.strategy()).isEqualTo(RetrievalStrategy.GRAPHQL);
			assertThat(gitHub.lookedUp()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Ties")
	class TiesTest {

		private final List<RepositorySnapshot> tied = List.of(new RepositorySnapshot("zeta", 10, 1, true),
				new RepositorySnapshot("Alpha", 10, 1, true), new RepositorySnapshot("beta", 5, 1, true));

		// serves the repositories in the given order whatever sort is asked for
		private FakeGitHub indexOrder() {
			return new FakeGitHub(tied, Map.of()) {
				@Override
				public SearchResult<RepositorySnapshot> searchRepositories(String searchQuery, @Nullable String sort,
						int pageSize, @Nullable String cursor) {
					return SearchResult.lastPage(tied);
				}
			};
		}

		@Test
		@DisplayName("REST stars keeps the search index order among equal values")
		void restKeepsIndexOrder() {
			RankedResult result = service(indexOrder(), 100, 2).rank(RankingRequest.rest("acme", 2, Metric.STARS));

			assertThat(names(result)).containsExactly("zeta", "Alpha");
		}

		@Test
		@DisplayName("A local sort breaks equal values by name")
		void localSortBreaksTiesByName() {
			RankedResult result = service(indexOrder(), 100, 2).rank(RankingRequest.graphQL("acme", 2, Metric.STARS));

			assertThat(names(result)).containsExactly("Alpha", "zeta");
		}

	}

	@Test
	@DisplayName("Should reject invalid requests")
	void shouldRejectInvalidRequests() {
		assertThatThrownBy(() -> RankingRequest.rest(" ", 3, Metric.STARS))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> RankingRequest.rest("netflix", -1, Metric.STARS))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
