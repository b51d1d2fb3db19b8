package org.springaicommunity.github.topn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ranks an organization's repositories and returns the top-n.
 *
 * <p>
 * With {@link RetrievalStrategy#REST}, stars and forks come pre-sorted from the search
 * index and pagination stops after {@code n} repositories; prs and contribs fetch every
 * repository, count pull requests through {@link PullRequestEnricher}, then sort. With
 * {@link RetrievalStrategy#GRAPHQL} every repository is fetched with its pull-request
 * total in one query and sorted locally.
 *
 * <p>
 * Holds no state between calls. Any failed request fails the whole call; no partial
 * result is returned.
 */
public class TopRepositoriesService {

	private static final Logger logger = LoggerFactory.getLogger(TopRepositoriesService.class);

	private final RepositoryFetcher fetcher;

	private final PullRequestEnricher enricher;

	private final RepositoryRanker ranker;

	public TopRepositoriesService(RepositoryFetcher fetcher, PullRequestEnricher enricher, RepositoryRanker ranker) {
		this.fetcher = fetcher;
		this.enricher = enricher;
		this.ranker = ranker;
	}

	/**
	 * Rank the repositories of an organization.
	 * @param request organization, n, metric and strategy
	 * @return the top repositories, best first
	 * @throws GitHubHttpClient.GitHubApiException if any request fails
	 * @throws ResponseDecodingException if any response cannot be decoded
	 * @throws java.util.concurrent.CancellationException if interrupted during
	 * enrichment
	 */
	public RankedResult rank(RankingRequest request) {
		logger.info("Ranking top {} repositories of {} by {} using {}", request.n(), request.organization(),
				request.metric(), request.strategy().key());

		List<RankedRepository> top = switch (request.strategy()) {
			case REST -> rankWithRest(request);
			case GRAPHQL -> rankWithGraphQL(request);
		};
		return new RankedResult(request.organization(), request.metric(), request.strategy(), top);
	}

	private List<RankedRepository> rankWithRest(RankingRequest request) {
		List<RepositorySnapshot> fetched = fetcher.fetch(request.organization(), request.metric(), request.n());
		logger.info("Fetched {} repositories of {}", fetched.size(), request.organization());

		if (request.usesSearchOrder()) {
			// Already the global top-n in index order
			return ranker.top(fetched, request.n()).stream().map(RankedRepository::of).collect(Collectors.toList());
		}
		List<EnrichedSnapshot> enriched = enricher.enrich(request.organization(), fetched, request.metric());
		return rankAll(enriched, request);
	}

	private List<RankedRepository> rankWithGraphQL(RankingRequest request) {
		List<EnrichedSnapshot> fetched = fetcher.fetchWithPullRequests(request.organization());
		logger.info("Fetched {} repositories of {} with pull request totals", fetched.size(),
				request.organization());
		return rankAll(fetched, request);
	}

	private List<RankedRepository> rankAll(List<EnrichedSnapshot> repositories, RankingRequest request) {
		return ranker.rank(repositories, request.metric(), request.n())
			.stream()
			.map(RankedRepository::of)
			.collect(Collectors.toList());
	}

}
