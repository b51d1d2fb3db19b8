package org.springaicommunity.github.topn;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder wiring the ranking services.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from GITHUB_TOKEN (.env or environment), default properties
 * TopRepositoriesService service = GitHubTopNBuilder.create()
 *     .tokenFromEnv()
 *     .buildRankingService();
 *
 * RankedResult result = service.rank(RankingRequest.rest("netflix", 10, Metric.STARS));
 *
 * // Custom configuration
 * RankingProperties props = new RankingProperties();
 * props.setPullRequestConcurrency(4);
 *
 * TopRepositoriesService service = GitHubTopNBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .buildRankingService();
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * TopRepositoriesService testService = GitHubTopNBuilder.create()
 *     .httpClient(mockClient)
 *     .buildRankingService();
 * }
 * </pre>
 */
public class GitHubTopNBuilder {

	private @Nullable String token;

	private RankingProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private GitHubTopNBuilder() {
		this.properties = new RankingProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubTopNBuilder
	 */
	public static GitHubTopNBuilder create() {
		return new GitHubTopNBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token, or null to run unauthenticated
	 * @return this builder
	 */
	public GitHubTopNBuilder token(@Nullable String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from GITHUB_TOKEN ({@code .env} file or environment). Leaves
	 * the builder unauthenticated when the variable is not set.
	 * @return this builder
	 */
	public GitHubTopNBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.githubToken();
		return this;
	}

	/**
	 * Whether a token has been configured.
	 * @return true if a non-blank token is set
	 */
	public boolean hasToken() {
		return token != null && !token.isBlank();
	}

	/**
	 * Set ranking properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubTopNBuilder properties(@Nullable RankingProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubTopNBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators. A custom client is used as given, without the retry decorator.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubTopNBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Build the ranking service.
	 * @return configured TopRepositoriesService
	 */
	public TopRepositoriesService buildRankingService() {
		Components components = buildComponents();
		RepositoryFetcher fetcher = new RepositoryFetcher(components.restService, components.graphQLService,
				properties.getSearchPageSize());
		PullRequestEnricher enricher = new PullRequestEnricher(components.restService,
				properties.getPullRequestConcurrency());
		return new TopRepositoriesService(fetcher, enricher, new RepositoryRanker());
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient client = this.httpClient != null ? this.httpClient : createDefaultClient();

		GitHubRestService restService = new GitHubRestService(client, mapper);
		GitHubGraphQLService graphQLService = new GitHubGraphQLService(client, mapper);
		return new Components(restService, graphQLService);
	}

	private GitHubClient createDefaultClient() {
		GitHubClient client = new GitHubHttpClient(token, properties.getApiBaseUrl());
		if (properties.getMaxRetries() <= 0) {
			return client;
		}
		return new RetryingGitHubClient(client, properties);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(RestService restService, GraphQLService graphQLService) {
	}

}
