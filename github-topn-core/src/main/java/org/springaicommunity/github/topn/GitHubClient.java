package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST and GraphQL APIs, enabling testability and
 * decorator implementations such as {@link RetryingGitHubClient}.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request against the GitHub REST API.
	 * @param path API path without query string (e.g. "/search/repositories")
	 * @param queryString query string without leading ?, may be null or empty
	 * @return response body together with the response headers
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	GitHubResponse getWithQuery(String path, @Nullable String queryString);

	/**
	 * Execute a POST request to the GitHub GraphQL API.
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String postGraphQL(String body);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
