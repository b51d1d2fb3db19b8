package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API operations used by the ranking.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON to encapsulate the GitHub API
 * response structure.
 */
public interface RestService {

	/**
	 * Fetch one page of a repository search.
	 * @param searchQuery search query, e.g. {@code org:netflix}
	 * @param sort field the index should sort by, descending ("stars" or "forks"), or
	 * null for the index's default order
	 * @param pageSize number of repositories per page (at most 100)
	 * @param cursor page number as string, or null for the first page
	 * @return the page's repositories and the cursor of the next page
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 * @throws ResponseDecodingException if the response cannot be decoded
	 */
	SearchResult<RepositorySnapshot> searchRepositories(String searchQuery, @Nullable String sort, int pageSize,
			@Nullable String cursor);

	/**
	 * Count the pull requests of a repository in any state with a single request.
	 * @param owner repository owner
	 * @param repo repository name
	 * @return total pull requests
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 * @throws ResponseDecodingException if the response cannot be decoded
	 */
	int countPullRequests(String owner, String repo);

	/**
	 * Build the repository search query for an organization.
	 * @param organization organization login
	 * @return search query string
	 */
	default String buildOrganizationQuery(String organization) {
		return "org:" + organization;
	}

}
