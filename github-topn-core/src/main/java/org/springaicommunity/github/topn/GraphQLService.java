package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub GraphQL API operations used by the ranking.
 *
 * <p>
 * Extracted to enable mocking in tests and support decorator pattern.
 */
public interface GraphQLService {

	/**
	 * Fetch one page of a repository search, with each repository's pull-request total
	 * included.
	 * @param searchQuery search query, e.g. {@code org:netflix}
	 * @param pageSize number of repositories per page (at most 100)
	 * @param cursor end cursor of the previous page, or null for the first page
	 * @return the page's repositories and the cursor of the next page
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 * @throws ResponseDecodingException if the response cannot be decoded or reports
	 * errors
	 */
	SearchResult<EnrichedSnapshot> searchRepositoriesWithPullRequests(String searchQuery, int pageSize,
			@Nullable String cursor);

}
