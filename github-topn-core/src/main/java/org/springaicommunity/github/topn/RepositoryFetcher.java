package org.springaicommunity.github.topn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves an organization's repositories from the GitHub search index, one page at a
 * time.
 *
 * <p>
 * Pages are requested sequentially, since every request needs the cursor of the previous
 * response. Any failed page aborts the fetch; nothing is retried here.
 */
public class RepositoryFetcher {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryFetcher.class);

	private final RestService restService;

	private final GraphQLService graphQLService;

	private final int pageSize;

	public RepositoryFetcher(RestService restService, GraphQLService graphQLService, int pageSize) {
		if (pageSize <= 0 || pageSize > 100) {
			throw new IllegalArgumentException("pageSize must be between 1 and 100: " + pageSize);
		}
		this.restService = restService;
		this.graphQLService = graphQLService;
		this.pageSize = pageSize;
	}

	/**
	 * Fetch repositories through the REST search.
	 *
	 * <p>
	 * For stars and forks the index sorts descending and pagination stops once {@code n}
	 * repositories are collected, so the returned list is already the top-n in order. For
	 * other metrics every page is fetched and the list is in index order.
	 * @param organization organization login
	 * @param metric the metric that will be ranked by
	 * @param n number of repositories that will be returned
	 * @return fetched repositories
	 */
	public List<RepositorySnapshot> fetch(String organization, Metric metric, int n) {
		boolean searchOrder = metric.isSearchSortable();
		String sort = searchOrder ? metric.key() : null;
		String query = restService.buildOrganizationQuery(organization);

		List<RepositorySnapshot> repositories = new ArrayList<>();
		String cursor = null;
		int pages = 0;
		do {
			if (searchOrder && repositories.size() >= n) {
				break;
			}
			SearchResult<RepositorySnapshot> page = restService.searchRepositories(query, sort, pageSize, cursor);
			pages++;
			logger.debug("Search page {} for {} returned {} repositories", pages, organization, page.items().size());

			for (RepositorySnapshot repository : page.items()) {
				repositories.add(repository);
				if (searchOrder && repositories.size() == n) {
					logger.debug("Collected top {} by {} after {} page(s), skipping remaining pages", n, metric,
							pages);
					return repositories;
				}
			}
			cursor = page.hasMore() ? page.nextCursor() : null;
		}
		while (cursor != null);

		logger.debug("Fetched {} repositories for {} in {} page(s)", repositories.size(), organization, pages);
		return repositories;
	}

	/**
	 * Fetch every repository through the GraphQL search, pull-request totals included.
	 * @param organization organization login
	 * @return all repositories in index order
	 */
	public List<EnrichedSnapshot> fetchWithPullRequests(String organization) {
		String query = restService.buildOrganizationQuery(organization);

		List<EnrichedSnapshot> repositories = new ArrayList<>();
		String cursor = null;
		int pages = 0;
		do {
			SearchResult<EnrichedSnapshot> page = graphQLService.searchRepositoriesWithPullRequests(query, pageSize,
					cursor);
			pages++;
			logger.debug("GraphQL page {} for {} returned {} repositories", pages, organization,
					page.items().size());
			repositories.addAll(page.items());
			cursor = page.hasMore() ? page.nextCursor() : null;
		}
		while (cursor != null);

		logger.debug("Fetched {} repositories for {} in {} page(s)", repositories.size(), organization, pages);
		return repositories;
	}

}
