package org.springaicommunity.github.topn;

/**
 * Parameters of one ranking call.
 *
 * @param organization the GitHub organization login
 * @param n how many repositories to return at most
 * @param metric the metric to rank by
 * @param strategy how to retrieve repositories and pull-request totals
 */
public record RankingRequest(String organization, int n, Metric metric, RetrievalStrategy strategy) {

	public RankingRequest {
		if (organization == null || organization.isBlank()) {
			throw new IllegalArgumentException("organization is required");
		}
		if (n < 0) {
			throw new IllegalArgumentException("n must be non-negative: " + n);
		}
		if (metric == null) {
			throw new IllegalArgumentException("metric is required");
		}
		if (strategy == null) {
			throw new IllegalArgumentException("strategy is required");
		}
	}

	/**
	 * Request using the paginated REST strategy.
	 */
	public static RankingRequest rest(String organization, int n, Metric metric) {
		return new RankingRequest(organization, n, metric, RetrievalStrategy.REST);
	}

	/**
	 * Request using the combined GraphQL strategy.
	 */
	public static RankingRequest graphQL(String organization, int n, Metric metric) {
		return new RankingRequest(organization, n, metric, RetrievalStrategy.GRAPHQL);
	}

	/**
	 * Whether the REST search can pre-sort for this request, letting pagination stop
	 * after {@code n} items.
	 * @return true for REST requests ranked by stars or forks
	 */
	public boolean usesSearchOrder() {
		return strategy == RetrievalStrategy.REST && metric.isSearchSortable();
	}

}
