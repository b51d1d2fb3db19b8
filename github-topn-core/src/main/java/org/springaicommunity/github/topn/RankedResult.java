package org.springaicommunity.github.topn;

import java.util.List;

/**
 * Outcome of a ranking call: the top repositories, best first.
 *
 * @param organization the organization that was ranked
 * @param metric the metric the repositories are ordered by
 * @param strategy the retrieval strategy that produced the data
 * @param repositories at most {@code n} repositories in descending metric order
 */
public record RankedResult(String organization, Metric metric, RetrievalStrategy strategy,
		List<RankedRepository> repositories) {

	public RankedResult {
		repositories = List.copyOf(repositories);
	}

	public int size() {
		return repositories.size();
	}

}
