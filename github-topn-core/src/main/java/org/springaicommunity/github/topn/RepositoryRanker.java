package org.springaicommunity.github.topn;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts repositories by a metric and keeps the top-n.
 */
public class RepositoryRanker {

	/**
	 * Sort by the metric, highest first, and keep the first {@code n}.
	 * @param repositories repositories with pull-request totals
	 * @param metric metric to rank by
	 * @param n maximum number of repositories to return
	 * @return at most {@code n} repositories, best first
	 */
	public List<EnrichedSnapshot> rank(List<EnrichedSnapshot> repositories, Metric metric, int n) {
		return top(sorted(repositories, metric.comparator()), n);
	}

	/**
	 * Keep the first {@code n} of an already ordered list.
	 * @param <T> element type
	 * @param ordered repositories in final order
	 * @param n maximum number of elements to return
	 * @return the first {@code min(n, size)} elements
	 */
	public <T> List<T> top(List<T> ordered, int n) {
		if (n < 0) {
			throw new IllegalArgumentException("n must be non-negative: " + n);
		}
		return List.copyOf(ordered.subList(0, Math.min(n, ordered.size())));
	}

	private static <T> List<T> sorted(List<T> items, Comparator<? super T> order) {
		List<T> copy = new ArrayList<>(items);
		copy.sort(order);
		return copy;
	}

}
