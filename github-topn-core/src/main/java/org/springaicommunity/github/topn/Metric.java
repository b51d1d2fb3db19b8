package org.springaicommunity.github.topn;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * The metric repositories are ranked by. Every constant orders repositories best first.
 *
 * <p>
 * When a ranking is sorted locally, ties on the metric are broken by repository name,
 * ignoring case first. Stars and forks fetched through the REST search keep the order of
 * the search index instead, which breaks ties its own way.
 */
public enum Metric {

	/**
	 * Stargazer count. The search index can sort by it.
	 */
	STARS("stars", true, Comparator.comparingInt(EnrichedSnapshot::stars)),

	/**
	 * Fork count. The search index can sort by it.
	 */
	FORKS("forks", true, Comparator.comparingInt(EnrichedSnapshot::forks)),

	/**
	 * Total pull requests in any state.
	 */
	PRS("prs", false, Comparator.comparingInt(EnrichedSnapshot::pullRequests)),

	/**
	 * Pull requests per fork, 0 for repositories without forks.
	 */
	CONTRIBS("contribs", false, Comparator.comparingDouble(EnrichedSnapshot::contributionRatio));

	private static final Comparator<EnrichedSnapshot> BY_NAME = Comparator
		.comparing(EnrichedSnapshot::name, String.CASE_INSENSITIVE_ORDER)
		.thenComparing(EnrichedSnapshot::name);

	private final String key;

	private final boolean searchSortable;

	private final Comparator<EnrichedSnapshot> ascending;

	Metric(String key, boolean searchSortable, Comparator<EnrichedSnapshot> ascending) {
		this.key = key;
		this.searchSortable = searchSortable;
		this.ascending = ascending;
	}

	/**
	 * Parse a metric key.
	 * @param key one of "stars", "forks", "prs", "contribs"
	 * @return matching metric
	 * @throws IllegalArgumentException for any other value
	 */
	public static Metric fromKey(String key) {
		for (Metric metric : values()) {
			if (metric.key.equals(key)) {
				return metric;
			}
		}
		throw new IllegalArgumentException("Invalid metric '" + key + "': must be one of " + keys());
	}

	/**
	 * All metric keys, formatted for messages.
	 * @return e.g. {@code [stars, forks, prs, contribs]}
	 */
	public static String keys() {
		return Arrays.stream(values()).map(Metric::key).collect(Collectors.joining(", ", "[", "]"));
	}

	public String key() {
		return key;
	}

	/**
	 * Whether the REST search endpoint accepts this metric as its {@code sort} parameter.
	 * @return true for stars and forks
	 */
	public boolean isSearchSortable() {
		return searchSortable;
	}

	/**
	 * Comparator ordering repositories by this metric, highest first, ties by name.
	 * @return descending comparator
	 */
	public Comparator<EnrichedSnapshot> comparator() {
		return ascending.reversed().thenComparing(BY_NAME);
	}

	@Override
	public String toString() {
		return key;
	}

}
