package org.springaicommunity.github.topn;

import java.util.Locale;

/**
 * How repositories and their pull-request totals are retrieved.
 */
public enum RetrievalStrategy {

	/**
	 * Paginated REST search, then one pull-request listing per repository when the metric
	 * needs pull-request totals. Lets the search index pre-sort by stars or forks.
	 */
	REST,

	/**
	 * One paginated GraphQL search returning stars, forks and pull-request totals
	 * together. Needs a token; results are always sorted locally.
	 */
	GRAPHQL;

	/**
	 * Parse a strategy name, ignoring case.
	 * @param value "rest" or "graphql"
	 * @return matching strategy
	 * @throws IllegalArgumentException for any other value
	 */
	public static RetrievalStrategy fromKey(String value) {
		return switch (value.toLowerCase(Locale.ROOT)) {
			case "rest" -> REST;
			case "graphql" -> GRAPHQL;
			default -> throw new IllegalArgumentException(
					"Invalid strategy '" + value + "': must be one of [rest, graphql]");
		};
	}

	public String key() {
		return name().toLowerCase(Locale.ROOT);
	}

}
