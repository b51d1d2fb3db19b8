package org.springaicommunity.github.topn;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * One row of a {@link RankedResult}.
 *
 * <p>
 * The pull-request total is present whenever it was retrieved: always under the GraphQL
 * strategy, and under the REST strategy when ranking by prs or contribs.
 *
 * @param snapshot the repository state
 * @param pullRequests pull-request total, empty if it was never retrieved
 */
public record RankedRepository(RepositorySnapshot snapshot, OptionalInt pullRequests) {

	public static RankedRepository of(RepositorySnapshot snapshot) {
		return new RankedRepository(snapshot, OptionalInt.empty());
	}

	public static RankedRepository of(EnrichedSnapshot enriched) {
		return new RankedRepository(enriched.snapshot(), OptionalInt.of(enriched.pullRequests()));
	}

	public String name() {
		return snapshot.name();
	}

	public int stars() {
		return snapshot.stars();
	}

	public int forks() {
		return snapshot.forks();
	}

	/**
	 * Pull requests per fork, when the pull-request total is known.
	 * @return the ratio (0 for repositories without forks), or empty
	 */
	public OptionalDouble contributionRatio() {
		if (pullRequests.isEmpty()) {
			return OptionalDouble.empty();
		}
		return OptionalDouble.of(EnrichedSnapshot.contributionRatio(pullRequests.getAsInt(), snapshot.forks()));
	}

}
