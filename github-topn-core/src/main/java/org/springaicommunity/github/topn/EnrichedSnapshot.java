package org.springaicommunity.github.topn;

/**
 * A {@link RepositorySnapshot} together with its pull-request total.
 *
 * <p>
 * The total is fixed at construction. For repositories the enrichment pass skips
 * (issues disabled, or no forks when ranking by contribution) it is zero.
 *
 * @param snapshot the fetched repository state
 * @param pullRequests total pull requests in any state
 */
public record EnrichedSnapshot(RepositorySnapshot snapshot, int pullRequests) {

	public EnrichedSnapshot {
		if (pullRequests < 0) {
			throw new IllegalArgumentException("pullRequests must be non-negative: " + pullRequests);
		}
	}

	/**
	 * Snapshot whose pull-request lookup was skipped.
	 * @param snapshot the fetched repository state
	 * @return enriched snapshot with a zero total
	 */
	public static EnrichedSnapshot skipped(RepositorySnapshot snapshot) {
		return new EnrichedSnapshot(snapshot, 0);
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
	 * Pull requests per fork.
	 * @return pull-request total divided by fork count, exactly 0 when there are no forks
	 */
	public double contributionRatio() {
		return contributionRatio(pullRequests, snapshot.forks());
	}

	static double contributionRatio(int pullRequests, int forks) {
		if (forks == 0) {
			return 0;
		}
		return (double) pullRequests / forks;
	}

}
