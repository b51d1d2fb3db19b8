package org.springaicommunity.github.topn;

/**
 * One repository's metric state as decoded from a search page.
 *
 * <p>
 * Carries no pull-request total. That figure only exists on an {@link EnrichedSnapshot},
 * produced by {@link PullRequestEnricher} or by the combined GraphQL query.
 *
 * @param name the repository name, unique within its organization
 * @param stars the stargazer count
 * @param forks the fork count
 * @param issuesEnabled whether the repository has issues enabled
 */
public record RepositorySnapshot(String name, int stars, int forks, boolean issuesEnabled) {

}
