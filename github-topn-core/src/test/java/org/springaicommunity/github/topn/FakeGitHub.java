package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory organization serving both the REST and the GraphQL service contracts.
 * Records every call so tests can check pagination and lookup behavior.
 */
class FakeGitHub implements RestService, GraphQLService {

	private final List<RepositorySnapshot> repositories;

	private final Map<String, Integer> pullRequests;

	private final Set<String> failingRepositories = ConcurrentHashMap.newKeySet();

	private final AtomicInteger inFlight = new AtomicInteger();

	private final AtomicInteger maxInFlight = new AtomicInteger();

	private final List<String> events = Collections.synchronizedList(new ArrayList<>());

	private final List<String> searchCursors = Collections.synchronizedList(new ArrayList<>());

	private volatile long lookupDelayMs;

	FakeGitHub(List<RepositorySnapshot> repositories, Map<String, Integer> pullRequests) {
		this.repositories = List.copyOf(repositories);
		this.pullRequests = new HashMap<>(pullRequests);
	}

	static FakeGitHub netflix() {
		return new FakeGitHub(NetflixFixture.REPOSITORIES, NetflixFixture.PULL_REQUESTS);
	}

	FakeGitHub failingOn(String repository) {
		failingRepositories.add(repository);
		return this;
	}

	FakeGitHub withLookupDelay(long millis) {
		this.lookupDelayMs = millis;
		return this;
	}

	int maxInFlight() {
		return maxInFlight.get();
	}

	List<String> events() {
		synchronized (events) {
			return List.copyOf(events);
		}
	}

	List<String> lookedUp() {
		return events().stream().filter(e -> e.startsWith("start:")).map(e -> e.substring("start:".length())).toList();
	}

	int searchRequests() {
		return searchCursors.size();
	}

	@Override
	public SearchResult<RepositorySnapshot> searchRepositories(String searchQuery, @Nullable String sort,
			int pageSize, @Nullable String cursor) {
		searchCursors.add(String.valueOf(cursor));
		List<RepositorySnapshot> ordered = new ArrayList<>(repositories);
		if (sort != null) {
			Metric metric = Metric.fromKey(sort);
			ordered.sort((a, b) -> metric.comparator().compare(EnrichedSnapshot.skipped(a), EnrichedSnapshot.skipped(b)));
		}
		int page = cursor == null ? 1 : Integer.parseInt(cursor);
		int from = Math.min((page - 1) * pageSize, ordered.size());
		int to = Math.min(from + pageSize, ordered.size());
		if (to < ordered.size()) {
			return new SearchResult<>(ordered.subList(from, to), String.valueOf(page + 1), true);
		}
		return SearchResult.lastPage(ordered.subList(from, to));
	}

	@Override
	public int countPullRequests(String owner, String repo) {
		events.add("start:" + repo);
		int current = inFlight.incrementAndGet();
		maxInFlight.accumulateAndGet(current, Math::max);
		try {
			if (lookupDelayMs > 0) {
				try {
					Thread.sleep(lookupDelayMs);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new GitHubHttpClient.GitHubApiException("HTTP request interrupted", e);
				}
			}
			if (failingRepositories.contains(repo)) {
				throw new GitHubHttpClient.GitHubApiException("GitHub API error: 500", 500, "boom");
			}
			return pullRequests.getOrDefault(repo, 0);
		}
		finally {
			inFlight.decrementAndGet();
			events.add("end:" + repo);
		}
	}

	@Override
	public SearchResult<EnrichedSnapshot> searchRepositoriesWithPullRequests(String searchQuery, int pageSize,
			@Nullable String cursor) {
		searchCursors.add(String.valueOf(cursor));
		int from = cursor == null ? 0 : Integer.parseInt(cursor.substring("cursor-".length()));
		int to = Math.min(from + pageSize, repositories.size());
		List<EnrichedSnapshot> page = new ArrayList<>();
		for (RepositorySnapshot repository : repositories.subList(from, to)) {
			page.add(repository.issuesEnabled()
					? new EnrichedSnapshot(repository, pullRequests.getOrDefault(repository.name(), 0))
					: EnrichedSnapshot.skipped(repository));
		}
		if (to < repositories.size()) {
			return new SearchResult<>(page, "cursor-" + to, true);
		}
		return SearchResult.lastPage(page);
	}

}
