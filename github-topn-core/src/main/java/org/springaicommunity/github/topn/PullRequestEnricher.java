package org.springaicommunity.github.topn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fills in pull-request totals for repositories fetched through the REST search, which
 * does not report them.
 *
 * <p>
 * Lookups run in consecutive batches of {@code concurrency} repositories. A batch starts
 * all of its lookups at once and must finish completely before the next batch starts, so
 * at most {@code concurrency} requests are ever in flight. The first failed lookup
 * cancels the rest of its batch and aborts the whole pass.
 *
 * <p>
 * Repositories with issues disabled are never looked up, and neither are repositories
 * without forks when ranking by {@link Metric#CONTRIBS}, whose ratio is 0 regardless.
 * Both get a total of 0.
 */
public class PullRequestEnricher {

	private static final Logger logger = LoggerFactory.getLogger(PullRequestEnricher.class);

	private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

	private final RestService restService;

	private final int concurrency;

	public PullRequestEnricher(RestService restService, int concurrency) {
		if (concurrency <= 0) {
			throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
		}
		this.restService = restService;
		this.concurrency = concurrency;
	}

	/**
	 * Look up the pull-request total of every repository that needs one.
	 * @param organization organization owning the repositories
	 * @param repositories fetched repositories
	 * @param metric the metric that will be ranked by
	 * @return one enriched snapshot per repository, in input order
	 * @throws GitHubHttpClient.GitHubApiException if a lookup fails
	 * @throws ResponseDecodingException if a lookup response cannot be decoded
	 * @throws CancellationException if the calling thread is interrupted
	 */
	public List<EnrichedSnapshot> enrich(String organization, List<RepositorySnapshot> repositories, Metric metric) {
		List<RepositorySnapshot> snapshots = List.copyOf(repositories);
		EnrichedSnapshot[] enriched = new EnrichedSnapshot[snapshots.size()];

		ExecutorService executor = Executors.newFixedThreadPool(concurrency, threadFactory());
		try {
			int lookups = 0;
			int batches = 0;
			for (int start = 0; start < snapshots.size(); start += concurrency) {
				int end = Math.min(start + concurrency, snapshots.size());
				lookups += runBatch(organization, snapshots, start, end, metric, enriched, executor);
				batches++;
			}
			logger.info("Counted pull requests for {} of {} repositories in {} batch(es)", lookups,
					snapshots.size(), batches);
		}
		finally {
			executor.shutdownNow();
		}
		return Arrays.asList(enriched);
	}

	private int runBatch(String organization, List<RepositorySnapshot> snapshots, int start, int end, Metric metric,
			EnrichedSnapshot[] enriched, ExecutorService executor) {
		CompletionService<Lookup> completionService = new ExecutorCompletionService<>(executor);
		List<Future<Lookup>> pending = new ArrayList<>();

		for (int i = start; i < end; i++) {
			RepositorySnapshot snapshot = snapshots.get(i);
			if (shouldSkip(snapshot, metric)) {
				enriched[i] = EnrichedSnapshot.skipped(snapshot);
				continue;
			}
			int index = i;
			pending.add(completionService
				.submit(() -> new Lookup(index, restService.countPullRequests(organization, snapshot.name()))));
		}
		logger.debug("Batch [{}, {}): {} lookup(s)", start, end, pending.size());

		try {
			for (int completed = 0; completed < pending.size(); completed++) {
				Lookup lookup = completionService.take().get();
				enriched[lookup.index()] = new EnrichedSnapshot(snapshots.get(lookup.index()), lookup.pullRequests());
			}
		}
		catch (ExecutionException e) {
			cancelAll(pending);
			throw propagate(e.getCause());
		}
		catch (InterruptedException e) {
			cancelAll(pending);
			Thread.currentThread().interrupt();
			CancellationException cancelled = new CancellationException(
					"Pull request enrichment for " + organization + " was interrupted");
			cancelled.initCause(e);
			throw cancelled;
		}
		return pending.size();
	}

	static boolean shouldSkip(RepositorySnapshot snapshot, Metric metric) {
		if (!snapshot.issuesEnabled()) {
			return true;
		}
		return metric == Metric.CONTRIBS && snapshot.forks() == 0;
	}

	private static void cancelAll(List<Future<Lookup>> futures) {
		for (Future<Lookup> future : futures) {
			future.cancel(true);
		}
	}

	private static RuntimeException propagate(Throwable cause) {
		if (cause instanceof RuntimeException) {
			return (RuntimeException) cause;
		}
		if (cause instanceof Error) {
			throw (Error) cause;
		}
		return new IllegalStateException("Pull request lookup failed", cause);
	}

	private static ThreadFactory threadFactory() {
		int pool = POOL_COUNTER.incrementAndGet();
		AtomicInteger threads = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "pr-enricher-" + pool + "-" + threads.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private record Lookup(int index, int pullRequests) {
	}

}
