package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.function.Supplier;

/**
 * {@link GitHubClient} decorator that absorbs transient failures below the ranking core,
 * which never retries on its own.
 *
 * <p>
 * Failures are sorted into four kinds:
 * <ul>
 * <li>cancelled: the calling thread was interrupted, typically because a pull-request
 * enrichment batch was aborted. Rethrown at once, never retried.</li>
 * <li>rate limited: 429, or 403 with no requests remaining. Waits until
 * {@code X-RateLimit-Reset} when that is at most an hour away, else backs off.</li>
 * <li>final: any other 4xx. Rethrown at once.</li>
 * <li>transient: 5xx and network errors. Exponential backoff from
 * {@link RankingProperties#getRetryInitialDelayMs()}.</li>
 * </ul>
 * After a successful call, requests are spread over the time left until the rate limit
 * resets once fewer than {@link RankingProperties#getPacingThreshold()} remain.
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private static final long MIN_PACE_MS = 100;

	private static final long MAX_PACE_MS = 10_000;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final int pacingThreshold;

	private final Sleeper sleeper;

	/**
	 * Wrap a client with the retry settings of the given properties.
	 * @param delegate client performing the requests
	 * @param properties source of max retries, initial delay and pacing threshold
	 */
	public RetryingGitHubClient(GitHubClient delegate, RankingProperties properties) {
		this(delegate, properties.getMaxRetries(), properties.getRetryInitialDelayMs(),
				properties.getPacingThreshold(), Thread::sleep);
	}

	RetryingGitHubClient(GitHubClient delegate, int maxRetries, long initialDelayMs, int pacingThreshold,
			Sleeper sleeper) {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative: " + maxRetries);
		}
		if (initialDelayMs <= 0) {
			throw new IllegalArgumentException("retry initial delay must be positive: " + initialDelayMs);
		}
		this.delegate = delegate;
		this.maxRetries = maxRetries;
		this.initialDelayMs = initialDelayMs;
		this.pacingThreshold = pacingThreshold;
		this.sleeper = sleeper;
	}

	@Override
	public GitHubResponse getWithQuery(String path, @Nullable String queryString) {
		String description = "GET " + path + (queryString != null ? "?" + queryString : "");
		return execute(description, () -> delegate.getWithQuery(path, queryString));
	}

	@Override
	public String postGraphQL(String body) {
		return execute("POST GraphQL", () -> delegate.postGraphQL(body));
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private <T> T execute(String description, Supplier<T> call) {
		long backoffMs = initialDelayMs;
		for (int attempt = 1;; attempt++) {
			try {
				T result = call.get();
				pace(description);
				return result;
			}
			catch (RuntimeException e) {
				Failure failure = Failure.of(e);
				if (failure == Failure.CANCELLED) {
					logger.debug("{} cancelled on attempt {}", description, attempt);
					throw e;
				}
				if (failure == Failure.FINAL) {
					throw e;
				}
				if (attempt > maxRetries) {
					if (maxRetries > 0) {
						logger.error("{} failed after {} attempts", description, attempt);
					}
					throw e;
				}
				long waitMs = failure == Failure.RATE_LIMITED
						? untilReset((GitHubHttpClient.GitHubApiException) e, backoffMs) : backoffMs;
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms", description, attempt, maxRetries + 1,
						e.getMessage(), waitMs);
				pause(waitMs, e);
				backoffMs *= 2;
			}
		}
	}

	private long untilReset(GitHubHttpClient.GitHubApiException e, long backoffMs) {
		if (e.getResetEpochSeconds() <= 0) {
			return backoffMs;
		}
		long waitSeconds = e.getResetEpochSeconds() - Instant.now().getEpochSecond() + 1;
		if (waitSeconds <= 0) {
			return backoffMs;
		}
		if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
			logger.warn("Rate limit resets in {}s, more than an hour away; backing off instead", waitSeconds);
			return backoffMs;
		}
		logger.info("Rate limit exceeded, waiting {}s for reset at epoch {}", waitSeconds, e.getResetEpochSeconds());
		return waitSeconds * 1000;
	}

	/**
	 * Sleep before the next attempt. An interrupt ends the retries with the failure that
	 * caused them, the interrupt attached as suppressed.
	 */
	private void pause(long waitMs, RuntimeException failure) {
		try {
			sleeper.sleep(waitMs);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			failure.addSuppressed(e);
			throw failure;
		}
	}

	private void pace(String description) {
		RateLimitInfo info = delegate.getLastRateLimitInfo();
		if (info == null || info.remaining() <= 0 || !info.isBelow(pacingThreshold)) {
			return;
		}
		long secondsUntilReset = info.reset() - Instant.now().getEpochSecond();
		if (secondsUntilReset <= 0) {
			return;
		}
		long paceMs = Math.max(MIN_PACE_MS, Math.min(MAX_PACE_MS, secondsUntilReset * 1000 / info.remaining()));
		logger.debug("Pacing: {}/{} remaining, sleeping {}ms after {}", info.remaining(), info.limit(), paceMs,
				description);
		try {
			sleeper.sleep(paceMs);
		}
		catch (InterruptedException e) {
			// the response is already in hand; let the caller see the interrupt
			Thread.currentThread().interrupt();
		}
	}

	/**
	 * How a failed call is handled.
	 */
	enum Failure {

		CANCELLED, RATE_LIMITED, FINAL, TRANSIENT;

		static Failure of(RuntimeException e) {
			if (Thread.currentThread().isInterrupted() || causedByInterrupt(e)) {
				return CANCELLED;
			}
			if (e instanceof GitHubHttpClient.GitHubApiException) {
				GitHubHttpClient.GitHubApiException apiError = (GitHubHttpClient.GitHubApiException) e;
				if (apiError.isRateLimitError()) {
					return RATE_LIMITED;
				}
				int status = apiError.getStatusCode();
				if (status >= 400 && status < 500) {
					return FINAL;
				}
			}
			return TRANSIENT;
		}

		private static boolean causedByInterrupt(Throwable e) {
			for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
				if (cause instanceof InterruptedException) {
					return true;
				}
			}
			return false;
		}

	}

	@FunctionalInterface
	interface Sleeper {

		void sleep(long millis) throws InterruptedException;

	}

}
