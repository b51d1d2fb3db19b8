package org.springaicommunity.github.topn;

/**
 * Configuration properties for repository ranking.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitHubTopNBuilder}.
 * The defaults suit github.com; lower {@link #setPullRequestConcurrency(int)} when
 * ranking large organizations by prs or contribs without a token.
 */
public class RankingProperties {

	/**
	 * Repositories per search page. GitHub caps this at 100.
	 */
	private int searchPageSize = 100;

	/**
	 * Maximum number of concurrent pull-request lookups during enrichment.
	 */
	private int pullRequestConcurrency = 10;

	/**
	 * Maximum number of retry attempts for failed API requests. 0 disables retries.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay in milliseconds between retry attempts, doubled on each retry.
	 */
	private long retryInitialDelayMs = 1000;

	/**
	 * Remaining request count below which requests are paced until the rate limit
	 * resets.
	 */
	private int pacingThreshold = 100;

	/**
	 * REST API base URL. Point at {@code https://<host>/api/v3} for GitHub Enterprise.
	 */
	private String apiBaseUrl = GitHubHttpClient.DEFAULT_API_BASE;

	/**
	 * Metric used when none is requested.
	 */
	private Metric defaultMetric = Metric.STARS;

	/**
	 * Retrieval strategy used when none is requested.
	 */
	private RetrievalStrategy defaultStrategy = RetrievalStrategy.REST;

	public int getSearchPageSize() {
		return searchPageSize;
	}

	public void setSearchPageSize(int searchPageSize) {
		this.searchPageSize = searchPageSize;
	}

	public int getPullRequestConcurrency() {
		return pullRequestConcurrency;
	}

	public void setPullRequestConcurrency(int pullRequestConcurrency) {
		this.pullRequestConcurrency = pullRequestConcurrency;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryInitialDelayMs() {
		return retryInitialDelayMs;
	}

	public void setRetryInitialDelayMs(long retryInitialDelayMs) {
		this.retryInitialDelayMs = retryInitialDelayMs;
	}

	public int getPacingThreshold() {
		return pacingThreshold;
	}

	public void setPacingThreshold(int pacingThreshold) {
		this.pacingThreshold = pacingThreshold;
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public Metric getDefaultMetric() {
		return defaultMetric;
	}

	public void setDefaultMetric(Metric defaultMetric) {
		this.defaultMetric = defaultMetric;
	}

	public RetrievalStrategy getDefaultStrategy() {
		return defaultStrategy;
	}

	public void setDefaultStrategy(RetrievalStrategy defaultStrategy) {
		this.defaultStrategy = defaultStrategy;
	}

}
