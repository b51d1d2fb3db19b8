package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Ranking target
	public @Nullable String organization;

	public @Nullable Integer n; // null until --n is given

	public Metric metric;

	public RetrievalStrategy strategy;

	// Tuning
	public int concurrency;

	public int maxRetries;

	public String apiUrl;

	// Output
	public String format = "text"; // text or json

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(RankingProperties defaultProperties) {
		this.organization = null;
		this.n = null;
		this.metric = defaultProperties.getDefaultMetric();
		this.strategy = defaultProperties.getDefaultStrategy();
		this.concurrency = defaultProperties.getPullRequestConcurrency();
		this.maxRetries = defaultProperties.getMaxRetries();
		this.apiUrl = defaultProperties.getApiBaseUrl();
	}

	/**
	 * Build the ranking request described by this configuration.
	 * @return request for {@link TopRepositoriesService#rank(RankingRequest)}
	 */
	public RankingRequest toRequest() {
		if (organization == null || n == null) {
			throw new IllegalStateException("organization and n must be set before building a request");
		}
		return new RankingRequest(organization, n, metric, strategy);
	}

	/**
	 * Copy the tuning options onto properties used to build the services.
	 * @param properties properties to update
	 * @return the same properties
	 */
	public RankingProperties applyTo(RankingProperties properties) {
		properties.setPullRequestConcurrency(concurrency);
		properties.setMaxRetries(maxRetries);
		properties.setApiBaseUrl(apiUrl);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "organization='" + organization + '\'' + ", n=" + n + ", metric=" + metric
				+ ", strategy=" + strategy.key() + ", concurrency=" + concurrency + ", maxRetries=" + maxRetries
				+ ", apiUrl='" + apiUrl + '\'' + ", format='" + format + '\'' + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
