package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for GitHub API calls using the JDK {@link HttpClient}.
 *
 * <p>
 * Works against github.com by default or against a GitHub Enterprise server when given
 * its API base URL. A token is optional: without one, REST calls run unauthenticated
 * with GitHub's lower rate limit, and GraphQL calls are rejected by the server.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String DEFAULT_API_BASE = "https://api.github.com";

	private final HttpClient httpClient;

	private final @Nullable String token;

	private final String apiBase;

	private final String graphQLEndpoint;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(@Nullable String token) {
		this(token, DEFAULT_API_BASE);
	}

	public GitHubHttpClient(@Nullable String token, String apiBase) {
		this.token = token;
		this.apiBase = stripTrailingSlash(apiBase);
		this.graphQLEndpoint = graphQLEndpointFor(this.apiBase);
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	/**
	 * Derive the GraphQL endpoint for a REST API base URL. GitHub Enterprise serves REST
	 * under {@code /api/v3} and GraphQL under {@code /api/graphql}; github.com serves
	 * GraphQL at {@code /graphql} next to the REST root.
	 * @param apiBase REST API base URL without trailing slash
	 * @return GraphQL endpoint URL
	 */
	static String graphQLEndpointFor(String apiBase) {
		if (apiBase.endsWith("/api/v3")) {
			return apiBase.substring(0, apiBase.length() - "/v3".length()) + "/graphql";
		}
		return apiBase + "/graphql";
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public GitHubResponse getWithQuery(String path, @Nullable String queryString) {
		String url = path.startsWith("http") ? path : apiBase + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest.Builder request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "github-topn")
			.GET();
		if (token != null && !token.isBlank()) {
			request.header("Authorization", "token " + token);
		}

		try {
			HttpResponse<String> response = executeRequest(request.build());
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.body().length());
			return new GitHubResponse(response.body(), response.headers().map());
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String postGraphQL(String body) {
		logger.debug("POST GraphQL ({} bytes)", body.length());
		long start = System.currentTimeMillis();

		HttpRequest.Builder request = HttpRequest.newBuilder()
			.uri(URI.create(graphQLEndpoint))
			.header("Content-Type", "application/json")
			.header("User-Agent", "github-topn")
			.POST(HttpRequest.BodyPublishers.ofString(body));
		if (token != null && !token.isBlank()) {
			request.header("Authorization", "Bearer " + token);
		}

		try {
			String response = executeRequest(request.build()).body();
			logger.debug("POST GraphQL completed in {}ms ({} bytes)", System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("POST GraphQL failed after {}ms: {}", System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private HttpResponse<String> executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Rate limit headers come with every response, 2xx included
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (remaining >= 0) {
				RateLimitInfo info = new RateLimitInfo(limit, remaining, reset, used);
				this.lastRateLimitInfo = info;
				if (info.isBelow(100)) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response;
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.", statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
							response.body(), remaining, reset);
				}
				throw new GitHubApiException("Forbidden: " + response.body(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 422) {
				throw new GitHubApiException("Unprocessable request: " + response.body(), statusCode, response.body(),
						remaining, reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(), remaining,
						reset);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * Carries rate limit information when available, enabling smart retry logic in
	 * {@link RetryingGitHubClient}.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, String responseBody, int rateLimitRemaining,
				long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

	}

}
