package org.springaicommunity.github.topn;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Body and headers of a successful REST response.
 *
 * <p>
 * Header lookup is case-insensitive, as HTTP header names are.
 *
 * @param body the response body
 * @param headers response headers, each name mapped to its values in arrival order
 */
public record GitHubResponse(String body, Map<String, List<String>> headers) {

	public GitHubResponse {
		headers = Map.copyOf(headers);
	}

	/**
	 * Response without headers, mostly useful in tests.
	 * @param body the response body
	 * @return GitHubResponse with no headers
	 */
	public static GitHubResponse of(String body) {
		return new GitHubResponse(body, Map.of());
	}

	/**
	 * Returns the first value of the named header.
	 * @param name header name, any case
	 * @return first header value, or empty if absent
	 */
	public Optional<String> firstHeader(String name) {
		for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
				return Optional.of(entry.getValue().get(0));
			}
		}
		return Optional.empty();
	}

}
