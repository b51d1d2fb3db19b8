package org.springaicommunity.github.topn;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary.
 * Errors are not caught here: a failed or undecodable call propagates to the caller.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public SearchResult<RepositorySnapshot> searchRepositories(String searchQuery, @Nullable String sort,
			int pageSize, @Nullable String cursor) {
		int page = parsePage(cursor);

		StringBuilder query = new StringBuilder();
		query.append("q=").append(URLEncoder.encode(searchQuery, StandardCharsets.UTF_8));
		if (sort != null) {
			query.append("&sort=").append(sort).append("&order=desc");
		}
		query.append("&per_page=").append(pageSize);
		if (page > 1) {
			query.append("&page=").append(page);
		}

		GitHubResponse response = httpClient.getWithQuery("/search/repositories", query.toString());
		JsonNode root = JsonNodeUtils.readTree(objectMapper, response.body(), "repository search");
		if (root.path("incomplete_results").asBoolean(false)) {
			logger.warn("Repository search for '{}' page {} reported incomplete results", searchQuery, page);
		}

		List<RepositorySnapshot> repositories = new ArrayList<>();
		for (JsonNode item : JsonNodeUtils.requireArray(root, "items")) {
			repositories.add(parseRepository(item));
		}

		PageLinks links = PageLinks.of(response);
		if (links.next().isEmpty()) {
			return SearchResult.lastPage(repositories);
		}
		return new SearchResult<>(repositories, String.valueOf(links.next().getAsInt()), true);
	}

	@Override
	public int countPullRequests(String owner, String repo) {
		String path = "/repos/" + owner + "/" + repo + "/pulls";
		GitHubResponse response = httpClient.getWithQuery(path, "state=all&per_page=1");

		// With one item per page, the last page number is the total. Without a "last"
		// link there is only this page, holding 0 or 1 pull requests.
		PageLinks links = PageLinks.of(response);
		if (links.last().isPresent()) {
			return links.last().getAsInt();
		}
		JsonNode root = JsonNodeUtils.readTree(objectMapper, response.body(), "pull request listing");
		if (!root.isArray()) {
			throw new ResponseDecodingException("Expected array from " + path);
		}
		return root.size();
	}

	// ========== JSON Parsing Methods ==========

	private RepositorySnapshot parseRepository(JsonNode node) {
		return new RepositorySnapshot(JsonNodeUtils.requireText(node, "name"),
				JsonNodeUtils.requireInt(node, "stargazers_count"), JsonNodeUtils.requireInt(node, "forks_count"),
				JsonNodeUtils.requireBoolean(node, "has_issues"));
	}

	private int parsePage(@Nullable String cursor) {
		if (cursor == null || cursor.isEmpty()) {
			return 1;
		}
		try {
			return Integer.parseInt(cursor);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid page cursor: " + cursor, e);
		}
	}

}
