package org.springaicommunity.github.topn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for GitHub GraphQL API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary,
 * encapsulating all JSON parsing logic here.
 */
public class GitHubGraphQLService implements GraphQLService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLService.class);

	static final String REPOSITORY_SEARCH_QUERY = """
			query($query: String!, $first: Int!, $after: String) {
			    search(query: $query, type: REPOSITORY, first: $first, after: $after) {
			        pageInfo {
			            hasNextPage
			            endCursor
			        }
			        nodes {
			            ... on Repository {
			                name
			                stargazerCount
			                forkCount
			                hasIssuesEnabled
			                pullRequests {
			                    totalCount
			                }
			            }
			        }
			    }
			}
			""";

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubGraphQLService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public SearchResult<EnrichedSnapshot> searchRepositoriesWithPullRequests(String searchQuery, int pageSize,
			@Nullable String cursor) {
		Map<String, Object> variables = new HashMap<>();
		variables.put("query", searchQuery);
		variables.put("first", pageSize);
		variables.put("after", cursor);

		JsonNode search = JsonNodeUtils.requireObject(executeGraphQL(REPOSITORY_SEARCH_QUERY, variables), "data",
				"search");

		List<EnrichedSnapshot> repositories = new ArrayList<>();
		for (JsonNode node : JsonNodeUtils.requireArray(search, "nodes")) {
			// Search nodes that are not repositories come back as empty objects
			if (node.isNull() || node.isEmpty()) {
				continue;
			}
			repositories.add(parseRepository(node));
		}

		boolean hasMore = JsonNodeUtils.requireBoolean(search, "pageInfo", "hasNextPage");
		if (!hasMore) {
			return SearchResult.lastPage(repositories);
		}
		return new SearchResult<>(repositories, JsonNodeUtils.requireText(search, "pageInfo", "endCursor"), true);
	}

	// ========== JSON Parsing Methods (at service boundary) ==========

	private EnrichedSnapshot parseRepository(JsonNode node) {
		RepositorySnapshot snapshot = new RepositorySnapshot(JsonNodeUtils.requireText(node, "name"),
				JsonNodeUtils.requireInt(node, "stargazerCount"), JsonNodeUtils.requireInt(node, "forkCount"),
				JsonNodeUtils.requireBoolean(node, "hasIssuesEnabled"));
		// Same rule as the REST enrichment pass: issues disabled means no pull requests
		// are counted, so both strategies rank a repository the same way.
		if (!snapshot.issuesEnabled()) {
			return EnrichedSnapshot.skipped(snapshot);
		}
		return new EnrichedSnapshot(snapshot, JsonNodeUtils.requireInt(node, "pullRequests", "totalCount"));
	}

	// ========== Internal GraphQL Execution ==========

	private JsonNode executeGraphQL(String query, Map<String, Object> variables) {
		String requestBody;
		try {
			requestBody = objectMapper.writeValueAsString(Map.of("query", query, "variables", variables));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize GraphQL request", e);
		}

		JsonNode response = JsonNodeUtils.readTree(objectMapper, httpClient.postGraphQL(requestBody), "GraphQL");
		JsonNode errors = response.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			String message = errors.get(0).path("message").asText("unknown error");
			logger.error("GraphQL query returned {} error(s), first: {}", errors.size(), message);
			throw new ResponseDecodingException("GraphQL error: " + message);
		}
		return response;
	}

}
