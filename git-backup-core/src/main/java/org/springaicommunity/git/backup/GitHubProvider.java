package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists GitHub repositories through the GraphQL API: the token owner's repositories plus
 * those of configured organisations.
 *
 * <p>
 * An organisation entry of {@code *} expands to every organisation the token owner
 * belongs to.
 */
public class GitHubProvider extends AbstractGitProvider {

	private static final Logger logger = LoggerFactory.getLogger(GitHubProvider.class);

	public static final String NAME = "GitHub";

	public static final String DEFAULT_API_URL = "https://api.github.com/graphql";

	static final String ALL_ORGANIZATIONS = "*";

	private static final int PAGE_SIZE = 100;

	private static final String REPOSITORY_FIELDS = "nodes { name nameWithOwner url } pageInfo { endCursor hasNextPage }";

	private static final String VIEWER_REPOSITORIES_QUERY = "query($first: Int!, $after: String) { viewer { "
			+ "repositories(first: $first, after: $after) { " + REPOSITORY_FIELDS + " } } }";

	private static final String VIEWER_OWNED_REPOSITORIES_QUERY = "query($first: Int!, $after: String) { viewer { "
			+ "repositories(first: $first, after: $after, affiliations: OWNER, ownerAffiliations: OWNER) { "
			+ REPOSITORY_FIELDS + " } } }";

	private static final String ORGANIZATION_REPOSITORIES_QUERY = "query($login: String!, $first: Int!, $after: String) { "
			+ "organization(login: $login) { repositories(first: $first, after: $after) { " + REPOSITORY_FIELDS
			+ " } } }";

	private static final String VIEWER_ORGANIZATIONS_QUERY = "query { viewer { organizations(first: 100) { nodes { login } } } }";

	private final String token;

	private final String apiUrl;

	private final List<String> organizations;

	private final boolean skipUserRepositories;

	private final boolean limitUserOwned;

	/**
	 * @param token personal access token
	 * @param apiUrl GraphQL endpoint, null for {@value #DEFAULT_API_URL}
	 * @param organizations organisations to include; {@code *} for all of the token
	 * owner's
	 * @param skipUserRepositories do not back up the token owner's own repositories
	 * @param limitUserOwned only include user repositories the token owner owns
	 */
	public GitHubProvider(ApiClient apiClient, ObjectMapper objectMapper, ProviderOptions options, String token,
			@Nullable String apiUrl, List<String> organizations, boolean skipUserRepositories,
			boolean limitUserOwned) {
		super(apiClient, objectMapper, options);
		this.token = token.strip();
		this.apiUrl = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
		this.organizations = List.copyOf(organizations);
		this.skipUserRepositories = skipUserRepositories;
		this.limitUserOwned = limitUserOwned;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public List<Repository> listRepositories() {
		Map<String, Repository> repositories = new LinkedHashMap<>();
		if (!skipUserRepositories) {
			String query = limitUserOwned ? VIEWER_OWNED_REPOSITORIES_QUERY : VIEWER_REPOSITORIES_QUERY;
			for (Repository repository : fetchRepositories(query, Map.of(), "viewer")) {
				repositories.putIfAbsent(repository.pathWithNamespace(), repository);
			}
		}
		for (String organization : resolveOrganizations()) {
			logger.debug("Listing repositories of GitHub organization {}", organization);
			for (Repository repository : fetchRepositories(ORGANIZATION_REPOSITORIES_QUERY,
					Map.of("login", organization), "organization")) {
				repositories.putIfAbsent(repository.pathWithNamespace(), repository);
			}
		}
		logger.info("Found {} GitHub repositories", repositories.size());
		return List.copyOf(repositories.values());
	}

	private Set<String> resolveOrganizations() {
		Set<String> resolved = new LinkedHashSet<>();
		for (String organization : organizations) {
			if (ALL_ORGANIZATIONS.equals(organization)) {
				resolved.addAll(fetchViewerOrganizations());
			}
			else if (!organization.isBlank()) {
				resolved.add(organization.strip());
			}
		}
		return resolved;
	}

	private List<String> fetchViewerOrganizations() {
		JsonNode data = query(VIEWER_ORGANIZATIONS_QUERY, Map.of());
		List<String> logins = new ArrayList<>();
		for (JsonNode node : data.path("viewer").path("organizations").path("nodes")) {
			String login = node.path("login").asText("");
			if (!login.isEmpty()) {
				logins.add(login);
			}
		}
		return logins;
	}

	private List<Repository> fetchRepositories(String query, Map<String, @Nullable Object> baseVariables,
			String owner) {
		List<Repository> repositories = new ArrayList<>();
		@Nullable
		String cursor = null;
		do {
			Map<String, @Nullable Object> variables = new LinkedHashMap<>(baseVariables);
			variables.put("first", PAGE_SIZE);
			variables.put("after", cursor);
			JsonNode ownerNode = query(query, variables).path(owner);
			if (ownerNode.isMissingNode() || ownerNode.isNull()) {
				throw new ProviderException(NAME, "GitHub " + owner + " " + baseVariables.getOrDefault("login", "")
					+ " not found");
			}
			JsonNode connection = ownerNode.path("repositories");
			for (JsonNode node : connection.path("nodes")) {
				repositories.add(toRepository(node));
			}
			JsonNode pageInfo = connection.path("pageInfo");
			cursor = pageInfo.path("hasNextPage").asBoolean(false) ? pageInfo.path("endCursor").asText(null) : null;
		}
		while (cursor != null);
		return repositories;
	}

	private JsonNode query(String query, Map<String, @Nullable Object> variables) {
		return graphQuery(apiUrl, query, variables, Map.of("Authorization", "bearer " + token));
	}

	private Repository toRepository(JsonNode node) {
		String url = node.path("url").asText();
		return new Repository(CloneUrls.host(url), node.path("nameWithOwner").asText(), node.path("name").asText(), url,
				CloneUrls.withToken(url, token), null);
	}

}
