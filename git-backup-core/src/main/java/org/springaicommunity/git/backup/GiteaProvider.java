package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists Gitea repositories through the REST v1 API: the token owner's repositories plus
 * those of configured organisations ({@code *} for every organisation the owner belongs
 * to).
 */
public class GiteaProvider extends AbstractGitProvider {

	private static final Logger logger = LoggerFactory.getLogger(GiteaProvider.class);

	public static final String NAME = "Gitea";

	private static final int PAGE_SIZE = 50;

	private final String token;

	private final String apiUrl;

	private final List<String> organizations;

	/**
	 * @param token access token
	 * @param apiUrl REST base URL, e.g. {@code https://gitea.example.com/api/v1}
	 * @param organizations organisations to include
	 */
	public GiteaProvider(ApiClient apiClient, ObjectMapper objectMapper, ProviderOptions options, String token,
			String apiUrl, List<String> organizations) {
		super(apiClient, objectMapper, options);
		if (apiUrl.isBlank()) {
			throw new IllegalArgumentException("Gitea API URL is required");
		}
		this.token = token.strip();
		this.apiUrl = GitLabProvider.stripTrailingSlash(apiUrl);
		this.organizations = List.copyOf(organizations);
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public List<Repository> listRepositories() {
		Map<String, Repository> repositories = new LinkedHashMap<>();
		addAll(repositories, fetchPages("Gitea user repository listing",
				page -> apiUrl + "/user/repos?page=" + page + "&limit=" + PAGE_SIZE, headers(), PAGE_SIZE));
		for (String organization : resolveOrganizations()) {
			String encoded = URLEncoder.encode(organization, StandardCharsets.UTF_8);
			addAll(repositories, fetchPages("Gitea repository listing of " + organization,
					page -> apiUrl + "/orgs/" + encoded + "/repos?page=" + page + "&limit=" + PAGE_SIZE, headers(),
					PAGE_SIZE));
		}
		logger.info("Found {} Gitea repositories", repositories.size());
		return List.copyOf(repositories.values());
	}

	private Set<String> resolveOrganizations() {
		Set<String> resolved = new LinkedHashSet<>();
		for (String organization : organizations) {
			if (GitHubProvider.ALL_ORGANIZATIONS.equals(organization)) {
				for (JsonNode org : fetchPages("Gitea organization listing",
						page -> apiUrl + "/user/orgs?page=" + page + "&limit=" + PAGE_SIZE, headers(), PAGE_SIZE)) {
					resolved.add(org.path("username").asText());
				}
			}
			else if (!organization.isBlank()) {
				resolved.add(organization.strip());
			}
		}
		return resolved;
	}

	private void addAll(Map<String, Repository> target, List<JsonNode> nodes) {
		for (JsonNode node : nodes) {
			String url = node.path("clone_url").asText();
			Repository repository = new Repository(CloneUrls.host(url), node.path("full_name").asText(),
					node.path("name").asText(), url, CloneUrls.withToken(url, token), null);
			target.putIfAbsent(repository.pathWithNamespace(), repository);
		}
	}

	private Map<String, String> headers() {
		return Map.of("Authorization", "token " + token);
	}

}
