package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists GitLab projects the token owner is a member of, through the REST v4 API.
 */
public class GitLabProvider extends AbstractGitProvider {

	private static final Logger logger = LoggerFactory.getLogger(GitLabProvider.class);

	public static final String NAME = "GitLab";

	public static final String DEFAULT_API_URL = "https://gitlab.com/api/v4";

	/**
	 * Reporter access: enough to clone.
	 */
	public static final int DEFAULT_MIN_ACCESS_LEVEL = 20;

	static final Set<Integer> ACCESS_LEVELS = Set.of(5, 10, 20, 30, 40, 50);

	private static final int PAGE_SIZE = 100;

	private final String token;

	private final String apiUrl;

	private final int minAccessLevel;

	/**
	 * @param token personal access token
	 * @param apiUrl REST base URL, null for {@value #DEFAULT_API_URL}
	 * @param minAccessLevel minimum membership access level of listed projects
	 */
	public GitLabProvider(ApiClient apiClient, ObjectMapper objectMapper, ProviderOptions options, String token,
			@Nullable String apiUrl, int minAccessLevel) {
		super(apiClient, objectMapper, options);
		if (!ACCESS_LEVELS.contains(minAccessLevel)) {
			throw new IllegalArgumentException(
					"Invalid GitLab access level " + minAccessLevel + ": must be one of 5, 10, 20, 30, 40, 50");
		}
		this.token = token.strip();
		this.apiUrl = stripTrailingSlash(apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl);
		this.minAccessLevel = minAccessLevel;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public List<Repository> listRepositories() {
		List<JsonNode> projects = fetchPages("GitLab project listing",
				page -> apiUrl + "/projects?membership=true&min_access_level=" + minAccessLevel + "&per_page="
						+ PAGE_SIZE + "&page=" + page,
				Map.of("PRIVATE-TOKEN", token), PAGE_SIZE);
		List<Repository> repositories = new ArrayList<>(projects.size());
		for (JsonNode project : projects) {
			String url = project.path("http_url_to_repo").asText();
			repositories.add(new Repository(CloneUrls.host(url), project.path("path_with_namespace").asText(),
					project.path("path").asText(), url, null, CloneUrls.withBasicAuth(url, "oauth2", token)));
		}
		logger.info("Found {} GitLab projects", repositories.size());
		return repositories;
	}

	static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

}
