package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lists the Git repositories of Azure DevOps organisations, across all of their projects.
 */
public class AzureDevOpsProvider extends AbstractGitProvider {

	private static final Logger logger = LoggerFactory.getLogger(AzureDevOpsProvider.class);

	public static final String NAME = "AzureDevOps";

	public static final String DEFAULT_BASE_URL = "https://dev.azure.com";

	static final String API_VERSION = "7.0";

	private final String userName;

	private final String personalAccessToken;

	private final List<String> organizations;

	private final String baseUrl;

	/**
	 * @param userName account user name, embedded in clone URLs
	 * @param personalAccessToken PAT with code read scope
	 * @param organizations organisations to back up, at least one
	 * @param baseUrl service URL, null for {@value #DEFAULT_BASE_URL}
	 */
	public AzureDevOpsProvider(ApiClient apiClient, ObjectMapper objectMapper, ProviderOptions options,
			String userName, String personalAccessToken, List<String> organizations, @Nullable String baseUrl) {
		super(apiClient, objectMapper, options);
		if (organizations.isEmpty()) {
			throw new IllegalArgumentException("Azure DevOps needs at least one organization");
		}
		this.userName = userName.strip();
		this.personalAccessToken = personalAccessToken.strip();
		this.organizations = List.copyOf(organizations);
		this.baseUrl = GitLabProvider
			.stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public List<Repository> listRepositories() {
		Map<String, String> headers = Map.of("Authorization", basicAuthorization(userName, personalAccessToken));
		List<Repository> repositories = new ArrayList<>();
		for (String organization : organizations) {
			String url = baseUrl + "/" + URLEncoder.encode(organization, StandardCharsets.UTF_8).replace("+", "%20")
					+ "/_apis/git/repositories?api-version=" + API_VERSION;
			JsonNode values = readTree(call("Azure DevOps repository listing for " + organization,
					() -> apiClient.get(url, headers)))
				.path("value");
			if (!values.isArray()) {
				throw new ProviderException(NAME,
						"Azure DevOps repository listing for " + organization + " returned no value list");
			}
			for (JsonNode value : values) {
				if (value.path("isDisabled").asBoolean(false)) {
					logger.debug("Skipping disabled repository {}", value.path("name").asText());
					continue;
				}
				repositories.add(toRepository(organization, value));
			}
		}
		logger.info("Found {} Azure DevOps repositories", repositories.size());
		return repositories;
	}

	private Repository toRepository(String organization, JsonNode value) {
		String name = value.path("name").asText();
		String url = value.path("webUrl").asText();
		String path = organization + "/" + value.path("project").path("name").asText() + "/" + name;
		return new Repository(CloneUrls.host(url), path, name, url, null,
				CloneUrls.withBasicAuth(url, userName, personalAccessToken));
	}

}
