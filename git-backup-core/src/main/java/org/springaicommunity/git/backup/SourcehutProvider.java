package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the token owner's git.sr.ht repositories through the GraphQL API.
 */
public class SourcehutProvider extends AbstractGitProvider {

	private static final Logger logger = LoggerFactory.getLogger(SourcehutProvider.class);

	public static final String NAME = "Sourcehut";

	public static final String DEFAULT_API_URL = "https://git.sr.ht/query";

	private static final String REPOSITORIES_QUERY = "query($cursor: Cursor) { me { canonicalName "
			+ "repositories(cursor: $cursor) { cursor results { name owner { canonicalName } } } } }";

	private final String token;

	private final String apiUrl;

	private final String cloneBaseUrl;

	/**
	 * @param token personal access token with repository read access
	 * @param apiUrl GraphQL endpoint, null for {@value #DEFAULT_API_URL}; clone URLs use the
	 * same host
	 */
	public SourcehutProvider(ApiClient apiClient, ObjectMapper objectMapper, ProviderOptions options, String token,
			@Nullable String apiUrl) {
		super(apiClient, objectMapper, options);
		this.token = token.strip();
		this.apiUrl = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
		this.cloneBaseUrl = "https://" + CloneUrls.host(this.apiUrl) + "/";
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public List<Repository> listRepositories() {
		List<Repository> repositories = new ArrayList<>();
		@Nullable
		String cursor = null;
		do {
			Map<String, @Nullable Object> variables = new LinkedHashMap<>();
			variables.put("cursor", cursor);
			JsonNode me = graphQuery(apiUrl, REPOSITORIES_QUERY, variables, Map.of("Authorization", "Bearer " + token))
				.path("me");
			if (me.isMissingNode() || me.isNull()) {
				throw new ProviderException(NAME, "Sourcehut returned no account for the token");
			}
			JsonNode connection = me.path("repositories");
			for (JsonNode result : connection.path("results")) {
				repositories.add(toRepository(result, me.path("canonicalName").asText()));
			}
			JsonNode next = connection.path("cursor");
			cursor = next.isTextual() && !next.asText().isBlank() ? next.asText() : null;
		}
		while (cursor != null);
		logger.info("Found {} Sourcehut repositories", repositories.size());
		return repositories;
	}

	private Repository toRepository(JsonNode result, String accountName) {
		String name = result.path("name").asText();
		String owner = result.path("owner").path("canonicalName").asText(accountName);
		String url = cloneBaseUrl + owner + "/" + name;
		String cloneUser = owner.startsWith("~") ? owner.substring(1) : owner;
		return new Repository(CloneUrls.host(url), owner + "/" + name, name, url, null,
				CloneUrls.withBasicAuth(url, cloneUser, token));
	}

}
