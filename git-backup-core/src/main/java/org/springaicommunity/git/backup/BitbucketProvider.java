package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lists Bitbucket Cloud repositories the account is a member of, through the REST 2.0 API.
 *
 * <p>
 * Two credential types are supported: an Atlassian API token with the account e-mail, or
 * an OAuth consumer key and secret exchanged for an access token on every listing.
 */
public class BitbucketProvider extends AbstractGitProvider {

	private static final Logger logger = LoggerFactory.getLogger(BitbucketProvider.class);

	public static final String NAME = "BitBucket";

	public static final String DEFAULT_API_URL = "https://api.bitbucket.org/2.0";

	public static final String DEFAULT_TOKEN_URL = "https://bitbucket.org/site/oauth2/access_token";

	static final String CLONE_BASE_URL = "https://bitbucket.org/";

	static final String API_TOKEN_CLONE_USER = "x-bitbucket-api-token-auth";

	private static final int PAGE_SIZE = 100;

	private final Credentials credentials;

	private final String apiUrl;

	private final String tokenUrl;

	/**
	 * @param credentials API token or OAuth consumer credentials
	 * @param apiUrl REST base URL, null for {@value #DEFAULT_API_URL}
	 */
	public BitbucketProvider(ApiClient apiClient, ObjectMapper objectMapper, ProviderOptions options,
			Credentials credentials, @Nullable String apiUrl) {
		this(apiClient, objectMapper, options, credentials, apiUrl, DEFAULT_TOKEN_URL);
	}

	BitbucketProvider(ApiClient apiClient, ObjectMapper objectMapper, ProviderOptions options,
			Credentials credentials, @Nullable String apiUrl, String tokenUrl) {
		super(apiClient, objectMapper, options);
		this.credentials = credentials;
		this.apiUrl = GitLabProvider.stripTrailingSlash(apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl);
		this.tokenUrl = tokenUrl;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public List<Repository> listRepositories() {
		String authorization;
		String cloneUser;
		String clonePassword;
		if (credentials.type() == AuthType.API_TOKEN) {
			authorization = basicAuthorization(credentials.user(), credentials.secret());
			cloneUser = API_TOKEN_CLONE_USER;
			clonePassword = credentials.secret();
		}
		else {
			String accessToken = fetchAccessToken();
			authorization = "Bearer " + accessToken;
			cloneUser = credentials.user();
			clonePassword = accessToken;
		}

		Map<String, String> headers = Map.of("Authorization", authorization);
		List<Repository> repositories = new ArrayList<>();
		@Nullable
		String url = apiUrl + "/repositories?role=member&pagelen=" + PAGE_SIZE;
		while (url != null) {
			String pageUrl = url;
			JsonNode page = readTree(call("Bitbucket repository listing", () -> apiClient.get(pageUrl, headers)));
			JsonNode values = page.path("values");
			if (!values.isArray()) {
				throw new ProviderException(NAME, "Bitbucket repository listing returned no values");
			}
			for (JsonNode value : values) {
				if (!"git".equals(value.path("scm").asText("git"))) {
					logger.debug("Skipping non-git repository {}", value.path("full_name").asText());
					continue;
				}
				repositories.add(toRepository(value, cloneUser, clonePassword));
			}
			JsonNode next = page.path("next");
			url = next.isTextual() && !next.asText().isBlank() ? next.asText() : null;
		}
		logger.info("Found {} Bitbucket repositories", repositories.size());
		return repositories;
	}

	private String fetchAccessToken() {
		Map<String, String> headers = Map.of("Authorization", basicAuthorization(credentials.key(), credentials.secret()),
				"Content-Type", "application/x-www-form-urlencoded");
		JsonNode response = readTree(call("Bitbucket OAuth token request",
				() -> apiClient.post(tokenUrl, "grant_type=client_credentials", headers)));
		String accessToken = response.path("access_token").asText("");
		if (accessToken.isBlank()) {
			throw new ProviderException(NAME, "Bitbucket OAuth token request failed: "
					+ response.path("error").asText("no access token") + " "
					+ response.path("error_description").asText(""));
		}
		return accessToken;
	}

	private Repository toRepository(JsonNode value, String cloneUser, String clonePassword) {
		String fullName = value.path("full_name").asText();
		String slug = value.path("slug").asText(fullName.substring(fullName.lastIndexOf('/') + 1));
		String url = CLONE_BASE_URL + fullName + ".git";
		return new Repository(CloneUrls.host(url), fullName, slug, url, null,
				CloneUrls.withBasicAuth(url, cloneUser, clonePassword));
	}

	/**
	 * How the provider authenticates.
	 */
	public enum AuthType {

		/**
		 * Account e-mail with an Atlassian API token.
		 */
		API_TOKEN,

		/**
		 * OAuth consumer key and secret, plus the user name used for cloning.
		 */
		OAUTH

	}

	/**
	 * Bitbucket credentials. Use the factory methods.
	 */
	public record Credentials(AuthType type, String user, String key, String secret) {

		public Credentials {
			if (user.isBlank() || secret.isBlank() || (type == AuthType.OAUTH && key.isBlank())) {
				throw new IllegalArgumentException("Incomplete Bitbucket " + type + " credentials");
			}
		}

		public static Credentials apiToken(String email, String apiToken) {
			return new Credentials(AuthType.API_TOKEN, email.strip(), "", apiToken.strip());
		}

		public static Credentials oauth(String user, String key, String secret) {
			return new Credentials(AuthType.OAUTH, user.strip(), key.strip(), secret.strip());
		}

		@Override
		public String toString() {
			return "Credentials[type=" + type + ", user=" + user + "]";
		}

	}

}
