package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("GitHubProvider Tests")
@ExtendWith(MockitoExtension.class)
class GitHubProviderTest {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	@Mock
	private ApiClient apiClient;

	private GitHubProvider provider(List<String> orgs, boolean skipUser) {
		return new GitHubProvider(apiClient, objectMapper, ProviderOptions.defaults(), "ghp_secret", null, orgs,
				skipUser, false);
	}

	private static String page(String owner, String cursor, boolean hasNext, String... names) {
		StringBuilder nodes = new StringBuilder();
		for (String name : names) {
			if (nodes.length() > 0) {
				nodes.append(',');
			}
			String repo = name.substring(name.indexOf('/') + 1);
			nodes.append("{\"name\":\"%s\",\"nameWithOwner\":\"%s\",\"url\":\"https://github.com/%s\"}".formatted(repo,
					name, name));
		}
		return "{\"data\":{\"%s\":{\"repositories\":{\"nodes\":[%s],\"pageInfo\":{\"endCursor\":\"%s\",\"hasNextPage\":%s}}}}}"
			.formatted(owner, nodes, cursor, hasNext);
	}

	@Test
	@DisplayName("Should page through viewer repositories")
	void shouldPageViewerRepositories() throws Exception {
		when(apiClient.post(eq(GitHubProvider.DEFAULT_API_URL), anyString(), anyMap()))
			.thenReturn(page("viewer", "c1", true, "me/a", "me/b"), page("viewer", "c2", false, "me/c"));

		List<Repository> repos = provider(List.of(), false).listRepositories();

		assertThat(repos).extracting(Repository::pathWithNamespace).containsExactly("me/a", "me/b", "me/c");
		assertThat(repos.get(0)).isEqualTo(new Repository("github.com", "me/a", "a", "https://github.com/me/a",
				"https://ghp_secret@github.com/me/a", null));

		ArgumentCaptor<String> bodies = ArgumentCaptor.forClass(String.class);
		verify(apiClient, times(2)).post(anyString(), bodies.capture(),
				eq(Map.of("Authorization", "bearer ghp_secret")));
		JsonNode second = objectMapper.readTree(bodies.getAllValues().get(1));
		assertThat(second.path("variables").path("after").asText()).isEqualTo("c1");
		assertThat(second.path("variables").path("first").asInt()).isEqualTo(100);
	}

	@Test
	@DisplayName("Should add organisation repositories without duplicates")
	void shouldMergeOrganizations() {
		when(apiClient.post(anyString(), anyString(), anyMap())).thenAnswer(invocation -> {
			String body = invocation.getArgument(1);
			if (body.contains("organizations(first")) {
				return "{\"data\":{\"viewer\":{\"organizations\":{\"nodes\":[{\"login\":\"acme\"}]}}}}";
			}
			if (body.contains("organization(login")) {
				return page("organization", "", false, "acme/tool", "me/a");
			}
			return page("viewer", "", false, "me/a");
		});

		List<Repository> repos = provider(List.of("*"), false).listRepositories();

		assertThat(repos).extracting(Repository::pathWithNamespace).containsExactly("me/a", "acme/tool");
	}

	@Test
	@DisplayName("Should skip user repositories when configured")
	void shouldSkipUserRepositories() {
		when(apiClient.post(anyString(), anyString(), anyMap()))
			.thenReturn(page("organization", "", false, "acme/tool"));

		List<Repository> repos = provider(List.of("acme"), true).listRepositories();

		assertThat(repos).extracting(Repository::identifier).containsExactly("github.com/acme/tool");
		verify(apiClient, times(1)).post(anyString(), anyString(), anyMap());
	}

	@Test
	@DisplayName("Should fail on GraphQL errors")
	void shouldFailOnGraphQLErrors() {
		when(apiClient.post(anyString(), anyString(), anyMap()))
			.thenReturn("{\"data\":{\"organization\":null},\"errors\":[{\"message\":\"Could not resolve to an Organization\"}]}");

		assertThatThrownBy(() -> provider(List.of("nope"), true).listRepositories())
			.isInstanceOf(ProviderException.class)
			.hasMessageContaining("Could not resolve");
	}

	@Test
	@DisplayName("Should wrap HTTP failures in a provider exception")
	void shouldWrapHttpFailures() {
		when(apiClient.post(anyString(), anyString(), anyMap()))
			.thenThrow(new HttpApiClient.ApiException("Unauthorized: check the provider token", 401, ""));

		assertThatThrownBy(() -> provider(List.of(), false).listRepositories()).isInstanceOf(ProviderException.class)
			.hasMessageContaining("Unauthorized")
			.satisfies(e -> assertThat(((ProviderException) e).getProvider()).isEqualTo("GitHub"));
	}

}
