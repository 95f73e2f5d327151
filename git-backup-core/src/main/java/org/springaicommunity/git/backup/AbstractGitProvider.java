package org.springaicommunity.git.backup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Base class for API-backed providers: holds the shared {@link ProviderOptions} and the
 * HTTP plumbing.
 */
public abstract class AbstractGitProvider implements GitProvider {

	protected final ApiClient apiClient;

	protected final ObjectMapper objectMapper;

	private final ProviderOptions options;

	protected AbstractGitProvider(ApiClient apiClient, ObjectMapper objectMapper, ProviderOptions options) {
		this.apiClient = apiClient;
		this.objectMapper = objectMapper;
		this.options = options;
	}

	@Override
	public DiffMode diffMode() {
		return options.diffMode();
	}

	@Override
	public int backupsToRetain() {
		return options.backupsToRetain();
	}

	@Override
	public int workerCount() {
		return options.workerCount();
	}

	@Override
	public Duration workerStartDelay() {
		return options.workerStartDelay();
	}

	/**
	 * Parse a response body, turning malformed JSON into a {@link ProviderException}.
	 */
	protected JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new ProviderException(name(), "Unexpected response from " + name() + " API: " + e.getOriginalMessage(),
					e);
		}
	}

	/**
	 * Run an API call, wrapping client failures into a {@link ProviderException}.
	 */
	protected String call(String description, ApiCall call) {
		try {
			return call.execute();
		}
		catch (HttpApiClient.ApiException e) {
			throw new ProviderException(name(), description + " failed: " + e.getMessage(), e);
		}
	}

	/**
	 * Collect the elements of a page-numbered REST listing. Pages are requested from 1
	 * upwards until one comes back shorter than {@code pageSize}.
	 * @param description what is being listed, for error messages
	 * @param urlForPage builds the URL of a page
	 * @param headers request headers
	 * @param pageSize requested page size
	 * @return all elements, in API order
	 */
	protected List<JsonNode> fetchPages(String description, IntFunction<String> urlForPage,
			Map<String, String> headers, int pageSize) {
		List<JsonNode> items = new ArrayList<>();
		for (int page = 1;; page++) {
			String url = urlForPage.apply(page);
			JsonNode array = readTree(call(description, () -> apiClient.get(url, headers)));
			if (!array.isArray()) {
				throw new ProviderException(name(), description + " returned " + array.getNodeType() + ", expected a list");
			}
			array.forEach(items::add);
			if (array.size() < pageSize) {
				return items;
			}
		}
	}

	/**
	 * Run a GraphQL query and return its {@code data} node.
	 * @throws ProviderException if the request fails or the response carries errors
	 */
	protected JsonNode graphQuery(String url, String query, Map<String, @Nullable Object> variables,
			Map<String, String> headers) {
		Map<String, Object> request = new LinkedHashMap<>();
		request.put("query", query);
		request.put("variables", variables);
		String body;
		try {
			body = objectMapper.writeValueAsString(request);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize GraphQL request", e);
		}
		JsonNode root = readTree(call(name() + " GraphQL query", () -> apiClient.post(url, body, headers)));
		JsonNode errors = root.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			throw new ProviderException(name(),
					name() + " GraphQL query failed: " + errors.get(0).path("message").asText());
		}
		return root.path("data");
	}

	/**
	 * Value of an HTTP basic {@code Authorization} header.
	 */
	protected static String basicAuthorization(String user, String password) {
		return "Basic " + Base64.getEncoder().encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
	}

	@FunctionalInterface
	protected interface ApiCall {

		String execute();

	}

}
