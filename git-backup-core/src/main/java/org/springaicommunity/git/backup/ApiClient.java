package org.springaicommunity.git.backup;

import java.util.Map;

/**
 * Interface for provider API HTTP operations.
 *
 * <p>
 * Provides abstraction over the hosting providers' REST and GraphQL endpoints, enabling
 * testability and decorator implementations such as {@link RetryingApiClient}.
 */
public interface ApiClient {

	/**
	 * Execute a GET request.
	 * @param url absolute URL
	 * @param headers request headers, e.g. authorization
	 * @return response body
	 * @throws HttpApiClient.ApiException if the request fails or returns a non-2xx status
	 */
	String get(String url, Map<String, String> headers);

	/**
	 * Execute a POST request. The body is sent as JSON unless {@code headers} set a
	 * {@code Content-Type}.
	 * @param url absolute URL
	 * @param body JSON request body
	 * @param headers request headers
	 * @return response body
	 * @throws HttpApiClient.ApiException if the request fails or returns a non-2xx status
	 */
	String post(String url, String body, Map<String, String> headers);

}
