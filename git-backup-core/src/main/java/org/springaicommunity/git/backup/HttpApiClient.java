package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link ApiClient} using the Java 11+ {@link HttpClient}.
 */
public class HttpApiClient implements ApiClient {

	private static final Logger logger = LoggerFactory.getLogger(HttpApiClient.class);

	private static final String USER_AGENT = "git-backup";

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	public HttpApiClient(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String url, Map<String, String> headers) {
		HttpRequest.Builder request = newRequest(url, headers).GET();
		return execute("GET", url, request.build());
	}

	@Override
	public String post(String url, String body, Map<String, String> headers) {
		HttpRequest.Builder request = newRequest(url, headers).POST(HttpRequest.BodyPublishers.ofString(body));
		if (headers.keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
			request.header("Content-Type", "application/json");
		}
		return execute("POST", url, request.build());
	}

	private HttpRequest.Builder newRequest(String url, Map<String, String> headers) {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("User-Agent", USER_AGENT)
			.header("Accept", "application/json");
		headers.forEach(builder::header);
		return builder;
	}

	private String execute(String method, String url, HttpRequest request) {
		String maskedUrl = CloneUrls.mask(url);
		logger.debug("{} {}", method, maskedUrl);
		long start = System.currentTimeMillis();
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			int statusCode = response.statusCode();
			logger.debug("{} {} returned {} in {}ms", method, maskedUrl, statusCode, System.currentTimeMillis() - start);
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new ApiException("Unauthorized: check the provider token", statusCode, response.body());
			}
			else if (statusCode == 403) {
				throw new ApiException("Forbidden: " + maskedUrl, statusCode, response.body());
			}
			else if (statusCode == 404) {
				throw new ApiException("Not found: " + maskedUrl, statusCode, response.body());
			}
			else if (statusCode == 429) {
				throw new ApiException("Too Many Requests (429): " + maskedUrl, statusCode, response.body());
			}
			throw new ApiException("API error " + statusCode + ": " + maskedUrl, statusCode, response.body());
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", method, maskedUrl, System.currentTimeMillis() - start,
					e.getMessage());
			throw new ApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ApiException("HTTP request interrupted", e);
		}
	}

	/**
	 * Exception thrown when a provider API call fails.
	 *
	 * <p>
	 * A status code of -1 means no response was received (network error or timeout).
	 */
	public static class ApiException extends RuntimeException {

		private final int statusCode;

		@Nullable
		private final String responseBody;

		public ApiException(String message, int statusCode, @Nullable String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public ApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		@Nullable
		public String getResponseBody() {
			return responseBody;
		}

		/**
		 * Returns true for failures worth retrying: no response, 429 or any 5xx.
		 */
		public boolean isTransient() {
			return statusCode == -1 || statusCode == 429 || statusCode >= 500;
		}

	}

}
