package org.springaicommunity.git.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Decorator that retries transient failures of an {@link ApiClient} with bounded
 * exponential backoff.
 *
 * <p>
 * Network errors, 429 and 5xx responses are retried; any other 4xx fails immediately.
 *
 * <pre>
 * {@code
 * ApiClient client = RetryingApiClient.builder()
 *     .wrapping(new HttpApiClient(Duration.ofMinutes(5)))
 *     .maxRetries(2)
 *     .initialDelay(Duration.ofSeconds(60))
 *     .maxDelay(Duration.ofSeconds(120))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingApiClient implements ApiClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingApiClient.class);

	private final ApiClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final long maxDelayMs;

	private RetryingApiClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.maxDelayMs = builder.maxDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String url, Map<String, String> headers) {
		return executeWithRetry(() -> delegate.get(url, headers), "GET " + CloneUrls.mask(url));
	}

	@Override
	public String post(String url, String body, Map<String, String> headers) {
		return executeWithRetry(() -> delegate.post(url, body, headers), "POST " + CloneUrls.mask(url));
	}

	private String executeWithRetry(RequestSupplier supplier, String description) {
		long delay = initialDelayMs;
		for (int attempt = 0;; attempt++) {
			try {
				return supplier.get();
			}
			catch (HttpApiClient.ApiException e) {
				if (!e.isTransient() || attempt >= maxRetries) {
					if (e.isTransient()) {
						logger.error("{} failed after {} attempts", description, attempt + 1);
					}
					throw e;
				}
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
						maxRetries + 1, e.getMessage(), delay);
				sleep(delay);
				delay = Math.min(delay * 2, maxDelayMs);
			}
		}
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new HttpApiClient.ApiException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface RequestSupplier {

		String get();

	}

	/**
	 * Builder for {@link RetryingApiClient}.
	 *
	 * <p>
	 * Defaults: 2 retries, 60 second initial delay, 120 second maximum delay.
	 */
	public static class Builder {

		private ApiClient delegate;

		private int maxRetries = 2;

		private long initialDelayMs = 60_000;

		private long maxDelayMs = 120_000;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the ApiClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(ApiClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the delay before the first retry; it doubles on each further attempt.
		 * @param delay initial delay
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the upper bound for the delay between attempts.
		 * @param delay maximum delay
		 * @return this builder
		 */
		public Builder maxDelay(Duration delay) {
			this.maxDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Build the RetryingApiClient.
		 * @return configured RetryingApiClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingApiClient build() {
			if (delegate == null) {
				throw new IllegalStateException("An ApiClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			if (maxDelayMs < initialDelayMs) {
				throw new IllegalStateException("maxDelay must not be shorter than initialDelay");
			}
			return new RetryingApiClient(this);
		}

	}

}
