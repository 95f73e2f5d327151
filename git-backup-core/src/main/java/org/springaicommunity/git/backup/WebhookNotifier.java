package org.springaicommunity.git.backup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Posts a JSON summary of each run to a webhook URL.
 *
 * <p>
 * Payload ({@code long} format):
 *
 * <pre>
 * {
 *   "app": "git-backup",
 *   "type": "backups.complete",
 *   "timestamp": "2024-05-01T10:00:00Z",
 *   "stats": {"succeeded": 3, "failed": 1},
 *   "data": [{"provider": "GitHub", "results": [...], "error": null}]
 * }
 * </pre>
 *
 * The {@code short} format omits {@code data}. Delivery failures are logged and never
 * affect the run result.
 */
public class WebhookNotifier implements BackupResultListener {

	private static final Logger logger = LoggerFactory.getLogger(WebhookNotifier.class);

	static final String APP = "git-backup";

	static final String EVENT_TYPE = "backups.complete";

	private final ApiClient apiClient;

	private final ObjectMapper objectMapper;

	private final String url;

	private final boolean includeResults;

	/**
	 * @param url webhook endpoint
	 * @param format {@code long} (default) or {@code short}
	 */
	public WebhookNotifier(ApiClient apiClient, ObjectMapper objectMapper, String url, String format) {
		this.apiClient = apiClient;
		this.objectMapper = objectMapper;
		this.url = url;
		this.includeResults = !"short".equalsIgnoreCase(format.strip());
	}

	@Override
	public void onRunComplete(BackupRunResult result) {
		String body;
		try {
			body = objectMapper.writeValueAsString(toPayload(result));
		}
		catch (JsonProcessingException e) {
			logger.warn("Failed to serialize webhook payload: {}", e.getOriginalMessage());
			return;
		}
		try {
			apiClient.post(url, body, Map.of());
			logger.info("Sent backup summary to webhook");
		}
		catch (HttpApiClient.ApiException e) {
			logger.warn("Webhook delivery failed: {}", e.getMessage());
		}
	}

	WebhookPayload toPayload(BackupRunResult result) {
		return new WebhookPayload(APP, EVENT_TYPE, result.finishedAt(),
				new Stats(result.succeeded(), result.failed()), includeResults ? result.providers() : null);
	}

	/**
	 * Webhook request body.
	 *
	 * @param app sending application
	 * @param type event type
	 * @param timestamp end of the run
	 * @param stats success and failure counts
	 * @param data per-provider results, omitted in the short format
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record WebhookPayload(String app, String type, Instant timestamp, Stats stats,
			@Nullable List<ProviderBackupResult> data) {
	}

	/**
	 * @param succeeded successfully backed up repositories
	 * @param failed failed repositories, plus one per failed provider
	 */
	public record Stats(long succeeded, long failed) {
	}

}
