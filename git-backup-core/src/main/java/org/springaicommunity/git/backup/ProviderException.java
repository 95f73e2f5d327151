package org.springaicommunity.git.backup;

/**
 * Thrown when a provider cannot list its repositories, e.g. because of bad credentials
 * or an unreachable API.
 */
public class ProviderException extends RuntimeException {

	private final String provider;

	public ProviderException(String provider, String message) {
		super(message);
		this.provider = provider;
	}

	public ProviderException(String provider, String message, Throwable cause) {
		super(message, cause);
		this.provider = provider;
	}

	public String getProvider() {
		return provider;
	}

}
