package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;

/**
 * A remote repository to back up, as returned by a {@link GitProvider}.
 *
 * <p>
 * The credential-embedded URL variants are only ever used for cloning and ref listing;
 * the plain {@code httpsUrl} is the one that appears in logs.
 *
 * @param domain hosting hostname, e.g. {@code github.com}
 * @param pathWithNamespace owner and repository path, e.g. {@code soba/test}; used as the
 * on-disk directory key
 * @param name repository name without the namespace; used as the bundle file prefix
 * @param httpsUrl plain HTTPS clone URL
 * @param urlWithToken HTTPS clone URL with an embedded token (may be null)
 * @param urlWithBasicAuth HTTPS clone URL with embedded user and password (may be null)
 */
public record Repository(String domain, String pathWithNamespace, String name, String httpsUrl,
		@Nullable String urlWithToken, @Nullable String urlWithBasicAuth) {

	public Repository {
		if (domain.isBlank()) {
			throw new IllegalArgumentException("Repository domain must not be blank");
		}
		if (pathWithNamespace.isBlank()) {
			throw new IllegalArgumentException("Repository path must not be blank");
		}
		if (name.isBlank()) {
			throw new IllegalArgumentException("Repository name must not be blank");
		}
	}

	/**
	 * Create a repository without credential-embedded URLs.
	 */
	public static Repository of(String domain, String pathWithNamespace, String name, String httpsUrl) {
		return new Repository(domain, pathWithNamespace, name, httpsUrl, null, null);
	}

	/**
	 * Returns the URL to clone with: the token variant, then the basic-auth variant, then
	 * the plain HTTPS URL.
	 * @return clone URL, possibly carrying credentials
	 */
	public String cloneUrl() {
		if (urlWithToken != null && !urlWithToken.isEmpty()) {
			return urlWithToken;
		}
		if (urlWithBasicAuth != null && !urlWithBasicAuth.isEmpty()) {
			return urlWithBasicAuth;
		}
		return httpsUrl;
	}

	/**
	 * Identifier used in results and log lines: {@code <domain>/<pathWithNamespace>}.
	 */
	public String identifier() {
		return domain + "/" + pathWithNamespace;
	}

	@Override
	public String toString() {
		return "Repository[" + identifier() + "]";
	}

}
