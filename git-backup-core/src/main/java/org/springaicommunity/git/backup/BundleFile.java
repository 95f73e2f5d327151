package org.springaicommunity.git.backup;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A bundle archive on disk, named {@code <repoName>.<yyyyMMddHHmmss>.bundle}.
 *
 * <p>
 * The creation time comes from the file name only; file modification times are never
 * consulted, so copies and restores keep their ordering.
 *
 * @param path location of the bundle file
 * @param created timestamp parsed from the file name
 */
public record BundleFile(Path path, LocalDateTime created) implements Comparable<BundleFile> {

	public static final String EXTENSION = "bundle";

	public static final String INVALID_SUFFIX = ".invalid";

	static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmmss")
		.withResolverStyle(ResolverStyle.STRICT);

	private static final Pattern TIMESTAMP = Pattern.compile("\\d{14}");

	private static final Comparator<BundleFile> ORDER = Comparator.comparing(BundleFile::created)
		.thenComparing(BundleFile::name);

	/**
	 * Interpret a path as a bundle file.
	 * @param path candidate file
	 * @return the bundle, or empty when the name has fewer than three dot-separated
	 * segments, does not end in {@code .bundle}, or has no valid timestamp as its
	 * second-to-last segment
	 */
	public static Optional<BundleFile> from(Path path) {
		Path fileName = path.getFileName();
		if (fileName == null) {
			return Optional.empty();
		}
		String[] segments = fileName.toString().split("\\.");
		if (segments.length < 3 || !EXTENSION.equals(segments[segments.length - 1])) {
			return Optional.empty();
		}
		String timestamp = segments[segments.length - 2];
		if (!TIMESTAMP.matcher(timestamp).matches()) {
			return Optional.empty();
		}
		try {
			return Optional.of(new BundleFile(path, LocalDateTime.parse(timestamp, TIMESTAMP_FORMAT)));
		}
		catch (DateTimeParseException e) {
			return Optional.empty();
		}
	}

	/**
	 * Build the file name for a bundle of {@code repoName} created at {@code created}.
	 */
	public static String fileName(String repoName, LocalDateTime created) {
		return repoName + "." + TIMESTAMP_FORMAT.format(created) + "." + EXTENSION;
	}

	public String name() {
		return path.getFileName().toString();
	}

	public long sizeBytes() {
		try {
			return Files.size(path);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read size of " + path, e);
		}
	}

	/**
	 * SHA-256 of the file content as lower-case hex. Computed on every call.
	 */
	public String contentHash() {
		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance("SHA-256");
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
		try (InputStream in = new DigestInputStream(Files.newInputStream(path), digest)) {
			in.transferTo(OutputStream.nullOutputStream());
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to hash " + path, e);
		}
		return HexFormat.of().formatHex(digest.digest());
	}

	@Override
	public int compareTo(BundleFile other) {
		return ORDER.compare(this, other);
	}

}
