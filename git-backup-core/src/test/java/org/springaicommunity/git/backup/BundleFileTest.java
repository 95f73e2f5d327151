package org.springaicommunity.git.backup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BundleFile Tests")
class BundleFileTest {

	@Nested
	@DisplayName("Name Parsing")
	class NameParsingTest {

		@Test
		@DisplayName("Should parse timestamp from second-to-last segment")
		void shouldParseTimestamp() {
			BundleFile bundle = BundleFile.from(Path.of("/b/test.20200401111111.bundle")).orElseThrow();

			assertThat(bundle.created()).isEqualTo(LocalDateTime.of(2020, 4, 1, 11, 11, 11));
			assertThat(bundle.name()).isEqualTo("test.20200401111111.bundle");
		}

		@Test
		@DisplayName("Should accept repository names containing dots")
		void shouldAcceptDottedNames() {
			assertThat(BundleFile.from(Path.of("my.site.io.20240102030405.bundle"))).hasValueSatisfying(
					bundle -> assertThat(bundle.created()).isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5)));
		}

		@ParameterizedTest
		@ValueSource(strings = { "test.bundle", "20200401111111.bundle", "test.20200401111111.bundle.invalid",
				"test.2020040111111.bundle", "test.20201301111111.bundle", "test.20200230111111.bundle",
				"test.2020040111111x.bundle", "test.20200401111111.zip", "notes.txt" })
		@DisplayName("Should reject names outside the bundle naming scheme")
		void shouldRejectInvalidNames(String name) {
			assertThat(BundleFile.from(Path.of(name))).isEmpty();
		}

		@Test
		@DisplayName("Should build file names that parse back to the same timestamp")
		void shouldBuildFileName() {
			LocalDateTime created = LocalDateTime.of(2021, 12, 31, 23, 59, 58);

			String name = BundleFile.fileName("repo", created);

			assertThat(name).isEqualTo("repo.20211231235958.bundle");
			assertThat(BundleFile.from(Path.of(name)).orElseThrow().created()).isEqualTo(created);
		}

	}

	@Test
	@DisplayName("Should order by embedded timestamp")
	void shouldOrderByTimestamp() {
		BundleFile older = BundleFile.from(Path.of("z.20200101000000.bundle")).orElseThrow();
		BundleFile newer = BundleFile.from(Path.of("a.20210101000000.bundle")).orElseThrow();
		List<BundleFile> bundles = new ArrayList<>(List.of(newer, older));

		Collections.sort(bundles);

		assertThat(bundles).containsExactly(older, newer);
	}

	@Test
	@DisplayName("Should report size and SHA-256 of content")
	void shouldHashContent(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("r.20200101000000.bundle");
		Files.writeString(file, "abc");
		BundleFile bundle = BundleFile.from(file).orElseThrow();

		assertThat(bundle.sizeBytes()).isEqualTo(3);
		assertThat(bundle.contentHash())
			.isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
	}

}
