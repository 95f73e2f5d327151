package org.springaicommunity.git.backup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitRefs Tests")
class GitRefsTest {

	@Test
	@DisplayName("Should parse ls-remote output and drop pseudo and peeled refs")
	void shouldParseLsRemote() {
		String output = """
				1111111111111111111111111111111111111111	HEAD
				1111111111111111111111111111111111111111	refs/heads/main
				2222222222222222222222222222222222222222	refs/tags/v1.0
				3333333333333333333333333333333333333333	refs/tags/v1.0^{}
				4444444444444444444444444444444444444444	FETCH_HEAD
				""";

		GitRefs refs = GitRefs.parse(output);

		assertThat(refs.refs()).containsExactlyInAnyOrderEntriesOf(
				Map.of("refs/heads/main", "1111111111111111111111111111111111111111", "refs/tags/v1.0",
						"2222222222222222222222222222222222222222"));
	}

	@Test
	@DisplayName("Should parse space separated bundle heads")
	void shouldParseBundleHeads() {
		GitRefs refs = GitRefs.parse("aaaa refs/heads/main\nbbbb refs/heads/dev\n\n");

		assertThat(refs.refs()).containsEntry("refs/heads/main", "aaaa").containsEntry("refs/heads/dev", "bbbb");
	}

	@Test
	@DisplayName("Should compare equal only with identical names and SHAs")
	void shouldCompareExactly() {
		GitRefs local = GitRefs.parse("aaaa refs/heads/main\nbbbb refs/tags/v1");

		assertThat(local).isEqualTo(GitRefs.parse("bbbb\trefs/tags/v1\naaaa\trefs/heads/main\ncccc\tHEAD"));
		assertThat(local).isNotEqualTo(GitRefs.parse("aaaa refs/heads/main\ncccc refs/tags/v1"));
		assertThat(local).isNotEqualTo(GitRefs.parse("aaaa refs/heads/main"));
		assertThat(local).isNotEqualTo(GitRefs.parse("aaaa refs/heads/main\nbbbb refs/tags/v1\ndddd refs/heads/x"));
	}

	@Test
	@DisplayName("Should treat empty output as no refs")
	void shouldHandleEmptyOutput() {
		assertThat(GitRefs.parse("").isEmpty()).isTrue();
	}

}
