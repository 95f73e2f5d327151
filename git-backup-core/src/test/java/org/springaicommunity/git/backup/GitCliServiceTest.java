package org.springaicommunity.git.backup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("GitCliService Tests")
@ExtendWith(MockitoExtension.class)
class GitCliServiceTest {

	@Mock
	private GitClient gitClient;

	private GitCliService service;

	@BeforeEach
	void setUp() {
		service = new GitCliService(gitClient);
	}

	private static GitCommandResult result(int exitCode, String stdout, String stderr) {
		return new GitCommandResult(List.of("git"), exitCode, stdout, stderr);
	}

	@Test
	@DisplayName("Should mirror clone with verbose output")
	void shouldMirrorClone() {
		when(gitClient.execute(null, "clone", "-v", "--mirror", "https://t@h/x", "/tmp/x"))
			.thenReturn(result(0, "", ""));

		service.mirrorClone("https://t@h/x", Path.of("/tmp/x"));

		verify(gitClient).execute(null, "clone", "-v", "--mirror", "https://t@h/x", "/tmp/x");
	}

	@Test
	@DisplayName("Should fail clone with masked stderr")
	void shouldFailCloneMasked() {
		when(gitClient.execute(isNull(), any(String[].class)))
			.thenReturn(new GitCommandResult(List.of("clone", "https://***@h/x"), 128, "",
					"fatal: Authentication failed for 'https://t@h/x/'"));

		assertThatThrownBy(() -> service.mirrorClone("https://t@h/x", Path.of("/tmp/x")))
			.isInstanceOf(GitCommandException.class)
			.hasMessageContaining("exited with 128")
			.hasMessageNotContaining("t@h");
	}

	@Test
	@DisplayName("Should create bundle of all refs inside the repository")
	void shouldCreateBundle() {
		Path repo = Path.of("/w/repo");
		when(gitClient.execute(repo, "bundle", "create", "/b/r.bundle", "--all")).thenReturn(result(0, "", ""));

		service.createBundle(repo, Path.of("/b/r.bundle"));

		verify(gitClient).execute(repo, "bundle", "create", "/b/r.bundle", "--all");
	}

	@Test
	@DisplayName("Should signal invalid bundle on git's not-a-bundle message")
	void shouldDetectInvalidBundle() {
		when(gitClient.execute(null, "bundle", "list-heads", "/b/r.bundle"))
			.thenReturn(result(128, "", "error: '/b/r.bundle' does not look like a v2 or v3 bundle file"));

		assertThatThrownBy(() -> service.listBundleHeads(Path.of("/b/r.bundle")))
			.isInstanceOf(InvalidBundleException.class)
			.satisfies(e -> assertThat(((InvalidBundleException) e).getBundlePath()).isEqualTo(Path.of("/b/r.bundle")));
	}

	@Test
	@DisplayName("Should report other list-heads failures as command errors")
	void shouldReportOtherFailures() {
		when(gitClient.execute(null, "bundle", "list-heads", "/b/r.bundle"))
			.thenReturn(result(128, "", "fatal: could not open '/b/r.bundle'"));

		assertThatThrownBy(() -> service.listBundleHeads(Path.of("/b/r.bundle")))
			.isExactlyInstanceOf(GitCommandException.class)
			.satisfies(e -> {
				GitCommandException failure = (GitCommandException) e;
				assertThat(failure.getExitCode()).isEqualTo(128);
				assertThat(failure.getStderr()).contains("could not open");
				assertThat(failure.getCommand()).containsExactly("git");
			});
	}

	@Test
	@DisplayName("Should parse remote refs")
	void shouldListRemoteRefs() {
		when(gitClient.execute(null, "ls-remote", "https://h/x"))
			.thenReturn(result(0, "aaaa\tHEAD\naaaa\trefs/heads/main\n", ""));

		assertThat(service.listRemoteRefs("https://h/x").refs()).containsOnlyKeys("refs/heads/main");
	}

	@Test
	@DisplayName("Should parse object counts")
	void shouldCountObjects() {
		Path repo = Path.of("/w/repo");
		when(gitClient.execute(repo, "count-objects", "-v")).thenReturn(result(0, """
				count: 0
				size: 0
				in-pack: 12
				packs: 1
				size-pack: 4
				prune-packable: 0
				garbage: 0
				size-garbage: 0
				""", ""));

		ObjectCounts counts = service.countObjects(repo);

		assertThat(counts).isEqualTo(new ObjectCounts(0, 12));
		assertThat(counts.isEmpty()).isFalse();
		assertThat(ObjectCounts.parse("count: 0\nin-pack: 0\n").isEmpty()).isTrue();
	}

}
