package org.springaicommunity.git.backup;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Ref name to commit SHA mapping, either read from a bundle's heads or listed from a live
 * remote.
 *
 * <p>
 * Pseudo-refs and peeled tag entries ({@code refs/tags/v1^{}}) are never part of the
 * mapping, so values from both sources compare with plain {@link #equals(Object)}: same
 * ref names, same SHA per ref.
 *
 * @param refs ref name to SHA
 */
public record GitRefs(Map<String, String> refs) {

	/**
	 * Refs that only describe a working-state pointer and never identify history.
	 */
	public static final Set<String> PSEUDO_REFS = Set.of("HEAD", "FETCH_HEAD", "ORIG_HEAD", "MERGE_HEAD",
			"CHERRY_PICK_HEAD");

	private static final String PEELED_SUFFIX = "^{}";

	public GitRefs {
		refs = Map.copyOf(refs);
	}

	/**
	 * Parse the output of {@code git bundle list-heads} or {@code git ls-remote}: one
	 * {@code <sha><whitespace><ref>} pair per line.
	 * @param output command output
	 * @return the refs, minus pseudo-refs and peeled entries
	 */
	public static GitRefs parse(String output) {
		Map<String, String> refs = new TreeMap<>();
		for (String line : output.split("\\R")) {
			String[] fields = line.trim().split("\\s+");
			if (fields.length != 2) {
				continue;
			}
			String sha = fields[0];
			String ref = fields[1];
			if (PSEUDO_REFS.contains(ref) || ref.endsWith(PEELED_SUFFIX)) {
				continue;
			}
			refs.put(ref, sha);
		}
		return new GitRefs(refs);
	}

	public boolean isEmpty() {
		return refs.isEmpty();
	}

	public int size() {
		return refs.size();
	}

}
