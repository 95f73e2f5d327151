package org.springaicommunity.git.backup;

/**
 * Object totals reported by {@code git count-objects -v}.
 *
 * @param loose number of loose objects ({@code count:})
 * @param inPack number of packed objects ({@code in-pack:})
 */
public record ObjectCounts(long loose, long inPack) {

	/**
	 * Parse {@code git count-objects -v} output. Missing lines count as zero.
	 */
	public static ObjectCounts parse(String output) {
		long loose = 0;
		long inPack = 0;
		for (String line : output.split("\\R")) {
			int colon = line.indexOf(':');
			if (colon == -1) {
				continue;
			}
			String key = line.substring(0, colon).trim();
			String value = line.substring(colon + 1).trim();
			if ("count".equals(key)) {
				loose = Long.parseLong(value);
			}
			else if ("in-pack".equals(key)) {
				inPack = Long.parseLong(value);
			}
		}
		return new ObjectCounts(loose, inPack);
	}

	/**
	 * True when the repository holds no objects at all, which is the case for a freshly
	 * created remote with no commits.
	 */
	public boolean isEmpty() {
		return loose == 0 && inPack == 0;
	}

}
