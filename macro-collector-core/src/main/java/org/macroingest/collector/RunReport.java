package org.macroingest.collector;

import java.util.List;

/**
 * Everything a run produced.
 *
 * @param manifest the run manifest
 * @param results one result per enumerated unit, in enumeration order
 * @param exportedFiles every file written by the run
 */
public record RunReport(RunManifest manifest, List<CollectionResult> results, List<ExportedFile> exportedFiles) {

	public RunReport {
		results = List.copyOf(results);
		exportedFiles = List.copyOf(exportedFiles);
	}

	public int recordCount() {
		return results.stream().mapToInt(r -> r.records().size()).sum();
	}

	public List<DuplicateConflict> conflicts() {
		return results.stream().flatMap(r -> r.conflicts().stream()).toList();
	}

	/**
	 * Whether some units were skipped.
	 * @return true if at least one unit did not succeed
	 */
	public boolean isPartial() {
		return !manifest.skippedUnits().isEmpty();
	}

}
