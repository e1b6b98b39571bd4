package org.macroingest.collector;

import java.time.Instant;
import java.util.List;

/**
 * Audit record of one run, persisted next to the exported files.
 *
 * @param runId unique run id
 * @param source source tag
 * @param startedAt run start
 * @param finishedAt run end
 * @param state final state, {@link RunState#IDLE} or {@link RunState#FAILED}
 * @param succeededUnits keys of units that were exported
 * @param skippedUnits units that failed or were cancelled, with the reason
 */
public record RunManifest(String runId, String source, Instant startedAt, Instant finishedAt, RunState state,
		List<String> succeededUnits, List<ManifestEntry> skippedUnits) {

	public RunManifest {
		succeededUnits = List.copyOf(succeededUnits);
		skippedUnits = List.copyOf(skippedUnits);
	}

}
