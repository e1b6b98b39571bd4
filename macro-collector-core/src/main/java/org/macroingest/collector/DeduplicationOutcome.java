package org.macroingest.collector;

import java.util.List;

/**
 * Result of filtering a batch through the {@link Deduplicator}.
 *
 * @param kept records with a new fingerprint (or no fingerprint), in input order
 * @param duplicates records dropped because their fingerprint was already seen or claimed
 * @param conflicts duplicates whose fields disagreed with the kept record
 */
public record DeduplicationOutcome(List<NormalizedRecord> kept, List<NormalizedRecord> duplicates,
		List<DuplicateConflict> conflicts) {

	public DeduplicationOutcome {
		kept = List.copyOf(kept);
		duplicates = List.copyOf(duplicates);
		conflicts = List.copyOf(conflicts);
	}

}
