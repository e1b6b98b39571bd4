package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable outcome of one unit.
 *
 * @param unit the unit
 * @param status final status
 * @param records records exported for the unit (after deduplication)
 * @param exportedFiles files written for the unit
 * @param error the failure, for failed and cancelled units
 * @param cursor watermark position reached by a successful unit
 * @param attempts network attempts made for the unit
 * @param conflicts duplicates whose fields differed from the kept record
 */
public record CollectionResult(CollectionUnit unit, UnitStatus status, List<NormalizedRecord> records,
		List<ExportedFile> exportedFiles, @Nullable CollectionError error, @Nullable Instant cursor,
		List<FetchAttempt> attempts, List<DuplicateConflict> conflicts) {

	public CollectionResult {
		records = List.copyOf(records);
		exportedFiles = List.copyOf(exportedFiles);
		attempts = List.copyOf(attempts);
		conflicts = List.copyOf(conflicts);
	}

	public static CollectionResult succeeded(CollectionUnit unit, List<NormalizedRecord> records,
			List<ExportedFile> exportedFiles, Optional<Instant> cursor, List<FetchAttempt> attempts,
			List<DuplicateConflict> conflicts) {
		return new CollectionResult(unit, UnitStatus.SUCCEEDED, records, exportedFiles, null, cursor.orElse(null),
				attempts, conflicts);
	}

	public static CollectionResult failed(CollectionUnit unit, CollectionError error, List<FetchAttempt> attempts) {
		UnitStatus status = error.type() == ErrorType.CANCELLED ? UnitStatus.CANCELLED : UnitStatus.FAILED;
		return new CollectionResult(unit, status, List.of(), List.of(), error, null, attempts, List.of());
	}

	public boolean isSuccess() {
		return status == UnitStatus.SUCCEEDED;
	}

}
