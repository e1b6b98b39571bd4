package org.macroingest.collector;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Smallest schedulable piece of work, enumerated by a {@link SourceAdapter} and consumed
 * exactly once per run.
 *
 * @param sourceId source identifier
 * @param dataset dataset the unit belongs to
 * @param workKey adapter-specific key (series id, day, page)
 * @param range date range covered by the unit, if any
 */
public record CollectionUnit(String sourceId, String dataset, String workKey, Optional<DateRange> range) {

	public static CollectionUnit of(String sourceId, String dataset, String workKey) {
		return new CollectionUnit(sourceId, dataset, workKey, Optional.empty());
	}

	public static CollectionUnit of(String sourceId, String dataset, String workKey, DateRange range) {
		return new CollectionUnit(sourceId, dataset, workKey, Optional.of(range));
	}

	/**
	 * Unique key within a run: {@code source:dataset:workKey}.
	 * @return the key
	 */
	public String key() {
		return sourceId + ":" + dataset + ":" + workKey;
	}

	/**
	 * Collection date used in export file names: the end of the unit's range, or the
	 * run date for units without a range.
	 * @param runDate date of the run
	 * @return the collection date
	 */
	public LocalDate collectionDate(LocalDate runDate) {
		return range.map(DateRange::end).orElse(runDate);
	}

	@Override
	public String toString() {
		return key() + range.map(r -> " [" + r + "]").orElse("");
	}

}
