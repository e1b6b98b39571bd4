package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * The range a caller asked to collect.
 *
 * @param start first day requested
 * @param end last day requested (inclusive)
 * @param incremental whether to resume from the stored watermark instead of {@code start}
 */
public record CollectionRange(LocalDate start, LocalDate end, boolean incremental) {

	public CollectionRange {
		if (end.isBefore(start)) {
			throw new IllegalArgumentException("Range end " + end + " is before start " + start);
		}
	}

	public DateRange asDateRange() {
		return new DateRange(start, end);
	}

	/**
	 * Effective first day for a dataset: the day after the watermark when collecting
	 * incrementally and a watermark exists, otherwise {@code start}.
	 * @param watermark the dataset watermark, if any
	 * @return the first day to collect
	 */
	public LocalDate effectiveStart(@Nullable Instant watermark) {
		if (!incremental || watermark == null) {
			return start;
		}
		LocalDate next = watermark.atZone(ZoneOffset.UTC).toLocalDate().plusDays(1);
		return next.isAfter(start) ? next : start;
	}

	/**
	 * Same dates, full (non-incremental) collection.
	 * @return the range
	 */
	public CollectionRange full() {
		return new CollectionRange(start, end, false);
	}

}
