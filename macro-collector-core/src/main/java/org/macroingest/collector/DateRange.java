package org.macroingest.collector;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Inclusive calendar date range.
 *
 * @param start first day
 * @param end last day, not before {@code start}
 */
public record DateRange(LocalDate start, LocalDate end) {

	public DateRange {
		if (end.isBefore(start)) {
			throw new IllegalArgumentException("Range end " + end + " is before start " + start);
		}
	}

	public static DateRange of(LocalDate day) {
		return new DateRange(day, day);
	}

	public boolean contains(LocalDate date) {
		return !date.isBefore(start) && !date.isAfter(end);
	}

	/**
	 * Every day of the range, in order.
	 * @return the days
	 */
	public List<LocalDate> days() {
		return start.datesUntil(end.plusDays(1)).collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return start.equals(end) ? start.toString() : start + ".." + end;
	}

}
