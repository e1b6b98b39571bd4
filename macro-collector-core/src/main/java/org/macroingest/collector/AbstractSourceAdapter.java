package org.macroingest.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Base class for source adapters providing the shared plumbing: access to the
 * {@link SourceContext}, health-check probes and secondary fetches through the
 * {@link ResilienceEngine}, and tabular row normalization.
 *
 * <p>
 * Row normalization renames columns to snake_case, coerces the declared numeric columns
 * and drops (with a warning) any row whose numeric value cannot be parsed.
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {

	private static final Logger logger = LoggerFactory.getLogger(AbstractSourceAdapter.class);

	protected final SourceContext context;

	protected AbstractSourceAdapter(SourceContext context) {
		this.context = context;
	}

	protected Instant now() {
		return context.clock().instant();
	}

	/**
	 * Single-attempt reachability check through the governor.
	 * @param url URL to probe
	 * @return true if the probe answered with a 2xx status
	 */
	protected boolean probe(String url) {
		Result<String> result = context.engine()
			.execute(sourceId(), "health check " + url, () -> context.client().get(url), context.retryPolicy()
				.withMaxAttempts(1));
		if (result.isFailure()) {
			logger.warn("Health check for {} failed: {}", sourceId(), result.errorOrThrow().message());
			return false;
		}
		return true;
	}

	/**
	 * Fetch a secondary page through the governor and retry engine.
	 * @param description description for logs and attempts
	 * @param url page URL
	 * @return the page body, or the classified failure
	 * @throws CancellationException if the fetch was interrupted
	 */
	protected Result<String> fetchSecondary(String description, String url) {
		Result<String> result = context.engine()
			.execute(sourceId(), description, () -> context.client().get(url), context.retryPolicy());
		throwIfCancelled(result);
		return result;
	}

	protected static void throwIfCancelled(Result<?> result) {
		if (result.isFailure() && result.errorOrThrow().type() == ErrorType.CANCELLED) {
			throw new CancellationException(result.errorOrThrow().message());
		}
	}

	/**
	 * Normalize raw tabular rows into records.
	 * @param payload payload the rows came from
	 * @param rows rows keyed by source column name, in source column order
	 * @param numericColumns source column names that must parse as numbers
	 * @param dateColumn source column holding the observation date, used as cursor
	 * @return the records, without rows that failed numeric coercion
	 */
	protected List<NormalizedRecord> normalizeRows(RawPayload payload, List<Map<String, String>> rows,
			Collection<String> numericColumns, @Nullable String dateColumn) {
		CollectionUnit unit = payload.unit();
		List<NormalizedRecord> records = new ArrayList<>(rows.size());
		int dropped = 0;
		for (Map<String, String> row : rows) {
			Optional<Map<String, @Nullable Object>> fields = coerceRow(row, numericColumns);
			if (fields.isEmpty()) {
				dropped++;
				continue;
			}
			Instant cursor = dateColumn != null ? parseCursor(row.get(dateColumn)) : null;
			records.add(NormalizedRecord.row(sourceId(), unit.dataset(), payload.fetchedAt(), fields.get(), cursor));
		}
		if (dropped > 0) {
			logger.warn("{}: dropped {} of {} row(s) with non-numeric values", unit.key(), dropped, rows.size());
		}
		return records;
	}

	/**
	 * Rename columns to snake_case and coerce numeric columns.
	 * @param row source row
	 * @param numericColumns source column names that must parse as numbers
	 * @return the coerced fields, or empty if a numeric column did not parse
	 */
	protected Optional<Map<String, @Nullable Object>> coerceRow(Map<String, String> row,
			Collection<String> numericColumns) {
		Map<String, @Nullable Object> fields = new LinkedHashMap<>();
		for (Map.Entry<String, String> column : row.entrySet()) {
			String value = column.getValue();
			if (numericColumns.contains(column.getKey())) {
				BigDecimal number = parseNumber(value);
				if (number == null) {
					logger.debug("Dropping row: {}='{}' is not numeric", column.getKey(), value);
					return Optional.empty();
				}
				fields.put(snakeCase(column.getKey()), number);
			}
			else {
				fields.put(snakeCase(column.getKey()), value);
			}
		}
		return Optional.of(fields);
	}

	@Nullable
	protected static BigDecimal parseNumber(@Nullable String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			return new BigDecimal(value.trim());
		}
		catch (NumberFormatException e) {
			return null;
		}
	}

	/**
	 * Parse an observation date ({@code yyyy-MM-dd}, {@code yyyy-MM}, or an ISO instant)
	 * into a cursor at UTC midnight.
	 * @param value the date text
	 * @return the cursor, or {@code null} if unparseable
	 */
	@Nullable
	protected static Instant parseCursor(@Nullable String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		String text = value.trim();
		try {
			if (text.length() > 10 && text.charAt(10) == 'T') {
				return Instant.parse(text);
			}
			if (text.length() == 7) {
				return YearMonth.parse(text).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
			}
			return LocalDate.parse(text.substring(0, Math.min(10, text.length())))
				.atStartOfDay(ZoneOffset.UTC)
				.toInstant();
		}
		catch (DateTimeParseException e) {
			return null;
		}
	}

	/**
	 * Normalize a column name: {@code TIME_PERIOD} &rarr; {@code time_period},
	 * {@code seriesId} &rarr; {@code series_id}, {@code Actual Value} &rarr;
	 * {@code actual_value}.
	 * @param name source column name
	 * @return snake_case name
	 */
	public static String snakeCase(String name) {
		String spaced = name.trim().replaceAll("([a-z0-9])([A-Z])", "$1_$2");
		String snake = spaced.replaceAll("[^A-Za-z0-9]+", "_").toLowerCase(Locale.ROOT);
		return snake.replaceAll("^_+|_+$", "");
	}

}
