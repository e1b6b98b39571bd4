package org.macroingest.collector;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Contract between the framework and one external source.
 *
 * <p>
 * Adapters are thin: they enumerate units, fetch one unit per call (a single attempt, the
 * {@link ResilienceEngine} owns retries), and normalize payloads. They never sleep, retry,
 * deduplicate or write files themselves.
 */
public interface SourceAdapter {

	/**
	 * Constant source tag written into every record, e.g. {@code "fred"}.
	 * @return the source id
	 */
	String sourceId();

	List<String> datasets();

	/**
	 * Whether the source can resume from a watermark.
	 * @return the capability flag
	 */
	boolean supportsIncremental();

	/**
	 * Per-dataset refinement of {@link #supportsIncremental()}.
	 * @param dataset dataset name
	 * @return true if this dataset can resume from a watermark
	 */
	default boolean supportsIncremental(String dataset) {
		return supportsIncremental();
	}

	/**
	 * Upper bound of units of this source processed in parallel.
	 * @return worker count, default 1
	 */
	default int maxConcurrency() {
		return 1;
	}

	/**
	 * When true, a dataset's watermark only advances through the contiguous prefix of
	 * successful units (in enumeration order), so a failed unit is retried by the next
	 * incremental run.
	 * @return the ordering mode, default false (maximum successful cursor)
	 */
	default boolean strictWatermarkOrdering() {
		return false;
	}

	ExportFormat exportFormat(String dataset);

	/**
	 * Lazily enumerate the units covering a range.
	 * @param range requested range
	 * @param watermarks current cursor per dataset; only incremental datasets have an entry
	 * @return finite stream of units
	 */
	Stream<CollectionUnit> enumerateUnits(CollectionRange range, Map<String, Instant> watermarks);

	/**
	 * Fetch one unit. Called through the {@link ResilienceEngine}; must be idempotent.
	 * @param unit the unit
	 * @return the raw payload
	 */
	RawPayload fetch(CollectionUnit unit);

	/**
	 * Turn a payload into records. Pure: no I/O.
	 * @param payload the raw payload
	 * @return the records
	 * @throws PayloadParseException if the payload is malformed
	 */
	List<NormalizedRecord> normalize(RawPayload payload);

	/**
	 * Cursor reached by a successful unit: the latest record cursor, or the end of the
	 * unit's range.
	 * @param unit the unit
	 * @param records its normalized records
	 * @return the cursor, empty if the unit does not move the watermark
	 */
	default Optional<Instant> cursorFor(CollectionUnit unit, List<NormalizedRecord> records) {
		Optional<Instant> latest = records.stream()
			.map(NormalizedRecord::cursor)
			.filter(Objects::nonNull)
			.max(Instant::compareTo);
		if (latest.isPresent()) {
			return latest;
		}
		return unit.range().map(r -> r.end().atStartOfDay(ZoneOffset.UTC).toInstant());
	}

	/**
	 * Pre-flight connectivity check.
	 * @return true if the source is reachable
	 */
	boolean healthCheck();

}
