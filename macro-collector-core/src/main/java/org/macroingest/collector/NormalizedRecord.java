package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One output row (tabular sources) or document (document sources).
 *
 * <p>
 * {@code fields} preserves every source field under its snake_case name, in source order.
 * Documents carry {@code url}, {@code title}, {@code content}, {@code document_type} and a
 * {@code metadata} map, plus a {@code fingerprint}. Tabular rows usually have no
 * fingerprint and are not deduplicated.
 *
 * @param source source tag
 * @param dataset dataset name
 * @param timestampCollected when the record was collected
 * @param fields payload fields
 * @param fingerprint content fingerprint, for documents
 * @param cursor position of the record for incremental collection
 */
public record NormalizedRecord(String source, String dataset, Instant timestampCollected,
		Map<String, @Nullable Object> fields, @Nullable String fingerprint, @Nullable Instant cursor) {

	public NormalizedRecord {
		fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	public static NormalizedRecord row(String source, String dataset, Instant timestampCollected,
			Map<String, @Nullable Object> fields, @Nullable Instant cursor) {
		return new NormalizedRecord(source, dataset, timestampCollected, fields, null, cursor);
	}

	public boolean isDocument() {
		return fingerprint != null;
	}

	@Nullable
	public Object field(String name) {
		return fields.get(name);
	}

	/**
	 * The record as written to the raw store: {@code source} and
	 * {@code timestamp_collected} first, then the payload fields, then the fingerprint.
	 * @return ordered column map
	 */
	public Map<String, @Nullable Object> toBronze() {
		Map<String, @Nullable Object> row = new LinkedHashMap<>();
		row.put("source", source);
		row.put("timestamp_collected", timestampCollected.toString());
		fields.forEach((name, value) -> {
			if (!"source".equals(name) && !"timestamp_collected".equals(name)) {
				row.put(name, value);
			}
		});
		if (fingerprint != null) {
			row.put("fingerprint", fingerprint);
		}
		return row;
	}

}
