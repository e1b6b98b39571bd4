package org.macroingest.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw response for one unit as returned by {@link SourceAdapter#fetch(CollectionUnit)}.
 *
 * @param unit the unit fetched
 * @param body primary response body
 * @param fetchedAt when the fetch completed
 * @param attachments secondary pages keyed by URL, in fetch order
 */
public record RawPayload(CollectionUnit unit, String body, Instant fetchedAt, Map<String, Attachment> attachments) {

	public RawPayload {
		attachments = Collections.unmodifiableMap(new LinkedHashMap<>(attachments));
	}

	public RawPayload(CollectionUnit unit, String body, Instant fetchedAt) {
		this(unit, body, fetchedAt, Map.of());
	}

	/**
	 * A secondary page, or the reason it could not be fetched.
	 *
	 * @param url page URL
	 * @param body page content, {@code null} on failure
	 * @param error failure description, {@code null} on success
	 */
	public record Attachment(String url, @Nullable String body, @Nullable String error) {

		public static Attachment success(String url, String body) {
			return new Attachment(url, body, null);
		}

		public static Attachment failure(String url, String error) {
			return new Attachment(url, null, error);
		}

		public boolean isSuccess() {
			return error == null;
		}

	}

}
