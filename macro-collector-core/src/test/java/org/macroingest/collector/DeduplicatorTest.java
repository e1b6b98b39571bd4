package org.macroingest.collector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link Deduplicator}.
 */
@DisplayName("Deduplicator Tests")
class DeduplicatorTest {

	private static final Instant NOW = Instant.parse("2024-02-01T00:00:00Z");

	private static NormalizedRecord document(String url, String title) {
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("url", url);
		fields.put("title", title);
		return new NormalizedRecord("fed", "speeches", NOW, fields, Fingerprints.of("fed", url), null);
	}

	@Nested
	@DisplayName("Seen Set Tests")
	class SeenSetTest {

		@Test
		@DisplayName("Should drop records already exported")
		void shouldDropExportedRecords() {
			NormalizedRecord old = document("https://example.org/a", "A");
			Deduplicator deduplicator = new Deduplicator(Set.of(old.fingerprint()));

			DeduplicationOutcome outcome = deduplicator.filter(List.of(old, document("https://example.org/b", "B")));

			assertThat(outcome.kept()).extracting(r -> r.field("url")).containsExactly("https://example.org/b");
			assertThat(outcome.duplicates()).containsExactly(old);
			assertThat(deduplicator.seenCount()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should keep the first of two identical records in one batch")
		void shouldKeepFirstWithinBatch() {
			NormalizedRecord first = document("https://example.org/a", "A");

			DeduplicationOutcome outcome = new Deduplicator().filter(List.of(first, first));

			assertThat(outcome.kept()).containsExactly(first);
			assertThat(outcome.duplicates()).hasSize(1);
			assertThat(outcome.conflicts()).isEmpty();
		}

		@Test
		@DisplayName("Should always keep records without a fingerprint")
		void shouldKeepRowsWithoutFingerprint() {
			NormalizedRecord row = NormalizedRecord.row("fred", "cpi", NOW, Map.of("date", "2024-01-01"), null);

			DeduplicationOutcome outcome = new Deduplicator().filter(List.of(row, row));

			assertThat(outcome.kept()).hasSize(2);
		}

		@Test
		@DisplayName("Should report a conflict when a duplicate differs")
		void shouldReportConflicts() {
			NormalizedRecord first = document("https://example.org/a", "Original title");
			NormalizedRecord second = document("https://example.org/a", "Edited title");

			DeduplicationOutcome outcome = new Deduplicator().filter(List.of(first, second));

			assertThat(outcome.kept()).containsExactly(first);
			assertThat(outcome.conflicts()).singleElement().satisfies(conflict -> {
				assertThat(conflict.kept()).isEqualTo(first);
				assertThat(conflict.discarded()).isEqualTo(second);
			});
		}

	}

	@Nested
	@DisplayName("Claim Tests")
	class ClaimTest {

		@Test
		@DisplayName("Should hide a claimed fingerprint from other units")
		void shouldHideClaimedFingerprints() {
			Deduplicator deduplicator = new Deduplicator();
			NormalizedRecord record = document("https://example.org/a", "A");

			deduplicator.claim("day-1", List.of(record));
			DeduplicationOutcome other = deduplicator.claim("day-2", List.of(record));

			assertThat(other.kept()).isEmpty();
			assertThat(deduplicator.isNew(record.fingerprint())).isFalse();
			assertThat(deduplicator.seenCount()).isZero();
		}

		@Test
		@DisplayName("Should make claims permanent on commit")
		void shouldCommitClaims() {
			Deduplicator deduplicator = new Deduplicator();
			NormalizedRecord record = document("https://example.org/a", "A");
			deduplicator.claim("day-1", List.of(record));

			assertThat(deduplicator.commit("day-1")).isEqualTo(1);

			assertThat(deduplicator.seenCount()).isEqualTo(1);
			assertThat(deduplicator.claim("day-2", List.of(record)).kept()).isEmpty();
		}

		@Test
		@DisplayName("Should free claims on release so a later unit can export them")
		void shouldReleaseClaims() {
			Deduplicator deduplicator = new Deduplicator();
			NormalizedRecord record = document("https://example.org/a", "A");
			deduplicator.claim("day-1", List.of(record));

			assertThat(deduplicator.release("day-1")).isEqualTo(1);

			assertThat(deduplicator.isNew(record.fingerprint())).isTrue();
			assertThat(deduplicator.claim("day-2", List.of(record)).kept()).containsExactly(record);
		}

		@Test
		@DisplayName("Should only commit the owner's claims")
		void shouldCommitOnlyOwnersClaims() {
			Deduplicator deduplicator = new Deduplicator();
			deduplicator.claim("day-1", List.of(document("https://example.org/a", "A")));
			deduplicator.claim("day-2", List.of(document("https://example.org/b", "B")));

			deduplicator.commit("day-1");
			deduplicator.release("day-2");

			assertThat(deduplicator.seenCount()).isEqualTo(1);
			assertThat(deduplicator.isNew(Fingerprints.of("fed", "https://example.org/b"))).isTrue();
		}

	}

}
