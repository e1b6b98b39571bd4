package org.macroingest.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CollectionOrchestrator} with in-memory sources and a file system raw
 * store.
 */
@DisplayName("CollectionOrchestrator Tests")
class CollectionOrchestratorTest {

	private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);

	private static final LocalDate JAN_30 = LocalDate.of(2024, 1, 30);

	@TempDir
	Path tempDir;

	private MutableClock clock;

	private RecordingSleeper sleeper;

	private ResilienceEngine engine;

	private InMemoryWatermarkStore watermarkStore;

	private WatermarkTracker watermarks;

	private FileSystemExportSink exportSink;

	@BeforeEach
	void setUp() {
		clock = MutableClock.at("2024-02-01T06:00:00Z");
		sleeper = new RecordingSleeper(clock);
		engine = new ResilienceEngine(RateGovernor.builder().clock(clock).sleeper(sleeper).build(), sleeper, clock);
		watermarkStore = new InMemoryWatermarkStore();
		watermarks = new WatermarkTracker(watermarkStore, clock);
		exportSink = new FileSystemExportSink(tempDir.resolve("raw"), ObjectMapperFactory.create());
	}

	private CollectionOrchestrator.Builder orchestrator() {
		return CollectionOrchestrator.builder()
			.engine(engine)
			.watermarks(watermarks)
			.exportSink(exportSink)
			.clock(clock);
	}

	private static Instant midnight(LocalDate day) {
		return day.atStartOfDay(ZoneOffset.UTC).toInstant();
	}

	@Nested
	@DisplayName("Partial Failure Tests")
	class PartialFailureTest {

		@Test
		@DisplayName("Should skip a terminally failing day and export the other 29")
		void shouldSkipFailingDay() {
			DailyAdapter adapter = new DailyAdapter(false);
			adapter.terminalDays.add(LocalDate.of(2024, 1, 15));

			RunReport report = orchestrator().build().run(adapter, new CollectionRange(JAN_1, JAN_30, true));

			assertThat(report.manifest().state()).isEqualTo(RunState.IDLE);
			assertThat(report.manifest().succeededUnits()).hasSize(29);
			assertThat(report.manifest().skippedUnits()).singleElement().satisfies(entry -> {
				assertThat(entry.unitKey()).isEqualTo("fake:daily:2024-01-15");
				assertThat(entry.errorType()).isEqualTo(ErrorType.TERMINAL_REQUEST);
			});
			assertThat(report.isPartial()).isTrue();
			assertThat(report.exportedFiles()).hasSize(29);
			assertThat(report.recordCount()).isEqualTo(29);
			assertThat(tempDir.resolve("raw/fake/fake_daily_20240115.csv")).doesNotExist();
			assertThat(tempDir.resolve("raw/fake/fake_daily_20240116.csv")).exists();
		}

		@Test
		@DisplayName("Should advance past the failed day when ordering is not strict")
		void shouldAdvanceWatermarkPastFailure() {
			DailyAdapter adapter = new DailyAdapter(false);
			adapter.terminalDays.add(LocalDate.of(2024, 1, 15));

			orchestrator().build().run(adapter, new CollectionRange(JAN_1, JAN_30, true));

			assertThat(watermarkStore.saved.get("fake/daily").cursor()).isEqualTo(midnight(JAN_30));
		}

		@Test
		@DisplayName("Should hold the watermark before the failed day when ordering is strict")
		void shouldHoldWatermarkWhenStrict() {
			DailyAdapter adapter = new DailyAdapter(true);
			adapter.terminalDays.add(LocalDate.of(2024, 1, 15));

			orchestrator().build().run(adapter, new CollectionRange(JAN_1, JAN_30, true));

			assertThat(watermarkStore.saved.get("fake/daily").cursor()).isEqualTo(midnight(LocalDate.of(2024, 1, 14)));
		}

		@Test
		@DisplayName("Should retry transient failures within a unit")
		void shouldRetryTransientFailures() {
			DailyAdapter adapter = new DailyAdapter(false);
			adapter.transientFailures.put(LocalDate.of(2024, 1, 2), new AtomicInteger(2));

			RunReport report = orchestrator().build()
				.run(adapter, new CollectionRange(JAN_1, LocalDate.of(2024, 1, 3), false));

			assertThat(report.manifest().skippedUnits()).isEmpty();
			assertThat(report.results().get(1).attempts()).hasSize(3);
			assertThat(sleeper.sleeps()).hasSize(2);
		}

	}

	@Nested
	@DisplayName("Total Failure Tests")
	class TotalFailureTest {

		@Test
		@DisplayName("Should fail before writing anything when the health check fails")
		void shouldFailOnHealthCheck() {
			DailyAdapter adapter = new DailyAdapter(false);
			adapter.healthy = false;

			assertThatThrownBy(() -> orchestrator().build().run(adapter, new CollectionRange(JAN_1, JAN_30, false)))
				.isInstanceOf(TotalSourceUnavailableException.class)
				.hasMessageContaining("Health check failed");

			assertThat(adapter.fetches).hasValue(0);
			assertThat(tempDir.resolve("raw")).doesNotExist();
		}

		@Test
		@DisplayName("Should raise and still write a FAILED manifest when every unit fails")
		void shouldFailWhenAllUnitsFail() {
			DailyAdapter adapter = new DailyAdapter(false);
			adapter.terminalDays.addAll(new DateRange(JAN_1, LocalDate.of(2024, 1, 3)).days());
			CollectionOrchestrator orchestrator = orchestrator().build();

			assertThatThrownBy(() -> orchestrator.run(adapter, new CollectionRange(JAN_1, LocalDate.of(2024, 1, 3), true)))
				.isInstanceOfSatisfying(TotalSourceUnavailableException.class, thrown -> {
					assertThat(thrown.getSourceId()).isEqualTo("fake");
					assertThat(thrown.getReport()).isNotNull();
					assertThat(thrown.getReport().manifest().state()).isEqualTo(RunState.FAILED);
					assertThat(thrown.getReport().manifest().skippedUnits()).hasSize(3);
				});
			assertThat(orchestrator.getState()).isEqualTo(RunState.FAILED);
			assertThat(tempDir.resolve("raw/fake/manifests")).isDirectory();
			assertThat(watermarkStore.saved).isEmpty();
		}

		@Test
		@DisplayName("Should write an IDLE manifest when there is nothing to collect")
		void shouldHandleEmptyEnumeration() {
			watermarkStore.save(new Watermark("fake", "daily", midnight(JAN_30), midnight(JAN_30)));
			DailyAdapter adapter = new DailyAdapter(false);

			RunReport report = orchestrator().build().run(adapter, new CollectionRange(JAN_1, JAN_30, true));

			assertThat(report.manifest().state()).isEqualTo(RunState.IDLE);
			assertThat(report.results()).isEmpty();
			assertThat(adapter.fetches).hasValue(0);
		}

	}

	@Nested
	@DisplayName("Incremental Tests")
	class IncrementalTest {

		@Test
		@DisplayName("Should resume the day after the stored watermark")
		void shouldResumeAfterWatermark() {
			watermarkStore.save(new Watermark("fake", "daily", midnight(LocalDate.of(2024, 1, 27)), clock.instant()));
			DailyAdapter adapter = new DailyAdapter(false);

			RunReport report = orchestrator().build().run(adapter, new CollectionRange(JAN_1, JAN_30, true));

			assertThat(report.manifest().succeededUnits()).containsExactly("fake:daily:2024-01-28",
					"fake:daily:2024-01-29", "fake:daily:2024-01-30");
		}

		@Test
		@DisplayName("Should ignore the watermark for a full run and never move it backwards")
		void shouldIgnoreWatermarkForFullRun() {
			watermarkStore.save(new Watermark("fake", "daily", midnight(JAN_30), clock.instant()));
			DailyAdapter adapter = new DailyAdapter(false);

			RunReport report = orchestrator().build()
				.run(adapter, new CollectionRange(JAN_1, LocalDate.of(2024, 1, 5), false));

			assertThat(report.manifest().succeededUnits()).hasSize(5);
			assertThat(watermarkStore.saved.get("fake/daily").cursor()).isEqualTo(midnight(JAN_30));
		}

	}

	@Nested
	@DisplayName("Deduplication Tests")
	class DeduplicationTest {

		@Test
		@DisplayName("Should export a document seen on two days only once")
		void shouldDeduplicateWithinRun() throws Exception {
			DocumentAdapter adapter = new DocumentAdapter();
			adapter.documents.put(JAN_1, List.of("https://example.org/a"));
			adapter.documents.put(LocalDate.of(2024, 1, 2), List.of("https://example.org/a", "https://example.org/b"));

			RunReport report = orchestrator().build()
				.run(adapter, new CollectionRange(JAN_1, LocalDate.of(2024, 1, 2), false));

			assertThat(report.recordCount()).isEqualTo(2);
			List<String> secondDay = Files.readAllLines(tempDir.resolve("raw/docs/docs_articles_20240102.jsonl"));
			assertThat(secondDay).hasSize(1);
			assertThat(secondDay.get(0)).contains("https://example.org/b");
		}

		@Test
		@DisplayName("Should not export documents from a previous run again")
		void shouldDeduplicateAcrossRuns() {
			DocumentAdapter adapter = new DocumentAdapter();
			adapter.documents.put(JAN_1, List.of("https://example.org/a", "https://example.org/b"));
			SeenSetLoader loader = new SeenSetLoader(ObjectMapperFactory.create());
			CollectionOrchestrator orchestrator = orchestrator()
				.seenSetSource(source -> loader.load(tempDir.resolve("raw"), source))
				.build();

			RunReport first = orchestrator.run(adapter, new CollectionRange(JAN_1, JAN_1, false));
			RunReport second = orchestrator.run(adapter, new CollectionRange(JAN_1, JAN_1, false));

			assertThat(first.recordCount()).isEqualTo(2);
			assertThat(second.recordCount()).isZero();
			assertThat(second.exportedFiles()).isEmpty();
			assertThat(second.manifest().succeededUnits()).containsExactly("docs:articles:2024-01-01");
		}

		@Test
		@DisplayName("Should report a repeated document with a different title as a conflict")
		void shouldReportConflictingDuplicates() {
			DocumentAdapter adapter = new DocumentAdapter();
			adapter.documents.put(JAN_1,
					List.of("https://example.org/a Rates held", "https://example.org/a Rates held steady"));

			RunReport report = orchestrator().build().run(adapter, new CollectionRange(JAN_1, JAN_1, false));

			assertThat(report.recordCount()).isEqualTo(1);
			assertThat(report.results()).singleElement()
				.satisfies(result -> assertThat(result.conflicts()).singleElement().satisfies(conflict -> {
					assertThat(conflict.fingerprint()).isEqualTo(Fingerprints.of("docs", "https://example.org/a"));
					assertThat(conflict.kept().field("title")).isEqualTo("Rates held");
					assertThat(conflict.discarded().field("title")).isEqualTo("Rates held steady");
				}));
			assertThat(report.conflicts()).hasSize(1);
		}

	}

	@Nested
	@DisplayName("Concurrency Tests")
	class ConcurrencyTest {

		@Test
		@DisplayName("Should export each document once when overlapping days run on four workers")
		void shouldExportEachDocumentOnceInParallel() {
			LocalDate jan20 = LocalDate.of(2024, 1, 20);
			ParallelDocumentAdapter adapter = new ParallelDocumentAdapter();
			Set<String> urls = new HashSet<>();
			for (LocalDate day = JAN_1; !day.isAfter(jan20); day = day.plusDays(1)) {
				int n = day.getDayOfMonth();
				List<String> documents = List.of("https://example.org/" + n % 12,
						"https://example.org/" + (n + 5) % 12, "https://example.org/" + (n * 7) % 12);
				adapter.documents.put(day, documents);
				urls.addAll(documents);
			}
			SeenSetLoader loader = new SeenSetLoader(ObjectMapperFactory.create());

			RunReport report = orchestrator().seenSetSource(source -> loader.load(tempDir.resolve("raw"), source))
				.build()
				.run(adapter, new CollectionRange(JAN_1, jan20, false));

			assertThat(urls).hasSize(12);
			assertThat(report.manifest().skippedUnits()).isEmpty();
			assertThat(report.recordCount()).isEqualTo(12);
			assertThat(loader.load(tempDir.resolve("raw"), "docs")).hasSize(12)
				.containsExactlyInAnyOrderElementsOf(urls.stream().map(url -> Fingerprints.of("docs", url)).toList());
			assertThat(watermarkStore.saved.get("docs/articles").cursor()).isEqualTo(midnight(jan20));
		}

	}

	@Nested
	@DisplayName("Cost Limit Tests")
	class CostLimitTest {

		@Test
		@DisplayName("Should skip units whose estimate exceeds the limit without querying")
		void shouldSkipExpensiveUnits() {
			MeteredDailyAdapter adapter = new MeteredDailyAdapter();
			adapter.estimates.put(LocalDate.of(2024, 1, 2), 6 * CostGuard.GIB);

			RunReport report = orchestrator().build()
				.run(adapter, new CollectionRange(JAN_1, LocalDate.of(2024, 1, 2), false));

			assertThat(report.manifest().skippedUnits()).singleElement()
				.extracting(ManifestEntry::errorType)
				.isEqualTo(ErrorType.COST_EXCEEDED);
			assertThat(adapter.fetches).hasValue(1);
		}

	}

	@Nested
	@DisplayName("Deadline Tests")
	class DeadlineTest {

		@Test
		@DisplayName("Should cancel units still running when the deadline elapses")
		void shouldCancelAtDeadline() {
			DailyAdapter adapter = new DailyAdapter(false);
			adapter.blockedDay = LocalDate.of(2024, 1, 2);

			RunReport report = orchestrator().deadline(Duration.ofMillis(300))
				.build()
				.run(adapter, new CollectionRange(JAN_1, LocalDate.of(2024, 1, 3), true));

			assertThat(report.manifest().succeededUnits()).containsExactly("fake:daily:2024-01-01");
			assertThat(report.manifest().skippedUnits()).extracting(ManifestEntry::errorType)
				.containsOnly(ErrorType.CANCELLED)
				.hasSize(2);
			assertThat(report.results().get(1).status()).isEqualTo(UnitStatus.CANCELLED);
			assertThat(tempDir.resolve("raw/fake/fake_daily_20240102.csv")).doesNotExist();
			assertThat(watermarkStore.saved.get("fake/daily").cursor()).isEqualTo(midnight(JAN_1));
		}

	}

	/**
	 * Daily tabular source with one row per day.
	 */
	static class DailyAdapter implements SourceAdapter {

		final Set<LocalDate> terminalDays = new HashSet<>();

		final Map<LocalDate, AtomicInteger> transientFailures = new ConcurrentHashMap<>();

		final AtomicInteger fetches = new AtomicInteger();

		final CountDownLatch release = new CountDownLatch(1);

		private final boolean strict;

		volatile boolean healthy = true;

		volatile LocalDate blockedDay;

		DailyAdapter(boolean strict) {
			this.strict = strict;
		}

		String source() {
			return "fake";
		}

		String dataset() {
			return "daily";
		}

		@Override
		public String sourceId() {
			return source();
		}

		@Override
		public List<String> datasets() {
			return List.of(dataset());
		}

		@Override
		public boolean supportsIncremental() {
			return true;
		}

		@Override
		public boolean strictWatermarkOrdering() {
			return strict;
		}

		@Override
		public ExportFormat exportFormat(String dataset) {
			return ExportFormat.CSV;
		}

		@Override
		public Stream<CollectionUnit> enumerateUnits(CollectionRange range, Map<String, Instant> watermarks) {
			LocalDate start = range.effectiveStart(watermarks.get(dataset()));
			if (start.isAfter(range.end())) {
				return Stream.empty();
			}
			return new DateRange(start, range.end()).days()
				.stream()
				.map(day -> CollectionUnit.of(source(), dataset(), day.toString(), DateRange.of(day)));
		}

		@Override
		public RawPayload fetch(CollectionUnit unit) {
			fetches.incrementAndGet();
			LocalDate day = unit.range().orElseThrow().start();
			if (day.equals(blockedDay)) {
				try {
					release.await(10, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new SourceRequestException("Interrupted", e);
				}
			}
			if (terminalDays.contains(day)) {
				throw new SourceRequestException("Not found", 404);
			}
			AtomicInteger remaining = transientFailures.get(day);
			if (remaining != null && remaining.getAndDecrement() > 0) {
				throw new SourceRequestException("Service unavailable", 503);
			}
			return new RawPayload(unit, day.toString(), Instant.parse("2024-02-01T06:00:00Z"));
		}

		@Override
		public List<NormalizedRecord> normalize(RawPayload payload) {
			LocalDate day = LocalDate.parse(payload.body());
			Map<String, Object> fields = new LinkedHashMap<>();
			fields.put("date", day.toString());
			fields.put("value", day.getDayOfMonth());
			return List.of(NormalizedRecord.row(source(), dataset(), payload.fetchedAt(), fields, midnight(day)));
		}

		@Override
		public boolean healthCheck() {
			return healthy;
		}

	}

	static class MeteredDailyAdapter extends DailyAdapter implements MeteredSourceAdapter {

		final Map<LocalDate, Long> estimates = new HashMap<>();

		MeteredDailyAdapter() {
			super(false);
		}

		@Override
		public CostEstimate estimateCost(CollectionUnit unit) {
			return new CostEstimate(estimates.getOrDefault(unit.range().orElseThrow().start(), 1024L));
		}

	}

	/**
	 * Document source where the same URL may show up on several days.
	 */
	static class DocumentAdapter extends DailyAdapter {

		final Map<LocalDate, List<String>> documents = new ConcurrentHashMap<>();

		DocumentAdapter() {
			super(false);
		}

		@Override
		String source() {
			return "docs";
		}

		@Override
		String dataset() {
			return "articles";
		}

		@Override
		public boolean supportsIncremental() {
			return false;
		}

		@Override
		public ExportFormat exportFormat(String dataset) {
			return ExportFormat.JSONL;
		}

		@Override
		public List<NormalizedRecord> normalize(RawPayload payload) {
			LocalDate day = LocalDate.parse(payload.body());
			return documents.getOrDefault(day, List.of()).stream().map(document -> {
				String[] parts = document.split(" ", 2);
				String url = parts[0];
				Map<String, Object> fields = new LinkedHashMap<>();
				fields.put("url", url);
				fields.put("title", parts.length > 1 ? parts[1] : "Article " + url);
				return new NormalizedRecord(source(), dataset(), payload.fetchedAt(), fields,
						Fingerprints.of(source(), url), null);
			}).toList();
		}

	}

	/**
	 * Document source fetched on four workers with jittered latency. Its watermark follows
	 * the end of each day.
	 */
	static class ParallelDocumentAdapter extends DocumentAdapter {

		@Override
		public boolean supportsIncremental() {
			return true;
		}

		@Override
		public int maxConcurrency() {
			return 4;
		}

		@Override
		public RawPayload fetch(CollectionUnit unit) {
			try {
				Thread.sleep(ThreadLocalRandom.current().nextInt(1, 15));
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new SourceRequestException("Interrupted", e);
			}
			return super.fetch(unit);
		}

	}

	static class InMemoryWatermarkStore implements WatermarkStore {

		final Map<String, Watermark> saved = new ConcurrentHashMap<>();

		@Override
		public Optional<Watermark> load(String source, String dataset) {
			return Optional.ofNullable(saved.get(source + "/" + dataset));
		}

		@Override
		public void save(Watermark watermark) {
			saved.put(watermark.source() + "/" + watermark.dataset(), watermark);
		}

	}

}
