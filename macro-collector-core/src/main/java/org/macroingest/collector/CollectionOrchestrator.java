package org.macroingest.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives one collection run for one source.
 *
 * <p>
 * A run:
 * <ol>
 * <li>runs the adapter's health check; failure raises
 * {@link TotalSourceUnavailableException} before anything is written</li>
 * <li>enumerates units, incrementally only when requested and supported</li>
 * <li>processes units on a pool of {@link SourceAdapter#maxConcurrency()} workers:
 * cost check for metered sources, fetch through the {@link ResilienceEngine}, normalize,
 * deduplicate and export all-or-nothing</li>
 * <li>advances watermarks from the successful units, flushes them and writes the
 * manifest</li>
 * </ol>
 * Unit failures are recorded in the manifest and never stop the run. A run in which
 * units were enumerated but none succeeded ends {@link RunState#FAILED} and raises
 * {@link TotalSourceUnavailableException}.
 *
 * <p>
 * When a deadline is configured, units still running when it elapses are interrupted at
 * their next suspension point and recorded as {@link ErrorType#CANCELLED}.
 */
public class CollectionOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(CollectionOrchestrator.class);

	private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

	private final ResilienceEngine engine;

	private final RetryPolicy retryPolicy;

	private final WatermarkTracker watermarks;

	private final ExportSink exportSink;

	private final Function<String, Set<String>> seenSetSource;

	private final Clock clock;

	@Nullable
	private final Duration deadline;

	private volatile RunState state = RunState.IDLE;

	private CollectionOrchestrator(Builder builder) {
		this.engine = builder.engine;
		this.retryPolicy = builder.retryPolicy;
		this.watermarks = builder.watermarks;
		this.exportSink = builder.exportSink;
		this.seenSetSource = builder.seenSetSource;
		this.clock = builder.clock;
		this.deadline = builder.deadline;
	}

	/**
	 * Create a new builder for CollectionOrchestrator.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	public RunState getState() {
		return state;
	}

	/**
	 * Collect a range from one source.
	 * @param adapter the source
	 * @param range the requested range
	 * @return the run report; may contain skipped units
	 * @throws TotalSourceUnavailableException if the health check fails or every unit
	 * fails
	 */
	public RunReport run(SourceAdapter adapter, CollectionRange range) {
		String source = adapter.sourceId();
		String runId = UUID.randomUUID().toString();
		Instant startedAt = clock.instant();

		logger.info("Starting {} run {} for {}..{}{}", source, runId, range.start(), range.end(),
				range.incremental() ? " (incremental)" : "");

		if (!adapter.healthCheck()) {
			state = RunState.FAILED;
			throw new TotalSourceUnavailableException(source, "Health check failed for source '" + source + "'");
		}

		state = RunState.ENUMERATING;
		List<CollectionUnit> units = enumerate(adapter, range);
		logger.info("Enumerated {} unit(s) for {}", units.size(), source);

		if (units.isEmpty()) {
			state = RunState.IDLE;
			RunManifest manifest = new RunManifest(runId, source, startedAt, clock.instant(), RunState.IDLE,
					List.of(), List.of());
			exportSink.writeManifest(manifest);
			logger.info("Nothing to collect for {}", source);
			return new RunReport(manifest, List.of(), List.of());
		}

		state = RunState.FETCHING_UNIT;
		Deduplicator deduplicator = new Deduplicator(seenSetSource.apply(source));
		LocalDate runDate = LocalDate.ofInstant(startedAt, ZoneOffset.UTC);
		List<CollectionResult> results = processAll(adapter, units, deduplicator, runDate);

		advanceWatermarks(adapter, units, results);
		watermarks.flush();

		List<String> succeeded = new ArrayList<>();
		List<ManifestEntry> skipped = new ArrayList<>();
		List<ExportedFile> files = new ArrayList<>();
		for (CollectionResult result : results) {
			if (result.isSuccess()) {
				succeeded.add(result.unit().key());
				files.addAll(result.exportedFiles());
			}
			else {
				CollectionError error = result.error();
				skipped.add(new ManifestEntry(result.unit().key(), error.type(), error.message()));
			}
		}

		RunState finalState = succeeded.isEmpty() ? RunState.FAILED : RunState.IDLE;
		RunManifest manifest = new RunManifest(runId, source, startedAt, clock.instant(), finalState, succeeded,
				skipped);
		exportSink.writeManifest(manifest);
		RunReport report = new RunReport(manifest, results, files);
		state = finalState;

		logger.info("Run {} for {} finished: {} unit(s) succeeded, {} skipped, {} record(s) in {} file(s)", runId,
				source, succeeded.size(), skipped.size(), report.recordCount(), files.size());

		if (finalState == RunState.FAILED) {
			throw new TotalSourceUnavailableException(source,
					"All " + units.size() + " unit(s) of source '" + source + "' failed", report);
		}
		return report;
	}

	private List<CollectionUnit> enumerate(SourceAdapter adapter, CollectionRange range) {
		String source = adapter.sourceId();
		boolean incremental = range.incremental() && adapter.supportsIncremental();
		if (range.incremental() && !incremental) {
			logger.info("{} does not support incremental collection, collecting the full range", source);
		}

		Map<String, Instant> cursors = new LinkedHashMap<>();
		if (incremental) {
			for (String dataset : adapter.datasets()) {
				if (adapter.supportsIncremental(dataset)) {
					watermarks.get(source, dataset).ifPresent(cursor -> cursors.put(dataset, cursor));
				}
			}
		}

		CollectionRange effective = incremental ? range : range.full();
		return adapter.enumerateUnits(effective, cursors).collect(Collectors.toList());
	}

	private List<CollectionResult> processAll(SourceAdapter adapter, List<CollectionUnit> units,
			Deduplicator deduplicator, LocalDate runDate) {
		int workers = Math.max(1, Math.min(adapter.maxConcurrency(), units.size()));
		ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory(adapter.sourceId()));

		Map<UnitTask, Future<CollectionResult>> futures = new LinkedHashMap<>();
		for (CollectionUnit unit : units) {
			UnitTask task = new UnitTask(adapter, unit, deduplicator, runDate);
			futures.put(task, pool.submit(task::process));
		}
		pool.shutdown();

		long deadlineNanos = deadline != null ? System.nanoTime() + deadline.toNanos() : Long.MAX_VALUE;
		boolean expired = false;
		List<CollectionResult> results = new ArrayList<>(units.size());

		for (Map.Entry<UnitTask, Future<CollectionResult>> entry : futures.entrySet()) {
			UnitTask task = entry.getKey();
			Future<CollectionResult> future = entry.getValue();
			if (!expired) {
				try {
					results.add(awaitResult(task, future, deadlineNanos));
					continue;
				}
				catch (TimeoutException e) {
					expired = true;
					logger.warn("Run deadline of {} elapsed, cancelling remaining units", deadline);
				}
			}
			results.add(cancelOrAwait(task, future));
		}

		if (expired) {
			pool.shutdownNow();
		}
		try {
			if (!pool.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
				logger.warn("Workers of {} did not stop within {}", adapter.sourceId(), SHUTDOWN_GRACE);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		return results;
	}

	private CollectionResult awaitResult(UnitTask task, Future<CollectionResult> future, long deadlineNanos)
			throws TimeoutException {
		try {
			if (deadlineNanos == Long.MAX_VALUE) {
				return future.get();
			}
			return future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TimeoutException("Interrupted while waiting for units");
		}
		catch (ExecutionException e) {
			return unexpectedFailure(task, e);
		}
	}

	/**
	 * Cancel a unit that has not started exporting; a unit already exporting is allowed to
	 * finish so that its files and its result agree.
	 */
	private CollectionResult cancelOrAwait(UnitTask task, Future<CollectionResult> future) {
		if (future.isDone() && !future.isCancelled()) {
			return getCompleted(task, future);
		}
		if (task.cancel()) {
			future.cancel(true);
			return CollectionResult.failed(task.unit, CollectionError.cancelled(task.unit.key()), List.of());
		}
		return getCompleted(task, future);
	}

	private CollectionResult getCompleted(UnitTask task, Future<CollectionResult> future) {
		try {
			return future.get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return CollectionResult.failed(task.unit, CollectionError.cancelled(task.unit.key()), List.of());
		}
		catch (CancellationException e) {
			return CollectionResult.failed(task.unit, CollectionError.cancelled(task.unit.key()), List.of());
		}
		catch (ExecutionException e) {
			return unexpectedFailure(task, e);
		}
	}

	private CollectionResult unexpectedFailure(UnitTask task, ExecutionException e) {
		Throwable cause = e.getCause() != null ? e.getCause() : e;
		logger.error("Unit {} failed unexpectedly", task.unit.key(), cause);
		return CollectionResult.failed(task.unit,
				CollectionError.of(ErrorType.TERMINAL_REQUEST, "Unexpected failure: " + cause, cause), List.of());
	}

	private void advanceWatermarks(SourceAdapter adapter, List<CollectionUnit> units,
			List<CollectionResult> results) {
		if (!adapter.supportsIncremental()) {
			return;
		}
		String source = adapter.sourceId();
		for (String dataset : adapter.datasets()) {
			if (!adapter.supportsIncremental(dataset)) {
				continue;
			}
			Instant target = null;
			for (int i = 0; i < units.size(); i++) {
				if (!units.get(i).dataset().equals(dataset)) {
					continue;
				}
				CollectionResult result = results.get(i);
				if (!result.isSuccess()) {
					if (adapter.strictWatermarkOrdering()) {
						logger.info("{}/{}: watermark held before failed unit {}", source, dataset,
								result.unit().key());
						break;
					}
					continue;
				}
				Instant cursor = result.cursor();
				if (cursor != null && (target == null || cursor.isAfter(target))) {
					target = cursor;
				}
			}
			if (target != null) {
				watermarks.advance(source, dataset, target);
			}
		}
	}

	private static ThreadFactory threadFactory(String source) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "collector-" + source + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	/**
	 * One unit moving through fetch, normalize, deduplicate and export. Cancellation and
	 * the start of the export are mutually exclusive.
	 */
	private final class UnitTask {

		private final SourceAdapter adapter;

		private final CollectionUnit unit;

		private final Deduplicator deduplicator;

		private final LocalDate runDate;

		private boolean cancelled;

		private boolean exporting;

		private UnitTask(SourceAdapter adapter, CollectionUnit unit, Deduplicator deduplicator, LocalDate runDate) {
			this.adapter = adapter;
			this.unit = unit;
			this.deduplicator = deduplicator;
			this.runDate = runDate;
		}

		synchronized boolean cancel() {
			if (exporting) {
				return false;
			}
			cancelled = true;
			return true;
		}

		private synchronized boolean beginExport() {
			if (cancelled || Thread.currentThread().isInterrupted()) {
				return false;
			}
			exporting = true;
			return true;
		}

		CollectionResult process() {
			String source = adapter.sourceId();
			String key = unit.key();
			List<FetchAttempt> attempts = new ArrayList<>();
			logger.debug("{}: {}", key, RunState.FETCHING_UNIT);

			if (adapter instanceof MeteredSourceAdapter) {
				MeteredSourceAdapter metered = (MeteredSourceAdapter) adapter;
				Result<CostEstimate> estimate = engine.execute(source, "dry run " + key,
						() -> metered.estimateCost(unit), retryPolicy);
				attempts.addAll(estimate.attempts());
				if (estimate.isFailure()) {
					return failed(estimate.errorOrThrow(), attempts);
				}
				Result<Void> verdict = CostGuard.guard(estimate.getOrThrow(), metered.costLimitBytes());
				if (verdict.isFailure()) {
					return failed(verdict.errorOrThrow(), attempts);
				}
			}

			Result<RawPayload> fetched = engine.execute(source, "fetch " + key, () -> adapter.fetch(unit),
					retryPolicy);
			attempts.addAll(fetched.attempts());
			if (fetched.isFailure()) {
				return failed(fetched.errorOrThrow(), attempts);
			}

			logger.debug("{}: {}", key, RunState.NORMALIZING);
			List<NormalizedRecord> records;
			try {
				records = adapter.normalize(fetched.getOrThrow());
			}
			catch (RuntimeException e) {
				ErrorType type = e instanceof PayloadParseException ? ErrorType.PARSE_ERROR
						: ErrorClassifier.terminalTypeOf(e);
				return failed(CollectionError.of(type, "Normalizing " + key + " failed: " + e.getMessage(), e),
						attempts);
			}

			logger.debug("{}: {}", key, RunState.DEDUPLICATING);
			DeduplicationOutcome outcome = deduplicator.claim(key, records);

			if (!beginExport()) {
				deduplicator.release(key);
				return failed(CollectionError.cancelled(key), attempts);
			}
			logger.debug("{}: {}", key, RunState.EXPORTING);
			List<ExportedFile> files;
			try {
				files = exportSink.write(batchesFor(outcome.kept()));
			}
			catch (RuntimeException e) {
				deduplicator.release(key);
				return failed(CollectionError.of(ErrorType.TERMINAL_REQUEST,
						"Export of " + key + " failed: " + e.getMessage(), e), attempts);
			}
			deduplicator.commit(key);

			return CollectionResult.succeeded(unit, outcome.kept(), files, adapter.cursorFor(unit, records),
					attempts, outcome.conflicts());
		}

		/**
		 * One batch per dataset present in the records, in first-seen order. Feed-style
		 * units produce records for several datasets.
		 */
		private List<ExportBatch> batchesFor(List<NormalizedRecord> records) {
			Map<String, List<NormalizedRecord>> byDataset = new LinkedHashMap<>();
			for (NormalizedRecord record : records) {
				byDataset.computeIfAbsent(record.dataset(), d -> new ArrayList<>()).add(record);
			}
			LocalDate collectionDate = unit.collectionDate(runDate);
			List<ExportBatch> batches = new ArrayList<>();
			byDataset.forEach((dataset, rows) -> batches.add(new ExportBatch(adapter.sourceId(), dataset,
					collectionDate, adapter.exportFormat(dataset), rows)));
			return batches;
		}

		private CollectionResult failed(CollectionError error, List<FetchAttempt> attempts) {
			logger.warn("Skipping unit {}: {}", unit.key(), error);
			return CollectionResult.failed(unit, error, attempts);
		}

	}

	/**
	 * Builder for {@link CollectionOrchestrator}.
	 */
	public static class Builder {

		private ResilienceEngine engine;

		private RetryPolicy retryPolicy = RetryPolicy.defaults();

		private WatermarkTracker watermarks;

		private ExportSink exportSink;

		private Function<String, Set<String>> seenSetSource = source -> Set.of();

		private Clock clock = Clock.systemUTC();

		@Nullable
		private Duration deadline;

		private Builder() {
		}

		public Builder engine(ResilienceEngine engine) {
			this.engine = engine;
			return this;
		}

		public Builder retryPolicy(RetryPolicy retryPolicy) {
			this.retryPolicy = retryPolicy;
			return this;
		}

		public Builder watermarks(WatermarkTracker watermarks) {
			this.watermarks = watermarks;
			return this;
		}

		public Builder exportSink(ExportSink exportSink) {
			this.exportSink = exportSink;
			return this;
		}

		/**
		 * Set where the fingerprints already exported for a source come from.
		 * @param seenSetSource function from source id to its seen set (default: empty)
		 * @return this builder
		 */
		public Builder seenSetSource(Function<String, Set<String>> seenSetSource) {
			this.seenSetSource = seenSetSource;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Set the run deadline.
		 * @param deadline maximum run duration ({@code null} for none)
		 * @return this builder
		 */
		public Builder deadline(@Nullable Duration deadline) {
			this.deadline = deadline;
			return this;
		}

		public CollectionOrchestrator build() {
			if (engine == null || watermarks == null || exportSink == null) {
				throw new IllegalStateException("engine, watermarks and exportSink are required");
			}
			return new CollectionOrchestrator(this);
		}

	}

}
