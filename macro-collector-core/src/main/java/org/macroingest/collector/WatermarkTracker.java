package org.macroingest.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Monotonic incremental-collection cursors per (source, dataset).
 *
 * <p>
 * Watermarks are loaded lazily from the {@link WatermarkStore} and only move forward:
 * {@link #advance(String, String, Instant)} with an older or equal cursor is a no-op.
 * Changes stay in memory until {@link #flush()}, which the orchestrator calls at the end of
 * a run. All access is serialized by a single lock.
 */
public class WatermarkTracker {

	private static final Logger logger = LoggerFactory.getLogger(WatermarkTracker.class);

	private final WatermarkStore store;

	private final Clock clock;

	private final ReentrantLock lock = new ReentrantLock();

	private final Map<String, Optional<Watermark>> cache = new HashMap<>();

	private final Set<String> dirty = new LinkedHashSet<>();

	public WatermarkTracker(WatermarkStore store, Clock clock) {
		this.store = store;
		this.clock = clock;
	}

	public WatermarkTracker(WatermarkStore store) {
		this(store, Clock.systemUTC());
	}

	/**
	 * Current cursor for a dataset.
	 * @param source source identifier
	 * @param dataset dataset name
	 * @return the cursor, or empty if nothing was collected yet
	 */
	public Optional<Instant> get(String source, String dataset) {
		lock.lock();
		try {
			return loaded(source, dataset).map(Watermark::cursor);
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Move the cursor forward.
	 * @param source source identifier
	 * @param dataset dataset name
	 * @param cursor the new cursor
	 * @return true if the watermark moved, false if {@code cursor} was not newer
	 */
	public boolean advance(String source, String dataset, Instant cursor) {
		lock.lock();
		try {
			Optional<Watermark> current = loaded(source, dataset);
			if (current.isPresent() && !cursor.isAfter(current.get().cursor())) {
				logger.debug("Ignoring watermark {}/{} = {}: not after {}", source, dataset, cursor,
						current.get().cursor());
				return false;
			}
			String key = key(source, dataset);
			cache.put(key, Optional.of(new Watermark(source, dataset, cursor, clock.instant())));
			dirty.add(key);
			logger.info("Watermark {}/{} advanced to {}", source, dataset, cursor);
			return true;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Persist every watermark changed since the last flush.
	 * @return number of watermarks written
	 */
	public int flush() {
		lock.lock();
		try {
			List<String> written = new ArrayList<>();
			for (String key : dirty) {
				Optional<Watermark> watermark = cache.get(key);
				if (watermark != null && watermark.isPresent()) {
					store.save(watermark.get());
					written.add(key);
				}
			}
			dirty.removeAll(written);
			if (!written.isEmpty()) {
				logger.info("Flushed {} watermark(s)", written.size());
			}
			return written.size();
		}
		finally {
			lock.unlock();
		}
	}

	private Optional<Watermark> loaded(String source, String dataset) {
		return cache.computeIfAbsent(key(source, dataset), k -> store.load(source, dataset));
	}

	private static String key(String source, String dataset) {
		return source + "/" + dataset;
	}

}
