package org.macroingest.collector;

import java.util.Optional;

/**
 * Persistence for {@link Watermark}s, one entry per (source, dataset).
 *
 * <p>
 * Abstracts storage so the tracker can be tested in memory and backed by other stores.
 */
public interface WatermarkStore {

	/**
	 * Load the persisted watermark.
	 * @param source source identifier
	 * @param dataset dataset name
	 * @return the watermark, or empty if none was saved yet
	 */
	Optional<Watermark> load(String source, String dataset);

	/**
	 * Persist a watermark, replacing the previous entry atomically.
	 * @param watermark the watermark to save
	 */
	void save(Watermark watermark);

}
