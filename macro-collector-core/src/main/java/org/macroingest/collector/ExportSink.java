package org.macroingest.collector;

import java.nio.file.Path;
import java.util.List;

/**
 * Append-only raw store.
 */
public interface ExportSink {

	/**
	 * Write batches all-or-nothing: either every non-empty batch ends up in its own new
	 * file, or nothing is left behind.
	 * @param batches batches to write
	 * @return the files written
	 */
	List<ExportedFile> write(List<ExportBatch> batches);

	default List<ExportedFile> write(ExportBatch batch) {
		return write(List.of(batch));
	}

	/**
	 * Persist the manifest of a run.
	 * @param manifest the manifest
	 * @return where it was written
	 */
	Path writeManifest(RunManifest manifest);

}
