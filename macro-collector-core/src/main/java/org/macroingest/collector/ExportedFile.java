package org.macroingest.collector;

import java.nio.file.Path;

/**
 * A file written to the raw store.
 *
 * @param path final location
 * @param source source tag
 * @param dataset dataset name
 * @param format file format
 * @param recordCount number of records in the file
 */
public record ExportedFile(Path path, String source, String dataset, ExportFormat format, int recordCount) {
}
