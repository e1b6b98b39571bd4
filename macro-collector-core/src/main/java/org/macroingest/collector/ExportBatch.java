package org.macroingest.collector;

import java.time.LocalDate;
import java.util.List;

/**
 * Records of one unit destined for one raw store file.
 *
 * @param source source tag
 * @param dataset dataset name
 * @param collectionDate date used in the file name
 * @param format file format
 * @param records the records, in export order
 */
public record ExportBatch(String source, String dataset, LocalDate collectionDate, ExportFormat format,
		List<NormalizedRecord> records) {

	public ExportBatch {
		records = List.copyOf(records);
	}

}
