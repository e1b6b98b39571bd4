package org.macroingest.collector.sources;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.macroingest.collector.PayloadParseException;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a CSV body with a header line into rows keyed by column name, keeping the column
 * order of the source.
 */
final class CsvRows {

	private CsvRows() {
	}

	static List<Map<String, String>> parse(String body) {
		if (body.isBlank()) {
			return List.of();
		}
		CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
		try (CSVParser parser = CSVParser.parse(new StringReader(body), format)) {
			List<String> header = parser.getHeaderNames();
			List<Map<String, String>> rows = new ArrayList<>();
			for (CSVRecord record : parser) {
				Map<String, String> row = new LinkedHashMap<>();
				for (String column : header) {
					row.put(column, record.isSet(column) ? record.get(column) : "");
				}
				rows.add(row);
			}
			return rows;
		}
		catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
			throw new PayloadParseException("Malformed CSV payload: " + e.getMessage(), e);
		}
	}

}
