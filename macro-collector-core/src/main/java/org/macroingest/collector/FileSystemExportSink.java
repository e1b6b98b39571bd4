package org.macroingest.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * File system raw store.
 *
 * <p>
 * Files are named {@code {root}/{source}/{source}_{dataset}_{yyyyMMdd}.{csv|jsonl}}. An
 * existing file is never overwritten: the next free name with a {@code _2}, {@code _3},
 * ... suffix is used instead. Every file is written to a temporary file in the target
 * directory and then atomically renamed.
 *
 * <p>
 * CSV files have a header made of the union of record columns in first-seen order;
 * nested values are written as JSON. JSON-Lines files hold one object per line.
 */
public class FileSystemExportSink implements ExportSink {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemExportSink.class);

	private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

	private final Path root;

	private final ObjectMapper objectMapper;

	private final Object renameLock = new Object();

	public FileSystemExportSink(Path root, ObjectMapper objectMapper) {
		this.root = root;
		this.objectMapper = objectMapper;
	}

	public Path getRoot() {
		return root;
	}

	@Override
	public List<ExportedFile> write(List<ExportBatch> batches) {
		List<Path> temps = new ArrayList<>();
		List<ExportedFile> written = new ArrayList<>();
		try {
			List<Path> staged = new ArrayList<>();
			List<ExportBatch> nonEmpty = new ArrayList<>();
			for (ExportBatch batch : batches) {
				if (batch.records().isEmpty()) {
					logger.debug("Nothing to export for {}/{}", batch.source(), batch.dataset());
					continue;
				}
				Path dir = root.resolve(batch.source());
				Files.createDirectories(dir);
				Path temp = Files.createTempFile(dir, "." + batch.source() + "_", ".tmp");
				temps.add(temp);
				writeRecords(temp, batch);
				staged.add(temp);
				nonEmpty.add(batch);
			}

			synchronized (renameLock) {
				for (int i = 0; i < staged.size(); i++) {
					ExportBatch batch = nonEmpty.get(i);
					Path target = nextFreeName(batch);
					Files.move(staged.get(i), target, StandardCopyOption.ATOMIC_MOVE);
					temps.remove(staged.get(i));
					written.add(new ExportedFile(target, batch.source(), batch.dataset(), batch.format(),
							batch.records().size()));
					logger.info("Exported {} record(s) to {}", batch.records().size(), target);
				}
			}
			return written;
		}
		catch (IOException | RuntimeException e) {
			rollback(temps, written, e);
			if (e instanceof IOException) {
				throw new UncheckedIOException("Export failed, batch rolled back", (IOException) e);
			}
			throw (RuntimeException) e;
		}
	}

	@Override
	public Path writeManifest(RunManifest manifest) {
		Path dir = root.resolve(manifest.source()).resolve("manifests");
		Path target = dir.resolve(manifest.source() + "_run_" + manifest.runId() + ".json");
		Path temp = dir.resolve(target.getFileName() + ".tmp");
		try {
			Files.createDirectories(dir);
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), manifest);
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
			logger.info("Wrote run manifest {}", target);
			return target;
		}
		catch (IOException e) {
			try {
				Files.deleteIfExists(temp);
			}
			catch (IOException cleanup) {
				e.addSuppressed(cleanup);
			}
			throw new UncheckedIOException("Failed to write manifest " + target, e);
		}
	}

	Path nextFreeName(ExportBatch batch) {
		Path dir = root.resolve(batch.source());
		String base = batch.source() + "_" + batch.dataset() + "_" + FILE_DATE.format(batch.collectionDate());
		String extension = "." + batch.format().extension();
		Path candidate = dir.resolve(base + extension);
		int suffix = 2;
		while (Files.exists(candidate)) {
			candidate = dir.resolve(base + "_" + suffix + extension);
			suffix++;
		}
		return candidate;
	}

	private void writeRecords(Path file, ExportBatch batch) throws IOException {
		switch (batch.format()) {
			case CSV -> writeCsv(file, batch.records());
			case JSONL -> writeJsonLines(file, batch.records());
		}
	}

	private void writeCsv(Path file, List<NormalizedRecord> records) throws IOException {
		List<Map<String, @Nullable Object>> rows = new ArrayList<>(records.size());
		Set<String> header = new LinkedHashSet<>();
		for (NormalizedRecord record : records) {
			Map<String, @Nullable Object> row = record.toBronze();
			header.addAll(row.keySet());
			rows.add(row);
		}

		CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(header.toArray(new String[0])).build();
		try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
				CSVPrinter printer = new CSVPrinter(writer, format)) {
			for (Map<String, @Nullable Object> row : rows) {
				List<String> values = new ArrayList<>(header.size());
				for (String column : header) {
					values.add(cell(row.get(column)));
				}
				printer.printRecord(values);
			}
		}
	}

	private String cell(@Nullable Object value) throws JsonProcessingException {
		if (value == null) {
			return "";
		}
		if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
			return objectMapper.writeValueAsString(value);
		}
		if (value instanceof BigDecimal) {
			return ((BigDecimal) value).toPlainString();
		}
		return value.toString();
	}

	private void writeJsonLines(Path file, List<NormalizedRecord> records) throws IOException {
		try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			for (NormalizedRecord record : records) {
				writer.write(objectMapper.writeValueAsString(record.toBronze()));
				writer.write('\n');
			}
		}
	}

	private void rollback(List<Path> temps, List<ExportedFile> written, Exception cause) {
		for (Path temp : temps) {
			deleteQuietly(temp, cause);
		}
		for (ExportedFile file : written) {
			deleteQuietly(file.path(), cause);
		}
		logger.error("Export failed, removed {} temporary and {} renamed file(s): {}", temps.size(), written.size(),
				cause.getMessage());
	}

	private static void deleteQuietly(Path path, Exception cause) {
		try {
			Files.deleteIfExists(path);
		}
		catch (IOException e) {
			cause.addSuppressed(e);
		}
	}

}
