package org.macroingest.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File system implementation of {@link WatermarkStore}.
 *
 * <p>
 * Each watermark lives in {@code {stateDir}/{source}/{dataset}.watermark.json}. Saves go
 * through a temporary file in the same directory followed by an atomic move, so a crash
 * leaves either the old or the new watermark, never a truncated one.
 */
public class FileSystemWatermarkStore implements WatermarkStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemWatermarkStore.class);

	private final Path stateDir;

	private final ObjectMapper objectMapper;

	public FileSystemWatermarkStore(Path stateDir, ObjectMapper objectMapper) {
		this.stateDir = stateDir;
		this.objectMapper = objectMapper;
	}

	@Override
	public Optional<Watermark> load(String source, String dataset) {
		Path file = fileFor(source, dataset);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			return Optional.of(objectMapper.readValue(file.toFile(), Watermark.class));
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read watermark " + file, e);
		}
	}

	@Override
	public void save(Watermark watermark) {
		Path file = fileFor(watermark.source(), watermark.dataset());
		Path temp = file.resolveSibling(file.getFileName() + ".tmp");
		try {
			Files.createDirectories(file.getParent());
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), watermark);
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			logger.debug("Saved watermark {}/{} = {}", watermark.source(), watermark.dataset(), watermark.cursor());
		}
		catch (IOException e) {
			try {
				Files.deleteIfExists(temp);
			}
			catch (IOException cleanup) {
				e.addSuppressed(cleanup);
			}
			throw new UncheckedIOException("Failed to save watermark " + file, e);
		}
	}

	Path fileFor(String source, String dataset) {
		return stateDir.resolve(source).resolve(dataset + ".watermark.json");
	}

}
