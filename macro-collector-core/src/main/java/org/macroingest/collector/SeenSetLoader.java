package org.macroingest.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rebuilds a source's seen set from the JSON-Lines history in the raw store.
 *
 * <p>
 * Every {@code .jsonl} file directly under {@code {root}/{source}/} is scanned and the
 * {@code fingerprint} of each line collected. Lines that are not valid JSON or lack a
 * fingerprint are skipped with a warning.
 */
public class SeenSetLoader {

	private static final Logger logger = LoggerFactory.getLogger(SeenSetLoader.class);

	private final ObjectMapper objectMapper;

	public SeenSetLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public Set<String> load(Path root, String source) {
		Path sourceDir = root.resolve(source);
		Set<String> fingerprints = new LinkedHashSet<>();
		if (!Files.isDirectory(sourceDir)) {
			return fingerprints;
		}

		List<Path> files;
		try (Stream<Path> listing = Files.list(sourceDir)) {
			files = listing.filter(p -> p.getFileName().toString().endsWith(".jsonl"))
				.sorted()
				.collect(Collectors.toList());
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to list " + sourceDir, e);
		}

		for (Path file : files) {
			readFingerprints(file, fingerprints);
		}
		logger.info("Loaded {} fingerprint(s) for {} from {} file(s)", fingerprints.size(), source, files.size());
		return fingerprints;
	}

	private void readFingerprints(Path file, Set<String> into) {
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			int lineNumber = 0;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				if (line.isBlank()) {
					continue;
				}
				try {
					JsonNode node = objectMapper.readTree(line);
					JsonNode fingerprint = node.path("fingerprint");
					if (fingerprint.isTextual()) {
						into.add(fingerprint.asText());
					}
					else {
						logger.warn("{}:{} has no fingerprint", file.getFileName(), lineNumber);
					}
				}
				catch (IOException e) {
					logger.warn("Skipping malformed line {}:{}: {}", file.getFileName(), lineNumber, e.getMessage());
				}
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + file, e);
		}
	}

}
