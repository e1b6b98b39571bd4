package org.macroingest.collector.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.macroingest.collector.AbstractSourceAdapter;
import org.macroingest.collector.CollectionRange;
import org.macroingest.collector.CollectionUnit;
import org.macroingest.collector.DateRange;
import org.macroingest.collector.ExportFormat;
import org.macroingest.collector.JsonNodeUtils;
import org.macroingest.collector.NormalizedRecord;
import org.macroingest.collector.PayloadParseException;
import org.macroingest.collector.RawPayload;
import org.macroingest.collector.SourceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FRED (Federal Reserve Economic Data) adapter.
 *
 * <p>
 * One unit per series, fetched from the observations endpoint. Missing observations
 * (reported by FRED as {@code "."}) are dropped during normalization.
 */
public class FredAdapter extends AbstractSourceAdapter {

	private static final Logger logger = LoggerFactory.getLogger(FredAdapter.class);

	public static final String SOURCE_ID = "fred";

	public static final String DEFAULT_BASE_URL = "https://api.stlouisfed.org/fred";

	public static final String API_KEY_VARIABLE = "FRED_API_KEY";

	/**
	 * FRED allows 120 requests per minute.
	 */
	public static final Duration REQUEST_INTERVAL = Duration.ofMillis(500);

	/**
	 * Series collected by this adapter, keyed by dataset name.
	 */
	public enum Series {

		FINANCIAL_STRESS("financial_stress", "STLFSI4", "W", "Index"),

		FEDERAL_FUNDS_RATE("federal_funds_rate", "DFF", "D", "Percent"),

		CPI("cpi", "CPIAUCSL", "M", "Index 1982-1984=100"),

		UNEMPLOYMENT_RATE("unemployment_rate", "UNRATE", "M", "Percent");

		private final String datasetName;

		private final String seriesId;

		private final String frequency;

		private final String units;

		Series(String datasetName, String seriesId, String frequency, String units) {
			this.datasetName = datasetName;
			this.seriesId = seriesId;
			this.frequency = frequency;
			this.units = units;
		}

		public String datasetName() {
			return datasetName;
		}

		public String seriesId() {
			return seriesId;
		}

		public String frequency() {
			return frequency;
		}

		public String units() {
			return units;
		}

		static Optional<Series> byDataset(String name) {
			return Arrays.stream(values()).filter(s -> s.datasetName.equals(name)).findFirst();
		}

	}

	private final ObjectMapper objectMapper;

	private final String apiKey;

	private final String baseUrl;

	public FredAdapter(SourceContext context, ObjectMapper objectMapper, String apiKey) {
		this(context, objectMapper, apiKey, DEFAULT_BASE_URL);
	}

	public FredAdapter(SourceContext context, ObjectMapper objectMapper, String apiKey, String baseUrl) {
		super(context);
		if (apiKey.isBlank()) {
			throw new IllegalArgumentException(API_KEY_VARIABLE + " must not be blank");
		}
		this.objectMapper = objectMapper;
		this.apiKey = apiKey;
		this.baseUrl = baseUrl;
	}

	@Override
	public String sourceId() {
		return SOURCE_ID;
	}

	@Override
	public List<String> datasets() {
		return Arrays.stream(Series.values()).map(Series::datasetName).collect(Collectors.toList());
	}

	@Override
	public boolean supportsIncremental() {
		return true;
	}

	@Override
	public ExportFormat exportFormat(String dataset) {
		return ExportFormat.CSV;
	}

	@Override
	public Stream<CollectionUnit> enumerateUnits(CollectionRange range, Map<String, Instant> watermarks) {
		return Arrays.stream(Series.values()).flatMap(series -> {
			LocalDate start = range.effectiveStart(watermarks.get(series.datasetName()));
			if (start.isAfter(range.end())) {
				logger.debug("{} is up to date", series.seriesId());
				return Stream.empty();
			}
			return Stream.of(CollectionUnit.of(SOURCE_ID, series.datasetName(), series.seriesId(),
					new DateRange(start, range.end())));
		});
	}

	@Override
	public RawPayload fetch(CollectionUnit unit) {
		Series series = series(unit);
		DateRange range = unit.range().orElseThrow();
		String url = baseUrl + "/series/observations?series_id=" + series.seriesId() + "&api_key="
				+ URLEncoder.encode(apiKey, StandardCharsets.UTF_8) + "&file_type=json&observation_start="
				+ range.start() + "&observation_end=" + range.end();
		return new RawPayload(unit, context.client().get(url), now());
	}

	@Override
	public List<NormalizedRecord> normalize(RawPayload payload) {
		Series series = series(payload.unit());
		JsonNode root;
		try {
			root = objectMapper.readTree(payload.body());
		}
		catch (JsonProcessingException e) {
			throw new PayloadParseException("Malformed FRED response for " + series.seriesId(), e);
		}
		if (root == null || !root.has("observations")) {
			String message = root != null ? JsonNodeUtils.getString(root, "error_message").orElse("") : "";
			throw new PayloadParseException(
					"FRED response for " + series.seriesId() + " has no observations " + message);
		}

		List<Map<String, String>> rows = new ArrayList<>();
		for (JsonNode observation : JsonNodeUtils.getArray(root, "observations")) {
			Map<String, String> row = new LinkedHashMap<>();
			row.put("date", JsonNodeUtils.getString(observation, "date").orElse(""));
			row.put("value", JsonNodeUtils.getString(observation, "value").orElse(""));
			row.put("series_id", series.seriesId());
			row.put("frequency", series.frequency());
			row.put("units", series.units());
			row.put("realtime_start", JsonNodeUtils.getString(observation, "realtime_start").orElse(""));
			row.put("realtime_end", JsonNodeUtils.getString(observation, "realtime_end").orElse(""));
			rows.add(row);
		}
		List<NormalizedRecord> records = normalizeRows(payload, rows, List.of("value"), "date");
		logger.info("Fetched {} observation(s) for {}", records.size(), series.seriesId());
		return records;
	}

	@Override
	public boolean healthCheck() {
		return probe(baseUrl + "/series?series_id=" + Series.FEDERAL_FUNDS_RATE.seriesId() + "&api_key="
				+ URLEncoder.encode(apiKey, StandardCharsets.UTF_8) + "&file_type=json");
	}

	private static Series series(CollectionUnit unit) {
		return Series.byDataset(unit.dataset())
			.orElseThrow(() -> new IllegalArgumentException("Unknown FRED series: " + unit.dataset()));
	}

}
