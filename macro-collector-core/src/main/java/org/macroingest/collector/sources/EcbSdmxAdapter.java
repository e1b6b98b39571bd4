package org.macroingest.collector.sources;

import org.jspecify.annotations.Nullable;
import org.macroingest.collector.AbstractSourceAdapter;
import org.macroingest.collector.CollectionRange;
import org.macroingest.collector.CollectionUnit;
import org.macroingest.collector.DateRange;
import org.macroingest.collector.ExportFormat;
import org.macroingest.collector.NormalizedRecord;
import org.macroingest.collector.RawPayload;
import org.macroingest.collector.SourceContext;
import org.macroingest.collector.SourceRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ECB Data Portal (SDMX 2.1 REST) adapter for key policy rates and EUR reference exchange
 * rates.
 *
 * <p>
 * Data is requested with {@code format=csvdata} and every SDMX column is kept. Exchange
 * rates support incremental collection through the {@code updatedAfter} parameter; the
 * policy rates dataflow (FM) is event based and always fetched in full.
 */
public class EcbSdmxAdapter extends AbstractSourceAdapter {

	private static final Logger logger = LoggerFactory.getLogger(EcbSdmxAdapter.class);

	public static final String SOURCE_ID = "ecb";

	public static final String DEFAULT_BASE_URL = "https://data-api.ecb.europa.eu/service";

	/**
	 * Politeness interval between two ECB requests.
	 */
	public static final Duration REQUEST_INTERVAL = Duration.ofSeconds(1);

	private static final String FULL = "full";

	private static final String UPDATED_AFTER = "updated-after-";

	private static final DateTimeFormatter UPDATED_AFTER_FORMAT = DateTimeFormatter
		.ofPattern("yyyy-MM-dd'T'HH:mm:ss'+00:00'")
		.withZone(ZoneOffset.UTC);

	/**
	 * ECB datasets collected by this adapter.
	 */
	public enum Dataset {

		POLICY_RATES("policy_rates", "FM", "B.U2.EUR.4F.KR.MRR_FR+DFR+MRR_MBR.LEV", false),

		EXCHANGE_RATES("exchange_rates", "EXR", "D.USD+GBP+JPY+CHF.EUR.SP00.A", true);

		private final String datasetName;

		private final String dataflow;

		private final String key;

		private final boolean incremental;

		Dataset(String datasetName, String dataflow, String key, boolean incremental) {
			this.datasetName = datasetName;
			this.dataflow = dataflow;
			this.key = key;
			this.incremental = incremental;
		}

		public String datasetName() {
			return datasetName;
		}

		public String dataflow() {
			return dataflow;
		}

		public String key() {
			return key;
		}

		public boolean incremental() {
			return incremental;
		}

		static Optional<Dataset> byName(String name) {
			return Arrays.stream(values()).filter(d -> d.datasetName.equals(name)).findFirst();
		}

	}

	private final String baseUrl;

	public EcbSdmxAdapter(SourceContext context) {
		this(context, DEFAULT_BASE_URL);
	}

	public EcbSdmxAdapter(SourceContext context, String baseUrl) {
		super(context);
		this.baseUrl = baseUrl;
	}

	@Override
	public String sourceId() {
		return SOURCE_ID;
	}

	@Override
	public List<String> datasets() {
		return Arrays.stream(Dataset.values()).map(Dataset::datasetName).collect(Collectors.toList());
	}

	@Override
	public boolean supportsIncremental() {
		return true;
	}

	@Override
	public boolean supportsIncremental(String dataset) {
		return Dataset.byName(dataset).map(Dataset::incremental).orElse(false);
	}

	@Override
	public ExportFormat exportFormat(String dataset) {
		return ExportFormat.CSV;
	}

	@Override
	public Stream<CollectionUnit> enumerateUnits(CollectionRange range, Map<String, Instant> watermarks) {
		return Arrays.stream(Dataset.values()).map(dataset -> {
			Instant since = dataset.incremental() ? watermarks.get(dataset.datasetName()) : null;
			String workKey = since != null ? UPDATED_AFTER + since : FULL;
			return CollectionUnit.of(SOURCE_ID, dataset.datasetName(), workKey, range.asDateRange());
		});
	}

	@Override
	public RawPayload fetch(CollectionUnit unit) {
		Dataset dataset = dataset(unit);
		LocalDate start = unit.range().map(DateRange::start).orElseThrow();
		LocalDate end = unit.range().map(DateRange::end).orElseThrow();
		String url = buildUrl(dataset, start, end, updatedAfter(unit));
		Instant requestedAt = now();
		try {
			String body = context.client().get(url, Map.of("Accept", "text/csv"));
			if (body.isBlank()) {
				logger.warn("Empty response body for {}", dataset.datasetName());
			}
			return new RawPayload(unit, body, requestedAt);
		}
		catch (SourceRequestException e) {
			if (e.getStatusCode() == 404) {
				throw new SourceRequestException("Invalid ECB dataset: " + dataset.dataflow() + "/" + dataset.key(),
						404, e.getResponseBody(), null);
			}
			throw e;
		}
	}

	@Override
	public List<NormalizedRecord> normalize(RawPayload payload) {
		List<Map<String, String>> rows = CsvRows.parse(payload.body());
		List<NormalizedRecord> records = normalizeRows(payload, rows, List.of("OBS_VALUE"), "TIME_PERIOD");
		logger.info("Received {} row(s) for {}", records.size(), payload.unit().dataset());
		return records;
	}

	/**
	 * Exchange rate revisions are tracked by collection time, which becomes the next
	 * {@code updatedAfter}. Payloads are stamped with the instant the request was sent, so a
	 * revision published while the response is in flight is fetched again next run.
	 */
	@Override
	public Optional<Instant> cursorFor(CollectionUnit unit, List<NormalizedRecord> records) {
		if (!supportsIncremental(unit.dataset())) {
			return Optional.empty();
		}
		Optional<Instant> collected = records.stream()
			.map(NormalizedRecord::timestampCollected)
			.filter(Objects::nonNull)
			.max(Instant::compareTo);
		return collected.isPresent() ? collected : super.cursorFor(unit, records);
	}

	@Override
	public boolean healthCheck() {
		LocalDate today = LocalDate.now(context.clock());
		return probe(buildUrl(Dataset.EXCHANGE_RATES, today, today, null));
	}

	String buildUrl(Dataset dataset, LocalDate start, LocalDate end, @Nullable Instant updatedAfter) {
		StringBuilder url = new StringBuilder(baseUrl).append("/data/")
			.append(dataset.dataflow())
			.append('/')
			.append(dataset.key())
			.append("?format=csvdata")
			.append("&startPeriod=")
			.append(start)
			.append("&endPeriod=")
			.append(end);
		if (updatedAfter != null) {
			url.append("&updatedAfter=")
				.append(URLEncoder.encode(UPDATED_AFTER_FORMAT.format(updatedAfter), StandardCharsets.UTF_8));
		}
		return url.toString();
	}

	private static Dataset dataset(CollectionUnit unit) {
		return Dataset.byName(unit.dataset())
			.orElseThrow(() -> new IllegalArgumentException("Unknown ECB dataset: " + unit.dataset()));
	}

	@Nullable
	private static Instant updatedAfter(CollectionUnit unit) {
		if (unit.workKey().startsWith(UPDATED_AFTER)) {
			return Instant.parse(unit.workKey().substring(UPDATED_AFTER.length()));
		}
		return null;
	}

}
