package org.macroingest.collector.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.macroingest.collector.AbstractSourceAdapter;
import org.macroingest.collector.CollectionRange;
import org.macroingest.collector.CollectionUnit;
import org.macroingest.collector.CostEstimate;
import org.macroingest.collector.DateRange;
import org.macroingest.collector.ExportFormat;
import org.macroingest.collector.Fingerprints;
import org.macroingest.collector.JsonNodeUtils;
import org.macroingest.collector.MeteredSourceAdapter;
import org.macroingest.collector.NormalizedRecord;
import org.macroingest.collector.PayloadParseException;
import org.macroingest.collector.RawPayload;
import org.macroingest.collector.Result;
import org.macroingest.collector.SourceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * GDELT Global Knowledge Graph adapter, querying the public {@code gdelt-bq} dataset on
 * BigQuery.
 *
 * <p>
 * One unit per day, restricted to currency and central bank themes for the major
 * currencies. Queries are billed by bytes scanned, so every unit is dry-run first and the
 * orchestrator refuses days above {@link #costLimitBytes()}. Articles are identified by
 * URL; each gets a credibility tier from its source domain.
 */
public class GdeltAdapter extends AbstractSourceAdapter implements MeteredSourceAdapter {

	private static final Logger logger = LoggerFactory.getLogger(GdeltAdapter.class);

	public static final String SOURCE_ID = "gdelt";

	public static final String DATASET = "aggregated";

	public static final String PROJECT_ID_VARIABLE = "GCP_PROJECT_ID";

	public static final String ACCESS_TOKEN_VARIABLE = "GOOGLE_OAUTH_ACCESS_TOKEN";

	static final Set<String> TIER_1 = Set.of("reuters.com", "bloomberg.com", "ft.com");

	static final Set<String> TIER_2 = Set.of("wsj.com", "cnbc.com");

	private static final String QUERY_TEMPLATE = """
			SELECT
			    DATE,
			    SourceCommonName,
			    DocumentIdentifier,
			    V2Tone,
			    V2Themes AS Themes,
			    V2Locations AS Locations,
			    V2Organizations AS Organizations
			FROM `gdelt-bq.gdeltv2.gkg_partitioned`
			WHERE DATE(_PARTITIONTIME) >= "%s"
			  AND DATE(_PARTITIONTIME) < "%s"
			  AND (
			      V2Themes LIKE '%%ECON_CURRENCY%%'
			      OR V2Themes LIKE '%%ECON_CENTRAL_BANK%%'
			  )
			  AND (
			      V2Themes LIKE '%%EUR%%'
			      OR V2Themes LIKE '%%USD%%'
			      OR V2Themes LIKE '%%GBP%%'
			      OR V2Themes LIKE '%%JPY%%'
			  )
			""";

	private final BigQueryRestClient bigQuery;

	private final ObjectMapper objectMapper;

	private final long costLimitBytes;

	public GdeltAdapter(SourceContext context, BigQueryRestClient bigQuery, ObjectMapper objectMapper,
			long costLimitBytes) {
		super(context);
		if (costLimitBytes <= 0) {
			throw new IllegalArgumentException("costLimitBytes must be positive");
		}
		this.bigQuery = bigQuery;
		this.objectMapper = objectMapper;
		this.costLimitBytes = costLimitBytes;
	}

	@Override
	public String sourceId() {
		return SOURCE_ID;
	}

	@Override
	public List<String> datasets() {
		return List.of(DATASET);
	}

	@Override
	public boolean supportsIncremental() {
		return true;
	}

	@Override
	public ExportFormat exportFormat(String dataset) {
		return ExportFormat.JSONL;
	}

	@Override
	public long costLimitBytes() {
		return costLimitBytes;
	}

	@Override
	public Stream<CollectionUnit> enumerateUnits(CollectionRange range, Map<String, Instant> watermarks) {
		LocalDate start = range.effectiveStart(watermarks.get(DATASET));
		if (start.isAfter(range.end())) {
			return Stream.empty();
		}
		return start.datesUntil(range.end().plusDays(1))
			.map(day -> CollectionUnit.of(SOURCE_ID, DATASET, day.toString(), DateRange.of(day)));
	}

	@Override
	public CostEstimate estimateCost(CollectionUnit unit) {
		CostEstimate estimate = new CostEstimate(bigQuery.dryRun(sqlFor(day(unit))));
		logger.info("Dry run for {}: {} GB", unit.workKey(), String.format(Locale.ROOT, "%.4f", estimate.gibibytes()));
		return estimate;
	}

	@Override
	public RawPayload fetch(CollectionUnit unit) {
		return new RawPayload(unit, bigQuery.query(sqlFor(day(unit))), now());
	}

	@Override
	public List<NormalizedRecord> normalize(RawPayload payload) {
		JsonNode root;
		try {
			root = objectMapper.readTree(payload.body());
		}
		catch (JsonProcessingException e) {
			throw new PayloadParseException("Malformed BigQuery result for " + payload.unit().key(), e);
		}

		List<String> columns = JsonNodeUtils.getArray(root, "schema", "fields")
			.stream()
			.map(field -> JsonNodeUtils.getString(field, "name").orElse(""))
			.collect(Collectors.toList());
		if (columns.isEmpty()) {
			throw new PayloadParseException("BigQuery result for " + payload.unit().key() + " has no schema");
		}

		List<NormalizedRecord> records = new ArrayList<>();
		for (JsonNode row : JsonNodeUtils.getArray(root, "rows")) {
			Map<String, @Nullable String> values = cells(columns, row);
			String url = values.get("DocumentIdentifier");
			if (url == null || url.isBlank()) {
				continue;
			}
			records.add(toRecord(payload, values, url));
		}
		logger.info("Fetched {} row(s) for {}", records.size(), payload.unit().workKey());
		return records;
	}

	private NormalizedRecord toRecord(RawPayload payload, Map<String, @Nullable String> values, String url) {
		String domain = values.get("SourceCommonName");
		String urlHash = Fingerprints.sha256(url);

		Map<String, @Nullable Object> metadata = new LinkedHashMap<>();
		metadata.put("credibility_tier", credibilityTier(domain));
		metadata.put("url_hash", urlHash);

		Map<String, @Nullable Object> fields = new LinkedHashMap<>();
		fields.put("timestamp_published", values.get("DATE"));
		fields.put("url", url);
		fields.put("title", null);
		fields.put("content", null);
		fields.put("source_domain", domain);
		fields.put("tone", values.get("V2Tone"));
		fields.put("themes", splitField(values.get("Themes")));
		fields.put("locations", splitField(values.get("Locations")));
		fields.put("organizations", splitField(values.get("Organizations")));
		fields.put("metadata", metadata);

		return new NormalizedRecord(SOURCE_ID, DATASET, payload.fetchedAt(), fields,
				Fingerprints.of(SOURCE_ID, url), null);
	}

	@Override
	public boolean healthCheck() {
		Result<String> result = context.engine()
			.execute(SOURCE_ID, "BigQuery health check", () -> bigQuery.query("SELECT 1"),
					context.retryPolicy().withMaxAttempts(1));
		if (result.isFailure()) {
			logger.error("BigQuery health check failed: {}", result.errorOrThrow().message());
			return false;
		}
		logger.info("BigQuery health check successful.");
		return true;
	}

	static String sqlFor(LocalDate day) {
		return String.format(Locale.ROOT, QUERY_TEMPLATE, day, day.plusDays(1));
	}

	/**
	 * Tier 1 for wire services and the financial press of record, 2 for major business
	 * outlets, 3 otherwise.
	 * @param domain source domain, may be absent
	 * @return the tier
	 */
	static int credibilityTier(@Nullable String domain) {
		String lower = domain != null ? domain.toLowerCase(Locale.ROOT) : "";
		if (TIER_1.stream().anyMatch(lower::contains)) {
			return 1;
		}
		if (TIER_2.stream().anyMatch(lower::contains)) {
			return 2;
		}
		return 3;
	}

	static List<String> splitField(@Nullable String value) {
		if (value == null || value.isEmpty()) {
			return List.of();
		}
		return Arrays.stream(value.split(";", -1)).map(String::trim).collect(Collectors.toList());
	}

	private static Map<String, @Nullable String> cells(List<String> columns, JsonNode row) {
		List<JsonNode> cells = JsonNodeUtils.getArray(row, "f");
		Map<String, @Nullable String> values = new LinkedHashMap<>();
		for (int i = 0; i < columns.size(); i++) {
			JsonNode cell = i < cells.size() ? cells.get(i).path("v") : null;
			values.put(columns.get(i), cell == null || cell.isNull() || cell.isMissingNode() ? null : cell.asText());
		}
		return values;
	}

	private static LocalDate day(CollectionUnit unit) {
		return LocalDate.parse(unit.workKey());
	}

}
