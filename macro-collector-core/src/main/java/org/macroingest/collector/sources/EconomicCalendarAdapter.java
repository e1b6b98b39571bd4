package org.macroingest.collector.sources;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jspecify.annotations.Nullable;
import org.macroingest.collector.AbstractSourceAdapter;
import org.macroingest.collector.CollectionRange;
import org.macroingest.collector.CollectionUnit;
import org.macroingest.collector.DateRange;
import org.macroingest.collector.ExportFormat;
import org.macroingest.collector.NormalizedRecord;
import org.macroingest.collector.PageFetcher;
import org.macroingest.collector.PayloadParseException;
import org.macroingest.collector.PolitenessPolicy;
import org.macroingest.collector.RawPayload;
import org.macroingest.collector.Result;
import org.macroingest.collector.RobotsRules;
import org.macroingest.collector.SourceContext;
import org.macroingest.collector.SourceRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Economic calendar adapter scraping the Investing.com calendar, one page per day.
 *
 * <p>
 * Pages are obtained through a {@link PageFetcher} and parsed with jsoup. Access is
 * checked against {@code robots.txt}; when it cannot be loaded a list of known disallowed
 * paths is used instead. The watermark only advances through contiguous successful days,
 * so a failed day is collected again by the next incremental run.
 */
public class EconomicCalendarAdapter extends AbstractSourceAdapter {

	private static final Logger logger = LoggerFactory.getLogger(EconomicCalendarAdapter.class);

	public static final String SOURCE_ID = "calendar";

	public static final String DATASET = "economic_events";

	public static final String DEFAULT_BASE_URL = "https://www.investing.com";

	static final String CALENDAR_PATH = "/economic-calendar/";

	/**
	 * Random 3 to 5 second pause between pages.
	 */
	public static final PolitenessPolicy POLITENESS = new PolitenessPolicy(Duration.ZERO, Duration.ofSeconds(3),
			Duration.ofSeconds(5));

	static final List<String> FALLBACK_DISALLOWED = List.of("/registration", "/login", "/images", "/admin",
			"/content", "/common", "/charts_xml", "/index.php", "/unsubscribe", "/toolbar", "/webmaster-tools/verify",
			"/upload_images", "/jp.php", "/charts/advinion.php", "/signup", "/studios/financialounge", "/members",
			"/mobile/mobile-redirect", "/mobile/footer-redirect", "/research/", "/brokers2/", "/cdn-cgi/",
			"/brokers/house/guest/", "/warrenai/conversation/");

	private static final List<String> TABLE_SELECTORS = List.of("table[class*=datatable-v2_table]", "table.genTbl",
			"table#economicCalendarData", "table.economicCalendarTable");

	private static final Set<String> EMPTY_VALUES = Set.of("-", "N/A", "NA", "");

	private static final List<String> IMPACT_LEVELS = List.of("high", "medium", "low");

	private final PageFetcher pageFetcher;

	private final String baseUrl;

	private volatile @Nullable RobotsRules robotsRules;

	public EconomicCalendarAdapter(SourceContext context, PageFetcher pageFetcher) {
		this(context, pageFetcher, DEFAULT_BASE_URL);
	}

	public EconomicCalendarAdapter(SourceContext context, PageFetcher pageFetcher, String baseUrl) {
		super(context);
		this.pageFetcher = pageFetcher;
		this.baseUrl = baseUrl;
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
	public boolean strictWatermarkOrdering() {
		return true;
	}

	@Override
	public ExportFormat exportFormat(String dataset) {
		return ExportFormat.CSV;
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
	public RawPayload fetch(CollectionUnit unit) {
		if (!robotsRules().isAllowed(CALENDAR_PATH)) {
			throw new SourceRequestException("Economic calendar access blocked by robots.txt: " + CALENDAR_PATH, 403);
		}
		String url = baseUrl + CALENDAR_PATH + "?date=" + unit.workKey();
		return new RawPayload(unit, pageFetcher.fetchPage(url), now());
	}

	@Override
	public List<NormalizedRecord> normalize(RawPayload payload) {
		LocalDate day = LocalDate.parse(payload.unit().workKey());
		Document doc = Jsoup.parse(payload.body(), baseUrl);
		Element table = findTable(doc);
		if (table == null) {
			throw new PayloadParseException("Calendar table not found on the page for " + day);
		}

		Instant cursor = day.atStartOfDay(ZoneOffset.UTC).toInstant();
		List<NormalizedRecord> records = new ArrayList<>();
		for (Element row : table.select("tr")) {
			if (row.className().toLowerCase(Locale.ROOT).contains("header")) {
				continue;
			}
			Map<String, @Nullable Object> event = parseRow(row, day);
			if (event != null) {
				records.add(NormalizedRecord.row(SOURCE_ID, DATASET, payload.fetchedAt(), event, cursor));
			}
		}
		logger.info("Successfully parsed {} events for {}", records.size(), day);
		return records;
	}

	@Override
	public boolean healthCheck() {
		if (!robotsRules().isAllowed(CALENDAR_PATH)) {
			logger.error("Economic calendar access BLOCKED by robots.txt: {}", CALENDAR_PATH);
			return false;
		}
		Result<String> result = context.engine()
			.execute(SOURCE_ID, "health check " + baseUrl, () -> pageFetcher.fetchPage(baseUrl + CALENDAR_PATH),
					context.retryPolicy().withMaxAttempts(1));
		if (result.isFailure()) {
			logger.warn("Health check failed: {}", result.errorOrThrow().message());
			return false;
		}
		return true;
	}

	RobotsRules robotsRules() {
		RobotsRules rules = robotsRules;
		if (rules == null) {
			rules = loadRobotsRules();
			robotsRules = rules;
		}
		return rules;
	}

	private RobotsRules loadRobotsRules() {
		Result<String> robots = fetchSecondary("robots.txt", baseUrl + "/robots.txt");
		if (robots.isSuccess()) {
			logger.info("Loaded robots.txt from {}", baseUrl);
			return RobotsRules.parse(robots.getOrThrow());
		}
		logger.warn("Failed to load robots.txt: {}. Using known disallowed paths.", robots.errorOrThrow().message());
		return RobotsRules.disallowing(FALLBACK_DISALLOWED);
	}

	@Nullable
	private static Element findTable(Document doc) {
		for (String selector : TABLE_SELECTORS) {
			Element table = doc.selectFirst(selector);
			if (table != null) {
				return table;
			}
		}
		return null;
	}

	/**
	 * Parse one event row: country, time, event, impact, actual, forecast, previous.
	 * @param row the table row
	 * @param day the calendar day
	 * @return the event fields, or {@code null} if the row is not an event
	 */
	@Nullable
	static Map<String, @Nullable Object> parseRow(Element row, LocalDate day) {
		Elements cells = row.getElementsByTag("td");
		if (cells.size() < 8) {
			return null;
		}
		Element link = cells.get(3).selectFirst("a");
		if (link == null) {
			link = row.selectFirst("a");
		}
		if (link == null) {
			return null;
		}

		Map<String, @Nullable Object> event = new LinkedHashMap<>();
		event.put("date", day.toString());
		event.put("time", emptyToNull(cells.get(1).text()));
		event.put("country", country(row, cells.get(0)));
		event.put("event", link.text().trim());
		event.put("impact", impact(cells.get(4)));
		event.put("actual", value(cells.get(5)));
		event.put("forecast", value(cells.get(6)));
		event.put("previous", value(cells.get(7)));
		event.put("event_url", link.absUrl("href").isEmpty() ? link.attr("href") : link.absUrl("href"));
		return event;
	}

	/**
	 * Impact from the filled star icons, falling back to the cell's class and text.
	 */
	static String impact(Element cell) {
		Elements stars = cell.select("svg");
		if (!stars.isEmpty()) {
			long filled = stars.stream().filter(svg -> svg.hasClass("opacity-60")).count();
			if (filled >= 3) {
				return "High";
			}
			if (filled == 2) {
				return "Medium";
			}
			if (filled == 1) {
				return "Low";
			}
		}
		String classes = cell.className().toLowerCase(Locale.ROOT);
		String text = cell.text().toLowerCase(Locale.ROOT);
		for (String source : List.of(classes, text)) {
			for (String level : IMPACT_LEVELS) {
				if (source.contains(level)) {
					return Character.toUpperCase(level.charAt(0)) + level.substring(1);
				}
			}
		}
		return "Unknown";
	}

	@Nullable
	private static String country(Element row, Element firstCell) {
		for (Element span : firstCell.select("span")) {
			if (span.className().contains("flag_flag--")) {
				String title = span.attr("title").trim();
				if (!title.isEmpty()) {
					return title;
				}
				break;
			}
		}
		String[] idParts = row.id().split("-");
		if (idParts.length >= 3 && !idParts[2].isEmpty()) {
			return idParts[2];
		}
		return emptyToNull(firstCell.text());
	}

	@Nullable
	private static String value(Element cell) {
		String text = cell.text().trim();
		return EMPTY_VALUES.contains(text) ? null : text;
	}

	@Nullable
	private static String emptyToNull(String text) {
		String trimmed = text.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}

}
