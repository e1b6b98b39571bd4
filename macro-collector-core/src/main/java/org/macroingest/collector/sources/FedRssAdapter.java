package org.macroingest.collector.sources;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;
import org.macroingest.collector.AbstractSourceAdapter;
import org.macroingest.collector.CollectionRange;
import org.macroingest.collector.CollectionUnit;
import org.macroingest.collector.DateRange;
import org.macroingest.collector.ExportFormat;
import org.macroingest.collector.Fingerprints;
import org.macroingest.collector.KeywordClassifier;
import org.macroingest.collector.NormalizedRecord;
import org.macroingest.collector.PayloadParseException;
import org.macroingest.collector.RawPayload;
import org.macroingest.collector.Result;
import org.macroingest.collector.SourceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringReader;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Federal Reserve publications adapter.
 *
 * <p>
 * Reads the Board's press RSS feed with Rome, fetches each publication page in the range
 * and extracts its text with jsoup. Publications are classified by keyword into
 * {@link FedDocumentType}s, each exported as a separate JSONL dataset. A page that cannot
 * be fetched still produces a record, with an empty {@code content} and the failure in
 * {@code metadata.fetch_error}.
 */
public class FedRssAdapter extends AbstractSourceAdapter {

	private static final Logger logger = LoggerFactory.getLogger(FedRssAdapter.class);

	public static final String SOURCE_ID = "fed";

	public static final String DEFAULT_FEED_URL = "https://www.federalreserve.gov/feeds/press_all.xml";

	public static final Duration REQUEST_INTERVAL = Duration.ofMillis(1500);

	/**
	 * Dataset of the single unit; records are exported under their document type.
	 */
	static final String FEED_DATASET = "press_all";

	private static final int MIN_CONTENT_LENGTH = 200;

	private static final List<String> CONTENT_SELECTORS = List.of("div#article", "div.col-xs-12.col-sm-8.col-md-8",
			"div.row", "article", "main", "div#content", "body");

	private static final List<Pattern> NOISE_PATTERNS = Stream
		.of("Skip to main content", "Board of Governors.*?Federal Reserve System", "Stay Connected.*?RSS",
				"Last Update:.*?\\d{4}")
		.map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.DOTALL))
		.collect(Collectors.toList());

	// Vice Chair must be tried before Chair
	private static final List<Pattern> SPEAKER_PATTERNS = Stream
		.of("(Vice\\s+Chair(?:man)?\\s+\\w+)", "(Chair(?:man)?\\s+\\w+)", "(Governor\\s+\\w+)")
		.map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
		.collect(Collectors.toList());

	static final KeywordClassifier<FedDocumentType> CLASSIFIER = KeywordClassifier
		.builder(FedDocumentType.PRESS_RELEASE)
		.rule(FedDocumentType.FOMC_STATEMENT, "fomc", "federal open market committee", "policy statement")
		.rule(FedDocumentType.SPEECH, "speech", "remarks", "statement by", "governor", "chair")
		.rule(FedDocumentType.TESTIMONY, "testimony", "testifies", "congress")
		.rule(FedDocumentType.MINUTES, "minutes", "meeting minutes")
		.rule(FedDocumentType.PRESS_RELEASE, "press release", "announces", "announcement", "enforcement action",
				"regulation")
		.build();

	private final String feedUrl;

	public FedRssAdapter(SourceContext context) {
		this(context, DEFAULT_FEED_URL);
	}

	public FedRssAdapter(SourceContext context, String feedUrl) {
		super(context);
		this.feedUrl = feedUrl;
	}

	@Override
	public String sourceId() {
		return SOURCE_ID;
	}

	@Override
	public List<String> datasets() {
		return Arrays.stream(FedDocumentType.values())
			.map(FedDocumentType::datasetName)
			.collect(Collectors.toList());
	}

	/**
	 * The feed only carries recent items and cannot be queried from a point in time.
	 */
	@Override
	public boolean supportsIncremental() {
		return false;
	}

	@Override
	public ExportFormat exportFormat(String dataset) {
		return ExportFormat.JSONL;
	}

	@Override
	public Stream<CollectionUnit> enumerateUnits(CollectionRange range, Map<String, Instant> watermarks) {
		return Stream.of(CollectionUnit.of(SOURCE_ID, FEED_DATASET, FEED_DATASET, range.asDateRange()));
	}

	@Override
	public RawPayload fetch(CollectionUnit unit) {
		String body = context.client().get(feedUrl);
		DateRange range = unit.range().orElseThrow();

		Map<String, RawPayload.Attachment> pages = new LinkedHashMap<>();
		for (SyndEntry entry : parseFeed(body).getEntries()) {
			Instant published = publishedAt(entry);
			String link = trimmed(entry.getLink());
			if (published == null || link.isEmpty() || pages.containsKey(link)
					|| !range.contains(published.atZone(ZoneOffset.UTC).toLocalDate())) {
				continue;
			}
			Result<String> page = fetchSecondary("article " + link, link);
			if (page.isSuccess()) {
				pages.put(link, RawPayload.Attachment.success(link, page.getOrThrow()));
			}
			else {
				logger.warn("Failed to extract content from {}: {}", link, page.errorOrThrow().message());
				pages.put(link, RawPayload.Attachment.failure(link, page.errorOrThrow().toString()));
			}
		}
		return new RawPayload(unit, body, now(), pages);
	}

	@Override
	public List<NormalizedRecord> normalize(RawPayload payload) {
		SyndFeed feed = parseFeed(payload.body());
		DateRange range = payload.unit().range().orElseThrow();
		List<NormalizedRecord> records = new ArrayList<>();

		for (SyndEntry entry : feed.getEntries()) {
			Instant published = publishedAt(entry);
			if (published == null) {
				logger.debug("Skipping entry without date: {}", entry.getTitle());
				continue;
			}
			if (!range.contains(published.atZone(ZoneOffset.UTC).toLocalDate())) {
				continue;
			}
			records.add(toRecord(payload, entry, published));
		}

		logger.info("Categorized {} publication(s) from {} feed entries", records.size(), feed.getEntries().size());
		return records;
	}

	private NormalizedRecord toRecord(RawPayload payload, SyndEntry entry, Instant published) {
		String title = trimmed(entry.getTitle());
		String summary = entry.getDescription() != null ? trimmed(entry.getDescription().getValue()) : "";
		String url = trimmed(entry.getLink());
		FedDocumentType type = CLASSIFIER.classify(title, summary);

		Map<String, @Nullable Object> metadata = new LinkedHashMap<>();
		metadata.put("rss_summary", summary);
		metadata.put("rss_published", published.toString());
		metadata.put("feed_id", trimmed(entry.getUri()));

		String content = "";
		RawPayload.Attachment page = payload.attachments().get(url);
		if (page != null && page.isSuccess() && page.body() != null) {
			content = extractContent(page.body());
		}
		else if (page != null) {
			metadata.put("fetch_error", page.error());
		}

		Map<String, @Nullable Object> fields = new LinkedHashMap<>();
		fields.put("timestamp_published", published.toString());
		fields.put("url", url);
		fields.put("title", title);
		fields.put("content", content);
		fields.put("document_type", type.label());
		fields.put("speaker", type == FedDocumentType.SPEECH ? extractSpeaker(title) : "");
		fields.put("metadata", metadata);

		String identity = url.isEmpty() ? title + "|" + published : url;
		return new NormalizedRecord(SOURCE_ID, type.datasetName(), payload.fetchedAt(), fields,
				Fingerprints.of(SOURCE_ID, identity), published);
	}

	@Override
	public boolean healthCheck() {
		return probe(feedUrl);
	}

	/**
	 * Speaker named in a speech title, e.g. {@code "Governor Waller"}.
	 * @param title the title
	 * @return the speaker, or an empty string
	 */
	static String extractSpeaker(String title) {
		for (Pattern pattern : SPEAKER_PATTERNS) {
			Matcher matcher = pattern.matcher(title);
			if (matcher.find()) {
				return matcher.group(1).trim();
			}
		}
		return "";
	}

	/**
	 * Main text of a publication page without navigation and boilerplate.
	 * @param html the page
	 * @return the text
	 */
	static String extractContent(String html) {
		Document doc = Jsoup.parse(html);
		doc.select("script, style, nav, header, footer, aside").remove();

		String text = "";
		for (String selector : CONTENT_SELECTORS) {
			Element element = doc.selectFirst(selector);
			if (element != null) {
				String candidate = element.text();
				if (candidate.length() > MIN_CONTENT_LENGTH) {
					text = candidate;
					break;
				}
			}
		}
		if (text.length() <= MIN_CONTENT_LENGTH) {
			text = doc.body().text();
		}
		for (Pattern noise : NOISE_PATTERNS) {
			text = noise.matcher(text).replaceAll("");
		}
		return text.trim();
	}

	private static SyndFeed parseFeed(String body) {
		try {
			return new SyndFeedInput().build(new StringReader(body));
		}
		catch (FeedException | IllegalArgumentException e) {
			throw new PayloadParseException("Malformed RSS feed: " + e.getMessage(), e);
		}
	}

	@Nullable
	private static Instant publishedAt(SyndEntry entry) {
		Date date = Optional.ofNullable(entry.getPublishedDate()).orElse(entry.getUpdatedDate());
		return date != null ? date.toInstant() : null;
	}

	private static String trimmed(@Nullable String value) {
		return value != null ? value.trim() : "";
	}

}
