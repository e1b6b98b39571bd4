package org.macroingest.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.macroingest.collector.sources.BigQueryRestClient;
import org.macroingest.collector.sources.EcbSdmxAdapter;
import org.macroingest.collector.sources.EconomicCalendarAdapter;
import org.macroingest.collector.sources.FedRssAdapter;
import org.macroingest.collector.sources.FredAdapter;
import org.macroingest.collector.sources.GdeltAdapter;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Builder wiring the collection framework and the source adapters without a container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: HTTP client, files under data/raw and data/state
 * MacroCollectorBuilder builder = MacroCollectorBuilder.create();
 * CollectionOrchestrator orchestrator = builder.buildOrchestrator();
 * RunReport report = orchestrator.run(builder.buildAdapter("fred"),
 *     new CollectionRange(LocalDate.parse("2024-01-01"), LocalDate.parse("2024-01-31"), true));
 *
 * // For testing with a mock HTTP client and a recording sleeper
 * SourceClient mockClient = mock(SourceClient.class);
 * MacroCollectorBuilder testBuilder = MacroCollectorBuilder.create()
 *     .sourceClient(mockClient)
 *     .sleeper(sleeper)
 *     .environment(Map.of("FRED_API_KEY", "test")::get);
 * }
 * </pre>
 *
 * <p>
 * The governor and engine are created once per builder, so every adapter and orchestrator
 * built from it shares the same per-source politeness state.
 */
public class MacroCollectorBuilder {

	/**
	 * Source ids understood by {@link #buildAdapter(String)}.
	 */
	public static final List<String> SOURCES = List.of(EcbSdmxAdapter.SOURCE_ID, FredAdapter.SOURCE_ID,
			FedRssAdapter.SOURCE_ID, GdeltAdapter.SOURCE_ID, EconomicCalendarAdapter.SOURCE_ID);

	private CollectionProperties properties;

	private ObjectMapper objectMapper;

	private SourceClient sourceClient;

	private PageFetcher pageFetcher;

	private ExportSink exportSink;

	private WatermarkStore watermarkStore;

	private Clock clock = Clock.systemUTC();

	private Sleeper sleeper = Sleeper.SYSTEM;

	private Function<String, @Nullable String> environment = EnvironmentSupport::get;

	private Components components;

	private MacroCollectorBuilder() {
		this.properties = new CollectionProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new MacroCollectorBuilder
	 */
	public static MacroCollectorBuilder create() {
		return new MacroCollectorBuilder();
	}

	/**
	 * Set collection properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public MacroCollectorBuilder properties(@Nullable CollectionProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public MacroCollectorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom SourceClient implementation. Useful for testing with mocks or for
	 * adding decorators (caching, logging).
	 * @param sourceClient custom client (null to use default)
	 * @return this builder
	 */
	public MacroCollectorBuilder sourceClient(@Nullable SourceClient sourceClient) {
		this.sourceClient = sourceClient;
		return this;
	}

	/**
	 * Set a custom PageFetcher, e.g. one backed by a browser.
	 * @param pageFetcher custom fetcher (null to use plain HTTP)
	 * @return this builder
	 */
	public MacroCollectorBuilder pageFetcher(@Nullable PageFetcher pageFetcher) {
		this.pageFetcher = pageFetcher;
		return this;
	}

	/**
	 * Set a custom ExportSink implementation.
	 * @param exportSink custom sink (null to write files under the output directory)
	 * @return this builder
	 */
	public MacroCollectorBuilder exportSink(@Nullable ExportSink exportSink) {
		this.exportSink = exportSink;
		return this;
	}

	/**
	 * Set a custom WatermarkStore implementation.
	 * @param watermarkStore custom store (null to use files under the state directory)
	 * @return this builder
	 */
	public MacroCollectorBuilder watermarkStore(@Nullable WatermarkStore watermarkStore) {
		this.watermarkStore = watermarkStore;
		return this;
	}

	public MacroCollectorBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	public MacroCollectorBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Set where credentials are looked up. Defaults to {@link EnvironmentSupport#get}.
	 * @param environment variable name to value, {@code null} when unset
	 * @return this builder
	 */
	public MacroCollectorBuilder environment(Function<String, @Nullable String> environment) {
		this.environment = environment;
		return this;
	}

	public RateGovernor buildGovernor() {
		return components().governor();
	}

	public ResilienceEngine buildEngine() {
		return components().engine();
	}

	public SourceContext buildContext() {
		Components built = components();
		return new SourceContext(built.client(), built.engine(), properties.toRetryPolicy(), clock);
	}

	/**
	 * Build an orchestrator writing to the configured sink and watermark store.
	 * @return configured CollectionOrchestrator
	 */
	public CollectionOrchestrator buildOrchestrator() {
		Components built = components();
		Path outputRoot = Path.of(properties.getOutputDir());
		SeenSetLoader seenSetLoader = new SeenSetLoader(built.objectMapper());
		@Nullable Duration deadline = properties.getRunDeadlineMinutes() > 0
				? Duration.ofMinutes(properties.getRunDeadlineMinutes()) : null;

		return CollectionOrchestrator.builder()
			.engine(built.engine())
			.retryPolicy(properties.toRetryPolicy())
			.watermarks(new WatermarkTracker(built.watermarkStore(), clock))
			.exportSink(built.exportSink())
			.seenSetSource(source -> seenSetLoader.load(outputRoot, source))
			.clock(clock)
			.deadline(deadline)
			.build();
	}

	/**
	 * Build the adapter for a source.
	 * @param sourceId one of {@link #SOURCES}
	 * @return the adapter
	 * @throws IllegalArgumentException if the source is unknown
	 * @throws IllegalStateException if a credential the source needs is missing
	 */
	public SourceAdapter buildAdapter(String sourceId) {
		Components built = components();
		SourceContext context = buildContext();
		return switch (sourceId) {
			case EcbSdmxAdapter.SOURCE_ID -> new EcbSdmxAdapter(context);
			case FredAdapter.SOURCE_ID -> new FredAdapter(context, built.objectMapper(),
					requireEnv(FredAdapter.API_KEY_VARIABLE, "Get a free key at https://fred.stlouisfed.org/docs/api/api_key.html"));
			case FedRssAdapter.SOURCE_ID -> new FedRssAdapter(context);
			case GdeltAdapter.SOURCE_ID -> new GdeltAdapter(context,
					new BigQueryRestClient(built.client(), built.objectMapper(),
							requireEnv(GdeltAdapter.PROJECT_ID_VARIABLE, "Set the Google Cloud project billed for queries."),
							requireEnv(GdeltAdapter.ACCESS_TOKEN_VARIABLE,
									"Use the output of 'gcloud auth print-access-token'.")),
					built.objectMapper(), properties.getGdeltCostLimitBytes());
			case EconomicCalendarAdapter.SOURCE_ID -> new EconomicCalendarAdapter(context, built.pageFetcher());
			default -> throw new IllegalArgumentException("Unknown source: " + sourceId + " (expected one of " + SOURCES + ")");
		};
	}

	private String requireEnv(String name, String hint) {
		return EnvironmentSupport.require(environment, name, hint);
	}

	private Components components() {
		if (components == null) {
			components = buildComponents();
		}
		return components;
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		SourceClient client = this.sourceClient != null ? this.sourceClient
				: new HttpSourceClient(Duration.ofSeconds(properties.getConnectTimeoutSeconds()),
						Duration.ofSeconds(properties.getRequestTimeoutSeconds()), HttpSourceClient.DEFAULT_USER_AGENT);
		PageFetcher fetcher = this.pageFetcher != null ? this.pageFetcher : new HttpPageFetcher(client);
		ExportSink sink = this.exportSink != null ? this.exportSink
				: new FileSystemExportSink(Path.of(properties.getOutputDir()), mapper);
		WatermarkStore store = this.watermarkStore != null ? this.watermarkStore
				: new FileSystemWatermarkStore(Path.of(properties.getStateDir()), mapper);

		RateGovernor governor = RateGovernor.builder()
			.defaultPolicy(PolitenessPolicy.fixed(Duration.ofMillis(properties.getDefaultMinIntervalMillis())))
			.policy(EcbSdmxAdapter.SOURCE_ID, PolitenessPolicy.fixed(EcbSdmxAdapter.REQUEST_INTERVAL))
			.policy(FredAdapter.SOURCE_ID, PolitenessPolicy.fixed(FredAdapter.REQUEST_INTERVAL))
			.policy(FedRssAdapter.SOURCE_ID, PolitenessPolicy.fixed(FedRssAdapter.REQUEST_INTERVAL))
			.policy(GdeltAdapter.SOURCE_ID, PolitenessPolicy.none())
			.policy(EconomicCalendarAdapter.SOURCE_ID, EconomicCalendarAdapter.POLITENESS)
			.clock(clock)
			.sleeper(sleeper)
			.build();
		ResilienceEngine engine = new ResilienceEngine(governor, sleeper, clock);

		return new Components(mapper, client, fetcher, sink, store, governor, engine);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(ObjectMapper objectMapper, SourceClient client, PageFetcher pageFetcher,
			ExportSink exportSink, WatermarkStore watermarkStore, RateGovernor governor, ResilienceEngine engine) {
	}

}
