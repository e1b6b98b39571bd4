package org.macroingest.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.macroingest.collector.sources.EcbSdmxAdapter;
import org.macroingest.collector.sources.EconomicCalendarAdapter;
import org.macroingest.collector.sources.FedRssAdapter;
import org.macroingest.collector.sources.FredAdapter;
import org.macroingest.collector.sources.GdeltAdapter;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link MacroCollectorBuilder}.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("MacroCollectorBuilder Tests")
class MacroCollectorBuilderTest {

	private static final Map<String, String> CREDENTIALS = Map.of(FredAdapter.API_KEY_VARIABLE, "fred-key",
			GdeltAdapter.PROJECT_ID_VARIABLE, "macro-project", GdeltAdapter.ACCESS_TOKEN_VARIABLE, "ya29.token");

	@Mock
	private SourceClient client;

	@TempDir
	Path tempDir;

	private MutableClock clock;

	private CollectionProperties properties;

	@BeforeEach
	void setUp() {
		clock = MutableClock.at("2024-02-01T06:00:00Z");
		properties = new CollectionProperties();
		properties.setOutputDir(tempDir.resolve("raw").toString());
		properties.setStateDir(tempDir.resolve("state").toString());
	}

	private MacroCollectorBuilder builder(Map<String, String> environment) {
		return MacroCollectorBuilder.create()
			.properties(properties)
			.sourceClient(client)
			.clock(clock)
			.sleeper(new RecordingSleeper(clock))
			.environment(environment::get);
	}

	@Nested
	@DisplayName("Adapter Tests")
	class AdapterTest {

		@Test
		@DisplayName("Should build an adapter for every known source")
		void shouldBuildEveryAdapter() {
			MacroCollectorBuilder builder = builder(CREDENTIALS);

			assertThat(builder.buildAdapter("ecb")).isInstanceOf(EcbSdmxAdapter.class);
			assertThat(builder.buildAdapter("fred")).isInstanceOf(FredAdapter.class);
			assertThat(builder.buildAdapter("fed")).isInstanceOf(FedRssAdapter.class);
			assertThat(builder.buildAdapter("gdelt")).isInstanceOf(GdeltAdapter.class);
			assertThat(builder.buildAdapter("calendar")).isInstanceOf(EconomicCalendarAdapter.class);
		}

		@Test
		@DisplayName("Should match adapter ids to the known source list")
		void shouldMatchSourceIds() {
			MacroCollectorBuilder builder = builder(CREDENTIALS);

			for (String source : MacroCollectorBuilder.SOURCES) {
				assertThat(builder.buildAdapter(source).sourceId()).isEqualTo(source);
			}
		}

		@Test
		@DisplayName("Should reject an unknown source")
		void shouldRejectUnknownSource() {
			assertThatThrownBy(() -> builder(CREDENTIALS).buildAdapter("imf"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown source: imf");
		}

		@Test
		@DisplayName("Should require a FRED API key")
		void shouldRequireFredKey() {
			assertThatThrownBy(() -> builder(Map.of()).buildAdapter("fred")).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining(FredAdapter.API_KEY_VARIABLE);
		}

		@ParameterizedTest
		@ValueSource(strings = { "GCP_PROJECT_ID", "GOOGLE_OAUTH_ACCESS_TOKEN" })
		@DisplayName("Should require both GDELT credentials")
		void shouldRequireGdeltCredentials(String missing) {
			Map<String, String> environment = new HashMap<>(CREDENTIALS);
			environment.put(missing, " ");

			assertThatThrownBy(() -> builder(environment).buildAdapter("gdelt"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining(missing);
		}

		@Test
		@DisplayName("Should not need credentials for public sources")
		void shouldBuildPublicSourcesWithoutCredentials() {
			MacroCollectorBuilder builder = builder(Map.of());

			assertThatCode(() -> {
				builder.buildAdapter("ecb");
				builder.buildAdapter("fed");
				builder.buildAdapter("calendar");
			}).doesNotThrowAnyException();
		}

	}

	@Nested
	@DisplayName("Politeness Tests")
	class PolitenessTest {

		@Test
		@DisplayName("Should register each source's published request interval")
		void shouldRegisterSourcePolicies() {
			RateGovernor governor = builder(CREDENTIALS).buildGovernor();

			assertThat(governor.policyFor("ecb").minInterval()).isEqualTo(Duration.ofSeconds(1));
			assertThat(governor.policyFor("fred").minInterval()).isEqualTo(Duration.ofMillis(500));
			assertThat(governor.policyFor("fed").minInterval()).isEqualTo(Duration.ofMillis(1500));
			assertThat(governor.policyFor("gdelt")).isEqualTo(PolitenessPolicy.none());
			assertThat(governor.policyFor("calendar")).isEqualTo(EconomicCalendarAdapter.POLITENESS);
		}

		@Test
		@DisplayName("Should fall back to the configured interval for other sources")
		void shouldUseConfiguredDefault() {
			properties.setDefaultMinIntervalMillis(250);

			RateGovernor governor = builder(CREDENTIALS).buildGovernor();

			assertThat(governor.policyFor("imf").minInterval()).isEqualTo(Duration.ofMillis(250));
		}

		@Test
		@DisplayName("Should share one governor and engine per builder")
		void shouldShareComponents() {
			MacroCollectorBuilder builder = builder(CREDENTIALS);

			assertThat(builder.buildGovernor()).isSameAs(builder.buildGovernor());
			assertThat(builder.buildEngine()).isSameAs(builder.buildEngine());
			assertThat(builder.buildContext().engine()).isSameAs(builder.buildEngine());
		}

		@Test
		@DisplayName("Should derive the context retry policy from properties")
		void shouldUsePropertiesRetryPolicy() {
			properties.setMaxAttempts(6);

			SourceContext context = builder(CREDENTIALS).buildContext();

			assertThat(context.retryPolicy().maxAttempts()).isEqualTo(6);
			assertThat(context.client()).isSameAs(client);
		}

	}

	@Nested
	@DisplayName("Orchestrator Tests")
	class OrchestratorTest {

		@Test
		@DisplayName("Should run a source end to end into the configured directories")
		void shouldRunSourceEndToEnd() throws Exception {
			when(client.get(anyString(), anyMap())).thenReturn("""
					KEY,FREQ,CURRENCY,CURRENCY_DENOM,EXR_TYPE,EXR_SUFFIX,TIME_PERIOD,OBS_VALUE
					EXR.D.USD.EUR.SP00.A,D,USD,EUR,SP00,A,2024-01-02,1.0956
					EXR.D.USD.EUR.SP00.A,D,USD,EUR,SP00,A,2024-01-03,1.0919
					""");
			MacroCollectorBuilder builder = builder(CREDENTIALS);

			RunReport report = builder.buildOrchestrator()
				.run(builder.buildAdapter("ecb"),
						new CollectionRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31), true));

			assertThat(report.manifest().skippedUnits()).isEmpty();
			assertThat(report.manifest().succeededUnits()).hasSize(2);
			assertThat(report.exportedFiles()).isNotEmpty()
				.allSatisfy(file -> assertThat(file.path()).startsWith(tempDir.resolve("raw").resolve("ecb")));
			try (var manifests = Files.list(tempDir.resolve("raw").resolve("ecb").resolve("manifests"))) {
				assertThat(manifests.toList()).hasSize(1);
			}
			assertThat(tempDir.resolve("state").resolve("ecb")).isDirectory();
		}

	}

}
