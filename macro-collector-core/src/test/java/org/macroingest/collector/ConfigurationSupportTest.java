package org.macroingest.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for CollectionProperties, the shared ObjectMapper and environment lookup.
 */
@DisplayName("ConfigurationSupport Tests")
class ConfigurationSupportTest {

	@Nested
	@DisplayName("CollectionProperties Tests")
	class CollectionPropertiesTest {

		private CollectionProperties properties;

		@BeforeEach
		void setUp() {
			properties = new CollectionProperties();
		}

		@Test
		@DisplayName("Should have correct default properties")
		void shouldHaveCorrectDefaults() {
			assertThat(properties.getOutputDir()).isEqualTo("data/raw");
			assertThat(properties.getStateDir()).isEqualTo("data/state");
			assertThat(properties.getDefaultSources()).containsExactly("ecb", "fred", "fed", "gdelt", "calendar");
			assertThat(properties.getDefaultLookbackDays()).isEqualTo(30);
			assertThat(properties.getMaxAttempts()).isEqualTo(3);
			assertThat(properties.getRunDeadlineMinutes()).isZero();
			assertThat(properties.getGdeltCostLimitBytes()).isEqualTo(5L * 1024 * 1024 * 1024);
			assertThat(properties.isVerbose()).isFalse();
		}

		@Test
		@DisplayName("Should describe the default retry policy")
		void shouldMatchDefaultRetryPolicy() {
			assertThat(properties.toRetryPolicy()).isEqualTo(RetryPolicy.defaults());
		}

		@Test
		@DisplayName("Should carry tuned values into the retry policy")
		void shouldCarryTunedValuesIntoRetryPolicy() {
			properties.setMaxAttempts(5);
			properties.setBaseBackoffMillis(200);
			properties.setBackoffMultiplier(3.0);
			properties.setMaxBackoffSeconds(10);

			RetryPolicy policy = properties.toRetryPolicy();

			assertThat(policy.maxAttempts()).isEqualTo(5);
			assertThat(policy.baseBackoff()).isEqualTo(Duration.ofMillis(200));
			assertThat(policy.multiplier()).isEqualTo(3.0);
			assertThat(policy.maxBackoff()).isEqualTo(Duration.ofSeconds(10));
			assertThat(policy.retryableStatuses()).isEqualTo(RetryPolicy.DEFAULT_RETRYABLE_STATUSES);
		}

		@Test
		@DisplayName("Should keep default sources modifiable")
		void shouldKeepDefaultSourcesModifiable() {
			properties.getDefaultSources().remove("gdelt");

			assertThat(properties.getDefaultSources()).doesNotContain("gdelt");
			assertThat(new CollectionProperties().getDefaultSources()).contains("gdelt");
		}

	}

	@Nested
	@DisplayName("ObjectMapper Tests")
	class ObjectMapperTest {

		@Test
		@DisplayName("Should write snake_case fields and ISO instants")
		void shouldWriteSnakeCaseAndIsoInstants() throws Exception {
			RunManifest manifest = new RunManifest("r1", "ecb", Instant.parse("2024-01-15T10:00:00Z"),
					Instant.parse("2024-01-15T10:05:00Z"), RunState.IDLE, List.of("ecb:policy_rates:full"),
					List.of());

			String json = ObjectMapperFactory.create().writeValueAsString(manifest);

			assertThat(json).contains("\"run_id\":\"r1\"")
				.contains("\"started_at\":\"2024-01-15T10:00:00Z\"")
				.contains("\"succeeded_units\":[\"ecb:policy_rates:full\"]");
		}

		@Test
		@DisplayName("Should keep decimal observations exact")
		void shouldKeepDecimalsExact() throws Exception {
			ObjectMapper mapper = ObjectMapperFactory.create();

			assertThat(mapper.writeValueAsString(Map.of("obs_value", new BigDecimal("1E+1"))))
				.isEqualTo("{\"obs_value\":10}");
			assertThat(mapper.readTree("{\"obs_value\":1.0956}").get("obs_value").decimalValue())
				.isEqualByComparingTo("1.0956");
		}

		@Test
		@DisplayName("Should ignore unknown properties when reading state")
		void shouldIgnoreUnknownProperties() throws Exception {
			Watermark watermark = ObjectMapperFactory.create()
				.readValue("{\"source\":\"fred\",\"dataset\":\"DFF\",\"cursor\":\"2024-01-20T00:00:00Z\","
						+ "\"updated_at\":\"2024-01-21T06:00:00Z\",\"schema\":2}", Watermark.class);

			assertThat(watermark.cursor()).isEqualTo(Instant.parse("2024-01-20T00:00:00Z"));
		}

	}

	@Nested
	@DisplayName("EnvironmentSupport Tests")
	class EnvironmentSupportTest {

		private static final String UNSET = "MACRO_COLLECTOR_TEST_UNSET_VARIABLE";

		@Test
		@DisplayName("Should return null for an unset variable")
		void shouldReturnNullForUnsetVariable() {
			assertThat(EnvironmentSupport.get(UNSET)).isNull();
		}

		@Test
		@DisplayName("Should include the hint when a required variable is missing")
		void shouldIncludeHintWhenMissing() {
			assertThatThrownBy(() -> EnvironmentSupport.require(UNSET, "Set it in .env."))
				.isInstanceOf(IllegalStateException.class)
				.hasMessage(UNSET + " environment variable is required. Set it in .env.");
		}

	}

}
