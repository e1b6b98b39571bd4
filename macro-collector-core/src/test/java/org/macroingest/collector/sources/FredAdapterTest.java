package org.macroingest.collector.sources;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.macroingest.collector.CollectionRange;
import org.macroingest.collector.CollectionUnit;
import org.macroingest.collector.NormalizedRecord;
import org.macroingest.collector.ObjectMapperFactory;
import org.macroingest.collector.PayloadParseException;
import org.macroingest.collector.RawPayload;
import org.macroingest.collector.SourceClient;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link FredAdapter}.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FredAdapter Tests")
class FredAdapterTest {

	private static final String OBSERVATIONS = """
			{
			  "realtime_start": "2024-02-01",
			  "realtime_end": "2024-02-01",
			  "observation_start": "2024-01-01",
			  "observation_end": "2024-01-03",
			  "units": "lin",
			  "count": 3,
			  "observations": [
			    {"realtime_start": "2024-02-01", "realtime_end": "2024-02-01", "date": "2024-01-01", "value": "5.33"},
			    {"realtime_start": "2024-02-01", "realtime_end": "2024-02-01", "date": "2024-01-02", "value": "."},
			    {"realtime_start": "2024-02-01", "realtime_end": "2024-02-01", "date": "2024-01-03", "value": "5.32"}
			  ]
			}
			""";

	private static final CollectionRange JANUARY = new CollectionRange(LocalDate.of(2024, 1, 1),
			LocalDate.of(2024, 1, 31), true);

	@Mock
	private SourceClient client;

	private FredAdapter adapter;

	@BeforeEach
	void setUp() {
		adapter = new FredAdapter(TestContexts.context(client), ObjectMapperFactory.create(), "test-key",
				"https://fred.test/fred");
	}

	@Test
	@DisplayName("Should reject a blank API key")
	void shouldRejectBlankApiKey() {
		assertThatThrownBy(() -> new FredAdapter(TestContexts.context(client), ObjectMapperFactory.create(), " "))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("FRED_API_KEY");
	}

	@Test
	@DisplayName("Should enumerate one unit per series starting after each watermark")
	void shouldEnumerateFromWatermarks() {
		List<CollectionUnit> units = adapter
			.enumerateUnits(JANUARY,
					Map.of("cpi", Instant.parse("2024-01-31T00:00:00Z"), "federal_funds_rate",
							Instant.parse("2024-01-20T00:00:00Z")))
			.toList();

		assertThat(units).extracting(CollectionUnit::workKey).containsExactly("STLFSI4", "DFF", "UNRATE");
		assertThat(units.get(1).range().orElseThrow().start()).isEqualTo(LocalDate.of(2024, 1, 21));
		assertThat(units.get(0).range().orElseThrow().start()).isEqualTo(LocalDate.of(2024, 1, 1));
	}

	@Test
	@DisplayName("Should request observations for the unit's range")
	void shouldRequestObservations() {
		when(client.get(anyString())).thenReturn(OBSERVATIONS);
		CollectionUnit unit = adapter.enumerateUnits(JANUARY, Map.of())
			.filter(u -> u.workKey().equals("DFF"))
			.findFirst()
			.orElseThrow();

		RawPayload payload = adapter.fetch(unit);

		assertThat(payload.body()).isEqualTo(OBSERVATIONS);
		verify(client).get("https://fred.test/fred/series/observations?series_id=DFF&api_key=test-key"
				+ "&file_type=json&observation_start=2024-01-01&observation_end=2024-01-31");
	}

	@Test
	@DisplayName("Should drop missing observations and add series metadata")
	void shouldNormalizeObservations() {
		CollectionUnit unit = CollectionUnit.of("fred", "federal_funds_rate", "DFF", JANUARY.asDateRange());

		List<NormalizedRecord> records = adapter
			.normalize(new RawPayload(unit, OBSERVATIONS, Instant.parse(TestContexts.NOW)));

		assertThat(records).hasSize(2);
		assertThat(records).extracting(r -> r.field("date")).containsExactly("2024-01-01", "2024-01-03");
		NormalizedRecord first = records.get(0);
		assertThat(first.field("value")).isEqualTo(new BigDecimal("5.33"));
		assertThat(first.field("series_id")).isEqualTo("DFF");
		assertThat(first.field("frequency")).isEqualTo("D");
		assertThat(first.field("units")).isEqualTo("Percent");
		assertThat(first.dataset()).isEqualTo("federal_funds_rate");
		assertThat(adapter.cursorFor(unit, records)).contains(Instant.parse("2024-01-03T00:00:00Z"));
	}

	@Test
	@DisplayName("Should fail to parse an error response without observations")
	void shouldRejectErrorResponse() {
		CollectionUnit unit = CollectionUnit.of("fred", "cpi", "CPIAUCSL", JANUARY.asDateRange());
		String error = """
				{"error_code": 400, "error_message": "Bad Request.  The value for variable api_key is not registered."}
				""";

		assertThatThrownBy(() -> adapter.normalize(new RawPayload(unit, error, Instant.parse(TestContexts.NOW))))
			.isInstanceOf(PayloadParseException.class)
			.hasMessageContaining("CPIAUCSL")
			.hasMessageContaining("not registered");
	}

	@Test
	@DisplayName("Should fail to parse malformed JSON")
	void shouldRejectMalformedJson() {
		CollectionUnit unit = CollectionUnit.of("fred", "cpi", "CPIAUCSL", JANUARY.asDateRange());

		assertThatThrownBy(
				() -> adapter.normalize(new RawPayload(unit, "{\"observations\": [", Instant.parse(TestContexts.NOW))))
			.isInstanceOf(PayloadParseException.class);
	}

	@Test
	@DisplayName("Should probe the series endpoint for health")
	void shouldProbeSeriesEndpoint() {
		when(client.get(anyString())).thenReturn("{\"seriess\": []}");

		assertThat(adapter.healthCheck()).isTrue();
		verify(client).get("https://fred.test/fred/series?series_id=DFF&api_key=test-key&file_type=json");
	}

}
