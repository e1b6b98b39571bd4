package org.macroingest.collector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("KeywordClassifier Tests")
class KeywordClassifierTest {

	enum Kind {

		STATEMENT, SPEECH, OTHER

	}

	private final KeywordClassifier<Kind> classifier = KeywordClassifier.builder(Kind.OTHER)
		.rule(Kind.STATEMENT, "FOMC statement", "policy statement")
		.rule(Kind.SPEECH, "speech", "remarks")
		.build();

	@Test
	@DisplayName("Should match case-insensitively in title or body")
	void shouldMatchCaseInsensitively() {
		assertThat(classifier.classify("Federal Reserve issues FOMC Statement", "")).isEqualTo(Kind.STATEMENT);
		assertThat(classifier.classify("Governor Waller", "Prepared REMARKS at the conference"))
			.isEqualTo(Kind.SPEECH);
	}

	@Test
	@DisplayName("Should let the first declared rule win")
	void shouldPreferFirstRule() {
		assertThat(classifier.classify("Speech on the policy statement", "")).isEqualTo(Kind.STATEMENT);
	}

	@Test
	@DisplayName("Should fall back to the default bucket")
	void shouldFallBackToDefault() {
		assertThat(classifier.classify("Board announces approval of application", "")).isEqualTo(Kind.OTHER);
		assertThat(classifier.defaultBucket()).isEqualTo(Kind.OTHER);
	}

}
