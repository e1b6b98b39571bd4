package org.macroingest.collector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure keyword-rule classifier for documents.
 *
 * <p>
 * Rules are tried in declaration order against the lower-cased title and body; the first
 * rule with a matching keyword wins, otherwise the default bucket is returned.
 *
 * <pre>
 * {@code
 * KeywordClassifier<DocType> classifier = KeywordClassifier.builder(DocType.OTHER)
 *     .rule(DocType.SPEECH, "speech", "remarks")
 *     .rule(DocType.MINUTES, "minutes")
 *     .build();
 * }
 * </pre>
 *
 * @param <E> the closed set of document types
 */
public final class KeywordClassifier<E extends Enum<E>> {

	private final List<Rule<E>> rules;

	private final E defaultBucket;

	private KeywordClassifier(List<Rule<E>> rules, E defaultBucket) {
		this.rules = List.copyOf(rules);
		this.defaultBucket = defaultBucket;
	}

	public static <E extends Enum<E>> Builder<E> builder(E defaultBucket) {
		return new Builder<>(defaultBucket);
	}

	public E classify(String title, String body) {
		String text = (title + " " + body).toLowerCase(Locale.ROOT);
		for (Rule<E> rule : rules) {
			for (String keyword : rule.keywords()) {
				if (text.contains(keyword)) {
					return rule.bucket();
				}
			}
		}
		return defaultBucket;
	}

	public E defaultBucket() {
		return defaultBucket;
	}

	private record Rule<E>(E bucket, List<String> keywords) {
	}

	public static final class Builder<E extends Enum<E>> {

		private final E defaultBucket;

		private final List<Rule<E>> rules = new ArrayList<>();

		private Builder(E defaultBucket) {
			this.defaultBucket = defaultBucket;
		}

		public Builder<E> rule(E bucket, String... keywords) {
			List<String> lowered = new ArrayList<>();
			for (String keyword : keywords) {
				lowered.add(keyword.toLowerCase(Locale.ROOT));
			}
			rules.add(new Rule<>(bucket, lowered));
			return this;
		}

		public KeywordClassifier<E> build() {
			return new KeywordClassifier<>(rules, defaultBucket);
		}

	}

}
