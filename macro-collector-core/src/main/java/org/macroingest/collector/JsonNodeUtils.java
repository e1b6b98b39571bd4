package org.macroingest.collector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Utility methods for JsonNode navigation.
 */
public final class JsonNodeUtils {

	private JsonNodeUtils() {
	}

	public static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	public static Optional<Long> getLong(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isMissingNode() || target.isNull()) {
			return Optional.empty();
		}
		// BigQuery encodes INT64 as JSON strings
		if (target.isTextual()) {
			try {
				return Optional.of(Long.parseLong(target.asText()));
			}
			catch (NumberFormatException e) {
				return Optional.empty();
			}
		}
		return Optional.of(target.asLong());
	}

	public static boolean getBoolean(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isBoolean() ? target.booleanValue() : Boolean.parseBoolean(target.asText());
	}

	public static List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}
		return List.of();
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
