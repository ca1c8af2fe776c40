package org.stance.github;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for navigating decoded API objects.
 */
public final class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	private JsonNodeUtils() {
	}

	public static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	public static Optional<Long> getLong(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isNumber() ? Optional.of(target.asLong()) : Optional.empty();
	}

	public static Optional<Instant> getInstant(JsonNode node, String... path) {
		return getString(node, path).flatMap(str -> {
			try {
				return Optional.of(Instant.parse(str));
			}
			catch (DateTimeParseException e) {
				logger.warn("Failed to parse timestamp: {}", str);
				return Optional.empty();
			}
		});
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

	/**
	 * Loose truthiness of a JSON value: {@code false}, {@code null}, missing, zero, the
	 * empty string and {@code "0"} are false; everything else is true.
	 * @param node the value
	 * @return whether the value counts as true
	 */
	public static boolean isTruthy(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return false;
		}
		if (node.isBoolean()) {
			return node.booleanValue();
		}
		if (node.isNumber()) {
			return node.doubleValue() != 0.0;
		}
		if (node.isTextual()) {
			String text = node.textValue();
			return !text.isEmpty() && !"0".equals(text);
		}
		return true;
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
