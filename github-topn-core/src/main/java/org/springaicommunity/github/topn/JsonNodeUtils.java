package org.springaicommunity.github.topn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Strict JsonNode access for decoding GitHub responses. Missing or mistyped fields fail
 * with {@link ResponseDecodingException} instead of defaulting.
 */
public final class JsonNodeUtils {

	private JsonNodeUtils() {
	}

	public static JsonNode readTree(ObjectMapper objectMapper, String json, String what) {
		try {
			JsonNode node = objectMapper.readTree(json);
			if (node == null || node.isMissingNode()) {
				throw new ResponseDecodingException("Empty " + what + " response");
			}
			return node;
		}
		catch (JsonProcessingException e) {
			throw new ResponseDecodingException("Malformed " + what + " response: " + e.getOriginalMessage(), e);
		}
	}

	public static JsonNode requireArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (!target.isArray()) {
			throw new ResponseDecodingException("Expected array at '" + String.join(".", path) + "'");
		}
		return target;
	}

	public static JsonNode requireObject(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (!target.isObject()) {
			throw new ResponseDecodingException("Expected object at '" + String.join(".", path) + "'");
		}
		return target;
	}

	public static String requireText(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (!target.isTextual()) {
			throw new ResponseDecodingException("Expected string at '" + String.join(".", path) + "'");
		}
		return target.asText();
	}

	public static int requireInt(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (!target.isIntegralNumber() || !target.canConvertToInt()) {
			throw new ResponseDecodingException("Expected integer at '" + String.join(".", path) + "'");
		}
		return target.asInt();
	}

	public static boolean requireBoolean(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (!target.isBoolean()) {
			throw new ResponseDecodingException("Expected boolean at '" + String.join(".", path) + "'");
		}
		return target.asBoolean();
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
