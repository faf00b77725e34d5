package my.knowledgegateway.app.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.Optional;

/**
 * Recovers JSON values from strings that crossed several serialization boundaries: clean JSON,
 * JSON wrapped in quotes, JSON encoded twice, or JSON with trailing or leading garbage.
 * Decoding never throws; callers either get a value or their fallback.
 */
@Component
public class PayloadDecoder {
	private static final Logger logger = LoggerFactory.getLogger(PayloadDecoder.class);
	private static final int DIAGNOSTIC_MIN_LENGTH = 10;
	private static final int DIAGNOSTIC_PREVIEW_CHARS = 200;

	private final ObjectMapper jsonMapper;

	public PayloadDecoder() {
		this.jsonMapper = JsonMapper.builder()
				.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
				.build();
	}

	public JsonNode decode(JsonNode raw, JsonNode fallback) {
		if (raw == null || raw.isNull() || raw.isMissingNode()) {
			return fallback;
		}
		if (!raw.isTextual()) {
			return raw;
		}
		return decode(raw.asText(), fallback);
	}

	public JsonNode decode(String raw, JsonNode fallback) {
		Optional<JsonNode> decoded = tryDecode(raw);
		if (decoded.isPresent()) {
			return decoded.get();
		}
		if (raw != null && raw.length() > DIAGNOSTIC_MIN_LENGTH) {
			logger.warn("Failed to decode payload after all attempts, using fallback (length={}, preview={})",
					raw.length(), preview(raw));
		}
		return fallback;
	}

	public Optional<JsonNode> tryDecode(String raw) {
		if (raw == null || raw.isBlank()) {
			return Optional.empty();
		}
		String cleaned = raw.trim();
		Optional<JsonNode> result = parseLayers(cleaned);
		if (result.isPresent()) {
			return result;
		}
		if (isQuoted(cleaned)) {
			cleaned = cleaned.substring(1, cleaned.length() - 1);
			result = parseLayers(cleaned);
			if (result.isPresent()) {
				return result;
			}
		}
		return scanForEmbeddedJson(cleaned);
	}

	private Optional<JsonNode> parseLayers(String text) {
		if (isQuoted(text)) {
			Optional<JsonNode> outer = parse(text);
			if (outer.isPresent()) {
				if (!outer.get().isTextual()) {
					return outer;
				}
				Optional<JsonNode> inner = parse(outer.get().asText());
				if (inner.isPresent()) {
					return inner;
				}
			}
		}
		return parse(text);
	}

	/**
	 * Captures the first balanced object or array, honouring string literals and escapes,
	 * and parses only that slice.
	 */
	private Optional<JsonNode> scanForEmbeddedJson(String text) {
		int brace = text.indexOf('{');
		int bracket = text.indexOf('[');
		int start = brace >= 0 && (bracket < 0 || brace < bracket) ? brace : bracket;
		if (start < 0) {
			return Optional.empty();
		}
		int depth = 0;
		boolean inString = false;
		boolean escapeNext = false;
		for (int i = start; i < text.length(); i++) {
			char c = text.charAt(i);
			if (escapeNext) {
				escapeNext = false;
				continue;
			}
			if (c == '\\') {
				escapeNext = true;
				continue;
			}
			if (c == '"') {
				inString = !inString;
				continue;
			}
			if (inString) {
				continue;
			}
			if (c == '{' || c == '[') {
				depth++;
			} else if (c == '}' || c == ']') {
				depth--;
				if (depth == 0) {
					return parse(text.substring(start, i + 1));
				}
			}
		}
		return Optional.empty();
	}

	private Optional<JsonNode> parse(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		try {
			JsonNode node = jsonMapper.readTree(text);
			if (node == null || node.isMissingNode()) {
				return Optional.empty();
			}
			return Optional.of(node);
		} catch (JacksonException ex) {
			return Optional.empty();
		}
	}

	private static boolean isQuoted(String text) {
		if (text.length() < 2) {
			return false;
		}
		char first = text.charAt(0);
		char last = text.charAt(text.length() - 1);
		return (first == '"' && last == '"') || (first == '\'' && last == '\'');
	}

	private static String preview(String raw) {
		return raw.length() <= DIAGNOSTIC_PREVIEW_CHARS ? raw : raw.substring(0, DIAGNOSTIC_PREVIEW_CHARS);
	}
}
