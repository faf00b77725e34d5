package my.knowledgegateway.app.util;

import tools.jackson.databind.JsonNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns graph query result cells into clean strings. Cells are either plain values or
 * {@code {"value": ...}} wrappers; string literals may still carry the store's quoting,
 * a datatype annotation ({@code "text"^^<iri>}) or a language tag.
 */
public final class LiteralNormalizer {
	private static final Pattern TYPED_LITERAL = Pattern.compile(
			"^(?:\"(.*)\"|([^\"]*?))\\^\\^(?:<[^>]*>|[^\\s\"<>^]+)$", Pattern.DOTALL);
	private static final Pattern LANGUAGE_LITERAL = Pattern.compile(
			"^\"(.*)\"@[A-Za-z]+(?:-[A-Za-z0-9]+)*$", Pattern.DOTALL);
	private static final int MAX_WRAPPER_DEPTH = 16;

	public enum Mode {
		/** Human readable text: every standard escape sequence is resolved. */
		DISPLAY,
		/** Embedded JSON: only the store's own quoting layer is removed. */
		PAYLOAD
	}

	private LiteralNormalizer() {
	}

	public static String normalize(JsonNode cell, Mode mode) {
		return normalize(cell, mode, 0);
	}

	public static String normalize(String value, Mode mode) {
		if (value == null || value.isEmpty()) {
			return "";
		}
		String clean = stripLiteralSyntax(value);
		if (mode == Mode.PAYLOAD) {
			return carriesStoreEscaping(clean) ? unescapeQuotingLayer(clean) : clean;
		}
		return unescapeAll(clean);
	}

	private static String normalize(JsonNode cell, Mode mode, int depth) {
		if (cell == null || cell.isNull() || cell.isMissingNode()) {
			return "";
		}
		if (cell.isObject()) {
			JsonNode nested = cell.get("value");
			if (nested == null) {
				return cell.toString();
			}
			return depth >= MAX_WRAPPER_DEPTH ? "" : normalize(nested, mode, depth + 1);
		}
		if (cell.isTextual()) {
			return normalize(cell.asText(), mode);
		}
		if (cell.isArray()) {
			return cell.toString();
		}
		return cell.asText();
	}

	private static String stripLiteralSyntax(String value) {
		Matcher typed = TYPED_LITERAL.matcher(value);
		if (typed.matches()) {
			return typed.group(1) != null ? typed.group(1) : stripOuterQuotes(typed.group(2));
		}
		Matcher language = LANGUAGE_LITERAL.matcher(value);
		if (language.matches()) {
			return language.group(1);
		}
		return stripOuterQuotes(value);
	}

	private static String stripOuterQuotes(String value) {
		if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
			return value.substring(1, value.length() - 1);
		}
		return value;
	}

	/**
	 * The store escapes a literal all-or-nothing: either every quote character is escaped or
	 * none is. A bare quote therefore means the text is already clean.
	 */
	static boolean carriesStoreEscaping(String value) {
		boolean sawEscapedQuote = false;
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\\' && i + 1 < value.length()) {
				if (value.charAt(i + 1) == '"') {
					sawEscapedQuote = true;
				}
				i++;
				continue;
			}
			if (c == '"') {
				return false;
			}
		}
		return sawEscapedQuote;
	}

	private static String unescapeQuotingLayer(String value) {
		StringBuilder out = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\\' && i + 1 < value.length()) {
				char next = value.charAt(i + 1);
				if (next == '"' || next == '\\') {
					out.append(next);
					i++;
					continue;
				}
			}
			out.append(c);
		}
		return out.toString();
	}

	private static String unescapeAll(String value) {
		if (value.indexOf('\\') < 0) {
			return value;
		}
		StringBuilder out = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c != '\\' || i + 1 >= value.length()) {
				out.append(c);
				continue;
			}
			char next = value.charAt(i + 1);
			switch (next) {
				case '"' -> out.append('"');
				case '\\' -> out.append('\\');
				case 'n' -> out.append('\n');
				case 'r' -> out.append('\r');
				case 't' -> out.append('\t');
				default -> {
					out.append(c);
					out.append(next);
				}
			}
			i++;
		}
		return out.toString();
	}
}
