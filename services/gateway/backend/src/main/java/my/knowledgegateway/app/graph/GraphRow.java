package my.knowledgegateway.app.graph;

import tools.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a SELECT result, keyed by query variable name. Cells are kept exactly as the
 * store returned them.
 */
public record GraphRow(Map<String, JsonNode> cells) {
	public GraphRow {
		cells = cells == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cells));
	}

	/**
	 * Returns the first present cell among the given variable names, or {@code null}.
	 */
	public JsonNode cell(String... names) {
		for (String name : names) {
			JsonNode value = cells.get(name);
			if (value != null && !value.isNull() && !value.isMissingNode()) {
				return value;
			}
		}
		return null;
	}
}
