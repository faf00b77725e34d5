package my.knowledgegateway.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.JsonNodeFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enum-keyed view over the seven analysis sections. Every section is always present; a section
 * without data holds an empty JSON object, never {@code null}.
 */
public final class AnalysisSections {
	private final Map<AnalysisSection, JsonNode> sections;

	private AnalysisSections(Map<AnalysisSection, JsonNode> sections) {
		this.sections = Collections.unmodifiableMap(sections);
	}

	public static AnalysisSections of(Map<AnalysisSection, JsonNode> provided) {
		EnumMap<AnalysisSection, JsonNode> filled = new EnumMap<>(AnalysisSection.class);
		for (AnalysisSection section : AnalysisSection.values()) {
			JsonNode value = provided == null ? null : provided.get(section);
			if (value == null || value.isNull() || value.isMissingNode()) {
				value = JsonNodeFactory.instance.objectNode();
			}
			filled.put(section, value);
		}
		return new AnalysisSections(filled);
	}

	public static AnalysisSections empty() {
		return of(Map.of());
	}

	public JsonNode get(AnalysisSection section) {
		return sections.get(section);
	}

	public boolean isEmpty(AnalysisSection section) {
		JsonNode value = sections.get(section);
		return value.isObject() && value.isEmpty();
	}

	@JsonValue
	public Map<String, JsonNode> asMap() {
		Map<String, JsonNode> result = new LinkedHashMap<>();
		for (Map.Entry<AnalysisSection, JsonNode> entry : sections.entrySet()) {
			result.put(entry.getKey().key(), entry.getValue());
		}
		return result;
	}
}
