package my.knowledgegateway.app.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tools.jackson.databind.JsonNode;

import java.util.List;

public record AnalysisResult(
		@JsonProperty("status") String status,
		@JsonProperty("analysis_id") String analysisId,
		@JsonProperty("topic") String topic,
		@JsonProperty("steps_completed") List<String> stepsCompleted,
		@JsonProperty("image_urls") @JsonInclude(JsonInclude.Include.NON_NULL) JsonNode imageUrls,
		@JsonProperty("results") AnalysisSections results,
		@JsonProperty("errors") List<String> errors,
		@JsonProperty("execution_time_seconds") double executionTimeSeconds,
		@JsonProperty("timestamp") String timestamp
) {
	public AnalysisResult {
		stepsCompleted = stepsCompleted == null ? List.of() : List.copyOf(stepsCompleted);
		errors = errors == null ? List.of() : List.copyOf(errors);
		results = results == null ? AnalysisSections.empty() : results;
	}
}
