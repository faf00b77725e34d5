package my.knowledgegateway.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import my.knowledgegateway.app.domain.AnalysisResult;
import tools.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.List;

public record KnowledgeAssetDto(
		String topicId,
		boolean found,
		int schemaVersion,
		String summary,
		String title,
		String createdAt,
		String identifier,
		String contributionType,
		String walletAddress,
		BigDecimal priceUsd,
		@JsonProperty("isPaywalled") boolean paywalled,
		JsonNode categoryMetrics,
		JsonNode notableInstances,
		String primarySource,
		String secondarySource,
		JsonNode provenance,
		@JsonInclude(JsonInclude.Include.NON_NULL) Integer trustScore,
		AnalysisResult analysisResult,
		@JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> diagnostics
) {
}
