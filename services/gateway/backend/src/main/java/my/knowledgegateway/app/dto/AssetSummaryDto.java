package my.knowledgegateway.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tools.jackson.databind.JsonNode;

import java.math.BigDecimal;

public record AssetSummaryDto(
		String topicId,
		String title,
		String summary,
		String createdAt,
		String identifier,
		String contributionType,
		String walletAddress,
		BigDecimal priceUsd,
		@JsonProperty("isPaywalled") boolean paywalled,
		@JsonInclude(JsonInclude.Include.NON_NULL) JsonNode categoryMetrics,
		@JsonInclude(JsonInclude.Include.NON_NULL) JsonNode notableInstances,
		String primarySource,
		String secondarySource,
		String analysisStatus
) {
}
