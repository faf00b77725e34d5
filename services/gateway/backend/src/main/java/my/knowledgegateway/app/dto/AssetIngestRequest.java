package my.knowledgegateway.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import tools.jackson.databind.JsonNode;

import java.math.BigDecimal;

public record AssetIngestRequest(
		@NotBlank String topicId,
		String title,
		String contributionType,
		String walletAddress,
		BigDecimal priceUsd,
		@NotNull JsonNode analysisResult
) {
}
