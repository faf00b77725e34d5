package my.knowledgegateway.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetIngestResponseDto(
		boolean success,
		String identifier,
		String error,
		String verificationUrl
) {
}
