package my.knowledgegateway.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentRequirementsDto(
		String scheme,
		String network,
		String amount,
		String maxAmountRequired,
		String resource,
		String method,
		String payTo,
		String asset,
		String facilitator,
		String description,
		String mimeType,
		Integer maxTimeoutSeconds,
		Map<String, String> extra
) {
}
