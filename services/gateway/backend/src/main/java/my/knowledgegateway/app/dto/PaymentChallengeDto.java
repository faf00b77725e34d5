package my.knowledgegateway.app.dto;

import java.util.List;

public record PaymentChallengeDto(
		int x402Version,
		String error,
		List<PaymentRequirementsDto> accepts
) {
}
