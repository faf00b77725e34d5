package my.knowledgegateway.app.payment;

import my.knowledgegateway.app.dto.PaymentRequirementsDto;
import tools.jackson.databind.JsonNode;

public class RejectingPaymentFacilitator implements PaymentFacilitator {
	private static final String REASON = "Payment facilitator not configured";

	@Override
	public VerificationResult verify(JsonNode paymentPayload, PaymentRequirementsDto requirements) {
		return VerificationResult.invalid(REASON);
	}

	@Override
	public SettlementResult settle(JsonNode paymentPayload, PaymentRequirementsDto requirements) {
		return SettlementResult.failed(REASON);
	}
}
