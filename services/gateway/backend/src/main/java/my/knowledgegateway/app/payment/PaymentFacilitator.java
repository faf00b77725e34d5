package my.knowledgegateway.app.payment;

import my.knowledgegateway.app.dto.PaymentRequirementsDto;
import tools.jackson.databind.JsonNode;

/**
 * External service that checks and settles payment proofs. The gateway never inspects a proof
 * cryptographically and keeps no replay state; both belong here.
 */
public interface PaymentFacilitator {
	VerificationResult verify(JsonNode paymentPayload, PaymentRequirementsDto requirements);

	SettlementResult settle(JsonNode paymentPayload, PaymentRequirementsDto requirements);
}
