package my.knowledgegateway.app.service;

import my.knowledgegateway.app.dto.PaymentChallengeDto;

/**
 * Outcome of the payment gate. A challenge is present for every state except {@link PaymentGateState#VERIFIED}.
 */
public record PaymentDecision(
		PaymentGateState state,
		PaymentChallengeDto challenge,
		String paymentResponseHeader
) {
	public boolean granted() {
		return state == PaymentGateState.VERIFIED;
	}

	static PaymentDecision verified(String paymentResponseHeader) {
		return new PaymentDecision(PaymentGateState.VERIFIED, null, paymentResponseHeader);
	}

	static PaymentDecision denied(PaymentGateState state, PaymentChallengeDto challenge) {
		return new PaymentDecision(state, challenge, null);
	}
}
