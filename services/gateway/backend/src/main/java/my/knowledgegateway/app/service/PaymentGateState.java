package my.knowledgegateway.app.service;

/**
 * Where a request ended up in the payment exchange.
 */
public enum PaymentGateState {
	CHALLENGE_ISSUED,
	VERIFIED,
	REJECTED
}
