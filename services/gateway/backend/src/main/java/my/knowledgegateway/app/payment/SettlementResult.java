package my.knowledgegateway.app.payment;

public record SettlementResult(
		boolean success,
		String transaction,
		String network,
		String payer,
		String errorReason
) {
	public static SettlementResult failed(String errorReason) {
		return new SettlementResult(false, null, null, null, errorReason);
	}
}
