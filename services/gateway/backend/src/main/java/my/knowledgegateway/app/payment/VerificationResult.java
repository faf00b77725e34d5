package my.knowledgegateway.app.payment;

public record VerificationResult(boolean verified, String error, String payer) {
	public static VerificationResult valid(String payer) {
		return new VerificationResult(true, null, payer);
	}

	public static VerificationResult invalid(String error) {
		return new VerificationResult(false, error, null);
	}
}
