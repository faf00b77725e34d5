package my.knowledgegateway.app.payment;

public class PaymentFacilitatorException extends RuntimeException {
	public PaymentFacilitatorException(String message, Throwable cause) {
		super(message, cause);
	}
}
