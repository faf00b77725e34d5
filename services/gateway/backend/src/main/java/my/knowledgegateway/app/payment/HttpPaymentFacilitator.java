package my.knowledgegateway.app.payment;

import my.knowledgegateway.app.dto.PaymentRequirementsDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class HttpPaymentFacilitator implements PaymentFacilitator {
	private static final Logger logger = LoggerFactory.getLogger(HttpPaymentFacilitator.class);
	private static final int X402_VERSION = 1;

	private final RestClient restClient;

	public HttpPaymentFacilitator(String baseUrl, Duration timeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(timeout);
		requestFactory.setReadTimeout(timeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
				.build();
	}

	@Override
	public VerificationResult verify(JsonNode paymentPayload, PaymentRequirementsDto requirements) {
		Map<?, ?> response;
		try {
			response = post("/verify", paymentPayload, requirements);
		} catch (HttpClientErrorException ex) {
			logger.warn("Facilitator rejected verification with status {}", ex.getStatusCode().value());
			return VerificationResult.invalid("Payment verification rejected");
		}
		if (response == null) {
			return VerificationResult.invalid("Empty verification response");
		}
		if (Boolean.TRUE.equals(response.get("isValid"))) {
			return VerificationResult.valid(asString(response.get("payer")));
		}
		String reason = asString(response.get("invalidReason"));
		return VerificationResult.invalid(reason == null ? "Payment verification failed" : reason);
	}

	@Override
	public SettlementResult settle(JsonNode paymentPayload, PaymentRequirementsDto requirements) {
		Map<?, ?> response;
		try {
			response = post("/settle", paymentPayload, requirements);
		} catch (HttpClientErrorException ex) {
			logger.warn("Facilitator rejected settlement with status {}", ex.getStatusCode().value());
			return SettlementResult.failed("Payment settlement rejected");
		}
		if (response == null) {
			return SettlementResult.failed("Empty settlement response");
		}
		boolean success = Boolean.TRUE.equals(response.get("success"));
		String errorReason = asString(response.get("errorReason"));
		if (!success && errorReason == null) {
			errorReason = "Payment settlement failed";
		}
		return new SettlementResult(
				success,
				asString(response.get("transaction")),
				asString(response.get("network")),
				asString(response.get("payer")),
				success ? null : errorReason
		);
	}

	private Map<?, ?> post(String path, JsonNode paymentPayload, PaymentRequirementsDto requirements) {
		Map<String, Object> request = new LinkedHashMap<>();
		request.put("x402Version", X402_VERSION);
		request.put("paymentPayload", paymentPayload);
		request.put("paymentRequirements", requirements);
		try {
			return restClient.post()
					.uri(path)
					.body(request)
					.retrieve()
					.body(Map.class);
		} catch (HttpClientErrorException ex) {
			throw ex;
		} catch (RestClientException ex) {
			throw new PaymentFacilitatorException("Facilitator call " + path + " failed", ex);
		}
	}

	private String asString(Object value) {
		if (value == null) {
			return null;
		}
		String text = value.toString();
		return text.isBlank() ? null : text;
	}
}
