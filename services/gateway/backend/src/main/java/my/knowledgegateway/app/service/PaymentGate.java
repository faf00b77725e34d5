package my.knowledgegateway.app.service;

import jakarta.annotation.PreDestroy;
import my.knowledgegateway.app.config.AppProperties;
import my.knowledgegateway.app.domain.AccessPolicy;
import my.knowledgegateway.app.dto.PaymentChallengeDto;
import my.knowledgegateway.app.dto.PaymentRequirementsDto;
import my.knowledgegateway.app.payment.PaymentFacilitator;
import my.knowledgegateway.app.payment.SettlementResult;
import my.knowledgegateway.app.payment.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pay-per-access gate for monetized records, speaking the x402 challenge/response protocol.
 * <p>
 * A request without a proof receives a 402 challenge describing the payment requirements. A proof
 * is forwarded to the facilitator together with the same requirements, bound to the request's
 * method and path; only a verified (and, when enabled, settled) payment grants access. Every
 * failure, including facilitator errors, timeouts and interruption, is a rejection. The gate keeps
 * no state between requests.
 */
@Component
public class PaymentGate {
	public static final String PAYMENT_HEADER = "X-PAYMENT";
	public static final String PAYMENT_RESPONSE_HEADER = "X-PAYMENT-RESPONSE";

	private static final Logger logger = LoggerFactory.getLogger(PaymentGate.class);
	private static final int X402_VERSION = 1;
	private static final int ASSET_DECIMALS = 6;
	private static final int DEFAULT_MAX_TIMEOUT_SECONDS = 60;
	private static final int DEFAULT_VERIFY_TIMEOUT_SECONDS = 15;
	private static final String MISSING_PROOF = "X-PAYMENT header is required";

	private final AppProperties.Payment properties;
	private final PaymentFacilitator facilitator;
	private final ObjectMapper objectMapper;
	private final ExecutorService executor = Executors.newCachedThreadPool();

	public PaymentGate(AppProperties properties, PaymentFacilitator facilitator, ObjectMapper objectMapper) {
		this.properties = properties.payment();
		this.facilitator = facilitator;
		this.objectMapper = objectMapper;
	}

	public PaymentDecision evaluate(AccessPolicy.Monetized policy, String paymentHeader, ResourceDescriptor resource) {
		PaymentRequirementsDto requirements = requirements(policy, resource);
		if (paymentHeader == null || paymentHeader.isBlank()) {
			return PaymentDecision.denied(PaymentGateState.CHALLENGE_ISSUED, challenge(MISSING_PROOF, requirements));
		}

		Optional<JsonNode> proof = decodeProof(paymentHeader);
		if (proof.isEmpty()) {
			logger.warn("Malformed payment proof for {}", resource);
			return reject("Invalid payment proof", requirements);
		}

		Optional<VerificationResult> verification = callFacilitator("verify", resource,
				() -> facilitator.verify(proof.get(), requirements));
		if (verification.isEmpty()) {
			return reject("Payment verification unavailable", requirements);
		}
		if (!verification.get().verified()) {
			String reason = verification.get().error() == null ? "Payment verification failed" : verification.get().error();
			logger.info("Payment rejected for {}: {}", resource, reason);
			return reject(reason, requirements);
		}

		if (!settlementEnabled()) {
			logger.info("Payment verified for {} (payer={})", resource, verification.get().payer());
			return PaymentDecision.verified(null);
		}
		Optional<SettlementResult> settlement = callFacilitator("settle", resource,
				() -> facilitator.settle(proof.get(), requirements));
		if (settlement.isEmpty()) {
			return reject("Payment settlement unavailable", requirements);
		}
		if (!settlement.get().success()) {
			String reason = settlement.get().errorReason() == null ? "Payment settlement failed" : settlement.get().errorReason();
			logger.info("Payment settlement failed for {}: {}", resource, reason);
			return reject(reason, requirements);
		}
		logger.info("Payment settled for {} (transaction={})", resource, settlement.get().transaction());
		return PaymentDecision.verified(encodeSettlement(settlement.get()));
	}

	public PaymentRequirementsDto requirements(AccessPolicy.Monetized policy, ResourceDescriptor resource) {
		Map<String, String> extra = null;
		if (properties.assetName() != null && !properties.assetName().isBlank()) {
			extra = new LinkedHashMap<>();
			extra.put("name", properties.assetName());
			extra.put("version", properties.assetVersion() == null ? "" : properties.assetVersion());
		}
		return new PaymentRequirementsDto(
				properties.scheme(),
				properties.network(),
				formatAmount(policy.priceUsd()),
				atomicAmount(policy.priceUsd()),
				resource.path(),
				resource.method(),
				policy.walletAddress(),
				properties.asset(),
				properties.facilitatorUrl(),
				"Access to " + resource,
				"application/json",
				properties.maxTimeoutSeconds() == null ? DEFAULT_MAX_TIMEOUT_SECONDS : properties.maxTimeoutSeconds(),
				extra
		);
	}

	/**
	 * Price as shown in the challenge: at least two decimals, never rounded.
	 */
	static String formatAmount(BigDecimal price) {
		BigDecimal stripped = price.stripTrailingZeros();
		int scale = Math.max(2, stripped.scale());
		return stripped.setScale(scale, RoundingMode.UNNECESSARY).toPlainString();
	}

	static String atomicAmount(BigDecimal price) {
		return price.movePointRight(ASSET_DECIMALS).setScale(0, RoundingMode.HALF_UP).toPlainString();
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private boolean settlementEnabled() {
		return properties.settle();
	}

	private PaymentDecision reject(String reason, PaymentRequirementsDto requirements) {
		return PaymentDecision.denied(PaymentGateState.REJECTED, challenge(reason, requirements));
	}

	private PaymentChallengeDto challenge(String error, PaymentRequirementsDto requirements) {
		return new PaymentChallengeDto(X402_VERSION, error, List.of(requirements));
	}

	private Optional<JsonNode> decodeProof(String header) {
		byte[] bytes;
		try {
			bytes = Base64.getDecoder().decode(header.trim());
		} catch (IllegalArgumentException ex) {
			return Optional.empty();
		}
		try {
			JsonNode node = objectMapper.readTree(bytes);
			return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
		} catch (JacksonException ex) {
			return Optional.empty();
		}
	}

	private String encodeSettlement(SettlementResult settlement) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("success", settlement.success());
		body.put("transaction", settlement.transaction());
		body.put("network", settlement.network());
		body.put("payer", settlement.payer());
		byte[] json = objectMapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
		return Base64.getEncoder().encodeToString(json);
	}

	private <T> Optional<T> callFacilitator(String operation, ResourceDescriptor resource, Callable<T> call) {
		Future<T> future;
		try {
			future = executor.submit(call);
		} catch (RejectedExecutionException ex) {
			logger.warn("Facilitator {} not attempted for {}: executor shut down", operation, resource);
			return Optional.empty();
		}
		try {
			return Optional.ofNullable(future.get(verifyTimeoutSeconds(), TimeUnit.SECONDS));
		} catch (TimeoutException ex) {
			future.cancel(true);
			logger.warn("Facilitator {} timed out for {}", operation, resource);
			return Optional.empty();
		} catch (InterruptedException ex) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			logger.warn("Facilitator {} interrupted for {}", operation, resource);
			return Optional.empty();
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause() == null ? ex : ex.getCause();
			logger.warn("Facilitator {} failed for {}: {}", operation, resource, cause.getMessage());
			return Optional.empty();
		}
	}

	private long verifyTimeoutSeconds() {
		Integer configured = properties.verifyTimeoutSeconds();
		return configured == null || configured <= 0 ? DEFAULT_VERIFY_TIMEOUT_SECONDS : configured;
	}
}
