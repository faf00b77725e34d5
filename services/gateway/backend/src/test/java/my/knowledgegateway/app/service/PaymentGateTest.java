package my.knowledgegateway.app.service;

import my.knowledgegateway.app.config.AppProperties;
import my.knowledgegateway.app.domain.AccessPolicy;
import my.knowledgegateway.app.dto.PaymentRequirementsDto;
import my.knowledgegateway.app.payment.PaymentFacilitator;
import my.knowledgegateway.app.payment.PaymentFacilitatorException;
import my.knowledgegateway.app.payment.SettlementResult;
import my.knowledgegateway.app.payment.VerificationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PaymentGateTest {
	private static final AccessPolicy.Monetized POLICY = new AccessPolicy.Monetized("0xseller", new BigDecimal("0.10"));
	private static final ResourceDescriptor RESOURCE = new ResourceDescriptor("GET", "/assets/alpha");

	private final ObjectMapper mapper = new ObjectMapper();
	private final PaymentFacilitator facilitator = mock(PaymentFacilitator.class);
	private PaymentGate gate;

	@AfterEach
	void tearDown() {
		if (gate != null) {
			gate.shutdown();
		}
	}

	@Test
	void missingProofIssuesChallenge() {
		gate = gate(false, 5);

		PaymentDecision decision = gate.evaluate(POLICY, null, RESOURCE);

		assertThat(decision.state()).isEqualTo(PaymentGateState.CHALLENGE_ISSUED);
		assertThat(decision.granted()).isFalse();
		assertThat(decision.challenge().x402Version()).isEqualTo(1);
		assertThat(decision.challenge().error()).contains("X-PAYMENT");
		PaymentRequirementsDto requirements = decision.challenge().accepts().get(0);
		assertThat(requirements.amount()).isEqualTo("0.10");
		assertThat(requirements.maxAmountRequired()).isEqualTo("100000");
		assertThat(requirements.resource()).isEqualTo("/assets/alpha");
		assertThat(requirements.method()).isEqualTo("GET");
		assertThat(requirements.payTo()).isEqualTo("0xseller");
		assertThat(requirements.scheme()).isEqualTo("exact");
		assertThat(requirements.network()).isEqualTo("base-sepolia");
		assertThat(requirements.maxTimeoutSeconds()).isEqualTo(60);
		assertThat(requirements.extra()).containsEntry("name", "USDC");
		verify(facilitator, never()).verify(any(), any());
	}

	@Test
	void malformedProofIsRejectedWithoutCallingFacilitator() {
		gate = gate(false, 5);

		PaymentDecision notBase64 = gate.evaluate(POLICY, "%%%not-base64%%%", RESOURCE);
		PaymentDecision notJson = gate.evaluate(POLICY, encode("not json"), RESOURCE);

		assertThat(notBase64.state()).isEqualTo(PaymentGateState.REJECTED);
		assertThat(notJson.state()).isEqualTo(PaymentGateState.REJECTED);
		assertThat(notJson.challenge().error()).isEqualTo("Invalid payment proof");
		verify(facilitator, never()).verify(any(), any());
	}

	@Test
	void verifiedProofGrantsAccess() {
		gate = gate(false, 5);
		when(facilitator.verify(any(), any())).thenReturn(VerificationResult.valid("0xpayer"));

		PaymentDecision decision = gate.evaluate(POLICY, validProof(), RESOURCE);

		assertThat(decision.state()).isEqualTo(PaymentGateState.VERIFIED);
		assertThat(decision.granted()).isTrue();
		assertThat(decision.challenge()).isNull();
		ArgumentCaptor<PaymentRequirementsDto> captor = ArgumentCaptor.forClass(PaymentRequirementsDto.class);
		verify(facilitator).verify(any(JsonNode.class), captor.capture());
		assertThat(captor.getValue().resource()).isEqualTo("/assets/alpha");
		assertThat(captor.getValue().amount()).isEqualTo("0.10");
		verify(facilitator, never()).settle(any(), any());
	}

	@Test
	void invalidProofIsRejectedWithReason() {
		gate = gate(false, 5);
		when(facilitator.verify(any(), any())).thenReturn(VerificationResult.invalid("invalid_signature"));

		PaymentDecision decision = gate.evaluate(POLICY, validProof(), RESOURCE);

		assertThat(decision.state()).isEqualTo(PaymentGateState.REJECTED);
		assertThat(decision.challenge().error()).isEqualTo("invalid_signature");
		assertThat(decision.challenge().accepts().get(0).amount()).isEqualTo("0.10");
	}

	@Test
	void facilitatorErrorIsRejection() {
		gate = gate(false, 5);
		when(facilitator.verify(any(), any()))
				.thenThrow(new PaymentFacilitatorException("down", new RuntimeException("io")));

		PaymentDecision decision = gate.evaluate(POLICY, validProof(), RESOURCE);

		assertThat(decision.state()).isEqualTo(PaymentGateState.REJECTED);
		assertThat(decision.paymentResponseHeader()).isNull();
	}

	@Test
	void slowFacilitatorTimesOutAndIsCancelled() throws InterruptedException {
		gate = gate(false, 1);
		CountDownLatch interrupted = new CountDownLatch(1);
		when(facilitator.verify(any(), any())).thenAnswer(invocation -> {
			try {
				Thread.sleep(10_000);
			} catch (InterruptedException ex) {
				interrupted.countDown();
			}
			return VerificationResult.valid("0xpayer");
		});

		long started = System.nanoTime();
		PaymentDecision decision = gate.evaluate(POLICY, validProof(), RESOURCE);
		long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

		assertThat(decision.state()).isEqualTo(PaymentGateState.REJECTED);
		assertThat(elapsedMillis).isLessThan(5_000);
		assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
	}

	@Test
	void settlementAddsPaymentResponseHeader() {
		gate = gate(true, 5);
		when(facilitator.verify(any(), any())).thenReturn(VerificationResult.valid("0xpayer"));
		when(facilitator.settle(any(), any()))
				.thenReturn(new SettlementResult(true, "0xtx", "base-sepolia", "0xpayer", null));

		PaymentDecision decision = gate.evaluate(POLICY, validProof(), RESOURCE);

		assertThat(decision.granted()).isTrue();
		JsonNode settlement = mapper.readTree(Base64.getDecoder().decode(decision.paymentResponseHeader()));
		assertThat(settlement.path("success").asBoolean()).isTrue();
		assertThat(settlement.path("transaction").asText()).isEqualTo("0xtx");
	}

	@Test
	void failedSettlementIsRejection() {
		gate = gate(true, 5);
		when(facilitator.verify(any(), any())).thenReturn(VerificationResult.valid("0xpayer"));
		when(facilitator.settle(any(), any())).thenReturn(SettlementResult.failed("nonce_used"));

		PaymentDecision decision = gate.evaluate(POLICY, validProof(), RESOURCE);

		assertThat(decision.state()).isEqualTo(PaymentGateState.REJECTED);
		assertThat(decision.challenge().error()).isEqualTo("nonce_used");
	}

	@Test
	void formatsAmountsWithAtLeastTwoDecimals() {
		assertThat(PaymentGate.formatAmount(new BigDecimal("0.1"))).isEqualTo("0.10");
		assertThat(PaymentGate.formatAmount(new BigDecimal("0.10"))).isEqualTo("0.10");
		assertThat(PaymentGate.formatAmount(new BigDecimal("5"))).isEqualTo("5.00");
		assertThat(PaymentGate.formatAmount(new BigDecimal("100"))).isEqualTo("100.00");
		assertThat(PaymentGate.formatAmount(new BigDecimal("0.125"))).isEqualTo("0.125");
		assertThat(PaymentGate.atomicAmount(new BigDecimal("0.125"))).isEqualTo("125000");
		assertThat(PaymentGate.atomicAmount(new BigDecimal("2"))).isEqualTo("2000000");
	}

	private PaymentGate gate(boolean settle, int verifyTimeoutSeconds) {
		AppProperties properties = new AppProperties(
				new AppProperties.Graph("https://node.example.org:8900", 10, 30),
				new AppProperties.Payment("https://facilitator.example.org", "base-sepolia", "exact",
						"0x036CbD53842c5426634e7929541eC2318f3dCF7e", "USDC", "2", 60, verifyTimeoutSeconds, settle),
				new AppProperties.Search(10, 100));
		return new PaymentGate(properties, facilitator, mapper);
	}

	private String validProof() {
		return encode("{\"x402Version\":1,\"scheme\":\"exact\",\"network\":\"base-sepolia\",\"payload\":{\"signature\":\"0xsig\"}}");
	}

	private static String encode(String value) {
		return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
	}
}
