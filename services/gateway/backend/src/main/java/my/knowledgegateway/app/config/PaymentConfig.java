package my.knowledgegateway.app.config;

import my.knowledgegateway.app.payment.HttpPaymentFacilitator;
import my.knowledgegateway.app.payment.PaymentFacilitator;
import my.knowledgegateway.app.payment.RejectingPaymentFacilitator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class PaymentConfig {
	private static final Logger logger = LoggerFactory.getLogger(PaymentConfig.class);

	@Bean
	public PaymentFacilitator paymentFacilitator(AppProperties properties) {
		AppProperties.Payment payment = properties.payment();
		String facilitatorUrl = payment == null ? null : payment.facilitatorUrl();
		if (facilitatorUrl == null || facilitatorUrl.isBlank()) {
			logger.info("Payment facilitator disabled; monetized records cannot be unlocked.");
			return new RejectingPaymentFacilitator();
		}
		int timeout = payment.verifyTimeoutSeconds() == null ? 15 : Math.max(1, payment.verifyTimeoutSeconds());
		logger.info("Payment facilitator enabled (url={}, network={}).", facilitatorUrl, payment.network());
		return new HttpPaymentFacilitator(facilitatorUrl.trim(), Duration.ofSeconds(timeout));
	}
}
