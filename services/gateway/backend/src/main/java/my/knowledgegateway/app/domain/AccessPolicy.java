package my.knowledgegateway.app.domain;

import java.math.BigDecimal;

public sealed interface AccessPolicy permits AccessPolicy.Open, AccessPolicy.Monetized {

	record Open() implements AccessPolicy {
	}

	record Monetized(String walletAddress, BigDecimal priceUsd) implements AccessPolicy {
	}
}
