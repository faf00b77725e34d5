package my.knowledgegateway.app.domain;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Payment terms of a user-contributed record. Both parts are always present together.
 */
public record Monetization(String walletAddress, BigDecimal priceUsd) {
	public Monetization {
		if (walletAddress == null || walletAddress.isBlank()) {
			throw new IllegalArgumentException("walletAddress is required");
		}
		if (priceUsd == null || priceUsd.signum() <= 0) {
			throw new IllegalArgumentException("priceUsd must be greater than 0");
		}
		walletAddress = walletAddress.trim();
	}

	public static Optional<Monetization> of(String walletAddress, BigDecimal priceUsd) {
		if (walletAddress == null || walletAddress.isBlank() || priceUsd == null || priceUsd.signum() <= 0) {
			return Optional.empty();
		}
		return Optional.of(new Monetization(walletAddress, priceUsd));
	}
}
