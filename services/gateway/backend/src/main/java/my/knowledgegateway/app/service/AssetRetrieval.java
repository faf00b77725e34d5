package my.knowledgegateway.app.service;

import my.knowledgegateway.app.dto.KnowledgeAssetDto;
import my.knowledgegateway.app.dto.PaymentChallengeDto;

/**
 * Result of a single-record lookup: either the full record, or a payment challenge and no record.
 */
public final class AssetRetrieval {
	private final KnowledgeAssetDto asset;
	private final PaymentChallengeDto challenge;
	private final String paymentResponseHeader;

	private AssetRetrieval(KnowledgeAssetDto asset, PaymentChallengeDto challenge, String paymentResponseHeader) {
		this.asset = asset;
		this.challenge = challenge;
		this.paymentResponseHeader = paymentResponseHeader;
	}

	public static AssetRetrieval granted(KnowledgeAssetDto asset, String paymentResponseHeader) {
		return new AssetRetrieval(asset, null, paymentResponseHeader);
	}

	public static AssetRetrieval paymentRequired(PaymentChallengeDto challenge) {
		return new AssetRetrieval(null, challenge, null);
	}

	public boolean isPaymentRequired() {
		return challenge != null;
	}

	public KnowledgeAssetDto getAsset() {
		return asset;
	}

	public PaymentChallengeDto getChallenge() {
		return challenge;
	}

	public String getPaymentResponseHeader() {
		return paymentResponseHeader;
	}
}
