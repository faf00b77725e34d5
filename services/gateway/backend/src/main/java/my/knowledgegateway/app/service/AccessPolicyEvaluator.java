package my.knowledgegateway.app.service;

import my.knowledgegateway.app.domain.AccessPolicy;
import my.knowledgegateway.app.domain.ContributionType;
import my.knowledgegateway.app.domain.KnowledgeRecord;
import my.knowledgegateway.app.domain.Monetization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class AccessPolicyEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(AccessPolicyEvaluator.class);

	public AccessPolicy classify(KnowledgeRecord record) {
		if (record == null || record.contributionType() != ContributionType.USER_CONTRIBUTED) {
			return new AccessPolicy.Open();
		}
		Optional<Monetization> terms = record.monetizationTerms();
		if (terms.isEmpty()) {
			logger.warn("Record {} is marked user contributed but has no complete payment terms; serving it open",
					record.topicId());
			return new AccessPolicy.Open();
		}
		Monetization monetization = terms.get();
		return new AccessPolicy.Monetized(monetization.walletAddress(), monetization.priceUsd());
	}
}
