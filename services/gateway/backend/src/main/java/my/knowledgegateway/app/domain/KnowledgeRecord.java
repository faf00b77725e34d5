package my.knowledgegateway.app.domain;

import tools.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Canonical, fully assembled knowledge record (schema version 2).
 * Records are never modified after publication; the gateway only reshapes them for responses.
 */
public record KnowledgeRecord(
		String topicId,
		String identifier,
		String title,
		String summary,
		String createdAt,
		ContributionType contributionType,
		Monetization monetization,
		JsonNode categoryMetrics,
		JsonNode notableInstances,
		String primarySource,
		String secondarySource,
		JsonNode provenance,
		Integer trustScore,
		AnalysisResult analysis
) {
	public static final int SCHEMA_VERSION = 2;

	public KnowledgeRecord {
		contributionType = contributionType == null ? ContributionType.REGULAR : contributionType;
		if (monetization != null && contributionType != ContributionType.USER_CONTRIBUTED) {
			throw new IllegalArgumentException("Monetization requires a user-contributed record");
		}
	}

	public Optional<Monetization> monetizationTerms() {
		return Optional.ofNullable(monetization);
	}
}
