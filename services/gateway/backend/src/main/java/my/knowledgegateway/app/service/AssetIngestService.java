package my.knowledgegateway.app.service;

import my.knowledgegateway.app.domain.AnalysisSection;
import my.knowledgegateway.app.domain.ContributionType;
import my.knowledgegateway.app.dto.AssetIngestRequest;
import my.knowledgegateway.app.dto.AssetIngestResponseDto;
import my.knowledgegateway.app.graph.GraphQueryException;
import my.knowledgegateway.app.graph.GraphStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Publishes a finished analysis as a community note. The note is stored as flat JSON-LD: each
 * analysis section and the whole aggregate are kept as JSON strings, with a few quick-access
 * fields extracted for search.
 */
@Service
public class AssetIngestService {
	private static final Logger logger = LoggerFactory.getLogger(AssetIngestService.class);
	private static final String NAMESPACE = "https://dkgpedia.org/schema/";
	private static final String PREFIX = "dkgpedia:";
	private static final int SUMMARY_MAX_LENGTH = 500;

	private final GraphStoreClient graphStoreClient;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	@Autowired
	public AssetIngestService(GraphStoreClient graphStoreClient, ObjectMapper objectMapper) {
		this(graphStoreClient, objectMapper, Clock.systemUTC());
	}

	AssetIngestService(GraphStoreClient graphStoreClient, ObjectMapper objectMapper, Clock clock) {
		this.graphStoreClient = graphStoreClient;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public AssetIngestResponseDto ingest(AssetIngestRequest request) {
		ContributionType contributionType = validate(request);
		ObjectNode document = buildDocument(request, contributionType);

		Optional<String> identifier;
		try {
			identifier = graphStoreClient.publish(document);
		} catch (GraphQueryException ex) {
			logger.warn("Publishing note for topic {} failed: {}", request.topicId(), ex.getMessage());
			throw new AssetIngestException(HttpStatus.BAD_GATEWAY, "Failed to publish knowledge asset.", ex);
		}
		if (identifier.isEmpty()) {
			logger.warn("Graph store returned no identifier for topic {}", request.topicId());
			throw new AssetIngestException(HttpStatus.INTERNAL_SERVER_ERROR,
					"Failed to create knowledge asset: no identifier returned.");
		}
		logger.info("Published note for topic {} as {}", request.topicId(), identifier.get());
		return new AssetIngestResponseDto(true, identifier.get(), null, "/assets/" + request.topicId().trim());
	}

	ContributionType validate(AssetIngestRequest request) {
		if (request.topicId() == null || request.topicId().isBlank()) {
			throw new AssetIngestException(HttpStatus.BAD_REQUEST, "topicId is required");
		}
		ContributionType contributionType = ContributionType.REGULAR;
		if (request.contributionType() != null && !request.contributionType().isBlank()) {
			contributionType = ContributionType.parse(request.contributionType())
					.orElseThrow(() -> new AssetIngestException(HttpStatus.BAD_REQUEST,
							"contributionType must be 'regular' or 'User contributed'"));
		}
		boolean hasWallet = request.walletAddress() != null && !request.walletAddress().isBlank();
		if (contributionType == ContributionType.USER_CONTRIBUTED) {
			if (!hasWallet) {
				throw new AssetIngestException(HttpStatus.BAD_REQUEST,
						"walletAddress is required when contributionType is 'User contributed'");
			}
			if (request.priceUsd() == null || request.priceUsd().signum() <= 0) {
				throw new AssetIngestException(HttpStatus.BAD_REQUEST,
						"priceUsd must be greater than 0 when contributionType is 'User contributed'");
			}
		} else if (hasWallet || request.priceUsd() != null) {
			throw new AssetIngestException(HttpStatus.BAD_REQUEST,
					"walletAddress and priceUsd are only allowed for 'User contributed' notes");
		}
		JsonNode analysis = request.analysisResult();
		if (analysis == null || !analysis.isObject() || !analysis.path("results").isObject()) {
			throw new AssetIngestException(HttpStatus.BAD_REQUEST, "analysisResult is required and must contain results");
		}
		return contributionType;
	}

	ObjectNode buildDocument(AssetIngestRequest request, ContributionType contributionType) {
		JsonNode analysis = request.analysisResult();
		JsonNode results = analysis.path("results");
		String now = Instant.now(clock).toString();
		String topicId = request.topicId().trim();

		ObjectNode document = objectMapper.createObjectNode();
		document.putObject("@context").put("dkgpedia", NAMESPACE);
		document.put("@type", PREFIX + "CommunityNote");
		document.put(PREFIX + "topicId", topicId);
		document.put(PREFIX + "name", firstNonBlank(request.title(), text(analysis, "topic"), topicId));
		document.put(PREFIX + "dateCreated", now);
		document.put(PREFIX + "contributionType", contributionType.marker());

		document.put(PREFIX + "summary", summary(results.path(AnalysisSection.JUDGING.key())));
		JsonNode triple = results.path(AnalysisSection.TRIPLE.key());
		JsonNode entityCoherence = triple.path("entity_coherence");
		JsonNode contradictions = triple.path("contradictions").path("contradictions");
		document.put(PREFIX + "categoryMetrics",
				entityCoherence.isMissingNode() || entityCoherence.isNull() ? "{}" : json(entityCoherence));
		document.put(PREFIX + "notableInstances",
				contradictions.isMissingNode() || contradictions.isNull() ? "[]" : json(contradictions));
		JsonNode fetch = results.path(AnalysisSection.FETCH.key());
		document.put(PREFIX + "primarySource", source(fetch, "grokipedia"));
		document.put(PREFIX + "secondarySource", source(fetch, "wikipedia"));

		document.put(PREFIX + "analysisResult", json(analysis));
		for (AnalysisSection section : AnalysisSection.values()) {
			JsonNode value = results.get(section.key());
			if (value != null && !value.isNull()) {
				document.put(PREFIX + section.storeField(), json(value));
			}
		}

		putIfPresent(document, "analysisId", analysis.get("analysis_id"));
		putIfPresent(document, "analysisStatus", analysis.get("status"));
		JsonNode steps = analysis.get("steps_completed");
		if (steps != null && !steps.isNull()) {
			document.put(PREFIX + "stepsCompleted", json(steps));
		}
		putIfPresent(document, "executionTimeSeconds", analysis.get("execution_time_seconds"));
		document.put(PREFIX + "analysisTimestamp", firstNonBlank(text(analysis, "timestamp"), now));
		JsonNode imageUrls = analysis.get("image_urls");
		document.put(PREFIX + "imageUrls", imageUrls == null || imageUrls.isNull() ? "{}" : json(imageUrls));

		if (contributionType == ContributionType.USER_CONTRIBUTED) {
			document.put(PREFIX + "walletAddress", request.walletAddress().trim());
			document.put(PREFIX + "priceUsd", request.priceUsd());
		}
		return document;
	}

	private String summary(JsonNode judging) {
		String preview = text(judging, "report_preview");
		if (preview != null) {
			return preview;
		}
		String report = text(judging, "full_report");
		if (report != null) {
			return report.length() > SUMMARY_MAX_LENGTH ? report.substring(0, SUMMARY_MAX_LENGTH) : report;
		}
		return "Analysis completed";
	}

	private String source(JsonNode fetch, String name) {
		String nested = text(fetch.path(name).path("files"), name);
		if (nested != null) {
			return nested;
		}
		String flat = text(fetch.path("files"), name);
		return flat == null ? "" : flat;
	}

	private void putIfPresent(ObjectNode document, String field, JsonNode value) {
		if (value != null && !value.isNull() && !value.isMissingNode()) {
			document.set(PREFIX + field, value);
		}
	}

	private String json(JsonNode value) {
		return objectMapper.writeValueAsString(value);
	}

	private static String text(JsonNode node, String field) {
		if (node == null) {
			return null;
		}
		JsonNode value = node.get(field);
		if (value == null || value.isNull() || value.isObject() || value.isArray()) {
			return null;
		}
		String text = value.asText();
		return text.isBlank() ? null : text;
	}

	private static String firstNonBlank(String... values) {
		for (String value : values) {
			if (value != null && !value.isBlank()) {
				return value;
			}
		}
		return null;
	}
}
