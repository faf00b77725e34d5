package my.knowledgegateway.app.service;

import my.knowledgegateway.app.domain.AnalysisResult;
import my.knowledgegateway.app.domain.AnalysisSection;
import my.knowledgegateway.app.domain.AnalysisSections;
import my.knowledgegateway.app.domain.ContributionType;
import my.knowledgegateway.app.domain.KnowledgeRecord;
import my.knowledgegateway.app.domain.Monetization;
import my.knowledgegateway.app.graph.GraphRow;
import my.knowledgegateway.app.util.LiteralNormalizer;
import my.knowledgegateway.app.util.PayloadDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one canonical record out of the redundant representations the store keeps.
 * <p>
 * Analysis sections resolve in this order: the aggregate payload's {@code results}, the dedicated
 * per-section field, the published asset's public assertion, and finally an empty object. The
 * asset lookup happens at most once per record and only if some field needs it. Nothing here
 * throws on bad data; every fallback and every unparseable field is reported as a diagnostic.
 */
@Component
public class RecordAssembler {
	private static final Logger logger = LoggerFactory.getLogger(RecordAssembler.class);

	private final PayloadDecoder payloadDecoder;
	private final Clock clock;

	@Autowired
	public RecordAssembler(PayloadDecoder payloadDecoder) {
		this(payloadDecoder, Clock.systemUTC());
	}

	RecordAssembler(PayloadDecoder payloadDecoder, Clock clock) {
		this.payloadDecoder = payloadDecoder;
		this.clock = clock;
	}

	public AssembledRecord assemble(GraphRow row, String requestedTopicId, AssetDetailsSource detailsSource) {
		Assembly assembly = new Assembly(row, detailsSource == null ? AssetDetailsSource.none() : detailsSource);

		String topicId = firstNonBlank(assembly.text("topicId"), requestedTopicId);
		String title = assembly.text("title");
		String createdAt = assembly.text("createdAt");
		String identifier = assembly.identifier();

		ContributionType contributionType = ContributionType.fromMarker(
				assembly.text("contributionType", "contribution_type"));
		String walletAddress = assembly.text("walletAddress", "wallet_address");
		BigDecimal priceUsd = assembly.decimal("priceUsd", "price_usd");
		Monetization monetization = contributionType == ContributionType.USER_CONTRIBUTED
				? Monetization.of(walletAddress, priceUsd).orElse(null)
				: null;

		JsonNode categoryMetrics = assembly.payloadWithDetails("categoryMetrics");
		JsonNode notableInstances = assembly.payloadWithDetails("notableInstances");
		JsonNode provenance = assembly.payloadWithDetails("provenance");
		String primarySource = assembly.textWithDetails("primarySource");
		String secondarySource = assembly.textWithDetails("secondarySource");
		Integer trustScore = assembly.integer("trustScore");

		AnalysisResult analysis = assembly.analysis(topicId, title, createdAt);

		KnowledgeRecord record = new KnowledgeRecord(
				topicId,
				identifier,
				title,
				assembly.text("summary"),
				createdAt,
				contributionType,
				monetization,
				categoryMetrics,
				notableInstances,
				primarySource,
				secondarySource,
				provenance,
				trustScore,
				analysis
		);
		if (!assembly.diagnostics.isEmpty()) {
			logger.debug("Assembled record {} with diagnostics {}", topicId, assembly.diagnostics);
		}
		return new AssembledRecord(record, assembly.diagnostics);
	}

	private final class Assembly {
		private final GraphRow row;
		private final AssetDetailsSource detailsSource;
		private final List<String> diagnostics = new ArrayList<>();
		private JsonNode assertion;
		private boolean detailsLoaded;

		private Assembly(GraphRow row, AssetDetailsSource detailsSource) {
			this.row = row == null ? new GraphRow(Map.of()) : row;
			this.detailsSource = detailsSource;
		}

		private String text(String... names) {
			String value = LiteralNormalizer.normalize(row.cell(names), LiteralNormalizer.Mode.DISPLAY);
			return value.isBlank() ? null : value;
		}

		private String identifier() {
			String value = text("ual");
			return value != null ? value : text("asset");
		}

		private BigDecimal decimal(String... names) {
			String value = text(names);
			if (value == null) {
				return null;
			}
			try {
				return new BigDecimal(value.trim());
			} catch (NumberFormatException ex) {
				diagnostics.add(names[0] + ": not a number");
				return null;
			}
		}

		private Integer integer(String name) {
			BigDecimal value = decimal(name);
			if (value == null) {
				return null;
			}
			try {
				return value.intValueExact();
			} catch (ArithmeticException ex) {
				diagnostics.add(name + ": not an integer");
				return null;
			}
		}

		/**
		 * Decoded payload of a dedicated field; {@code null} when absent or unparseable.
		 */
		private JsonNode payload(String name) {
			JsonNode cell = row.cell(name);
			if (cell == null) {
				return null;
			}
			String raw = LiteralNormalizer.normalize(cell, LiteralNormalizer.Mode.PAYLOAD);
			if (raw.isBlank()) {
				return null;
			}
			Optional<JsonNode> decoded = payloadDecoder.tryDecode(raw);
			if (decoded.isEmpty()) {
				diagnostics.add(name + ": unparseable");
				return null;
			}
			return decoded.get();
		}

		private JsonNode payloadWithDetails(String field) {
			JsonNode value = payload(field);
			if (present(value)) {
				return value;
			}
			JsonNode detail = detailPayload(field);
			if (present(detail)) {
				diagnostics.add(field + ": from asset details");
				return detail;
			}
			return null;
		}

		private String textWithDetails(String field) {
			String value = text(field);
			if (value != null) {
				return value;
			}
			String detail = detailText(field);
			if (detail != null) {
				diagnostics.add(field + ": from asset details");
			}
			return detail;
		}

		private AnalysisResult analysis(String topicId, String title, String createdAt) {
			JsonNode aggregate = payload("analysisResult");
			if (aggregate != null && !aggregate.isObject()) {
				diagnostics.add("analysisResult: not an object");
				aggregate = null;
			}
			JsonNode aggregateResults = aggregate == null ? null : aggregate.get("results");

			Map<AnalysisSection, JsonNode> sections = new EnumMap<>(AnalysisSection.class);
			for (AnalysisSection section : AnalysisSection.values()) {
				sections.put(section, section(section, aggregateResults));
			}

			String status = firstNonBlank(analysisScalar(aggregate, "status", "analysisStatus"), "success");
			String analysisId = analysisScalar(aggregate, "analysis_id", "analysisId");
			String topic = firstNonBlank(aggregateText(aggregate, "topic"), title, topicId);
			List<String> steps = stepsCompleted(aggregate);
			JsonNode imageUrls = imageUrls(aggregate);
			double executionTime = executionTime(aggregate);
			String timestamp = firstNonBlank(analysisScalar(aggregate, "timestamp", "analysisTimestamp"), createdAt);
			if (timestamp == null) {
				diagnostics.add("timestamp: default");
				timestamp = Instant.now(clock).toString();
			}
			List<String> errors = aggregate == null ? List.of() : stringList(aggregate.get("errors"));

			return new AnalysisResult(
					status,
					analysisId == null ? "" : analysisId,
					topic,
					steps,
					imageUrls,
					AnalysisSections.of(sections),
					errors,
					executionTime,
					timestamp
			);
		}

		private JsonNode section(AnalysisSection section, JsonNode aggregateResults) {
			JsonNode fromAggregate = aggregateResults == null ? null : aggregateResults.get(section.key());
			if (present(fromAggregate)) {
				return fromAggregate;
			}
			JsonNode dedicated = payload(section.storeField());
			if (present(dedicated)) {
				return dedicated;
			}
			JsonNode detail = detailPayload(section.storeField());
			if (present(detail)) {
				diagnostics.add(section.key() + ": from asset details");
				return detail;
			}
			diagnostics.add(section.key() + ": default");
			return null;
		}

		private List<String> stepsCompleted(JsonNode aggregate) {
			JsonNode value = aggregate == null ? null : aggregate.get("steps_completed");
			if (value == null || !value.isArray()) {
				value = payload("stepsCompleted");
			}
			if (value == null || !value.isArray()) {
				value = detailPayload("stepsCompleted");
			}
			return stringList(value);
		}

		private JsonNode imageUrls(JsonNode aggregate) {
			JsonNode value = aggregate == null ? null : aggregate.get("image_urls");
			if (present(value)) {
				return value;
			}
			value = payload("imageUrls");
			if (present(value)) {
				return value;
			}
			value = detailPayload("imageUrls");
			return present(value) ? value : null;
		}

		private double executionTime(JsonNode aggregate) {
			JsonNode value = aggregate == null ? null : aggregate.get("execution_time_seconds");
			if (value != null && value.isNumber()) {
				return value.asDouble();
			}
			String raw = text("executionTimeSeconds");
			if (raw == null) {
				raw = detailText("executionTimeSeconds");
				if (raw == null) {
					return 0;
				}
				diagnostics.add("executionTimeSeconds: from asset details");
			}
			try {
				return Double.parseDouble(raw.trim());
			} catch (NumberFormatException ex) {
				diagnostics.add("executionTimeSeconds: not a number");
				return 0;
			}
		}

		/**
		 * Aggregate field, then the dedicated field, then asset details. Each source is only
		 * consulted when the previous one is blank.
		 */
		private String analysisScalar(JsonNode aggregate, String aggregateField, String storeField) {
			String value = aggregateText(aggregate, aggregateField);
			if (value != null) {
				return value;
			}
			value = text(storeField);
			if (value != null) {
				return value;
			}
			value = detailText(storeField);
			if (value != null) {
				diagnostics.add(storeField + ": from asset details");
			}
			return value;
		}

		private String aggregateText(JsonNode aggregate, String field) {
			if (aggregate == null) {
				return null;
			}
			JsonNode value = aggregate.get(field);
			if (value == null || value.isNull() || value.isObject() || value.isArray()) {
				return null;
			}
			String text = value.asText();
			return text.isBlank() ? null : text;
		}

		private JsonNode assertion() {
			if (!detailsLoaded) {
				detailsLoaded = true;
				String identifier = identifier();
				if (identifier != null) {
					assertion = loadAssertion(identifier);
				}
			}
			return assertion;
		}

		private JsonNode loadAssertion(String identifier) {
			try {
				return detailsSource.fetch(identifier)
						.map(details -> details.path("public").path("assertion"))
						.filter(node -> !node.isMissingNode() && !node.isNull())
						.orElse(null);
			} catch (RuntimeException ex) {
				logger.warn("Asset details lookup failed for {}: {}", identifier, ex.getMessage());
				diagnostics.add("assetDetails: unavailable");
				return null;
			}
		}

		private JsonNode detailNode(String field) {
			JsonNode source = assertion();
			if (source == null) {
				return null;
			}
			JsonNode value = source.get(field);
			if (value == null) {
				value = source.get("dkgpedia:" + field);
			}
			if (value != null && value.isObject() && value.has("@value")) {
				value = value.get("@value");
			}
			return value == null || value.isNull() ? null : value;
		}

		private JsonNode detailPayload(String field) {
			JsonNode value = detailNode(field);
			if (value == null) {
				return null;
			}
			if (!value.isTextual()) {
				return value;
			}
			Optional<JsonNode> decoded = payloadDecoder.tryDecode(
					LiteralNormalizer.normalize(value.asText(), LiteralNormalizer.Mode.PAYLOAD));
			if (decoded.isEmpty()) {
				diagnostics.add(field + ": unparseable in asset details");
			}
			return decoded.orElse(null);
		}

		private String detailText(String field) {
			JsonNode value = detailNode(field);
			if (value == null) {
				return null;
			}
			String text = LiteralNormalizer.normalize(value, LiteralNormalizer.Mode.DISPLAY);
			return text.isBlank() ? null : text;
		}
	}

	private static boolean present(JsonNode node) {
		if (node == null || node.isNull() || node.isMissingNode()) {
			return false;
		}
		return !((node.isObject() || node.isArray()) && node.isEmpty());
	}

	private static List<String> stringList(JsonNode node) {
		if (node == null || !node.isArray()) {
			return List.of();
		}
		List<String> values = new ArrayList<>();
		for (JsonNode item : node) {
			if (!item.isNull()) {
				values.add(item.asText());
			}
		}
		return values;
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
