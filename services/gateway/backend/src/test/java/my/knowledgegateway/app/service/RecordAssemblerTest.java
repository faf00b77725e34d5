package my.knowledgegateway.app.service;

import my.knowledgegateway.app.domain.AnalysisResult;
import my.knowledgegateway.app.domain.AnalysisSection;
import my.knowledgegateway.app.domain.ContributionType;
import my.knowledgegateway.app.domain.KnowledgeRecord;
import my.knowledgegateway.app.graph.GraphRow;
import my.knowledgegateway.app.util.PayloadDecoder;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RecordAssemblerTest {
	private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

	private final ObjectMapper mapper = new ObjectMapper();
	private final RecordAssembler assembler = new RecordAssembler(new PayloadDecoder(), Clock.fixed(NOW, ZoneOffset.UTC));

	@Test
	void aggregateSectionBeatsDedicatedField() {
		Map<String, JsonNode> cells = baseCells();
		cells.put("analysisResult", literal(
				"{\"status\":\"success\",\"analysis_id\":\"an-1\",\"results\":{\"sentiment\":{\"label\":\"aggregate\"}}}"));
		cells.put("sentimentResults", literal("{\"label\":\"dedicated\"}"));

		AssembledRecord assembled = assembler.assemble(new GraphRow(cells), "climate", AssetDetailsSource.none());

		AnalysisResult analysis = assembled.record().analysis();
		assertThat(analysis.results().get(AnalysisSection.SENTIMENT).path("label").asText()).isEqualTo("aggregate");
		assertThat(analysis.analysisId()).isEqualTo("an-1");
	}

	@Test
	void dedicatedFieldFillsSectionMissingFromAggregate() {
		Map<String, JsonNode> cells = baseCells();
		cells.put("analysisResult", literal("{\"results\":{\"fetch\":{\"pages\":2}}}"));
		cells.put("tripleResults", storeEscaped("{\"claims\":[\"a\",\"b\"]}"));

		AnalysisResult analysis = assembler.assemble(new GraphRow(cells), "climate", AssetDetailsSource.none())
				.record().analysis();

		assertThat(analysis.results().get(AnalysisSection.FETCH).path("pages").asInt()).isEqualTo(2);
		assertThat(analysis.results().get(AnalysisSection.TRIPLE).path("claims").size()).isEqualTo(2);
	}

	@Test
	void alwaysExposesAllSevenSections() {
		AssembledRecord assembled = assembler.assemble(new GraphRow(baseCells()), "climate", AssetDetailsSource.none());

		Map<String, JsonNode> sections = assembled.record().analysis().results().asMap();
		assertThat(sections).containsOnlyKeys(
				"fetch", "triple", "semanticdrift", "factcheck", "sentiment", "multimodal", "judging");
		assertThat(sections.values()).allSatisfy(node -> {
			assertThat(node.isObject()).isTrue();
			assertThat(node.isEmpty()).isTrue();
		});
		assertThat(assembled.diagnostics()).contains("judging: default");
	}

	@Test
	void appliesScalarDefaults() {
		Map<String, JsonNode> cells = new LinkedHashMap<>();
		cells.put("topicId", literal("climate"));

		AnalysisResult analysis = assembler.assemble(new GraphRow(cells), "climate", AssetDetailsSource.none())
				.record().analysis();

		assertThat(analysis.status()).isEqualTo("success");
		assertThat(analysis.analysisId()).isEmpty();
		assertThat(analysis.topic()).isEqualTo("climate");
		assertThat(analysis.stepsCompleted()).isEmpty();
		assertThat(analysis.executionTimeSeconds()).isZero();
		assertThat(analysis.timestamp()).isEqualTo(NOW.toString());
		assertThat(analysis.imageUrls()).isNull();
	}

	@Test
	void scalarsFallBackToDedicatedFields() {
		Map<String, JsonNode> cells = baseCells();
		cells.put("analysisStatus", literal("partial"));
		cells.put("stepsCompleted", literal("[\"fetch\",\"triple\"]"));
		cells.put("executionTimeSeconds", literal("\"12.5\"^^<http://www.w3.org/2001/XMLSchema#decimal>"));
		cells.put("analysisTimestamp", literal("2025-02-01T08:00:00Z"));

		AnalysisResult analysis = assembler.assemble(new GraphRow(cells), "climate", AssetDetailsSource.none())
				.record().analysis();

		assertThat(analysis.status()).isEqualTo("partial");
		assertThat(analysis.stepsCompleted()).containsExactly("fetch", "triple");
		assertThat(analysis.executionTimeSeconds()).isEqualTo(12.5);
		assertThat(analysis.timestamp()).isEqualTo("2025-02-01T08:00:00Z");
		assertThat(analysis.topic()).isEqualTo("Climate Change");
	}

	@Test
	void timestampFallsBackToCreatedAt() {
		AnalysisResult analysis = assembler.assemble(new GraphRow(baseCells()), "climate", AssetDetailsSource.none())
				.record().analysis();

		assertThat(analysis.timestamp()).isEqualTo("2025-01-15T10:00:00Z");
	}

	@Test
	void missingSectionsComeFromAssetDetailsWithSingleLookup() {
		AtomicInteger lookups = new AtomicInteger();
		JsonNode details = mapper.readTree("""
				{"public":{"assertion":{
				  "judgingResults":"{\\"verdict\\":\\"consistent\\"}",
				  "dkgpedia:multimodalResults":{"aligned":true},
				  "primarySource":"grokipedia.md"
				}}}
				""");
		AssetDetailsSource source = identifier -> {
			lookups.incrementAndGet();
			assertThat(identifier).isEqualTo("did:dkg:otp/0xabc/1");
			return Optional.of(details);
		};

		AssembledRecord assembled = assembler.assemble(new GraphRow(baseCells()), "climate", source);

		KnowledgeRecord record = assembled.record();
		assertThat(record.analysis().results().get(AnalysisSection.JUDGING).path("verdict").asText()).isEqualTo("consistent");
		assertThat(record.analysis().results().get(AnalysisSection.MULTIMODAL).path("aligned").asBoolean()).isTrue();
		assertThat(record.primarySource()).isEqualTo("grokipedia.md");
		assertThat(lookups.get()).isEqualTo(1);
		assertThat(assembled.diagnostics()).contains("judging: from asset details", "primarySource: from asset details");
	}

	@Test
	void completeRowNeverFetchesAssetDetails() {
		AtomicInteger lookups = new AtomicInteger();
		AssetDetailsSource source = identifier -> {
			lookups.incrementAndGet();
			return Optional.empty();
		};
		Map<String, JsonNode> cells = baseCells();
		cells.put("categoryMetrics", literal("{\"coherence\":0.9}"));
		cells.put("notableInstances", literal("[{\"claim\":\"a\"}]"));
		cells.put("provenance", literal("{\"createdBy\":\"pipeline\"}"));
		cells.put("primarySource", literal("grokipedia.md"));
		cells.put("secondarySource", literal("wikipedia.md"));
		cells.put("analysisResult", literal("""
				{"status":"success","analysis_id":"an-7","topic":"Climate Change",
				 "steps_completed":["fetch","judging"],"image_urls":["https://img.example/1.png"],
				 "execution_time_seconds":41.2,"timestamp":"2025-01-15T10:05:00Z",
				 "results":{"fetch":{"pages":2},"triple":{"claims":1},"semanticdrift":{"score":0.1},
				  "factcheck":{"checked":3},"sentiment":{"label":"neutral"},"multimodal":{"aligned":true},
				  "judging":{"verdict":"consistent"}}}
				"""));

		AssembledRecord assembled = assembler.assemble(new GraphRow(cells), "climate", source);

		assertThat(lookups.get()).isZero();
		assertThat(assembled.diagnostics()).isEmpty();
		assertThat(assembled.record().analysis().analysisId()).isEqualTo("an-7");
		assertThat(assembled.record().analysis().executionTimeSeconds()).isEqualTo(41.2);
	}

	@Test
	void analysisScalarsFromAssetDetailsAreDiagnosed() {
		JsonNode details = mapper.readTree("""
				{"public":{"assertion":{"analysisId":"an-9","executionTimeSeconds":"3.5"}}}
				""");

		AssembledRecord assembled = assembler.assemble(new GraphRow(baseCells()), "climate", identifier -> Optional.of(details));

		assertThat(assembled.record().analysis().analysisId()).isEqualTo("an-9");
		assertThat(assembled.record().analysis().executionTimeSeconds()).isEqualTo(3.5);
		assertThat(assembled.diagnostics()).contains(
				"analysisId: from asset details", "executionTimeSeconds: from asset details");
	}

	@Test
	void failingDetailsLookupIsReportedNotThrown() {
		AssetDetailsSource failing = identifier -> {
			throw new IllegalStateException("node down");
		};

		AssembledRecord assembled = assembler.assemble(new GraphRow(baseCells()), "climate", failing);

		assertThat(assembled.record().analysis().results().isEmpty(AnalysisSection.FETCH)).isTrue();
		assertThat(assembled.diagnostics()).contains("assetDetails: unavailable");
	}

	@Test
	void unparseablePayloadIsDiagnosed() {
		Map<String, JsonNode> cells = baseCells();
		cells.put("factCheckResults", literal("{broken"));

		AssembledRecord assembled = assembler.assemble(new GraphRow(cells), "climate", AssetDetailsSource.none());

		assertThat(assembled.record().analysis().results().isEmpty(AnalysisSection.FACT_CHECK)).isTrue();
		assertThat(assembled.diagnostics()).contains("factCheckResults: unparseable");
	}

	@Test
	void readsMonetizationForUserContributedRecords() {
		Map<String, JsonNode> cells = baseCells();
		cells.put("contributionType", literal("user CONTRIBUTED"));
		cells.put("walletAddress", literal("0xseller"));
		cells.put("priceUsd", literal("\"0.10\"^^<http://www.w3.org/2001/XMLSchema#decimal>"));

		KnowledgeRecord record = assembler.assemble(new GraphRow(cells), "climate", AssetDetailsSource.none()).record();

		assertThat(record.contributionType()).isEqualTo(ContributionType.USER_CONTRIBUTED);
		assertThat(record.monetizationTerms()).isPresent();
		assertThat(record.monetizationTerms().get().priceUsd()).isEqualByComparingTo(new BigDecimal("0.10"));
	}

	@Test
	void incompleteMonetizationIsDropped() {
		Map<String, JsonNode> cells = baseCells();
		cells.put("contribution_type", literal("User contributed"));
		cells.put("price_usd", literal("0"));

		KnowledgeRecord record = assembler.assemble(new GraphRow(cells), "climate", AssetDetailsSource.none()).record();

		assertThat(record.contributionType()).isEqualTo(ContributionType.USER_CONTRIBUTED);
		assertThat(record.monetizationTerms()).isEmpty();
	}

	@Test
	void legacyRecordKeepsTrustScore() {
		Map<String, JsonNode> cells = new LinkedHashMap<>();
		cells.put("topicId", literal("legacy"));
		cells.put("summary", literal("Old note"));
		cells.put("trustScore", literal("\"87\"^^<http://www.w3.org/2001/XMLSchema#integer>"));

		KnowledgeRecord record = assembler.assemble(new GraphRow(cells), "legacy", AssetDetailsSource.none()).record();

		assertThat(record.trustScore()).isEqualTo(87);
		assertThat(record.analysis().results().asMap()).hasSize(7);
	}

	@Test
	void nonIntegralTrustScoreIsDiagnosedNotTruncated() {
		for (String raw : new String[]{"87.9", "1e12"}) {
			Map<String, JsonNode> cells = new LinkedHashMap<>();
			cells.put("topicId", literal("legacy"));
			cells.put("trustScore", literal(raw));

			AssembledRecord assembled = assembler.assemble(new GraphRow(cells), "legacy", AssetDetailsSource.none());

			assertThat(assembled.record().trustScore()).as(raw).isNull();
			assertThat(assembled.diagnostics()).as(raw).contains("trustScore: not an integer");
		}
	}

	private Map<String, JsonNode> baseCells() {
		Map<String, JsonNode> cells = new LinkedHashMap<>();
		cells.put("topicId", literal("climate"));
		cells.put("title", literal("Climate Change"));
		cells.put("summary", literal("Both sources agree."));
		cells.put("createdAt", literal("2025-01-15T10:00:00Z"));
		cells.put("ual", literal("did:dkg:otp/0xabc/1"));
		return cells;
	}

	private JsonNode literal(String value) {
		return mapper.createObjectNode().put("value", value);
	}

	private JsonNode storeEscaped(String json) {
		return literal("\"" + json.replace("\\", "\\\\").replace("\"", "\\\"") + "\"");
	}
}
