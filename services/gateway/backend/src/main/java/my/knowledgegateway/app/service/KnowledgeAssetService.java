package my.knowledgegateway.app.service;

import my.knowledgegateway.app.config.AppProperties;
import my.knowledgegateway.app.domain.AccessPolicy;
import my.knowledgegateway.app.domain.KnowledgeRecord;
import my.knowledgegateway.app.domain.Monetization;
import my.knowledgegateway.app.dto.AssetSearchResultDto;
import my.knowledgegateway.app.dto.AssetSummaryDto;
import my.knowledgegateway.app.dto.KnowledgeAssetDto;
import my.knowledgegateway.app.graph.GraphQueryException;
import my.knowledgegateway.app.graph.GraphRow;
import my.knowledgegateway.app.graph.GraphStoreClient;
import my.knowledgegateway.app.graph.SparqlQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Service
public class KnowledgeAssetService {
	private static final Logger logger = LoggerFactory.getLogger(KnowledgeAssetService.class);
	private static final int DEFAULT_SEARCH_LIMIT = 10;
	private static final int DEFAULT_MAX_SEARCH_LIMIT = 100;

	private final GraphStoreClient graphStoreClient;
	private final RecordAssembler recordAssembler;
	private final AccessPolicyEvaluator accessPolicyEvaluator;
	private final PaymentGate paymentGate;
	private final AppProperties properties;

	public KnowledgeAssetService(GraphStoreClient graphStoreClient,
								 RecordAssembler recordAssembler,
								 AccessPolicyEvaluator accessPolicyEvaluator,
								 PaymentGate paymentGate,
								 AppProperties properties) {
		this.graphStoreClient = graphStoreClient;
		this.recordAssembler = recordAssembler;
		this.accessPolicyEvaluator = accessPolicyEvaluator;
		this.paymentGate = paymentGate;
		this.properties = properties;
	}

	/**
	 * Loads the current record for a topic. Monetized records are only returned once the payment
	 * gate has verified the proof; otherwise the result carries the payment challenge instead.
	 *
	 * @throws AssetNotFoundException when no record exists for the topic
	 * @throws GraphQueryException when the graph store fails or times out
	 */
	public AssetRetrieval retrieve(String topicId, String paymentHeader, ResourceDescriptor resource) {
		List<GraphRow> rows = graphStoreClient.select(SparqlQueries.latestByTopic(topicId));
		if (rows.isEmpty()) {
			throw new AssetNotFoundException(topicId);
		}
		AssembledRecord assembled = recordAssembler.assemble(rows.get(0), topicId, graphStoreClient::fetchAsset);
		KnowledgeRecord record = assembled.record();
		AccessPolicy policy = accessPolicyEvaluator.classify(record);
		if (policy instanceof AccessPolicy.Monetized monetized) {
			PaymentDecision decision = paymentGate.evaluate(monetized, paymentHeader, resource);
			if (!decision.granted()) {
				return AssetRetrieval.paymentRequired(decision.challenge());
			}
			return AssetRetrieval.granted(toDto(record, true, assembled.diagnostics()), decision.paymentResponseHeader());
		}
		return AssetRetrieval.granted(toDto(record, false, assembled.diagnostics()), null);
	}

	/**
	 * Keyword search over topics and titles. Returns summaries only and is never payment gated.
	 */
	public AssetSearchResultDto search(String keyword, Integer limit) {
		List<GraphRow> rows;
		try {
			rows = graphStoreClient.select(SparqlQueries.search(keyword, clampLimit(limit)));
		} catch (GraphQueryException ex) {
			logger.warn("Search query failed (keyword={}): {}", keyword, ex.getMessage());
			return AssetSearchResultDto.empty();
		}
		if (rows.isEmpty()) {
			return AssetSearchResultDto.empty();
		}
		List<AssetSummaryDto> notes = new ArrayList<>();
		for (GraphRow row : rows) {
			KnowledgeRecord record = recordAssembler.assemble(row, null, AssetDetailsSource.none()).record();
			notes.add(toSummary(record, accessPolicyEvaluator.classify(record) instanceof AccessPolicy.Monetized));
		}
		return new AssetSearchResultDto(true, notes.size(), notes);
	}

	int clampLimit(Integer limit) {
		AppProperties.Search search = properties.search();
		int defaultLimit = search == null || search.defaultLimit() == null ? DEFAULT_SEARCH_LIMIT : search.defaultLimit();
		int maxLimit = search == null || search.maxLimit() == null ? DEFAULT_MAX_SEARCH_LIMIT : search.maxLimit();
		int requested = limit == null ? defaultLimit : limit;
		return Math.max(1, Math.min(requested, maxLimit));
	}

	private KnowledgeAssetDto toDto(KnowledgeRecord record, boolean paywalled, List<String> diagnostics) {
		return new KnowledgeAssetDto(
				record.topicId(),
				true,
				KnowledgeRecord.SCHEMA_VERSION,
				record.summary(),
				record.title(),
				record.createdAt(),
				record.identifier(),
				record.contributionType().marker(),
				record.monetizationTerms().map(Monetization::walletAddress).orElse(null),
				record.monetizationTerms().map(Monetization::priceUsd).orElse(null),
				paywalled,
				record.categoryMetrics(),
				record.notableInstances(),
				record.primarySource(),
				record.secondarySource(),
				record.provenance(),
				record.trustScore(),
				record.analysis(),
				diagnostics
		);
	}

	private AssetSummaryDto toSummary(KnowledgeRecord record, boolean paywalled) {
		String walletAddress = record.monetizationTerms().map(Monetization::walletAddress).orElse(null);
		BigDecimal priceUsd = record.monetizationTerms().map(Monetization::priceUsd).orElse(null);
		return new AssetSummaryDto(
				record.topicId(),
				record.title(),
				record.summary(),
				record.createdAt(),
				record.identifier(),
				record.contributionType().marker(),
				walletAddress,
				priceUsd,
				paywalled,
				paywalled ? null : record.categoryMetrics(),
				paywalled ? null : record.notableInstances(),
				record.primarySource(),
				record.secondarySource(),
				record.analysis().status()
		);
	}
}
