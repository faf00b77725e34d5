package my.knowledgegateway.app.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class HttpGraphStoreClient implements GraphStoreClient {
	private static final Logger logger = LoggerFactory.getLogger(HttpGraphStoreClient.class);
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
	private static final List<String> IDENTIFIER_FIELDS = List.of("UAL", "ual", "asset_id", "dataSetId");

	private final RestClient restClient;

	public HttpGraphStoreClient(String baseUrl) {
		this(baseUrl, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public HttpGraphStoreClient(String baseUrl, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
				.build();
	}

	@Override
	public List<GraphRow> select(String query) {
		Map<String, Object> request = Map.of("query", query, "type", "SELECT");
		JsonNode response = execute("query", () -> restClient.post()
				.uri("/query")
				.body(request)
				.retrieve()
				.body(JsonNode.class));
		JsonNode data = response == null ? null : response.path("data");
		if (data == null || !data.isArray()) {
			return List.of();
		}
		List<GraphRow> rows = new ArrayList<>();
		for (JsonNode item : data) {
			if (!item.isObject()) {
				continue;
			}
			Map<String, JsonNode> cells = new LinkedHashMap<>();
			for (Map.Entry<String, JsonNode> entry : item.properties()) {
				cells.put(entry.getKey(), entry.getValue());
			}
			rows.add(new GraphRow(cells));
		}
		return rows;
	}

	@Override
	public Optional<JsonNode> fetchAsset(String identifier) {
		if (identifier == null || identifier.isBlank()) {
			return Optional.empty();
		}
		JsonNode response = execute("asset lookup", () -> restClient.get()
				.uri(uriBuilder -> uriBuilder.path("/assets")
						.queryParam("ual", identifier)
						.queryParam("includeMetadata", true)
						.build())
				.retrieve()
				.body(JsonNode.class));
		if (response == null || response.isNull() || response.isMissingNode()) {
			return Optional.empty();
		}
		return Optional.of(response);
	}

	@Override
	public Optional<String> publish(JsonNode document) {
		Map<String, Object> request = Map.of(
				"public", document,
				"options", Map.of(
						"epochsNum", 2,
						"minimumNumberOfFinalizationConfirmations", 3,
						"minimumNumberOfNodeReplications", 1
				)
		);
		JsonNode response = execute("publish", () -> restClient.post()
				.uri("/assets")
				.body(request)
				.retrieve()
				.body(JsonNode.class));
		if (response == null) {
			return Optional.empty();
		}
		for (String field : IDENTIFIER_FIELDS) {
			JsonNode value = response.get(field);
			if (value != null && value.isTextual() && !value.asText().isBlank()) {
				return Optional.of(value.asText());
			}
		}
		return Optional.empty();
	}

	private JsonNode execute(String operation, Call call) {
		try {
			return call.run();
		} catch (RestClientResponseException ex) {
			int status = ex.getStatusCode().value();
			logger.warn("Graph {} failed with status {}", operation, status);
			throw new GraphQueryException("Graph " + operation + " failed with status " + status, status, ex);
		} catch (ResourceAccessException ex) {
			logger.warn("Graph {} failed: {}", operation, ex.getMessage());
			throw new GraphQueryException("Graph " + operation + " unreachable or timed out", null, ex);
		} catch (RestClientException ex) {
			logger.warn("Graph {} returned an unreadable response: {}", operation, ex.getMessage());
			throw new GraphQueryException("Graph " + operation + " returned an unreadable response", null, ex);
		}
	}

	@FunctionalInterface
	private interface Call {
		JsonNode run();
	}
}
