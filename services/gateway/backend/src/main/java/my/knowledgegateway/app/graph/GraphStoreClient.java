package my.knowledgegateway.app.graph;

import tools.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Remote knowledge graph node. Implementations must fail with {@link GraphQueryException}
 * rather than return partial data when the node is unreachable or times out.
 */
public interface GraphStoreClient {
	List<GraphRow> select(String query);

	/**
	 * Full asset document for a published identifier, including its public assertion.
	 */
	Optional<JsonNode> fetchAsset(String identifier);

	/**
	 * Publishes a JSON-LD document and returns the identifier the store assigned.
	 */
	Optional<String> publish(JsonNode document);
}
