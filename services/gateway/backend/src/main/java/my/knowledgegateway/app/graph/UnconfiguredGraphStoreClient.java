package my.knowledgegateway.app.graph;

import tools.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

public class UnconfiguredGraphStoreClient implements GraphStoreClient {
	@Override
	public List<GraphRow> select(String query) {
		throw new GraphQueryException("Graph endpoint not configured", null, null);
	}

	@Override
	public Optional<JsonNode> fetchAsset(String identifier) {
		throw new GraphQueryException("Graph endpoint not configured", null, null);
	}

	@Override
	public Optional<String> publish(JsonNode document) {
		throw new GraphQueryException("Graph endpoint not configured", null, null);
	}
}
