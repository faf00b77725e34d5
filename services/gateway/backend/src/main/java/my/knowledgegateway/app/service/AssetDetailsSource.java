package my.knowledgegateway.app.service;

import tools.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Secondary lookup of the full published asset by its identifier.
 */
@FunctionalInterface
public interface AssetDetailsSource {
	Optional<JsonNode> fetch(String identifier);

	static AssetDetailsSource none() {
		return identifier -> Optional.empty();
	}
}
