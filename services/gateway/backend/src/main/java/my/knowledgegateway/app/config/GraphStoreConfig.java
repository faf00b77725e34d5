package my.knowledgegateway.app.config;

import my.knowledgegateway.app.graph.GraphStoreClient;
import my.knowledgegateway.app.graph.HttpGraphStoreClient;
import my.knowledgegateway.app.graph.UnconfiguredGraphStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class GraphStoreConfig {
	private static final Logger logger = LoggerFactory.getLogger(GraphStoreConfig.class);

	@Bean
	public GraphStoreClient graphStoreClient(AppProperties properties) {
		AppProperties.Graph graph = properties.graph();
		String endpoint = graph == null ? null : graph.endpoint();
		if (endpoint == null || endpoint.isBlank()) {
			logger.info("Graph store client disabled (no endpoint configured).");
			return new UnconfiguredGraphStoreClient();
		}
		int connectTimeout = graph.connectTimeoutSeconds() == null ? 10 : Math.max(1, graph.connectTimeoutSeconds());
		int readTimeout = graph.readTimeoutSeconds() == null ? 30 : Math.max(1, graph.readTimeoutSeconds());
		String baseUrl = endpoint.contains("://") ? endpoint.trim() : "http://" + endpoint.trim();
		logger.info("Graph store client enabled (endpoint={}).", baseUrl);
		return new HttpGraphStoreClient(baseUrl,
				Duration.ofSeconds(connectTimeout),
				Duration.ofSeconds(readTimeout));
	}
}
