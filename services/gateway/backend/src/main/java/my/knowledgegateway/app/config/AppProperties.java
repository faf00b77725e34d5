package my.knowledgegateway.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Graph graph,
		Payment payment,
		Search search
) {
	/**
	 * Remote knowledge graph node. The endpoint is deliberately not required at startup:
	 * requests are rejected by the remote-source guard while it is unset or local.
	 */
	public record Graph(
			String endpoint,
			Integer connectTimeoutSeconds,
			Integer readTimeoutSeconds
	) {
	}

	public record Payment(
			String facilitatorUrl,
			@NotBlank String network,
			@NotBlank String scheme,
			String asset,
			String assetName,
			String assetVersion,
			Integer maxTimeoutSeconds,
			Integer verifyTimeoutSeconds,
			boolean settle
	) {
	}

	public record Search(
			Integer defaultLimit,
			Integer maxLimit
	) {
	}
}
