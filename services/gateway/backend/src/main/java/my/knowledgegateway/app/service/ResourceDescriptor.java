package my.knowledgegateway.app.service;

import java.util.Locale;

/**
 * The protected resource a payment is bound to.
 */
public record ResourceDescriptor(String method, String path) {
	public ResourceDescriptor {
		method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
		path = path == null ? "" : path;
	}

	@Override
	public String toString() {
		return method + " " + path;
	}
}
