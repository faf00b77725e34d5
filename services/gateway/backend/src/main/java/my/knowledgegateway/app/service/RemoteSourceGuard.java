package my.knowledgegateway.app.service;

import my.knowledgegateway.app.config.AppProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

/**
 * Refuses to serve data from a graph node on the local machine. Only a remote, publicly reachable
 * node gives records that other parties can verify.
 */
@Component
public class RemoteSourceGuard {
	private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1", "::1");

	private final AppProperties properties;

	public RemoteSourceGuard(AppProperties properties) {
		this.properties = properties;
	}

	public String validateConfigured() {
		String endpoint = properties.graph() == null ? null : properties.graph().endpoint();
		validate(endpoint);
		return endpoint.trim();
	}

	public static void validate(String endpoint) {
		if (endpoint == null || endpoint.isBlank()) {
			throw new RemoteSourceConfigException(
					"Graph endpoint is not configured. Set DKG_OTNODE_URL to a remote node.");
		}
		String host = extractHost(endpoint.trim());
		if (host == null || LOCAL_HOSTS.contains(host)) {
			throw new RemoteSourceConfigException(
					"Graph endpoint must be a remote node, not " + endpoint.trim());
		}
	}

	static String extractHost(String endpoint) {
		String candidate = endpoint.contains("://") ? endpoint : "http://" + endpoint;
		String host;
		try {
			host = URI.create(candidate).getHost();
		} catch (IllegalArgumentException ex) {
			host = null;
		}
		if (host == null) {
			host = hostFromAuthority(candidate);
		}
		if (host == null || host.isBlank()) {
			return null;
		}
		if (host.startsWith("[") && host.endsWith("]")) {
			host = host.substring(1, host.length() - 1);
		}
		return host.toLowerCase(Locale.ROOT);
	}

	private static String hostFromAuthority(String candidate) {
		int start = candidate.indexOf("://") + 3;
		int end = candidate.length();
		for (char stop : new char[] {'/', '?', '#'}) {
			int index = candidate.indexOf(stop, start);
			if (index >= 0 && index < end) {
				end = index;
			}
		}
		String authority = candidate.substring(start, end);
		int at = authority.lastIndexOf('@');
		if (at >= 0) {
			authority = authority.substring(at + 1);
		}
		if (authority.startsWith("[")) {
			int close = authority.indexOf(']');
			return close > 0 ? authority.substring(0, close + 1) : authority;
		}
		if (authority.chars().filter(c -> c == ':').count() > 1) {
			return authority;
		}
		int colon = authority.indexOf(':');
		return colon >= 0 ? authority.substring(0, colon) : authority;
	}
}
