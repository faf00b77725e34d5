package my.knowledgegateway.app.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import my.knowledgegateway.app.service.RemoteSourceGuard;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs the remote-source check once per request, before any handler touches the graph store.
 */
@Component
public class RemoteSourceInterceptor implements HandlerInterceptor {
	private final RemoteSourceGuard remoteSourceGuard;

	public RemoteSourceInterceptor(RemoteSourceGuard remoteSourceGuard) {
		this.remoteSourceGuard = remoteSourceGuard;
	}

	@Override
	public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
		remoteSourceGuard.validateConfigured();
		return true;
	}
}
