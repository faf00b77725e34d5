package my.knowledgegateway.app.service;

import org.springframework.http.HttpStatus;

public class AssetIngestException extends RuntimeException {
	private final HttpStatus status;

	public AssetIngestException(HttpStatus status, String message) {
		this(status, message, null);
	}

	public AssetIngestException(HttpStatus status, String message, Throwable cause) {
		super(message, cause);
		this.status = status;
	}

	public HttpStatus getStatus() {
		return status;
	}
}
