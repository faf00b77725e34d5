package my.knowledgegateway.app.graph;

public class GraphQueryException extends RuntimeException {
	private final Integer statusCode;

	public GraphQueryException(String message, Integer statusCode, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
	}

	public Integer getStatusCode() {
		return statusCode;
	}
}
