package my.knowledgegateway.app.service;

public class RemoteSourceConfigException extends RuntimeException {
	public RemoteSourceConfigException(String message) {
		super(message);
	}
}
