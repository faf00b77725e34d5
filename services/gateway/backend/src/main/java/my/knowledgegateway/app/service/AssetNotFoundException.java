package my.knowledgegateway.app.service;

public class AssetNotFoundException extends RuntimeException {
	private final String topicId;

	public AssetNotFoundException(String topicId) {
		super("No knowledge asset found for topic " + topicId);
		this.topicId = topicId;
	}

	public String getTopicId() {
		return topicId;
	}
}
