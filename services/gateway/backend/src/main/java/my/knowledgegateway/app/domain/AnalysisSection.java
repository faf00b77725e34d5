package my.knowledgegateway.app.domain;

/**
 * The fixed set of analysis sections a knowledge record carries. Each section has a key in the
 * aggregate analysis payload and a dedicated field in the graph store.
 */
public enum AnalysisSection {
	FETCH("fetch", "fetchResults"),
	TRIPLE("triple", "tripleResults"),
	SEMANTIC_DRIFT("semanticdrift", "semanticDriftResults"),
	FACT_CHECK("factcheck", "factCheckResults"),
	SENTIMENT("sentiment", "sentimentResults"),
	MULTIMODAL("multimodal", "multimodalResults"),
	JUDGING("judging", "judgingResults");

	private final String key;
	private final String storeField;

	AnalysisSection(String key, String storeField) {
		this.key = key;
		this.storeField = storeField;
	}

	public String key() {
		return key;
	}

	public String storeField() {
		return storeField;
	}
}
