package my.knowledgegateway.app.graph;

import java.util.List;

/**
 * SELECT queries against the community note vocabulary. Caller supplied values only ever enter
 * a query through {@link #literal(String)}; limits are plain integers.
 */
public final class SparqlQueries {
	private static final String PREFIXES = """
			PREFIX schema: <https://schema.org/>
			PREFIX dkgpedia: <https://dkgpedia.org/schema/>
			""";

	private static final List<String> SUMMARY_FIELDS = List.of(
			"summary:summary",
			"name:title",
			"dateCreated:createdAt",
			"identifier:ual",
			"contributionType:contributionType",
			"walletAddress:walletAddress",
			"priceUsd:priceUsd",
			"categoryMetrics:categoryMetrics",
			"notableInstances:notableInstances",
			"primarySource:primarySource",
			"secondarySource:secondarySource",
			"analysisResult:analysisResult",
			"analysisStatus:analysisStatus"
	);

	private static final List<String> DETAIL_FIELDS = List.of(
			"provenance:provenance",
			"trustScore:trustScore",
			"fetchResults:fetchResults",
			"tripleResults:tripleResults",
			"semanticDriftResults:semanticDriftResults",
			"factCheckResults:factCheckResults",
			"sentimentResults:sentimentResults",
			"multimodalResults:multimodalResults",
			"judgingResults:judgingResults",
			"analysisId:analysisId",
			"stepsCompleted:stepsCompleted",
			"executionTimeSeconds:executionTimeSeconds",
			"analysisTimestamp:analysisTimestamp",
			"imageUrls:imageUrls"
	);

	private SparqlQueries() {
	}

	/**
	 * Most recent note filed under the topic, with every stored field.
	 */
	public static String latestByTopic(String topicId) {
		StringBuilder query = new StringBuilder(PREFIXES);
		query.append("SELECT * WHERE {\n");
		query.append("  ?asset a dkgpedia:CommunityNote .\n");
		query.append("  ?asset dkgpedia:topicId ").append(literal(topicId)).append(" .\n");
		query.append("  OPTIONAL { ?asset dkgpedia:topicId ?topicId . }\n");
		appendOptionals(query, SUMMARY_FIELDS);
		appendOptionals(query, DETAIL_FIELDS);
		query.append("}\n");
		query.append("ORDER BY DESC(?createdAt)\n");
		query.append("LIMIT 1\n");
		return query.toString();
	}

	/**
	 * Notes whose topic or title contains the keyword (case-insensitive), newest first.
	 */
	public static String search(String keyword, int limit) {
		StringBuilder query = new StringBuilder(PREFIXES);
		query.append("SELECT * WHERE {\n");
		query.append("  ?asset a dkgpedia:CommunityNote .\n");
		query.append("  ?asset dkgpedia:topicId ?topicId .\n");
		appendOptionals(query, SUMMARY_FIELDS);
		if (keyword != null && !keyword.isBlank()) {
			String value = literal(keyword.trim());
			query.append("  FILTER (\n");
			query.append("    CONTAINS(LCASE(?topicId), LCASE(").append(value).append(")) ||\n");
			query.append("    CONTAINS(LCASE(?title), LCASE(").append(value).append("))\n");
			query.append("  )\n");
		}
		query.append("}\n");
		query.append("ORDER BY DESC(?createdAt)\n");
		query.append("LIMIT ").append(Math.max(1, limit)).append('\n');
		return query.toString();
	}

	/**
	 * Quoted SPARQL string literal with every character that could end or alter the literal escaped.
	 */
	public static String literal(String value) {
		String raw = value == null ? "" : value;
		StringBuilder out = new StringBuilder(raw.length() + 2);
		out.append('"');
		for (int i = 0; i < raw.length(); i++) {
			char c = raw.charAt(i);
			switch (c) {
				case '\\' -> out.append("\\\\");
				case '"' -> out.append("\\\"");
				case '\'' -> out.append("\\'");
				case '\n' -> out.append("\\n");
				case '\r' -> out.append("\\r");
				case '\t' -> out.append("\\t");
				case '\b' -> out.append("\\b");
				case '\f' -> out.append("\\f");
				default -> out.append(c);
			}
		}
		out.append('"');
		return out.toString();
	}

	private static void appendOptionals(StringBuilder query, List<String> fields) {
		for (String field : fields) {
			int separator = field.indexOf(':');
			String predicate = field.substring(0, separator);
			String variable = field.substring(separator + 1);
			query.append("  OPTIONAL { ?asset dkgpedia:").append(predicate)
					.append(" ?").append(variable).append(" . }\n");
		}
	}
}
