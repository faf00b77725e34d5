package my.knowledgegateway.app.service;

import my.knowledgegateway.app.domain.KnowledgeRecord;

import java.util.List;

public record AssembledRecord(KnowledgeRecord record, List<String> diagnostics) {
	public AssembledRecord {
		diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
	}
}
