package my.knowledgegateway.app.dto;

import java.util.List;

public record AssetSearchResultDto(
		boolean found,
		int count,
		List<AssetSummaryDto> notes
) {
	public static AssetSearchResultDto empty() {
		return new AssetSearchResultDto(false, 0, List.of());
	}
}
