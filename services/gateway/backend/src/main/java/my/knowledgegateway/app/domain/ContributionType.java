package my.knowledgegateway.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ContributionType {
	REGULAR("regular"),
	USER_CONTRIBUTED("User contributed");

	private final String marker;

	ContributionType(String marker) {
		this.marker = marker;
	}

	@JsonValue
	public String marker() {
		return marker;
	}

	/**
	 * Lenient lookup used when reading stored records: anything that is not the
	 * user-contributed marker is treated as a regular contribution.
	 */
	public static ContributionType fromMarker(String value) {
		return parse(value).orElse(REGULAR);
	}

	/**
	 * Strict lookup used at the ingest boundary.
	 */
	public static Optional<ContributionType> parse(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (ContributionType type : values()) {
			if (type.marker.toLowerCase(Locale.ROOT).equals(normalized)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
