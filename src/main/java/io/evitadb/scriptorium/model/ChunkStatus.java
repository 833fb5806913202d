package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;

/**
 * Processing status of a single chunk. The order of constants follows the pipeline.
 */
public enum ChunkStatus {

	PENDING,
	TRANSLATING,
	TRANSLATED,
	CRITIQUED,
	REFINED,
	FAILED;

	/**
	 * Returns true when the chunk carries a usable translation.
	 */
	public boolean hasTranslation() {
		return this == TRANSLATED || this == CRITIQUED || this == REFINED;
	}

	@JsonValue
	@Nonnull
	public String value() {
		return name().toLowerCase();
	}
}
