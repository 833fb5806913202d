package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;

/**
 * Where the glossary used by a job came from. Reported back on submission.
 */
public enum GlossarySource {

	NONE,
	AUTO_EXTRACTED,
	DEFAULT,
	STORED,
	INLINE;

	@JsonValue
	@Nonnull
	public String value() {
		return name().toLowerCase();
	}
}
