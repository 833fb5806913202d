package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Pipeline variant. Quick mode translates and assembles, deep mode adds terminology unification,
 * critique and revision.
 */
public enum TranslationMode {

	QUICK,
	DEEP;

	/**
	 * Parses a mode name. Accepts `quick`, `deep` and the legacy `quick_mode` / `deep_mode` spellings.
	 *
	 * @param value the mode name
	 * @return parsed mode
	 * @throws IllegalArgumentException if the value is not recognized
	 */
	@JsonCreator
	@Nonnull
	public static TranslationMode fromString(@Nonnull String value) {
		Objects.requireNonNull(value, "value must not be null");
		final String normalized = value.trim().toLowerCase().replace("_mode", "");
		return switch (normalized) {
			case "quick" -> QUICK;
			case "deep" -> DEEP;
			default -> throw new IllegalArgumentException(
				"Unknown translation mode: " + value + ". Supported modes: quick, deep"
			);
		};
	}

	@JsonValue
	@Nonnull
	public String value() {
		return name().toLowerCase();
	}
}
