package io.evitadb.scriptorium.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A source term with its proposed translations keyed by target language or `default`.
 *
 * @param sourceTerm           term as it appears in the source document
 * @param proposedTranslations target language (or `default`) to proposed translation
 */
public record GlossaryTerm(
	@Nonnull String sourceTerm,
	@Nonnull Map<String, String> proposedTranslations
) {

	public static final String DEFAULT_KEY = "default";

	public GlossaryTerm {
		Objects.requireNonNull(sourceTerm, "sourceTerm must not be null");
		if (sourceTerm.isBlank()) {
			throw new IllegalArgumentException("sourceTerm must not be blank");
		}
		proposedTranslations = proposedTranslations == null
			? Map.of()
			: Map.copyOf(new LinkedHashMap<>(proposedTranslations));
	}

	/**
	 * Creates a term with a single default translation.
	 */
	@Nonnull
	public static GlossaryTerm of(@Nonnull String sourceTerm, @Nonnull String translation) {
		return new GlossaryTerm(sourceTerm, Map.of(DEFAULT_KEY, translation));
	}

	/**
	 * Looks up the translation for the given target language. Tries the exact key, then a
	 * case-insensitive match and finally the `default` entry.
	 *
	 * @param targetLanguage target language identifier
	 * @return translation or null if the term has none usable
	 */
	@Nullable
	public String translationFor(@Nullable String targetLanguage) {
		if (targetLanguage != null) {
			final String exact = this.proposedTranslations.get(targetLanguage);
			if (exact != null && !exact.isBlank()) {
				return exact;
			}
			for (Map.Entry<String, String> entry : this.proposedTranslations.entrySet()) {
				if (entry.getKey().equalsIgnoreCase(targetLanguage) && !entry.getValue().isBlank()) {
					return entry.getValue();
				}
			}
		}
		final String fallback = this.proposedTranslations.get(DEFAULT_KEY);
		return fallback == null || fallback.isBlank() ? null : fallback;
	}
}
