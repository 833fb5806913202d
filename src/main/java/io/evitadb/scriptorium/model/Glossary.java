package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Set of glossary terms keyed by unique source term. When two terms share a source term the
 * one added later wins.
 *
 * @param terms the terms, unique by source term
 */
public record Glossary(@Nonnull List<GlossaryTerm> terms) {

	private static final Glossary EMPTY = new Glossary(List.of());
	private static final String NO_TERMINOLOGY = "No specific terminology provided.";

	public Glossary {
		final Map<String, GlossaryTerm> unique = new LinkedHashMap<>();
		if (terms != null) {
			for (GlossaryTerm term : terms) {
				if (term != null) {
					// remove first so the surviving entry takes the position of the last write
					unique.remove(term.sourceTerm());
					unique.put(term.sourceTerm(), term);
				}
			}
		}
		terms = List.copyOf(unique.values());
	}

	@Nonnull
	public static Glossary empty() {
		return EMPTY;
	}

	@Nonnull
	public static Glossary of(@Nonnull Collection<GlossaryTerm> terms) {
		return new Glossary(new ArrayList<>(terms));
	}

	@Nonnull
	public static Glossary of(@Nonnull GlossaryTerm... terms) {
		return new Glossary(List.of(terms));
	}

	@JsonIgnore
	public boolean isEmpty() {
		return this.terms.isEmpty();
	}

	public int size() {
		return this.terms.size();
	}

	@Nonnull
	public Optional<GlossaryTerm> find(@Nonnull String sourceTerm) {
		return this.terms.stream()
			.filter(term -> term.sourceTerm().equals(sourceTerm))
			.findFirst();
	}

	/**
	 * Returns a glossary reduced to terms that occur (case-insensitively) in the given text.
	 *
	 * @param text text to match terms against
	 * @return filtered glossary
	 */
	@Nonnull
	public Glossary filterTo(@Nonnull String text) {
		final String haystack = text.toLowerCase(Locale.ROOT);
		final List<GlossaryTerm> matching = new ArrayList<>();
		for (GlossaryTerm term : this.terms) {
			if (haystack.contains(term.sourceTerm().toLowerCase(Locale.ROOT))) {
				matching.add(term);
			}
		}
		return matching.size() == this.terms.size() ? this : new Glossary(matching);
	}

	/**
	 * Combines two glossaries; terms of the other glossary override terms with the same source term.
	 */
	@Nonnull
	public Glossary merge(@Nullable Glossary other) {
		if (other == null || other.isEmpty()) {
			return this;
		}
		final List<GlossaryTerm> combined = new ArrayList<>(this.terms);
		combined.addAll(other.terms);
		return new Glossary(combined);
	}

	/**
	 * Formats the glossary as prompt guidance, one `- 'source' -> 'target'` line per term that has
	 * a translation for the target language.
	 *
	 * @param targetLanguage target language of the job
	 * @return guidance block
	 */
	@Nonnull
	public String toPromptGuidance(@Nullable String targetLanguage) {
		final StringBuilder guidance = new StringBuilder();
		for (GlossaryTerm term : this.terms) {
			final String translation = term.translationFor(targetLanguage);
			if (translation != null) {
				guidance.append("- '").append(term.sourceTerm()).append("' -> '").append(translation).append("'\n");
			}
		}
		if (guidance.length() == 0) {
			return NO_TERMINOLOGY;
		}
		return "Terminology Glossary:\n" + guidance.toString().stripTrailing();
	}
}
