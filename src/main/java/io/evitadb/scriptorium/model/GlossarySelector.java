package io.evitadb.scriptorium.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Tells the job service which glossary a submitted job should use.
 */
public sealed interface GlossarySelector
	permits GlossarySelector.None, GlossarySelector.DefaultGlossary, GlossarySelector.Stored, GlossarySelector.Inline {

	@Nonnull
	static GlossarySelector none() {
		return None.INSTANCE;
	}

	@Nonnull
	static GlossarySelector defaultGlossary() {
		return DefaultGlossary.INSTANCE;
	}

	@Nonnull
	static GlossarySelector stored(@Nonnull String glossaryId) {
		return new Stored(glossaryId);
	}

	@Nonnull
	static GlossarySelector inline(@Nonnull Glossary glossary) {
		return new Inline(glossary);
	}

	/**
	 * No user glossary; deep mode extracts terminology automatically.
	 */
	record None() implements GlossarySelector {
		private static final None INSTANCE = new None();
	}

	/**
	 * The catalog's default glossary.
	 */
	record DefaultGlossary() implements GlossarySelector {
		private static final DefaultGlossary INSTANCE = new DefaultGlossary();
	}

	/**
	 * A glossary stored in the catalog under an explicit id.
	 */
	record Stored(@Nonnull String glossaryId) implements GlossarySelector {
		public Stored {
			Objects.requireNonNull(glossaryId, "glossaryId must not be null");
		}
	}

	/**
	 * A glossary submitted together with the job.
	 */
	record Inline(@Nonnull Glossary glossary) implements GlossarySelector {
		public Inline {
			Objects.requireNonNull(glossary, "glossary must not be null");
		}
	}
}
