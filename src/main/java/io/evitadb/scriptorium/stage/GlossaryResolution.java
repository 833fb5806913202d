package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.GlossarySource;

import javax.annotation.Nonnull;

/**
 * Glossary chosen for a job.
 *
 * @param glossary the glossary to use, possibly empty
 * @param source   where the glossary came from
 * @param degraded true when automatic extraction failed and an empty glossary is used instead
 */
public record GlossaryResolution(
	@Nonnull Glossary glossary,
	@Nonnull GlossarySource source,
	boolean degraded
) {
}
