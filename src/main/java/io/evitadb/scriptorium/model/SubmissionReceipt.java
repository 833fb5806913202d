package io.evitadb.scriptorium.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Answer to a job submission.
 *
 * @param jobId          id of the created job
 * @param glossarySource where the job's glossary comes from
 * @param glossaryId     catalog id of the glossary, if one was taken from the catalog
 */
public record SubmissionReceipt(
	@Nonnull String jobId,
	@Nonnull GlossarySource glossarySource,
	@Nullable String glossaryId
) {
}
