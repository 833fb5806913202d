package io.evitadb.scriptorium.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Request to translate a document.
 *
 * @param jobId            client-assigned id, null to let the service generate one
 * @param originalContent  document to translate
 * @param originalFilename name of the uploaded file, informational
 * @param config           translation configuration
 * @param glossarySelector which glossary the job should use
 */
public record JobSubmission(
	@Nullable String jobId,
	@Nonnull String originalContent,
	@Nullable String originalFilename,
	@Nonnull JobConfig config,
	@Nonnull GlossarySelector glossarySelector
) {

	public JobSubmission {
		Objects.requireNonNull(originalContent, "originalContent must not be null");
		Objects.requireNonNull(config, "config must not be null");
		glossarySelector = glossarySelector == null ? GlossarySelector.none() : glossarySelector;
	}

	@Nonnull
	public static JobSubmission of(@Nonnull String originalContent, @Nonnull JobConfig config) {
		return new JobSubmission(null, originalContent, null, config, GlossarySelector.none());
	}
}
