package io.evitadb.scriptorium.llm;

import javax.annotation.Nonnull;

/**
 * The generation capability the pipeline depends on. Implementations must be safe for concurrent use
 * by the worker pool.
 */
public interface GenerationService {

	/**
	 * Generates text for the given prompt.
	 *
	 * @param request the prompt
	 * @return generated text and token usage
	 * @throws GenerationTransientException on failures worth retrying (timeouts, rate limits, unusable output)
	 * @throws GenerationFatalException     on failures that retrying cannot fix (authentication, bad request)
	 */
	@Nonnull
	GenerationResult generate(@Nonnull GenerationRequest request) throws GenerationException;
}
