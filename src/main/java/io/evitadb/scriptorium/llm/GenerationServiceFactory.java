package io.evitadb.scriptorium.llm;

import io.evitadb.scriptorium.model.JobConfig;

import javax.annotation.Nonnull;

/**
 * Resolves the generation backend for a job from its provider and model selectors.
 */
@FunctionalInterface
public interface GenerationServiceFactory {

	/**
	 * Returns the generation service to use for the given configuration.
	 *
	 * @param config job configuration
	 * @return generation service
	 * @throws IllegalArgumentException if the configuration selects an unknown or unconfigured provider
	 */
	@Nonnull
	GenerationService create(@Nonnull JobConfig config);
}
