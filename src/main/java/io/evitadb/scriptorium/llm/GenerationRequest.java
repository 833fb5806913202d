package io.evitadb.scriptorium.llm;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A single prompt sent to the generation backend.
 *
 * @param stage        short label of the requesting stage, used in logs and errors (e.g. `translate`, `critique`)
 * @param systemPrompt system instructions
 * @param userPrompt   user message with the content to process
 */
public record GenerationRequest(
	@Nonnull String stage,
	@Nonnull String systemPrompt,
	@Nonnull String userPrompt
) {

	public GenerationRequest {
		Objects.requireNonNull(stage, "stage must not be null");
		Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
		Objects.requireNonNull(userPrompt, "userPrompt must not be null");
	}
}
