package io.evitadb.scriptorium.llm;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Text produced by the generation backend together with token usage of the call.
 *
 * @param text             generated text
 * @param promptTokens     tokens consumed by the prompt
 * @param completionTokens tokens produced in the response
 */
public record GenerationResult(
	@Nonnull String text,
	long promptTokens,
	long completionTokens
) {

	public GenerationResult {
		Objects.requireNonNull(text, "text must not be null");
	}

	@Nonnull
	public static GenerationResult of(@Nonnull String text) {
		return new GenerationResult(text, 0, 0);
	}
}
