package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.llm.GenerationException;
import io.evitadb.scriptorium.llm.GenerationRequest;
import io.evitadb.scriptorium.llm.PromptLoader;
import io.evitadb.scriptorium.model.Chunk;
import io.evitadb.scriptorium.model.ChunkOutcome;
import io.evitadb.scriptorium.model.Critique;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.JobConfig;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Refines translated chunks using the critique findings. Runs on the worker pool with the same retry
 * contract as translation. A failure outcome here is not fatal: the engine keeps the chunk's initial
 * translation.
 */
public final class RevisionStage {

	static final String PROMPT_STAGE = "revise";
	private static final String NO_FINDINGS = "No specific issues were reported. Polish fluency and terminology only.";

	private final PromptLoader prompts;

	public RevisionStage(@Nonnull PromptLoader prompts) {
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
	}

	/**
	 * Revises the given chunks.
	 *
	 * @param chunks    translated chunks
	 * @param critique  verdict of the critique stage
	 * @param glossary  terminology to enforce
	 * @param context   per-job collaborators
	 * @param onOutcome receives each outcome on the calling thread
	 * @return outcomes ordered by chunk index
	 * @throws InterruptedException if the calling thread is interrupted at the barrier
	 */
	@Nonnull
	public List<ChunkOutcome> reviseAll(
		@Nonnull List<Chunk> chunks,
		@Nonnull Critique critique,
		@Nonnull Glossary glossary,
		@Nonnull StageContext context,
		@Nonnull Consumer<ChunkOutcome> onOutcome
	) throws InterruptedException {
		Objects.requireNonNull(critique, "critique must not be null");
		Objects.requireNonNull(glossary, "glossary must not be null");
		return context.pool().runAll(chunks, chunk -> revise(chunk, critique, glossary, context), onOutcome);
	}

	@Nonnull
	private ChunkOutcome revise(
		@Nonnull Chunk chunk,
		@Nonnull Critique critique,
		@Nonnull Glossary glossary,
		@Nonnull StageContext context
	) throws JobCancelledException {
		if (chunk.translatedText() == null) {
			return ChunkOutcome.failure(chunk.index(), "Chunk has no translation to revise");
		}
		if (chunk.sourceText().isBlank()) {
			return ChunkOutcome.success(chunk.index(), chunk.translatedText());
		}
		final GenerationRequest request = this.prompts.loadRequest(
			PROMPT_STAGE, promptValues(chunk, critique.findingsFor(chunk.index()), glossary, context.config())
		);
		try {
			return ChunkOutcome.success(chunk.index(), context.generator().generate(request));
		} catch (GenerationException e) {
			return ChunkOutcome.failure(chunk.index(), e.getMessage());
		}
	}

	@Nonnull
	static Map<String, String> promptValues(
		@Nonnull Chunk chunk,
		@Nonnull List<String> findings,
		@Nonnull Glossary glossary,
		@Nonnull JobConfig config
	) {
		final Map<String, String> values = new HashMap<>();
		values.put("sourceLanguage", config.sourceLanguage());
		values.put("targetLanguage", config.targetLanguage());
		values.put("accent", config.targetLanguageAccent());
		values.put("glossary", glossary.toPromptGuidance(config.targetLanguage()));
		values.put("critiqueFeedback", formatFindings(findings));
		values.put("originalText", chunk.sourceText());
		values.put("initialTranslation", Objects.requireNonNull(chunk.translatedText()));
		return values;
	}

	@Nonnull
	static String formatFindings(@Nonnull List<String> findings) {
		if (findings.isEmpty()) {
			return NO_FINDINGS;
		}
		final StringBuilder feedback = new StringBuilder();
		for (String finding : findings) {
			feedback.append("- ").append(finding).append('\n');
		}
		return feedback.toString().stripTrailing();
	}
}
