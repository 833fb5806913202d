package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.llm.GenerationException;
import io.evitadb.scriptorium.llm.GenerationRequest;
import io.evitadb.scriptorium.llm.PromptLoader;
import io.evitadb.scriptorium.model.Chunk;
import io.evitadb.scriptorium.model.ChunkOutcome;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.JobConfig;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Translates chunks concurrently on the worker pool. Each chunk is translated on its own; a chunk that
 * exhausts its retries yields a failure outcome while its siblings continue.
 */
public final class TranslationStage {

	static final String PROMPT_STAGE = "translate";

	private final PromptLoader prompts;

	public TranslationStage(@Nonnull PromptLoader prompts) {
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
	}

	/**
	 * Translates the given chunks.
	 *
	 * @param chunks      chunks to translate
	 * @param totalChunks number of chunks of the whole document, used for position hints in prompts
	 * @param glossary    terminology to enforce
	 * @param context     per-job collaborators
	 * @param onOutcome   receives each outcome on the calling thread as soon as it is available
	 * @return outcomes ordered by chunk index
	 * @throws InterruptedException if the calling thread is interrupted at the barrier
	 */
	@Nonnull
	public List<ChunkOutcome> translateAll(
		@Nonnull List<Chunk> chunks,
		int totalChunks,
		@Nonnull Glossary glossary,
		@Nonnull StageContext context,
		@Nonnull Consumer<ChunkOutcome> onOutcome
	) throws InterruptedException {
		Objects.requireNonNull(glossary, "glossary must not be null");
		return context.pool().runAll(
			chunks,
			chunk -> translate(chunk, totalChunks, glossary, context),
			onOutcome
		);
	}

	@Nonnull
	private ChunkOutcome translate(
		@Nonnull Chunk chunk,
		int totalChunks,
		@Nonnull Glossary glossary,
		@Nonnull StageContext context
	) throws JobCancelledException {
		if (chunk.sourceText().isBlank()) {
			return ChunkOutcome.success(chunk.index(), chunk.sourceText());
		}
		final GenerationRequest request = this.prompts.loadRequest(
			PROMPT_STAGE, promptValues(chunk, totalChunks, glossary, context.config())
		);
		try {
			final String translated = context.generator().generate(request);
			context.log().debug(context.logPrefix() + "Translated chunk " + (chunk.index() + 1) + "/" + totalChunks);
			return ChunkOutcome.success(chunk.index(), translated);
		} catch (GenerationException e) {
			return ChunkOutcome.failure(chunk.index(), e.getMessage());
		}
	}

	@Nonnull
	static Map<String, String> promptValues(
		@Nonnull Chunk chunk,
		int totalChunks,
		@Nonnull Glossary glossary,
		@Nonnull JobConfig config
	) {
		final Map<String, String> values = new HashMap<>();
		values.put("sourceLanguage", config.sourceLanguage());
		values.put("targetLanguage", config.targetLanguage());
		values.put("accent", config.targetLanguageAccent());
		values.put("contentType", describeContent(config.contentType(), chunk.sourceText()));
		values.put("glossary", glossary.toPromptGuidance(config.targetLanguage()));
		values.put("customInstructions", customInstructions(config));
		values.put("chunkPosition", (chunk.index() + 1) + " of " + totalChunks);
		values.put("chunkText", chunk.sourceText());
		return values;
	}

	/**
	 * Extends the configured content type with hints about code blocks and images in the chunk.
	 */
	@Nonnull
	static String describeContent(@Nonnull String contentType, @Nonnull String text) {
		final String lower = contentType.toLowerCase();
		String description = contentType;
		if (text.contains("```") && !lower.contains("code")) {
			description += " with code blocks";
		}
		if (text.contains("![") && !lower.contains("image")) {
			description += " with images";
		}
		return description;
	}

	@Nonnull
	static String customInstructions(@Nonnull JobConfig config) {
		final String instructions = config.customInstructions();
		return instructions == null || instructions.isBlank()
			? ""
			: "Additional instructions:\n" + instructions.strip();
	}
}
