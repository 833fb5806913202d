package io.evitadb.scriptorium.stage;

import com.fasterxml.jackson.databind.JsonNode;
import io.evitadb.scriptorium.llm.GenerationException;
import io.evitadb.scriptorium.llm.GenerationRequest;
import io.evitadb.scriptorium.llm.JsonResponseParser;
import io.evitadb.scriptorium.llm.MalformedResponseException;
import io.evitadb.scriptorium.llm.PromptLoader;
import io.evitadb.scriptorium.model.Chunk;
import io.evitadb.scriptorium.model.ChunkOutcome;
import io.evitadb.scriptorium.model.Critique;
import io.evitadb.scriptorium.model.Glossary;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Reviews the translated chunks and produces one document-level verdict.
 *
 * Every chunk is reviewed on the worker pool; the model answers with JSON containing its findings and a
 * `criticalError` flag. The findings are attributed to their chunk and the document is critical as
 * soon as one chunk is. If any review cannot be produced the whole verdict is critical: quality
 * assurance is never skipped silently.
 */
public final class CritiqueStage {

	static final String PROMPT_STAGE = "critique";

	private final PromptLoader prompts;
	private final JsonResponseParser jsonParser;

	public CritiqueStage(@Nonnull PromptLoader prompts, @Nonnull JsonResponseParser jsonParser) {
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
		this.jsonParser = Objects.requireNonNull(jsonParser, "jsonParser must not be null");
	}

	/**
	 * Critiques all translated chunks. Must only be called once every chunk has been translated.
	 *
	 * @param chunks    translated chunks
	 * @param glossary  terminology the translation should follow
	 * @param context   per-job collaborators
	 * @param onOutcome receives each per-chunk review on the calling thread
	 * @return aggregated verdict
	 * @throws InterruptedException if the calling thread is interrupted at the barrier
	 */
	@Nonnull
	public Critique critique(
		@Nonnull List<Chunk> chunks,
		@Nonnull Glossary glossary,
		@Nonnull StageContext context,
		@Nonnull Consumer<ChunkOutcome> onOutcome
	) throws InterruptedException {
		Objects.requireNonNull(glossary, "glossary must not be null");
		final List<ChunkOutcome> outcomes = context.pool().runAll(
			chunks, chunk -> review(chunk, glossary, context), onOutcome
		);
		return aggregate(outcomes);
	}

	/**
	 * Combines per-chunk reviews into one verdict.
	 */
	@Nonnull
	static Critique aggregate(@Nonnull List<ChunkOutcome> outcomes) {
		final Map<Integer, List<String>> chunkIssues = new TreeMap<>();
		final List<String> issues = new ArrayList<>();
		final List<String> failures = new ArrayList<>();
		boolean critical = false;

		for (ChunkOutcome outcome : outcomes) {
			if (!outcome.success()) {
				failures.add("chunk " + outcome.index() + ": " + outcome.errorMessage());
				continue;
			}
			if (!outcome.findings().isEmpty()) {
				chunkIssues.put(outcome.index(), outcome.findings());
			}
			if (outcome.critical()) {
				critical = true;
				issues.add("Chunk " + outcome.index() + " contains a critical error");
			}
		}

		if (!failures.isEmpty()) {
			return Critique.failed(String.join("; ", failures));
		}
		return new Critique(critical, issues, chunkIssues, null);
	}

	@Nonnull
	private ChunkOutcome review(
		@Nonnull Chunk chunk,
		@Nonnull Glossary glossary,
		@Nonnull StageContext context
	) throws JobCancelledException {
		if (chunk.translatedText() == null) {
			return ChunkOutcome.failure(chunk.index(), "Chunk has no translation to critique");
		}
		if (chunk.sourceText().isBlank()) {
			return ChunkOutcome.findings(chunk.index(), List.of(), false);
		}
		final Map<String, String> values = new HashMap<>();
		values.put("sourceLanguage", context.config().sourceLanguage());
		values.put("targetLanguage", context.config().targetLanguage());
		values.put("glossary", glossary.toPromptGuidance(context.config().targetLanguage()));
		values.put("originalText", chunk.sourceText());
		values.put("translatedText", chunk.translatedText());
		final GenerationRequest request = this.prompts.loadRequest(PROMPT_STAGE, values);

		try {
			return context.generator().generate(request, text -> parseReview(chunk.index(), text));
		} catch (GenerationException e) {
			return ChunkOutcome.failure(chunk.index(), e.getMessage());
		}
	}

	/**
	 * Reads a review answer. Recognized keys are `criticalError`, `issues`, `suggestedImprovements`,
	 * `glossaryAdherence` and `overallAssessment`; at least one of the finding keys must be present.
	 */
	@Nonnull
	ChunkOutcome parseReview(int index, @Nonnull String text) throws MalformedResponseException {
		final JsonNode review = this.jsonParser.parse(PROMPT_STAGE, text);
		if (!review.isObject()) {
			throw new MalformedResponseException(PROMPT_STAGE, "Critique must be a JSON object", text);
		}
		if (!review.has("issues") && !review.has("suggestedImprovements") && !review.has("overallAssessment")) {
			throw new MalformedResponseException(PROMPT_STAGE, "Critique is missing its findings", text);
		}

		final List<String> findings = new ArrayList<>();
		collectText(review.get("issues"), findings);
		collectText(review.get("suggestedImprovements"), findings);
		final JsonNode adherence = review.get("glossaryAdherence");
		if (adherence != null && adherence.isTextual() && !adherence.asText().isBlank()
			&& !adherence.asText().toLowerCase().startsWith("good")) {
			findings.add("Glossary adherence: " + adherence.asText());
		}
		final boolean critical = review.path("criticalError").asBoolean(false);
		return ChunkOutcome.findings(index, findings, critical);
	}

	private static void collectText(JsonNode node, @Nonnull List<String> target) {
		if (node == null || node.isNull()) {
			return;
		}
		if (node.isArray()) {
			for (JsonNode item : node) {
				collectText(item, target);
			}
		} else if (node.isObject()) {
			final JsonNode description = node.has("description") ? node.get("description") : node.get("issue");
			if (description != null && description.isTextual() && !description.asText().isBlank()) {
				target.add(description.asText().strip());
			}
		} else if (!node.asText().isBlank()) {
			target.add(node.asText().strip());
		}
	}
}
