package io.evitadb.scriptorium.stage;

import com.fasterxml.jackson.databind.JsonNode;
import io.evitadb.scriptorium.llm.GenerationException;
import io.evitadb.scriptorium.llm.GenerationRequest;
import io.evitadb.scriptorium.llm.JsonResponseParser;
import io.evitadb.scriptorium.llm.MalformedResponseException;
import io.evitadb.scriptorium.llm.PromptLoader;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.GlossarySource;
import io.evitadb.scriptorium.model.GlossaryTerm;
import io.evitadb.scriptorium.model.JobConfig;
import io.evitadb.scriptorium.model.TranslationMode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Produces the glossary used by the translation and critique prompts.
 *
 * - quick mode: empty glossary, no generation call
 * - deep mode with a user glossary: the user glossary, optionally reduced to terms found in the document
 * - deep mode without one: terms extracted from the beginning of the document by the model
 *
 * Terminology unification improves quality but is not required for a correct translation, so any
 * extraction failure degrades to an empty glossary instead of failing the job.
 */
public final class GlossaryResolver {

	static final String PROMPT_STAGE = "extract-terms";
	public static final int DEFAULT_EXCERPT_LENGTH = 8000;

	private final PromptLoader prompts;
	private final JsonResponseParser jsonParser;
	private final int excerptLength;

	public GlossaryResolver(@Nonnull PromptLoader prompts, @Nonnull JsonResponseParser jsonParser, int excerptLength) {
		if (excerptLength < 1) {
			throw new IllegalArgumentException("excerptLength must be positive");
		}
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
		this.jsonParser = Objects.requireNonNull(jsonParser, "jsonParser must not be null");
		this.excerptLength = excerptLength;
	}

	/**
	 * Resolves the glossary of a job.
	 *
	 * @param document     the full source document
	 * @param userGlossary glossary supplied with the job, null if none
	 * @param userSource   where the user glossary came from, ignored when there is none
	 * @param context      per-job collaborators
	 * @return the resolution, never failing
	 * @throws JobCancelledException if the job is cancelled during extraction
	 */
	@Nonnull
	public GlossaryResolution resolve(
		@Nonnull String document,
		@Nullable Glossary userGlossary,
		@Nonnull GlossarySource userSource,
		@Nonnull StageContext context
	) throws JobCancelledException {
		Objects.requireNonNull(document, "document must not be null");
		final JobConfig config = context.config();

		if (config.translationMode() == TranslationMode.QUICK) {
			return new GlossaryResolution(Glossary.empty(), GlossarySource.NONE, false);
		}

		if (userGlossary != null) {
			final Glossary glossary = config.filterGlossaryToDocument() ? userGlossary.filterTo(document) : userGlossary;
			context.log().info(
				context.logPrefix() + "Using " + userSource.value() + " glossary with " + glossary.size() +
					" of " + userGlossary.size() + " terms relevant to the document"
			);
			return new GlossaryResolution(glossary, userSource, false);
		}

		final String excerpt = document.length() > this.excerptLength
			? document.substring(0, this.excerptLength)
			: document;
		final Map<String, String> values = Map.of(
			"sourceLanguage", config.sourceLanguage(),
			"targetLanguage", config.targetLanguage(),
			"contentType", config.contentType(),
			"documentExcerpt", excerpt
		);
		final GenerationRequest request = this.prompts.loadRequest(PROMPT_STAGE, values);

		try {
			final Glossary extracted = context.generator().generate(request, this::parseTerms);
			context.log().info(context.logPrefix() + "Extracted " + extracted.size() + " glossary terms");
			return new GlossaryResolution(extracted, GlossarySource.AUTO_EXTRACTED, false);
		} catch (GenerationException e) {
			context.log().warn(
				context.logPrefix() + "Terminology extraction failed, continuing without glossary: " + e.getMessage()
			);
			return new GlossaryResolution(Glossary.empty(), GlossarySource.AUTO_EXTRACTED, true);
		}
	}

	/**
	 * Reads extracted terms. Accepts a JSON array of terms or an object with a `terms` array. Each term
	 * needs a `sourceTerm` and either a `proposedTranslations` object or a `translation` string; entries
	 * without them are skipped. Duplicates are resolved by the last entry.
	 */
	@Nonnull
	Glossary parseTerms(@Nonnull String text) throws MalformedResponseException {
		final JsonNode root = this.jsonParser.parse(PROMPT_STAGE, text);
		final JsonNode items = root.isArray() ? root : root.get("terms");
		if (items == null || !items.isArray()) {
			throw new MalformedResponseException(PROMPT_STAGE, "Expected a JSON array of terms", text);
		}

		final List<GlossaryTerm> terms = new ArrayList<>();
		for (JsonNode item : items) {
			final String sourceTerm = item.path("sourceTerm").asText("").strip();
			if (sourceTerm.isEmpty()) {
				continue;
			}
			final Map<String, String> translations = new LinkedHashMap<>();
			final JsonNode proposed = item.get("proposedTranslations");
			if (proposed != null && proposed.isObject()) {
				final Iterator<Map.Entry<String, JsonNode>> fields = proposed.fields();
				while (fields.hasNext()) {
					final Map.Entry<String, JsonNode> field = fields.next();
					if (field.getValue().isTextual() && !field.getValue().asText().isBlank()) {
						translations.put(field.getKey(), field.getValue().asText().strip());
					}
				}
			}
			final JsonNode single = item.get("translation");
			if (single != null && single.isTextual() && !single.asText().isBlank()) {
				translations.putIfAbsent(GlossaryTerm.DEFAULT_KEY, single.asText().strip());
			}
			if (!translations.isEmpty()) {
				terms.add(new GlossaryTerm(sourceTerm, translations));
			}
		}
		return Glossary.of(terms);
	}
}
