package io.evitadb.scriptorium.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Immutable translation configuration of a job. Once a job has been submitted its configuration
 * never changes; a different configuration means a new job.
 *
 * @param sourceLanguage           free-form source language identifier
 * @param targetLanguage           free-form target language identifier
 * @param provider                 generation provider selector, null for the service default
 * @param model                    model name, null for the provider default
 * @param targetLanguageAccent     style directive passed to the translation prompts
 * @param translationMode          quick or deep pipeline
 * @param maxChunkSize             maximum chunk size in characters
 * @param contentType              description of the document kind used in prompts
 * @param customInstructions       additional instructions appended to translation prompts
 * @param filterGlossaryToDocument whether a user glossary is reduced to terms occurring in the document
 */
public record JobConfig(
	@Nonnull String sourceLanguage,
	@Nonnull String targetLanguage,
	@Nullable String provider,
	@Nullable String model,
	@Nonnull String targetLanguageAccent,
	@Nonnull TranslationMode translationMode,
	int maxChunkSize,
	@Nonnull String contentType,
	@Nullable String customInstructions,
	boolean filterGlossaryToDocument
) {

	public static final String DEFAULT_ACCENT = "professional";
	public static final String DEFAULT_CONTENT_TYPE = "general document";
	public static final int DEFAULT_MAX_CHUNK_SIZE = 2000;

	public JobConfig {
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		if (sourceLanguage.isBlank() || targetLanguage.isBlank()) {
			throw new IllegalArgumentException("source and target language must not be blank");
		}
		targetLanguageAccent = targetLanguageAccent == null || targetLanguageAccent.isBlank()
			? DEFAULT_ACCENT : targetLanguageAccent;
		translationMode = translationMode == null ? TranslationMode.DEEP : translationMode;
		maxChunkSize = maxChunkSize <= 0 ? DEFAULT_MAX_CHUNK_SIZE : maxChunkSize;
		contentType = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
	}

	/**
	 * Creates a configuration with defaults for everything except languages and mode.
	 *
	 * @param sourceLanguage source language
	 * @param targetLanguage target language
	 * @param mode           pipeline variant
	 * @return new configuration
	 */
	@Nonnull
	public static JobConfig of(@Nonnull String sourceLanguage, @Nonnull String targetLanguage, @Nonnull TranslationMode mode) {
		return new JobConfig(
			sourceLanguage, targetLanguage, null, null, DEFAULT_ACCENT, mode,
			DEFAULT_MAX_CHUNK_SIZE, DEFAULT_CONTENT_TYPE, null, true
		);
	}

	@Nonnull
	public JobConfig withProvider(@Nullable String provider, @Nullable String model) {
		return new JobConfig(
			this.sourceLanguage, this.targetLanguage, provider, model, this.targetLanguageAccent,
			this.translationMode, this.maxChunkSize, this.contentType, this.customInstructions,
			this.filterGlossaryToDocument
		);
	}

	@Nonnull
	public JobConfig withAccent(@Nullable String accent) {
		return new JobConfig(
			this.sourceLanguage, this.targetLanguage, this.provider, this.model, accent,
			this.translationMode, this.maxChunkSize, this.contentType, this.customInstructions,
			this.filterGlossaryToDocument
		);
	}

	@Nonnull
	public JobConfig withMaxChunkSize(int maxChunkSize) {
		return new JobConfig(
			this.sourceLanguage, this.targetLanguage, this.provider, this.model, this.targetLanguageAccent,
			this.translationMode, maxChunkSize, this.contentType, this.customInstructions,
			this.filterGlossaryToDocument
		);
	}

	@Nonnull
	public JobConfig withContentType(@Nullable String contentType, @Nullable String customInstructions) {
		return new JobConfig(
			this.sourceLanguage, this.targetLanguage, this.provider, this.model, this.targetLanguageAccent,
			this.translationMode, this.maxChunkSize, contentType, customInstructions,
			this.filterGlossaryToDocument
		);
	}

	@Nonnull
	public JobConfig withGlossaryFiltering(boolean filterGlossaryToDocument) {
		return new JobConfig(
			this.sourceLanguage, this.targetLanguage, this.provider, this.model, this.targetLanguageAccent,
			this.translationMode, this.maxChunkSize, this.contentType, this.customInstructions,
			filterGlossaryToDocument
		);
	}

	/**
	 * Shortcut for the pipeline variant.
	 */
	@Nonnull
	public TranslationMode mode() {
		return this.translationMode;
	}
}
