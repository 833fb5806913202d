package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * An ordered, indexed segment of the source document sized for one generation call.
 * The index is assigned once by the chunker and never changes; every transition returns a new instance.
 *
 * @param index          0-based position in the document
 * @param sourceText     original text including its boundary whitespace
 * @param translatedText translation, null until the translation stage finishes the chunk
 * @param refinedText    revised translation, only populated in deep mode
 * @param status         processing status
 * @param errorMessage   last error recorded for the chunk, null if none
 */
public record Chunk(
	int index,
	@Nonnull String sourceText,
	@JsonProperty("translated_chunk") @Nullable String translatedText,
	@Nullable String refinedText,
	@Nonnull ChunkStatus status,
	@Nullable String errorMessage
) {

	public Chunk {
		if (index < 0) {
			throw new IllegalArgumentException("index must not be negative");
		}
		Objects.requireNonNull(sourceText, "sourceText must not be null");
		status = status == null ? ChunkStatus.PENDING : status;
	}

	/**
	 * Creates a fresh chunk as produced by the chunker.
	 */
	@Nonnull
	public static Chunk of(int index, @Nonnull String sourceText) {
		return new Chunk(index, sourceText, null, null, ChunkStatus.PENDING, null);
	}

	@Nonnull
	public Chunk translating() {
		return new Chunk(this.index, this.sourceText, this.translatedText, this.refinedText, ChunkStatus.TRANSLATING, this.errorMessage);
	}

	@Nonnull
	public Chunk translated(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		return new Chunk(this.index, this.sourceText, text, null, ChunkStatus.TRANSLATED, null);
	}

	@Nonnull
	public Chunk failed(@Nonnull String error) {
		return new Chunk(this.index, this.sourceText, this.translatedText, this.refinedText, ChunkStatus.FAILED, error);
	}

	@Nonnull
	public Chunk critiqued() {
		return new Chunk(this.index, this.sourceText, this.translatedText, this.refinedText, ChunkStatus.CRITIQUED, this.errorMessage);
	}

	@Nonnull
	public Chunk refined(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		return new Chunk(this.index, this.sourceText, this.translatedText, text, ChunkStatus.REFINED, null);
	}

	/**
	 * Keeps the pre-revision translation after a failed revision and records why.
	 */
	@Nonnull
	public Chunk revisionSkipped(@Nonnull String error) {
		return new Chunk(this.index, this.sourceText, this.translatedText, null, ChunkStatus.CRITIQUED, error);
	}

	/**
	 * Returns the chunk to its initial state, dropping any output. Used when a failed job is resumed.
	 */
	@Nonnull
	public Chunk reset() {
		return of(this.index, this.sourceText);
	}

	/**
	 * Text that goes into the assembled document: the refined translation if present, otherwise the
	 * initial translation.
	 */
	@Nullable
	public String outputText() {
		return this.refinedText != null ? this.refinedText : this.translatedText;
	}
}
