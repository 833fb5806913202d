package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.model.Chunk;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Joins processed chunks into the final document.
 *
 * Chunks are ordered by index, never by completion order. The chunker keeps boundary whitespace inside
 * the source chunks; generated text usually loses it, so each output is trimmed and wrapped in the
 * leading and trailing whitespace of its source chunk. With an identity translation the result is
 * therefore exactly the source document.
 */
public final class Assembler {

	private Assembler() {
		// Utility class - prevent instantiation
	}

	/**
	 * Assembles the document from refined text where present, otherwise from translated text.
	 *
	 * @param chunks all chunks of the job, in any order
	 * @return the assembled document
	 * @throws IllegalStateException if a chunk has no translated text
	 */
	@Nonnull
	public static String assemble(@Nonnull List<Chunk> chunks) {
		Objects.requireNonNull(chunks, "chunks must not be null");

		final List<Chunk> ordered = new ArrayList<>(chunks);
		ordered.sort(Comparator.comparingInt(Chunk::index));

		final StringBuilder document = new StringBuilder();
		for (Chunk chunk : ordered) {
			final String output = chunk.outputText();
			if (output == null) {
				throw new IllegalStateException("Chunk " + chunk.index() + " has no translated text (status " + chunk.status().value() + ")");
			}
			document.append(withSourceWhitespace(chunk.sourceText(), output));
		}
		return document.toString();
	}

	/**
	 * Wraps the trimmed output in the whitespace that surrounds the source chunk.
	 */
	@Nonnull
	static String withSourceWhitespace(@Nonnull String source, @Nonnull String output) {
		if (source.isBlank()) {
			return source;
		}
		final String core = output.strip();
		final int leadingEnd = source.length() - source.stripLeading().length();
		final int trailingStart = source.stripTrailing().length();
		return source.substring(0, leadingEnd) + core + source.substring(trailingStart);
	}
}
