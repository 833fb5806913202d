package io.evitadb.scriptorium.chunk;

import javax.annotation.Nonnull;

/**
 * Exception thrown when a document cannot be split into chunks, typically because it is empty.
 * Chunking errors are fatal for the job and never retried.
 */
public final class ChunkingException extends Exception {

	private final int documentLength;

	/**
	 * Creates a new ChunkingException.
	 *
	 * @param message        description of the failure
	 * @param documentLength length of the rejected document in characters
	 */
	public ChunkingException(@Nonnull String message, int documentLength) {
		super(formatMessage(message, documentLength));
		this.documentLength = documentLength;
	}

	@Nonnull
	private static String formatMessage(@Nonnull String message, int documentLength) {
		if (documentLength > 0) {
			return message + " (document length " + documentLength + " characters)";
		}
		return message;
	}

	/**
	 * Returns the length of the rejected document.
	 *
	 * @return length in characters
	 */
	public int getDocumentLength() {
		return this.documentLength;
	}
}
