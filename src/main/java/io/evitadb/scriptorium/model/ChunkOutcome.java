package io.evitadb.scriptorium.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Result of processing one chunk on the worker pool.
 *
 * @param index        index of the processed chunk
 * @param success      whether the chunk was processed
 * @param text         produced text on success
 * @param findings     findings produced by critique work, empty otherwise
 * @param critical     whether critique work flagged a critical error
 * @param errorMessage cause of the failure
 */
public record ChunkOutcome(
	int index,
	boolean success,
	@Nullable String text,
	@Nonnull List<String> findings,
	boolean critical,
	@Nullable String errorMessage
) {

	public ChunkOutcome {
		findings = findings == null ? List.of() : List.copyOf(findings);
	}

	@Nonnull
	public static ChunkOutcome success(int index, @Nonnull String text) {
		return new ChunkOutcome(index, true, text, null, false, null);
	}

	@Nonnull
	public static ChunkOutcome findings(int index, @Nonnull List<String> findings, boolean critical) {
		return new ChunkOutcome(index, true, null, findings, critical, null);
	}

	@Nonnull
	public static ChunkOutcome failure(int index, @Nonnull String errorMessage) {
		return new ChunkOutcome(index, false, null, null, false, errorMessage);
	}
}
