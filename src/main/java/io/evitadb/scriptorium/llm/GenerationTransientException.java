package io.evitadb.scriptorium.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Retryable generation failure: timeout, rate limit, unusable output or any error that could not be
 * classified.
 */
public class GenerationTransientException extends GenerationException {

	public GenerationTransientException(@Nonnull String stage, @Nonnull String message) {
		super(stage, message, null);
	}

	public GenerationTransientException(@Nonnull String stage, @Nonnull String message, @Nullable Throwable cause) {
		super(stage, message, cause);
	}

	@Override
	public boolean isRetryable() {
		return true;
	}
}
