package io.evitadb.scriptorium.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Non-retryable generation failure such as an authentication error or an invalid request.
 */
public final class GenerationFatalException extends GenerationException {

	public GenerationFatalException(@Nonnull String stage, @Nonnull String message, @Nullable Throwable cause) {
		super(stage, message, cause);
	}

	@Override
	public boolean isRetryable() {
		return false;
	}
}
