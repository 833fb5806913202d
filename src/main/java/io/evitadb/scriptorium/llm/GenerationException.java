package io.evitadb.scriptorium.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Base class of failures raised by the generation backend.
 */
public abstract class GenerationException extends Exception {

	@Nonnull
	private final String stage;

	protected GenerationException(@Nonnull String stage, @Nonnull String message, @Nullable Throwable cause) {
		super(formatMessage(stage, message), cause);
		this.stage = Objects.requireNonNull(stage, "stage must not be null");
	}

	@Nonnull
	private static String formatMessage(@Nonnull String stage, @Nonnull String message) {
		return "[" + stage + "] " + message;
	}

	/**
	 * Returns true if another attempt may succeed.
	 */
	public abstract boolean isRetryable();

	/**
	 * Returns the label of the stage whose request failed.
	 *
	 * @return stage label
	 */
	@Nonnull
	public String getStage() {
		return this.stage;
	}
}
