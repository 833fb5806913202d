package io.evitadb.scriptorium.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The backend answered, but the answer could not be used (empty text, unparseable JSON, missing keys).
 * Retried like any other transient failure.
 */
public final class MalformedResponseException extends GenerationTransientException {

	@Nullable
	private final String rawResponse;

	public MalformedResponseException(@Nonnull String stage, @Nonnull String message, @Nullable String rawResponse) {
		super(stage, message);
		this.rawResponse = rawResponse;
	}

	public MalformedResponseException(
		@Nonnull String stage,
		@Nonnull String message,
		@Nullable String rawResponse,
		@Nonnull Throwable cause
	) {
		super(stage, message, cause);
		this.rawResponse = rawResponse;
	}

	/**
	 * Returns the raw response that could not be used.
	 *
	 * @return raw response or null
	 */
	@Nullable
	public String getRawResponse() {
		return this.rawResponse;
	}
}
