package io.evitadb.scriptorium.llm;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Generation service backed by a LangChain4j {@link ChatModel}.
 *
 * Error classification:
 * - {@link NonRetriableException} (authentication, invalid request, model not found) becomes a
 *   {@link GenerationFatalException} and puts the client into a permanent failure state, so that
 *   concurrent workers fail fast instead of hammering a backend that will reject them anyway
 * - any other runtime exception becomes a {@link GenerationTransientException}
 * - an empty answer becomes a {@link MalformedResponseException}
 */
public final class LlmGenerationService implements GenerationService {

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final AtomicBoolean permanentFailure = new AtomicBoolean(false);
	@Nonnull
	private final AtomicReference<NonRetriableException> failureCause = new AtomicReference<>();

	/**
	 * Creates a generation service wrapping the given ChatModel.
	 *
	 * @param model the underlying chat model
	 */
	public LlmGenerationService(@Nonnull ChatModel model) {
		this.model = Objects.requireNonNull(model, "model must not be null");
	}

	@Nonnull
	@Override
	public GenerationResult generate(@Nonnull GenerationRequest request) throws GenerationException {
		Objects.requireNonNull(request, "request must not be null");

		if (this.permanentFailure.get()) {
			final NonRetriableException cause = this.failureCause.get();
			throw new GenerationFatalException(
				request.stage(),
				"LLM client shut down due to previous permanent failure" + (cause != null ? ": " + cause.getMessage() : ""),
				cause
			);
		}

		final ChatResponse response;
		try {
			response = this.model.chat(List.of(
				SystemMessage.from(request.systemPrompt()),
				UserMessage.from(request.userPrompt())
			));
		} catch (NonRetriableException e) {
			this.failureCause.set(e);
			this.permanentFailure.set(true);
			throw new GenerationFatalException(request.stage(), describe(e), e);
		} catch (RuntimeException e) {
			throw new GenerationTransientException(request.stage(), describe(e), e);
		}

		final String text = response.aiMessage() != null ? response.aiMessage().text() : null;
		if (text == null || text.isBlank()) {
			throw new MalformedResponseException(request.stage(), "LLM returned an empty response", text);
		}

		final TokenUsage tokenUsage = response.tokenUsage();
		return new GenerationResult(
			text,
			tokenUsage != null ? count(tokenUsage.inputTokenCount()) : 0,
			tokenUsage != null ? count(tokenUsage.outputTokenCount()) : 0
		);
	}

	/**
	 * Checks if a permanent failure has occurred.
	 *
	 * @return true if every further call fails immediately
	 */
	public boolean hasPermanentFailure() {
		return this.permanentFailure.get();
	}

	/**
	 * Returns the cause of the permanent failure, if any.
	 *
	 * @return the permanent failure exception or null
	 */
	@Nullable
	public NonRetriableException getFailureCause() {
		return this.failureCause.get();
	}

	private static long count(@Nullable Integer tokens) {
		return tokens != null ? tokens : 0;
	}

	@Nonnull
	private static String describe(@Nonnull Exception e) {
		return e.getClass().getSimpleName() + ": " + e.getMessage();
	}
}
