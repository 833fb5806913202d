package io.evitadb.scriptorium.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Creates LangChain4j chat models for the providers the pipeline can talk to. OpenAI covers every
 * OpenAI-compatible endpoint (Groq, Ollama, DeepSeek, OpenRouter...).
 *
 * Retries are left to the pipeline, which applies its own bounded backoff per chunk, so the models are
 * built with `maxRetries(0)`.
 */
public final class ChatModelFactory {

	private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
	private static final double DEFAULT_TEMPERATURE = 0.3;
	private static final String DEFAULT_OPENAI_MODEL = "gpt-4o";
	private static final String DEFAULT_ANTHROPIC_MODEL = "claude-sonnet-4-5-20250929";

	public static final String PROVIDER_OPENAI = "openai";
	public static final String PROVIDER_ANTHROPIC = "anthropic";
	public static final String DEFAULT_OPENAI_URL = "https://api.openai.com/v1";
	public static final String DEFAULT_ANTHROPIC_URL = "https://api.anthropic.com/v1";

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a ChatModel for the given provider, endpoint URL and API token.
	 *
	 * @param provider  the provider name ("openai" or "anthropic")
	 * @param llmUrl    base URL of the endpoint
	 * @param llmToken  API key, may be null for local endpoints
	 * @param modelName model name, null for the provider default
	 * @return configured ChatModel
	 * @throws IllegalArgumentException if the provider is unknown or the URL is blank
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nonnull String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName
	) {
		Objects.requireNonNull(provider, "provider must not be null");
		Objects.requireNonNull(llmUrl, "llmUrl must not be null");
		if (llmUrl.isBlank()) {
			throw new IllegalArgumentException("llmUrl must not be blank");
		}

		final String baseUrl = normalizeUrl(llmUrl);
		return switch (normalizeProvider(provider)) {
			case PROVIDER_OPENAI -> OpenAiChatModel.builder()
				.baseUrl(baseUrl)
				.apiKey(llmToken != null && !llmToken.isBlank() ? llmToken : "none")
				.modelName(resolveModelName(provider, modelName))
				.timeout(DEFAULT_TIMEOUT)
				.temperature(DEFAULT_TEMPERATURE)
				.maxRetries(0)
				.build();
			case PROVIDER_ANTHROPIC -> {
				final AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
					.baseUrl(baseUrl)
					.modelName(resolveModelName(provider, modelName))
					.timeout(DEFAULT_TIMEOUT)
					.temperature(DEFAULT_TEMPERATURE)
					.maxRetries(0);
				if (llmToken != null && !llmToken.isBlank()) {
					builder.apiKey(llmToken);
				}
				yield builder.build();
			}
			default -> throw unknownProvider(provider);
		};
	}

	/**
	 * Returns the public endpoint of a provider, used when no URL is configured.
	 *
	 * @param provider provider name
	 * @return default base URL
	 */
	@Nonnull
	public static String defaultUrl(@Nonnull String provider) {
		return switch (normalizeProvider(provider)) {
			case PROVIDER_OPENAI -> DEFAULT_OPENAI_URL;
			case PROVIDER_ANTHROPIC -> DEFAULT_ANTHROPIC_URL;
			default -> throw unknownProvider(provider);
		};
	}

	/**
	 * Returns the model name that will be used for the provider.
	 *
	 * @param provider  provider name
	 * @param modelName requested model, may be null
	 * @return effective model name
	 */
	@Nonnull
	public static String resolveModelName(@Nonnull String provider, @Nullable String modelName) {
		if (modelName != null && !modelName.isBlank()) {
			return modelName;
		}
		return switch (normalizeProvider(provider)) {
			case PROVIDER_OPENAI -> DEFAULT_OPENAI_MODEL;
			case PROVIDER_ANTHROPIC -> DEFAULT_ANTHROPIC_MODEL;
			default -> throw unknownProvider(provider);
		};
	}

	/**
	 * Lower-cases and trims a provider name.
	 */
	@Nonnull
	public static String normalizeProvider(@Nonnull String provider) {
		return provider.toLowerCase().trim();
	}

	@Nonnull
	private static IllegalArgumentException unknownProvider(@Nonnull String provider) {
		return new IllegalArgumentException(
			"Unknown provider: " + provider + ". Supported providers: " + PROVIDER_OPENAI + ", " + PROVIDER_ANTHROPIC
		);
	}

	@Nonnull
	private static String normalizeUrl(@Nonnull String url) {
		String normalized = url.trim();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}
}
