package io.evitadb.scriptorium.llm;

import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.scriptorium.model.JobConfig;
import io.evitadb.scriptorium.model.TranslationMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChatModelFactory should create ChatModel instances for different providers")
public class ChatModelFactoryTest {

	@Test
	@DisplayName("shouldCreateOpenAiModelWithUrl")
	void shouldCreateOpenAiModelWithUrl() {
		final ChatModel model = ChatModelFactory.create("openai", "https://api.openai.com/v1", "test-api-key", "gpt-4o");

		assertNotNull(model);
	}

	@Test
	@DisplayName("shouldCreateAnthropicModelWithUrl")
	void shouldCreateAnthropicModelWithUrl() {
		final ChatModel model = ChatModelFactory.create("anthropic", "https://api.anthropic.com/v1///", "test-api-key", null);

		assertNotNull(model);
	}

	@Test
	@DisplayName("shouldThrowOnInvalidProvider")
	void shouldThrowOnInvalidProvider() {
		final Exception exception = assertThrows(IllegalArgumentException.class, () ->
			ChatModelFactory.create("unknown", "https://example.com", "key", null)
		);

		assertTrue(exception.getMessage().contains("Unknown provider"));
		assertTrue(exception.getMessage().contains("openai"));
		assertTrue(exception.getMessage().contains("anthropic"));
	}

	@Test
	@DisplayName("shouldThrowOnBlankUrl")
	void shouldThrowOnBlankUrl() {
		final Exception exception = assertThrows(IllegalArgumentException.class, () ->
			ChatModelFactory.create("openai", "   ", "key", null)
		);

		assertTrue(exception.getMessage().contains("blank"));
	}

	@Test
	@DisplayName("shouldHandleMissingTokenForLocalEndpoints")
	void shouldHandleMissingTokenForLocalEndpoints() {
		assertNotNull(ChatModelFactory.create("openai", "http://localhost:11434/v1", null, "llama3"));
		assertNotNull(ChatModelFactory.create("  OpenAI ", "http://localhost:11434/v1", "   ", null));
	}

	@Test
	@DisplayName("shouldResolveDefaultsPerProvider")
	void shouldResolveDefaultsPerProvider() {
		assertEquals("gpt-4o", ChatModelFactory.resolveModelName("openai", null));
		assertEquals("my-model", ChatModelFactory.resolveModelName("anthropic", "my-model"));
		assertEquals(ChatModelFactory.DEFAULT_ANTHROPIC_URL, ChatModelFactory.defaultUrl("Anthropic"));
		assertEquals(ChatModelFactory.DEFAULT_OPENAI_URL, ChatModelFactory.defaultUrl("openai"));
	}

	@Test
	@DisplayName("shouldRejectUnconfiguredProviderInServiceFactory")
	void shouldRejectUnconfiguredProviderInServiceFactory() {
		final LlmGenerationServiceFactory factory = LlmGenerationServiceFactory.forProvider("openai", null, "key");
		final JobConfig config = JobConfig.of("English", "German", TranslationMode.QUICK);

		final GenerationService first = factory.create(config);
		assertSame(first, factory.create(config), "Services should be shared per provider and model");
		assertThrows(IllegalArgumentException.class, () -> factory.create(config.withProvider("anthropic", null)));
	}
}
