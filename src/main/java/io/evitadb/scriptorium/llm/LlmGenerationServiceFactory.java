package io.evitadb.scriptorium.llm;

import io.evitadb.scriptorium.model.JobConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds {@link LlmGenerationService} instances from configured provider endpoints. Services are cached
 * per provider and model, so all jobs using the same model share one client and its permanent failure
 * state.
 */
public final class LlmGenerationServiceFactory implements GenerationServiceFactory {

	@Nonnull
	private final String defaultProvider;
	@Nonnull
	private final Map<String, Endpoint> endpoints;
	private final Map<String, GenerationService> services = new ConcurrentHashMap<>();

	/**
	 * Creates the factory.
	 *
	 * @param defaultProvider provider used when a job does not select one
	 * @param endpoints       endpoint per provider name
	 */
	public LlmGenerationServiceFactory(@Nonnull String defaultProvider, @Nonnull Map<String, Endpoint> endpoints) {
		this.defaultProvider = ChatModelFactory.normalizeProvider(
			Objects.requireNonNull(defaultProvider, "defaultProvider must not be null")
		);
		this.endpoints = Map.copyOf(Objects.requireNonNull(endpoints, "endpoints must not be null"));
	}

	/**
	 * Creates a factory for a single provider.
	 */
	@Nonnull
	public static LlmGenerationServiceFactory forProvider(
		@Nonnull String provider,
		@Nullable String url,
		@Nullable String token
	) {
		final String normalized = ChatModelFactory.normalizeProvider(provider);
		return new LlmGenerationServiceFactory(normalized, Map.of(normalized, new Endpoint(url, token)));
	}

	@Nonnull
	@Override
	public GenerationService create(@Nonnull JobConfig config) {
		final String provider = config.provider() != null && !config.provider().isBlank()
			? ChatModelFactory.normalizeProvider(config.provider())
			: this.defaultProvider;
		final Endpoint endpoint = this.endpoints.get(provider);
		if (endpoint == null) {
			throw new IllegalArgumentException(
				"Provider " + provider + " is not configured. Configured providers: " + this.endpoints.keySet()
			);
		}
		final String modelName = ChatModelFactory.resolveModelName(provider, config.model());
		return this.services.computeIfAbsent(
			provider + "/" + modelName,
			key -> new LlmGenerationService(
				ChatModelFactory.create(provider, endpoint.urlOrDefault(provider), endpoint.token(), modelName)
			)
		);
	}

	/**
	 * Connection settings of one provider.
	 *
	 * @param url   base URL, null for the provider's public endpoint
	 * @param token API key, may be null for local endpoints
	 */
	public record Endpoint(@Nullable String url, @Nullable String token) {

		@Nonnull
		String urlOrDefault(@Nonnull String provider) {
			return this.url != null && !this.url.isBlank() ? this.url : ChatModelFactory.defaultUrl(provider);
		}
	}
}
