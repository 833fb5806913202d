package io.evitadb.scriptorium.store;

import io.evitadb.scriptorium.model.Glossary;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named glossaries that submissions can refer to, with an optional default.
 */
public final class GlossaryCatalog {

	private final Map<String, Glossary> glossaries = new ConcurrentHashMap<>();
	private volatile String defaultId;

	/**
	 * Registers or replaces a glossary.
	 */
	public void register(@Nonnull String id, @Nonnull Glossary glossary) {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(glossary, "glossary must not be null");
		this.glossaries.put(id, glossary);
	}

	/**
	 * Marks a registered glossary as the default one.
	 *
	 * @throws IllegalArgumentException if no glossary is registered under the id
	 */
	public void setDefault(@Nonnull String id) {
		if (!this.glossaries.containsKey(id)) {
			throw new IllegalArgumentException("Unknown glossary: " + id);
		}
		this.defaultId = id;
	}

	@Nonnull
	public Optional<Glossary> find(@Nonnull String id) {
		return Optional.ofNullable(this.glossaries.get(id));
	}

	@Nonnull
	public Optional<String> getDefaultId() {
		final String id = this.defaultId;
		return id != null && this.glossaries.containsKey(id) ? Optional.of(id) : Optional.empty();
	}

	public boolean remove(@Nonnull String id) {
		if (id.equals(this.defaultId)) {
			this.defaultId = null;
		}
		return this.glossaries.remove(id) != null;
	}
}
