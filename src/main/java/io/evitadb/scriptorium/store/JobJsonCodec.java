package io.evitadb.scriptorium.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.GlossaryTerm;
import io.evitadb.scriptorium.model.Job;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * JSON form of jobs and glossaries. Field names are snake_case, timestamps ISO-8601, and unknown
 * fields are ignored so that older snapshots stay readable.
 */
public final class JobJsonCodec {

	private final ObjectMapper objectMapper;

	public JobJsonCodec() {
		this(createObjectMapper());
	}

	public JobJsonCodec(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	/**
	 * Creates the mapper used for persisted snapshots.
	 */
	@Nonnull
	public static ObjectMapper createObjectMapper() {
		return new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.enable(SerializationFeature.INDENT_OUTPUT);
	}

	@Nonnull
	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	@Nonnull
	public String writeJob(@Nonnull Job job) throws JsonProcessingException {
		return this.objectMapper.writeValueAsString(job);
	}

	@Nonnull
	public Job readJob(@Nonnull String json) throws JsonProcessingException {
		return this.objectMapper.readValue(json, Job.class);
	}

	@Nonnull
	public String writeGlossary(@Nonnull Glossary glossary) throws JsonProcessingException {
		return this.objectMapper.writeValueAsString(glossary);
	}

	/**
	 * Reads a glossary. Accepts both `{"terms": [...]}` and a bare array of terms.
	 *
	 * @param json glossary JSON
	 * @return parsed glossary
	 * @throws JsonProcessingException if the JSON cannot be read
	 */
	@Nonnull
	public Glossary readGlossary(@Nonnull String json) throws JsonProcessingException {
		if (json.stripLeading().startsWith("[")) {
			final GlossaryTerm[] terms = this.objectMapper.readValue(json, GlossaryTerm[].class);
			return Glossary.of(List.of(terms));
		}
		return this.objectMapper.readValue(json, Glossary.class);
	}
}
