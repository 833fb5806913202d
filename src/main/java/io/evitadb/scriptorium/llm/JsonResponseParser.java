package io.evitadb.scriptorium.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Extracts JSON from generated text. Models often wrap JSON in markdown fences or add a sentence
 * before it, so the parser strips fences and starts at the first `{` or `[`.
 */
public final class JsonResponseParser {

	private final ObjectMapper objectMapper;

	public JsonResponseParser(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	/**
	 * Parses the JSON value contained in the response.
	 *
	 * @param stage    stage label for error reporting
	 * @param response raw generated text
	 * @return parsed JSON tree
	 * @throws MalformedResponseException if no JSON value can be read
	 */
	@Nonnull
	public JsonNode parse(@Nonnull String stage, @Nonnull String response) throws MalformedResponseException {
		Objects.requireNonNull(response, "response must not be null");
		final String json = extractJson(response);
		if (json == null) {
			throw new MalformedResponseException(stage, "Response contains no JSON", response);
		}
		try {
			return this.objectMapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new MalformedResponseException(stage, "Response is not valid JSON: " + e.getOriginalMessage(), response, e);
		}
	}

	/**
	 * Returns the JSON part of the text, or null when it contains neither an object nor an array.
	 */
	static String extractJson(@Nonnull String response) {
		String text = response.strip();
		if (text.startsWith("```")) {
			final int firstNewline = text.indexOf('\n');
			text = firstNewline >= 0 ? text.substring(firstNewline + 1) : "";
			if (text.endsWith("```")) {
				text = text.substring(0, text.length() - 3);
			}
			text = text.strip();
		}

		final int object = text.indexOf('{');
		final int array = text.indexOf('[');
		final int start;
		if (object < 0) {
			start = array;
		} else if (array < 0) {
			start = object;
		} else {
			start = Math.min(object, array);
		}
		if (start < 0) {
			return null;
		}
		final char close = text.charAt(start) == '{' ? '}' : ']';
		final int end = text.lastIndexOf(close);
		return end > start ? text.substring(start, end + 1) : null;
	}
}
