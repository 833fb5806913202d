package io.evitadb.scriptorium.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonResponseParser should find JSON in generated text")
class JsonResponseParserTest {

	private final JsonResponseParser parser = new JsonResponseParser(new ObjectMapper());

	@Test
	@DisplayName("parses a bare JSON object")
	void shouldParseBareObject() throws MalformedResponseException {
		final JsonNode node = parser.parse("critique", "{\"criticalError\": true}");

		assertTrue(node.get("criticalError").asBoolean());
	}

	@Test
	@DisplayName("strips markdown fences")
	void shouldStripFences() throws MalformedResponseException {
		final JsonNode node = parser.parse("extract-terms", "```json\n[{\"sourceTerm\": \"entity\"}]\n```");

		assertTrue(node.isArray());
		assertEquals("entity", node.get(0).get("sourceTerm").asText());
	}

	@Test
	@DisplayName("skips prose around the JSON value")
	void shouldSkipProse() {
		assertEquals("{\"a\": [1, 2]}", JsonResponseParser.extractJson("Sure! Here it is: {\"a\": [1, 2]} Hope it helps."));
		assertEquals("[1]", JsonResponseParser.extractJson("Result: [1] done"));
		assertNull(JsonResponseParser.extractJson("No structured data here."));
	}

	@Test
	@DisplayName("reports invalid JSON with the raw response")
	void shouldRejectInvalidJson() {
		final MalformedResponseException exception = assertThrows(
			MalformedResponseException.class, () -> parser.parse("critique", "{\"issues\": [unquoted]}")
		);

		assertTrue(exception.isRetryable());
		assertEquals("{\"issues\": [unquoted]}", exception.getRawResponse());
		assertTrue(exception.getMessage().startsWith("[critique]"));
	}
}
