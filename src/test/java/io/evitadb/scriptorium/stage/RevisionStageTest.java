package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.llm.GenerationFatalException;
import io.evitadb.scriptorium.llm.GenerationRequest;
import io.evitadb.scriptorium.llm.GenerationResult;
import io.evitadb.scriptorium.llm.PromptLoader;
import io.evitadb.scriptorium.llm.TokenUsageMeter;
import io.evitadb.scriptorium.model.Chunk;
import io.evitadb.scriptorium.model.ChunkOutcome;
import io.evitadb.scriptorium.model.Critique;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.JobConfig;
import io.evitadb.scriptorium.model.TranslationMode;
import io.evitadb.scriptorium.support.ScriptedGenerationService;
import io.evitadb.scriptorium.support.TestLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.evitadb.scriptorium.support.ScriptedGenerationService.REVISE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RevisionStage should refine translations using critique findings")
class RevisionStageTest {

	private RevisionStage stage;
	private ScriptedGenerationService backend;
	private ChunkWorkerPool pool;
	private StageContext context;

	@BeforeEach
	void setUp() {
		final TestLog log = new TestLog();
		stage = new RevisionStage(new PromptLoader());
		backend = new ScriptedGenerationService();
		pool = new ChunkWorkerPool(2, log);
		context = new StageContext(
			"job-1",
			JobConfig.of("English", "German", TranslationMode.DEEP),
			new RetryingGenerator(backend, RetryPolicy.noRetry(), duration -> {}, new TokenUsageMeter(), new JobCancellation("job-1"), log),
			pool,
			log
		);
	}

	@AfterEach
	void tearDown() {
		pool.shutdown();
	}

	@Test
	@DisplayName("sends chunk findings and document findings to the model")
	void shouldIncludeFindingsInPrompt() throws InterruptedException {
		backend.answer(REVISE, "Verbessert.");
		final Critique critique = new Critique(false, List.of("Use formal address"), Map.of(0, List.of("Wrong tense")), null);
		final List<Chunk> chunks = List.of(Chunk.of(0, "Hello.").translated("Hallo.").critiqued());

		final List<ChunkOutcome> outcomes = stage.reviseAll(chunks, critique, Glossary.empty(), context, outcome -> {});

		assertEquals(1, outcomes.size());
		assertTrue(outcomes.get(0).success());
		assertEquals("Verbessert.", outcomes.get(0).text());
		final GenerationRequest request = backend.requestsFor(REVISE).get(0);
		assertTrue(request.userPrompt().contains("- Wrong tense\n- Use formal address"));
		assertTrue(request.userPrompt().contains("Hallo."));
		assertEquals("Hello.", ScriptedGenerationService.originalText(request));
	}

	@Test
	@DisplayName("asks for polishing only when there are no findings")
	void shouldHandleChunkWithoutFindings() {
		assertEquals(
			"No specific issues were reported. Polish fluency and terminology only.",
			RevisionStage.formatFindings(List.of())
		);
	}

	@Test
	@DisplayName("reports a failure outcome when revision fails")
	void shouldReportFailure() throws InterruptedException {
		backend.on(REVISE, request -> {
			if (ScriptedGenerationService.originalText(request).contains("Two")) {
				throw new GenerationFatalException(REVISE, "content filtered", null);
			}
			return new GenerationResult("Eins!", 1, 1);
		});
		final Critique critique = new Critique(false, List.of(), Map.of(), null);
		final List<Chunk> chunks = List.of(
			Chunk.of(0, "One.").translated("Eins.").critiqued(),
			Chunk.of(1, "Two.").translated("Zwei.").critiqued()
		);

		final List<ChunkOutcome> outcomes = stage.reviseAll(chunks, critique, Glossary.empty(), context, outcome -> {});

		assertTrue(outcomes.get(0).success());
		assertFalse(outcomes.get(1).success());
		assertTrue(outcomes.get(1).errorMessage().contains("content filtered"));
	}
}
