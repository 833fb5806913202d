package io.evitadb.scriptorium;

import io.evitadb.scriptorium.llm.GenerationFatalException;
import io.evitadb.scriptorium.llm.GenerationResult;
import io.evitadb.scriptorium.llm.GenerationTransientException;
import io.evitadb.scriptorium.model.Chunk;
import io.evitadb.scriptorium.model.ChunkStatus;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.GlossarySource;
import io.evitadb.scriptorium.model.GlossaryTerm;
import io.evitadb.scriptorium.model.Job;
import io.evitadb.scriptorium.model.JobConfig;
import io.evitadb.scriptorium.model.JobLogEntry;
import io.evitadb.scriptorium.model.JobStatus;
import io.evitadb.scriptorium.model.PipelineStep;
import io.evitadb.scriptorium.model.TranslationMode;
import io.evitadb.scriptorium.stage.ChunkWorkerPool;
import io.evitadb.scriptorium.stage.JobCancellation;
import io.evitadb.scriptorium.stage.JobCancelledException;
import io.evitadb.scriptorium.stage.RetryPolicy;
import io.evitadb.scriptorium.store.InMemoryJobStore;
import io.evitadb.scriptorium.store.JobEvent;
import io.evitadb.scriptorium.store.JobEventHub;
import io.evitadb.scriptorium.store.JobEventListener;
import io.evitadb.scriptorium.store.JobStore;
import io.evitadb.scriptorium.store.PersistenceException;
import io.evitadb.scriptorium.support.ScriptedGenerationService;
import io.evitadb.scriptorium.support.TestLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static io.evitadb.scriptorium.support.ScriptedGenerationService.CRITIQUE;
import static io.evitadb.scriptorium.support.ScriptedGenerationService.EXTRACT_TERMS;
import static io.evitadb.scriptorium.support.ScriptedGenerationService.REVISE;
import static io.evitadb.scriptorium.support.ScriptedGenerationService.TRANSLATE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineEngine should drive jobs through the pipeline")
class PipelineEngineTest {

	private static final String JOB_ID = "job-1";
	private static final String TWO_PARAGRAPHS = "First paragraph with some words.\n\nSecond paragraph with other words.";
	private static final String FIVE_PARAGRAPHS =
		"Paragraph one is here.\n\n" +
		"Paragraph two is here.\n\n" +
		"Paragraph three is here.\n\n" +
		"Paragraph four is here.\n\n" +
		"Paragraph five is here.";
	private static final String CLEAN_CRITIQUE = "{\"criticalError\": false, \"issues\": [\"minor wording\"], \"overallAssessment\": \"good\"}";

	private TestLog log;
	private JobStore store;
	private JobEventHub hub;
	private ChunkWorkerPool pool;
	private ScriptedGenerationService backend;
	private PipelineEngine engine;
	private List<JobEvent> events;
	private AtomicBoolean streamEnded;

	@BeforeEach
	void setUp() {
		log = new TestLog();
		store = new InMemoryJobStore();
		hub = new JobEventHub(Clock.systemUTC(), log);
		pool = new ChunkWorkerPool(4, log);
		backend = new ScriptedGenerationService();
		engine = createEngine(store, backend);
		events = new ArrayList<>();
		streamEnded = new AtomicBoolean(false);
		hub.subscribe(JOB_ID, new JobEventListener() {
			@Override
			public void onEvent(JobEvent event) {
				events.add(event);
			}

			@Override
			public void onEndOfStream(String jobId) {
				streamEnded.set(true);
			}
		});
	}

	@AfterEach
	void tearDown() {
		pool.shutdown();
	}

	@Test
	@DisplayName("quick mode with two chunks concatenates the translations and reaches 100%")
	void shouldCompleteQuickJob() throws Exception {
		backend.translateWithTag("DE:");

		final Job result = run(TWO_PARAGRAPHS, config(TranslationMode.QUICK), null, GlossarySource.NONE);

		assertEquals(JobStatus.COMPLETED, result.status());
		assertEquals(PipelineStep.COMPLETED, result.currentStep());
		assertEquals(100, result.progressPercent());
		assertEquals(2, result.chunks().size());
		assertEquals(
			"DE:First paragraph with some words.\n\nDE:Second paragraph with other words.",
			result.finalDocument()
		);
		assertEquals(result, store.find(JOB_ID).orElseThrow());
		assertEquals(
			List.of(
				"Starting quick translation English -> German",
				"Entered step chunking",
				"Split 68 characters into 2 chunk(s)",
				"Entered step translating",
				"Entered step assembling"
			),
			result.logs().subList(0, 5).stream().map(JobLogEntry::message).toList()
		);
		final JobLogEntry last = result.logs().get(result.logs().size() - 1);
		assertEquals(PipelineStep.COMPLETED, last.step());
		assertTrue(last.message().startsWith("Completed: 2 chunks"));
	}

	@Test
	@DisplayName("quick mode never calls terminology, critique or revision")
	void shouldSkipDeepStagesInQuickMode() throws Exception {
		backend.translateWithTag("DE:")
			.answer(CRITIQUE, CLEAN_CRITIQUE)
			.answer(REVISE, "revised")
			.answer(EXTRACT_TERMS, "[]");

		final Job result = run(TWO_PARAGRAPHS, config(TranslationMode.QUICK), null, GlossarySource.NONE);

		assertEquals(JobStatus.COMPLETED, result.status());
		assertEquals(2, backend.callCount(TRANSLATE));
		assertEquals(0, backend.callCount(CRITIQUE));
		assertEquals(0, backend.callCount(REVISE));
		assertEquals(0, backend.callCount(EXTRACT_TERMS));
		assertNull(result.critique());
		assertTrue(result.chunks().stream().allMatch(chunk -> chunk.refinedText() == null));
	}

	@Test
	@DisplayName("deep mode revises each chunk once and assembles the refined text")
	void shouldCompleteDeepJob() throws Exception {
		backend.translateWithTag("DE:")
			.answer(EXTRACT_TERMS, "[{\"sourceTerm\": \"paragraph\", \"proposedTranslations\": {\"default\": \"Absatz\"}}]")
			.answer(CRITIQUE, CLEAN_CRITIQUE)
			.on(REVISE, request -> new GenerationResult(
				"REFINED:" + ScriptedGenerationService.originalText(request).strip(), 10, 5
			));

		final Job result = run(TWO_PARAGRAPHS, config(TranslationMode.DEEP), null, GlossarySource.AUTO_EXTRACTED);

		assertEquals(JobStatus.COMPLETED, result.status());
		assertEquals(1, backend.callCount(EXTRACT_TERMS));
		assertEquals(2, backend.callCount(CRITIQUE));
		assertEquals(2, backend.callCount(REVISE));
		assertEquals(
			"REFINED:First paragraph with some words.\n\nREFINED:Second paragraph with other words.",
			result.finalDocument()
		);
		assertTrue(result.chunks().stream().allMatch(chunk -> chunk.status() == ChunkStatus.REFINED));
		assertTrue(result.chunks().stream().allMatch(chunk -> chunk.translatedText().startsWith("DE:")));
		assertEquals(GlossarySource.AUTO_EXTRACTED, result.glossarySource());
		assertEquals(1, result.glossary().size());
		assertTrue(backend.requestsFor(TRANSLATE).stream().allMatch(r -> r.systemPrompt().contains("'paragraph' -> 'Absatz'")));
		assertNotNull(result.critique());
		assertFalse(result.critique().hasCriticalError());
	}

	@Test
	@DisplayName("deep mode visits every step in order with monotonic progress")
	void shouldEmitOrderedStepsWithMonotonicProgress() throws Exception {
		backend.translateWithTag("DE:")
			.answer(EXTRACT_TERMS, "[]")
			.answer(CRITIQUE, CLEAN_CRITIQUE)
			.answer(REVISE, "refined");

		run(TWO_PARAGRAPHS, config(TranslationMode.DEEP), null, GlossarySource.AUTO_EXTRACTED);

		final List<PipelineStep> steps = new ArrayList<>();
		int lastProgress = 0;
		long lastSequence = -1;
		for (JobEvent event : events) {
			assertTrue(event.sequence() > lastSequence, "sequence must increase");
			lastSequence = event.sequence();
			assertTrue(event.job().progressPercent() >= lastProgress, "progress must not decrease");
			lastProgress = event.job().progressPercent();
			final PipelineStep step = event.job().currentStep();
			if (steps.isEmpty() || steps.get(steps.size() - 1) != step) {
				steps.add(step);
			}
		}
		assertEquals(
			List.of(
				PipelineStep.CHUNKING, PipelineStep.TERMINOLOGY_UNIFICATION, PipelineStep.TRANSLATING,
				PipelineStep.CRITIQUING, PipelineStep.REVISING, PipelineStep.ASSEMBLING, PipelineStep.COMPLETED
			),
			steps
		);
		assertEquals(100, lastProgress);
		assertTrue(events.get(events.size() - 1).isTerminal());
		assertTrue(streamEnded.get());
	}

	@Test
	@DisplayName("critical critique fails the job without assembling")
	void shouldHaltOnCriticalCritique() throws Exception {
		backend.translateWithTag("DE:")
			.answer(EXTRACT_TERMS, "[]")
			.answer(CRITIQUE, "{\"criticalError\": true, \"issues\": [\"meaning inverted\"]}")
			.answer(REVISE, "refined");

		final Job result = run(TWO_PARAGRAPHS, config(TranslationMode.DEEP), null, GlossarySource.AUTO_EXTRACTED);

		assertEquals(JobStatus.FAILED, result.status());
		assertEquals(PipelineStep.FAILED, result.currentStep());
		assertNull(result.finalDocument());
		assertTrue(result.errorInfo().startsWith("Critique reported critical errors"), result.errorInfo());
		assertTrue(result.errorInfo().contains("meaning inverted"));
		assertTrue(result.critique().hasCriticalError());
		assertEquals(0, backend.callCount(REVISE));
		assertTrue(streamEnded.get());
	}

	@Test
	@DisplayName("critique that cannot be produced halts the job")
	void shouldHaltWhenCritiqueFails() throws Exception {
		backend.translateWithTag("DE:")
			.answer(EXTRACT_TERMS, "[]")
			.answer(CRITIQUE, "I think the translation is fine.");

		final Job result = run(TWO_PARAGRAPHS, config(TranslationMode.DEEP), null, GlossarySource.AUTO_EXTRACTED);

		assertEquals(JobStatus.FAILED, result.status());
		assertNull(result.finalDocument());
		assertTrue(result.errorInfo().startsWith("Critique stage failed"), result.errorInfo());
		assertEquals(0, backend.callCount(REVISE));
	}

	@Test
	@DisplayName("one failing chunk fails the job but keeps the other translations")
	void shouldContainChunkFailure() throws Exception {
		backend.on(TRANSLATE, request -> {
			final String text = ScriptedGenerationService.chunkText(request);
			if (text.contains("three")) {
				throw new GenerationTransientException(TRANSLATE, "rate limited");
			}
			return new GenerationResult("DE:" + text.strip(), 10, 5);
		});

		final Job result = run(FIVE_PARAGRAPHS, config(TranslationMode.QUICK).withMaxChunkSize(40), null, GlossarySource.NONE);

		assertEquals(JobStatus.FAILED, result.status());
		assertTrue(result.errorInfo().startsWith("Translation failed for 1 of 5 chunks"), result.errorInfo());
		assertNull(result.finalDocument());

		final Job persisted = store.find(JOB_ID).orElseThrow();
		assertEquals(5, persisted.chunks().size());
		for (Chunk chunk : persisted.chunks()) {
			if (chunk.index() == 2) {
				assertEquals(ChunkStatus.FAILED, chunk.status());
				assertNotNull(chunk.errorMessage());
			} else {
				assertEquals(ChunkStatus.TRANSLATED, chunk.status());
				assertEquals("DE:" + chunk.sourceText().strip(), chunk.translatedText());
			}
		}
		// two attempts for the failing chunk, one for each of the others
		assertEquals(6, backend.callCount(TRANSLATE));
		assertTrue(hasLog(persisted, JobLogEntry.Level.WARN, PipelineStep.TRANSLATING, "Chunk 2 failed"));
		assertTrue(hasLog(persisted, JobLogEntry.Level.ERROR, PipelineStep.TRANSLATING, "Translation failed for 1 of 5 chunks"));
	}

	@Test
	@DisplayName("completion order does not change the assembled order")
	void shouldKeepDocumentOrderUnderShuffledCompletion() throws Exception {
		final AtomicInteger calls = new AtomicInteger();
		backend.on(TRANSLATE, request -> {
			final String text = ScriptedGenerationService.chunkText(request);
			// earlier paragraphs finish later
			final int delay = text.contains("one") ? 120 : text.contains("two") ? 80 : text.contains("three") ? 40 : 0;
			try {
				Thread.sleep(delay);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			calls.incrementAndGet();
			return new GenerationResult("DE:" + text.strip(), 10, 5);
		});

		final Job result = run(FIVE_PARAGRAPHS, config(TranslationMode.QUICK).withMaxChunkSize(40), null, GlossarySource.NONE);

		assertEquals(JobStatus.COMPLETED, result.status());
		assertEquals(5, calls.get());
		assertEquals(
			"DE:Paragraph one is here.\n\n" +
				"DE:Paragraph two is here.\n\n" +
				"DE:Paragraph three is here.\n\n" +
				"DE:Paragraph four is here.\n\n" +
				"DE:Paragraph five is here.",
			result.finalDocument()
		);
	}

	@Test
	@DisplayName("identity translation reproduces the source document")
	void shouldRoundTripWithIdentityTranslation() throws Exception {
		backend.translateIdentity();

		final Job result = run(FIVE_PARAGRAPHS + "\n", config(TranslationMode.QUICK).withMaxChunkSize(40), null, GlossarySource.NONE);

		assertEquals(FIVE_PARAGRAPHS + "\n", result.finalDocument());
	}

	@Test
	@DisplayName("glossary extraction failure degrades to an empty glossary")
	void shouldContinueWithoutGlossaryWhenExtractionFails() throws Exception {
		backend.translateWithTag("DE:")
			.answer(EXTRACT_TERMS, "no terms, sorry")
			.answer(CRITIQUE, CLEAN_CRITIQUE)
			.answer(REVISE, "refined");

		final Job result = run(TWO_PARAGRAPHS, config(TranslationMode.DEEP), null, GlossarySource.AUTO_EXTRACTED);

		assertEquals(JobStatus.COMPLETED, result.status());
		assertEquals(GlossarySource.AUTO_EXTRACTED, result.glossarySource());
		assertTrue(result.glossary().isEmpty());
		assertTrue(log.hasWarning("Terminology extraction failed"));
		assertTrue(hasLog(result, JobLogEntry.Level.WARN, PipelineStep.TERMINOLOGY_UNIFICATION, "Glossary extraction failed"));
	}

	@Test
	@DisplayName("user glossary is used without extraction")
	void shouldUseSuppliedGlossary() throws Exception {
		backend.translateWithTag("DE:")
			.answer(CRITIQUE, CLEAN_CRITIQUE)
			.answer(REVISE, "refined");
		final Glossary glossary = Glossary.of(GlossaryTerm.of("words", "Wörter"));

		final Job result = run(TWO_PARAGRAPHS, config(TranslationMode.DEEP), glossary, GlossarySource.INLINE);

		assertEquals(JobStatus.COMPLETED, result.status());
		assertEquals(0, backend.callCount(EXTRACT_TERMS));
		assertEquals(GlossarySource.INLINE, result.glossarySource());
		assertTrue(backend.requestsFor(TRANSLATE).stream().allMatch(r -> r.systemPrompt().contains("Wörter")));
		assertTrue(backend.requestsFor(CRITIQUE).stream().allMatch(r -> r.systemPrompt().contains("Wörter")));
	}

	@Test
	@DisplayName("failed revision keeps the initial translation")
	void shouldFallBackToTranslationWhenRevisionFails() throws Exception {
		backend.translateWithTag("DE:")
			.answer(EXTRACT_TERMS, "[]")
			.answer(CRITIQUE, CLEAN_CRITIQUE)
			.on(REVISE, request -> {
				final String original = ScriptedGenerationService.originalText(request);
				if (original.contains("Second")) {
					throw new GenerationFatalException(REVISE, "content policy", null);
				}
				return new GenerationResult("REFINED:" + original.strip(), 10, 5);
			});

		final Job result = run(TWO_PARAGRAPHS, config(TranslationMode.DEEP), null, GlossarySource.AUTO_EXTRACTED);

		assertEquals(JobStatus.COMPLETED, result.status());
		assertEquals(
			"REFINED:First paragraph with some words.\n\nDE:Second paragraph with other words.",
			result.finalDocument()
		);
		final Chunk skipped = result.chunk(1).orElseThrow();
		assertEquals(ChunkStatus.CRITIQUED, skipped.status());
		assertNull(skipped.refinedText());
		assertNotNull(skipped.errorMessage());
		assertTrue(log.hasWarning("Revision of chunk 1 failed"));
		assertTrue(hasLog(result, JobLogEntry.Level.WARN, PipelineStep.REVISING, "Revision of chunk 1 failed"));
		assertEquals(result, store.find(JOB_ID).orElseThrow());
	}

	@Test
	@DisplayName("resumed job does not translate finished chunks again")
	void shouldResumeWithoutRetranslatingFinishedChunks() throws Exception {
		final AtomicBoolean failSecond = new AtomicBoolean(true);
		backend.on(TRANSLATE, request -> {
			final String text = ScriptedGenerationService.chunkText(request);
			if (failSecond.get() && text.contains("Second")) {
				throw new GenerationFatalException(TRANSLATE, "invalid request", null);
			}
			return new GenerationResult("DE:" + text.strip(), 10, 5);
		});

		final Job failed = run(TWO_PARAGRAPHS, config(TranslationMode.QUICK), null, GlossarySource.NONE);
		assertEquals(JobStatus.FAILED, failed.status());
		assertEquals(2, backend.callCount(TRANSLATE));

		failSecond.set(false);
		final Job resumed = store.find(JOB_ID).orElseThrow().resumed(Clock.systemUTC().instant());
		assertNull(resumed.errorInfo());
		assertEquals(ChunkStatus.PENDING, resumed.chunk(1).orElseThrow().status());
		store.save(resumed);

		final Job result = engine.run(resumed, new JobCancellation(JOB_ID));

		assertEquals(JobStatus.COMPLETED, result.status());
		assertEquals(3, backend.callCount(TRANSLATE));
		assertEquals(
			"DE:First paragraph with some words.\n\nDE:Second paragraph with other words.",
			result.finalDocument()
		);
		// tokens of both runs are kept
		assertEquals(30, result.metrics().totalTokens());
		assertEquals(2, result.metrics().totalChunks());
	}

	@Test
	@DisplayName("empty document fails in chunking")
	void shouldFailOnEmptyDocument() throws Exception {
		backend.translateWithTag("DE:");

		final Job result = run("  \n\n ", config(TranslationMode.QUICK), null, GlossarySource.NONE);

		assertEquals(JobStatus.FAILED, result.status());
		assertTrue(result.errorInfo().startsWith("Chunking failed"), result.errorInfo());
		assertEquals(0, backend.callCount(TRANSLATE));
	}

	@Test
	@DisplayName("unavailable backend fails the job")
	void shouldFailWhenBackendCannotBeCreated() throws Exception {
		final PipelineEngine failingEngine = new PipelineEngine(
			store, hub,
			config -> {
				throw new IllegalArgumentException("Unknown provider: foo");
			},
			pool, settings(), duration -> {}, Clock.systemUTC(), log
		);
		final Job job = Job.create(JOB_ID, "doc.md", TWO_PARAGRAPHS, config(TranslationMode.QUICK), null, GlossarySource.NONE, Clock.systemUTC().instant());
		store.save(job);

		final Job result = failingEngine.run(job, new JobCancellation(JOB_ID));

		assertEquals(JobStatus.FAILED, result.status());
		assertTrue(result.errorInfo().contains("Unknown provider: foo"));
	}

	@Test
	@DisplayName("cancelled job stops without persisting further state")
	void shouldStopWhenCancelled() throws Exception {
		final JobCancellation cancellation = new JobCancellation(JOB_ID);
		backend.on(TRANSLATE, request -> {
			cancellation.cancel();
			return new GenerationResult("DE:" + ScriptedGenerationService.chunkText(request).strip(), 10, 5);
		});
		final Job job = Job.create(JOB_ID, "doc.md", TWO_PARAGRAPHS, config(TranslationMode.QUICK), null, GlossarySource.NONE, Clock.systemUTC().instant());
		store.save(job);

		assertThrows(JobCancelledException.class, () -> engine.run(job, cancellation));

		final Job persisted = store.find(JOB_ID).orElseThrow();
		assertFalse(persisted.isTerminal());
		assertNull(persisted.finalDocument());
	}

	@Test
	@DisplayName("deletion racing a commit leaves no state behind")
	void shouldNotResurrectJobDeletedDuringSave() throws Exception {
		backend.translateWithTag("DE:");
		final JobCancellation cancellation = new JobCancellation(JOB_ID);
		final PipelineEngine racingEngine = createEngine(new DeletingStore(store, cancellation, 2), backend);
		final Job job = Job.create(JOB_ID, "doc.md", TWO_PARAGRAPHS, config(TranslationMode.QUICK), null, GlossarySource.NONE, Clock.systemUTC().instant());
		store.save(job);

		assertThrows(JobCancelledException.class, () -> racingEngine.run(job, cancellation));

		assertTrue(store.find(JOB_ID).isEmpty());
		assertEquals(2, events.size(), "the snapshot saved after deletion must not be published");
	}

	@Test
	@DisplayName("persistence failure surfaces and ends the stream with a failed state")
	void shouldSurfacePersistenceFailure() throws Exception {
		backend.translateWithTag("DE:");
		final FailingStore failingStore = new FailingStore(store, 3);
		final PipelineEngine fragileEngine = createEngine(failingStore, backend);
		final Job job = Job.create(JOB_ID, "doc.md", TWO_PARAGRAPHS, config(TranslationMode.QUICK), null, GlossarySource.NONE, Clock.systemUTC().instant());
		store.save(job);

		assertThrows(PersistenceException.class, () -> fragileEngine.run(job, new JobCancellation(JOB_ID)));

		assertTrue(streamEnded.get());
		final JobEvent last = events.get(events.size() - 1);
		assertEquals(JobStatus.FAILED, last.job().status());
		assertTrue(last.job().errorInfo().startsWith("Persistence failure"));
		// the store keeps the last durable snapshot
		assertFalse(store.find(JOB_ID).orElseThrow().isTerminal());
	}

	private static boolean hasLog(Job job, JobLogEntry.Level level, PipelineStep step, String fragment) {
		return job.logs().stream().anyMatch(
			entry -> entry.level() == level && entry.step() == step && entry.message().contains(fragment)
		);
	}

	private Job run(String content, JobConfig config, Glossary glossary, GlossarySource source) throws Exception {
		final Job job = Job.create(JOB_ID, "doc.md", content, config, glossary, source, Clock.systemUTC().instant());
		store.save(job);
		return engine.run(job, new JobCancellation(JOB_ID));
	}

	private PipelineEngine createEngine(JobStore jobStore, ScriptedGenerationService service) {
		return new PipelineEngine(
			jobStore, hub, service.asFactory(), pool, settings(), duration -> {}, Clock.systemUTC(), log
		);
	}

	private static PipelineSettings settings() {
		return PipelineSettings.defaults()
			.withParallelism(4)
			.withRetryPolicy(new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO));
	}

	private static JobConfig config(TranslationMode mode) {
		return JobConfig.of("English", "German", mode).withMaxChunkSize(60);
	}

	/**
	 * Store whose job gets deleted just before a save lands, after a number of undisturbed saves.
	 */
	private static class DeletingStore implements JobStore {
		private final JobStore delegate;
		private final JobCancellation cancellation;
		private final AtomicInteger remainingSaves;

		DeletingStore(JobStore delegate, JobCancellation cancellation, int undisturbedSaves) {
			this.delegate = delegate;
			this.cancellation = cancellation;
			this.remainingSaves = new AtomicInteger(undisturbedSaves);
		}

		@Override
		public void save(Job job) throws PersistenceException {
			if (remainingSaves.getAndDecrement() == 0) {
				cancellation.cancel();
				delegate.delete(job.jobId());
			}
			delegate.save(job);
		}

		@Override
		public Optional<Job> find(String jobId) throws PersistenceException {
			return delegate.find(jobId);
		}

		@Override
		public boolean delete(String jobId) throws PersistenceException {
			return delegate.delete(jobId);
		}

		@Override
		public List<Job> list() throws PersistenceException {
			return delegate.list();
		}
	}

	/**
	 * Store that starts failing after a number of successful saves.
	 */
	private static class FailingStore implements JobStore {
		private final JobStore delegate;
		private final AtomicInteger remainingSaves;

		FailingStore(JobStore delegate, int successfulSaves) {
			this.delegate = delegate;
			this.remainingSaves = new AtomicInteger(successfulSaves);
		}

		@Override
		public void save(Job job) throws PersistenceException {
			if (remainingSaves.getAndDecrement() <= 0) {
				throw new PersistenceException("disk full", job.jobId(), null);
			}
			delegate.save(job);
		}

		@Override
		public Optional<Job> find(String jobId) throws PersistenceException {
			return delegate.find(jobId);
		}

		@Override
		public boolean delete(String jobId) throws PersistenceException {
			return delegate.delete(jobId);
		}

		@Override
		public List<Job> list() throws PersistenceException {
			return delegate.list();
		}
	}
}
