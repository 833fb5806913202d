package io.evitadb.scriptorium;

import io.evitadb.scriptorium.chunk.Chunker;
import io.evitadb.scriptorium.chunk.ChunkingException;
import io.evitadb.scriptorium.llm.GenerationService;
import io.evitadb.scriptorium.llm.GenerationServiceFactory;
import io.evitadb.scriptorium.llm.JsonResponseParser;
import io.evitadb.scriptorium.llm.PromptLoader;
import io.evitadb.scriptorium.llm.TokenUsageMeter;
import io.evitadb.scriptorium.model.Chunk;
import io.evitadb.scriptorium.model.ChunkOutcome;
import io.evitadb.scriptorium.model.ChunkStatus;
import io.evitadb.scriptorium.model.Critique;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.GlossarySource;
import io.evitadb.scriptorium.model.Job;
import io.evitadb.scriptorium.model.JobLogEntry;
import io.evitadb.scriptorium.model.JobMetrics;
import io.evitadb.scriptorium.model.PipelineStep;
import io.evitadb.scriptorium.model.TranslationMode;
import io.evitadb.scriptorium.stage.Assembler;
import io.evitadb.scriptorium.stage.ChunkWorkerPool;
import io.evitadb.scriptorium.stage.CriticalQualityException;
import io.evitadb.scriptorium.stage.CritiqueStage;
import io.evitadb.scriptorium.stage.GlossaryResolution;
import io.evitadb.scriptorium.stage.GlossaryResolver;
import io.evitadb.scriptorium.stage.JobCancellation;
import io.evitadb.scriptorium.stage.JobCancelledException;
import io.evitadb.scriptorium.stage.RetryingGenerator;
import io.evitadb.scriptorium.stage.RevisionStage;
import io.evitadb.scriptorium.stage.Sleeper;
import io.evitadb.scriptorium.stage.StageContext;
import io.evitadb.scriptorium.stage.TranslationStage;
import io.evitadb.scriptorium.store.JobEventHub;
import io.evitadb.scriptorium.store.JobJsonCodec;
import io.evitadb.scriptorium.store.JobStore;
import io.evitadb.scriptorium.store.PersistenceException;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Drives one job through the pipeline state machine:
 *
 * `pending -> chunking -> (terminology_unification) -> translating -> (critiquing -> revising) -> assembling -> completed`
 *
 * Quick mode skips the bracketed steps; `failed` is reachable from every step. Every step is a method that
 * returns the next step together with the updated snapshot. Each transition, and each chunk result of
 * the concurrent steps, is committed: the snapshot is persisted and then published to the event hub.
 * The engine is the only writer of job state. Notable events are also recorded in the job's own history,
 * so they are committed together with the state they belong to.
 *
 * A job that was run before is resumed from its snapshot: existing chunks, finished translations and an
 * already extracted glossary are reused.
 */
public final class PipelineEngine {

	@Nonnull
	private final JobStore store;
	@Nonnull
	private final JobEventHub hub;
	@Nonnull
	private final GenerationServiceFactory serviceFactory;
	@Nonnull
	private final ChunkWorkerPool pool;
	@Nonnull
	private final PipelineSettings settings;
	@Nonnull
	private final Sleeper sleeper;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final Log log;

	private final GlossaryResolver glossaryResolver;
	private final TranslationStage translationStage;
	private final CritiqueStage critiqueStage;
	private final RevisionStage revisionStage;

	/**
	 * Creates the engine.
	 *
	 * @param store          durable job state
	 * @param hub            receives every committed snapshot
	 * @param serviceFactory creates the generation backend of a job
	 * @param pool           shared chunk worker pool
	 * @param settings       retry and extraction settings
	 * @param sleeper        waits between retry attempts
	 * @param clock          source of timestamps
	 * @param log            Maven log for output
	 */
	public PipelineEngine(
		@Nonnull JobStore store,
		@Nonnull JobEventHub hub,
		@Nonnull GenerationServiceFactory serviceFactory,
		@Nonnull ChunkWorkerPool pool,
		@Nonnull PipelineSettings settings,
		@Nonnull Sleeper sleeper,
		@Nonnull Clock clock,
		@Nonnull Log log
	) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.hub = Objects.requireNonNull(hub, "hub must not be null");
		this.serviceFactory = Objects.requireNonNull(serviceFactory, "serviceFactory must not be null");
		this.pool = Objects.requireNonNull(pool, "pool must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");

		final PromptLoader prompts = new PromptLoader();
		final JsonResponseParser jsonParser = new JsonResponseParser(JobJsonCodec.createObjectMapper());
		this.glossaryResolver = new GlossaryResolver(prompts, jsonParser, settings.glossaryExcerptLength());
		this.translationStage = new TranslationStage(prompts);
		this.critiqueStage = new CritiqueStage(prompts, jsonParser);
		this.revisionStage = new RevisionStage(prompts);
	}

	/**
	 * Runs the job until it completes or fails.
	 *
	 * @param job          the persisted snapshot to start from, fresh or resumed
	 * @param cancellation cancellation flag of the job
	 * @return the terminal snapshot
	 * @throws PersistenceException  if a snapshot cannot be saved; the store keeps the last durable state
	 * @throws JobCancelledException if the job was deleted while running; nothing more is persisted
	 * @throws InterruptedException  if the job thread is interrupted
	 */
	@Nonnull
	public Job run(
		@Nonnull Job job,
		@Nonnull JobCancellation cancellation
	) throws PersistenceException, JobCancelledException, InterruptedException {
		Objects.requireNonNull(job, "job must not be null");
		Objects.requireNonNull(cancellation, "cancellation must not be null");

		final Execution execution = new Execution(job, cancellation);
		final String prefix = execution.prefix;
		final String start = "Starting " + job.mode().value() + " translation " +
			job.config().sourceLanguage() + " -> " + job.config().targetLanguage();
		this.log.info(prefix + start);

		final GenerationService service;
		try {
			service = this.serviceFactory.create(job.config());
		} catch (RuntimeException e) {
			this.log.error(prefix + "Generation backend unavailable: " + e.getMessage());
			return execution.commit(
				finish(failed(job, "Generation backend unavailable: " + e.getMessage()))
			);
		}
		final StageContext context = new StageContext(
			job.jobId(),
			job.config(),
			new RetryingGenerator(service, this.settings.retryPolicy(), this.sleeper, execution.meter, cancellation, this.log),
			this.pool,
			this.log
		);

		Job current = job.withMetrics(job.metrics().started(now())).withLog(JobLogEntry.Level.INFO, start, now());
		PipelineStep step = PipelineStep.CHUNKING;
		while (!step.isTerminal()) {
			current = execution.commit(
				current.atStep(step, ProgressModel.progress(job.mode(), step, 0.0), now())
					.withLog(JobLogEntry.Level.INFO, "Entered step " + step.value(), now())
			);
			this.log.info(prefix + "Step " + step.value() + " (" + current.progressPercent() + "%)");

			Transition transition;
			try {
				transition = enter(step, execution, context);
			} catch (ChunkingException e) {
				transition = failWith(execution.current(), "Chunking failed: " + e.getMessage());
			} catch (CriticalQualityException e) {
				transition = failWith(execution.current().withCritique(e.getCritique(), now()), e.getMessage());
			} catch (RuntimeException e) {
				this.log.error(prefix + "Unexpected error during " + step.value() + ": " + e.getMessage(), e);
				transition = failWith(
					execution.current(), "Unexpected error during " + step.value() + ": " + e.getMessage()
				);
			}

			step = transition.next();
			if (step == PipelineStep.COMPLETED) {
				final Job finished = finish(transition.job().atStep(PipelineStep.COMPLETED, 100, now()));
				final JobMetrics metrics = finished.metrics();
				final String summary = "Completed: " + metrics.totalChunks() + " chunks, " +
					metrics.sourceWordCount() + " -> " + metrics.translatedWordCount() + " words, " +
					metrics.totalTokens() + " tokens in " + metrics.generationCalls() + " calls";
				current = execution.commit(finished.withLog(JobLogEntry.Level.INFO, summary, now()));
				this.log.info(prefix + summary);
			} else if (step == PipelineStep.FAILED) {
				current = execution.commit(finish(transition.job()));
				this.log.error(prefix + "Failed: " + current.errorInfo());
			} else {
				current = transition.job();
			}
		}
		return current;
	}

	@Nonnull
	private Transition enter(
		@Nonnull PipelineStep step,
		@Nonnull Execution execution,
		@Nonnull StageContext context
	) throws ChunkingException, CriticalQualityException, PersistenceException, JobCancelledException, InterruptedException {
		switch (step) {
			case CHUNKING:
				return chunk(execution);
			case TERMINOLOGY_UNIFICATION:
				return unifyTerminology(execution, context);
			case TRANSLATING:
				return translate(execution, context);
			case CRITIQUING:
				return critique(execution, context);
			case REVISING:
				return revise(execution, context);
			case ASSEMBLING:
				return assemble(execution);
			default:
				throw new IllegalStateException("Step " + step.value() + " has no entry action");
		}
	}

	@Nonnull
	private Transition chunk(@Nonnull Execution execution) throws ChunkingException {
		final Job job = execution.current();
		final PipelineStep next = job.mode() == TranslationMode.DEEP
			? PipelineStep.TERMINOLOGY_UNIFICATION
			: PipelineStep.TRANSLATING;
		final List<Chunk> chunks;
		final String message;
		if (job.chunks().isEmpty()) {
			chunks = new Chunker(job.config().maxChunkSize()).split(job.originalContent());
			message = "Split " + job.originalContent().length() + " characters into " + chunks.size() + " chunk(s)";
		} else {
			chunks = job.chunks();
			message = "Reusing " + chunks.size() + " existing chunk(s)";
		}
		this.log.info(execution.prefix + message);
		final Job chunked = job.withChunks(chunks, now()).withLog(JobLogEntry.Level.INFO, message, now());
		return new Transition(
			next,
			chunked.withMetrics(
				chunked.metrics().withChunking(JobMetrics.countWords(job.originalContent()), chunks.size())
			)
		);
	}

	@Nonnull
	private Transition unifyTerminology(
		@Nonnull Execution execution,
		@Nonnull StageContext context
	) throws JobCancelledException {
		final Job job = execution.current();
		if (job.glossarySource() == GlossarySource.AUTO_EXTRACTED && job.glossary() != null) {
			final String message = "Reusing extracted glossary with " + job.glossary().size() + " terms";
			this.log.info(execution.prefix + message);
			return new Transition(PipelineStep.TRANSLATING, job.withLog(JobLogEntry.Level.INFO, message, now()));
		}
		final GlossaryResolution resolution = this.glossaryResolver.resolve(
			job.originalContent(), job.glossary(), job.glossarySource(), context
		);
		final Job resolved = job.withGlossary(resolution.glossary(), resolution.source(), now());
		return new Transition(
			PipelineStep.TRANSLATING,
			resolution.degraded()
				? resolved.withLog(JobLogEntry.Level.WARN, "Glossary extraction failed, continuing without a glossary", now())
				: resolved.withLog(
					JobLogEntry.Level.INFO,
					"Using " + resolution.source().value() + " glossary with " + resolution.glossary().size() + " terms",
					now()
				)
		);
	}

	@Nonnull
	private Transition translate(
		@Nonnull Execution execution,
		@Nonnull StageContext context
	) throws PersistenceException, JobCancelledException, InterruptedException {
		final Job job = execution.current();
		final TranslationMode mode = job.mode();
		final int total = job.chunks().size();
		final List<Chunk> pending = job.chunks().stream()
			.filter(chunk -> !chunk.status().hasTranslation())
			.collect(Collectors.toList());

		if (pending.size() < total) {
			this.log.info(execution.prefix + (total - pending.size()) + " of " + total +
				" chunk(s) already translated, translating the remaining " + pending.size());
		}

		if (!pending.isEmpty()) {
			Job marked = job;
			for (Chunk chunk : pending) {
				marked = marked.withChunk(chunk.translating(), now());
			}
			execution.commit(marked);

			final Glossary glossary = glossaryOf(execution.current());
			final int[] finished = {total - pending.size()};
			this.translationStage.translateAll(pending, total, glossary, context, outcome -> {
				finished[0]++;
				final double fraction = (double) finished[0] / total;
				execution.commitAsync(current -> {
					final Chunk chunk = chunkOf(current, outcome.index());
					final Chunk updated = outcome.success()
						? chunk.translated(outcome.text())
						: chunk.failed(outcome.errorMessage());
					Job next = current.withChunk(updated, now())
						.withProgress(ProgressModel.progress(mode, PipelineStep.TRANSLATING, fraction), now());
					if (!outcome.success()) {
						final String message = "Chunk " + outcome.index() + " failed: " + outcome.errorMessage();
						this.log.warn(execution.prefix + message);
						next = next.withLog(JobLogEntry.Level.WARN, message, now());
					}
					return next;
				});
			});
			execution.rethrowDeferred();
		}

		final Job translated = execution.current();
		final List<Chunk> failed = translated.chunks().stream()
			.filter(chunk -> chunk.status() == ChunkStatus.FAILED)
			.collect(Collectors.toList());
		if (!failed.isEmpty()) {
			final String causes = failed.stream()
				.map(chunk -> "chunk " + chunk.index() + ": " + chunk.errorMessage())
				.collect(Collectors.joining("; "));
			return failWith(
				translated, "Translation failed for " + failed.size() + " of " + total + " chunks: " + causes
			);
		}
		return new Transition(
			mode == TranslationMode.DEEP ? PipelineStep.CRITIQUING : PipelineStep.ASSEMBLING,
			translated
		);
	}

	@Nonnull
	private Transition critique(
		@Nonnull Execution execution,
		@Nonnull StageContext context
	) throws PersistenceException, JobCancelledException, InterruptedException, CriticalQualityException {
		final Job job = execution.current();
		final int total = job.chunks().size();
		final int[] finished = {0};
		final Critique critique = this.critiqueStage.critique(
			job.chunks(), glossaryOf(job), context, outcome -> {
				finished[0]++;
				final double fraction = (double) finished[0] / total;
				execution.commitAsync(
					current -> current.withProgress(ProgressModel.progress(current.mode(), PipelineStep.CRITIQUING, fraction), now())
				);
			}
		);
		execution.rethrowDeferred();

		if (critique.hasCriticalError()) {
			throw new CriticalQualityException(critique);
		}
		final String verdict = "Critique passed with " + critique.chunkIssues().size() + " chunk(s) carrying findings";
		this.log.info(execution.prefix + verdict);

		Job critiqued = execution.current()
			.withCritique(critique, now())
			.withLog(JobLogEntry.Level.INFO, verdict, now());
		for (Chunk chunk : critiqued.chunks()) {
			if (chunk.status() == ChunkStatus.TRANSLATED) {
				critiqued = critiqued.withChunk(chunk.critiqued(), now());
			}
		}
		return new Transition(PipelineStep.REVISING, critiqued);
	}

	@Nonnull
	private Transition revise(
		@Nonnull Execution execution,
		@Nonnull StageContext context
	) throws PersistenceException, JobCancelledException, InterruptedException {
		final Job job = execution.current();
		final Critique critique = Objects.requireNonNull(job.critique(), "critique must be present before revision");
		final List<Chunk> targets = job.chunks().stream()
			.filter(chunk -> chunk.status() == ChunkStatus.CRITIQUED)
			.collect(Collectors.toList());
		final int total = targets.size();
		final int[] finished = {0};

		this.revisionStage.reviseAll(targets, critique, glossaryOf(job), context, outcome -> {
			finished[0]++;
			final double fraction = (double) finished[0] / total;
			execution.commitAsync(current -> {
				final Chunk chunk = chunkOf(current, outcome.index());
				if (outcome.success()) {
					return current.withChunk(chunk.refined(outcome.text()), now())
						.withProgress(ProgressModel.progress(current.mode(), PipelineStep.REVISING, fraction), now());
				}
				final String message = "Revision of chunk " + outcome.index() +
					" failed, keeping the initial translation: " + outcome.errorMessage();
				this.log.warn(execution.prefix + message);
				return current.withChunk(chunk.revisionSkipped(outcome.errorMessage()), now())
					.withProgress(ProgressModel.progress(current.mode(), PipelineStep.REVISING, fraction), now())
					.withLog(JobLogEntry.Level.WARN, message, now());
			});
		});
		execution.rethrowDeferred();
		return new Transition(PipelineStep.ASSEMBLING, execution.current());
	}

	@Nonnull
	private Transition assemble(@Nonnull Execution execution) {
		final Job job = execution.current();
		final String document = Assembler.assemble(job.chunks());
		final Job assembled = job.withFinalDocument(document, now());
		return new Transition(
			PipelineStep.COMPLETED,
			assembled.withMetrics(assembled.metrics().finished(now(), JobMetrics.countWords(document)))
		);
	}

	@Nonnull
	private Transition failWith(@Nonnull Job job, @Nonnull String errorInfo) {
		return new Transition(PipelineStep.FAILED, failed(job, errorInfo));
	}

	/**
	 * Fails the job and records the cause under the step in which it happened.
	 */
	@Nonnull
	private Job failed(@Nonnull Job job, @Nonnull String errorInfo) {
		return job.withLog(JobLogEntry.Level.ERROR, errorInfo, now()).failed(errorInfo, now());
	}

	@Nonnull
	private Job finish(@Nonnull Job job) {
		final JobMetrics metrics = job.metrics();
		return metrics.finishedAt() != null
			? job
			: job.withMetrics(metrics.finished(now(), metrics.translatedWordCount()));
	}

	@Nonnull
	private static Glossary glossaryOf(@Nonnull Job job) {
		if (job.mode() == TranslationMode.QUICK || job.glossary() == null) {
			return Glossary.empty();
		}
		return job.glossary();
	}

	@Nonnull
	private static Chunk chunkOf(@Nonnull Job job, int index) {
		return job.chunk(index).orElseThrow(
			() -> new IllegalStateException("Job " + job.jobId() + " has no chunk with index " + index)
		);
	}

	@Nonnull
	private Instant now() {
		return this.clock.instant();
	}

	/**
	 * Result of a step's entry action.
	 *
	 * @param next the step to enter next
	 * @param job  the snapshot produced by the step, not yet committed
	 */
	private record Transition(@Nonnull PipelineStep next, @Nonnull Job job) {
	}

	/**
	 * Mutable state of one run: the last committed snapshot and the token meter of the job.
	 * Only the engine thread touches it; per-chunk results are committed from the outcome callbacks,
	 * which run on the engine thread as well.
	 */
	private final class Execution {

		private final String prefix;
		private final JobCancellation cancellation;
		private final TokenUsageMeter meter = new TokenUsageMeter();
		private final TokenUsageMeter.Usage baseUsage;
		private Job current;
		@Nullable
		private Exception deferred;

		Execution(@Nonnull Job job, @Nonnull JobCancellation cancellation) {
			this.prefix = "[" + job.jobId() + "] ";
			this.cancellation = cancellation;
			this.current = job;
			final JobMetrics metrics = job.metrics();
			this.baseUsage = new TokenUsageMeter.Usage(
				metrics.promptTokens(), metrics.completionTokens(), metrics.generationCalls()
			);
		}

		@Nonnull
		Job current() {
			return this.current;
		}

		/**
		 * Persists and publishes a snapshot with the current token totals. A snapshot saved after the job
		 * was cancelled is removed again and never published.
		 */
		@Nonnull
		Job commit(@Nonnull Job job) throws PersistenceException, JobCancelledException {
			this.cancellation.throwIfCancelled();
			final TokenUsageMeter.Usage usage = this.meter.snapshot();
			final Job measured = job.withMetrics(job.metrics().withUsage(
				this.baseUsage.promptTokens() + usage.promptTokens(),
				this.baseUsage.completionTokens() + usage.completionTokens(),
				this.baseUsage.calls() + usage.calls()
			));
			try {
				PipelineEngine.this.store.save(measured);
			} catch (PersistenceException e) {
				PipelineEngine.this.log.error(this.prefix + "Cannot persist job state: " + e.getMessage(), e);
				PipelineEngine.this.hub.publish(
					failed(this.current, "Persistence failure: " + e.getMessage())
				);
				throw e;
			}
			if (this.cancellation.isCancelled()) {
				// the job was deleted while the snapshot was being written
				PipelineEngine.this.store.delete(measured.jobId());
				this.cancellation.throwIfCancelled();
			}
			this.current = measured;
			PipelineEngine.this.hub.publish(measured);
			return measured;
		}

		/**
		 * Commits from an outcome callback. The first failure is kept and rethrown after the stage barrier;
		 * later updates are dropped.
		 */
		void commitAsync(@Nonnull UnaryOperator<Job> update) {
			if (this.deferred != null) {
				return;
			}
			try {
				commit(update.apply(this.current));
			} catch (PersistenceException | JobCancelledException e) {
				this.deferred = e;
			}
		}

		void rethrowDeferred() throws PersistenceException, JobCancelledException {
			final Exception failure = this.deferred;
			if (failure instanceof PersistenceException persistenceException) {
				throw persistenceException;
			} else if (failure instanceof JobCancelledException cancelledException) {
				throw cancelledException;
			}
		}
	}
}
