package io.evitadb.scriptorium;

import io.evitadb.scriptorium.llm.GenerationServiceFactory;
import io.evitadb.scriptorium.model.Glossary;
import io.evitadb.scriptorium.model.GlossarySelector;
import io.evitadb.scriptorium.model.GlossarySource;
import io.evitadb.scriptorium.model.Job;
import io.evitadb.scriptorium.model.JobLogEntry;
import io.evitadb.scriptorium.model.JobStatus;
import io.evitadb.scriptorium.model.JobSubmission;
import io.evitadb.scriptorium.model.SubmissionReceipt;
import io.evitadb.scriptorium.model.TranslationMode;
import io.evitadb.scriptorium.stage.ChunkWorkerPool;
import io.evitadb.scriptorium.stage.JobCancellation;
import io.evitadb.scriptorium.stage.JobCancelledException;
import io.evitadb.scriptorium.stage.Sleeper;
import io.evitadb.scriptorium.store.GlossaryCatalog;
import io.evitadb.scriptorium.store.JobEventHub;
import io.evitadb.scriptorium.store.JobEventListener;
import io.evitadb.scriptorium.store.JobEventStream;
import io.evitadb.scriptorium.store.JobStore;
import io.evitadb.scriptorium.store.JobSubscription;
import io.evitadb.scriptorium.store.PersistenceException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Entry point for clients: submits, observes, resumes and deletes translation jobs.
 *
 * Each job runs as one task on a bounded job executor; chunk-level work of all jobs shares one worker
 * pool. Job state is read from the store, live updates come from the event hub.
 */
public final class TranslationJobService implements AutoCloseable {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;
	private static final Pattern JOB_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

	@Nonnull
	private final JobStore store;
	@Nonnull
	private final GlossaryCatalog catalog;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final Log log;
	private final JobEventHub hub;
	private final ChunkWorkerPool pool;
	private final PipelineEngine engine;
	private final ExecutorService jobExecutor;
	private final Map<String, RunningJob> running = new ConcurrentHashMap<>();

	/**
	 * Creates a service logging to the console.
	 */
	public TranslationJobService(
		@Nonnull JobStore store,
		@Nonnull GlossaryCatalog catalog,
		@Nonnull GenerationServiceFactory serviceFactory,
		@Nonnull PipelineSettings settings
	) {
		this(store, catalog, serviceFactory, settings, new SystemStreamLog());
	}

	public TranslationJobService(
		@Nonnull JobStore store,
		@Nonnull GlossaryCatalog catalog,
		@Nonnull GenerationServiceFactory serviceFactory,
		@Nonnull PipelineSettings settings,
		@Nonnull Log log
	) {
		this(store, catalog, serviceFactory, settings, Sleeper.SYSTEM, Clock.systemUTC(), log);
	}

	/**
	 * Creates the service.
	 *
	 * @param store          durable job state
	 * @param catalog        named glossaries available to submissions
	 * @param serviceFactory creates the generation backend of a job
	 * @param settings       pipeline settings
	 * @param sleeper        waits between retry attempts
	 * @param clock          source of timestamps
	 * @param log            Maven log for output
	 */
	public TranslationJobService(
		@Nonnull JobStore store,
		@Nonnull GlossaryCatalog catalog,
		@Nonnull GenerationServiceFactory serviceFactory,
		@Nonnull PipelineSettings settings,
		@Nonnull Sleeper sleeper,
		@Nonnull Clock clock,
		@Nonnull Log log
	) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		Objects.requireNonNull(settings, "settings must not be null");
		this.hub = new JobEventHub(clock, log);
		this.pool = new ChunkWorkerPool(settings.parallelism(), log);
		this.engine = new PipelineEngine(store, this.hub, serviceFactory, this.pool, settings, sleeper, clock, log);
		this.jobExecutor = Executors.newFixedThreadPool(settings.maxConcurrentJobs());
	}

	/**
	 * Creates a job and starts it in the background.
	 *
	 * @param submission the document and its configuration
	 * @return id of the job and the glossary it uses
	 * @throws IllegalArgumentException if the job id is invalid or taken, or the stored glossary is unknown
	 * @throws PersistenceException     if the job cannot be saved
	 */
	@Nonnull
	public SubmissionReceipt submit(@Nonnull JobSubmission submission) throws PersistenceException {
		Objects.requireNonNull(submission, "submission must not be null");

		final String jobId = submission.jobId() != null ? submission.jobId() : "job_" + UUID.randomUUID();
		if (!JOB_ID_PATTERN.matcher(jobId).matches()) {
			throw new IllegalArgumentException("Invalid job id: " + jobId);
		}
		if (this.running.containsKey(jobId) || this.store.find(jobId).isPresent()) {
			throw new IllegalArgumentException("Job " + jobId + " already exists");
		}

		final ResolvedGlossary resolved = resolveGlossary(submission.glossarySelector(), jobId);
		final boolean quick = submission.config().translationMode() == TranslationMode.QUICK;
		final GlossarySource source = quick ? GlossarySource.NONE : resolved.source();
		final Glossary glossary = quick ? null : resolved.glossary();
		final String glossaryId = quick ? null : resolved.glossaryId();

		final Job job = Job.create(
			jobId, submission.originalFilename(), submission.originalContent(), submission.config(),
			glossary, source, this.clock.instant()
		);
		this.store.save(job);
		this.hub.publish(job);
		this.log.info("[" + jobId + "] Submitted " + submission.config().translationMode().value() + " job" +
			(submission.originalFilename() != null ? " for " + submission.originalFilename() : "") +
			", glossary: " + source.value());
		start(job);
		return new SubmissionReceipt(jobId, source, glossaryId);
	}

	/**
	 * Returns the current snapshot of a job, including partial results.
	 */
	@Nonnull
	public Optional<Job> getJob(@Nonnull String jobId) throws PersistenceException {
		return this.store.find(Objects.requireNonNull(jobId, "jobId must not be null"));
	}

	/**
	 * Returns all jobs ordered by creation time.
	 */
	@Nonnull
	public List<Job> listJobs() throws PersistenceException {
		return this.store.list();
	}

	/**
	 * Registers a listener for a job. The listener first receives the current state, then every later
	 * state, then end-of-stream. A job that already finished yields its final state and end-of-stream
	 * right away.
	 *
	 * @param jobId    the job to observe
	 * @param listener receives the events
	 * @return handle to stop receiving events
	 * @throws IllegalArgumentException if the job does not exist
	 * @throws PersistenceException     if the store cannot be read
	 */
	@Nonnull
	public JobSubscription subscribe(@Nonnull String jobId, @Nonnull JobEventListener listener) throws PersistenceException {
		Objects.requireNonNull(jobId, "jobId must not be null");
		Objects.requireNonNull(listener, "listener must not be null");

		// register before reading so that no state published in between is lost
		final JobSubscription subscription = this.hub.subscribe(jobId, listener);
		final Optional<Job> job;
		try {
			job = this.store.find(jobId);
		} catch (PersistenceException e) {
			subscription.close();
			throw e;
		}
		if (job.isEmpty()) {
			subscription.close();
			throw new IllegalArgumentException("Unknown job: " + jobId);
		}
		// the hub ends the stream itself when the replayed snapshot is terminal
		this.hub.replay(job.get(), listener);
		return subscription;
	}

	/**
	 * Opens a pull-based stream of a job's states.
	 *
	 * @see #subscribe(String, JobEventListener)
	 */
	@Nonnull
	public JobEventStream openStream(@Nonnull String jobId) throws PersistenceException {
		final JobEventStream stream = new JobEventStream();
		stream.attach(subscribe(jobId, stream));
		return stream;
	}

	/**
	 * Deletes a job. A running job is cancelled: its workers stop retrying and nothing more is persisted.
	 * Deleting an unknown job is a no-op.
	 *
	 * @param jobId the job to delete
	 * @return true if there was anything to delete
	 * @throws PersistenceException if the store cannot be updated
	 */
	public boolean delete(@Nonnull String jobId) throws PersistenceException {
		Objects.requireNonNull(jobId, "jobId must not be null");
		final RunningJob runningJob = this.running.get(jobId);
		if (runningJob != null) {
			runningJob.cancellation().cancel();
		}
		final boolean removed = this.store.delete(jobId);
		this.hub.forget(jobId);
		if (removed || runningJob != null) {
			this.log.info("[" + jobId + "] Deleted" + (runningJob != null ? " while running" : ""));
		}
		return removed || runningJob != null;
	}

	/**
	 * Restarts a job that did not complete, continuing from its persisted snapshot.
	 *
	 * @param jobId the job to resume
	 * @return receipt of the resumed job
	 * @throws IllegalArgumentException if the job does not exist, is completed or is still running
	 * @throws PersistenceException     if the store cannot be read or written
	 */
	@Nonnull
	public SubmissionReceipt resume(@Nonnull String jobId) throws PersistenceException {
		Objects.requireNonNull(jobId, "jobId must not be null");
		final Job job = this.store.find(jobId)
			.orElseThrow(() -> new IllegalArgumentException("Unknown job: " + jobId));
		if (job.status() == JobStatus.COMPLETED) {
			throw new IllegalArgumentException("Job " + jobId + " is already completed");
		}
		if (this.running.containsKey(jobId)) {
			throw new IllegalArgumentException("Job " + jobId + " is already running");
		}

		final String message = "Resuming from step " + job.currentStep().value() +
			" with " + job.chunks().size() + " existing chunk(s)";
		final Job resumed = job.resumed(this.clock.instant())
			.withLog(JobLogEntry.Level.INFO, message, this.clock.instant());
		this.store.save(resumed);
		this.hub.publish(resumed);
		this.log.info("[" + jobId + "] " + message);
		start(resumed);
		return new SubmissionReceipt(jobId, resumed.glossarySource(), null);
	}

	/**
	 * Waits until a job reaches a terminal state.
	 *
	 * @param jobId   the job to wait for
	 * @param timeout maximum time to wait
	 * @return the terminal snapshot, or empty if the job was deleted or does not exist
	 * @throws PersistenceException if the job stopped because its state could not be saved
	 * @throws InterruptedException if interrupted while waiting
	 * @throws TimeoutException     if the job is still running after the timeout
	 */
	@Nonnull
	public Optional<Job> await(
		@Nonnull String jobId,
		@Nonnull Duration timeout
	) throws PersistenceException, InterruptedException, TimeoutException {
		Objects.requireNonNull(jobId, "jobId must not be null");
		final RunningJob runningJob = this.running.get(jobId);
		if (runningJob == null) {
			return this.store.find(jobId);
		}
		try {
			return Optional.ofNullable(runningJob.result().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
		} catch (ExecutionException e) {
			if (e.getCause() instanceof PersistenceException persistenceException) {
				throw persistenceException;
			}
			throw new IllegalStateException("Job " + jobId + " crashed: " + e.getCause().getMessage(), e.getCause());
		}
	}

	/**
	 * Returns true while the job is being processed.
	 */
	public boolean isRunning(@Nonnull String jobId) {
		return this.running.containsKey(jobId);
	}

	private void start(@Nonnull Job job) {
		final RunningJob runningJob = new RunningJob(new JobCancellation(job.jobId()), new CompletableFuture<>());
		this.running.put(job.jobId(), runningJob);
		this.jobExecutor.submit(() -> execute(job, runningJob));
	}

	private void execute(@Nonnull Job job, @Nonnull RunningJob runningJob) {
		final String prefix = "[" + job.jobId() + "] ";
		try {
			runningJob.result().complete(this.engine.run(job, runningJob.cancellation()));
		} catch (JobCancelledException e) {
			this.log.info(prefix + "Cancelled, discarding its state");
			try {
				// a commit may have raced with the deletion
				this.store.delete(job.jobId());
			} catch (PersistenceException pe) {
				this.log.warn(prefix + "Cannot remove state of cancelled job: " + pe.getMessage());
			}
			this.hub.forget(job.jobId());
			runningJob.result().complete(null);
		} catch (PersistenceException e) {
			this.log.error(prefix + "Stopped, job state could not be persisted: " + e.getMessage());
			runningJob.result().completeExceptionally(e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.log.warn(prefix + "Interrupted");
			this.hub.endOfStream(job.jobId());
			runningJob.result().completeExceptionally(e);
		} catch (RuntimeException e) {
			this.log.error(prefix + "Crashed: " + e.getMessage(), e);
			this.hub.endOfStream(job.jobId());
			runningJob.result().completeExceptionally(e);
		} finally {
			this.running.remove(job.jobId(), runningJob);
		}
	}

	@Nonnull
	private ResolvedGlossary resolveGlossary(@Nonnull GlossarySelector selector, @Nonnull String jobId) {
		if (selector instanceof GlossarySelector.Inline inline) {
			return new ResolvedGlossary(inline.glossary(), GlossarySource.INLINE, null);
		} else if (selector instanceof GlossarySelector.Stored stored) {
			final Glossary glossary = this.catalog.find(stored.glossaryId())
				.orElseThrow(() -> new IllegalArgumentException("Unknown glossary: " + stored.glossaryId()));
			return new ResolvedGlossary(glossary, GlossarySource.STORED, stored.glossaryId());
		} else if (selector instanceof GlossarySelector.DefaultGlossary) {
			final Optional<String> defaultId = this.catalog.getDefaultId();
			final Optional<Glossary> glossary = defaultId.flatMap(this.catalog::find);
			if (glossary.isPresent()) {
				return new ResolvedGlossary(glossary.get(), GlossarySource.DEFAULT, defaultId.get());
			}
			this.log.warn("[" + jobId + "] No default glossary configured, terminology will be extracted automatically");
		}
		return new ResolvedGlossary(null, GlossarySource.AUTO_EXTRACTED, null);
	}

	/**
	 * Stops accepting work and waits for running jobs to finish.
	 */
	@Override
	public void close() {
		this.jobExecutor.shutdown();
		try {
			if (!this.jobExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Job executor did not terminate in time, cancelling running jobs");
				this.running.values().forEach(job -> job.cancellation().cancel());
				this.jobExecutor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.jobExecutor.shutdownNow();
		}
		this.pool.shutdown();
	}

	private record RunningJob(@Nonnull JobCancellation cancellation, @Nonnull CompletableFuture<Job> result) {
	}

	private record ResolvedGlossary(@Nullable Glossary glossary, @Nonnull GlossarySource source, @Nullable String glossaryId) {
	}
}
