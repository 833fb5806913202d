package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Full snapshot of a translation job: the unit of persistence and of event delivery.
 *
 * The record is immutable. The pipeline engine is its only writer and produces a new snapshot on
 * every transition; chunks are always kept sorted by index so that no reader ever has to rely on
 * the order in which concurrent work completed.
 */
public record Job(
	@Nonnull String jobId,
	@Nullable String originalFilename,
	@Nonnull String originalContent,
	@Nonnull JobConfig config,
	@Nonnull JobStatus status,
	@Nonnull PipelineStep currentStep,
	int progressPercent,
	@Nonnull Instant createdAt,
	@Nonnull Instant updatedAt,
	@Nullable String errorInfo,
	@Nonnull JobMetrics metrics,
	@Nonnull List<Chunk> chunks,
	@JsonProperty("job_glossary") @Nullable Glossary glossary,
	@Nonnull GlossarySource glossarySource,
	@JsonProperty("critiques") @Nullable Critique critique,
	@Nullable String finalDocument,
	@Nonnull List<JobLogEntry> logs
) {

	/**
	 * Number of history entries a job keeps; older entries are dropped first.
	 */
	public static final int MAX_LOG_ENTRIES = 200;

	public Job {
		Objects.requireNonNull(jobId, "jobId must not be null");
		Objects.requireNonNull(originalContent, "originalContent must not be null");
		Objects.requireNonNull(config, "config must not be null");
		Objects.requireNonNull(status, "status must not be null");
		Objects.requireNonNull(currentStep, "currentStep must not be null");
		Objects.requireNonNull(createdAt, "createdAt must not be null");
		Objects.requireNonNull(updatedAt, "updatedAt must not be null");
		if (progressPercent < 0 || progressPercent > 100) {
			throw new IllegalArgumentException("progressPercent must be between 0 and 100, got " + progressPercent);
		}
		metrics = metrics == null ? JobMetrics.empty() : metrics;
		glossarySource = glossarySource == null ? GlossarySource.NONE : glossarySource;
		if (chunks == null) {
			chunks = List.of();
		} else {
			final List<Chunk> sorted = new ArrayList<>(chunks);
			sorted.sort(Comparator.comparingInt(Chunk::index));
			chunks = List.copyOf(sorted);
		}
		if (logs == null) {
			logs = List.of();
		} else {
			logs = List.copyOf(logs.subList(Math.max(0, logs.size() - MAX_LOG_ENTRIES), logs.size()));
		}
	}

	/**
	 * Creates a freshly submitted job.
	 */
	@Nonnull
	public static Job create(
		@Nonnull String jobId,
		@Nullable String originalFilename,
		@Nonnull String originalContent,
		@Nonnull JobConfig config,
		@Nullable Glossary userGlossary,
		@Nonnull GlossarySource glossarySource,
		@Nonnull Instant now
	) {
		return new Job(
			jobId, originalFilename, originalContent, config, JobStatus.PENDING, PipelineStep.PENDING, 0,
			now, now, null, JobMetrics.empty(), List.of(), userGlossary, glossarySource, null, null, List.of()
		);
	}

	/**
	 * Pipeline variant of the job.
	 */
	@Nonnull
	public TranslationMode mode() {
		return this.config.translationMode();
	}

	@JsonIgnore
	public boolean isTerminal() {
		return this.status.isTerminal();
	}

	@Nonnull
	public Optional<Chunk> chunk(int index) {
		return this.chunks.stream().filter(chunk -> chunk.index() == index).findFirst();
	}

	/**
	 * Moves the job to the given step. Progress never goes backwards.
	 */
	@Nonnull
	public Job atStep(@Nonnull PipelineStep step, int progress, @Nonnull Instant now) {
		final JobStatus newStatus = step == PipelineStep.COMPLETED
			? JobStatus.COMPLETED
			: step == PipelineStep.FAILED ? JobStatus.FAILED : JobStatus.RUNNING;
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, newStatus, step,
			Math.max(this.progressPercent, Math.min(progress, 100)), this.createdAt, now, this.errorInfo,
			this.metrics, this.chunks, this.glossary, this.glossarySource, this.critique, this.finalDocument,
			this.logs
		);
	}

	/**
	 * Raises progress within the current step.
	 */
	@Nonnull
	public Job withProgress(int progress, @Nonnull Instant now) {
		return atStep(this.currentStep, progress, now);
	}

	@Nonnull
	public Job withChunks(@Nonnull List<Chunk> chunks, @Nonnull Instant now) {
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, this.status, this.currentStep,
			this.progressPercent, this.createdAt, now, this.errorInfo, this.metrics, chunks, this.glossary,
			this.glossarySource, this.critique, this.finalDocument, this.logs
		);
	}

	/**
	 * Replaces the chunk with the same index.
	 */
	@Nonnull
	public Job withChunk(@Nonnull Chunk chunk, @Nonnull Instant now) {
		final List<Chunk> updated = new ArrayList<>(this.chunks.size());
		boolean replaced = false;
		for (Chunk existing : this.chunks) {
			if (existing.index() == chunk.index()) {
				updated.add(chunk);
				replaced = true;
			} else {
				updated.add(existing);
			}
		}
		if (!replaced) {
			throw new IllegalArgumentException("Job " + this.jobId + " has no chunk with index " + chunk.index());
		}
		return withChunks(updated, now);
	}

	@Nonnull
	public Job withGlossary(@Nonnull Glossary glossary, @Nonnull GlossarySource source, @Nonnull Instant now) {
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, this.status, this.currentStep,
			this.progressPercent, this.createdAt, now, this.errorInfo, this.metrics, this.chunks, glossary,
			source, this.critique, this.finalDocument, this.logs
		);
	}

	@Nonnull
	public Job withCritique(@Nonnull Critique critique, @Nonnull Instant now) {
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, this.status, this.currentStep,
			this.progressPercent, this.createdAt, now, this.errorInfo, this.metrics, this.chunks, this.glossary,
			this.glossarySource, critique, this.finalDocument, this.logs
		);
	}

	@Nonnull
	public Job withMetrics(@Nonnull JobMetrics metrics) {
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, this.status, this.currentStep,
			this.progressPercent, this.createdAt, this.updatedAt, this.errorInfo, metrics, this.chunks, this.glossary,
			this.glossarySource, this.critique, this.finalDocument, this.logs
		);
	}

	@Nonnull
	public Job withFinalDocument(@Nonnull String finalDocument, @Nonnull Instant now) {
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, this.status, this.currentStep,
			this.progressPercent, this.createdAt, now, this.errorInfo, this.metrics, this.chunks, this.glossary,
			this.glossarySource, this.critique, finalDocument, this.logs
		);
	}

	/**
	 * Appends an entry to the job's history, tagged with the current step. Only the newest
	 * {@link #MAX_LOG_ENTRIES} entries are kept.
	 */
	@Nonnull
	public Job withLog(@Nonnull JobLogEntry.Level level, @Nonnull String message, @Nonnull Instant now) {
		final List<JobLogEntry> updated = new ArrayList<>(this.logs.size() + 1);
		updated.addAll(this.logs);
		updated.add(new JobLogEntry(now, level, this.currentStep, message));
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, this.status, this.currentStep,
			this.progressPercent, this.createdAt, this.updatedAt, this.errorInfo, this.metrics, this.chunks,
			this.glossary, this.glossarySource, this.critique, this.finalDocument, updated
		);
	}

	/**
	 * Moves the job to the failed state with a human-readable cause. Chunks and partial results are kept.
	 */
	@Nonnull
	public Job failed(@Nonnull String errorInfo, @Nonnull Instant now) {
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, JobStatus.FAILED, PipelineStep.FAILED,
			this.progressPercent, this.createdAt, now, errorInfo, this.metrics, this.chunks, this.glossary,
			this.glossarySource, this.critique, null, this.logs
		);
	}

	/**
	 * Prepares a non-completed job for another run: clears the error, resets failed chunks and
	 * drops a previous critique verdict.
	 */
	@Nonnull
	public Job resumed(@Nonnull Instant now) {
		final List<Chunk> resetChunks = new ArrayList<>(this.chunks.size());
		for (Chunk chunk : this.chunks) {
			resetChunks.add(chunk.status() == ChunkStatus.FAILED || chunk.status() == ChunkStatus.TRANSLATING
				? chunk.reset() : chunk);
		}
		return new Job(
			this.jobId, this.originalFilename, this.originalContent, this.config, JobStatus.PENDING, PipelineStep.PENDING,
			this.progressPercent, this.createdAt, now, null, this.metrics, resetChunks, this.glossary,
			this.glossarySource, null, null, this.logs
		);
	}
}
