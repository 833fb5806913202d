package io.evitadb.scriptorium.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;

/**
 * Cumulative counters of a job. Token counts only ever grow; every generation call adds to them,
 * including calls made by earlier runs of a resumed job.
 *
 * @param promptTokens        tokens sent to the generation backend
 * @param completionTokens    tokens received from the generation backend
 * @param totalTokens         sum of prompt and completion tokens
 * @param generationCalls     number of generation calls, including retried attempts
 * @param startedAt           when the engine first started the job
 * @param finishedAt          when the job reached a terminal state
 * @param sourceWordCount     words in the source document
 * @param translatedWordCount words in the final document
 * @param totalChunks         number of chunks the document was split into
 */
public record JobMetrics(
	long promptTokens,
	long completionTokens,
	long totalTokens,
	long generationCalls,
	@Nullable Instant startedAt,
	@Nullable Instant finishedAt,
	long sourceWordCount,
	long translatedWordCount,
	int totalChunks
) {

	public JobMetrics {
		totalTokens = promptTokens + completionTokens;
	}

	@Nonnull
	public static JobMetrics empty() {
		return new JobMetrics(0, 0, 0, 0, null, null, 0, 0, 0);
	}

	/**
	 * Marks the start of processing. Keeps the original start time when a job is resumed.
	 */
	@Nonnull
	public JobMetrics started(@Nonnull Instant now) {
		return new JobMetrics(
			this.promptTokens, this.completionTokens, 0, this.generationCalls,
			this.startedAt != null ? this.startedAt : now, null,
			this.sourceWordCount, this.translatedWordCount, this.totalChunks
		);
	}

	/**
	 * Replaces the usage counters. Callers pass totals that already include earlier runs of the job.
	 */
	@Nonnull
	public JobMetrics withUsage(long promptTokens, long completionTokens, long calls) {
		return new JobMetrics(
			promptTokens, completionTokens, 0, calls, this.startedAt, this.finishedAt,
			this.sourceWordCount, this.translatedWordCount, this.totalChunks
		);
	}

	@Nonnull
	public JobMetrics withChunking(long sourceWordCount, int totalChunks) {
		return new JobMetrics(
			this.promptTokens, this.completionTokens, 0, this.generationCalls,
			this.startedAt, this.finishedAt, sourceWordCount, this.translatedWordCount, totalChunks
		);
	}

	@Nonnull
	public JobMetrics finished(@Nonnull Instant now, long translatedWordCount) {
		return new JobMetrics(
			this.promptTokens, this.completionTokens, 0, this.generationCalls,
			this.startedAt, now, this.sourceWordCount, translatedWordCount, this.totalChunks
		);
	}

	/**
	 * Wall-clock duration, null while the job has not finished.
	 */
	@Nullable
	public Duration duration() {
		if (this.startedAt == null || this.finishedAt == null) {
			return null;
		}
		return Duration.between(this.startedAt, this.finishedAt);
	}

	/**
	 * Counts whitespace-separated words.
	 */
	public static long countWords(@Nullable String text) {
		if (text == null || text.isBlank()) {
			return 0;
		}
		return text.trim().split("\\s+").length;
	}
}
