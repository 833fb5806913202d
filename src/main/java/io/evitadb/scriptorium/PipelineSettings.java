package io.evitadb.scriptorium;

import io.evitadb.scriptorium.stage.GlossaryResolver;
import io.evitadb.scriptorium.stage.RetryPolicy;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Engine-wide settings shared by all jobs.
 *
 * @param parallelism           number of chunk workers
 * @param retryPolicy           retry policy of every generation call
 * @param glossaryExcerptLength characters of the document shown to terminology extraction
 * @param maxConcurrentJobs     number of jobs processed at the same time
 */
public record PipelineSettings(
	int parallelism,
	@Nonnull RetryPolicy retryPolicy,
	int glossaryExcerptLength,
	int maxConcurrentJobs
) {

	public static final int DEFAULT_PARALLELISM = 5;
	public static final int DEFAULT_MAX_CONCURRENT_JOBS = 2;

	public PipelineSettings {
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		if (maxConcurrentJobs < 1) {
			throw new IllegalArgumentException("maxConcurrentJobs must be at least 1");
		}
		if (glossaryExcerptLength < 1) {
			throw new IllegalArgumentException("glossaryExcerptLength must be positive");
		}
		Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
	}

	@Nonnull
	public static PipelineSettings defaults() {
		return new PipelineSettings(
			DEFAULT_PARALLELISM, RetryPolicy.defaults(), GlossaryResolver.DEFAULT_EXCERPT_LENGTH, DEFAULT_MAX_CONCURRENT_JOBS
		);
	}

	@Nonnull
	public PipelineSettings withParallelism(int parallelism) {
		return new PipelineSettings(parallelism, this.retryPolicy, this.glossaryExcerptLength, this.maxConcurrentJobs);
	}

	@Nonnull
	public PipelineSettings withRetryPolicy(@Nonnull RetryPolicy retryPolicy) {
		return new PipelineSettings(this.parallelism, retryPolicy, this.glossaryExcerptLength, this.maxConcurrentJobs);
	}
}
