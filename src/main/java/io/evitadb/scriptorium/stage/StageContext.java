package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.model.JobConfig;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Per-job collaborators handed to every stage.
 *
 * @param jobId     id of the job being processed
 * @param config    job configuration
 * @param generator retrying generation client bound to the job
 * @param pool      worker pool for chunk-level work
 * @param log       Maven log for output
 */
public record StageContext(
	@Nonnull String jobId,
	@Nonnull JobConfig config,
	@Nonnull RetryingGenerator generator,
	@Nonnull ChunkWorkerPool pool,
	@Nonnull Log log
) {

	public StageContext {
		Objects.requireNonNull(jobId, "jobId must not be null");
		Objects.requireNonNull(config, "config must not be null");
		Objects.requireNonNull(generator, "generator must not be null");
		Objects.requireNonNull(pool, "pool must not be null");
		Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Prefix for log messages of this job.
	 */
	@Nonnull
	public String logPrefix() {
		return "[" + this.jobId + "] ";
	}
}
