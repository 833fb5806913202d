package io.evitadb.scriptorium.store;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The job store could not read or write a job. The job keeps its last durable state and can be
 * resumed once the store is available again.
 */
public final class PersistenceException extends Exception {

	@Nullable
	private final String jobId;

	public PersistenceException(@Nonnull String message, @Nullable String jobId, @Nullable Throwable cause) {
		super(formatMessage(message, jobId), cause);
		this.jobId = jobId;
	}

	@Nonnull
	private static String formatMessage(@Nonnull String message, @Nullable String jobId) {
		if (jobId != null) {
			return message + " (job " + jobId + ")";
		}
		return message;
	}

	/**
	 * Returns the id of the affected job.
	 *
	 * @return job id or null if the failure is not tied to a single job
	 */
	@Nullable
	public String getJobId() {
		return this.jobId;
	}
}
