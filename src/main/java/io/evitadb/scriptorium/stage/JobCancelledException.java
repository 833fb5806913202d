package io.evitadb.scriptorium.stage;

import javax.annotation.Nonnull;

/**
 * Thrown inside the pipeline once a job has been deleted while it was running.
 */
public final class JobCancelledException extends Exception {

	@Nonnull
	private final String jobId;

	public JobCancelledException(@Nonnull String jobId) {
		super("Job " + jobId + " was cancelled");
		this.jobId = jobId;
	}

	@Nonnull
	public String getJobId() {
		return this.jobId;
	}
}
