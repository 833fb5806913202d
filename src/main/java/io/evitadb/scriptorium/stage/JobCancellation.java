package io.evitadb.scriptorium.stage;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag of one running job. Set by job deletion, checked by workers before every
 * generation attempt and by the engine before every commit.
 */
public final class JobCancellation {

	@Nonnull
	private final String jobId;
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public JobCancellation(@Nonnull String jobId) {
		this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
	}

	@Nonnull
	public String getJobId() {
		return this.jobId;
	}

	public void cancel() {
		this.cancelled.set(true);
	}

	public boolean isCancelled() {
		return this.cancelled.get();
	}

	/**
	 * @throws JobCancelledException if the job has been cancelled
	 */
	public void throwIfCancelled() throws JobCancelledException {
		if (this.cancelled.get()) {
			throw new JobCancelledException(this.jobId);
		}
	}
}
