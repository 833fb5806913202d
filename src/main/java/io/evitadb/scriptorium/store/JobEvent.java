package io.evitadb.scriptorium.store;

import io.evitadb.scriptorium.model.Job;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * A state-delta event of one job. State events carry the complete snapshot; observers always get the
 * latest state and never need to merge deltas themselves.
 *
 * @param jobId     job the event belongs to
 * @param sequence  per-job sequence number, increasing with every published state
 * @param type      state change or end of stream
 * @param job       snapshot for state events, null for the end-of-stream marker
 * @param emittedAt when the event was created
 */
public record JobEvent(
	@Nonnull String jobId,
	long sequence,
	@Nonnull Type type,
	@Nullable Job job,
	@Nonnull Instant emittedAt
) {

	public JobEvent {
		Objects.requireNonNull(jobId, "jobId must not be null");
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(emittedAt, "emittedAt must not be null");
		if (type == Type.STATE && job == null) {
			throw new IllegalArgumentException("state event requires a job snapshot");
		}
	}

	/**
	 * Returns true when the event carries a completed or failed job.
	 */
	public boolean isTerminal() {
		return this.job != null && this.job.isTerminal();
	}

	public enum Type {
		STATE,
		END_OF_STREAM
	}
}
