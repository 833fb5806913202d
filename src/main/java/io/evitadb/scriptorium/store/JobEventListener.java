package io.evitadb.scriptorium.store;

import javax.annotation.Nonnull;

/**
 * Receives live updates of one job.
 */
public interface JobEventListener {

	/**
	 * Called for each published state, in sequence order. Must return quickly: it runs on the thread
	 * that drives the job.
	 *
	 * @param event the state event
	 */
	void onEvent(@Nonnull JobEvent event);

	/**
	 * Called once after the terminal state (or after the job was deleted). No further events follow.
	 *
	 * @param jobId the job id
	 */
	default void onEndOfStream(@Nonnull String jobId) {
	}
}
