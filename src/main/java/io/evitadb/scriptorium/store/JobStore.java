package io.evitadb.scriptorium.store;

import io.evitadb.scriptorium.model.Job;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of job snapshots keyed by job id.
 *
 * Implementations must allow concurrent access to distinct jobs and serialize writes to the same job.
 */
public interface JobStore {

	/**
	 * Stores the snapshot, replacing any previous snapshot of the same job.
	 *
	 * @param job snapshot to store
	 * @throws PersistenceException if the store is not available
	 */
	void save(@Nonnull Job job) throws PersistenceException;

	/**
	 * Loads the latest snapshot of a job.
	 *
	 * @param jobId job id
	 * @return the snapshot or empty if there is no such job
	 * @throws PersistenceException if the store is not available
	 */
	@Nonnull
	Optional<Job> find(@Nonnull String jobId) throws PersistenceException;

	/**
	 * Removes a job. Deleting a job that does not exist is not an error.
	 *
	 * @param jobId job id
	 * @return true if a job was removed
	 * @throws PersistenceException if the store is not available
	 */
	boolean delete(@Nonnull String jobId) throws PersistenceException;

	/**
	 * Lists all stored jobs, oldest first.
	 *
	 * @return stored jobs
	 * @throws PersistenceException if the store is not available
	 */
	@Nonnull
	List<Job> list() throws PersistenceException;
}
