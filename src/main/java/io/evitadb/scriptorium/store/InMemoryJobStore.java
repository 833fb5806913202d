package io.evitadb.scriptorium.store;

import io.evitadb.scriptorium.model.Job;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job store kept in memory. Jobs are immutable snapshots, so storing the reference is enough.
 */
public final class InMemoryJobStore implements JobStore {

	private final Map<String, Job> jobs = new ConcurrentHashMap<>();

	@Override
	public void save(@Nonnull Job job) {
		Objects.requireNonNull(job, "job must not be null");
		this.jobs.put(job.jobId(), job);
	}

	@Nonnull
	@Override
	public Optional<Job> find(@Nonnull String jobId) {
		return Optional.ofNullable(this.jobs.get(jobId));
	}

	@Override
	public boolean delete(@Nonnull String jobId) {
		return this.jobs.remove(jobId) != null;
	}

	@Nonnull
	@Override
	public List<Job> list() {
		final List<Job> all = new ArrayList<>(this.jobs.values());
		all.sort(Comparator.comparing(Job::createdAt));
		return all;
	}
}
