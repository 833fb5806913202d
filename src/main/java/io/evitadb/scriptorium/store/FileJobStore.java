package io.evitadb.scriptorium.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.evitadb.scriptorium.model.Job;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores every job as one JSON document `<directory>/<jobId>.json`.
 *
 * A snapshot is first written to a temporary file and then moved over the previous one, so readers
 * never see a half-written job. Writes to the same job are serialized by one of a fixed set of striped
 * locks, so the number of locks does not grow with the number of jobs.
 */
public final class FileJobStore implements JobStore {

	private static final String EXTENSION = ".json";
	private static final int LOCK_STRIPES = 64;
	private static final Pattern SAFE_JOB_ID = Pattern.compile("[A-Za-z0-9._-]+");

	private final Path directory;
	private final JobJsonCodec codec;
	private final Object[] locks = new Object[LOCK_STRIPES];

	/**
	 * Creates the store.
	 *
	 * @param directory directory holding the job files, created on first write
	 * @param codec     JSON codec
	 */
	public FileJobStore(@Nonnull Path directory, @Nonnull JobJsonCodec codec) {
		this.directory = Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath().normalize();
		this.codec = Objects.requireNonNull(codec, "codec must not be null");
		for (int i = 0; i < this.locks.length; i++) {
			this.locks[i] = new Object();
		}
	}

	@Nonnull
	public Path getDirectory() {
		return this.directory;
	}

	@Override
	public void save(@Nonnull Job job) throws PersistenceException {
		Objects.requireNonNull(job, "job must not be null");
		final Path target = fileOf(job.jobId());
		synchronized (lockOf(job.jobId())) {
			try {
				final String json = this.codec.writeJob(job);
				Files.createDirectories(this.directory);
				final Path temp = Files.createTempFile(this.directory, job.jobId() + ".", ".tmp");
				try {
					Files.writeString(temp, json, StandardCharsets.UTF_8);
					move(temp, target);
				} finally {
					Files.deleteIfExists(temp);
				}
			} catch (IOException e) {
				throw new PersistenceException("Failed to write job snapshot to " + target + ": " + e.getMessage(), job.jobId(), e);
			}
		}
	}

	@Nonnull
	@Override
	public Optional<Job> find(@Nonnull String jobId) throws PersistenceException {
		final Path file = fileOf(jobId);
		synchronized (lockOf(jobId)) {
			if (!Files.exists(file)) {
				return Optional.empty();
			}
			return Optional.of(read(file, jobId));
		}
	}

	@Override
	public boolean delete(@Nonnull String jobId) throws PersistenceException {
		final Path file = fileOf(jobId);
		synchronized (lockOf(jobId)) {
			try {
				return Files.deleteIfExists(file);
			} catch (IOException e) {
				throw new PersistenceException("Failed to delete " + file + ": " + e.getMessage(), jobId, e);
			}
		}
	}

	@Nonnull
	@Override
	public List<Job> list() throws PersistenceException {
		if (!Files.isDirectory(this.directory)) {
			return List.of();
		}
		final List<Path> files;
		try (final Stream<Path> stream = Files.list(this.directory)) {
			files = stream
				.filter(path -> path.getFileName().toString().endsWith(EXTENSION))
				.toList();
		} catch (IOException e) {
			throw new PersistenceException("Failed to list jobs in " + this.directory + ": " + e.getMessage(), null, e);
		}

		final List<Job> jobs = new ArrayList<>(files.size());
		for (Path file : files) {
			final String name = file.getFileName().toString();
			final String jobId = name.substring(0, name.length() - EXTENSION.length());
			find(jobId).ifPresent(jobs::add);
		}
		jobs.sort(Comparator.comparing(Job::createdAt));
		return jobs;
	}

	/**
	 * Validates a job id and returns the file of the job.
	 *
	 * @throws IllegalArgumentException if the id contains characters unsafe for a file name
	 */
	@Nonnull
	private Path fileOf(@Nonnull String jobId) {
		Objects.requireNonNull(jobId, "jobId must not be null");
		if (!SAFE_JOB_ID.matcher(jobId).matches() || jobId.startsWith(".")) {
			throw new IllegalArgumentException("Job id is not usable as a file name: " + jobId);
		}
		return this.directory.resolve(jobId + EXTENSION);
	}

	@Nonnull
	private Object lockOf(@Nonnull String jobId) {
		return this.locks[Math.floorMod(jobId.hashCode(), this.locks.length)];
	}

	@Nonnull
	private Job read(@Nonnull Path file, @Nonnull String jobId) throws PersistenceException {
		try {
			return this.codec.readJob(Files.readString(file, StandardCharsets.UTF_8));
		} catch (JsonProcessingException e) {
			throw new PersistenceException("Corrupted job snapshot " + file + ": " + e.getOriginalMessage(), jobId, e);
		} catch (IOException e) {
			throw new PersistenceException("Failed to read " + file + ": " + e.getMessage(), jobId, e);
		}
	}

	private static void move(@Nonnull Path source, @Nonnull Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
