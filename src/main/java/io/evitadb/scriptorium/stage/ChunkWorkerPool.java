package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.model.Chunk;
import io.evitadb.scriptorium.model.ChunkOutcome;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Fixed-size pool that processes chunk-level work items in parallel.
 *
 * Work items wait in the executor queue until a worker is free, so no more than {@code parallelism}
 * items run at once. Results are handed back through a completion service in the order they finish;
 * the calling thread consumes them one by one, which keeps the caller the only writer of job state.
 * A failing work item produces a failure outcome for its chunk and never affects its siblings.
 */
public final class ChunkWorkerPool implements AutoCloseable {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	private final ExecutorService executor;
	private final int parallelism;
	private final Log log;

	/**
	 * Creates a pool with the specified parallelism.
	 *
	 * @param parallelism maximum number of work items in flight
	 * @param log         Maven log for output
	 */
	public ChunkWorkerPool(int parallelism, @Nonnull Log log) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		this.parallelism = parallelism;
		this.executor = Executors.newFixedThreadPool(parallelism);
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	public int getParallelism() {
		return this.parallelism;
	}

	/**
	 * Runs the task for every chunk and waits until all of them have finished (the stage barrier).
	 *
	 * @param chunks    chunks to process
	 * @param task      work applied to each chunk
	 * @param onOutcome called on the calling thread for every outcome, in completion order
	 * @return outcomes sorted by chunk index
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	@Nonnull
	public List<ChunkOutcome> runAll(
		@Nonnull List<Chunk> chunks,
		@Nonnull ChunkTask task,
		@Nonnull Consumer<ChunkOutcome> onOutcome
	) throws InterruptedException {
		Objects.requireNonNull(chunks, "chunks must not be null");
		Objects.requireNonNull(task, "task must not be null");
		Objects.requireNonNull(onOutcome, "onOutcome must not be null");

		if (chunks.isEmpty()) {
			return List.of();
		}

		final CompletionService<ChunkOutcome> results = new ExecutorCompletionService<>(this.executor);
		final List<Future<ChunkOutcome>> submitted = new ArrayList<>(chunks.size());
		for (final Chunk chunk : chunks) {
			submitted.add(results.submit(() -> runGuarded(task, chunk)));
		}

		final List<ChunkOutcome> outcomes = new ArrayList<>(chunks.size());
		try {
			for (int i = 0; i < chunks.size(); i++) {
				final Future<ChunkOutcome> finished = results.take();
				final ChunkOutcome outcome;
				try {
					outcome = finished.get();
				} catch (ExecutionException e) {
					// runGuarded converts every exception, only errors end up here
					throw new IllegalStateException("Chunk worker crashed: " + e.getCause(), e.getCause());
				}
				outcomes.add(outcome);
				onOutcome.accept(outcome);
			}
		} catch (InterruptedException e) {
			submitted.forEach(future -> future.cancel(true));
			throw e;
		}

		outcomes.sort(Comparator.comparingInt(ChunkOutcome::index));
		return outcomes;
	}

	@Nonnull
	private ChunkOutcome runGuarded(@Nonnull ChunkTask task, @Nonnull Chunk chunk) {
		try {
			return task.process(chunk);
		} catch (JobCancelledException e) {
			return ChunkOutcome.failure(chunk.index(), e.getMessage());
		} catch (Exception e) {
			this.log.debug("Chunk " + chunk.index() + " failed: " + e.getMessage());
			return ChunkOutcome.failure(chunk.index(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
		}
	}

	/**
	 * Shuts down the pool gracefully, waiting for running work items to complete.
	 */
	public void shutdown() {
		this.executor.shutdown();
		try {
			if (!this.executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Chunk worker pool did not terminate in time, forcing shutdown");
				this.executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.executor.shutdownNow();
		}
	}

	@Override
	public void close() {
		shutdown();
	}

	/**
	 * Work applied to a single chunk on a pool thread.
	 */
	@FunctionalInterface
	public interface ChunkTask {

		@Nonnull
		ChunkOutcome process(@Nonnull Chunk chunk) throws Exception;
	}
}
