package io.evitadb.scriptorium.store;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Optional;

/**
 * Pull-side view of a job's live updates.
 *
 * The stream keeps only the newest undelivered state: a slow reader skips intermediate states but
 * always sees the latest one. An event that is not newer than the last one received is ignored.
 * Because the hub publishes the terminal state before ending the stream, the terminal state is always
 * returned before {@link #isFinished()} becomes true.
 */
public final class JobEventStream implements JobEventListener, AutoCloseable {

	private final Object monitor = new Object();
	private JobEvent pending;
	private long lastSequence = -1;
	private boolean ended;
	private JobSubscription subscription;

	/**
	 * Binds the stream to its hub registration so that {@link #close()} can unregister it.
	 */
	public void attach(@Nonnull JobSubscription subscription) {
		synchronized (this.monitor) {
			this.subscription = subscription;
		}
	}

	@Override
	public void onEvent(@Nonnull JobEvent event) {
		synchronized (this.monitor) {
			if (this.ended || event.sequence() <= this.lastSequence) {
				return;
			}
			this.pending = event;
			this.lastSequence = event.sequence();
			this.monitor.notifyAll();
		}
	}

	@Override
	public void onEndOfStream(@Nonnull String jobId) {
		synchronized (this.monitor) {
			this.ended = true;
			this.monitor.notifyAll();
		}
	}

	/**
	 * Waits for the next state.
	 *
	 * @param timeout maximum time to wait
	 * @return the newest undelivered state, or empty on timeout or when the stream has finished
	 * @throws InterruptedException if interrupted while waiting
	 */
	@Nonnull
	public Optional<JobEvent> poll(@Nonnull Duration timeout) throws InterruptedException {
		final long deadline = System.nanoTime() + timeout.toNanos();
		synchronized (this.monitor) {
			while (this.pending == null && !this.ended) {
				final long remaining = deadline - System.nanoTime();
				if (remaining <= 0) {
					return Optional.empty();
				}
				final long millis = Math.max(1, remaining / 1_000_000);
				this.monitor.wait(millis);
			}
			final JobEvent event = this.pending;
			this.pending = null;
			return Optional.ofNullable(event);
		}
	}

	/**
	 * Returns true once the end-of-stream marker arrived and the last state has been taken.
	 */
	public boolean isFinished() {
		synchronized (this.monitor) {
			return this.ended && this.pending == null;
		}
	}

	@Override
	public void close() {
		final JobSubscription current;
		synchronized (this.monitor) {
			current = this.subscription;
			this.subscription = null;
			this.ended = true;
			this.monitor.notifyAll();
		}
		if (current != null) {
			current.close();
		}
	}
}
