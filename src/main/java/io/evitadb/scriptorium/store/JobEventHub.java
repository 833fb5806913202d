package io.evitadb.scriptorium.store;

import io.evitadb.scriptorium.model.Job;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publish/subscribe hub for job state events.
 *
 * Events are delivered synchronously on the publishing thread, which for a running job is the
 * engine's, so listeners of one job see states in order. A terminal state is always delivered
 * before the end-of-stream marker, after which the job's channel is dropped. A failing listener is
 * logged and skipped; it never disturbs the job or other listeners.
 *
 * The hub only tracks jobs that have listeners or are still publishing: a channel is removed once
 * its stream ends, and a channel nobody publishes to is removed with its last listener.
 */
public final class JobEventHub {

	private final Map<String, Channel> channels = new ConcurrentHashMap<>();
	private final Clock clock;
	private final Log log;

	public JobEventHub(@Nonnull Clock clock, @Nonnull Log log) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Registers a listener for one job.
	 *
	 * @param jobId    job to observe
	 * @param listener receiver of the events
	 * @return subscription that unregisters the listener when closed
	 */
	@Nonnull
	public JobSubscription subscribe(@Nonnull String jobId, @Nonnull JobEventListener listener) {
		Objects.requireNonNull(jobId, "jobId must not be null");
		Objects.requireNonNull(listener, "listener must not be null");
		while (true) {
			final Channel channel = this.channels.computeIfAbsent(jobId, key -> new Channel());
			synchronized (channel) {
				// a channel closed between lookup and lock is already out of the map
				if (!channel.closed) {
					channel.listeners.add(listener);
					return () -> unsubscribe(jobId, channel, listener);
				}
			}
		}
	}

	/**
	 * Publishes a new state of a job. A terminal state also ends the job's streams.
	 *
	 * @param job the new snapshot
	 */
	public void publish(@Nonnull Job job) {
		Objects.requireNonNull(job, "job must not be null");
		while (true) {
			final Channel channel = this.channels.computeIfAbsent(job.jobId(), key -> new Channel());
			synchronized (channel) {
				if (channel.closed) {
					continue;
				}
				final JobEvent event = new JobEvent(
					job.jobId(), ++channel.sequence, JobEvent.Type.STATE, job, this.clock.instant()
				);
				channel.latest = event;
				for (JobEventListener listener : List.copyOf(channel.listeners)) {
					deliver(listener, event);
				}
				if (job.isTerminal()) {
					close(job.jobId(), channel);
				}
				return;
			}
		}
	}

	/**
	 * Gives a registered listener the current state of a job. When the hub has already published a
	 * state of the job, that state is sent with its own sequence number and the given snapshot is
	 * ignored, so a replay never takes a listener back to an older state. Otherwise the snapshot is
	 * sent with sequence number zero and, when it is terminal, followed by end-of-stream.
	 *
	 * A listener that is no longer registered, because its stream has ended or it was unsubscribed,
	 * receives nothing.
	 *
	 * @param job      the state read from the store
	 * @param listener a listener registered by {@link #subscribe(String, JobEventListener)}
	 */
	public void replay(@Nonnull Job job, @Nonnull JobEventListener listener) {
		Objects.requireNonNull(job, "job must not be null");
		Objects.requireNonNull(listener, "listener must not be null");
		final Channel channel = this.channels.get(job.jobId());
		if (channel == null) {
			return;
		}
		synchronized (channel) {
			if (channel.closed || !channel.listeners.contains(listener)) {
				return;
			}
			if (channel.latest != null) {
				deliver(listener, channel.latest);
				return;
			}
			deliver(listener, new JobEvent(job.jobId(), 0, JobEvent.Type.STATE, job, this.clock.instant()));
			if (job.isTerminal()) {
				channel.listeners.remove(listener);
				endOfStream(job.jobId(), listener);
				removeIfIdle(job.jobId(), channel);
			}
		}
	}

	/**
	 * Ends all streams of a job and drops its channel.
	 *
	 * @param jobId the job id
	 */
	public void endOfStream(@Nonnull String jobId) {
		final Channel channel = this.channels.get(jobId);
		if (channel == null) {
			return;
		}
		synchronized (channel) {
			if (!channel.closed) {
				close(jobId, channel);
			}
		}
	}

	/**
	 * Ends the streams of a deleted job.
	 */
	public void forget(@Nonnull String jobId) {
		endOfStream(jobId);
	}

	/**
	 * Returns the number of listeners registered for a job.
	 */
	public int listenerCount(@Nonnull String jobId) {
		final Channel channel = this.channels.get(jobId);
		if (channel == null) {
			return 0;
		}
		synchronized (channel) {
			return channel.listeners.size();
		}
	}

	/**
	 * Returns the number of jobs the hub keeps state for.
	 */
	int trackedJobCount() {
		return this.channels.size();
	}

	private void unsubscribe(@Nonnull String jobId, @Nonnull Channel channel, @Nonnull JobEventListener listener) {
		synchronized (channel) {
			if (channel.listeners.remove(listener)) {
				removeIfIdle(jobId, channel);
			}
		}
	}

	// caller holds the channel lock
	private void close(@Nonnull String jobId, @Nonnull Channel channel) {
		channel.closed = true;
		this.channels.remove(jobId, channel);
		final List<JobEventListener> ended = new ArrayList<>(channel.listeners);
		channel.listeners.clear();
		for (JobEventListener listener : ended) {
			endOfStream(jobId, listener);
		}
	}

	// caller holds the channel lock
	private void removeIfIdle(@Nonnull String jobId, @Nonnull Channel channel) {
		if (channel.listeners.isEmpty() && channel.latest == null) {
			channel.closed = true;
			this.channels.remove(jobId, channel);
		}
	}

	private void endOfStream(@Nonnull String jobId, @Nonnull JobEventListener listener) {
		try {
			listener.onEndOfStream(jobId);
		} catch (RuntimeException e) {
			this.log.warn("[" + jobId + "] Event listener failed on end of stream: " + e.getMessage(), e);
		}
	}

	private void deliver(@Nonnull JobEventListener listener, @Nonnull JobEvent event) {
		try {
			listener.onEvent(event);
		} catch (RuntimeException e) {
			this.log.warn("[" + event.jobId() + "] Event listener failed: " + e.getMessage(), e);
		}
	}

	/**
	 * Listeners, sequence counter and last published event of one job. Guarded by its own monitor.
	 */
	private static final class Channel {
		private final List<JobEventListener> listeners = new ArrayList<>();
		private long sequence;
		@Nullable private JobEvent latest;
		private boolean closed;
	}
}
