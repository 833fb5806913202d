package io.evitadb.scriptorium.store;

import io.evitadb.scriptorium.model.GlossarySource;
import io.evitadb.scriptorium.model.Job;
import io.evitadb.scriptorium.model.JobConfig;
import io.evitadb.scriptorium.model.PipelineStep;
import io.evitadb.scriptorium.model.TranslationMode;
import io.evitadb.scriptorium.support.TestLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobEventHub should deliver ordered job states to subscribers")
public class JobEventHubTest {

	private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

	private TestLog log;
	private JobEventHub hub;

	@BeforeEach
	void setUp() {
		log = new TestLog();
		hub = new JobEventHub(Clock.fixed(NOW, ZoneOffset.UTC), log);
	}

	@Test
	@DisplayName("numbers events per job and ends the stream after a terminal state")
	void shouldSequenceAndEndStream() {
		final RecordingListener listener = new RecordingListener();
		final RecordingListener other = new RecordingListener();
		hub.subscribe("job-1", listener);
		hub.subscribe("job-2", other);

		final Job job = job("job-1");
		hub.publish(job.atStep(PipelineStep.CHUNKING, 0, NOW));
		hub.publish(job.atStep(PipelineStep.TRANSLATING, 10, NOW));
		hub.publish(job.atStep(PipelineStep.COMPLETED, 100, NOW));

		assertEquals(List.of(1L, 2L, 3L), listener.events.stream().map(JobEvent::sequence).toList());
		assertTrue(listener.events.get(2).isTerminal());
		assertEquals(List.of("job-1"), listener.ended);
		assertEquals(0, hub.listenerCount("job-1"));
		assertTrue(other.events.isEmpty());
		assertEquals(1, hub.listenerCount("job-2"));
	}

	@Test
	@DisplayName("isolates a failing listener from the others")
	void shouldIsolateFailingListener() {
		final RecordingListener healthy = new RecordingListener();
		hub.subscribe("job-1", event -> {
			throw new IllegalStateException("listener exploded");
		});
		hub.subscribe("job-1", healthy);

		hub.publish(job("job-1").atStep(PipelineStep.CHUNKING, 0, NOW));

		assertEquals(1, healthy.events.size());
		assertTrue(log.hasWarning("[job-1] Event listener failed: listener exploded"));
	}

	@Test
	@DisplayName("stops delivery once the subscription is closed")
	void shouldUnsubscribe() {
		final RecordingListener listener = new RecordingListener();
		final JobSubscription subscription = hub.subscribe("job-1", listener);

		subscription.close();
		subscription.close();
		hub.publish(job("job-1").atStep(PipelineStep.CHUNKING, 0, NOW));

		assertTrue(listener.events.isEmpty());
	}

	@Test
	@DisplayName("replays the current state without advancing the sequence")
	void shouldReplayCurrentState() {
		final Job job = job("job-1");
		hub.publish(job.atStep(PipelineStep.CHUNKING, 0, NOW));
		final RecordingListener late = new RecordingListener();
		hub.subscribe("job-1", late);

		hub.replay(job.atStep(PipelineStep.CHUNKING, 0, NOW), late);
		hub.publish(job.atStep(PipelineStep.TRANSLATING, 10, NOW));

		assertEquals(List.of(1L, 2L), late.events.stream().map(JobEvent::sequence).toList());
		assertEquals(NOW, late.events.get(0).emittedAt());
	}

	@Test
	@DisplayName("never replays a snapshot older than the last published state")
	void shouldNotReplayStaleSnapshot() throws InterruptedException {
		final Job job = job("job-1");
		final Job stale = job.atStep(PipelineStep.CHUNKING, 0, NOW);
		hub.publish(stale);
		final JobEventStream stream = new JobEventStream();
		stream.attach(hub.subscribe("job-1", stream));

		hub.publish(job.atStep(PipelineStep.TRANSLATING, 10, NOW));
		hub.replay(stale, stream);

		final JobEvent event = stream.poll(Duration.ofSeconds(1)).orElseThrow();
		assertEquals(PipelineStep.TRANSLATING, event.job().currentStep());
		assertEquals(2L, event.sequence());
		assertTrue(stream.poll(Duration.ofMillis(10)).isEmpty());
	}

	@Test
	@DisplayName("sends the last published state instead of an older stored snapshot")
	void shouldReplayPublishedStateOverStoredSnapshot() {
		final Job job = job("job-1");
		hub.publish(job.atStep(PipelineStep.TRANSLATING, 10, NOW));
		final RecordingListener late = new RecordingListener();
		hub.subscribe("job-1", late);

		hub.replay(job.atStep(PipelineStep.CHUNKING, 0, NOW), late);

		assertEquals(1, late.events.size());
		assertEquals(PipelineStep.TRANSLATING, late.events.get(0).job().currentStep());
		assertEquals(1L, late.events.get(0).sequence());
	}

	@Test
	@DisplayName("delivers nothing to a listener whose stream already ended")
	void shouldNotReplayAfterEndOfStream() {
		final Job job = job("job-1");
		final RecordingListener listener = new RecordingListener();
		hub.subscribe("job-1", listener);
		hub.publish(job.atStep(PipelineStep.COMPLETED, 100, NOW));

		hub.replay(job.atStep(PipelineStep.TRANSLATING, 10, NOW), listener);

		assertEquals(1, listener.events.size());
		assertTrue(listener.events.get(0).isTerminal());
		assertEquals(List.of("job-1"), listener.ended);
	}

	@Test
	@DisplayName("replays a finished job from its stored snapshot and ends the stream")
	void shouldReplayFinishedJobAndEnd() {
		final RecordingListener listener = new RecordingListener();
		hub.subscribe("job-1", listener);

		hub.replay(job("job-1").failed("boom", NOW), listener);

		assertEquals(1, listener.events.size());
		assertEquals(0L, listener.events.get(0).sequence());
		assertTrue(listener.events.get(0).isTerminal());
		assertEquals(List.of("job-1"), listener.ended);
		assertEquals(0, hub.listenerCount("job-1"));
		assertEquals(0, hub.trackedJobCount());
	}

	@Test
	@DisplayName("keeps no state for finished, deleted or unobserved jobs")
	void shouldDropStateOfFinishedJobs() {
		final Job job = job("job-1");
		hub.subscribe("job-1", new RecordingListener());
		hub.publish(job.atStep(PipelineStep.TRANSLATING, 10, NOW));
		assertEquals(1, hub.trackedJobCount());
		hub.publish(job.atStep(PipelineStep.COMPLETED, 100, NOW));
		assertEquals(0, hub.trackedJobCount());

		hub.publish(job("job-2").atStep(PipelineStep.CHUNKING, 0, NOW));
		hub.forget("job-2");
		assertEquals(0, hub.trackedJobCount());

		hub.subscribe("job-3", new RecordingListener()).close();
		assertEquals(0, hub.trackedJobCount());

		final RecordingListener restarted = new RecordingListener();
		hub.subscribe("job-1", restarted);
		hub.publish(job.atStep(PipelineStep.TRANSLATING, 10, NOW));
		assertEquals(1L, restarted.events.get(0).sequence());
	}

	@Test
	@DisplayName("hands the latest state to a stream before finishing it")
	void shouldFeedEventStream() throws InterruptedException {
		final JobEventStream stream = new JobEventStream();
		stream.attach(hub.subscribe("job-1", stream));
		final Job job = job("job-1");

		hub.publish(job.atStep(PipelineStep.CHUNKING, 0, NOW));
		hub.publish(job.atStep(PipelineStep.TRANSLATING, 10, NOW));
		assertEquals(PipelineStep.TRANSLATING, stream.poll(Duration.ofSeconds(1)).orElseThrow().job().currentStep());

		hub.publish(job.failed("boom", NOW));
		assertFalse(stream.isFinished());
		final JobEvent last = stream.poll(Duration.ofSeconds(1)).orElseThrow();
		assertTrue(last.isTerminal());
		assertTrue(stream.isFinished());
		assertTrue(stream.poll(Duration.ofMillis(10)).isEmpty());
	}

	@Test
	@DisplayName("times out when no state arrives and unregisters on close")
	void shouldTimeOutAndClose() throws InterruptedException {
		final JobEventStream stream = new JobEventStream();
		stream.attach(hub.subscribe("job-1", stream));

		assertTrue(stream.poll(Duration.ofMillis(20)).isEmpty());
		assertFalse(stream.isFinished());

		stream.close();
		assertEquals(0, hub.listenerCount("job-1"));
		assertTrue(stream.isFinished());
	}

	@Test
	@DisplayName("forgetting a job ends its streams")
	void shouldForgetJob() {
		final RecordingListener listener = new RecordingListener();
		hub.subscribe("job-1", listener);
		hub.publish(job("job-1").atStep(PipelineStep.CHUNKING, 0, NOW));

		hub.forget("job-1");
		hub.publish(job("job-1").atStep(PipelineStep.CHUNKING, 0, NOW));

		assertEquals(List.of("job-1"), listener.ended);
		assertEquals(1, listener.events.size());
	}

	private static Job job(String jobId) {
		return Job.create(jobId, null, "Hello.", JobConfig.of("English", "German", TranslationMode.QUICK), null, GlossarySource.NONE, NOW);
	}

	private static class RecordingListener implements JobEventListener {
		private final List<JobEvent> events = new ArrayList<>();
		private final List<String> ended = new ArrayList<>();

		@Override
		public void onEvent(@Nonnull JobEvent event) {
			events.add(event);
		}

		@Override
		public void onEndOfStream(@Nonnull String jobId) {
			ended.add(jobId);
		}
	}
}
