package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.llm.GenerationException;
import io.evitadb.scriptorium.llm.GenerationFatalException;
import io.evitadb.scriptorium.llm.GenerationRequest;
import io.evitadb.scriptorium.llm.GenerationResult;
import io.evitadb.scriptorium.llm.GenerationService;
import io.evitadb.scriptorium.llm.GenerationTransientException;
import io.evitadb.scriptorium.llm.MalformedResponseException;
import io.evitadb.scriptorium.llm.TokenUsageMeter;
import io.evitadb.scriptorium.support.TestLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("RetryingGenerator should retry transient failures only")
class RetryingGeneratorTest {

	private static final GenerationRequest REQUEST = new GenerationRequest("translate", "system", "user");

	private GenerationService service;
	private TokenUsageMeter meter;
	private JobCancellation cancellation;
	private List<Duration> sleeps;
	private TestLog log;

	@BeforeEach
	void setUp() {
		service = mock(GenerationService.class);
		meter = new TokenUsageMeter();
		cancellation = new JobCancellation("job-1");
		sleeps = new ArrayList<>();
		log = new TestLog();
	}

	@Test
	@DisplayName("returns the first successful answer and records its tokens")
	void shouldReturnFirstAnswer() throws Exception {
		when(service.generate(any())).thenReturn(new GenerationResult("Hallo", 12, 3));

		final String text = generator(RetryPolicy.defaults()).generate(REQUEST);

		assertEquals("Hallo", text);
		assertEquals(new TokenUsageMeter.Usage(12, 3, 1), meter.snapshot());
		assertTrue(sleeps.isEmpty());
	}

	@Test
	@DisplayName("retries transient failures with exponential backoff")
	void shouldRetryTransientFailures() throws Exception {
		when(service.generate(any()))
			.thenThrow(new GenerationTransientException("translate", "rate limited"))
			.thenThrow(new GenerationTransientException("translate", "timeout"))
			.thenReturn(new GenerationResult("Hallo", 10, 5));
		final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(10));

		final String text = generator(policy).generate(REQUEST);

		assertEquals("Hallo", text);
		assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
		assertEquals(new TokenUsageMeter.Usage(10, 5, 3), meter.snapshot());
		assertTrue(log.hasWarning("translate attempt 1/3 failed"));
	}

	@Test
	@DisplayName("gives up after the last attempt")
	void shouldGiveUpAfterMaxAttempts() throws Exception {
		when(service.generate(any())).thenThrow(new GenerationTransientException("translate", "overloaded"));
		final RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO);

		final GenerationException exception = assertThrows(
			GenerationException.class, () -> generator(policy).generate(REQUEST)
		);

		assertTrue(exception.getMessage().contains("Giving up after 3 attempt(s)"));
		assertTrue(exception.isRetryable());
		verify(service, times(3)).generate(any());
		assertEquals(3, meter.snapshot().calls());
	}

	@Test
	@DisplayName("does not retry fatal failures")
	void shouldNotRetryFatalFailures() throws Exception {
		when(service.generate(any())).thenThrow(new GenerationFatalException("translate", "invalid api key", null));

		final GenerationException exception = assertThrows(
			GenerationException.class, () -> generator(RetryPolicy.defaults()).generate(REQUEST)
		);

		assertFalse(exception.isRetryable());
		verify(service, times(1)).generate(any());
		assertTrue(sleeps.isEmpty());
	}

	@Test
	@DisplayName("retries answers rejected by the parser and keeps their tokens")
	void shouldRetryMalformedAnswers() throws Exception {
		when(service.generate(any()))
			.thenReturn(new GenerationResult("not json", 10, 5))
			.thenReturn(new GenerationResult("{\"ok\": true}", 10, 5));

		final Integer parsed = generator(new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO)).generate(REQUEST, text -> {
			if (!text.startsWith("{")) {
				throw new MalformedResponseException("translate", "Response contains no JSON", text);
			}
			return text.length();
		});

		assertEquals(12, parsed);
		assertEquals(new TokenUsageMeter.Usage(20, 10, 2), meter.snapshot());
	}

	@Test
	@DisplayName("treats unclassified runtime exceptions as transient")
	void shouldRetryUnclassifiedErrors() throws Exception {
		when(service.generate(any()))
			.thenThrow(new IllegalStateException("connection reset"))
			.thenReturn(new GenerationResult("Hallo", 1, 1));

		final String text = generator(new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO)).generate(REQUEST);

		assertEquals("Hallo", text);
		verify(service, times(2)).generate(any());
	}

	@Test
	@DisplayName("stops before calling the backend when the job is cancelled")
	void shouldStopWhenCancelled() throws Exception {
		cancellation.cancel();

		assertThrows(JobCancelledException.class, () -> generator(RetryPolicy.defaults()).generate(REQUEST));

		verify(service, never()).generate(any());
	}

	@Test
	@DisplayName("caps the backoff at the maximum")
	void shouldCapBackoff() {
		final RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(1), 3.0, Duration.ofSeconds(5));

		assertEquals(Duration.ofSeconds(1), policy.backoffAfter(1));
		assertEquals(Duration.ofSeconds(3), policy.backoffAfter(2));
		assertEquals(Duration.ofSeconds(5), policy.backoffAfter(3));
		assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO));
		assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, 0.5, Duration.ZERO));
	}

	private RetryingGenerator generator(RetryPolicy policy) {
		return new RetryingGenerator(service, policy, sleeps::add, meter, cancellation, log);
	}
}
