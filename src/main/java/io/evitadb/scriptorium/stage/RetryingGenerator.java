package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.llm.GenerationException;
import io.evitadb.scriptorium.llm.GenerationRequest;
import io.evitadb.scriptorium.llm.GenerationResult;
import io.evitadb.scriptorium.llm.GenerationService;
import io.evitadb.scriptorium.llm.GenerationTransientException;
import io.evitadb.scriptorium.llm.MalformedResponseException;
import io.evitadb.scriptorium.llm.TokenUsageMeter;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Calls the generation service on behalf of one job with bounded retries.
 *
 * - transient failures (including unusable output rejected by the response parser and any unclassified
 *   runtime exception) are retried with exponential backoff until the attempts run out
 * - fatal failures are rethrown immediately
 * - cancellation of the job is checked before every attempt and after every backoff
 * - token usage of every successful call is added to the job's meter, even when the answer is then
 *   rejected by the parser
 */
public final class RetryingGenerator {

	private final GenerationService service;
	private final RetryPolicy policy;
	private final Sleeper sleeper;
	private final TokenUsageMeter meter;
	private final JobCancellation cancellation;
	private final Log log;

	public RetryingGenerator(
		@Nonnull GenerationService service,
		@Nonnull RetryPolicy policy,
		@Nonnull Sleeper sleeper,
		@Nonnull TokenUsageMeter meter,
		@Nonnull JobCancellation cancellation,
		@Nonnull Log log
	) {
		this.service = Objects.requireNonNull(service, "service must not be null");
		this.policy = Objects.requireNonNull(policy, "policy must not be null");
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
		this.meter = Objects.requireNonNull(meter, "meter must not be null");
		this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Generates text, retrying transient failures.
	 *
	 * @param request prompt to send
	 * @return generated text
	 * @throws GenerationException   when a fatal failure occurs or the attempts are exhausted
	 * @throws JobCancelledException when the job is cancelled
	 */
	@Nonnull
	public String generate(@Nonnull GenerationRequest request) throws GenerationException, JobCancelledException {
		return generate(request, text -> text);
	}

	/**
	 * Generates text and converts it with the parser. A parser rejection counts as a transient failure.
	 *
	 * @param request prompt to send
	 * @param parser  converts the generated text into the result
	 * @param <T>     result type
	 * @return parsed result
	 * @throws GenerationException   when a fatal failure occurs or the attempts are exhausted
	 * @throws JobCancelledException when the job is cancelled
	 */
	@Nonnull
	public <T> T generate(
		@Nonnull GenerationRequest request,
		@Nonnull ResponseParser<T> parser
	) throws GenerationException, JobCancelledException {
		Objects.requireNonNull(request, "request must not be null");
		Objects.requireNonNull(parser, "parser must not be null");

		GenerationException lastFailure = null;
		for (int attempt = 1; attempt <= this.policy.maxAttempts(); attempt++) {
			this.cancellation.throwIfCancelled();
			try {
				final GenerationResult result;
				try {
					result = this.service.generate(request);
				} catch (GenerationException | RuntimeException e) {
					this.meter.recordFailedCall();
					throw e;
				}
				this.meter.record(result.promptTokens(), result.completionTokens());
				return parser.parse(result.text());
			} catch (GenerationException e) {
				if (!e.isRetryable()) {
					throw e;
				}
				lastFailure = e;
			} catch (RuntimeException e) {
				lastFailure = new GenerationTransientException(
					request.stage(), "Unclassified error: " + e.getClass().getSimpleName() + ": " + e.getMessage(), e
				);
			}

			if (attempt < this.policy.maxAttempts()) {
				final Duration backoff = this.policy.backoffAfter(attempt);
				this.log.warn(
					"[" + this.cancellation.getJobId() + "] " + request.stage() + " attempt " + attempt + "/" +
						this.policy.maxAttempts() + " failed (" + lastFailure.getMessage() + "), retrying in " +
						backoff.toMillis() + " ms"
				);
				try {
					this.sleeper.sleep(backoff);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new JobCancelledException(this.cancellation.getJobId());
				}
			}
		}

		throw new GenerationTransientException(
			request.stage(),
			"Giving up after " + this.policy.maxAttempts() + " attempt(s): " + lastFailure.getMessage(),
			lastFailure
		);
	}

	/**
	 * Converts generated text into a result, rejecting unusable answers.
	 *
	 * @param <T> result type
	 */
	@FunctionalInterface
	public interface ResponseParser<T> {

		@Nonnull
		T parse(@Nonnull String text) throws MalformedResponseException;
	}
}
