package io.evitadb.scriptorium.stage;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff for generation calls.
 *
 * @param maxAttempts    total attempts including the first one
 * @param initialBackoff wait before the second attempt
 * @param multiplier     growth factor of the wait between consecutive attempts
 * @param maxBackoff     upper bound of a single wait
 */
public record RetryPolicy(
	int maxAttempts,
	@Nonnull Duration initialBackoff,
	double multiplier,
	@Nonnull Duration maxBackoff
) {

	public static final int DEFAULT_MAX_ATTEMPTS = 3;
	public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
	public static final double DEFAULT_MULTIPLIER = 2.0;
	public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
		Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
		if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
			throw new IllegalArgumentException("backoff must not be negative");
		}
		if (multiplier < 1.0) {
			throw new IllegalArgumentException("multiplier must be at least 1.0");
		}
	}

	@Nonnull
	public static RetryPolicy defaults() {
		return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF, DEFAULT_MULTIPLIER, DEFAULT_MAX_BACKOFF);
	}

	/**
	 * Policy that tries exactly once.
	 */
	@Nonnull
	public static RetryPolicy noRetry() {
		return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
	}

	/**
	 * Returns the wait after the given failed attempt.
	 *
	 * @param failedAttempt 1-based number of the attempt that just failed
	 * @return backoff capped at {@link #maxBackoff()}
	 */
	@Nonnull
	public Duration backoffAfter(int failedAttempt) {
		final double factor = Math.pow(this.multiplier, Math.max(0, failedAttempt - 1));
		final double millis = this.initialBackoff.toMillis() * factor;
		if (millis >= this.maxBackoff.toMillis()) {
			return this.maxBackoff;
		}
		return Duration.ofMillis((long) millis);
	}
}
