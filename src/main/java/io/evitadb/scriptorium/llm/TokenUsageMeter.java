package io.evitadb.scriptorium.llm;

import javax.annotation.Nonnull;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe token counters shared by all workers of one job.
 */
public final class TokenUsageMeter {

	private final AtomicLong promptTokens = new AtomicLong(0);
	private final AtomicLong completionTokens = new AtomicLong(0);
	private final AtomicLong calls = new AtomicLong(0);

	/**
	 * Records one generation call.
	 */
	public void record(long promptTokens, long completionTokens) {
		this.promptTokens.addAndGet(promptTokens);
		this.completionTokens.addAndGet(completionTokens);
		this.calls.incrementAndGet();
	}

	/**
	 * Records a call that failed before any usage was reported.
	 */
	public void recordFailedCall() {
		this.calls.incrementAndGet();
	}

	/**
	 * Returns the current counters.
	 */
	@Nonnull
	public Usage snapshot() {
		return new Usage(this.promptTokens.get(), this.completionTokens.get(), this.calls.get());
	}

	/**
	 * Point-in-time copy of the counters.
	 *
	 * @param promptTokens     prompt tokens
	 * @param completionTokens completion tokens
	 * @param calls            number of generation calls
	 */
	public record Usage(long promptTokens, long completionTokens, long calls) {

		public static final Usage NONE = new Usage(0, 0, 0);

		/**
		 * Returns the difference between this and an earlier snapshot.
		 */
		@Nonnull
		public Usage minus(@Nonnull Usage earlier) {
			return new Usage(
				this.promptTokens - earlier.promptTokens,
				this.completionTokens - earlier.completionTokens,
				this.calls - earlier.calls
			);
		}
	}
}
