package io.evitadb.scriptorium.stage;

import io.evitadb.scriptorium.model.Critique;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Raised when the critique flags a critical error. It halts the job before assembly; it is an expected
 * outcome, not a malfunction.
 */
public final class CriticalQualityException extends Exception {

	@Nonnull
	private final Critique critique;

	public CriticalQualityException(@Nonnull Critique critique) {
		super(Objects.requireNonNull(critique, "critique must not be null").describeHalt());
		this.critique = critique;
	}

	@Nonnull
	public Critique getCritique() {
		return this.critique;
	}
}
