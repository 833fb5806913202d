package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;

/**
 * States of the pipeline state machine. Each working state carries its share of the overall
 * progress; terminal and waiting states weigh nothing.
 */
public enum PipelineStep {

	PENDING(0),
	CHUNKING(5),
	TERMINOLOGY_UNIFICATION(5),
	TRANSLATING(45),
	CRITIQUING(10),
	REVISING(25),
	ASSEMBLING(10),
	COMPLETED(0),
	FAILED(0);

	private final int weight;

	PipelineStep(int weight) {
		this.weight = weight;
	}

	/**
	 * Relative progress weight of this step.
	 */
	public int weight() {
		return this.weight;
	}

	/**
	 * Returns true if the step is only part of the deep mode path.
	 */
	public boolean isDeepOnly() {
		return this == TERMINOLOGY_UNIFICATION || this == CRITIQUING || this == REVISING;
	}

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}

	@JsonValue
	@Nonnull
	public String value() {
		return name().toLowerCase();
	}
}
