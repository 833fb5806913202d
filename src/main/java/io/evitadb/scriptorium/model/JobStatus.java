package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;

/**
 * Lifecycle status of a translation job.
 */
public enum JobStatus {

	PENDING,
	RUNNING,
	COMPLETED,
	FAILED;

	/**
	 * Returns true for statuses after which the engine never touches the job again.
	 */
	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}

	@JsonValue
	@Nonnull
	public String value() {
		return name().toLowerCase();
	}
}
