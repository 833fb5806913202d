package io.evitadb.scriptorium.model;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * One line of a job's own history, kept in the job snapshot so that clients can see what happened to
 * the job without access to the process log.
 *
 * @param timestamp when the entry was written
 * @param level     severity
 * @param step      pipeline step the job was in, if known
 * @param message   human-readable text
 */
public record JobLogEntry(
	@Nonnull Instant timestamp,
	@Nonnull Level level,
	@Nullable PipelineStep step,
	@Nonnull String message
) {

	public JobLogEntry {
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		Objects.requireNonNull(level, "level must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	public enum Level {
		DEBUG,
		INFO,
		WARN,
		ERROR;

		@JsonValue
		@Nonnull
		public String value() {
			return name().toLowerCase();
		}
	}
}
