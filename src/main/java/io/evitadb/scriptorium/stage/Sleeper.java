package io.evitadb.scriptorium.stage;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Waits between retry attempts. Tests replace it to avoid real delays.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	void sleep(@Nonnull Duration duration) throws InterruptedException;
}
