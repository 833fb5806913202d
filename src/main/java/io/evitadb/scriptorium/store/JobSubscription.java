package io.evitadb.scriptorium.store;

/**
 * Handle of a registered listener. Closing it stops delivery; closing twice is harmless.
 */
@FunctionalInterface
public interface JobSubscription extends AutoCloseable {

	@Override
	void close();
}
