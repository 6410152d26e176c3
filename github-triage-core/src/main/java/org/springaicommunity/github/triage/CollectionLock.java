package org.springaicommunity.github.triage;

/**
 * Exclusive hold on one collection, released by {@link #close()}.
 *
 * <pre>{@code
 * try (CollectionLock lock = store.lock(key)) {
 *     IssueCollection collection = store.load(key);
 *     store.save(change(collection));
 * }
 * }</pre>
 */
public interface CollectionLock extends AutoCloseable {

	@Override
	void close();

}
