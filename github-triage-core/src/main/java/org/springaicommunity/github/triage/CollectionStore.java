package org.springaicommunity.github.triage;

import java.util.Set;

/**
 * Durable storage of {@link IssueCollection}s.
 *
 * <p>
 * {@link #save(IssueCollection)} replaces a collection atomically: readers see either
 * the old or the new version, never a partial one. Read-modify-write sequences must run
 * under {@link #lock(CollectionKey)}; the lock is reentrant for the owning thread, and
 * {@link #upsert} and {@link #purge} take it themselves.
 */
public interface CollectionStore {

	/**
	 * Load a collection.
	 * @param key the collection key
	 * @return the stored collection, or an empty one if none exists
	 * @throws CollectionStoreException if the stored data cannot be read
	 */
	IssueCollection load(CollectionKey key);

	boolean exists(CollectionKey key);

	/**
	 * Atomically replace the stored collection, records and checkpoints together.
	 */
	void save(IssueCollection collection);

	/**
	 * Replace or add a single record, leaving every other record untouched.
	 */
	void upsert(CollectionKey key, IssueRecord record);

	/**
	 * Remove records by number.
	 * @return the number of records removed
	 */
	int purge(CollectionKey key, Set<Integer> numbers);

	/**
	 * Delete a collection entirely.
	 * @return true if something was deleted
	 */
	boolean delete(CollectionKey key);

	/**
	 * Acquire exclusive access to a collection, blocking until it is available.
	 */
	CollectionLock lock(CollectionKey key);

}
