package org.springaicommunity.github.triage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * File system implementation of {@link CollectionStore}.
 *
 * <p>
 * Each collection lives in {@code <dataDir>/<owner>/<repo>[--<prefix>]/} as a single
 * {@code collection.json}, written to a temporary file and moved into place atomically.
 * Locking combines a per-collection {@link ReentrantLock} (threads of this process) with
 * an OS file lock on {@code collection.lock} (other processes).
 */
public class FileSystemCollectionStore implements CollectionStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCollectionStore.class);

	static final String COLLECTION_FILE = "collection.json";

	static final String LOCK_FILE = "collection.lock";

	private final Path dataDir;

	private final ObjectMapper objectMapper;

	private final Map<CollectionKey, ReentrantLock> locks = new ConcurrentHashMap<>();

	private final Map<CollectionKey, FileHold> fileHolds = new ConcurrentHashMap<>();

	public FileSystemCollectionStore(Path dataDir, ObjectMapper objectMapper) {
		this.dataDir = dataDir;
		this.objectMapper = objectMapper;
	}

	public Path directoryOf(CollectionKey key) {
		return dataDir.resolve(key.owner()).resolve(key.directoryName());
	}

	Path fileOf(CollectionKey key) {
		return directoryOf(key).resolve(COLLECTION_FILE);
	}

	@Override
	public IssueCollection load(CollectionKey key) {
		Path file = fileOf(key);
		if (!Files.exists(file)) {
			logger.debug("No stored collection for {} at {}", key, file);
			return IssueCollection.empty(key);
		}
		try {
			IssueCollection collection = objectMapper.readValue(file.toFile(), IssueCollection.class);
			if (!collection.key().equals(key)) {
				throw new CollectionStoreException(
						"Collection file " + file + " belongs to " + collection.key() + ", expected " + key);
			}
			logger.debug("Loaded {} records of {} from {}", collection.size(), key, file);
			return collection;
		}
		catch (IOException e) {
			throw new CollectionStoreException("Failed to read collection " + key + " from " + file, e);
		}
	}

	@Override
	public boolean exists(CollectionKey key) {
		return Files.exists(fileOf(key));
	}

	@Override
	public void save(IssueCollection collection) {
		Path file = fileOf(collection.key());
		try {
			Files.createDirectories(file.getParent());
			Path temp = Files.createTempFile(file.getParent(), "collection", ".tmp");
			try {
				objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), collection);
				move(temp, file);
			}
			finally {
				Files.deleteIfExists(temp);
			}
			logger.debug("Saved {} records of {} to {}", collection.size(), collection.key(), file);
		}
		catch (IOException e) {
			throw new CollectionStoreException("Failed to save collection " + collection.key() + " to " + file, e);
		}
	}

	private static void move(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	@Override
	public void upsert(CollectionKey key, IssueRecord record) {
		try (CollectionLock lock = lock(key)) {
			save(load(key).withRecord(record));
		}
	}

	@Override
	public int purge(CollectionKey key, Set<Integer> numbers) {
		try (CollectionLock lock = lock(key)) {
			IssueCollection collection = load(key);
			IssueCollection purged = collection.without(numbers);
			int removed = collection.size() - purged.size();
			if (removed > 0) {
				save(purged);
				logger.info("Purged {} records from {}", removed, key);
			}
			return removed;
		}
	}

	@Override
	public boolean delete(CollectionKey key) {
		Path directory = directoryOf(key);
		if (!Files.exists(directory)) {
			return false;
		}
		try (CollectionLock lock = lock(key); Stream<Path> paths = Files.walk(directory)) {
			paths.sorted(Comparator.reverseOrder())
				.filter(path -> !path.getFileName().toString().equals(LOCK_FILE))
				.forEach(FileSystemCollectionStore::deleteQuietly);
		}
		catch (IOException e) {
			throw new CollectionStoreException("Failed to delete collection " + key, e);
		}
		// The lock file goes last, once the lock is released
		deleteQuietly(directory.resolve(LOCK_FILE));
		deleteQuietly(directory);
		logger.info("Deleted collection {} at {}", key, directory);
		return true;
	}

	private static void deleteQuietly(Path path) {
		try {
			Files.deleteIfExists(path);
		}
		catch (IOException e) {
			logger.warn("Failed to delete {}: {}", path, e.getMessage());
		}
	}

	@Override
	public CollectionLock lock(CollectionKey key) {
		ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
		lock.lock();
		if (lock.getHoldCount() == 1) {
			try {
				fileHolds.put(key, acquireFileLock(key));
			}
			catch (RuntimeException e) {
				lock.unlock();
				throw e;
			}
		}
		return () -> release(key, lock);
	}

	private FileHold acquireFileLock(CollectionKey key) {
		Path lockFile = directoryOf(key).resolve(LOCK_FILE);
		try {
			Files.createDirectories(lockFile.getParent());
			FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
			try {
				logger.debug("Waiting for lock on {}", lockFile);
				return new FileHold(channel, channel.lock());
			}
			catch (IOException | RuntimeException e) {
				channel.close();
				throw e;
			}
		}
		catch (IOException e) {
			throw new CollectionStoreException("Failed to lock collection " + key, e);
		}
	}

	private void release(CollectionKey key, ReentrantLock lock) {
		if (!lock.isHeldByCurrentThread()) {
			return;
		}
		try {
			if (lock.getHoldCount() == 1) {
				FileHold hold = fileHolds.remove(key);
				if (hold != null) {
					hold.close();
				}
			}
		}
		finally {
			lock.unlock();
		}
	}

	private record FileHold(FileChannel channel, FileLock fileLock) {

		void close() {
			try {
				fileLock.release();
				channel.close();
			}
			catch (IOException e) {
				logger.warn("Failed to release collection lock: {}", e.getMessage());
			}
		}

	}

}
