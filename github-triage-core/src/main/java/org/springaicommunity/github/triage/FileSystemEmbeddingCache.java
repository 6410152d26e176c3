package org.springaicommunity.github.triage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * {@link EmbeddingCache} storing one JSON file per key.
 *
 * <p>
 * Files live at {@code <cacheDir>/<first two hash characters>/<model>_<hash>.json}. A
 * corrupt entry is logged and treated as a miss, so it is recomputed and overwritten.
 */
public class FileSystemEmbeddingCache implements EmbeddingCache {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemEmbeddingCache.class);

	private static final TypeReference<List<Double>> VECTOR_TYPE = new TypeReference<>() {
	};

	private final Path cacheDir;

	private final ObjectMapper objectMapper;

	public FileSystemEmbeddingCache(Path cacheDir, ObjectMapper objectMapper) {
		this.cacheDir = cacheDir;
		this.objectMapper = objectMapper;
	}

	@Override
	public Optional<List<Double>> get(String key) {
		Path file = pathFor(key);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			List<Double> vector = objectMapper.readValue(file.toFile(), VECTOR_TYPE);
			return vector == null || vector.isEmpty() ? Optional.empty() : Optional.of(vector);
		}
		catch (IOException e) {
			logger.warn("Ignoring unreadable cache entry {}: {}", file, e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void put(String key, List<Double> vector) {
		Path file = pathFor(key);
		try {
			Files.createDirectories(file.getParent());
			Path temp = Files.createTempFile(file.getParent(), "embedding", ".tmp");
			objectMapper.writeValue(temp.toFile(), vector);
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write embedding cache entry " + file, e);
		}
	}

	Path pathFor(String key) {
		int separator = key.lastIndexOf(':');
		String hash = separator >= 0 ? key.substring(separator + 1) : key;
		String shard = hash.length() >= 2 ? hash.substring(0, 2) : "00";
		String fileName = key.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
		return cacheDir.resolve(shard).resolve(fileName);
	}

}
