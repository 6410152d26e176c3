package org.springaicommunity.github.triage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the {@link ObjectMapper} used for collections, caches and API payloads.
 *
 * <p>
 * Java camelCase record components are written as snake_case JSON keys
 * (e.g.&nbsp;{@code updatedAt} &rarr; {@code updated_at}), dates as ISO-8601 strings, and
 * map entries sorted by key, so equal content always serializes to equal bytes. Unknown
 * properties are ignored when reading, which lets older binaries read newer files.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
