package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for creating a consistently configured {@link ObjectMapper}.
 *
 * <p>
 * The returned mapper uses {@link PropertyNamingStrategies#SNAKE_CASE} so that record
 * components such as {@code startedAt} are written as {@code started_at}, and writes
 * {@code java.time} values as ISO-8601 strings. Unknown properties in provider API
 * responses are ignored.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
