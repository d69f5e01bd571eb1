package org.springaicommunity.scvs;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson setup shared by everything that reads or writes repository snapshot files.
 *
 * <p>
 * Record components appear in the file with underscores ({@code stagedAt} is written as
 * {@code staged_at}), timestamps are ISO-8601 strings, and keys a snapshot carries but
 * this version does not know are skipped on read.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Build a fresh mapper for snapshot files. Callers may keep and share the instance.
	 * @return mapper configured for snapshot files
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

}
