package io.github.archlog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

/**
 * Factory for consistently configured Jackson mappers.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create the JSON mapper used for API responses, configuration and changelog files.
	 * Output is indented and unknown properties are ignored.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.enable(SerializationFeature.INDENT_OUTPUT);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

	/**
	 * Create the mapper for {@code .nvchecker.toml} files.
	 * @return TOML mapper
	 */
	public static TomlMapper createToml() {
		return new TomlMapper();
	}

}
