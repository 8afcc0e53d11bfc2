package dev.pinharvest.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Shared Jackson mappers for database JSON columns and export files */
public class JsonUtils {
	private static final ObjectMapper mapper =
			new ObjectMapper().configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

	private static final ObjectMapper prettyMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
	private static final TypeReference<Map<String, String>> STRING_MAP_TYPE = new TypeReference<>() {};
	private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

	public static ObjectMapper mapper() {
		return mapper;
	}

	/** Serialize a value for a JSON column; null stays null */
	public static String toJson(Object value) {
		if (value == null) {
			return null;
		}
		try {
			return mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static <T> T fromJson(String json, Class<T> type) {
		if (json == null || json.isEmpty()) {
			return null;
		}
		try {
			return mapper.readValue(json, type);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static Map<String, Object> readMap(String json) {
		return read(json, MAP_TYPE);
	}

	public static Map<String, String> readStringMap(String json) {
		return read(json, STRING_MAP_TYPE);
	}

	public static List<String> readStringList(String json) {
		return read(json, STRING_LIST_TYPE);
	}

	public static JsonNode readTree(String json) throws IOException {
		return mapper.readTree(json);
	}

	/** Convert a parsed node into a plain map for the raw data extension of a pin */
	public static Map<String, Object> toMap(JsonNode node) {
		return mapper.convertValue(node, MAP_TYPE);
	}

	/** Write an indented JSON file followed by a newline */
	public static void writeFile(Path file, Object value) throws IOException {
		try (var writer = Files.newBufferedWriter(file)) {
			prettyMapper.writeValue(writer, value);
			writer.write("\n");
		}
	}

	private static <T> T read(String json, TypeReference<T> type) {
		if (json == null || json.isEmpty()) {
			return null;
		}
		try {
			return mapper.readValue(json, type);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}
}
