package se.alipsa.tablefilter.helper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Jackson helpers for the JSON documents this library consumes. */
public final class JsonSupport {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<Map<String, Object>>> RECORD_LIST = new TypeReference<>() {
  };

  private JsonSupport() {
  }

  /**
   * The shared, thread safe mapper.
   *
   * @return the object mapper
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Parse JSON text into plain Java values: arrays become {@link List}s,
   * objects become {@link Map}s, numbers become {@link Number}s.
   *
   * @param json
   *          the JSON text
   * @return the parsed value, {@code null} for the JSON literal {@code null}
   * @throws JsonProcessingException
   *           if the text is not valid JSON
   */
  public static Object parse(String json) throws JsonProcessingException {
    return MAPPER.readValue(json, Object.class);
  }

  /**
   * Read a JSON array of objects.
   *
   * @param in
   *          the stream to read
   * @return the records in document order
   * @throws IOException
   *           if the stream cannot be read or is not an array of objects
   */
  public static List<Map<String, Object>> readRecords(InputStream in) throws IOException {
    return MAPPER.readValue(in, RECORD_LIST);
  }

  /**
   * Read a JSON document into a tree.
   *
   * @param file
   *          the file to read
   * @return the root node
   * @throws IOException
   *           if the file cannot be read or parsed
   */
  public static JsonNode readTree(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return MAPPER.readTree(in);
    }
  }
}
