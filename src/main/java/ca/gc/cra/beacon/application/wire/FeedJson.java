package ca.gc.cra.beacon.application.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Shared Jackson configuration for feed frames and persisted state documents.
 *
 * @since BEACON 0.1
 */
public final class FeedJson {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

  private FeedJson() {}

  /**
   * Returns the shared, fully configured mapper. Thread-safe for reads and writes.
   *
   * @return object mapper
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Creates an empty object node.
   *
   * @return new object node
   */
  public static ObjectNode object() {
    return MAPPER.createObjectNode();
  }

  /**
   * Parses a JSON document into a tree.
   *
   * @param json document text
   * @return parsed tree
   * @throws IllegalArgumentException if the text is not valid JSON
   */
  public static JsonNode parse(String json) {
    Objects.requireNonNull(json, "json");
    try {
      JsonNode node = MAPPER.readTree(json);
      if (node == null || node.isMissingNode()) {
        throw new IllegalArgumentException("JSON document is empty");
      }
      return node;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON payload: " + ex.getOriginalMessage(), ex);
    }
  }

  /**
   * Serializes a tree to compact JSON text.
   *
   * @param node tree to write
   * @return JSON text
   */
  public static String write(JsonNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize JSON tree", ex);
    }
  }
}
