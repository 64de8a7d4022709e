package io.syncevents.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Jackson-backed JSON access shared by the classifier and the sync reader.
 *
 * <p>Only generic trees are read; event payload schemas are never bound to
 * typed classes. Parsing is strict: a payload with trailing content is
 * rejected.
 *
 * @see #getDefault()
 */
public final class JsonCodec {

  private static final JsonCodec DEFAULT = new JsonCodec(new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));

  private final ObjectMapper mapper;

  public JsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Returns the default instance.
   *
   * @return the shared {@link JsonCodec}
   */
  public static JsonCodec getDefault() {
    return DEFAULT;
  }

  /**
   * Parses a JSON document into a tree.
   *
   * @param json the JSON text
   * @return the parsed tree (never {@code null})
   * @throws IllegalArgumentException if the input is not valid JSON
   */
  public JsonNode parse(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("empty JSON document");
    }
    try {
      JsonNode node = mapper.readTree(json);
      if (node == null || node.isMissingNode()) {
        throw new IllegalArgumentException("empty JSON document");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Serializes a tree back to compact JSON text.
   *
   * @param node the tree
   * @return the JSON text
   */
  public String write(JsonNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize JSON tree", e);
    }
  }

  /**
   * Returns a textual field of an object node, or {@code null} if the field is
   * absent or not a string.
   *
   * @param node  the object node
   * @param field the field name
   * @return the string value, or {@code null}
   */
  public static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.textValue() : null;
  }
}
