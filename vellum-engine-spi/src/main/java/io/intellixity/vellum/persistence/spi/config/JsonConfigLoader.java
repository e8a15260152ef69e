package io.intellixity.vellum.persistence.spi.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Loads JSON configuration on top of typed defaults.
 *
 * <p>The defaults are turned into a JSON tree, the supplied document is merged into it field by field
 * (nested objects recursively), and the result is bound back to the target type. Property names match
 * ignoring case; unknown properties are ignored; explicit nulls keep the default. Validation in the
 * target's constructor surfaces as {@link IllegalArgumentException}.</p>
 */
public final class JsonConfigLoader {
  private static final JsonConfigLoader DEFAULT = new JsonConfigLoader(defaultMapper());

  private final ObjectMapper mapper;

  public JsonConfigLoader(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static JsonConfigLoader defaults() { return DEFAULT; }

  public static ObjectMapper defaultMapper() {
    return JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  public ObjectMapper mapper() { return mapper; }

  /**
   * @param section optional root property holding the settings; when absent the root object is used
   */
  public <T> T load(String json, T defaults, Class<T> type, String section) {
    Objects.requireNonNull(defaults, "defaults");
    if (json == null || json.isBlank()) return defaults;
    try {
      return merge(mapper.readTree(json), defaults, type, section);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid " + type.getSimpleName() + " JSON: " + e.getOriginalMessage(), e);
    }
  }

  public <T> T load(InputStream in, T defaults, Class<T> type, String section) {
    Objects.requireNonNull(in, "in");
    try {
      return merge(mapper.readTree(in), defaults, type, section);
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid " + type.getSimpleName() + " JSON: " + e.getMessage(), e);
    }
  }

  /** A missing file yields {@code defaults}. */
  public <T> T load(Path file, T defaults, Class<T> type, String section) {
    if (file == null || !Files.isRegularFile(file)) return defaults;
    return loadRequired(file, defaults, type, section);
  }

  public <T> T loadRequired(Path file, T defaults, Class<T> type, String section) {
    Objects.requireNonNull(file, "file");
    if (!Files.isRegularFile(file)) throw new IllegalArgumentException("Configuration file not found: " + file);
    try (InputStream in = Files.newInputStream(file)) {
      return load(in, defaults, type, section);
    } catch (IOException e) {
      throw new IllegalArgumentException("Cannot read configuration file " + file, e);
    }
  }

  private <T> T merge(JsonNode supplied, T defaults, Class<T> type, String section) {
    if (supplied == null || supplied.isNull() || supplied.isMissingNode()) return defaults;
    if (!supplied.isObject()) throw new IllegalArgumentException(type.getSimpleName() + " JSON must be an object");
    JsonNode source = supplied;
    if (section != null) {
      JsonNode s = fieldIgnoreCase((ObjectNode) supplied, section);
      if (s != null && s.isObject()) source = s;
    }

    ObjectNode base = mapper.valueToTree(defaults);
    deepMerge(base, (ObjectNode) source);
    try {
      return mapper.treeToValue(base, type);
    } catch (JsonProcessingException e) {
      IllegalArgumentException validation = findValidationError(e);
      if (validation != null) throw validation;
      throw new IllegalArgumentException("Invalid " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
    }
  }

  static void deepMerge(ObjectNode target, ObjectNode source) {
    Iterator<Map.Entry<String, JsonNode>> it = source.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode value = e.getValue();
      if (value == null || value.isNull()) continue;
      String key = existingKey(target, e.getKey());
      JsonNode current = target.get(key);
      if (current instanceof ObjectNode co && value instanceof ObjectNode vo) {
        deepMerge(co, vo);
      } else {
        target.set(key, value);
      }
    }
  }

  private static String existingKey(ObjectNode node, String name) {
    Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      String n = names.next();
      if (n.equalsIgnoreCase(name)) return n;
    }
    return name;
  }

  private static JsonNode fieldIgnoreCase(ObjectNode node, String name) {
    return node.get(existingKey(node, name));
  }

  private static IllegalArgumentException findValidationError(Throwable t) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (c instanceof IllegalArgumentException iae) return iae;
    }
    return null;
  }
}
