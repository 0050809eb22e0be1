package uploadqueue.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson-backed JSON codec for payload objects.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}. Object entries keep their order;
 * nested objects decode to {@link LinkedHashMap}, arrays to lists, and numbers to the
 * narrowest of {@code Integer}, {@code Long} or {@code BigInteger}, or to {@code Double}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper mapper;

  DefaultJsonCodec() {
    this.mapper = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  @Override
  public String toJson(Map<String, Object> fields) {
    if (fields == null || fields.isEmpty()) {
      return null;
    }
    try {
      return mapper.writeValueAsString(fields);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode payload as JSON: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    if (trimmed.charAt(0) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    try {
      return mapper.readValue(trimmed, OBJECT_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON object: " + e.getOriginalMessage(), e);
    }
  }
}
