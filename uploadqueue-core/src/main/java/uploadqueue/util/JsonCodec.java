package uploadqueue.util;

import java.util.Map;

/**
 * Codec turning payload field maps into the JSON object text persisted in the store,
 * and back.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) delegates to Jackson. Values
 * may be {@code null}, strings, numbers, booleans, nested objects and arrays.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a field map as a JSON object string. Returns {@code null} for a null or empty map.
     *
     * @param fields the fields to encode
     * @return JSON string, or {@code null}
     * @throws IllegalArgumentException if a value cannot be written as JSON
     */
    String toJson(Map<String, Object> fields);

    /**
     * Parses a JSON object string into a field map. Returns an empty map for {@code null},
     * empty, or {@code "null"} input.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a well-formed JSON object
     */
    Map<String, Object> parseObject(String json);
}
