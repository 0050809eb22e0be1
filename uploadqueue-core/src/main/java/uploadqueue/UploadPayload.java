package uploadqueue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed payload of a pending upload: one record per {@link UploadType}.
 *
 * <p>The variant determines the record's type, so handlers switch on the variant
 * instead of inspecting a loosely shaped object. Each variant wraps an opaque JSON
 * object ({@link #fields()}) and is rebuilt from it by {@link #decode(UploadType, Map)}.
 *
 * <p>Field values are JSON values: {@code null}, {@link String}, {@link Number},
 * {@link Boolean}, nested {@code Map<String, ?>} objects and {@link List} arrays.
 * Maps and lists are deep-copied into unmodifiable views; any other value type is
 * rejected with {@link IllegalArgumentException}.
 */
public sealed interface UploadPayload {

  /**
   * Returns the upload type this variant belongs to.
   *
   * @return the upload type
   */
  UploadType type();

  /**
   * Returns the JSON object persisted for this payload.
   *
   * @return an unmodifiable field map; values may be {@code null}
   */
  Map<String, Object> fields();

  /**
   * Rebuilds a payload from its persisted JSON object.
   *
   * @param type   the stored upload type
   * @param fields the stored field map
   * @return the typed payload
   * @throws IllegalArgumentException if required fields are missing or malformed
   */
  static UploadPayload decode(UploadType type, Map<String, Object> fields) {
    Objects.requireNonNull(type, "type");
    Map<String, Object> source = fields == null ? Map.of() : fields;
    return switch (type) {
      case BINARY_UPLOAD -> new Photo(source);
      case RECORD_INSERT -> new InspectionResult(source);
      case RESULT_PHOTO_INSERT -> new ResultPhoto(source);
      case SIGNATURE_UPLOAD -> new Signature(stringField(source, Signature.USER_ID));
      case LIFECYCLE_UPSERT -> Lifecycle.fromFields(source);
      case AUDIT_LOG_INSERT -> new AuditEntry(source);
    };
  }

  /** Metadata describing an inspection photo; bytes travel in the attachment. */
  record Photo(Map<String, Object> metadata) implements UploadPayload {
    public Photo {
      metadata = copyOf(metadata, "metadata");
    }

    @Override
    public UploadType type() {
      return UploadType.BINARY_UPLOAD;
    }

    @Override
    public Map<String, Object> fields() {
      return metadata;
    }
  }

  /** Inspection result row. */
  record InspectionResult(Map<String, Object> row) implements UploadPayload {
    public InspectionResult {
      row = copyOf(row, "row");
    }

    @Override
    public UploadType type() {
      return UploadType.RECORD_INSERT;
    }

    @Override
    public Map<String, Object> fields() {
      return row;
    }
  }

  /** Row linking a stored photo to an inspection result. */
  record ResultPhoto(Map<String, Object> row) implements UploadPayload {
    public ResultPhoto {
      row = copyOf(row, "row");
    }

    @Override
    public UploadType type() {
      return UploadType.RESULT_PHOTO_INSERT;
    }

    @Override
    public Map<String, Object> fields() {
      return row;
    }
  }

  /**
   * Signature image. A non-null {@code userId} asks the handler to point that
   * user's profile at the stored signature once the bytes are written.
   */
  record Signature(String userId) implements UploadPayload {
    static final String USER_ID = "user_id";

    @Override
    public UploadType type() {
      return UploadType.SIGNATURE_UPLOAD;
    }

    @Override
    public Map<String, Object> fields() {
      return userId == null ? Map.of() : Map.of(USER_ID, userId);
    }
  }

  /**
   * Lifecycle state of a model element. {@code (elementGuid, projectId)} is the
   * natural key the handler upserts on; it is persisted under the backend's column
   * names {@value #ELEMENT_GUID} and {@value #PROJECT_ID}.
   */
  record Lifecycle(String elementGuid, String projectId, Map<String, Object> state)
      implements UploadPayload {
    public static final String ELEMENT_GUID = "guid_ifc";
    public static final String PROJECT_ID = "trimble_project_id";

    public Lifecycle {
      Objects.requireNonNull(elementGuid, "elementGuid");
      Objects.requireNonNull(projectId, "projectId");
      state = copyOf(state, "state");
      if (state.containsKey(ELEMENT_GUID) || state.containsKey(PROJECT_ID)) {
        throw new IllegalArgumentException("state cannot redefine the natural key columns");
      }
    }

    static Lifecycle fromFields(Map<String, Object> fields) {
      String guid = stringField(fields, ELEMENT_GUID);
      String project = stringField(fields, PROJECT_ID);
      if (guid == null || project == null) {
        throw new IllegalArgumentException("Lifecycle payload is missing its natural key");
      }
      Map<String, Object> state = new LinkedHashMap<>(fields);
      state.remove(ELEMENT_GUID);
      state.remove(PROJECT_ID);
      return new Lifecycle(guid, project, state);
    }

    @Override
    public UploadType type() {
      return UploadType.LIFECYCLE_UPSERT;
    }

    @Override
    public Map<String, Object> fields() {
      Map<String, Object> out = new LinkedHashMap<>();
      out.put(ELEMENT_GUID, elementGuid);
      out.put(PROJECT_ID, projectId);
      out.putAll(state);
      return Collections.unmodifiableMap(out);
    }
  }

  /** Audit log entry. */
  record AuditEntry(Map<String, Object> entry) implements UploadPayload {
    public AuditEntry {
      entry = copyOf(entry, "entry");
    }

    @Override
    public UploadType type() {
      return UploadType.AUDIT_LOG_INSERT;
    }

    @Override
    public Map<String, Object> fields() {
      return entry;
    }
  }

  private static String stringField(Map<String, Object> fields, String key) {
    Object value = fields.get(key);
    if (value == null || value instanceof String) {
      return (String) value;
    }
    throw new IllegalArgumentException("Field '" + key + "' must be a string");
  }

  private static Map<String, Object> copyOf(Map<String, ?> map, String name) {
    if (map == null) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : map.entrySet()) {
      if (e.getKey() == null) {
        throw new IllegalArgumentException(name + " cannot contain null keys");
      }
      copy.put(e.getKey(), copyValue(e.getValue(), name + "." + e.getKey()));
    }
    return Collections.unmodifiableMap(copy);
  }

  @SuppressWarnings("unchecked")
  private static Object copyValue(Object value, String path) {
    if (value == null || value instanceof String || value instanceof Number
        || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Map<?, ?> nested) {
      for (Object key : nested.keySet()) {
        if (!(key instanceof String)) {
          throw new IllegalArgumentException(path + " must have string keys");
        }
      }
      return copyOf((Map<String, ?>) nested, path);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (int i = 0; i < list.size(); i++) {
        copy.add(copyValue(list.get(i), path + "[" + i + "]"));
      }
      return Collections.unmodifiableList(copy);
    }
    throw new IllegalArgumentException(
        path + " is not a JSON value: " + value.getClass().getName());
  }
}
