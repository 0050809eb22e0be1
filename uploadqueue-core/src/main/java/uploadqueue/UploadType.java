package uploadqueue;

/**
 * Closed set of pending upload kinds. Each type maps to at most one
 * {@link UploadHandler} in the {@linkplain uploadqueue.registry.HandlerRegistry registry}.
 *
 * <p>The enum constant name is the persisted value, so constants must never be
 * renamed once records of that type may exist on a device.
 */
public enum UploadType {
  /** Inspection photo bytes written to object storage. */
  BINARY_UPLOAD(true),
  /** Inspection result row appended to a table. */
  RECORD_INSERT(false),
  /** Row linking an uploaded photo to an inspection result. */
  RESULT_PHOTO_INSERT(false),
  /** Signature image bytes, optionally followed by a profile update. */
  SIGNATURE_UPLOAD(true),
  /** Element lifecycle state, upserted by natural key. */
  LIFECYCLE_UPSERT(false),
  /** Audit log entry appended to a table. */
  AUDIT_LOG_INSERT(false);

  private final boolean carriesBinary;

  UploadType(boolean carriesBinary) {
    this.carriesBinary = carriesBinary;
  }

  /**
   * Returns {@code true} if records of this type must carry a {@link BinaryAttachment}.
   * Records of every other type must not carry one.
   *
   * @return whether a binary attachment is required
   */
  public boolean carriesBinary() {
    return carriesBinary;
  }
}
