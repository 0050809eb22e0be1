package uploadqueue;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable byte payload carried by binary upload types, together with the
 * metadata a handler needs to place it in object storage.
 *
 * <p>Bytes are defensively copied on the way in and out. The payload is limited to
 * {@value #MAX_BYTES} bytes.
 *
 * @see UploadType#carriesBinary()
 */
public final class BinaryAttachment {
  public static final int MAX_BYTES = 32 * 1024 * 1024; // 32MB
  public static final String DEFAULT_CONTENT_TYPE = "image/png";

  private final byte[] bytes;
  private final String fileName;
  private final String contentType;
  private final String storageLocation;

  /**
   * Creates an attachment.
   *
   * @param bytes           the raw bytes
   * @param fileName        object name under the storage location
   * @param contentType     MIME type; {@code null} defaults to {@value #DEFAULT_CONTENT_TYPE}
   * @param storageLocation bucket or folder; {@code null} lets the queue pick the type default
   */
  public BinaryAttachment(byte[] bytes, String fileName, String contentType, String storageLocation) {
    Objects.requireNonNull(bytes, "bytes");
    this.fileName = Objects.requireNonNull(fileName, "fileName");
    if (fileName.isBlank()) {
      throw new IllegalArgumentException("fileName cannot be blank");
    }
    if (bytes.length > MAX_BYTES) {
      throw new IllegalArgumentException("Binary exceeds maximum size of " + MAX_BYTES + " bytes");
    }
    this.bytes = Arrays.copyOf(bytes, bytes.length);
    this.contentType = contentType == null ? DEFAULT_CONTENT_TYPE : contentType;
    this.storageLocation = storageLocation;
  }

  public static BinaryAttachment of(byte[] bytes, String fileName, String contentType) {
    return new BinaryAttachment(bytes, fileName, contentType, null);
  }

  public byte[] bytes() {
    return Arrays.copyOf(bytes, bytes.length);
  }

  public int size() {
    return bytes.length;
  }

  public String fileName() {
    return fileName;
  }

  public String contentType() {
    return contentType;
  }

  /**
   * Returns the target bucket or folder, or {@code null} if none was chosen.
   *
   * @return the storage location, or {@code null}
   */
  public String storageLocation() {
    return storageLocation;
  }

  /**
   * Returns a copy targeting the given storage location.
   *
   * @param location the bucket or folder
   * @return a new attachment sharing bytes and metadata
   */
  public BinaryAttachment withStorageLocation(String location) {
    return new BinaryAttachment(bytes, fileName, contentType, location);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BinaryAttachment that)) return false;
    return Arrays.equals(bytes, that.bytes)
        && fileName.equals(that.fileName)
        && contentType.equals(that.contentType)
        && Objects.equals(storageLocation, that.storageLocation);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(fileName, contentType, storageLocation);
    return 31 * result + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "BinaryAttachment{fileName=" + fileName + ", contentType=" + contentType
        + ", storageLocation=" + storageLocation + ", size=" + bytes.length + '}';
  }
}
