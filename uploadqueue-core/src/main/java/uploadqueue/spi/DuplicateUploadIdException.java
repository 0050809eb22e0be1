package uploadqueue.spi;

/**
 * Thrown by {@link UploadStore#insertNew} when a record with the same id is already stored.
 */
public final class DuplicateUploadIdException extends UploadStoreException {
    private final String uploadId;

    public DuplicateUploadIdException(String uploadId, Throwable cause) {
        super("Upload id already exists: " + uploadId, cause);
        this.uploadId = uploadId;
    }

    public String uploadId() {
        return uploadId;
    }
}
