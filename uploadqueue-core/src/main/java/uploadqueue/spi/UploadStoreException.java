package uploadqueue.spi;

/**
 * Unchecked exception signalling that the durable store could not be read or written.
 *
 * <p>Thrown from {@link UploadStore} implementations and from the processor when a
 * connection cannot be obtained. A failure while taking the pass snapshot aborts the
 * whole pass and propagates to the caller.
 */
public class UploadStoreException extends RuntimeException {
    public UploadStoreException(String message) {
        super(message);
    }

    public UploadStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
