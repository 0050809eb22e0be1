package uploadqueue.registry;

import uploadqueue.UploadHandler;
import uploadqueue.UploadType;

/**
 * Registry for looking up the upload handler of a record type.
 *
 * <p>The processor consults this registry for every record of a pass. A missing
 * handler is not an error at lookup time: the record is left untouched, because an
 * unregistered type signals a configuration or version mismatch rather than a
 * transient fault.
 *
 * @see UploadHandler
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler registered for the given type.
   *
   * @param type the upload type
   * @return the handler, or {@code null} if none is registered
   */
  UploadHandler handlerFor(UploadType type);
}
