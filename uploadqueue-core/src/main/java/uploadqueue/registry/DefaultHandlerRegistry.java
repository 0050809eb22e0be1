package uploadqueue.registry;

import uploadqueue.UploadHandler;
import uploadqueue.UploadType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe registry holding at most one handler per {@link UploadType}.
 *
 * <p>Registering a second handler for the same type replaces the first, so a domain
 * module can be re-initialized without tearing down the queue.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register(UploadType.BINARY_UPLOAD, photoHandler)
 *     .register(UploadType.RECORD_INSERT, upload -> backend.insertResult(upload))
 *     .register(UploadType.LIFECYCLE_UPSERT, lifecycleHandler);
 * }</pre>
 *
 * @see HandlerRegistry
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private static final Logger logger = Logger.getLogger(DefaultHandlerRegistry.class.getName());

  private final Map<UploadType, UploadHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers the handler for a type, replacing any previous one.
   *
   * @param type    the upload type
   * @param handler the handler
   * @return this registry for chaining
   */
  public DefaultHandlerRegistry register(UploadType type, UploadHandler handler) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
    if (handlers.put(type, handler) != null) {
      logger.info("Replaced upload handler for " + type);
    }
    return this;
  }

  /**
   * Removes the handler for a type. Records of that type stay queued.
   *
   * @param type the upload type
   * @return {@code true} if a handler was removed
   */
  public boolean unregister(UploadType type) {
    return handlers.remove(type) != null;
  }

  /**
   * Returns the types that currently have a handler.
   *
   * @return an unmodifiable snapshot of registered types
   */
  public Set<UploadType> registeredTypes() {
    Set<UploadType> types = EnumSet.noneOf(UploadType.class);
    types.addAll(handlers.keySet());
    return Collections.unmodifiableSet(types);
  }

  @Override
  public UploadHandler handlerFor(UploadType type) {
    return type == null ? null : handlers.get(type);
  }
}
