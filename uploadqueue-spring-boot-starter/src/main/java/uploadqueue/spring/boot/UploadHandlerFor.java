package uploadqueue.spring.boot;

import uploadqueue.UploadType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one or more upload types.
 *
 * <p>The annotated bean must implement {@link uploadqueue.UploadHandler}.
 *
 * <pre>{@code
 * @Component
 * @UploadHandlerFor(UploadType.BINARY_UPLOAD)
 * public class PhotoUploader implements UploadHandler {
 *   public boolean upload(PendingUpload upload) { ... }
 * }
 * }</pre>
 *
 * @see UploadHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface UploadHandlerFor {

    /**
     * Upload types delivered by the annotated handler. At least one is required.
     */
    UploadType[] value();
}
