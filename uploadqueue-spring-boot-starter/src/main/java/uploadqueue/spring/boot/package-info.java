/**
 * Spring Boot auto-configuration for the upload queue: properties under
 * {@code upload-queue.*}, annotation-driven handler registration and Micrometer metrics.
 *
 * @see uploadqueue.spring.boot.UploadQueueAutoConfiguration
 * @see uploadqueue.spring.boot.UploadQueueProperties
 * @see uploadqueue.spring.boot.UploadHandlerFor
 */
package uploadqueue.spring.boot;
