/**
 * Single-pass processing of the durable store.
 *
 * <p>{@link uploadqueue.process.UploadProcessor} snapshots the store, orders records by
 * priority and age, and hands each eligible record to its handler. Success deletes the
 * record; failure increments its retry count, optionally deferring it via a
 * {@link uploadqueue.process.RetryPolicy}.
 *
 * @see uploadqueue.process.UploadProcessor
 * @see uploadqueue.process.PassResult
 */
package uploadqueue.process;
