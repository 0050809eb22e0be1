/**
 * Triggers for passes: startup, fixed interval while online, and reconnect.
 *
 * @see uploadqueue.scheduler.UploadScheduler
 */
package uploadqueue.scheduler;
