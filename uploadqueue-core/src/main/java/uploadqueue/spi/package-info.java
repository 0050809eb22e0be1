/**
 * Service provider interfaces: the durable store contract, connection supply,
 * connectivity signal and metrics hook.
 *
 * @see uploadqueue.spi.UploadStore
 * @see uploadqueue.spi.NetworkMonitor
 */
package uploadqueue.spi;
