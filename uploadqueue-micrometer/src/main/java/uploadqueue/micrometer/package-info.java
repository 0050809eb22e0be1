/**
 * Micrometer integration for upload queue metrics.
 *
 * @see uploadqueue.micrometer.MicrometerMetricsExporter
 */
package uploadqueue.micrometer;
