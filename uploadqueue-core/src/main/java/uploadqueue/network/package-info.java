/**
 * Connectivity state fed by the host application, exposed to the scheduler as an
 * edge-triggered "became online" signal.
 */
package uploadqueue.network;
