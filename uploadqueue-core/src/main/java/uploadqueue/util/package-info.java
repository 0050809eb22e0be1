/**
 * Small shared helpers: daemon thread naming and the payload JSON codec.
 */
package uploadqueue.util;
