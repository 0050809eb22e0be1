/**
 * Mapping from upload type to the domain-supplied handler that delivers it.
 *
 * @see uploadqueue.registry.HandlerRegistry
 * @see uploadqueue.registry.DefaultHandlerRegistry
 */
package uploadqueue.registry;
