/**
 * Dialect-specific work stores and their {@link java.util.ServiceLoader} registry.
 */
package workpipe.jdbc.store;
