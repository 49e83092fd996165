/**
 * Exposes registered classes to JSON clients as properties and callables.
 */
package works.introspect.jackson.binding;
