/**
 * The primary introspection API.
 * Start with {@link works.introspect.Reflective} and {@link works.introspect.TypeRegistry}.
 */
package works.introspect;
