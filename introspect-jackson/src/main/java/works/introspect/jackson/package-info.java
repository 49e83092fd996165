/**
 * Tag-driven conversion between Jackson {@link tools.jackson.databind.JsonNode}s
 * and {@link works.introspect.Boxed} values.
 */
package works.introspect.jackson;
