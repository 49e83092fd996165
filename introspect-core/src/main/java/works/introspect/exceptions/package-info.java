/**
 * The failure taxonomy of the introspection engine, rooted at
 * {@link works.introspect.exceptions.IntrospectionException}.
 */
package works.introspect.exceptions;
