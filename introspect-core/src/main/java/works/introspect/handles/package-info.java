/**
 * Method handles paired with the {@link works.introspect.types.TypeTag tags} of their signatures.
 */
package works.introspect.handles;
