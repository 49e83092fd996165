/**
 * Type tags: the closed vocabulary used to match boxed values against
 * member and parameter declarations, rooted at {@link works.introspect.types.TypeTag}.
 */
package works.introspect.types;
