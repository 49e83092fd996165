/**
 * Registration-based runtime introspection.
 * <p>
 * Classes register their members and methods once, through a {@link works.introspect.Registrar},
 * into a {@link works.introspect.TypeDescriptor} cached by a {@link works.introspect.TypeRegistry}.
 * Instances are then read, written and invoked by name through the {@link works.introspect.Reflective} facade,
 * with every value carried in a {@link works.introspect.Boxed} tagged by its {@link works.introspect.types.TypeTag}.
 */
module works.introspect.core {
	requires static org.jetbrains.annotations;
	requires org.slf4j;

	exports works.introspect;
	exports works.introspect.exceptions;
	exports works.introspect.handles;
	exports works.introspect.types;
}
