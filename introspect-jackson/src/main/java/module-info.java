/**
 * JSON collaborators of the introspection engine, built on Jackson.
 * <p>
 * {@link works.introspect.jackson.BoxedJsonCodec} converts between JSON and boxed values;
 * {@link works.introspect.jackson.binding} exposes registered classes to JSON clients;
 * {@link works.introspect.jackson.sync} keeps remote clients in sync with a live object.
 */
module works.introspect.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.introspect.core;

	requires static lombok;
	requires static org.jetbrains.annotations;

	exports works.introspect.jackson;
	exports works.introspect.jackson.binding;
	exports works.introspect.jackson.sync;
}
