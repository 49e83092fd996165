package works.introspect.jackson.binding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import works.introspect.Boxed;
import works.introspect.MemberDescriptor;
import works.introspect.MethodDescriptor;
import works.introspect.Reflection;
import works.introspect.TypeDescriptor;
import works.introspect.exceptions.ArityMismatchException;
import works.introspect.exceptions.NotFoundException;
import works.introspect.exceptions.TypeMismatchException;
import works.introspect.jackson.BoxedJsonCodec;
import works.introspect.types.TypeTag;

import static java.util.Collections.unmodifiableMap;
import static works.introspect.exceptions.NotFoundException.Kind.MEMBER;
import static works.introspect.exceptions.NotFoundException.Kind.METHOD;

/**
 * The JSON-facing view of one registered class:
 * a {@link Property} per member and a {@link Callable} per exposed method.
 */
public final class BoundClass {
	private final TypeDescriptor descriptor;
	private final BoxedJsonCodec codec;
	private final Map<String, Property> properties;
	private final Map<String, Callable> callables;

	BoundClass(TypeDescriptor descriptor, BoxedJsonCodec codec, JsonBindings.Settings settings) {
		this.descriptor = descriptor;
		this.codec = codec;
		Map<String, Property> properties = new LinkedHashMap<>();
		for (MemberDescriptor member : descriptor.members()) {
			properties.put(member.name(), new Property(member));
		}
		Map<String, Callable> callables = new LinkedHashMap<>();
		for (MethodDescriptor method : descriptor.methods()) {
			if (settings.suppressAccessorMethods() && isAccessorOfMember(method.name())) {
				continue;
			}
			callables.put(method.name(), new Callable(method));
		}
		this.properties = unmodifiableMap(properties);
		this.callables = unmodifiableMap(callables);
	}

	/**
	 * {@code getX}, {@code setX} and {@code isX} are accessors only when {@code x} is itself a registered member.
	 */
	private boolean isAccessorOfMember(String methodName) {
		for (String prefix : ACCESSOR_PREFIXES) {
			if (methodName.length() > prefix.length()
				&& methodName.startsWith(prefix)
				&& Character.isUpperCase(methodName.charAt(prefix.length()))) {
				String rest = methodName.substring(prefix.length());
				String memberName = Character.toLowerCase(rest.charAt(0)) + rest.substring(1);
				if (descriptor.hasMember(memberName)) {
					return true;
				}
			}
		}
		return false;
	}

	public final class Property {
		private final MemberDescriptor member;

		private Property(MemberDescriptor member) {
			this.member = member;
		}

		public String name() {
			return member.name();
		}

		public TypeTag tag() {
			return member.tag();
		}

		public JsonNode get(Object instance) {
			return codec.encode(member.get(instance));
		}

		/**
		 * @throws TypeMismatchException if {@code value} can't be decoded as this property's tag
		 */
		public void set(Object instance, JsonNode value) {
			member.set(instance, codec.decode(member.tag(), value));
		}
	}

	public final class Callable {
		private final MethodDescriptor method;

		private Callable(MethodDescriptor method) {
			this.method = method;
		}

		public String name() {
			return method.name();
		}

		public int arity() {
			return method.arity();
		}

		public List<TypeTag> parameterTypes() {
			return method.parameterTypes();
		}

		public TypeTag returnType() {
			return method.returnType();
		}

		/**
		 * The argument count is checked before any argument is decoded.
		 *
		 * @return the encoded result; JSON {@code null} for {@code void} methods
		 * @throws ArityMismatchException if {@code args} has the wrong length
		 * @throws TypeMismatchException if an argument can't be decoded as its parameter's tag
		 */
		public JsonNode call(Object instance, List<? extends JsonNode> args) {
			if (args.size() != method.arity()) {
				throw new ArityMismatchException(method.name(), method.arity(), args.size());
			}
			Boxed[] boxed = new Boxed[args.size()];
			for (int i = 0; i < boxed.length; i++) {
				boxed[i] = codec.decode(method.parameterTypes().get(i), args.get(i));
			}
			return codec.encode(method.invoke(instance, List.of(boxed)));
		}
	}

	public TypeDescriptor descriptor() {
		return descriptor;
	}

	public String className() {
		return descriptor.className();
	}

	public List<String> memberNames() {
		return descriptor.memberNames();
	}

	public List<String> methodNames() {
		return descriptor.methodNames();
	}

	public List<Property> properties() {
		return List.copyOf(properties.values());
	}

	public List<Callable> callables() {
		return List.copyOf(callables.values());
	}

	/**
	 * @throws NotFoundException if there's no such member
	 */
	public Property property(String name) {
		Property result = properties.get(name);
		if (result == null) {
			throw new NotFoundException(MEMBER, className(), name);
		}
		return result;
	}

	/**
	 * @throws NotFoundException if there's no such method, or it's suppressed as an accessor
	 */
	public Callable callable(String name) {
		Callable result = callables.get(name);
		if (result == null) {
			throw new NotFoundException(METHOD, className(), name);
		}
		return result;
	}

	public JsonNode get(Object instance, String member) {
		return property(member).get(instance);
	}

	public void set(Object instance, String member, JsonNode value) {
		property(member).set(instance, value);
	}

	public JsonNode call(Object instance, String method, List<? extends JsonNode> args) {
		return callable(method).call(instance, args);
	}

	public String toJSON(Object instance) {
		return Reflection.of(descriptor, instance).toJSON();
	}

	/**
	 * Describes the bound interface, for generating client-side stubs:
	 * <pre>{@code
	 * {"className": "Person",
	 *  "properties": {"age": "int", ...},
	 *  "methods": {"introduce": {"returns": "void", "params": []}, ...}}
	 * }</pre>
	 */
	public ObjectNode schema() {
		ObjectNode result = codec.mapper().createObjectNode();
		result.put("className", className());
		ObjectNode props = result.putObject("properties");
		properties.values().forEach(p -> props.put(p.name(), p.tag().name()));
		ObjectNode methods = result.putObject("methods");
		for (Callable c : callables.values()) {
			ObjectNode m = methods.putObject(c.name());
			m.put("returns", c.returnType().name());
			ArrayNode params = m.putArray("params");
			c.parameterTypes().forEach(t -> params.add(t.name()));
		}
		return result;
	}

	@Override
	public String toString() {
		return "BoundClass(" + className() + ")";
	}

	private static final List<String> ACCESSOR_PREFIXES = List.of("get", "set", "is");
}
