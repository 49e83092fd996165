package works.introspect;

import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.introspect.TypeRegistry.DuplicatePolicy;
import works.introspect.exceptions.DuplicateRegistrationException;
import works.introspect.exceptions.InvalidRegistrationException;
import works.introspect.handles.TypedHandle;
import works.introspect.handles.TypedHandles;
import works.introspect.types.TypeReference;
import works.introspect.types.TypeTag;

import static java.util.Objects.requireNonNull;
import static works.introspect.types.TypeTag.VOID;

/**
 * Populates the {@link TypeDescriptor} of one type {@code C}.
 * <p>
 * A registrar is handed to a {@link TypeRegistry.Registration} exactly once;
 * every method returns {@code this} for chaining:
 *
 * <pre>{@code
 * registrar
 *     .field("name", lookup())
 *     .member("age", int.class, Person::getAge, Person::setAge)
 *     .method("introduce", lookup());
 * }</pre>
 *
 * Problems with the registered members or methods are reported immediately
 * as {@link InvalidRegistrationException}.
 */
public final class Registrar<C> {
	private final Class<C> type;
	private final TypeTag receiverTag;
	private final DuplicatePolicy duplicatePolicy;
	private String className;
	private final Map<String, MemberDescriptor> members = new LinkedHashMap<>();
	private final Map<String, MethodDescriptor> methods = new LinkedHashMap<>();
	private boolean built = false;

	Registrar(Class<C> type, DuplicatePolicy duplicatePolicy) {
		this.type = requireNonNull(type);
		this.receiverTag = TypeTag.of(type);
		this.duplicatePolicy = requireNonNull(duplicatePolicy);
		this.className = type.getSimpleName();
	}

	public Class<C> type() {
		return type;
	}

	/**
	 * Overrides the class name reported by {@link TypeDescriptor#className()},
	 * which defaults to the simple name of the type.
	 */
	public Registrar<C> named(String className) {
		checkOpen();
		this.className = requireNonNull(className);
		return this;
	}

	/**
	 * Registers the field {@code name} declared by {@code C} as a member of the same name.
	 *
	 * @param lookup must have access to the field; private fields need the lookup of {@code C} itself
	 */
	public Registrar<C> field(String name, MethodHandles.Lookup lookup) {
		return field(name, name, lookup);
	}

	public Registrar<C> field(String memberName, String fieldName, MethodHandles.Lookup lookup) {
		checkOpen();
		Field field;
		try {
			field = type.getDeclaredField(fieldName);
		} catch (NoSuchFieldException e) {
			throw new InvalidRegistrationException(type, memberName, "no field named \"" + fieldName + "\"", e);
		}
		if (Modifier.isFinal(field.getModifiers())) {
			throw new InvalidRegistrationException(type, memberName, "field \"" + fieldName + "\" is final");
		}
		checkNotWrapper(memberName, field.getGenericType(), "field \"" + fieldName + "\"");
		TypedHandle getter, setter;
		try {
			getter = TypedHandles.getter(field, lookup);
			setter = TypedHandles.setter(field, lookup);
		} catch (IllegalAccessException e) {
			throw new InvalidRegistrationException(type, memberName, "field \"" + fieldName + "\" is not accessible", e);
		}
		return member(memberName, TypeTag.of(field.getGenericType()), getter, setter);
	}

	public <X> Registrar<C> member(String name, Class<X> memberType, Function<? super C, ? extends X> getter, BiConsumer<? super C, ? super X> setter) {
		checkNotWrapper(name, memberType, "member type");
		return member(name, TypeTag.of(memberType), getter, setter);
	}

	public <X> Registrar<C> member(String name, TypeReference<X> memberType, Function<? super C, ? extends X> getter, BiConsumer<? super C, ? super X> setter) {
		checkNotWrapper(name, memberType.reflectionType(), "member type");
		return member(name, TypeTag.of(memberType), getter, setter);
	}

	private Registrar<C> member(String name, TypeTag tag, Function<? super C, ?> getter, BiConsumer<? super C, ?> setter) {
		return member(name, tag,
			TypedHandles.function(type, tag, getter),
			TypedHandles.biConsumer(type, tag, setter));
	}

	/**
	 * @param getter {@code (C)->X} where {@code X} has the given {@code tag}
	 * @param setter {@code (C, X)->void}
	 */
	public Registrar<C> member(String name, TypeTag tag, TypedHandle getter, TypedHandle setter) {
		checkOpen();
		checkName(name);
		if (tag.equals(VOID)) {
			throw new InvalidRegistrationException(type, name, "member cannot be void");
		}
		if (!getter.parameterTypes().equals(List.of(receiverTag)) || !getter.returnType().equals(tag)) {
			throw new InvalidRegistrationException(type, name, "getter " + getter + " should be (" + receiverTag + ")->" + tag);
		}
		if (!setter.parameterTypes().equals(List.of(receiverTag, tag)) || !setter.returnType().equals(VOID)) {
			throw new InvalidRegistrationException(type, name, "setter " + setter + " should be (" + receiverTag + ", " + tag + ")->void");
		}
		put(members, "member", name, new MemberDescriptor(type, name, tag, getter, setter));
		return this;
	}

	/**
	 * Registers the unique method called {@code name} declared by {@code C}, of any arity.
	 * Static methods are accepted too; they ignore the instance.
	 */
	public Registrar<C> method(String name, MethodHandles.Lookup lookup) {
		checkOpen();
		List<Method> candidates = Arrays.stream(type.getDeclaredMethods())
			.filter(m -> m.getName().equals(name))
			.filter(m -> !m.isSynthetic() && !m.isBridge())
			.toList();
		if (candidates.isEmpty()) {
			throw new InvalidRegistrationException(type, name, "no method named \"" + name + "\"");
		} else if (candidates.size() > 1) {
			throw new InvalidRegistrationException(type, name, candidates.size()
				+ " overloads; supply the parameter types to choose one");
		}
		return method(name, candidates.get(0), lookup);
	}

	public Registrar<C> method(String name, MethodHandles.Lookup lookup, Class<?>... parameterTypes) {
		checkOpen();
		Method method;
		try {
			method = type.getDeclaredMethod(name, parameterTypes);
		} catch (NoSuchMethodException e) {
			throw new InvalidRegistrationException(type, name, "no method with parameter types " + Arrays.toString(parameterTypes), e);
		}
		return method(name, method, lookup);
	}

	private Registrar<C> method(String name, Method method, MethodHandles.Lookup lookup) {
		checkNotWrapper(name, method.getGenericReturnType(), "return type");
		TypedHandle handle;
		try {
			handle = TypedHandles.method(method, lookup);
		} catch (IllegalAccessException e) {
			throw new InvalidRegistrationException(type, name, "method is not accessible", e);
		}
		return method(name, handle);
	}

	/**
	 * @param invoker {@code (C, P1, ..., Pn)->R}; see {@link TypedHandles} for ways to make one
	 */
	public Registrar<C> method(String name, TypedHandle invoker) {
		checkOpen();
		checkName(name);
		List<TypeTag> parameters = invoker.parameterTypes();
		if (parameters.isEmpty() || !parameters.get(0).equals(receiverTag)) {
			throw new InvalidRegistrationException(type, name, "first parameter of " + invoker + " should be " + receiverTag);
		}
		List<TypeTag> declared = parameters.subList(1, parameters.size());
		if (declared.contains(VOID)) {
			throw new InvalidRegistrationException(type, name, "parameters cannot be void");
		}
		put(methods, "method", name, new MethodDescriptor(type, name, invoker.returnType(), declared, invoker));
		return this;
	}

	TypeDescriptor build() {
		checkOpen();
		built = true;
		return new TypeDescriptor(type, className, new LinkedHashMap<>(members), new LinkedHashMap<>(methods));
	}

	private <D> void put(Map<String, D> map, String kind, String name, D descriptor) {
		if (map.containsKey(name)) {
			switch (duplicatePolicy) {
				case REJECT -> throw new DuplicateRegistrationException(className, name, kind + " already registered");
				case REPLACE -> LOGGER.debug("Replacing {} {}.{}", kind, className, name);
			}
		}
		map.put(name, descriptor);
	}

	/**
	 * Wrapper classes share their primitive's tag, which can't hold the {@code null} a wrapper can.
	 */
	private void checkNotWrapper(String name, Type javaType, String what) {
		if (javaType instanceof Class<?> c && !c.isPrimitive() && TypeTag.of(c).kind() == TypeTag.Kind.PRIMITIVE) {
			throw new InvalidRegistrationException(type, name, what + " " + c.getSimpleName()
				+ " is a wrapper; use " + TypeTag.of(c) + " or a primitive type");
		}
	}

	private void checkName(String name) {
		if (name == null || name.isEmpty()) {
			throw new InvalidRegistrationException(type, String.valueOf(name), "name must be non-empty");
		}
	}

	private void checkOpen() {
		if (built) {
			throw new IllegalStateException("Registration of " + type.getName() + " is already complete");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Registrar.class);
}
