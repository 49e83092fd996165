package works.introspect.handles;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;
import works.introspect.types.TypeTag;

import static java.lang.invoke.MethodType.methodType;
import static works.introspect.types.TypeTag.VOID;

/**
 * Factories for {@link TypedHandle}s whose first parameter is the receiver.
 * <p>
 * Handles built from lambdas declare their value parameters and results as {@link Object};
 * the tags carry the real types, and callers check values against the tags
 * before and after invocation.
 */
public final class TypedHandles {
	private TypedHandles(){}

	/**
	 * @throws IllegalAccessException if {@code lookup} can't read the field
	 */
	public static TypedHandle getter(Field field, MethodHandles.Lookup lookup) throws IllegalAccessException {
		TypeTag receiver = TypeTag.of(field.getDeclaringClass());
		TypeTag tag = TypeTag.of(field.getGenericType());
		MethodHandle mh = lookup.unreflectGetter(field);
		if (isStatic(field.getModifiers())) {
			return new TypedHandle(mh, tag, List.of()).dropArguments(0, receiver);
		} else {
			return new TypedHandle(mh, tag, List.of(receiver));
		}
	}

	/**
	 * @throws IllegalAccessException if {@code lookup} can't write the field, including when it's final
	 */
	public static TypedHandle setter(Field field, MethodHandles.Lookup lookup) throws IllegalAccessException {
		TypeTag receiver = TypeTag.of(field.getDeclaringClass());
		TypeTag tag = TypeTag.of(field.getGenericType());
		MethodHandle mh = lookup.unreflectSetter(field);
		if (isStatic(field.getModifiers())) {
			return new TypedHandle(mh, VOID, List.of(tag)).dropArguments(0, receiver);
		} else {
			return new TypedHandle(mh, VOID, List.of(receiver, tag));
		}
	}

	/**
	 * Static methods get a leading receiver parameter that is ignored,
	 * so every method handle has the same shape.
	 *
	 * @throws IllegalAccessException if {@code lookup} can't call the method
	 */
	public static TypedHandle method(Method method, MethodHandles.Lookup lookup) throws IllegalAccessException {
		TypeTag receiver = TypeTag.of(method.getDeclaringClass());
		List<TypeTag> parameters = Stream.of(method.getGenericParameterTypes())
			.map(TypeTag::of)
			.toList();
		MethodHandle mh = lookup.unreflect(method);
		if (method.isVarArgs()) {
			mh = mh.asFixedArity();
		}
		if (isStatic(method.getModifiers())) {
			return new TypedHandle(mh, TypeTag.of(method.getGenericReturnType()), parameters)
				.dropArguments(0, receiver);
		} else {
			List<TypeTag> withReceiver = new ArrayList<>(parameters.size() + 1);
			withReceiver.add(receiver);
			withReceiver.addAll(parameters);
			return new TypedHandle(mh, TypeTag.of(method.getGenericReturnType()), withReceiver);
		}
	}

	public static <C> TypedHandle function(Class<C> receiverType, TypeTag returnType, Function<? super C, ?> function) {
		return new TypedHandle(
			FUNCTION_APPLY
				.bindTo(function)
				.asType(methodType(Object.class, receiverType)),
			returnType,
			List.of(TypeTag.of(receiverType))
		);
	}

	public static <C> TypedHandle biFunction(Class<C> receiverType, TypeTag argType, TypeTag returnType, BiFunction<? super C, ?, ?> biFunction) {
		return new TypedHandle(
			BI_FUNCTION_APPLY
				.bindTo(biFunction)
				.asType(methodType(Object.class, receiverType, Object.class)),
			returnType,
			List.of(TypeTag.of(receiverType), argType)
		);
	}

	public static <C> TypedHandle consumer(Class<C> receiverType, Consumer<? super C> consumer) {
		return new TypedHandle(
			CONSUMER_ACCEPT
				.bindTo(consumer)
				.asType(methodType(void.class, receiverType)),
			VOID,
			List.of(TypeTag.of(receiverType))
		);
	}

	public static <C> TypedHandle biConsumer(Class<C> receiverType, TypeTag argType, BiConsumer<? super C, ?> biConsumer) {
		return new TypedHandle(
			BICONSUMER_ACCEPT
				.bindTo(biConsumer)
				.asType(methodType(void.class, receiverType, Object.class)),
			VOID,
			List.of(TypeTag.of(receiverType), argType)
		);
	}

	/**
	 * Any-arity form: {@code invoker} receives the already-checked arguments in declaration order.
	 * A {@link TypeTag#VOID void} {@code returnType} discards whatever {@code invoker} returns.
	 */
	public static <C> TypedHandle invoker(Class<C> receiverType, TypeTag returnType, List<TypeTag> parameterTypes, Invoker<? super C> invoker) {
		int arity = parameterTypes.size();
		Class<?>[] parameterClasses = new Class<?>[arity + 1];
		parameterClasses[0] = receiverType;
		Arrays.fill(parameterClasses, 1, arity + 1, Object.class);
		MethodHandle mh = INVOKER_INVOKE
			.bindTo(invoker)
			.asCollector(Object[].class, arity)
			.asType(methodType(returnType.equals(VOID) ? void.class : Object.class, parameterClasses));
		List<TypeTag> tags = new ArrayList<>(arity + 1);
		tags.add(TypeTag.of(receiverType));
		tags.addAll(parameterTypes);
		return new TypedHandle(mh, returnType, tags);
	}

	@FunctionalInterface
	public interface Invoker<C> {
		Object invoke(C receiver, List<Object> arguments) throws Exception;
	}

	private static Object invokeInvoker(Invoker<Object> invoker, Object receiver, Object[] arguments) throws Exception {
		return invoker.invoke(receiver, Collections.unmodifiableList(Arrays.asList(arguments)));
	}

	private static boolean isStatic(int modifiers) {
		return Modifier.isStatic(modifiers);
	}

	private static final MethodHandle FUNCTION_APPLY;
	private static final MethodHandle BI_FUNCTION_APPLY;
	private static final MethodHandle CONSUMER_ACCEPT;
	private static final MethodHandle BICONSUMER_ACCEPT;
	private static final MethodHandle INVOKER_INVOKE;

	static {
		try {
			FUNCTION_APPLY = MethodHandles.lookup().findVirtual(Function.class, "apply", methodType(Object.class, Object.class));
			BI_FUNCTION_APPLY = MethodHandles.lookup().findVirtual(BiFunction.class, "apply", methodType(Object.class, Object.class, Object.class));
			CONSUMER_ACCEPT = MethodHandles.lookup().findVirtual(Consumer.class, "accept", methodType(void.class, Object.class));
			BICONSUMER_ACCEPT = MethodHandles.lookup().findVirtual(BiConsumer.class, "accept", methodType(void.class, Object.class, Object.class));
			INVOKER_INVOKE = MethodHandles.lookup().findStatic(
				TypedHandles.class,
				"invokeInvoker",
				MethodType.methodType(Object.class, Invoker.class, Object.class, Object[].class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new ExceptionInInitializerError(e);
		}
	}
}
