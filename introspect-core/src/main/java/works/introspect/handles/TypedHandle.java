package works.introspect.handles;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.WrongMethodTypeException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import works.introspect.exceptions.InvocationFailedException;
import works.introspect.types.TypeTag;

import static java.util.Objects.requireNonNull;

/**
 * A {@link MethodHandle} annotated with the {@link TypeTag}s of its return value and parameters.
 * <p>
 * The tags are the engine's view of the signature; the handle's own {@link java.lang.invoke.MethodType}
 * may use primitives where the tags use their wrappers.
 */
public record TypedHandle(
	MethodHandle handle,
	TypeTag returnType,
	List<TypeTag> parameterTypes
) {
	public TypedHandle {
		requireNonNull(handle);
		requireNonNull(returnType);
		parameterTypes = List.copyOf(parameterTypes);
		if (handle.type().parameterCount() != parameterTypes.size()) {
			throw new IllegalArgumentException("Method handle type " + handle.type()
				+ " does not have " + parameterTypes.size() + " parameters " + parameterTypes);
		}
		boolean returnsVoid = handle.type().returnType() == void.class;
		if (returnsVoid != returnType.equals(TypeTag.VOID)) {
			throw new IllegalArgumentException("Method handle type " + handle.type()
				+ " does not match return type " + returnType);
		}
	}

	static Class<?> equivalentClass(TypeTag tag) {
		return tag.equals(TypeTag.VOID) ? void.class : tag.carrierClass();
	}

	public int arity() {
		return parameterTypes.size();
	}

	/**
	 * Calls the handle. The caller is responsible for supplying arguments
	 * that conform to {@link #parameterTypes()}.
	 *
	 * @param name used in the exception message if the target throws
	 * @throws InvocationFailedException if the target throws
	 */
	public Object invoke(String name, List<?> args) {
		try {
			return handle.invokeWithArguments(args);
		} catch (WrongMethodTypeException e) {
			throw new IllegalStateException("Unexpected type error invoking method handle " + this, e);
		} catch (Error e) {
			throw e;
		} catch (Throwable e) {
			throw new InvocationFailedException(name, e);
		}
	}

	/**
	 * @see MethodHandles#dropArguments(MethodHandle, int, Class[])
	 */
	public TypedHandle dropArguments(int pos, TypeTag... argTypes) {
		MethodHandle resultHandle = MethodHandles.dropArguments(
			handle,
			pos,
			Stream.of(argTypes)
				.map(TypedHandle::equivalentClass)
				.toArray(Class<?>[]::new)
		);
		List<TypeTag> resultParameterTypes = new ArrayList<>(parameterTypes());
		resultParameterTypes.addAll(pos, List.of(argTypes));
		return new TypedHandle(resultHandle, returnType, resultParameterTypes);
	}

	@Override
	public String toString() {
		return "(" + String.join(", ", parameterTypes.stream().map(TypeTag::name).toList()) + ")->" + returnType;
	}
}
