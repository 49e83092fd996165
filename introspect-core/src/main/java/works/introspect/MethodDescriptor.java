package works.introspect;

import java.util.ArrayList;
import java.util.List;
import works.introspect.exceptions.ArityMismatchException;
import works.introspect.exceptions.TypeMismatchException;
import works.introspect.handles.TypedHandle;
import works.introspect.types.TypeTag;

import static java.util.Objects.requireNonNull;

/**
 * One reflective method of a registered type.
 * <p>
 * The parameter tags are captured once at registration,
 * so methods of every arity go through the same {@link #invoke} logic.
 *
 * @param invoker {@code (C, P1, ..., Pn)->R}
 */
public record MethodDescriptor(
	Class<?> ownerType,
	String name,
	TypeTag returnType,
	List<TypeTag> parameterTypes,
	TypedHandle invoker
) {
	public MethodDescriptor {
		requireNonNull(ownerType);
		requireNonNull(name);
		requireNonNull(returnType);
		parameterTypes = List.copyOf(parameterTypes);
		requireNonNull(invoker);
	}

	public int arity() {
		return parameterTypes.size();
	}

	/**
	 * Every argument is checked before the underlying method runs,
	 * so a failure here never leaves the instance partly modified.
	 *
	 * @return the boxed result, or {@link Boxed#empty()} for a {@code void} method
	 * @throws ArityMismatchException if {@code args} has the wrong length
	 * @throws TypeMismatchException if an argument or the return value has the wrong tag
	 */
	public Boxed invoke(Object instance, List<Boxed> args) {
		if (!ownerType.isInstance(instance)) {
			throw new IllegalArgumentException("Method '" + name + "' belongs to " + ownerType.getName()
				+ ", not " + (instance == null ? "null" : instance.getClass().getName()));
		}
		if (args.size() != parameterTypes.size()) {
			throw new ArityMismatchException(name, parameterTypes.size(), args.size());
		}
		List<Object> unboxed = new ArrayList<>(args.size() + 1);
		unboxed.add(instance);
		for (int i = 0; i < args.size(); i++) {
			TypeTag expected = parameterTypes.get(i);
			Boxed arg = args.get(i);
			if (!arg.tag().equals(expected)) {
				throw new TypeMismatchException(expected.name(), arg.tag().name(),
					"Argument " + i + " of method '" + name + "'");
			}
			unboxed.add(arg.as(expected));
		}
		Object result = invoker.invoke(name, unboxed);
		if (returnType.equals(TypeTag.VOID)) {
			return Boxed.empty();
		}
		if (!returnType.accepts(result)) {
			throw new TypeMismatchException(returnType.name(), MemberDescriptor.describe(result),
				"Return value of method '" + name + "'");
		}
		return Boxed.of(returnType, result);
	}

	@Override
	public String toString() {
		return name + parameterTypes.toString().replace('[', '(').replace(']', ')') + "->" + returnType;
	}
}
