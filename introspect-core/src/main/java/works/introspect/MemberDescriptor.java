package works.introspect;

import java.util.Arrays;
import java.util.List;
import works.introspect.exceptions.TypeMismatchException;
import works.introspect.handles.TypedHandle;
import works.introspect.types.TypeTag;

import static java.util.Objects.requireNonNull;

/**
 * One reflective member of a registered type: a name, a tag,
 * and the handles that read and write it on an instance.
 *
 * @param getter {@code (C)->X}
 * @param setter {@code (C, X)->void}
 */
public record MemberDescriptor(
	Class<?> ownerType,
	String name,
	TypeTag tag,
	TypedHandle getter,
	TypedHandle setter
) {
	public MemberDescriptor {
		requireNonNull(ownerType);
		requireNonNull(name);
		requireNonNull(tag);
		requireNonNull(getter);
		requireNonNull(setter);
	}

	/**
	 * Reads the member. The instance is not modified.
	 *
	 * @throws TypeMismatchException if the accessor returns something that doesn't conform to {@link #tag()}
	 */
	public Boxed get(Object instance) {
		checkReceiver(instance);
		Object value = getter.invoke(name, List.of(instance));
		if (!tag.accepts(value)) {
			throw new TypeMismatchException(tag.name(), describe(value), "Value read from member '" + name + "'");
		}
		return Boxed.of(tag, value);
	}

	/**
	 * @throws TypeMismatchException if {@code value} is not tagged exactly {@link #tag()};
	 * the instance is then left unchanged.
	 */
	public void set(Object instance, Boxed value) {
		checkReceiver(instance);
		if (!value.tag().equals(tag)) {
			throw new TypeMismatchException(tag.name(), value.tag().name(), "Member '" + name + "'");
		}
		setter.invoke(name, Arrays.asList(instance, value.as(tag)));
	}

	private void checkReceiver(Object instance) {
		if (!ownerType.isInstance(instance)) {
			throw new IllegalArgumentException("Member '" + name + "' belongs to " + ownerType.getName()
				+ ", not " + (instance == null ? "null" : instance.getClass().getName()));
		}
	}

	static String describe(Object value) {
		return (value == null) ? "null" : TypeTag.of(value.getClass()).name();
	}
}
