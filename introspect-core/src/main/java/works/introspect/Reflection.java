package works.introspect;

import static java.util.Objects.requireNonNull;

/**
 * Adapts objects that don't implement {@link Reflective} themselves.
 */
public final class Reflection {
	private Reflection(){}

	public static Reflective of(TypeDescriptor descriptor, Object instance) {
		requireNonNull(descriptor);
		if (!descriptor.type().isInstance(instance)) {
			throw new IllegalArgumentException("Expected an instance of " + descriptor.type().getName()
				+ ", not " + (instance == null ? "null" : instance.getClass().getName()));
		}
		if (instance instanceof Reflective r && r.typeDescriptor() == descriptor) {
			return r;
		}
		return new Adapter(descriptor, instance);
	}

	/**
	 * Uses the descriptor already registered in {@code registry} for the instance's exact class.
	 *
	 * @throws IllegalArgumentException if the class isn't registered
	 */
	public static Reflective of(TypeRegistry registry, Object instance) {
		requireNonNull(instance);
		TypeDescriptor descriptor = registry.find(instance.getClass())
			.orElseThrow(() -> new IllegalArgumentException("Type is not registered: " + instance.getClass().getName()));
		return of(descriptor, instance);
	}

	private record Adapter(TypeDescriptor typeDescriptor, Object reflectionTarget) implements Reflective {
		@Override
		public String toString() {
			return "Reflective(" + typeDescriptor.className() + ")";
		}
	}
}
