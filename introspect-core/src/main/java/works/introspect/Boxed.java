package works.introspect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.introspect.exceptions.TypeMismatchException;
import works.introspect.types.TypeReference;
import works.introspect.types.TypeTag;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static works.introspect.types.TypeTag.Kind.VECTOR;

/**
 * A type-erased carrier holding a value of exactly one {@link TypeTag}.
 * <p>
 * A value can be recovered only by asking for exactly the tag it was boxed with;
 * there is no widening, so an {@code int} cannot be unboxed as a {@code double}.
 * <p>
 * Boxes are immutable and share no mutable state with each other or with the objects
 * they were read from: vectors are copied on the way in and again on the way out.
 */
public final class Boxed {
	private static final Boxed EMPTY = new Boxed(TypeTag.VOID, null);

	@NotNull private final TypeTag tag;
	@Nullable private final Object value;

	private Boxed(@NotNull TypeTag tag, @Nullable Object value) {
		this.tag = tag;
		this.value = value;
	}

	/**
	 * @throws TypeMismatchException if {@code value} does not conform to {@code tag}
	 */
	public static Boxed of(TypeTag tag, @Nullable Object value) {
		requireNonNull(tag);
		if (!tag.accepts(value)) {
			throw new TypeMismatchException(tag.name(), describe(value), "Cannot box value");
		}
		if (tag.equals(TypeTag.VOID)) {
			return EMPTY;
		}
		return new Boxed(tag, freeze(tag, value));
	}

	/**
	 * Boxes a scalar, inferring its tag from its class.
	 * Vectors, pointers and other types need an explicit tag; use {@link #of(TypeTag, Object)}.
	 */
	public static Boxed ofValue(@NotNull Object value) {
		TypeTag inferred = TypeTag.of(value.getClass());
		if (inferred.kind() == TypeTag.Kind.PRIMITIVE || inferred.kind() == TypeTag.Kind.STRING) {
			return new Boxed(inferred, value);
		}
		throw new IllegalArgumentException("Cannot infer a tag for " + value.getClass().getName() + "; supply one explicitly");
	}

	public static Boxed of(int value) {
		return new Boxed(TypeTag.INT, value);
	}

	public static Boxed of(long value) {
		return new Boxed(TypeTag.LONG, value);
	}

	public static Boxed of(short value) {
		return new Boxed(TypeTag.SHORT, value);
	}

	public static Boxed of(byte value) {
		return new Boxed(TypeTag.BYTE, value);
	}

	public static Boxed of(double value) {
		return new Boxed(TypeTag.DOUBLE, value);
	}

	public static Boxed of(float value) {
		return new Boxed(TypeTag.FLOAT, value);
	}

	public static Boxed of(boolean value) {
		return new Boxed(TypeTag.BOOL, value);
	}

	public static Boxed of(char value) {
		return new Boxed(TypeTag.CHAR, value);
	}

	public static Boxed of(@Nullable String value) {
		return new Boxed(TypeTag.STRING, value);
	}

	public static Boxed vector(TypeTag elementTag, List<?> values) {
		return of(TypeTag.vectorOf(elementTag), values);
	}

	/**
	 * @return the result of a {@code void} call
	 */
	public static Boxed empty() {
		return EMPTY;
	}

	public TypeTag tag() {
		return tag;
	}

	public boolean isEmpty() {
		return this == EMPTY;
	}

	/**
	 * A read-only view of the contents, for encoders that dispatch on {@link #tag()} themselves.
	 * Vectors are returned unmodifiable.
	 */
	@Nullable
	public Object peek() {
		return value;
	}

	/**
	 * @throws TypeMismatchException unless {@code expected} equals {@link #tag()}
	 */
	@Nullable
	public Object as(TypeTag expected) {
		if (!tag.equals(expected)) {
			throw new TypeMismatchException(expected.name(), tag.name(), "Cannot unbox value");
		}
		return thaw(tag, value);
	}

	@SuppressWarnings("unchecked")
	public <T> T as(Class<T> type) {
		return (T) as(TypeTag.of(type));
	}

	@SuppressWarnings("unchecked")
	public <T> T as(TypeReference<T> type) {
		return (T) as(TypeTag.of(type));
	}

	public int asInt() {
		return (Integer) as(TypeTag.INT);
	}

	public long asLong() {
		return (Long) as(TypeTag.LONG);
	}

	public double asDouble() {
		return (Double) as(TypeTag.DOUBLE);
	}

	public float asFloat() {
		return (Float) as(TypeTag.FLOAT);
	}

	public boolean asBoolean() {
		return (Boolean) as(TypeTag.BOOL);
	}

	public char asChar() {
		return (Character) as(TypeTag.CHAR);
	}

	public String asString() {
		return (String) as(TypeTag.STRING);
	}

	private static Object freeze(TypeTag tag, Object value) {
		if (value != null && tag.kind() == VECTOR) {
			List<Object> copy = new ArrayList<>();
			for (Object element : (List<?>) value) {
				copy.add(freeze(tag.elementTag(), element));
			}
			return unmodifiableList(copy);
		}
		return value;
	}

	private static Object thaw(TypeTag tag, Object value) {
		if (value != null && tag.kind() == VECTOR) {
			List<Object> copy = new ArrayList<>();
			for (Object element : (List<?>) value) {
				copy.add(thaw(tag.elementTag(), element));
			}
			return copy;
		}
		return value;
	}

	private static String describe(Object value) {
		if (value == null) {
			return "null";
		} else if (value instanceof List) {
			return "a list of " + ((List<?>) value).size() + " element(s) " + value;
		} else {
			return TypeTag.of(value.getClass()).name();
		}
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Boxed that = (Boxed) o;
		return tag.equals(that.tag) && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tag, value);
	}

	@Override
	public String toString() {
		return isEmpty() ? "void" : tag + ":" + value;
	}
}
