package works.introspect.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableMap;

/**
 * The string identifying a value's semantic type.
 * Two values interoperate only if their tags are equal; there is no coercion and no subtyping.
 * <p>
 * Tags are compared by {@link #name() name} alone.
 * The built-in tags form a closed set:
 * {@code int, long, short, byte, double, float, bool, char, string, void},
 * {@code vector<E>} for a {@link List} of any built-in element tag,
 * and {@code T*} for an {@link AtomicReference} to a value of tag {@code T}.
 * Every other type resolves to an {@link Kind#OPAQUE opaque} tag named after the type,
 * which is useful for diagnostics but carries no conversion support.
 */
public final class TypeTag {
	public static final TypeTag VOID = new TypeTag("void", Kind.VOID, Void.class, null);
	public static final TypeTag BOOL = primitive("bool", Boolean.class);
	public static final TypeTag BYTE = primitive("byte", Byte.class);
	public static final TypeTag SHORT = primitive("short", Short.class);
	public static final TypeTag INT = primitive("int", Integer.class);
	public static final TypeTag LONG = primitive("long", Long.class);
	public static final TypeTag FLOAT = primitive("float", Float.class);
	public static final TypeTag DOUBLE = primitive("double", Double.class);
	public static final TypeTag CHAR = primitive("char", Character.class);
	public static final TypeTag STRING = new TypeTag("string", Kind.STRING, String.class, null);

	private static final Map<Class<?>, TypeTag> BUILT_IN;

	static {
		Map<Class<?>, TypeTag> map = new HashMap<>();
		map.put(void.class, VOID);
		map.put(Void.class, VOID);
		map.put(boolean.class, BOOL);
		map.put(Boolean.class, BOOL);
		map.put(byte.class, BYTE);
		map.put(Byte.class, BYTE);
		map.put(short.class, SHORT);
		map.put(Short.class, SHORT);
		map.put(int.class, INT);
		map.put(Integer.class, INT);
		map.put(long.class, LONG);
		map.put(Long.class, LONG);
		map.put(float.class, FLOAT);
		map.put(Float.class, FLOAT);
		map.put(double.class, DOUBLE);
		map.put(Double.class, DOUBLE);
		map.put(char.class, CHAR);
		map.put(Character.class, CHAR);
		map.put(String.class, STRING);
		BUILT_IN = unmodifiableMap(map);
	}

	public enum Kind {
		VOID,
		/**
		 * A scalar that can never be null.
		 */
		PRIMITIVE,
		STRING,
		VECTOR,
		POINTER,
		OPAQUE
	}

	@NotNull private final String name;
	@NotNull private final Kind kind;
	@NotNull private final Class<?> carrierClass;
	@Nullable private final TypeTag elementTag;

	private TypeTag(@NotNull String name, @NotNull Kind kind, @NotNull Class<?> carrierClass, @Nullable TypeTag elementTag) {
		this.name = name;
		this.kind = kind;
		this.carrierClass = carrierClass;
		this.elementTag = elementTag;
	}

	private static TypeTag primitive(String name, Class<?> wrapper) {
		return new TypeTag(name, Kind.PRIMITIVE, wrapper, null);
	}

	public static TypeTag vectorOf(TypeTag element) {
		return new TypeTag("vector<" + element.name + ">", Kind.VECTOR, List.class, element);
	}

	public static TypeTag pointerTo(TypeTag pointee) {
		return new TypeTag(pointee.name + "*", Kind.POINTER, AtomicReference.class, pointee);
	}

	public static TypeTag of(TypeReference<?> ref) {
		return of(ref.reflectionType());
	}

	/**
	 * Primitive classes and their wrappers resolve to the same tag.
	 */
	public static TypeTag of(Type type) {
		if (type instanceof Class<?> c) {
			TypeTag builtIn = BUILT_IN.get(c);
			if (builtIn != null) {
				return builtIn;
			}
			return opaque(c.getName(), c);
		} else if (type instanceof ParameterizedType pt) {
			Class<?> raw = (Class<?>) pt.getRawType();
			Type argument = pt.getActualTypeArguments()[0];
			if (raw.equals(List.class)) {
				return vectorOf(of(argument));
			} else if (raw.equals(AtomicReference.class)) {
				return pointerTo(of(argument));
			} else {
				return opaque(pt.getTypeName(), raw);
			}
		} else if (type instanceof WildcardType w) {
			return opaque(w.getTypeName(), erasure(w.getUpperBounds()[0]));
		} else if (type instanceof TypeVariable<?> tv) {
			return opaque(tv.getTypeName(), erasure(tv.getBounds()[0]));
		} else if (type instanceof GenericArrayType gat) {
			return opaque(gat.getTypeName(), Object[].class);
		}
		throw new IllegalArgumentException("Unsupported type: " + type);
	}

	private static TypeTag opaque(String name, Class<?> carrier) {
		return new TypeTag(name, Kind.OPAQUE, carrier, null);
	}

	private static Class<?> erasure(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType pt) {
			return (Class<?>) pt.getRawType();
		} else {
			return Object.class;
		}
	}

	public String name() {
		return name;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * @return the class every non-null value with this tag is an instance of
	 */
	public Class<?> carrierClass() {
		return carrierClass;
	}

	/**
	 * @return the element tag of a vector, or the pointee tag of a pointer
	 * @throws IllegalStateException for any other kind of tag
	 */
	public TypeTag elementTag() {
		if (elementTag == null) {
			throw new IllegalStateException("Tag " + name + " has no element tag");
		}
		return elementTag;
	}

	public boolean isBuiltIn() {
		return kind != Kind.OPAQUE;
	}

	public boolean isNullable() {
		return kind != Kind.PRIMITIVE;
	}

	/**
	 * Checks the runtime shape of {@code value} against this tag.
	 * Vectors are checked element by element; pointers only by their carrier class.
	 */
	public boolean accepts(@Nullable Object value) {
		if (kind == Kind.VOID) {
			return value == null;
		} else if (value == null) {
			return isNullable();
		} else if (!carrierClass.isInstance(value)) {
			return false;
		} else if (kind == Kind.VECTOR) {
			TypeTag element = elementTag();
			for (Object e : (List<?>) value) {
				if (!element.accepts(e)) {
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return name.equals(((TypeTag) o).name);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(name);
	}

	@Override
	public String toString() {
		return name;
	}
}
