package works.introspect.types;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Super-type token for generic types whose tags can't be obtained from a {@link Class}:
 * <pre>{@code
 * TypeTag tag = TypeTag.of(new TypeReference<List<Integer>>() {});  // vector<int>
 * }</pre>
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	public Type reflectionType() {
		Type superclass = getClass().getGenericSuperclass();
		if (superclass instanceof ParameterizedType pt) {
			return pt.getActualTypeArguments()[0];
		} else {
			throw new IllegalStateException("TypeReference must be subclassed with a type argument: " + getClass());
		}
	}
}
