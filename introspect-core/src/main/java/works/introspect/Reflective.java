package works.introspect;

import java.io.PrintStream;
import java.util.List;
import works.introspect.exceptions.ArityMismatchException;
import works.introspect.exceptions.InvocationFailedException;
import works.introspect.exceptions.NotFoundException;
import works.introspect.exceptions.TypeMismatchException;

/**
 * Name-based access to the registered members and methods of an object.
 * <p>
 * A class becomes reflective by implementing {@link #typeDescriptor()},
 * typically by asking a {@link TypeRegistry} for its descriptor:
 *
 * <pre>{@code
 * public TypeDescriptor typeDescriptor() {
 *     return TypeRegistry.global().descriptorFor(Person.class, Person::register);
 * }
 * }</pre>
 *
 * Objects of classes that can't implement this interface can be adapted with {@link Reflection#of}.
 * <p>
 * None of these operations lock anything.
 * Concurrent reflective calls on one instance need the same care as concurrent direct calls.
 */
public interface Reflective {
	TypeDescriptor typeDescriptor();

	/**
	 * The object the descriptor's handles operate on.
	 */
	default Object reflectionTarget() {
		return this;
	}

	/**
	 * @throws NotFoundException if there's no such member
	 */
	default Boxed getMemberValue(String name) {
		return typeDescriptor().member(name).get(reflectionTarget());
	}

	/**
	 * @throws NotFoundException if there's no such member
	 * @throws TypeMismatchException if {@code value} isn't tagged exactly as the member is
	 */
	default void setMemberValue(String name, Boxed value) {
		typeDescriptor().member(name).set(reflectionTarget(), value);
	}

	default Boxed callMethod(String name) {
		return callMethod(name, List.of());
	}

	default Boxed callMethod(String name, Boxed... args) {
		return callMethod(name, List.of(args));
	}

	/**
	 * @return the result, or {@link Boxed#empty()} for {@code void} methods
	 * @throws NotFoundException if there's no such method
	 * @throws ArityMismatchException if {@code args} has the wrong length
	 * @throws TypeMismatchException if any argument has the wrong tag
	 * @throws InvocationFailedException if the method itself throws
	 */
	default Boxed callMethod(String name, List<Boxed> args) {
		return typeDescriptor().method(name).invoke(reflectionTarget(), args);
	}

	default List<String> getMemberNames() {
		return typeDescriptor().memberNames();
	}

	default List<String> getMethodNames() {
		return typeDescriptor().methodNames();
	}

	default boolean hasMember(String name) {
		return typeDescriptor().hasMember(name);
	}

	default boolean hasMethod(String name) {
		return typeDescriptor().hasMethod(name);
	}

	default String getClassName() {
		return typeDescriptor().className();
	}

	/**
	 * @see JsonExport
	 */
	default String toJSON() {
		return JsonExport.toJson(typeDescriptor(), reflectionTarget());
	}

	/**
	 * @throws NotFoundException if there's no such member
	 */
	default String describeMember(String name) {
		return Descriptions.describeMember(typeDescriptor(), reflectionTarget(), name);
	}

	default String describeClass() {
		return Descriptions.describeClass(typeDescriptor());
	}

	default void printClassInfo(PrintStream out) {
		out.print(describeClass());
	}
}
