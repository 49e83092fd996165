package works.introspect;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.introspect.exceptions.NotFoundException;

import static java.util.Collections.unmodifiableMap;
import static works.introspect.exceptions.NotFoundException.Kind.MEMBER;
import static works.introspect.exceptions.NotFoundException.Kind.METHOD;

/**
 * The reflective catalog of one registered type.
 * Built once by a {@link Registrar} and immutable afterward;
 * names enumerate in the order they were first registered.
 */
public final class TypeDescriptor {
	private final Class<?> type;
	private final String className;
	private final Map<String, MemberDescriptor> members;
	private final Map<String, MethodDescriptor> methods;

	/**
	 * @param members must iterate in registration order, and must not be modified afterward
	 * @param methods must iterate in registration order, and must not be modified afterward
	 */
	TypeDescriptor(Class<?> type, String className, Map<String, MemberDescriptor> members, Map<String, MethodDescriptor> methods) {
		this.type = type;
		this.className = className;
		this.members = unmodifiableMap(members);
		this.methods = unmodifiableMap(methods);
	}

	public Class<?> type() {
		return type;
	}

	public String className() {
		return className;
	}

	public Optional<MemberDescriptor> findMember(String name) {
		return Optional.ofNullable(members.get(name));
	}

	public Optional<MethodDescriptor> findMethod(String name) {
		return Optional.ofNullable(methods.get(name));
	}

	/**
	 * @throws NotFoundException if there's no member called {@code name}
	 */
	public MemberDescriptor member(String name) {
		MemberDescriptor result = members.get(name);
		if (result == null) {
			throw new NotFoundException(MEMBER, className, name);
		}
		return result;
	}

	/**
	 * @throws NotFoundException if there's no method called {@code name}
	 */
	public MethodDescriptor method(String name) {
		MethodDescriptor result = methods.get(name);
		if (result == null) {
			throw new NotFoundException(METHOD, className, name);
		}
		return result;
	}

	public boolean hasMember(String name) {
		return members.containsKey(name);
	}

	public boolean hasMethod(String name) {
		return methods.containsKey(name);
	}

	public List<String> memberNames() {
		return List.copyOf(members.keySet());
	}

	public List<String> methodNames() {
		return List.copyOf(methods.keySet());
	}

	public Collection<MemberDescriptor> members() {
		return members.values();
	}

	public Collection<MethodDescriptor> methods() {
		return methods.values();
	}

	@Override
	public String toString() {
		return "TypeDescriptor(" + className + ", members=" + members.keySet() + ", methods=" + methods.keySet() + ")";
	}
}
