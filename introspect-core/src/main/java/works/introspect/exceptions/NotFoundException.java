package works.introspect.exceptions;

/**
 * A member or method name is absent from a type's descriptor.
 */
public final class NotFoundException extends IntrospectionException {
	private final Kind kind;
	private final String className;
	private final String name;

	public enum Kind { MEMBER, METHOD }

	public NotFoundException(Kind kind, String className, String name) {
		super(fullMessage(kind, className, name));
		this.kind = kind;
		this.className = className;
		this.name = name;
	}

	public Kind kind() {
		return kind;
	}

	public String className() {
		return className;
	}

	public String name() {
		return name;
	}

	private static String fullMessage(Kind kind, String className, String name) {
		String noun = (kind == Kind.MEMBER) ? "Member" : "Method";
		return noun + " '" + name + "' not found in " + className;
	}
}
