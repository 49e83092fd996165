package works.introspect.exceptions;

public final class InvalidRegistrationException extends IntrospectionException {
	private final Class<?> containingClass;
	private final String name;

	public InvalidRegistrationException(Class<?> containingClass, String name, String message) {
		super(fullMessage(containingClass, name, message));
		this.containingClass = containingClass;
		this.name = name;
	}

	public InvalidRegistrationException(Class<?> containingClass, String name, String message, Throwable cause) {
		super(fullMessage(containingClass, name, message), cause);
		this.containingClass = containingClass;
		this.name = name;
	}

	public Class<?> containingClass() {
		return containingClass;
	}

	public String name() {
		return name;
	}

	private static String fullMessage(Class<?> containingClass, String name, String message) {
		return "Invalid registration " + containingClass.getSimpleName() + "." + name + ": " + message;
	}
}
