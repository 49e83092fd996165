package works.introspect.exceptions;

/**
 * The underlying method or accessor threw.
 * The original exception is available as the {@link #getCause() cause}.
 */
public final class InvocationFailedException extends IntrospectionException {
	private final String name;

	public InvocationFailedException(String name, Throwable cause) {
		super("Invocation of '" + name + "' failed: " + cause, cause);
		this.name = name;
	}

	public String name() {
		return name;
	}
}
