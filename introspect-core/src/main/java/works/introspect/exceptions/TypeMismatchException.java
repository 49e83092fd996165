package works.introspect.exceptions;

/**
 * A boxed value does not carry the exact type that was requested.
 * There is no coercion: an {@code int} is never accepted where a {@code double} is expected.
 */
public final class TypeMismatchException extends IntrospectionException {
	private final String expectedTag;
	private final String actualTag;

	public TypeMismatchException(String expectedTag, String actualTag, String context) {
		super(context + ": expected " + expectedTag + " but got " + actualTag);
		this.expectedTag = expectedTag;
		this.actualTag = actualTag;
	}

	public TypeMismatchException(String expectedTag, String actualTag, String context, Throwable cause) {
		super(context + ": expected " + expectedTag + " but got " + actualTag, cause);
		this.expectedTag = expectedTag;
		this.actualTag = actualTag;
	}

	public String expectedTag() {
		return expectedTag;
	}

	public String actualTag() {
		return actualTag;
	}
}
