package works.introspect.exceptions;

public final class ArityMismatchException extends IntrospectionException {
	private final String methodName;
	private final int expected;
	private final int actual;

	public ArityMismatchException(String methodName, int expected, int actual) {
		super("Incorrect number of arguments for method '" + methodName
			+ "'. Expected " + expected + ", got " + actual);
		this.methodName = methodName;
		this.expected = expected;
		this.actual = actual;
	}

	public String methodName() {
		return methodName;
	}

	public int expected() {
		return expected;
	}

	public int actual() {
		return actual;
	}
}
