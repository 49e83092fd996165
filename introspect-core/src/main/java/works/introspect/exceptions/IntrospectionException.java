package works.introspect.exceptions;

/**
 * Root of every failure raised by the introspection engine.
 * <p>
 * All failures are unchecked and surface synchronously to the immediate caller.
 * The engine never retries or swallows them.
 */
public sealed abstract class IntrospectionException extends RuntimeException permits
	ArityMismatchException,
	DuplicateRegistrationException,
	InvalidRegistrationException,
	InvocationFailedException,
	NotFoundException,
	TypeMismatchException
{
	protected IntrospectionException(String message) {
		super(message);
	}

	protected IntrospectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
