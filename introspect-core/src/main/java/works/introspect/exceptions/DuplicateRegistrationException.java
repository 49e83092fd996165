package works.introspect.exceptions;

/**
 * Raised when a name is registered twice and the active policy rejects duplicates,
 * or when a type that already has a descriptor is registered again explicitly.
 */
public final class DuplicateRegistrationException extends IntrospectionException {
	private final String owner;
	private final String name;

	public DuplicateRegistrationException(String owner, String name, String message) {
		super("Duplicate registration of " + owner + "." + name + ": " + message);
		this.owner = owner;
		this.name = name;
	}

	public String owner() {
		return owner;
	}

	public String name() {
		return name;
	}
}
