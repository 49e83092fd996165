package works.introspect;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.introspect.exceptions.DuplicateRegistrationException;

import static java.util.Objects.requireNonNull;

/**
 * Holds at most one {@link TypeDescriptor} per class.
 * <p>
 * Descriptors are built either lazily by {@link #descriptorFor} on first access,
 * or eagerly by {@link #register} during startup.
 * A type's registration runs at most once per successful publication,
 * even when several threads ask for it at the same time.
 * Published descriptors are immutable and may be shared without locking.
 */
public final class TypeRegistry {
	private final Settings settings;
	private final ConcurrentMap<Class<?>, TypeDescriptor> descriptors = new ConcurrentHashMap<>();

	private static final TypeRegistry GLOBAL = new TypeRegistry(Settings.DEFAULT);

	/**
	 * @param duplicatePolicy what happens when one type registers the same member or method name twice
	 */
	public record Settings(
		DuplicatePolicy duplicatePolicy
	) {
		public Settings {
			requireNonNull(duplicatePolicy);
		}

		public static final Settings DEFAULT = new Settings(DuplicatePolicy.REPLACE);
	}

	public enum DuplicatePolicy {
		/**
		 * The last registration wins; the name keeps the position of its first registration.
		 */
		REPLACE,

		/**
		 * The second registration throws {@link DuplicateRegistrationException}.
		 */
		REJECT,
	}

	@FunctionalInterface
	public interface Registration<C> {
		void registerWith(Registrar<C> registrar);
	}

	public TypeRegistry() {
		this(Settings.DEFAULT);
	}

	public TypeRegistry(Settings settings) {
		this.settings = requireNonNull(settings);
	}

	/**
	 * The registry used by types that don't specify one.
	 */
	public static TypeRegistry global() {
		return GLOBAL;
	}

	public Settings settings() {
		return settings;
	}

	/**
	 * Returns the descriptor for {@code type}, running {@code registration} first if there isn't one yet.
	 * Concurrent first calls for the same type run {@code registration} once; the others wait for its result.
	 * If {@code registration} throws, nothing is published and a later call will try again.
	 * <p>
	 * {@code registration} must not itself ask this registry for a descriptor.
	 */
	public <C> TypeDescriptor descriptorFor(Class<C> type, Registration<C> registration) {
		TypeDescriptor existing = descriptors.get(type);
		if (existing != null) {
			return existing;
		}
		return descriptors.computeIfAbsent(type, t -> {
			TypeDescriptor built = build(type, registration);
			LOGGER.debug("Published {}", built);
			return built;
		});
	}

	/**
	 * Eagerly builds and publishes the descriptor for {@code type}.
	 *
	 * @throws DuplicateRegistrationException if {@code type} already has a descriptor
	 */
	public <C> TypeDescriptor register(Class<C> type, Registration<C> registration) {
		TypeDescriptor candidate = build(type, registration);
		if (descriptors.putIfAbsent(type, candidate) != null) {
			throw new DuplicateRegistrationException(type.getName(), candidate.className(), "type is already registered");
		}
		LOGGER.info("Registered {}", candidate);
		return candidate;
	}

	public Optional<TypeDescriptor> find(Class<?> type) {
		return Optional.ofNullable(descriptors.get(type));
	}

	public boolean isRegistered(Class<?> type) {
		return descriptors.containsKey(type);
	}

	public Set<Class<?>> registeredTypes() {
		return Set.copyOf(descriptors.keySet());
	}

	private <C> TypeDescriptor build(Class<C> type, Registration<C> registration) {
		Registrar<C> registrar = new Registrar<>(type, settings.duplicatePolicy());
		registration.registerWith(registrar);
		return registrar.build();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);
}
