package works.introspect.jackson.binding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.node.ObjectNode;
import works.introspect.TypeDescriptor;
import works.introspect.TypeRegistry;
import works.introspect.exceptions.DuplicateRegistrationException;
import works.introspect.jackson.BoxedJsonCodec;

import static java.util.Objects.requireNonNull;

/**
 * Exposes registered classes to JSON clients, by class name.
 */
public final class JsonBindings {
	private final Settings settings;
	private final BoxedJsonCodec codec;
	private final Map<String, BoundClass> classes = new LinkedHashMap<>();

	/**
	 * @param suppressAccessorMethods if true, methods named {@code getX}, {@code setX} or {@code isX}
	 *                                aren't callable when {@code x} is a member, since the member's
	 *                                property already covers them
	 */
	public record Settings(
		boolean suppressAccessorMethods
	) {
		public static final Settings DEFAULT = new Settings(true);
	}

	public JsonBindings() {
		this(Settings.DEFAULT, new BoxedJsonCodec());
	}

	public JsonBindings(Settings settings, BoxedJsonCodec codec) {
		this.settings = requireNonNull(settings);
		this.codec = requireNonNull(codec);
	}

	/**
	 * @throws DuplicateRegistrationException if a class of the same name is already bound
	 */
	public synchronized BoundClass bind(TypeDescriptor descriptor) {
		String className = descriptor.className();
		if (classes.containsKey(className)) {
			throw new DuplicateRegistrationException("bindings", className, "class name is already bound");
		}
		BoundClass result = new BoundClass(descriptor, codec, settings);
		classes.put(className, result);
		LOGGER.debug("Bound {} with properties {} and callables {}",
			className,
			result.properties().stream().map(BoundClass.Property::name).toList(),
			result.callables().stream().map(BoundClass.Callable::name).toList());
		return result;
	}

	public <C> BoundClass bind(TypeRegistry registry, Class<C> type, TypeRegistry.Registration<C> registration) {
		return bind(registry.descriptorFor(type, registration));
	}

	public synchronized Optional<BoundClass> find(String className) {
		return Optional.ofNullable(classes.get(className));
	}

	public synchronized List<String> classNames() {
		return List.copyOf(classes.keySet());
	}

	/**
	 * @return {@code {"Person": <schema>, ...}}; see {@link BoundClass#schema()}
	 */
	public synchronized ObjectNode schema() {
		ObjectNode result = codec.mapper().createObjectNode();
		classes.forEach((name, bound) -> result.set(name, bound.schema()));
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonBindings.class);
}
