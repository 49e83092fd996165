package works.introspect.example;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.introspect.Boxed;
import works.introspect.Reflective;
import works.introspect.exceptions.IntrospectionException;
import works.introspect.jackson.BoxedJsonCodec;
import works.introspect.jackson.binding.BoundClass;
import works.introspect.jackson.binding.JsonBindings;
import works.introspect.jackson.sync.LiveStateProtocolHandler;
import works.introspect.jackson.sync.LiveStateSession;
import works.introspect.jackson.sync.LiveStateSettings;

/**
 * Walks through the reflective API using {@link Person} and {@link Vehicle}.
 */
public final class IntrospectionDemo {
	private final ObjectMapper mapper = JsonMapper.builder().build();

	public static void main(String[] args) {
		new IntrospectionDemo().run();
	}

	void run() {
		Person person = new Person("Alice", 30, 1.65);

		LOGGER.info("=== Class introspection ===\n{}", person.describeClass());

		LOGGER.info("=== Member access ===");
		logMembers(person, "name", "age", "height");

		LOGGER.info("=== Member modification ===");
		person.setMemberValue("name", Boxed.of("Bob"));
		person.setMemberValue("age", Boxed.of(25));
		logMembers(person, "name", "age");

		LOGGER.info("=== Method invocation ===");
		LOGGER.info("Description: {}", person.callMethod("getDescription").asString());
		person.callMethod("setName", Boxed.of("Charlie"));
		person.callMethod("introduce");
		person.callMethod("setNameAndAge", Boxed.of("Toto"), Boxed.of(22));
		person.callMethod("introduce");
		person.callMethod("setNameAgeAndHeight", Boxed.of("Toto"), Boxed.of(22), Boxed.of(1.74));
		person.callMethod("introduce");

		LOGGER.info("=== Failed calls ===");
		attempt(() -> person.callMethod("setAge", Boxed.of("old")));
		attempt(() -> person.callMethod("setNameAndAge", Boxed.of("Zed")));
		attempt(() -> person.getMemberValue("weight"));

		LOGGER.info("=== Utility queries ===");
		LOGGER.info("Class name: {}", person.getClassName());
		LOGGER.info("Has 'name' member: {}", yesNo(person.hasMember("name")));
		LOGGER.info("Has 'weight' member: {}", yesNo(person.hasMember("weight")));
		LOGGER.info("Has 'introduce' method: {}", yesNo(person.hasMethod("introduce")));
		LOGGER.info("All members: {}", String.join(" ", person.getMemberNames()));
		LOGGER.info("All methods: {}", String.join(" ", person.getMethodNames()));

		LOGGER.info("=== JSON export ===");
		LOGGER.info("{}", person.toJSON());

		Vehicle vehicle = new Vehicle("Toyota", "Corolla", 2020);
		bindingDemo(person, vehicle);
		liveStateDemo(vehicle);
	}

	private void bindingDemo(Person person, Vehicle vehicle) {
		LOGGER.info("=== JSON bindings ===");
		JsonBindings bindings = new JsonBindings(JsonBindings.Settings.DEFAULT, new BoxedJsonCodec(mapper));
		bindings.bind(person.typeDescriptor());
		BoundClass vehicles = bindings.bind(vehicle.typeDescriptor());
		LOGGER.info("Schema: {}", mapper.writeValueAsString(bindings.schema()));

		vehicles.call(vehicle, "start", List.of());
		vehicles.call(vehicle, "drive", List.of(json("12.5")));
		vehicles.set(vehicle, "year", json("2021"));
		LOGGER.info("Vehicle info: {}", vehicles.call(vehicle, "getInfo", List.of()).asString());
		LOGGER.info("Vehicle as JSON: {}", vehicles.toJSON(vehicle));
	}

	LoggingSession liveStateDemo(Vehicle vehicle) {
		LOGGER.info("=== Live state ===");
		LiveStateProtocolHandler handler = new LiveStateProtocolHandler(vehicle,
			LiveStateSettings.builder().includeTimestamps(false).build(),
			new BoxedJsonCodec(mapper),
			Clock.systemUTC());
		LoggingSession browser = new LoggingSession("browser");
		handler.onOpen(browser);
		handler.onMessage(browser, "{\"type\":\"update\",\"field\":\"mileage\",\"value\":\"100.5\"}");
		handler.onMessage(browser, "{\"type\":\"method\",\"name\":\"stop\"}");
		handler.onMessage(browser, "{\"type\":\"method\",\"name\":\"getInfo\",\"args\":[]}");
		handler.onMessage(browser, "{\"type\":\"update\",\"field\":\"color\",\"value\":\"red\"}");
		handler.onMessage(browser, "{\"type\":\"ping\"}");
		handler.onClose(browser);
		return browser;
	}

	private JsonNode json(String text) {
		return mapper.readTree(text);
	}

	private static void logMembers(Reflective target, String... names) {
		for (String name : names) {
			LOGGER.info("{}", target.describeMember(name));
		}
	}

	private static void attempt(Runnable action) {
		try {
			action.run();
			LOGGER.warn("Expected a failure");
		} catch (IntrospectionException e) {
			LOGGER.info("Rejected: {}", e.getMessage());
		}
	}

	private static String yesNo(boolean value) {
		return value ? "yes" : "no";
	}

	/**
	 * Stands in for a WebSocket connection.
	 */
	static final class LoggingSession implements LiveStateSession {
		private final String id;
		private final List<String> received = new ArrayList<>();

		LoggingSession(String id) {
			this.id = id;
		}

		@Override
		public String id() {
			return id;
		}

		@Override
		public boolean isOpen() {
			return true;
		}

		@Override
		public synchronized void sendText(String message) {
			received.add(message);
			LOGGER.info("{} <- {}", id, message);
		}

		synchronized List<String> received() {
			return List.copyOf(received);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(IntrospectionDemo.class);
}
