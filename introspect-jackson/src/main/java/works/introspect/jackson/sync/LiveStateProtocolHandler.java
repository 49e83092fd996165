package works.introspect.jackson.sync;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.JsonNodeType;
import tools.jackson.databind.node.ObjectNode;
import works.introspect.Boxed;
import works.introspect.MethodDescriptor;
import works.introspect.Reflective;
import works.introspect.exceptions.ArityMismatchException;
import works.introspect.exceptions.IntrospectionException;
import works.introspect.jackson.BoxedJsonCodec;
import works.introspect.types.TypeTag;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Keeps any number of {@link LiveStateSession sessions} in sync with one {@link Reflective} target.
 * <p>
 * Inbound messages are JSON objects distinguished by their {@code type}:
 * <ul>
 *     <li>{@code {"type":"update","field":f,"value":v}} sets a member.
 *         A JSON string value is parsed according to the member's tag;
 *         any other JSON value must already have the right kind.</li>
 *     <li>{@code {"type":"method","name":n,"args":[...]}} calls a method; {@code args} may be omitted.</li>
 *     <li>{@code {"type":"ping"}} is answered with {@code {"type":"pong"}}.</li>
 * </ul>
 * Failures are reported as {@code {"type":"error","message":...}} to the sending session only.
 * <p>
 * The handler serializes all its access to the target,
 * because sessions may deliver messages on different threads.
 * Code that modifies the target by other means should call {@link #refreshIfChanged()} afterward,
 * or rely on the periodic refresh set up by {@link #start}.
 */
public class LiveStateProtocolHandler {
	private final Reflective target;
	private final LiveStateSettings settings;
	private final BoxedJsonCodec codec;
	private final ObjectMapper mapper;
	private final Clock clock;
	private final Map<String, LiveStateSession> sessions = new ConcurrentHashMap<>();
	private final Object targetLock = new Object();
	@Nullable private JsonNode lastBroadcastMembers; // Guarded by targetLock

	public LiveStateProtocolHandler(Reflective target, LiveStateSettings settings) {
		this(target, settings, new BoxedJsonCodec(), Clock.systemUTC());
	}

	public LiveStateProtocolHandler(Reflective target, LiveStateSettings settings, BoxedJsonCodec codec, Clock clock) {
		this.target = requireNonNull(target);
		this.settings = requireNonNull(settings);
		this.codec = requireNonNull(codec);
		this.mapper = codec.mapper();
		this.clock = requireNonNull(clock);
	}

	public void onOpen(LiveStateSession session) {
		sessions.put(session.id(), session);
		LOGGER.debug("Session {} opened; {} open", session.id(), sessions.size());
		send(session, stateMessage());
	}

	public void onClose(LiveStateSession session) {
		sessions.remove(session.id());
		LOGGER.debug("Session {} closed; {} open", session.id(), sessions.size());
	}

	public int sessionCount() {
		return sessions.size();
	}

	public void onMessage(LiveStateSession session, String text) {
		ObjectNode reply;
		try {
			JsonNode message = mapper.readTree(text);
			if (message == null || !message.isObject()) {
				reply = error("Message must be a JSON object");
			} else {
				reply = dispatch(message);
			}
		} catch (IntrospectionException | JacksonException e) {
			LOGGER.debug("Session {} sent a message that failed", session.id(), e);
			reply = error(e.getMessage());
		}
		send(session, reply);
	}

	private ObjectNode dispatch(JsonNode message) {
		String type = stringField(message, "type");
		if (type == null) {
			return error("Missing message type");
		}
		return switch (type) {
			case "update" -> handleUpdate(message);
			case "method" -> handleMethod(message);
			case "ping" -> reply("pong");
			default -> error("Unknown message type: " + type);
		};
	}

	private ObjectNode handleUpdate(JsonNode message) {
		String field = stringField(message, "field");
		if (field == null) {
			return error("Update needs a field name");
		}
		JsonNode value = message.get("value");
		if (value == null) {
			return error("Update needs a value");
		}
		synchronized (targetLock) {
			if (!target.hasMember(field)) {
				return error("Unknown field: " + field);
			}
			TypeTag tag = target.typeDescriptor().member(field).tag();
			target.setMemberValue(field, decode(tag, value));
		}
		if (settings.isBroadcastAfterUpdate()) {
			broadcastState();
		}
		ObjectNode result = reply("update_success");
		result.put("field", field);
		return result;
	}

	private ObjectNode handleMethod(JsonNode message) {
		String name = stringField(message, "name");
		if (name == null) {
			return error("Method call needs a method name");
		}
		JsonNode argsNode = message.get("args");
		List<JsonNode> args = new ArrayList<>();
		if (argsNode != null && !argsNode.isNull()) {
			if (!argsNode.isArray()) {
				return error("Method arguments must be an array");
			}
			for (int i = 0; i < argsNode.size(); i++) {
				args.add(argsNode.get(i));
			}
		}
		Boxed result;
		synchronized (targetLock) {
			MethodDescriptor method = target.typeDescriptor().method(name);
			if (args.size() != method.arity()) {
				throw new ArityMismatchException(name, method.arity(), args.size());
			}
			List<Boxed> boxedArgs = new ArrayList<>(args.size());
			for (int i = 0; i < args.size(); i++) {
				boxedArgs.add(decode(method.parameterTypes().get(i), args.get(i)));
			}
			result = target.callMethod(name, boxedArgs);
		}
		if (settings.isBroadcastAfterUpdate()) {
			broadcastState();
		}
		ObjectNode response = reply("method_success");
		response.put("method", name);
		if (!result.isEmpty()) {
			response.set("result", codec.encode(result));
		}
		return response;
	}

	private Boxed decode(TypeTag tag, JsonNode value) {
		if (value != null && value.getNodeType() == JsonNodeType.STRING) {
			return codec.coerce(tag, value.asString());
		} else {
			return codec.decode(tag, value);
		}
	}

	/**
	 * {@code {"className":..,"members":{name:{"type":tag,"value":v},...}}}
	 */
	public ObjectNode snapshot() {
		ObjectNode result = mapper.createObjectNode();
		result.put("className", target.getClassName());
		result.set("members", members());
		return result;
	}

	/**
	 * The {@link #snapshot()} with {@code "type":"state"} and, if enabled, a {@code timestamp} in milliseconds.
	 */
	public ObjectNode stateMessage() {
		return stateMessage(members());
	}

	private ObjectNode stateMessage(JsonNode members) {
		ObjectNode result = reply("state");
		result.put("className", target.getClassName());
		result.set("members", members);
		if (settings.isIncludeTimestamps()) {
			result.put("timestamp", clock.millis());
		}
		return result;
	}

	private ObjectNode members() {
		ObjectNode members = mapper.createObjectNode();
		synchronized (targetLock) {
			for (String name : target.getMemberNames()) {
				Boxed value = target.getMemberValue(name);
				ObjectNode entry = members.putObject(name);
				entry.put("type", value.tag().name());
				entry.set("value", codec.encode(value));
			}
		}
		return members;
	}

	/**
	 * Sends the current state to every open session.
	 * Sessions that are closed, or whose send fails, are dropped.
	 */
	public void broadcastState() {
		ObjectNode members;
		synchronized (targetLock) {
			members = members();
			lastBroadcastMembers = members;
		}
		broadcast(stateMessage(members));
	}

	/**
	 * @return true if the members changed since the last broadcast, in which case they have now been broadcast
	 */
	public boolean refreshIfChanged() {
		ObjectNode members;
		synchronized (targetLock) {
			members = members();
			if (members.equals(lastBroadcastMembers)) {
				return false;
			}
			lastBroadcastMembers = members;
		}
		LOGGER.debug("Target changed; broadcasting to {} session(s)", sessions.size());
		broadcast(stateMessage(members));
		return true;
	}

	/**
	 * Calls {@link #refreshIfChanged()} every {@link LiveStateSettings#getRefreshIntervalMs() refreshIntervalMs}.
	 * Cancel the returned future to stop.
	 */
	public ScheduledFuture<?> start(ScheduledExecutorService executor) {
		long interval = settings.getRefreshIntervalMs();
		return executor.scheduleAtFixedRate(this::refreshInBackground, interval, interval, MILLISECONDS);
	}

	private void refreshInBackground() {
		try {
			refreshIfChanged();
		} catch (RuntimeException e) {
			// Propagating would cancel all future refreshes
			LOGGER.warn("Periodic refresh failed", e);
		}
	}

	private void broadcast(ObjectNode message) {
		String text = mapper.writeValueAsString(message);
		sessions.values().removeIf(session -> {
			if (!session.isOpen()) {
				LOGGER.debug("Dropping closed session {}", session.id());
				return true;
			}
			return !sendText(session, text);
		});
	}

	private void send(LiveStateSession session, ObjectNode message) {
		sendText(session, mapper.writeValueAsString(message));
	}

	/**
	 * @return false if the send failed
	 */
	private boolean sendText(LiveStateSession session, String text) {
		try {
			synchronized (session) {
				session.sendText(text);
			}
			return true;
		} catch (IOException e) {
			LOGGER.warn("Unable to send to session {}; dropping it", session.id(), e);
			sessions.remove(session.id());
			return false;
		}
	}

	private ObjectNode reply(String type) {
		ObjectNode result = mapper.createObjectNode();
		result.put("type", type);
		return result;
	}

	private ObjectNode error(String message) {
		ObjectNode result = reply("error");
		result.put("message", message);
		return result;
	}

	@Nullable
	private static String stringField(JsonNode message, String name) {
		JsonNode node = message.get(name);
		if (node == null || node.getNodeType() != JsonNodeType.STRING) {
			return null;
		}
		return node.asString();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LiveStateProtocolHandler.class);
}
