package works.introspect.jackson.sync;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.introspect.jackson.BoxedJsonCodec;
import works.introspect.jackson.Thermostat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveStateProtocolHandlerTest {
	static final long NOW = 1_700_000_000_000L;

	final ObjectMapper mapper = JsonMapper.builder().build();
	Thermostat thermostat;
	LiveStateProtocolHandler handler;
	RecordingSession alice;
	RecordingSession bob;

	static class RecordingSession implements LiveStateSession {
		final String id;
		final List<String> received = new ArrayList<>();
		boolean open = true;
		boolean failing = false;

		RecordingSession(String id) {
			this.id = id;
		}

		@Override
		public String id() {
			return id;
		}

		@Override
		public boolean isOpen() {
			return open;
		}

		@Override
		public synchronized void sendText(String message) throws IOException {
			if (failing) {
				throw new IOException("Connection reset");
			}
			received.add(message);
		}

		synchronized List<String> received() {
			return List.copyOf(received);
		}

		synchronized void clear() {
			received.clear();
		}
	}

	@BeforeEach
	void setup() {
		thermostat = new Thermostat();
		handler = new LiveStateProtocolHandler(
			thermostat,
			LiveStateSettings.DEFAULT,
			new BoxedJsonCodec(mapper),
			Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
		alice = new RecordingSession("alice");
		bob = new RecordingSession("bob");
		handler.onOpen(alice);
		handler.onOpen(bob);
		alice.clear();
		bob.clear();
	}

	JsonNode json(String text) {
		return mapper.readTree(text);
	}

	JsonNode lastMessage(RecordingSession session) {
		List<String> received = session.received();
		return json(received.get(received.size() - 1));
	}

	@Test
	void onOpen_sendsCurrentState() {
		RecordingSession carol = new RecordingSession("carol");
		handler.onOpen(carol);
		assertEquals(1, carol.received().size());
		JsonNode expected = json("""
			{
				"type": "state",
				"className": "Thermostat",
				"members": {
					"room": {"type": "string", "value": "kitchen"},
					"target": {"type": "int", "value": 20},
					"current": {"type": "double", "value": 18.5},
					"heating": {"type": "bool", "value": false},
					"schedule": {"type": "vector<string>", "value": ["06:00", "22:00"]}
				},
				"timestamp": 1700000000000
			}
			""");
		assertEquals(expected, lastMessage(carol));
		assertEquals(3, handler.sessionCount());
	}

	@Test
	void snapshot_omitsTypeAndTimestamp() {
		JsonNode snapshot = handler.snapshot();
		assertEquals("Thermostat", snapshot.get("className").asString());
		assertFalse(snapshot.has("type"));
		assertFalse(snapshot.has("timestamp"));
		assertEquals(handler.stateMessage().get("members"), snapshot.get("members"));
	}

	@Test
	void update_coercesStringAndBroadcasts() {
		handler.onMessage(alice, "{\"type\":\"update\",\"field\":\"target\",\"value\":\"23\"}");
		assertEquals(23, thermostat.getTarget());
		assertEquals(json("{\"type\":\"update_success\",\"field\":\"target\"}"), lastMessage(alice));
		assertEquals(2, alice.received().size(), "Broadcast state, then the reply");
		assertEquals("state", json(alice.received().get(0)).get("type").asString());
		assertEquals(1, bob.received().size());
		assertEquals(23, lastMessage(bob).get("members").get("target").get("value").intValue());
	}

	@Test
	void update_boolCoercion() {
		handler.onMessage(alice, "{\"type\":\"update\",\"field\":\"heating\",\"value\":\"1\"}");
		assertTrue(thermostat.heating());
		handler.onMessage(alice, "{\"type\":\"update\",\"field\":\"heating\",\"value\":\"no\"}");
		assertFalse(thermostat.heating());
	}

	@Test
	void update_nonStringValue_decodedStrictly() {
		handler.onMessage(alice, "{\"type\":\"update\",\"field\":\"current\",\"value\":19.5}");
		assertEquals(19.5, thermostat.current());
		handler.onMessage(alice, "{\"type\":\"update\",\"field\":\"schedule\",\"value\":[\"05:00\"]}");
		assertEquals(List.of("05:00"), thermostat.schedule());

		bob.clear();
		handler.onMessage(alice, "{\"type\":\"update\",\"field\":\"target\",\"value\":true}");
		assertEquals("error", lastMessage(alice).get("type").asString());
		assertEquals(20, thermostat.getTarget());
		assertTrue(bob.received().isEmpty(), "Failures are reported to the sender only");
	}

	@Test
	void update_unknownField_error() {
		handler.onMessage(alice, "{\"type\":\"update\",\"field\":\"humidity\",\"value\":\"40\"}");
		assertEquals(json("{\"type\":\"error\",\"message\":\"Unknown field: humidity\"}"), lastMessage(alice));
		assertTrue(bob.received().isEmpty());
	}

	@Test
	void update_unparseable_error() {
		handler.onMessage(alice, "{\"type\":\"update\",\"field\":\"target\",\"value\":\"warm\"}");
		JsonNode reply = lastMessage(alice);
		assertEquals("error", reply.get("type").asString());
		assertTrue(reply.get("message").asString().contains("warm"));
	}

	@Test
	void method_withArgs_returnsResult() {
		handler.onMessage(bob, "{\"type\":\"method\",\"name\":\"bump\",\"args\":[2]}");
		assertEquals(json("{\"type\":\"method_success\",\"method\":\"bump\",\"result\":22}"), lastMessage(bob));
		assertEquals(22, lastMessage(alice).get("members").get("target").get("value").intValue());
	}

	@Test
	void method_void_omitsResult() {
		handler.onMessage(bob, "{\"type\":\"method\",\"name\":\"configure\",\"args\":[\"attic\",\"15\",true]}");
		assertEquals(json("{\"type\":\"method_success\",\"method\":\"configure\"}"), lastMessage(bob));
		assertEquals("attic", thermostat.room());
		assertEquals(15, thermostat.getTarget());
	}

	@Test
	void method_argsOmitted_meansNoArgs() {
		thermostat.configure("den", 25, true);
		handler.onMessage(bob, "{\"type\":\"method\",\"name\":\"reset\"}");
		assertEquals("method_success", lastMessage(bob).get("type").asString());
		assertEquals(20, thermostat.getTarget());
	}

	@Test
	void method_failures_reportedAsErrors() {
		handler.onMessage(bob, "{\"type\":\"method\",\"name\":\"bump\",\"args\":[1,2]}");
		assertEquals("Incorrect number of arguments for method 'bump'. Expected 1, got 2",
			lastMessage(bob).get("message").asString());
		handler.onMessage(bob, "{\"type\":\"method\",\"name\":\"fly\"}");
		assertEquals("Method 'fly' not found in Thermostat", lastMessage(bob).get("message").asString());
		thermostat.room("");
		handler.onMessage(bob, "{\"type\":\"method\",\"name\":\"reset\",\"args\":[]}");
		assertEquals("error", lastMessage(bob).get("type").asString());
		assertEquals(20, thermostat.getTarget());
		assertTrue(alice.received().isEmpty());
	}

	@Test
	void ping_pong() {
		handler.onMessage(alice, "{\"type\":\"ping\"}");
		assertEquals(List.of("{\"type\":\"pong\"}"), alice.received());
	}

	@Test
	void malformedMessages_error() {
		handler.onMessage(alice, "not json");
		assertEquals("error", lastMessage(alice).get("type").asString());
		handler.onMessage(alice, "[1,2]");
		assertEquals("Message must be a JSON object", lastMessage(alice).get("message").asString());
		handler.onMessage(alice, "{\"field\":\"target\"}");
		assertEquals("Missing message type", lastMessage(alice).get("message").asString());
		handler.onMessage(alice, "{\"type\":\"teleport\"}");
		assertEquals("Unknown message type: teleport", lastMessage(alice).get("message").asString());
		assertEquals(4, alice.received().size());
	}

	@Test
	void broadcast_dropsClosedAndFailingSessions() {
		bob.open = false;
		handler.broadcastState();
		assertEquals(1, handler.sessionCount());
		assertEquals(1, alice.received().size());

		alice.failing = true;
		handler.broadcastState();
		assertEquals(0, handler.sessionCount());
	}

	@Test
	void onClose_stopsDelivery() {
		handler.onClose(bob);
		handler.broadcastState();
		assertTrue(bob.received().isEmpty());
		assertEquals(1, alice.received().size());
	}

	@Test
	void refreshIfChanged_onlyBroadcastsChanges() {
		assertTrue(handler.refreshIfChanged(), "Nothing has been broadcast yet");
		assertFalse(handler.refreshIfChanged());
		thermostat.bump(1);
		assertTrue(handler.refreshIfChanged());
		assertEquals(2, alice.received().size());
		assertEquals(21, lastMessage(alice).get("members").get("target").get("value").intValue());
	}

	@Test
	void noBroadcastAfterUpdate_whenDisabled() {
		LiveStateProtocolHandler quiet = new LiveStateProtocolHandler(thermostat,
			LiveStateSettings.builder().broadcastAfterUpdate(false).includeTimestamps(false).build());
		quiet.onOpen(alice);
		quiet.onOpen(bob);
		assertFalse(lastMessage(alice).has("timestamp"));
		bob.clear();
		quiet.onMessage(alice, "{\"type\":\"update\",\"field\":\"target\",\"value\":30}");
		assertEquals(30, thermostat.getTarget());
		assertTrue(bob.received().isEmpty());
		assertTrue(quiet.refreshIfChanged());
		assertEquals(1, bob.received().size());
	}

	@Test
	void start_refreshesPeriodically() throws Exception {
		ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
		try {
			LiveStateProtocolHandler fast = new LiveStateProtocolHandler(thermostat,
				LiveStateSettings.DEFAULT.toBuilder().refreshIntervalMs(10).build());
			fast.onOpen(alice);
			alice.clear();
			thermostat.bump(5);
			ScheduledFuture<?> future = fast.start(executor);
			long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
			while (alice.received().isEmpty() && System.nanoTime() < deadline) {
				Thread.sleep(10);
			}
			future.cancel(false);
			assertFalse(alice.received().isEmpty());
			assertEquals(25, lastMessage(alice).get("members").get("target").get("value").intValue());
		} finally {
			executor.shutdownNow();
		}
	}
}
