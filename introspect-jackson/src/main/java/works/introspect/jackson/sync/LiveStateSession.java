package works.introspect.jackson.sync;

import java.io.IOException;

/**
 * One client connection, as seen by {@link LiveStateProtocolHandler}.
 * A host server (WebSocket, server-sent events, and so on) adapts its own connection objects to this.
 */
public interface LiveStateSession {
	String id();

	boolean isOpen();

	/**
	 * @throws IOException if the message could not be delivered; the handler then drops the session
	 */
	void sendText(String message) throws IOException;
}
