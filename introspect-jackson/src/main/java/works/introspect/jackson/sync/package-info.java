/**
 * Live editing of one reflective object by any number of remote clients,
 * independent of the transport that carries the messages.
 *
 * <p>
 * Clients send {@code update}, {@code method} and {@code ping} messages;
 * the {@link works.introspect.jackson.sync.LiveStateProtocolHandler handler} applies them
 * and broadcasts the resulting state to every open session.
 */
package works.introspect.jackson.sync;
