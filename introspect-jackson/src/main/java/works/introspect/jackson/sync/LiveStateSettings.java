package works.introspect.jackson.sync;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class LiveStateSettings {
	/**
	 * How often {@link LiveStateProtocolHandler#start} checks the target for changes.
	 */
	@Default long refreshIntervalMs = 1000;

	/**
	 * Whether state messages carry a {@code timestamp} field.
	 */
	@Default boolean includeTimestamps = true;

	/**
	 * Whether a successful update or method call is followed by a broadcast to every session.
	 * If false, only the periodic refresh propagates changes.
	 */
	@Default boolean broadcastAfterUpdate = true;

	public static final LiveStateSettings DEFAULT = LiveStateSettings.builder().build();
}
