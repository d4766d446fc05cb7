package works.menusync.transport;

import java.util.Map;
import works.menusync.PropertyValue;

import static java.util.Objects.requireNonNull;

/**
 * One entry of a {@link MenuTransport#getGroupProperties} reply, or of a bulk
 * {@link RemoteMenuListener#itemPropertiesUpdated} notification.
 */
public record NodeProperties(
	int id,
	Map<String, PropertyValue> properties
) {
	public NodeProperties {
		properties = Map.copyOf(requireNonNull(properties));
	}
}
