package works.menusync.transport;

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Property keys the remote side dropped from one node.
 */
public record RemovedProperties(
	int id,
	Set<String> keys
) {
	public RemovedProperties {
		keys = Set.copyOf(requireNonNull(keys));
	}
}
