package works.menusync.transport;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The structure of a remote menu subtree as returned by {@link MenuTransport#getLayout}:
 * node ids and child order only. Properties are fetched separately.
 */
public record LayoutDescription(
	int id,
	List<LayoutDescription> children
) {
	public LayoutDescription {
		children = List.copyOf(requireNonNull(children));
	}

	public static LayoutDescription leaf(int id) {
		return new LayoutDescription(id, List.of());
	}

	public static LayoutDescription node(int id, LayoutDescription... children) {
		return new LayoutDescription(id, List.of(children));
	}
}
