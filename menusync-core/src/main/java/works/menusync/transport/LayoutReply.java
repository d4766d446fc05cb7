package works.menusync.transport;

import static java.util.Objects.requireNonNull;

/**
 * @param revision the remote side's revision number at the time the layout was taken
 */
public record LayoutReply(
	long revision,
	LayoutDescription layout
) {
	public LayoutReply {
		requireNonNull(layout);
	}
}
