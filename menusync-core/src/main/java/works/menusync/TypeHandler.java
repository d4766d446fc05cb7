package works.menusync;

/**
 * Gets first look at each newly realized node whose {@link MenuNode#type() type}
 * matches the tag it was {@link TypeHandlerRegistry#register registered} under.
 */
@FunctionalInterface
public interface TypeHandler {
	/**
	 * Called once per node, after its initial properties have arrived and before
	 * any {@link SessionListener} hears about it.
	 *
	 * @param parent null for the root
	 * @return true if the handler took care of the node, which suppresses
	 * {@link SessionListener#newNode}
	 */
	boolean onNewNode(MenuNode node, MenuNode parent, SyncSession session);

	/**
	 * Called when the handler is removed, normally when the session closes.
	 * Release anything attached to nodes here.
	 */
	default void release() { }
}
