package works.menusync;

import java.util.Optional;

/**
 * Notifications for whatever presents the mirrored menu.
 * Listeners only ever see {@link MenuNode#isRealized() realized} nodes,
 * with one exception: {@link #rootChanged} announces the new root as soon as
 * it exists, because the presentation needs a place to hang its children.
 *
 * <p>
 * All methods are called on the session's event loop, and all have empty defaults.
 */
public interface SessionListener {
	/**
	 * The root node was replaced. <code>newRoot</code> is null when the tree was dropped.
	 */
	default void rootChanged(MenuNode newRoot) { }

	/**
	 * A layout refresh finished, or the tree was dropped.
	 */
	default void layoutUpdated() { }

	/**
	 * A node was realized and no {@link TypeHandler} claimed it.
	 */
	default void newNode(MenuNode node) { }

	/**
	 * A realized node joined <code>parent</code>'s children at <code>position</code>.
	 */
	default void childAdded(MenuNode parent, MenuNode child, int position) { }

	/**
	 * A realized node was removed from <code>parent</code>, along with its descendants.
	 */
	default void childRemoved(MenuNode parent, MenuNode child) { }

	/**
	 * A realized node changed position among its siblings.
	 */
	default void childMoved(MenuNode parent, MenuNode child, int newPosition, int oldPosition) { }

	/**
	 * A property of a realized node changed. <code>newValue</code> is empty if the property was removed.
	 */
	default void propertyChanged(MenuNode node, String key, Optional<PropertyValue> newValue) { }

	/**
	 * The remote side asked for <code>node</code> to be activated.
	 */
	default void itemActivationRequested(MenuNode node, long timestamp) { }

	/**
	 * An event sent with {@link SyncSession#sendEvent} got its reply.
	 *
	 * @param error null if the remote side accepted the event
	 */
	default void eventResult(MenuNode node, String eventName, PropertyValue data, long timestamp, Throwable error) { }
}
