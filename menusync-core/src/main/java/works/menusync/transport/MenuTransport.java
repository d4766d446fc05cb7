package works.menusync.transport;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import works.menusync.PropertyValue;

/**
 * The remote procedures a menu client needs, plus a way to hear about
 * changes on the remote side. Resolving the remote endpoint and encoding
 * values on the wire are the implementation's business.
 *
 * <p>
 * Returned futures may complete on any thread. A failed or timed-out call
 * completes its future exceptionally.
 */
public interface MenuTransport {
	/**
	 * <code>GetLayout</code>: the structure of the subtree under <code>parentId</code>
	 * along with the remote revision it reflects.
	 */
	CompletableFuture<LayoutReply> getLayout(int parentId);

	/**
	 * <code>GetGroupProperties</code>: properties for several nodes in one call.
	 *
	 * @param propertyNames the keys wanted; empty means all of them
	 * @return one entry per id the remote side could answer for, in any order
	 */
	CompletableFuture<List<NodeProperties>> getGroupProperties(List<Integer> ids, List<String> propertyNames);

	/**
	 * <code>Event</code>: tells the remote side something happened to a node, such as a click.
	 */
	CompletableFuture<Void> event(int id, String eventName, PropertyValue data, long timestamp);

	/**
	 * <code>AboutToShow</code>: the node's submenu is about to be displayed.
	 *
	 * @return whether the remote side changed the layout in response and a refresh is needed
	 */
	CompletableFuture<Boolean> aboutToShow(int id);

	/**
	 * Starts delivering notifications to <code>listener</code>.
	 * Closing the result stops them.
	 */
	AutoCloseable subscribe(RemoteMenuListener listener);
}
