package works.menusync.transport;

import java.util.List;
import works.menusync.PropertyValue;

/**
 * Notifications a {@link MenuTransport} delivers from the remote side.
 */
public interface RemoteMenuListener {
	/**
	 * The remote endpoint appeared on the bus, or came back after vanishing.
	 */
	void remoteAppeared();

	/**
	 * The remote endpoint is gone.
	 */
	void remoteVanished();

	/**
	 * <code>LayoutUpdated</code>: the structure changed and the remote revision is now <code>revision</code>.
	 */
	void layoutUpdated(long revision, int parentId);

	/**
	 * <code>ItemPropertyUpdated</code>: one property changed; the new value comes with the notification.
	 */
	void itemPropertyUpdated(int id, String key, PropertyValue value);

	/**
	 * <code>ItemsPropertiesUpdated</code>: bulk property changes and removals.
	 */
	void itemPropertiesUpdated(List<NodeProperties> updated, List<RemovedProperties> removed);

	/**
	 * <code>ItemUpdated</code>: something about this node changed; refetch its properties.
	 */
	void itemUpdated(int id);

	/**
	 * <code>ItemActivationRequested</code>: the remote side wants this node activated.
	 */
	void itemActivationRequested(int id, long timestamp);
}
