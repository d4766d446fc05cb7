package works.menusync.reconcile;

import works.menusync.MenuNode;

/**
 * Where {@link TreeReconciler} sends the property fetches a layout change calls for.
 */
public interface FetchScheduler {
	/**
	 * <code>node</code> was just created and has no properties yet.
	 *
	 * @param parent null if <code>node</code> is the root
	 */
	void fetchNew(MenuNode node, MenuNode parent);

	/**
	 * <code>node</code> survived a layout change; its properties may be stale.
	 */
	void refresh(MenuNode node);

	/**
	 * A good moment to send whatever has been queued so far.
	 */
	void flush();
}
