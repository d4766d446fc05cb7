package works.menusync.reconcile;

import java.util.List;
import works.menusync.MenuNode;

/**
 * Structural changes made by a {@link TreeReconciler}, reported as they happen.
 */
public interface StructureListener {
	void childAdded(MenuNode parent, MenuNode child, int position);

	/**
	 * @param removed <code>child</code> and all its descendants, which are no longer in the tree
	 */
	void childRemoved(MenuNode parent, MenuNode child, List<MenuNode> removed);

	void childMoved(MenuNode parent, MenuNode child, int newPosition, int oldPosition);
}
