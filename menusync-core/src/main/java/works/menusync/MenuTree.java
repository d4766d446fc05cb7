package works.menusync;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static works.menusync.MenuNode.NO_PARENT;

/**
 * Arena that owns every {@link MenuNode} of one mirrored menu, addressed by id.
 *
 * <p>
 * Ids are unique within a tree. Nodes refer to each other only by id, so removing
 * a subtree is just a matter of dropping its entries from the arena; a removed
 * node instance is never reused, and {@link #contains} tells a live node from a
 * stale one even if a new node has since taken over its id.
 *
 * <p>
 * Not thread-safe. A tree belongs to one {@link SyncSession} and is only touched
 * on that session's event loop.
 */
public final class MenuTree {
	private final Map<Integer, MenuNode> nodes = new HashMap<>();
	private MenuNode root = null;

	public Optional<MenuNode> root() {
		return Optional.ofNullable(root);
	}

	public Optional<MenuNode> find(int id) {
		return Optional.ofNullable(nodes.get(id));
	}

	/**
	 * @return true if this exact node instance is currently part of the tree.
	 */
	public boolean contains(MenuNode node) {
		return node != null && nodes.get(node.id()) == node;
	}

	public int size() {
		return nodes.size();
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	public List<MenuNode> childrenOf(MenuNode parent) {
		List<MenuNode> result = new ArrayList<>(parent.childIds().size());
		for (int childId : parent.childIds()) {
			result.add(requireNonNull(nodes.get(childId), "Dangling child id"));
		}
		return result;
	}

	public Optional<MenuNode> parentOf(MenuNode node) {
		if (node.parentId() == NO_PARENT) {
			return Optional.empty();
		}
		return find(node.parentId());
	}

	/**
	 * @throws IllegalStateException if the tree already has a root
	 */
	public MenuNode createRoot(int id) {
		if (root != null) {
			throw new IllegalStateException("Tree already has root " + root.id());
		}
		MenuNode result = newNode(id);
		root = result;
		return result;
	}

	/**
	 * Creates a node and links it under <code>parent</code>.
	 *
	 * @param position clamped to the parent's current child count
	 * @throws IllegalStateException if <code>childId</code> is already in use
	 */
	public MenuNode insertChild(MenuNode parent, int childId, int position) {
		checkContains(parent);
		MenuNode child = newNode(childId);
		List<Integer> siblings = parent.mutableChildIds();
		siblings.add(clamp(position, siblings.size()), childId);
		child.setParentId(parent.id());
		return child;
	}

	/**
	 * Moves an existing child of <code>parent</code> to <code>position</code>.
	 *
	 * @return the child's previous position
	 */
	public int placeChild(MenuNode parent, MenuNode child, int position) {
		checkContains(parent);
		List<Integer> siblings = parent.mutableChildIds();
		int oldPosition = siblings.indexOf(child.id());
		if (oldPosition < 0 || child.parentId() != parent.id()) {
			throw new IllegalArgumentException(child + " is not a child of " + parent);
		}
		siblings.remove(oldPosition);
		siblings.add(clamp(position, siblings.size()), child.id());
		return oldPosition;
	}

	/**
	 * Unlinks <code>node</code> from its parent and drops it, with all its descendants, from the tree.
	 *
	 * @return the removed nodes, <code>node</code> first
	 */
	public List<MenuNode> detach(MenuNode node) {
		checkContains(node);
		if (node == root) {
			root = null;
		} else {
			parentOf(node).ifPresent(p -> p.mutableChildIds().remove((Integer) node.id()));
		}
		List<MenuNode> removed = subtree(node);
		removed.forEach(n -> {
			nodes.remove(n.id());
			n.setParentId(NO_PARENT);
		});
		return removed;
	}

	/**
	 * Drops every node.
	 *
	 * @return the removed nodes
	 */
	public List<MenuNode> clear() {
		if (root == null) {
			List<MenuNode> orphans = new ArrayList<>(nodes.values());
			nodes.clear();
			return orphans;
		}
		return detach(root);
	}

	/**
	 * @return <code>from</code> and its descendants, in pre-order
	 */
	public List<MenuNode> subtree(MenuNode from) {
		List<MenuNode> result = new ArrayList<>();
		Deque<MenuNode> stack = new ArrayDeque<>();
		stack.push(from);
		while (!stack.isEmpty()) {
			MenuNode node = stack.pop();
			result.add(node);
			List<MenuNode> children = childrenOf(node);
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
		return result;
	}

	private MenuNode newNode(int id) {
		if (id < 0) {
			throw new IllegalArgumentException("Invalid node id " + id);
		}
		if (nodes.containsKey(id)) {
			throw new IllegalStateException("Node id " + id + " already in use");
		}
		MenuNode result = new MenuNode(id);
		nodes.put(id, result);
		return result;
	}

	private void checkContains(MenuNode node) {
		if (!contains(node)) {
			throw new IllegalArgumentException(node + " is not part of this tree");
		}
	}

	private static int clamp(int position, int size) {
		return Math.max(0, Math.min(position, size));
	}
}
