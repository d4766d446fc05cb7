package works.menusync.reconcile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.menusync.MenuNode;
import works.menusync.MenuTree;
import works.menusync.exceptions.ProtocolMismatchException;
import works.menusync.transport.LayoutDescription;

import static works.menusync.MenuNode.ROOT_ID;

/**
 * Patches a {@link MenuTree} in place to match a freshly fetched {@link LayoutDescription}.
 *
 * <p>
 * Children are matched by id. A matching child is kept and moved into position
 * rather than rebuilt, so anything attached to it (by a {@link works.menusync.TypeHandler},
 * or by a presentation layer keyed on node identity) survives the update.
 * Unmatched descriptions become new nodes, each with its own property fetch,
 * and unmatched children are pruned along with their descendants.
 *
 * <p>
 * The walk uses an explicit stack, so arbitrarily deep menus can't exhaust the call stack.
 */
@RequiredArgsConstructor
public class TreeReconciler {
	private final MenuTree tree;
	private final FetchScheduler fetches;
	private final StructureListener structure;
	private final boolean refreshRecycled;

	/**
	 * Brings the whole tree in line with <code>layout</code>, creating the root if there isn't one.
	 *
	 * @throws ProtocolMismatchException if <code>layout</code> can't describe this tree;
	 * the tree is not modified in that case
	 */
	public ReconcileReport reconcile(LayoutDescription layout) throws ProtocolMismatchException {
		Optional<MenuNode> existingRoot = tree.root();
		if (existingRoot.isPresent()) {
			return reconcile(existingRoot.get(), layout);
		}
		validate(null, layout);
		Pass pass = new Pass();
		MenuNode root = tree.createRoot(layout.id());
		pass.created++;
		fetches.fetchNew(root, null);
		return pass.run(root, layout);
	}

	/**
	 * Brings the subtree under <code>existing</code> in line with <code>description</code>.
	 *
	 * @throws ProtocolMismatchException if <code>description</code> is not a description of <code>existing</code>;
	 * the tree is not modified in that case
	 */
	public ReconcileReport reconcile(MenuNode existing, LayoutDescription description) throws ProtocolMismatchException {
		if (!tree.contains(existing)) {
			throw new IllegalArgumentException(existing + " is not part of the tree");
		}
		validate(existing, description);
		Pass pass = new Pass();
		pass.recycled++;
		if (refreshRecycled) {
			fetches.refresh(existing);
		}
		return pass.run(existing, description);
	}

	/**
	 * Catches everything that would leave the tree half-patched, before anything is touched.
	 */
	private void validate(MenuNode existing, LayoutDescription description) throws ProtocolMismatchException {
		if (existing == null) {
			if (description.id() != ROOT_ID) {
				LOGGER.debug("Root description has id {}, not {}", description.id(), ROOT_ID);
			}
		} else if (existing.id() != description.id()) {
			throw new ProtocolMismatchException("Description of node " + description.id() + " can't be applied to node " + existing.id());
		}

		Set<Integer> protectedIds = new HashSet<>();
		for (MenuNode n = existing; n != null; n = tree.parentOf(n).orElse(null)) {
			protectedIds.add(n.id());
		}

		Set<Integer> seen = new HashSet<>();
		Deque<LayoutDescription> stack = new ArrayDeque<>();
		stack.push(description);
		seen.add(description.id());
		while (!stack.isEmpty()) {
			for (LayoutDescription child : stack.pop().children()) {
				if (child.id() < 0) {
					continue;
				}
				if (!seen.add(child.id())) {
					throw new ProtocolMismatchException("Node id " + child.id() + " appears more than once in layout");
				}
				if (protectedIds.contains(child.id())) {
					throw new ProtocolMismatchException("Node id " + child.id() + " can't be its own descendant");
				}
				stack.push(child);
			}
		}
	}

	private record Work(MenuNode node, LayoutDescription description) { }

	private final class Pass {
		int created = 0;
		int recycled = 0;
		int removed = 0;
		int mismatches = 0;

		ReconcileReport run(MenuNode top, LayoutDescription description) {
			Deque<Work> stack = new ArrayDeque<>();
			stack.push(new Work(top, description));
			while (!stack.isEmpty()) {
				Work work = stack.pop();
				List<Work> children = reconcileChildren(work.node(), work.description());
				for (int i = children.size() - 1; i >= 0; i--) {
					stack.push(children.get(i));
				}
			}
			LOGGER.debug("Reconciled node {}: {} created, {} recycled, {} removed", top.id(), created, recycled, removed);
			return new ReconcileReport(top, created, recycled, removed, mismatches);
		}

		private List<Work> reconcileChildren(MenuNode node, LayoutDescription description) {
			Set<Integer> wanted = new HashSet<>();
			description.children().forEach(c -> wanted.add(c.id()));
			Set<Integer> oldChildren = new LinkedHashSet<>(node.childIds());
			for (int leftover : List.copyOf(oldChildren)) {
				if (!wanted.contains(leftover)) {
					oldChildren.remove(leftover);
					prune(tree.find(leftover).orElseThrow());
				}
			}

			List<Work> result = new ArrayList<>(description.children().size());
			int position = 0;
			for (LayoutDescription childDescription : description.children()) {
				int childId = childDescription.id();
				if (childId < 0) {
					// Doesn't count toward the position
					LOGGER.warn("Skipping child of node {} with invalid id {}", node.id(), childId);
					continue;
				}
				MenuNode child;
				if (oldChildren.remove(childId)) {
					child = tree.find(childId).orElseThrow();
					LOGGER.trace("Recycling node {} at position {}", childId, position);
					int oldPosition = tree.placeChild(node, child, position);
					if (oldPosition != position) {
						structure.childMoved(node, child, position, oldPosition);
					}
					recycled++;
					if (refreshRecycled) {
						fetches.refresh(child);
					}
				} else {
					tree.find(childId).ifPresent(stale -> {
						LOGGER.debug("Node {} moved from parent {} to {}; rebuilding it", childId, stale.parentId(), node.id());
						prune(stale);
					});
					LOGGER.trace("Building new node {} at position {}", childId, position);
					child = tree.insertChild(node, childId, position);
					created++;
					structure.childAdded(node, child, position);
					fetches.fetchNew(child, node);
				}
				result.add(new Work(child, childDescription));
				position++;
			}

			if (node.parentId() == ROOT_ID) {
				// Likely done with this burst
				fetches.flush();
			}

			if (node.childIds().size() != result.size()) {
				LOGGER.warn("Sync failed on node {}: {} children but {} in layout", node.id(), node.childIds().size(), result.size());
				mismatches++;
			}
			return result;
		}

		private void prune(MenuNode node) {
			MenuNode parent = tree.parentOf(node).orElse(null);
			List<MenuNode> gone = tree.detach(node);
			removed += gone.size();
			LOGGER.trace("Removed node {} and {} descendant{}", node.id(), gone.size() - 1, (gone.size() == 2) ? "" : "s");
			structure.childRemoved(parent, node, gone);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeReconciler.class);
}
