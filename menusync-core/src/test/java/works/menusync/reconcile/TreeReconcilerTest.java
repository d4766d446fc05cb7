package works.menusync.reconcile;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.menusync.MenuNode;
import works.menusync.MenuTree;
import works.menusync.exceptions.ProtocolMismatchException;
import works.menusync.transport.LayoutDescription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.menusync.transport.LayoutDescription.leaf;
import static works.menusync.transport.LayoutDescription.node;

class TreeReconcilerTest {
	MenuTree tree;
	List<Integer> fetchedNew;
	List<Integer> refreshed;
	List<String> structure;
	int flushes;

	final FetchScheduler fetches = new FetchScheduler() {
		@Override
		public void fetchNew(MenuNode node, MenuNode parent) {
			fetchedNew.add(node.id());
		}

		@Override
		public void refresh(MenuNode node) {
			refreshed.add(node.id());
		}

		@Override
		public void flush() {
			flushes++;
		}
	};

	final StructureListener structureListener = new StructureListener() {
		@Override
		public void childAdded(MenuNode parent, MenuNode child, int position) {
			structure.add("added " + child.id() + " to " + parent.id() + " at " + position);
		}

		@Override
		public void childRemoved(MenuNode parent, MenuNode child, List<MenuNode> removed) {
			structure.add("removed " + child.id() + " from " + parent.id() + " with " + removed.size());
		}

		@Override
		public void childMoved(MenuNode parent, MenuNode child, int newPosition, int oldPosition) {
			structure.add("moved " + child.id() + " in " + parent.id() + " from " + oldPosition + " to " + newPosition);
		}
	};

	@BeforeEach
	void setUp() {
		tree = new MenuTree();
		fetchedNew = new ArrayList<>();
		refreshed = new ArrayList<>();
		structure = new ArrayList<>();
		flushes = 0;
	}

	TreeReconciler reconciler(boolean refreshRecycled) {
		return new TreeReconciler(tree, fetches, structureListener, refreshRecycled);
	}

	void clearRecords() {
		fetchedNew.clear();
		refreshed.clear();
		structure.clear();
	}

	static final LayoutDescription ABC = node(0, leaf(1), leaf(2), leaf(3));

	@Test
	void initialLayout_buildsTree() throws ProtocolMismatchException {
		ReconcileReport report = reconciler(true).reconcile(node(0,
			node(1, leaf(11), leaf(12)),
			leaf(2)));

		MenuNode root = tree.root().orElseThrow();
		assertSame(root, report.root());
		assertEquals(List.of(1, 2), root.childIds());
		assertEquals(List.of(11, 12), tree.find(1).orElseThrow().childIds());
		assertEquals(5, report.created());
		assertEquals(0, report.recycled());
		assertEquals(List.of(0, 1, 2, 11, 12), fetchedNew, "Breadth of each node's children first");
		assertEquals(List.of(), refreshed);
		assertFalse(root.isRealized(), "Realizing is the caller's job");
	}

	@Test
	void sameLayout_keepsNodes() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(true);
		reconciler.reconcile(ABC);
		List<MenuNode> before = tree.subtree(tree.root().orElseThrow());
		clearRecords();

		ReconcileReport report = reconciler.reconcile(ABC);

		List<MenuNode> after = tree.subtree(tree.root().orElseThrow());
		assertEquals(before.size(), after.size());
		for (int i = 0; i < before.size(); i++) {
			assertSame(before.get(i), after.get(i));
		}
		assertEquals(0, report.created());
		assertEquals(4, report.recycled());
		assertEquals(List.of(), fetchedNew);
		assertEquals(List.of(), structure);
	}

	@Test
	void insertion_recyclesOthers() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(true);
		reconciler.reconcile(node(0, leaf(1), leaf(2)));
		MenuNode a = tree.find(1).orElseThrow();
		MenuNode b = tree.find(2).orElseThrow();
		clearRecords();

		reconciler.reconcile(node(0, leaf(1), leaf(3), leaf(2)));

		MenuNode root = tree.root().orElseThrow();
		assertEquals(List.of(1, 3, 2), root.childIds());
		assertSame(a, tree.find(1).orElseThrow());
		assertSame(b, tree.find(2).orElseThrow());
		assertEquals(List.of(3), fetchedNew, "Only the new node gets an initial fetch");
		assertEquals(List.of(0, 1, 2), refreshed);
		assertEquals(List.of("added 3 to 0 at 1"), structure, "Node 2 shifts along without moving");
	}

	@Test
	void insertion_withoutRefresh_fetchesOnlyNewNode() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(false);
		reconciler.reconcile(node(0, leaf(1), leaf(2)));
		clearRecords();

		reconciler.reconcile(node(0, leaf(1), leaf(3), leaf(2)));

		assertEquals(List.of(3), fetchedNew);
		assertEquals(List.of(), refreshed);
	}

	@Test
	void reorder_movesInPlace() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(false);
		reconciler.reconcile(ABC);
		MenuNode c = tree.find(3).orElseThrow();
		clearRecords();

		ReconcileReport report = reconciler.reconcile(node(0, leaf(3), leaf(1), leaf(2)));

		assertEquals(List.of(3, 1, 2), tree.root().orElseThrow().childIds());
		assertSame(c, tree.find(3).orElseThrow());
		assertEquals(0, report.created());
		assertEquals(0, report.removed());
		assertEquals(List.of("moved 3 in 0 from 2 to 0"), structure);
	}

	@Test
	void missingChildren_prunedWithDescendants() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(false);
		reconciler.reconcile(node(0, node(1, leaf(11), node(12, leaf(121))), leaf(2)));
		MenuNode gone = tree.find(1).orElseThrow();
		MenuNode goneGrandchild = tree.find(121).orElseThrow();
		clearRecords();

		ReconcileReport report = reconciler.reconcile(node(0, leaf(2)));

		assertEquals(List.of(2), tree.root().orElseThrow().childIds());
		assertFalse(tree.contains(gone));
		assertFalse(tree.contains(goneGrandchild));
		assertEquals(4, report.removed());
		assertEquals(List.of("removed 1 from 0 with 4"), structure);
		assertEquals(2, tree.size());
	}

	@Test
	void nodeMovedToAnotherParent_rebuilt() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(false);
		reconciler.reconcile(node(0, node(1, leaf(5)), leaf(2)));
		MenuNode oldFive = tree.find(5).orElseThrow();
		clearRecords();

		reconciler.reconcile(node(0, leaf(2), node(1), node(3, leaf(5))));

		MenuNode newFive = tree.find(5).orElseThrow();
		assertFalse(tree.contains(oldFive));
		assertEquals(3, newFive.parentId());
		assertEquals(List.of(), tree.find(1).orElseThrow().childIds());
		assertEquals(List.of(3, 5), fetchedNew);
	}

	@Test
	void negativeIds_skippedWithoutTakingAPosition() throws ProtocolMismatchException {
		ReconcileReport report = reconciler(false).reconcile(node(0, leaf(1), leaf(-1), leaf(2)));

		assertEquals(List.of(1, 2), tree.root().orElseThrow().childIds());
		assertEquals(List.of("added 1 to 0 at 0", "added 2 to 0 at 1"), structure);
		assertEquals(0, report.mismatches());
	}

	@Test
	void grandchildrenOfRoot_triggerFlush() throws ProtocolMismatchException {
		reconciler(false).reconcile(node(0,
			node(1, leaf(11)),
			node(2, leaf(21))));
		assertEquals(2, flushes, "Once after each child of the root has its children");
	}

	@Test
	void rootIdMismatch_leavesTreeAlone() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(true);
		reconciler.reconcile(ABC);
		MenuNode root = tree.root().orElseThrow();
		clearRecords();

		assertThrows(ProtocolMismatchException.class, () -> reconciler.reconcile(node(7, leaf(1))));

		assertSame(root, tree.root().orElseThrow());
		assertEquals(List.of(1, 2, 3), root.childIds());
		assertEquals(List.of(), fetchedNew);
		assertEquals(List.of(), refreshed);
	}

	@Test
	void duplicateIds_rejectedBeforeAnyChange() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(false);
		reconciler.reconcile(ABC);
		clearRecords();

		assertThrows(ProtocolMismatchException.class, () -> reconciler.reconcile(node(0, leaf(4), node(1, leaf(4)))));

		assertEquals(List.of(1, 2, 3), tree.root().orElseThrow().childIds());
		assertEquals(List.of(), structure);
	}

	@Test
	void subtree_ancestorAsDescendant_rejected() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(false);
		reconciler.reconcile(node(0, node(1, leaf(11))));
		MenuNode one = tree.find(1).orElseThrow();

		assertThrows(ProtocolMismatchException.class, () -> reconciler.reconcile(one, node(1, leaf(0))));
		assertThrows(ProtocolMismatchException.class, () -> reconciler.reconcile(one, node(2)));
	}

	@Test
	void subtree_onlyTouchesThatSubtree() throws ProtocolMismatchException {
		TreeReconciler reconciler = reconciler(false);
		reconciler.reconcile(node(0, node(1, leaf(11)), node(2, leaf(21))));
		MenuNode one = tree.find(1).orElseThrow();
		clearRecords();

		ReconcileReport report = reconciler.reconcile(one, node(1, leaf(12), leaf(11)));

		assertSame(one, report.root());
		assertEquals(List.of(12, 11), one.childIds());
		assertEquals(List.of(21), tree.find(2).orElseThrow().childIds());
		assertEquals(List.of(12), fetchedNew);
	}

	@Test
	void deepLayout_noStackOverflow() throws ProtocolMismatchException {
		int depth = 20_000;
		LayoutDescription description = leaf(depth);
		for (int id = depth - 1; id >= 0; id--) {
			description = node(id, description);
		}

		ReconcileReport report = reconciler(false).reconcile(description);

		assertEquals(depth + 1, report.created());
		assertEquals(depth + 1, tree.size());
		assertTrue(tree.find(depth).isPresent());
	}
}
