package works.menusync;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.menusync.MenuNode.NO_PARENT;
import static works.menusync.MenuNode.ROOT_ID;

class MenuTreeTest {
	MenuTree tree;
	MenuNode root;

	@BeforeEach
	void setUp() {
		tree = new MenuTree();
		root = tree.createRoot(ROOT_ID);
	}

	@Test
	void createRoot_onlyOnce() {
		assertSame(root, tree.root().orElseThrow());
		assertTrue(root.isRoot());
		assertEquals(NO_PARENT, root.parentId());
		assertThrows(IllegalStateException.class, () -> tree.createRoot(5));
	}

	@Test
	void insertChild_linksBothWays() {
		MenuNode a = tree.insertChild(root, 1, 0);
		MenuNode b = tree.insertChild(root, 2, 0);
		assertEquals(List.of(2, 1), root.childIds());
		assertEquals(List.of(b, a), tree.childrenOf(root));
		assertSame(root, tree.parentOf(a).orElseThrow());
		assertEquals(3, tree.size());
	}

	@Test
	void insertChild_clampsPosition() {
		tree.insertChild(root, 1, 0);
		tree.insertChild(root, 2, 99);
		tree.insertChild(root, 3, -4);
		assertEquals(List.of(3, 1, 2), root.childIds());
	}

	@Test
	void insertChild_idInUse_throws() {
		MenuNode a = tree.insertChild(root, 1, 0);
		assertThrows(IllegalStateException.class, () -> tree.insertChild(a, 1, 0));
		assertThrows(IllegalStateException.class, () -> tree.insertChild(a, ROOT_ID, 0));
		assertThrows(IllegalArgumentException.class, () -> tree.insertChild(a, -3, 0));
	}

	@Test
	void placeChild_returnsOldPosition() {
		tree.insertChild(root, 1, 0);
		tree.insertChild(root, 2, 1);
		MenuNode c = tree.insertChild(root, 3, 2);
		assertEquals(2, tree.placeChild(root, c, 0));
		assertEquals(List.of(3, 1, 2), root.childIds());
	}

	@Test
	void placeChild_notAChild_throws() {
		MenuNode a = tree.insertChild(root, 1, 0);
		MenuNode b = tree.insertChild(a, 2, 0);
		assertThrows(IllegalArgumentException.class, () -> tree.placeChild(root, b, 0));
	}

	@Test
	void detach_removesWholeSubtree() {
		MenuNode a = tree.insertChild(root, 1, 0);
		MenuNode b = tree.insertChild(a, 2, 0);
		MenuNode c = tree.insertChild(b, 3, 0);
		MenuNode d = tree.insertChild(root, 4, 1);

		List<MenuNode> removed = tree.detach(a);

		assertEquals(List.of(a, b, c), removed);
		assertEquals(List.of(4), root.childIds());
		assertFalse(tree.contains(a));
		assertFalse(tree.contains(c));
		assertTrue(tree.contains(d));
		assertTrue(tree.find(2).isEmpty());
		assertEquals(2, tree.size());
	}

	@Test
	void contains_isIdentityBased() {
		MenuNode a = tree.insertChild(root, 1, 0);
		tree.detach(a);
		MenuNode replacement = tree.insertChild(root, 1, 0);
		assertFalse(tree.contains(a));
		assertTrue(tree.contains(replacement));
	}

	@Test
	void subtree_isPreOrder() {
		MenuNode a = tree.insertChild(root, 1, 0);
		tree.insertChild(a, 11, 0);
		tree.insertChild(a, 12, 1);
		tree.insertChild(root, 2, 1);
		List<Integer> ids = tree.subtree(root).stream().map(MenuNode::id).toList();
		assertEquals(List.of(0, 1, 11, 12, 2), ids);
	}

	@Test
	void subtree_deepChain() {
		MenuNode node = root;
		for (int i = 1; i <= 10_000; i++) {
			node = tree.insertChild(node, i, 0);
		}
		assertEquals(10_001, tree.subtree(root).size());
		assertEquals(10_001, tree.clear().size());
		assertTrue(tree.isEmpty());
		assertTrue(tree.root().isEmpty());
	}

	@Test
	void properties_reportChanges() {
		assertTrue(root.setProperty("label", PropertyValue.of("File")));
		assertFalse(root.setProperty("label", PropertyValue.of("File")));
		assertTrue(root.setProperty("label", PropertyValue.of("Edit")));
		assertEquals("Edit", root.stringProperty("label").orElseThrow());
		assertTrue(root.removeProperty("label"));
		assertFalse(root.removeProperty("label"));
	}

	@Test
	void type_defaultsToStandard() {
		assertEquals(MenuProperties.DEFAULT_TYPE, root.type());
		root.setProperty(MenuProperties.TYPE, PropertyValue.boxed(PropertyValue.of("separator")));
		assertEquals("separator", root.type());
		root.setProperty(MenuProperties.TYPE, PropertyValue.of(7));
		assertEquals(MenuProperties.DEFAULT_TYPE, root.type());
	}
}
