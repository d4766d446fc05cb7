package works.menusync.reconcile;

import works.menusync.MenuNode;

/**
 * What one {@link TreeReconciler#reconcile} pass did.
 *
 * @param root       the node the pass started from
 * @param created    nodes built from scratch
 * @param recycled   existing nodes kept, possibly at a new position
 * @param removed    nodes dropped from the tree, counting descendants
 * @param mismatches nodes whose resulting child count disagreed with their description
 */
public record ReconcileReport(
	MenuNode root,
	int created,
	int recycled,
	int removed,
	int mismatches
) { }
