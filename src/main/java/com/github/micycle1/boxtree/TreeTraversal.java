package com.github.micycle1.boxtree;

/**
 * Stackless pre-order walk over a {@link NodeTable}.
 * <p>
 * The whole traversal state is {@code (node, descending)}. Each step tries the
 * first child (when descending), then the next sibling, and otherwise climbs to
 * the parent and repeats the sibling search there. Subclasses decide which
 * children and siblings exist for them (e.g. only those overlapping a query
 * box), which is how range and nearest-neighbour queries prune subtrees. The
 * walk never leaves the subtree of its start node; climbing out of it ends the
 * traversal, leaving {@link #node} at {@link NodeTable#NONE}.
 * <p>
 * This relies on the node table being immutable while the walk is in progress.
 */
abstract class TreeTraversal {

	final NodeTable nodes;
	final int start;
	int node;
	boolean descending = true;

	TreeTraversal(NodeTable nodes, int start) {
		this.nodes = nodes;
		this.start = start;
		this.node = start;
	}

	/**
	 * @return the first child of {@code parent} to visit, or
	 *         {@link NodeTable#NONE}
	 */
	abstract int firstChild(int parent);

	/**
	 * @return the sibling of {@code child} to visit after it, or
	 *         {@link NodeTable#NONE}
	 */
	abstract int nextSibling(int child);

	final boolean isValid() {
		return node != NodeTable.NONE;
	}

	/**
	 * Moves to the next node in pre-order.
	 *
	 * @return false once the walk has ended
	 */
	final boolean advance() {
		while (true) {
			if (descending) {
				int child = firstChild(node);
				if (child != NodeTable.NONE) {
					node = child;
					return true;
				}
			}
			if (node == start) {
				node = NodeTable.NONE;
				return false;
			}
			int sibling = nextSibling(node);
			if (sibling != NodeTable.NONE) {
				node = sibling;
				descending = true;
				return true;
			}
			node = nodes.getParent(node);
			descending = false;
		}
	}
}
