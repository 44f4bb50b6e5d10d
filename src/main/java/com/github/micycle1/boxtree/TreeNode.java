package com.github.micycle1.boxtree;

/**
 * Read-only view of one node of a {@link StaticBoxTree}, for diagnostics and
 * visualisation.
 * <p>
 * Links are node indices, {@code -1} when absent. A view stays tied to the node
 * table it was obtained from; after the tree is re-created it describes the old
 * structure.
 */
public final class TreeNode {

	private final NodeTable nodes;
	private final int index;

	TreeNode(NodeTable nodes, int index) {
		this.nodes = nodes;
		this.index = index;
	}

	NodeTable table() {
		return nodes;
	}

	public int getIndex() {
		return index;
	}

	public int getParent() {
		return nodes.getParent(index);
	}

	public int getLowChild() {
		return nodes.getLowChild(index);
	}

	/**
	 * Returns the child holding elements that straddle this node's split plane.
	 * Always {@code -1} in point-key trees.
	 */
	public int getMiddleChild() {
		return nodes.getMiddleChild(index);
	}

	public int getHighChild() {
		return nodes.getHighChild(index);
	}

	public boolean isRoot() {
		return nodes.getParent(index) == NodeTable.NONE;
	}

	public boolean hasChildren() {
		return nodes.hasChildren(index);
	}

	public boolean isLeaf() {
		return !nodes.hasChildren(index);
	}

	/**
	 * Start (inclusive) of this node's own element range in
	 * {@link StaticBoxTree#getElements()}, or {@code -1} for a pure internal node.
	 */
	public int getElementsBegin() {
		return nodes.getElementsBegin(index);
	}

	/**
	 * End (exclusive) of this node's own element range, or {@code -1}.
	 */
	public int getElementsEnd() {
		return nodes.getElementsEnd(index);
	}

	/**
	 * Number of elements held directly by this node (not by its descendants).
	 */
	public int getElementCount() {
		return nodes.getElementCount(index);
	}

	/**
	 * Returns the tight bounds of every element in this node's subtree.
	 */
	public Box getBox() {
		return nodes.getBox(index);
	}

	/**
	 * Returns the split axis, or {@code -1} if the node was not split.
	 */
	public int getSplitAxis() {
		return nodes.getSplitAxis(index);
	}

	/**
	 * Returns the split position; meaningless when {@link #getSplitAxis()} is
	 * {@code -1}.
	 */
	public double getSplitPosition() {
		return nodes.getSplitPosition(index);
	}

	/**
	 * Tests whether an axis is excluded from splitting in this node's subtree.
	 * Always false in point-key trees.
	 */
	public boolean isAxisLocked(int axis) {
		return nodes.isAxisLocked(index, axis);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof TreeNode)) {
			return false;
		}
		TreeNode other = (TreeNode) obj;
		return nodes == other.nodes && index == other.index;
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(nodes) + index;
	}

	@Override
	public String toString() {
		return "TreeNode[" + index + ", parent=" + getParent() + ", elements=[" + getElementsBegin() + ", " + getElementsEnd() + "), split=" + getSplitAxis()
				+ "@" + getSplitPosition() + "]";
	}
}
