package com.github.micycle1.boxtree;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pre-order iterator over the nodes of a subtree, visiting children in the
 * order low, middle, high. Uses constant extra space.
 */
public final class NodeIterator extends TreeTraversal implements Iterator<TreeNode> {

	NodeIterator(NodeTable nodes, int start) {
		super(nodes, start);
	}

	@Override
	int firstChild(int parent) {
		return nodes.getFirstChild(parent);
	}

	@Override
	int nextSibling(int child) {
		return nodes.getNextSibling(child);
	}

	@Override
	public boolean hasNext() {
		return isValid();
	}

	@Override
	public TreeNode next() {
		if (!isValid()) {
			throw new NoSuchElementException();
		}
		TreeNode current = new TreeNode(nodes, node);
		advance();
		return current;
	}
}
