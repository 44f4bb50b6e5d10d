package com.github.micycle1.boxtree;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, single-pass iterator over the elements whose spatial key intersects a
 * query box.
 * <p>
 * A child subtree is entered only if its bounds intersect the query box; the
 * elements held by an entered node are then tested one by one, since node
 * bounds only enclose them. The iterator is positioned on the next matching
 * element (or at the end); abandoning it early is always safe.
 * <p>
 * Two iterators are equal when they are at the same node and, unless both are
 * at the end, the same element.
 *
 * @param <T> the element type
 */
public final class RangeQueryIterator<T> extends TreeTraversal implements Iterator<T> {

	private final ElementStore<T> store;
	private final double[] min;
	private final double[] max;
	private final QueryStats stats;

	private int elementIndex = NodeTable.NONE;
	private int lastReturned = NodeTable.NONE;

	RangeQueryIterator(NodeTable nodes, ElementStore<T> store, int start, Box range, QueryStats stats) {
		super(nodes, start);
		this.store = store;
		this.stats = stats;
		if (range.isEmpty()) {
			// matches nothing
			this.min = null;
			this.max = null;
			this.node = NodeTable.NONE;
			return;
		}
		this.min = range.getMin();
		this.max = range.getMax();
		if (isValid()) {
			visit();
			elementIndex = nodes.getElementsBegin(node);
			moveToNextMatch();
		}
	}

	@Override
	int firstChild(int parent) {
		int child = nodes.getLowChild(parent);
		if (child != NodeTable.NONE && overlaps(child)) {
			return child;
		}
		child = nodes.getMiddleChild(parent);
		if (child != NodeTable.NONE && overlaps(child)) {
			return child;
		}
		child = nodes.getHighChild(parent);
		if (child != NodeTable.NONE && overlaps(child)) {
			return child;
		}
		return NodeTable.NONE;
	}

	@Override
	int nextSibling(int child) {
		int parent = nodes.getParent(child);
		if (parent == NodeTable.NONE) {
			return NodeTable.NONE;
		}
		int middle = nodes.getMiddleChild(parent);
		if (child == nodes.getLowChild(parent) && middle != NodeTable.NONE && overlaps(middle)) {
			return middle;
		}
		int high = nodes.getHighChild(parent);
		if (child != high && high != NodeTable.NONE && overlaps(high)) {
			return high;
		}
		return NodeTable.NONE;
	}

	private boolean overlaps(int candidate) {
		if (stats != null) {
			stats.addNodeOverlapTest();
		}
		return nodes.intersects(candidate, min, max);
	}

	private void visit() {
		if (stats != null) {
			stats.addNodeVisit();
		}
	}

	private void moveToNextMatch() {
		while (true) {
			int end = nodes.getElementsEnd(node);
			for (; elementIndex < end; elementIndex++) {
				if (stats != null) {
					stats.addElementOverlapTest();
				}
				if (store.intersects(elementIndex, min, max)) {
					return;
				}
			}
			if (!advance()) {
				elementIndex = NodeTable.NONE;
				return;
			}
			visit();
			elementIndex = nodes.getElementsBegin(node);
		}
	}

	@Override
	public boolean hasNext() {
		return isValid();
	}

	@Override
	public T next() {
		if (!isValid()) {
			throw new NoSuchElementException();
		}
		lastReturned = elementIndex;
		elementIndex++;
		moveToNextMatch();
		return store.get(lastReturned);
	}

	/**
	 * Returns the storage index of the element most recently returned by
	 * {@link #next()}.
	 *
	 * @throws IllegalStateException if {@code next()} has not been called
	 */
	public int getElementIndex() {
		if (lastReturned == NodeTable.NONE) {
			throw new IllegalStateException("next() has not been called");
		}
		return lastReturned;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof RangeQueryIterator)) {
			return false;
		}
		RangeQueryIterator<?> other = (RangeQueryIterator<?>) obj;
		return nodes == other.nodes && node == other.node && (!isValid() || elementIndex == other.elementIndex);
	}

	@Override
	public int hashCode() {
		return isValid() ? 31 * node + elementIndex : NodeTable.NONE;
	}
}
