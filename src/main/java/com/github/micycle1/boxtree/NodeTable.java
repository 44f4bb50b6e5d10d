package com.github.micycle1.boxtree;

import java.util.Arrays;

/**
 * Index-addressed node records stored as parallel primitive arrays.
 * <p>
 * A node is identified by its position; links between nodes are indices, with
 * {@link #NONE} marking an absent parent, child or element range. Bounds are
 * stored as {@code 2 * dimensions} doubles per node (all minimums, then all
 * maximums). The middle-child and locked-axes columns exist only for box-key
 * tables.
 */
final class NodeTable {

	static final int NONE = -1;

	private static final int INITIAL_CAPACITY = 16;

	private final int dimensions;
	private final boolean boxKeys;
	private int size;

	private int[] parent;
	private int[] lowChild;
	private int[] highChild;
	private int[] elementsBegin;
	private int[] elementsEnd;
	private int[] splitAxis;
	private double[] splitPosition;
	private double[] bounds;

	// box keys only
	private int[] middleChild;
	private int[] lockedAxes;

	NodeTable(int dimensions, boolean boxKeys, int expectedNodes) {
		this.dimensions = dimensions;
		this.boxKeys = boxKeys;
		int capacity = Math.max(INITIAL_CAPACITY, expectedNodes);
		parent = new int[capacity];
		lowChild = new int[capacity];
		highChild = new int[capacity];
		elementsBegin = new int[capacity];
		elementsEnd = new int[capacity];
		splitAxis = new int[capacity];
		splitPosition = new double[capacity];
		bounds = new double[capacity * 2 * dimensions];
		if (boxKeys) {
			middleChild = new int[capacity];
			lockedAxes = new int[capacity];
		}
	}

	int size() {
		return size;
	}

	/**
	 * Appends a node with no children and no split.
	 *
	 * @param min the node's low bounds ({@code dimensions} values)
	 * @param max the node's high bounds
	 * @return the new node's index
	 */
	int add(int parentIndex, int begin, int end, double[] min, double[] max, int lockedAxesMask) {
		ensureCapacity(size + 1);
		int index = size++;
		parent[index] = parentIndex;
		lowChild[index] = NONE;
		highChild[index] = NONE;
		elementsBegin[index] = begin;
		elementsEnd[index] = end;
		splitAxis[index] = NONE;
		splitPosition[index] = 0;
		int offset = index * 2 * dimensions;
		System.arraycopy(min, 0, bounds, offset, dimensions);
		System.arraycopy(max, 0, bounds, offset + dimensions, dimensions);
		if (boxKeys) {
			middleChild[index] = NONE;
			lockedAxes[index] = lockedAxesMask;
		}
		return index;
	}

	private void ensureCapacity(int capacity) {
		if (capacity <= parent.length) {
			return;
		}
		int newCapacity = Math.max(capacity, parent.length * 2);
		parent = Arrays.copyOf(parent, newCapacity);
		lowChild = Arrays.copyOf(lowChild, newCapacity);
		highChild = Arrays.copyOf(highChild, newCapacity);
		elementsBegin = Arrays.copyOf(elementsBegin, newCapacity);
		elementsEnd = Arrays.copyOf(elementsEnd, newCapacity);
		splitAxis = Arrays.copyOf(splitAxis, newCapacity);
		splitPosition = Arrays.copyOf(splitPosition, newCapacity);
		bounds = Arrays.copyOf(bounds, newCapacity * 2 * dimensions);
		if (boxKeys) {
			middleChild = Arrays.copyOf(middleChild, newCapacity);
			lockedAxes = Arrays.copyOf(lockedAxes, newCapacity);
		}
	}

	int getParent(int node) {
		return parent[node];
	}

	int getLowChild(int node) {
		return lowChild[node];
	}

	int getHighChild(int node) {
		return highChild[node];
	}

	int getMiddleChild(int node) {
		return boxKeys ? middleChild[node] : NONE;
	}

	void setLowChild(int node, int child) {
		lowChild[node] = child;
	}

	void setHighChild(int node, int child) {
		highChild[node] = child;
	}

	void setMiddleChild(int node, int child) {
		middleChild[node] = child;
	}

	int getElementsBegin(int node) {
		return elementsBegin[node];
	}

	int getElementsEnd(int node) {
		return elementsEnd[node];
	}

	int getElementCount(int node) {
		return elementsEnd[node] - elementsBegin[node];
	}

	void setElementRange(int node, int begin, int end) {
		elementsBegin[node] = begin;
		elementsEnd[node] = end;
	}

	int getSplitAxis(int node) {
		return splitAxis[node];
	}

	double getSplitPosition(int node) {
		return splitPosition[node];
	}

	void setSplit(int node, int axis, double position) {
		splitAxis[node] = axis;
		splitPosition[node] = position;
	}

	int getLockedAxes(int node) {
		return boxKeys ? lockedAxes[node] : 0;
	}

	boolean isAxisLocked(int node, int axis) {
		return boxKeys && (lockedAxes[node] & (1 << axis)) != 0;
	}

	double getMin(int node, int axis) {
		return bounds[node * 2 * dimensions + axis];
	}

	double getMax(int node, int axis) {
		return bounds[node * 2 * dimensions + dimensions + axis];
	}

	void copyBounds(int node, double[] min, double[] max) {
		int offset = node * 2 * dimensions;
		System.arraycopy(bounds, offset, min, 0, dimensions);
		System.arraycopy(bounds, offset + dimensions, max, 0, dimensions);
	}

	Box getBox(int node) {
		double[] min = new double[dimensions];
		double[] max = new double[dimensions];
		copyBounds(node, min, max);
		return Box.wrap(min, max);
	}

	/**
	 * Tests whether a node's bounds intersect the closed box {@code [min, max]}.
	 */
	boolean intersects(int node, double[] min, double[] max) {
		int offset = node * 2 * dimensions;
		for (int axis = 0; axis < dimensions; axis++) {
			if (bounds[offset + dimensions + axis] < min[axis] || bounds[offset + axis] > max[axis]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Returns the first existing child in the order low, middle, high.
	 */
	int getFirstChild(int node) {
		if (lowChild[node] != NONE) {
			return lowChild[node];
		}
		int middle = getMiddleChild(node);
		if (middle != NONE) {
			return middle;
		}
		return highChild[node];
	}

	/**
	 * Returns the sibling following {@code node} in its parent's low, middle,
	 * high order, or {@link #NONE}.
	 */
	int getNextSibling(int node) {
		int p = parent[node];
		if (p == NONE) {
			return NONE;
		}
		if (node == lowChild[p]) {
			int middle = getMiddleChild(p);
			return middle != NONE ? middle : highChild[p];
		}
		if (boxKeys && node == middleChild[p]) {
			return highChild[p];
		}
		return NONE;
	}

	boolean hasChildren(int node) {
		return lowChild[node] != NONE || highChild[node] != NONE || getMiddleChild(node) != NONE;
	}
}
