package com.github.micycle1.boxtree;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the node table of a {@link StaticBoxTree} by iterative top-down
 * splitting, permuting the element store in place.
 * <p>
 * Each node with more than {@code maxElementsPerNode} elements is split at the
 * midpoint of its widest unlocked axis. Box keys that straddle the split plane
 * either stay in the node (when few enough) or move into a middle child whose
 * split axis is locked for its whole subtree. Child bounds are tightened on the
 * split axis from the child's actual elements.
 */
final class TreeBuilder {

	private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

	private final ElementStore<?> store;
	private final NodeTable nodes;
	private final int maxElementsPerNode;
	private final double splitEffectiveness;
	private final int dimensions;
	private final boolean boxKeys;

	// scratch bounds
	private final double[] min;
	private final double[] max;

	private int[] workList = new int[16];
	private int workSize = 0;

	private int abandonedSplits = 0;

	TreeBuilder(ElementStore<?> store, int maxElementsPerNode, double splitEffectiveness) {
		this.store = store;
		this.maxElementsPerNode = maxElementsPerNode;
		this.splitEffectiveness = splitEffectiveness;
		this.dimensions = store.dimensions();
		this.boxKeys = store.hasBoxKeys();
		this.nodes = new NodeTable(dimensions, boxKeys, Math.max(4, store.size() / maxElementsPerNode / 2));
		this.min = new double[dimensions];
		this.max = new double[dimensions];
	}

	/**
	 * Builds the tree. An empty store yields an empty table (no root).
	 */
	NodeTable build() {
		if (store.size() == 0) {
			return nodes;
		}
		store.bound(0, store.size(), min, max);
		push(nodes.add(NodeTable.NONE, 0, store.size(), min, max, 0));

		while (workSize > 0) {
			int node = workList[--workSize];
			splitNode(node);
			// low, middle, high pushed in turn; the order only changes memory layout
			if (nodes.getLowChild(node) != NodeTable.NONE) {
				push(nodes.getLowChild(node));
			}
			if (nodes.getMiddleChild(node) != NodeTable.NONE) {
				push(nodes.getMiddleChild(node));
			}
			if (nodes.getHighChild(node) != NodeTable.NONE) {
				push(nodes.getHighChild(node));
			}
		}
		if (abandonedSplits > 0) {
			log.trace("{} node splits abandoned", abandonedSplits);
		}
		return nodes;
	}

	private void push(int node) {
		if (workSize == workList.length) {
			workList = Arrays.copyOf(workList, workSize * 2);
		}
		workList[workSize++] = node;
	}

	private void splitNode(int node) {
		int count = nodes.getElementCount(node);
		if (count <= maxElementsPerNode) {
			return;
		}

		int axis = chooseSplitAxis(node);
		if (axis < 0) {
			// every axis locked or of zero extent
			return;
		}

		double nodeMin = nodes.getMin(node, axis);
		double nodeMax = nodes.getMax(node, axis);
		// halved separately so that extents above Double.MAX_VALUE do not overflow
		double splitPosition = nodeMin * 0.5 + nodeMax * 0.5;

		int begin = nodes.getElementsBegin(node);
		int end = nodes.getElementsEnd(node);
		int lowCount;
		int highCount;
		if (boxKeys) {
			int[] counts = ElementPartitioner.partitionBoxes(store, begin, end, axis, splitPosition);
			lowCount = counts[0];
			highCount = counts[1];
			if (lowCount + highCount < splitEffectiveness * count) {
				abandon(node, count, "too many elements straddle the split plane");
				return;
			}
		} else {
			lowCount = ElementPartitioner.partitionPoints(store, begin, end, axis, splitPosition);
			highCount = count - lowCount;
		}

		double lowChildMax = lowCount > 0 ? maxHigh(begin, begin + lowCount, axis, nodeMin) : nodeMin;
		double highChildMin = highCount > 0 ? minLow(end - highCount, end, axis, nodeMax) : nodeMax;
		if ((lowCount == count && lowChildMax >= nodeMax) || (highCount == count && highChildMin <= nodeMin)) {
			// one-sided split that would not shrink the bounds (midpoint rounded onto an end)
			abandon(node, count, "split does not separate the elements");
			return;
		}

		nodes.setSplit(node, axis, splitPosition);
		int lockedAxes = nodes.getLockedAxes(node);

		if (lowCount > 0) {
			nodes.copyBounds(node, min, max);
			max[axis] = lowChildMax;
			nodes.setLowChild(node, nodes.add(node, begin, begin + lowCount, min, max, lockedAxes));
		}
		if (highCount > 0) {
			nodes.copyBounds(node, min, max);
			min[axis] = highChildMin;
			nodes.setHighChild(node, nodes.add(node, end - highCount, end, min, max, lockedAxes));
		}

		int middleCount = count - lowCount - highCount;
		if (middleCount > 0 && middleCount <= maxElementsPerNode) {
			// few straddling elements: keep them here alongside the children
			nodes.setElementRange(node, begin + lowCount, end - highCount);
			return;
		}
		if (middleCount > 0) {
			int middleBegin = begin + lowCount;
			int middleEnd = end - highCount;
			nodes.copyBounds(node, min, max);
			min[axis] = minLow(middleBegin, middleEnd, axis, nodeMax);
			max[axis] = maxHigh(middleBegin, middleEnd, axis, nodeMin);
			nodes.setMiddleChild(node, nodes.add(node, middleBegin, middleEnd, min, max, lockedAxes | (1 << axis)));
		}
		nodes.setElementRange(node, NodeTable.NONE, NodeTable.NONE);
	}

	private int chooseSplitAxis(int node) {
		int axis = -1;
		double maxSize = 0;
		for (int i = 0; i < dimensions; i++) {
			double size = nodes.getMax(node, i) - nodes.getMin(node, i);
			if (size > maxSize && !nodes.isAxisLocked(node, i)) {
				maxSize = size;
				axis = i;
			}
		}
		return axis;
	}

	private void abandon(int node, int count, String reason) {
		abandonedSplits++;
		if (log.isTraceEnabled()) {
			log.trace("Node {} kept as a leaf of {} elements: {}", node, count, reason);
		}
	}

	// smallest lower bound in [begin, end) on axis, no greater than limit
	private double minLow(int begin, int end, int axis, double limit) {
		double result = limit;
		for (int i = begin; i < end; i++) {
			result = Math.min(result, store.getLow(i, axis));
		}
		return result;
	}

	// largest upper bound in [begin, end) on axis, no less than limit
	private double maxHigh(int begin, int end, int axis, double limit) {
		double result = limit;
		for (int i = begin; i < end; i++) {
			result = Math.max(result, store.getHigh(i, axis));
		}
		return result;
	}
}
