package com.github.micycle1.boxtree;

import java.util.ArrayList;
import java.util.List;

/**
 * Branch-and-bound k-nearest-neighbour search over the stackless traversal.
 * <p>
 * At an internal node the middle child is entered first, then the child on the
 * target's side of the split plane; the far child is entered only while the
 * squared distance from the target to the split plane can still beat the
 * current bound. The bound starts at the squared search radius (or unbounded)
 * and tightens to the k-th best squared distance once k results are held.
 * <p>
 * Results are kept ascending by squared distance. Equidistant elements keep the
 * order in which the traversal found them, and while the list is full a
 * candidate must be strictly closer than the current worst to enter it.
 */
final class NearestNeighborQuery extends TreeTraversal {

	private final ElementStore<?> store;
	private final double[] target;
	private final int nearestCount;
	private final QueryStats stats;
	private final List<Neighbor> result;

	private double worstDistance2;

	NearestNeighborQuery(NodeTable nodes, ElementStore<?> store, double[] target, int nearestCount, double maxDistance, QueryStats stats) {
		super(nodes, nodes.size() > 0 ? 0 : NodeTable.NONE);
		this.store = store;
		this.target = target;
		this.nearestCount = nearestCount;
		this.stats = stats;
		this.result = nearestCount > 0 ? new ArrayList<>(nearestCount) : new ArrayList<>();
		this.worstDistance2 = maxDistance > 0 ? maxDistance * maxDistance : Double.POSITIVE_INFINITY;
	}

	List<Neighbor> run() {
		if (!isValid()) {
			return result;
		}
		do {
			if (stats != null) {
				stats.addNodeVisit();
			}
			scoreElements(node);
		} while (advance());
		return result;
	}

	private boolean isFull() {
		return nearestCount > 0 && result.size() == nearestCount;
	}

	/**
	 * Tests a squared distance against the current bound: inclusive while the
	 * list still has room (the radius is inclusive), strict once it is full.
	 */
	private boolean withinBound(double distance2) {
		return isFull() ? distance2 < worstDistance2 : distance2 <= worstDistance2;
	}

	private void scoreElements(int nodeIndex) {
		int end = nodes.getElementsEnd(nodeIndex);
		for (int i = nodes.getElementsBegin(nodeIndex); i < end; i++) {
			if (stats != null) {
				stats.addDistanceEvaluation();
			}
			double distance2 = store.distanceSquared(i, target);
			if (withinBound(distance2)) {
				insert(i, distance2);
			}
		}
	}

	private void insert(int elementIndex, double distance2) {
		if (isFull()) {
			result.remove(result.size() - 1);
		}
		// upper bound: after any equal distances already held
		int lo = 0;
		int hi = result.size();
		while (lo < hi) {
			int mid = (lo + hi) >>> 1;
			if (result.get(mid).getDistanceSquared() <= distance2) {
				lo = mid + 1;
			} else {
				hi = mid;
			}
		}
		result.add(lo, new Neighbor(elementIndex, distance2));
		if (isFull()) {
			worstDistance2 = result.get(result.size() - 1).getDistanceSquared();
		}
	}

	private double planeDistance2(int nodeIndex) {
		double d = target[nodes.getSplitAxis(nodeIndex)] - nodes.getSplitPosition(nodeIndex);
		return d * d;
	}

	private boolean isLowSide(int nodeIndex) {
		return target[nodes.getSplitAxis(nodeIndex)] < nodes.getSplitPosition(nodeIndex);
	}

	/**
	 * Returns the near child of a split node, or the far child when the near one
	 * is absent and the split plane is still within the bound.
	 */
	private int nearChild(int parent) {
		int low = nodes.getLowChild(parent);
		int high = nodes.getHighChild(parent);
		if (isLowSide(parent)) {
			if (low != NodeTable.NONE) {
				return low;
			}
			return high != NodeTable.NONE && withinPruneBound(parent) ? high : NodeTable.NONE;
		}
		if (high != NodeTable.NONE) {
			return high;
		}
		return low != NodeTable.NONE && withinPruneBound(parent) ? low : NodeTable.NONE;
	}

	private boolean withinPruneBound(int parent) {
		return withinBound(planeDistance2(parent));
	}

	@Override
	int firstChild(int parent) {
		if (nodes.getSplitAxis(parent) == NodeTable.NONE) {
			return NodeTable.NONE;
		}
		int middle = nodes.getMiddleChild(parent);
		if (middle != NodeTable.NONE) {
			return middle;
		}
		return nearChild(parent);
	}

	@Override
	int nextSibling(int child) {
		int parent = nodes.getParent(child);
		if (parent == NodeTable.NONE) {
			return NodeTable.NONE;
		}
		if (child == nodes.getMiddleChild(parent)) {
			return nearChild(parent);
		}
		boolean lowSide = isLowSide(parent);
		if (child == nodes.getLowChild(parent)) {
			// low was the far side, both sides done
			if (!lowSide) {
				return NodeTable.NONE;
			}
			int high = nodes.getHighChild(parent);
			return high != NodeTable.NONE && withinPruneBound(parent) ? high : NodeTable.NONE;
		}
		if (lowSide) {
			return NodeTable.NONE;
		}
		int low = nodes.getLowChild(parent);
		return low != NodeTable.NONE && withinPruneBound(parent) ? low : NodeTable.NONE;
	}
}
