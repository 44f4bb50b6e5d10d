package com.github.micycle1.boxtree;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

/**
 * Structural and range-query tests for StaticBoxTree. Query results are checked
 * against a brute-force scan of the dataset (and against a JTS STRtree for
 * envelope data); structure is checked node by node.
 */
public class StaticBoxTreeTest {

	private static final SpatialKeyAdapter<Feature<Coordinate>> POINT_KEYS = SpatialKeyAdapter.coordinates(Feature::getKey);
	private static final SpatialKeyAdapter<Feature<Envelope>> BOX_KEYS = SpatialKeyAdapter.envelopes(Feature::getKey);

	@Test
	public void testEmptyTree() {
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS);
		tree.create(new ArrayList<>());

		assertTrue(tree.isEmpty());
		assertEquals(0, tree.getNodeCount());
		assertEquals(0, tree.getDepth());
		assertNull(tree.getRoot());
		assertEquals(0, tree.getBounds().length);
		assertFalse(tree.nodes().iterator().hasNext());
		assertFalse(tree.rangeQuery(new Envelope(-1e9, 1e9, -1e9, 1e9)).hasNext());
		assertTrue(tree.query(new Envelope(0, 1, 0, 1)).isEmpty());
		assertEquals(tree.endRangeQuery(), tree.rangeQuery(Box.of(new double[] { 0, 0 }, new double[] { 1, 1 })));
	}

	@Test
	public void testUnbuiltTreeBehavesAsEmpty() {
		StaticBoxTree<double[]> tree = new StaticBoxTree<>(SpatialKeyAdapter.identityPoints(3));
		assertTrue(tree.isEmpty());
		assertNull(tree.getRoot());
		assertTrue(tree.queryNearest(new double[] { 0, 0, 0 }, 5).isEmpty());
		assertNull(tree.nearestNeighbor(new double[] { 0, 0, 0 }));
	}

	@Test
	public void testSmallDatasetIsSingleLeaf() {
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(POINT_KEYS);
		tree.create(DatasetMaker.uniformPoints(StaticBoxTree.DEFAULT_MAX_ELEMENTS_PER_NODE, 100, 1));

		assertEquals(1, tree.getNodeCount());
		assertEquals(1, tree.getDepth());
		TreeNode root = tree.getRoot();
		assertTrue(root.isRoot());
		assertTrue(root.isLeaf());
		assertEquals(-1, root.getSplitAxis());
		assertEquals(0, root.getElementsBegin());
		assertEquals(tree.size(), root.getElementsEnd());
	}

	@Test
	public void testIdenticalBoxesTerminate() {
		List<Box> items = new ArrayList<>();
		for (int i = 0; i < 100; i++) {
			items.add(Box.of(new double[] { 0, 0 }, new double[] { 1, 1 }));
		}

		// every box straddles every split: the default threshold rejects the split
		StaticBoxTree<Box> tree = new StaticBoxTree<>(SpatialKeyAdapter.identityBoxes(2), 4);
		tree.create(items);
		assertEquals(1, tree.getNodeCount());

		// without the threshold, each axis gets locked in turn until none is left
		StaticBoxTree<Box> locking = new StaticBoxTree<>(SpatialKeyAdapter.identityBoxes(2), 4, 0);
		locking.create(items);
		assertEquals(3, locking.getNodeCount());
		assertEquals(3, locking.getDepth());
		TreeNode middle = locking.getNode(locking.getRoot().getMiddleChild());
		assertTrue(middle.isAxisLocked(0));
		TreeNode last = locking.getNode(middle.getMiddleChild());
		assertTrue(last.isAxisLocked(0));
		assertTrue(last.isAxisLocked(1));
		assertTrue(last.isLeaf());
		assertEquals(100, last.getElementCount());
		assertStructure(locking);
		assertEquals(100, locking.query(Box.ofPoint(0.5, 0.5)).size());
	}

	@Test
	public void testIdenticalPointsTerminate() {
		List<double[]> items = new ArrayList<>();
		for (int i = 0; i < 500; i++) {
			items.add(new double[] { 3, 4 });
		}
		StaticBoxTree<double[]> tree = new StaticBoxTree<>(SpatialKeyAdapter.identityPoints(2), 8);
		tree.create(items);

		assertEquals(1, tree.getNodeCount());
		assertEquals(500, tree.query(Box.ofPoint(3, 4)).size());
	}

	@Test
	public void testFourBoxExample() {
		for (int capacity : new int[] { 0, 1 }) {
			StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, capacity);
			tree.create(new Feature<>(1, new Envelope(0, 1, 0, 1)), new Feature<>(2, new Envelope(1, 2, 0, 1)),
					new Feature<>(3, new Envelope(0, 1, 1, 2)), new Feature<>(4, new Envelope(2, 3, 2, 3)));
			assertStructure(tree);

			assertEquals(Set.of(1L, 2L, 3L), ids(tree.query(new Envelope(0, 1.5, 0, 1.5))), "capacity " + capacity);
			assertEquals(Set.of(4L), ids(tree.query(new Envelope(2, 3, 2, 3))), "capacity " + capacity);
		}
	}

	@Test
	public void testDefaultsAndConfiguration() {
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, -5);
		assertEquals(StaticBoxTree.DEFAULT_MAX_ELEMENTS_PER_NODE, tree.getMaxElementsPerNode());
		assertEquals(StaticBoxTree.DEFAULT_SPLIT_EFFECTIVENESS, tree.getSplitEffectiveness());
		assertEquals(SpatialKeyKind.BOX, tree.getKeyKind());
		assertEquals(2, tree.getDimensions());

		assertThrows(IllegalArgumentException.class, () -> new StaticBoxTree<>(BOX_KEYS, 8, 1.5));
		assertThrows(IllegalArgumentException.class, () -> new StaticBoxTree<>(BOX_KEYS, 8, Double.NaN));
	}

	@Test
	public void testPointTreeStructure() {
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(POINT_KEYS, 8);
		tree.create(DatasetMaker.uniformPoints(5000, 1000, 2));

		assertTrue(tree.getNodeCount() > 1);
		assertStructure(tree);
		for (TreeNode node : tree.nodes()) {
			assertEquals(-1, node.getMiddleChild());
			if (node.isLeaf()) {
				assertTrue(node.getElementCount() <= 8, "oversized leaf " + node);
			} else {
				assertEquals(0, node.getElementCount(), "split point node keeps elements " + node);
			}
		}
	}

	@Test
	public void testBoxTreeStructure() {
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, 8);
		tree.create(DatasetMaker.uniformBoxes(5000, 1000, 40, 3));

		assertTrue(tree.getNodeCount() > 1);
		assertStructure(tree);
	}

	@Test
	public void testNodesPreOrder() {
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, 4, 0.5);
		tree.create(DatasetMaker.uniformBoxes(2000, 100, 10, 4));

		List<TreeNode> visited = new ArrayList<>();
		tree.nodes().forEach(visited::add);
		assertEquals(tree.getRoot(), visited.get(0));
		assertEquals(tree.getNodeCount(), visited.size());
		Set<Integer> indices = new HashSet<>();
		for (TreeNode node : visited) {
			assertTrue(indices.add(node.getIndex()), "node visited twice: " + node);
			// pre-order: a parent is always visited before its children
			if (!node.isRoot()) {
				assertTrue(indices.contains(node.getParent()));
			}
		}

		// a subtree walk stays inside the subtree
		TreeNode child = tree.getNode(tree.getRoot().getLowChild());
		int count = 0;
		for (TreeNode node : tree.nodes(child)) {
			assertTrue(isInSubtree(tree, node, child), node + " outside subtree of " + child);
			count++;
		}
		assertTrue(count >= 1 && count < tree.getNodeCount());
	}

	@Test
	public void testNodeIteratorExhaustion() {
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(POINT_KEYS, 2);
		tree.create(DatasetMaker.uniformPoints(10, 10, 5));
		Iterator<TreeNode> it = tree.nodes().iterator();
		while (it.hasNext()) {
			it.next();
		}
		assertThrows(NoSuchElementException.class, it::next);
	}

	@Test
	public void testPointRangeQueryAgainstBruteForce() {
		List<Feature<Coordinate>> items = DatasetMaker.uniformPoints(20000, 1000, 6);
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(POINT_KEYS, 16);
		tree.create(items);

		for (Envelope window : DatasetMaker.queryWindows(300, 1000, 35, 7)) {
			Set<Long> expected = new HashSet<>();
			for (Feature<Coordinate> f : items) {
				if (window.intersects(f.getKey())) {
					expected.add(f.getId());
				}
			}
			List<Feature<Coordinate>> found = tree.query(window);
			assertEquals(expected.size(), found.size(), "duplicate or missing results for " + window);
			assertEquals(expected, ids(found), "Result mismatch for " + window);
		}
	}

	@Test
	public void testBoxRangeQueryAgainstBruteForce() {
		List<Feature<Envelope>> items = DatasetMaker.uniformBoxes(20000, 1000, 30, 8);
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, 16);
		tree.create(items);

		for (Envelope window : DatasetMaker.queryWindows(300, 1000, 20, 9)) {
			Set<Long> expected = new HashSet<>();
			for (Feature<Envelope> f : items) {
				if (window.intersects(f.getKey())) {
					expected.add(f.getId());
				}
			}
			List<Feature<Envelope>> found = tree.query(window);
			assertEquals(expected.size(), found.size(), "duplicate or missing results for " + window);
			assertEquals(expected, ids(found), "Result mismatch for " + window);
		}
	}

	@Test
	public void testBoxRangeQueryAgainstSTRtree() {
		List<Feature<Envelope>> items = DatasetMaker.uniformBoxes(10000, 500, 50, 10);
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, 10);
		tree.create(items);
		STRtree strTree = new STRtree();
		for (Feature<Envelope> f : items) {
			strTree.insert(f.getKey(), f);
		}
		strTree.build();

		for (Envelope window : DatasetMaker.queryWindows(200, 500, 25, 11)) {
			@SuppressWarnings("unchecked")
			List<Feature<Envelope>> expected = strTree.query(window);
			assertEquals(ids(expected), ids(tree.query(window)), "Result mismatch for " + window);
		}
	}

	@Test
	public void testThreeDimensionalRangeQuery() {
		Random rnd = new Random(12);
		List<Feature<double[]>> items = new ArrayList<>();
		for (int i = 0; i < 8000; i++) {
			items.add(new Feature<>(i, new double[] { rnd.nextDouble() * 100, rnd.nextDouble() * 100, rnd.nextInt(20) }));
		}
		SpatialKeyAdapter<Feature<double[]>> keys = SpatialKeyAdapter.points(3, (f, axis) -> f.getKey()[axis]);
		StaticBoxTree<Feature<double[]>> tree = new StaticBoxTree<>(keys, 12);
		tree.create(items);
		assertEquals(3, tree.getDimensions());
		assertStructure(tree);

		for (int q = 0; q < 200; q++) {
			double[] a = { rnd.nextDouble() * 100, rnd.nextDouble() * 100, rnd.nextInt(20) };
			double[] b = { rnd.nextDouble() * 100, rnd.nextDouble() * 100, rnd.nextInt(20) };
			Box range = Box.bound(a, b);
			Set<Long> expected = new HashSet<>();
			for (Feature<double[]> f : items) {
				if (range.contains(f.getKey())) {
					expected.add(f.getId());
				}
			}
			assertEquals(expected, ids(tree.query(range)), "Result mismatch for " + range);
		}
	}

	@Test
	public void testTouchingBoundariesIntersect() {
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS);
		tree.create(new Feature<>(1, new Envelope(0, 1, 0, 1)));

		assertEquals(1, tree.query(new Envelope(1, 2, 1, 2)).size());
		assertEquals(1, tree.query(Box.ofPoint(1, 0.5)).size());
		assertEquals(0, tree.query(new Envelope(1.0001, 2, 0, 1)).size());
	}

	@Test
	public void testEmptyRangeMatchesNothing() {
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(POINT_KEYS);
		tree.create(DatasetMaker.uniformPoints(100, 10, 13));

		assertFalse(tree.rangeQuery(Box.empty(2)).hasNext());
		assertFalse(tree.rangeQuery(new Envelope()).hasNext());
	}

	@Test
	public void testSubtreeRangeQuery() {
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, 8);
		tree.create(DatasetMaker.uniformBoxes(3000, 100, 6, 14));
		Box everything = Box.of(new double[] { -1, -1 }, new double[] { 101, 101 });

		TreeNode high = tree.getNode(tree.getRoot().getHighChild());
		Set<Integer> expected = subtreeElements(tree, high);
		Set<Integer> found = new HashSet<>();
		RangeQueryIterator<Feature<Envelope>> it = tree.rangeQuery(high, everything);
		while (it.hasNext()) {
			Feature<Envelope> f = it.next();
			assertSame(f, tree.getElement(it.getElementIndex()));
			assertTrue(found.add(it.getElementIndex()));
		}
		assertEquals(expected, found);
		assertTrue(found.size() < tree.size());

		// from the root, the subtree form equals the whole-tree query
		assertEquals(tree.query(everything), collect(tree.rangeQuery(tree.getRoot(), everything)));
	}

	@Test
	public void testIteratorProtocol() {
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(POINT_KEYS, 4);
		tree.create(DatasetMaker.uniformPoints(1000, 100, 15));
		Envelope window = new Envelope(10, 40, 10, 40);

		RangeQueryIterator<Feature<Coordinate>> it = tree.rangeQuery(window);
		assertThrows(IllegalStateException.class, it::getElementIndex);
		assertTrue(it.hasNext());
		assertNotEquals(tree.endRangeQuery(), it);
		assertEquals(it, tree.rangeQuery(window));

		int count = 0;
		while (it.hasNext()) {
			it.next();
			count++;
		}
		assertEquals(tree.query(window).size(), count);
		assertEquals(tree.endRangeQuery(), it);
		assertEquals(tree.endRangeQuery().hashCode(), it.hashCode());
		assertThrows(NoSuchElementException.class, it::next);
	}

	@Test
	public void testVisitorEarlyExit() {
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(POINT_KEYS, 4);
		tree.create(DatasetMaker.uniformPoints(1000, 100, 16));

		List<Feature<Coordinate>> visited = new ArrayList<>();
		tree.query(Box.of(new double[] { 0, 0 }, new double[] { 100, 100 }), item -> {
			visited.add(item);
			return visited.size() < 5;
		});
		assertEquals(5, visited.size());
	}

	@Test
	public void testRecreateIsQueryEquivalent() {
		List<Feature<Envelope>> items = DatasetMaker.uniformBoxes(4000, 200, 10, 17);
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, 12);
		tree.create(items);
		Envelope[] windows = DatasetMaker.queryWindows(100, 200, 15, 18);
		List<Set<Long>> before = new ArrayList<>();
		for (Envelope window : windows) {
			before.add(ids(tree.query(window)));
		}
		TreeNode oldRoot = tree.getRoot();

		List<Feature<Envelope>> shuffled = new ArrayList<>(items);
		Collections.shuffle(shuffled, new Random(19));
		tree.create(shuffled);

		for (int i = 0; i < windows.length; i++) {
			assertEquals(before.get(i), ids(tree.query(windows[i])), "Result mismatch for " + windows[i]);
			// repeated queries on one structure agree
			assertEquals(tree.query(windows[i]), tree.query(windows[i]));
		}
		// nodes of the discarded structure are rejected
		assertThrows(IllegalArgumentException.class, () -> tree.nodes(oldRoot));
		assertThrows(IllegalArgumentException.class, () -> tree.rangeQuery(oldRoot, Box.ofPoint(1, 1)));
	}

	@Test
	public void testQueryStats() {
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(BOX_KEYS, 8);
		tree.create(DatasetMaker.uniformBoxes(5000, 1000, 20, 20));
		QueryStats stats = new QueryStats();

		RangeQueryIterator<Feature<Envelope>> it = tree.rangeQuery(Box.fromEnvelope(new Envelope(100, 150, 100, 150)), stats);
		int count = 0;
		while (it.hasNext()) {
			it.next();
			count++;
		}
		assertTrue(count > 0);
		assertTrue(stats.getNodesVisited() > 0);
		assertTrue(stats.getNodeOverlapTests() > 0);
		assertTrue(stats.getElementOverlapTests() >= count);
		// pruning: far fewer element tests than a full scan
		assertTrue(stats.getElementOverlapTests() < tree.size(), stats.toString());

		stats.reset();
		assertEquals(0, stats.getNodesVisited());
		assertEquals(0, stats.getElementOverlapTests());
	}

	@Test
	public void testElementsView() {
		List<Feature<Coordinate>> items = DatasetMaker.uniformPoints(300, 10, 21);
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(POINT_KEYS, 4);
		tree.create(items);

		List<Feature<Coordinate>> elements = tree.getElements();
		assertEquals(items.size(), elements.size());
		assertEquals(new HashSet<>(items), new HashSet<>(elements));
		for (int i = 0; i < elements.size(); i++) {
			assertSame(elements.get(i), tree.getElement(i));
			assertEquals(Box.fromCoordinate(elements.get(i).getKey()), tree.getElementKey(i));
		}
		assertThrows(UnsupportedOperationException.class, () -> elements.add(items.get(0)));
		assertThrows(IndexOutOfBoundsException.class, () -> tree.getElement(items.size()));
		assertThrows(IndexOutOfBoundsException.class, () -> tree.getElementKey(-1));
		assertThrows(IndexOutOfBoundsException.class, () -> tree.getNode(tree.getNodeCount()));
	}

	@Test
	public void testInvalidInput() {
		StaticBoxTree<Box> boxes = new StaticBoxTree<>(SpatialKeyAdapter.identityBoxes(2));
		StaticBoxTree<double[]> points = new StaticBoxTree<>(SpatialKeyAdapter.identityPoints(2));

		assertThrows(IllegalArgumentException.class, () -> points.create(List.of(new double[] { 1, Double.NaN })));
		// an inverted box cannot be built as a Box, so go through a raw adapter
		SpatialKeyAdapter<double[]> intervals = SpatialKeyAdapter.boxes(1, (b, axis, high) -> high ? b[1] : b[0]);
		StaticBoxTree<double[]> raw = new StaticBoxTree<>(intervals);
		assertThrows(IllegalArgumentException.class, () -> raw.create(List.of(new double[] { 2, 1 })));

		boxes.create(Box.ofPoint(0, 0));
		assertThrows(IllegalArgumentException.class, () -> boxes.rangeQuery(Box.ofPoint(0, 0, 0)));
		assertThrows(NullPointerException.class, () -> boxes.rangeQuery((Box) null));
		assertThrows(IllegalArgumentException.class, () -> boxes.query(Box.ofPoint(1)));
	}

	@Test
	public void testNonFiniteOrdinatesRejected() {
		List<Feature<Coordinate>> points = new ArrayList<>(DatasetMaker.uniformPoints(400, 1, 22));
		points.add(new Feature<>(400, new Coordinate(Double.NEGATIVE_INFINITY, 0.5)));
		StaticBoxTree<Feature<Coordinate>> pointTree = new StaticBoxTree<>(POINT_KEYS, 8);
		pointTree.create(points.subList(0, 400));
		int nodeCount = pointTree.getNodeCount();
		assertThrows(IllegalArgumentException.class, () -> pointTree.create(points));
		// a rejected dataset leaves the previous structure in place
		assertEquals(400, pointTree.size());
		assertEquals(nodeCount, pointTree.getNodeCount());

		StaticBoxTree<Feature<Envelope>> boxTree = new StaticBoxTree<>(BOX_KEYS, 8);
		assertThrows(IllegalArgumentException.class, () -> boxTree.create(new Feature<>(1, new Envelope(0, Double.POSITIVE_INFINITY, 0, 1))));
		assertThrows(IllegalArgumentException.class, () -> boxTree.create(new Feature<>(1, new Envelope(Double.NEGATIVE_INFINITY, 0, 0, 1))));
	}

	@Test
	public void testHugeExtentStillSplits() {
		// extent of 2e308 exceeds Double.MAX_VALUE
		List<double[]> items = new ArrayList<>();
		for (int i = 0; i <= 100; i++) {
			items.add(new double[] { (i - 50) * 2e306, 0 });
		}
		StaticBoxTree<double[]> tree = new StaticBoxTree<>(SpatialKeyAdapter.identityPoints(2), 8);
		tree.create(items);

		TreeNode root = tree.getRoot();
		assertEquals(0, root.getSplitAxis());
		assertEquals(0, root.getSplitPosition());
		assertTrue(tree.getNodeCount() > 1);
		assertStructure(tree);
		assertEquals(51, tree.query(Box.of(new double[] { -Double.MAX_VALUE, -1 }, new double[] { 0, 1 })).size());
	}

	private static Set<Long> ids(List<? extends Feature<?>> features) {
		Set<Long> ids = new HashSet<>();
		for (Feature<?> f : features) {
			ids.add(f.getId());
		}
		return ids;
	}

	private static <T> List<T> collect(RangeQueryIterator<T> it) {
		List<T> out = new ArrayList<>();
		it.forEachRemaining(out::add);
		return out;
	}

	private static boolean isInSubtree(StaticBoxTree<?> tree, TreeNode node, TreeNode root) {
		int i = node.getIndex();
		while (i != -1) {
			if (i == root.getIndex()) {
				return true;
			}
			i = tree.getNode(i).getParent();
		}
		return false;
	}

	private static Set<Integer> subtreeElements(StaticBoxTree<?> tree, TreeNode root) {
		Set<Integer> out = new HashSet<>();
		for (TreeNode node : tree.nodes(root)) {
			for (int i = node.getElementsBegin(); i >= 0 && i < node.getElementsEnd(); i++) {
				out.add(i);
			}
		}
		return out;
	}

	/**
	 * Checks that every element is owned by exactly one node and enclosed by its
	 * bounds, that children nest in their parents, and that elements sit on the
	 * correct side of every split plane above them.
	 */
	private static void assertStructure(StaticBoxTree<?> tree) {
		int[] owner = new int[tree.size()];
		Arrays.fill(owner, -1);

		for (TreeNode node : tree.nodes()) {
			Box box = node.getBox();
			for (int i = node.getElementsBegin(); i >= 0 && i < node.getElementsEnd(); i++) {
				assertEquals(-1, owner[i], "element " + i + " owned twice");
				owner[i] = node.getIndex();
				assertTrue(box.contains(tree.getElementKey(i)), "element " + i + " outside bounds of " + node);
			}
			if (!node.isRoot()) {
				TreeNode parent = tree.getNode(node.getParent());
				assertTrue(parent.getBox().contains(box), node + " not inside parent " + parent);
				for (int axis = 0; axis < tree.getDimensions(); axis++) {
					if (parent.isAxisLocked(axis)) {
						assertTrue(node.isAxisLocked(axis), "lock on axis " + axis + " not inherited by " + node);
					}
				}
			}

			int axis = node.getSplitAxis();
			if (axis < 0) {
				assertTrue(node.isLeaf(), "unsplit node has children: " + node);
				continue;
			}
			assertFalse(node.isAxisLocked(axis), "split on a locked axis: " + node);
			double split = node.getSplitPosition();
			for (int i = node.getElementsBegin(); i >= 0 && i < node.getElementsEnd(); i++) {
				Box key = tree.getElementKey(i);
				assertTrue(key.getMin(axis) < split && key.getMax(axis) >= split, "kept element " + key + " does not straddle " + node);
			}
			if (node.getLowChild() >= 0) {
				for (int i : subtreeElements(tree, tree.getNode(node.getLowChild()))) {
					assertTrue(tree.getElementKey(i).getMax(axis) < split, "low side element " + i + " reaches split of " + node);
				}
			}
			if (node.getHighChild() >= 0) {
				for (int i : subtreeElements(tree, tree.getNode(node.getHighChild()))) {
					assertTrue(tree.getElementKey(i).getMin(axis) >= split, "high side element " + i + " below split of " + node);
				}
			}
			if (node.getMiddleChild() >= 0) {
				TreeNode middle = tree.getNode(node.getMiddleChild());
				assertTrue(middle.isAxisLocked(axis), "middle child not locked on split axis: " + middle);
				for (int i : subtreeElements(tree, middle)) {
					Box key = tree.getElementKey(i);
					assertTrue(key.getMin(axis) < split && key.getMax(axis) >= split, "middle element " + key + " does not straddle " + node);
				}
			}
		}
		for (int i = 0; i < owner.length; i++) {
			assertTrue(owner[i] >= 0, "element " + i + " owned by no node");
		}
	}
}
