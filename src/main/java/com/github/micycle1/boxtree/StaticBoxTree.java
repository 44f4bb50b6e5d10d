package com.github.micycle1.boxtree;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A static (bulk-built) k-d tree over point or box keys, supporting range
 * (window) queries and k-nearest-neighbour queries.
 * <p>
 * The tree is built once from a complete dataset by {@link #create(Collection)}
 * and is immutable afterwards; calling {@code create} again discards the
 * previous structure. Elements are copied into one contiguous sequence that the
 * tree reorders while building, and nodes live in an index-addressed table, so
 * the structure holds no per-node objects.
 * <p>
 * Features:
 * <ul>
 * <li>Keys of any dimension count up to {@value SpatialKeyAdapter#MAX_DIMENSIONS},
 * read through a {@link SpatialKeyAdapter}; JTS {@link Coordinate}s and
 * {@link Envelope}s for 2D data.</li>
 * <li>Box keys that straddle a split plane are kept in the splitting node or in
 * a <em>middle</em> child, so boxes never need to be duplicated.</li>
 * <li>Lazy range queries ({@link #rangeQuery(Box)}), optionally restricted to a
 * subtree, and a visitor form with early exit.</li>
 * <li>Nearest-neighbour queries by count and/or radius, with split-plane
 * pruning.</li>
 * </ul>
 * <p>
 * Thread-safety notes:
 * <ul>
 * <li>{@link #create(Collection)} is not synchronized and must not run
 * concurrently with any other call on the same tree.</li>
 * <li>Once built, any number of threads may query concurrently: queries only
 * read the structure and keep their traversal state in the returned iterator or
 * on the stack.</li>
 * </ul>
 *
 * @param <T> the type of the elements stored in the tree
 */
public class StaticBoxTree<T> {

	private static final Logger log = LoggerFactory.getLogger(StaticBoxTree.class);

	/** Default maximum number of elements a node holds before it is split. */
	public static final int DEFAULT_MAX_ELEMENTS_PER_NODE = 64;

	/**
	 * Default minimum fraction of a box node's elements that must fall entirely on
	 * one side of the split plane for the split to be kept.
	 */
	public static final double DEFAULT_SPLIT_EFFECTIVENESS = 0.75;

	private final SpatialKeyAdapter<? super T> adapter;
	private final int maxElementsPerNode;
	private final double splitEffectiveness;

	private ElementStore<T> store;
	private NodeTable nodes;

	/**
	 * Creates an empty tree with the default node capacity.
	 *
	 * @param adapter extracts the spatial key of each element
	 */
	public StaticBoxTree(SpatialKeyAdapter<? super T> adapter) {
		this(adapter, DEFAULT_MAX_ELEMENTS_PER_NODE);
	}

	/**
	 * Creates an empty tree with the given node capacity.
	 *
	 * @param adapter            extracts the spatial key of each element
	 * @param maxElementsPerNode nodes with more elements than this are split; a
	 *                           value &lt;= 0 selects
	 *                           {@value #DEFAULT_MAX_ELEMENTS_PER_NODE}
	 */
	public StaticBoxTree(SpatialKeyAdapter<? super T> adapter, int maxElementsPerNode) {
		this(adapter, maxElementsPerNode, DEFAULT_SPLIT_EFFECTIVENESS);
	}

	/**
	 * Creates an empty tree with the given node capacity and split-effectiveness
	 * threshold.
	 *
	 * @param adapter            extracts the spatial key of each element
	 * @param maxElementsPerNode nodes with more elements than this are split; a
	 *                           value &lt;= 0 selects
	 *                           {@value #DEFAULT_MAX_ELEMENTS_PER_NODE}
	 * @param splitEffectiveness for box keys, a split is abandoned (the node stays
	 *                           a leaf) when fewer than this fraction of its
	 *                           elements lie entirely on one side of the split
	 *                           plane. Must be in {@code [0, 1]}; ignored for
	 *                           point keys.
	 */
	public StaticBoxTree(SpatialKeyAdapter<? super T> adapter, int maxElementsPerNode, double splitEffectiveness) {
		this.adapter = Objects.requireNonNull(adapter, "adapter");
		if (!(splitEffectiveness >= 0 && splitEffectiveness <= 1)) {
			throw new IllegalArgumentException("splitEffectiveness must be in [0, 1], was " + splitEffectiveness);
		}
		this.maxElementsPerNode = maxElementsPerNode > 0 ? maxElementsPerNode : DEFAULT_MAX_ELEMENTS_PER_NODE;
		this.splitEffectiveness = splitEffectiveness;
		this.store = new ElementStore<>(List.of(), adapter);
		this.nodes = new NodeTable(adapter.dimensions(), adapter.isBox(), 0);
	}

	/**
	 * Builds the tree from a complete dataset, replacing any previous content.
	 * <p>
	 * The elements are copied into the tree's own storage, whose order afterwards
	 * is the tree's layout order (see {@link #getElements()}).
	 *
	 * @param elements the dataset; may be empty
	 * @throws IllegalArgumentException if an element's key has a NaN or infinite
	 *                                  ordinate or, for boxes, a low bound above
	 *                                  its high bound
	 */
	public void create(Collection<? extends T> elements) {
		Objects.requireNonNull(elements, "elements");
		long start = System.nanoTime();
		ElementStore<T> newStore = new ElementStore<>(elements, adapter);
		NodeTable newNodes = new TreeBuilder(newStore, maxElementsPerNode, splitEffectiveness).build();
		this.store = newStore;
		this.nodes = newNodes;
		if (log.isDebugEnabled()) {
			log.debug("Built {} tree of {} elements: {} nodes, depth {}, {} ms", adapter.kind(), newStore.size(), newNodes.size(), getDepth(),
					(System.nanoTime() - start) / 1_000_000);
		}
	}

	/**
	 * Builds the tree from an array of elements, replacing any previous content.
	 *
	 * @see #create(Collection)
	 */
	@SafeVarargs
	public final void create(T... elements) {
		create(Arrays.asList(elements));
	}

	public int size() {
		return store.size();
	}

	public boolean isEmpty() {
		return store.size() == 0;
	}

	public int getNodeCount() {
		return nodes.size();
	}

	public int getMaxElementsPerNode() {
		return maxElementsPerNode;
	}

	public double getSplitEffectiveness() {
		return splitEffectiveness;
	}

	public SpatialKeyKind getKeyKind() {
		return adapter.kind();
	}

	public int getDimensions() {
		return adapter.dimensions();
	}

	/**
	 * Returns the element stored at a position of the tree's layout order.
	 *
	 * @throws IndexOutOfBoundsException if the index is out of range
	 */
	public T getElement(int index) {
		Objects.checkIndex(index, store.size());
		return store.get(index);
	}

	/**
	 * Returns the spatial key of the element at {@code index}, as a box
	 * (degenerate for point keys).
	 */
	public Box getElementKey(int index) {
		Objects.checkIndex(index, store.size());
		return store.getKey(index);
	}

	/**
	 * Returns an unmodifiable view of the elements in the tree's layout order.
	 * Node element ranges and {@link Neighbor#getElementIndex()} index into this
	 * list.
	 */
	public List<T> getElements() {
		return new ElementList<>(store);
	}

	/**
	 * @return the root node, or {@code null} if the tree is empty
	 */
	public TreeNode getRoot() {
		return nodes.size() > 0 ? new TreeNode(nodes, 0) : null;
	}

	/**
	 * @throws IndexOutOfBoundsException if the index is out of range
	 */
	public TreeNode getNode(int index) {
		Objects.checkIndex(index, nodes.size());
		return new TreeNode(nodes, index);
	}

	/**
	 * Returns the bounds of every node, indexed by node index. Each box is a new
	 * object.
	 *
	 * @return the node bounds; an empty array if the tree is empty
	 */
	public Box[] getBounds() {
		Box[] bounds = new Box[nodes.size()];
		for (int i = 0; i < bounds.length; i++) {
			bounds[i] = nodes.getBox(i);
		}
		return bounds;
	}

	/**
	 * Returns the number of levels of the tree: 0 when empty, 1 for a single leaf.
	 */
	public int getDepth() {
		int n = nodes.size();
		int[] depth = new int[n];
		int maxDepth = 0;
		// parents always precede their children in the table
		for (int i = 0; i < n; i++) {
			int parent = nodes.getParent(i);
			depth[i] = parent == NodeTable.NONE ? 1 : depth[parent] + 1;
			maxDepth = Math.max(maxDepth, depth[i]);
		}
		return maxDepth;
	}

	/**
	 * Returns the nodes of the tree in pre-order (children low, middle, high).
	 */
	public Iterable<TreeNode> nodes() {
		NodeTable table = nodes;
		return () -> new NodeIterator(table, table.size() > 0 ? 0 : NodeTable.NONE);
	}

	/**
	 * Returns the nodes of the subtree rooted at {@code startNode} in pre-order.
	 */
	public Iterable<TreeNode> nodes(TreeNode startNode) {
		NodeTable table = checkNode(startNode);
		int start = startNode.getIndex();
		return () -> new NodeIterator(table, start);
	}

	/**
	 * Starts a lazy range query over the whole tree.
	 *
	 * @param range the query box; touching boundaries count as intersecting
	 * @return an iterator over the elements whose key intersects {@code range}
	 */
	public RangeQueryIterator<T> rangeQuery(Box range) {
		return rangeQuery(range, (QueryStats) null);
	}

	/**
	 * Starts a lazy range query over the whole tree, recording its work into
	 * {@code stats}.
	 *
	 * @param stats counters to update, or {@code null}
	 */
	public RangeQueryIterator<T> rangeQuery(Box range, QueryStats stats) {
		checkRange(range);
		return new RangeQueryIterator<>(nodes, store, nodes.size() > 0 ? 0 : NodeTable.NONE, range, stats);
	}

	/**
	 * Starts a lazy range query restricted to the subtree rooted at
	 * {@code startNode}.
	 */
	public RangeQueryIterator<T> rangeQuery(TreeNode startNode, Box range) {
		NodeTable table = checkNode(startNode);
		checkRange(range);
		return new RangeQueryIterator<>(table, store, startNode.getIndex(), range, null);
	}

	/**
	 * Starts a lazy range query with a two-dimensional JTS envelope.
	 */
	public RangeQueryIterator<T> rangeQuery(Envelope range) {
		return rangeQuery(Box.fromEnvelope(range));
	}

	/**
	 * Returns an iterator in the end state, equal to every exhausted range query
	 * iterator of this tree.
	 */
	public RangeQueryIterator<T> endRangeQuery() {
		return new RangeQueryIterator<>(nodes, store, NodeTable.NONE, Box.empty(adapter.dimensions()), null);
	}

	/**
	 * Returns the elements whose key intersects {@code range}, in traversal order.
	 *
	 * @return a list of matching elements; empty if none
	 */
	public List<T> query(Box range) {
		List<T> result = new ArrayList<>();
		query(range, item -> {
			result.add(item);
			return true; // keep visiting
		});
		return result;
	}

	/**
	 * Returns the elements whose key intersects a two-dimensional JTS envelope.
	 */
	public List<T> query(Envelope range) {
		return query(Box.fromEnvelope(range));
	}

	/**
	 * Visits the elements whose key intersects {@code range}. The visitor may
	 * return {@code false} to stop the traversal; no further elements are then
	 * visited.
	 */
	public void query(Box range, ItemVisitor<? super T> visitor) {
		RangeQueryIterator<T> it = rangeQuery(range);
		while (it.hasNext()) {
			if (!visitor.visitItem(it.next())) {
				return;
			}
		}
	}

	/**
	 * Finds the elements nearest to a location, by count and/or radius.
	 *
	 * @param target       the query location, one ordinate per axis
	 * @param nearestCount the maximum number of results; &lt;= 0 for no limit
	 *                     (then {@code maxDistance} must be positive)
	 * @param maxDistance  the search radius (inclusive); &lt;= 0 for no limit
	 * @return neighbours ascending by squared distance; equidistant elements in
	 *         the order they were found
	 * @throws IllegalArgumentException if neither {@code nearestCount} nor
	 *                                  {@code maxDistance} is positive, or the
	 *                                  target has the wrong dimension count or a
	 *                                  NaN ordinate
	 */
	public List<Neighbor> queryNearest(double[] target, int nearestCount, double maxDistance) {
		return queryNearest(target, nearestCount, maxDistance, null);
	}

	/**
	 * As {@link #queryNearest(double[], int, double)}, recording the query's work
	 * into {@code stats}.
	 *
	 * @param stats counters to update, or {@code null}
	 */
	public List<Neighbor> queryNearest(double[] target, int nearestCount, double maxDistance, QueryStats stats) {
		if (nearestCount <= 0 && !(maxDistance > 0)) {
			throw new IllegalArgumentException("Either nearestCount or maxDistance must be positive");
		}
		if (target.length != adapter.dimensions()) {
			throw new IllegalArgumentException("Target has " + target.length + " ordinates, tree has " + adapter.dimensions() + " dimensions");
		}
		for (int axis = 0; axis < target.length; axis++) {
			if (Double.isNaN(target[axis])) {
				throw new IllegalArgumentException("Target has a NaN ordinate on axis " + axis);
			}
		}
		return new NearestNeighborQuery(nodes, store, target.clone(), nearestCount, maxDistance, stats).run();
	}

	/**
	 * Finds the {@code nearestCount} elements nearest to a location.
	 */
	public List<Neighbor> queryNearest(double[] target, int nearestCount) {
		return queryNearest(target, nearestCount, 0);
	}

	/**
	 * Two-dimensional form of {@link #queryNearest(double[], int, double)} taking
	 * a JTS coordinate (z is ignored).
	 */
	public List<Neighbor> queryNearest(Coordinate target, int nearestCount, double maxDistance) {
		return queryNearest(new double[] { target.x, target.y }, nearestCount, maxDistance);
	}

	/**
	 * Returns the elements themselves, nearest first, for a nearest-neighbour
	 * query.
	 *
	 * @see #queryNearest(double[], int, double)
	 */
	public List<T> nearestElements(double[] target, int nearestCount, double maxDistance) {
		List<Neighbor> neighbors = queryNearest(target, nearestCount, maxDistance);
		List<T> result = new ArrayList<>(neighbors.size());
		for (Neighbor n : neighbors) {
			result.add(store.get(n.getElementIndex()));
		}
		return result;
	}

	/**
	 * Returns the single element nearest to a location.
	 *
	 * @return the nearest element, or {@code null} if the tree is empty
	 */
	public T nearestNeighbor(double[] target) {
		List<Neighbor> nearest = queryNearest(target, 1, 0);
		return nearest.isEmpty() ? null : store.get(nearest.get(0).getElementIndex());
	}

	private NodeTable checkNode(TreeNode node) {
		Objects.requireNonNull(node, "node");
		if (node.table() != nodes) {
			throw new IllegalArgumentException("Node does not belong to the current structure of this tree");
		}
		return nodes;
	}

	private void checkRange(Box range) {
		Objects.requireNonNull(range, "range");
		if (range.getDimensions() != adapter.dimensions()) {
			throw new IllegalArgumentException("Range has " + range.getDimensions() + " dimensions, tree has " + adapter.dimensions());
		}
	}

	/**
	 * Visitor used by {@link StaticBoxTree#query(Box, ItemVisitor)} to process
	 * elements that intersect a query box.
	 *
	 * @param <T> the type of elements visited
	 */
	@FunctionalInterface
	public interface ItemVisitor<T> {
		/**
		 * Invoked for each element whose key intersects the query box.
		 *
		 * @param item the element being visited
		 * @return {@code true} to continue visiting, {@code false} to stop the
		 *         traversal
		 */
		boolean visitItem(T item);
	}

	private static final class ElementList<T> extends AbstractList<T> implements RandomAccess {
		private final ElementStore<T> store;

		ElementList(ElementStore<T> store) {
			this.store = store;
		}

		@Override
		public T get(int index) {
			Objects.checkIndex(index, store.size());
			return store.get(index);
		}

		@Override
		public int size() {
			return store.size();
		}
	}
}
