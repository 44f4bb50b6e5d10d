package com.github.micycle1.boxtree;

/**
 * Counters describing the work done by queries, for profiling pruning
 * effectiveness.
 * <p>
 * Pass an instance to a query to have it accumulate into the counters. An
 * instance is not thread-safe; use one per querying thread.
 */
public final class QueryStats {

	private long nodesVisited;
	private long nodeOverlapTests;
	private long elementOverlapTests;
	private long distanceEvaluations;

	/** Nodes entered by a traversal. */
	public long getNodesVisited() {
		return nodesVisited;
	}

	/** Node bounds tested against a range query box. */
	public long getNodeOverlapTests() {
		return nodeOverlapTests;
	}

	/** Element keys tested against a range query box. */
	public long getElementOverlapTests() {
		return elementOverlapTests;
	}

	/** Element keys scored by a nearest-neighbour query. */
	public long getDistanceEvaluations() {
		return distanceEvaluations;
	}

	void addNodeVisit() {
		nodesVisited++;
	}

	void addNodeOverlapTest() {
		nodeOverlapTests++;
	}

	void addElementOverlapTest() {
		elementOverlapTests++;
	}

	void addDistanceEvaluation() {
		distanceEvaluations++;
	}

	public void reset() {
		nodesVisited = 0;
		nodeOverlapTests = 0;
		elementOverlapTests = 0;
		distanceEvaluations = 0;
	}

	@Override
	public String toString() {
		return "QueryStats[nodesVisited=" + nodesVisited + ", nodeOverlapTests=" + nodeOverlapTests + ", elementOverlapTests=" + elementOverlapTests
				+ ", distanceEvaluations=" + distanceEvaluations + "]";
	}
}
