package com.github.micycle1.boxtree;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.hprtree.HPRtree;
import org.locationtech.jts.index.strtree.STRtree;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 1, time = 1)
@Measurement(iterations = 2, time = 2)
@Fork(value = 1, jvmArgsAppend = { "-Xms1g", "-Xmx1g", "-XX:+AlwaysPreTouch" })
public class BenchmarkStaticBoxTree {

	@Param({ "100000" })
	public int n;

	@Param({ "10" })
	public double windowSize;

	@Param({ "1", "16" })
	public int nearestCount;

	private static final int numQueries = 5000;
	private static final double extent = 1000;

	private List<Feature<Coordinate>> points;
	private List<Feature<Envelope>> boxes;

	private StaticBoxTree<Feature<Coordinate>> pointTree;
	private StaticBoxTree<Feature<Envelope>> boxTree;
	private STRtree strBoxes;
	private HPRtree hprBoxes;

	private Envelope[] windows;
	private Coordinate[] targets;

	@Setup(Level.Trial)
	public void setup() {
		points = DatasetMaker.uniformPoints(n, extent, 13);
		boxes = DatasetMaker.uniformBoxes(n, extent, 1, 13);

		pointTree = new StaticBoxTree<>(SpatialKeyAdapter.coordinates(Feature::getKey));
		pointTree.create(points);
		boxTree = new StaticBoxTree<>(SpatialKeyAdapter.envelopes(Feature::getKey));
		boxTree.create(boxes);

		strBoxes = new STRtree();
		hprBoxes = new HPRtree();
		for (Feature<Envelope> f : boxes) {
			strBoxes.insert(f.getKey(), f);
			hprBoxes.insert(f.getKey(), f);
		}
		strBoxes.build();
		hprBoxes.build();

		windows = DatasetMaker.queryWindows(numQueries, extent, windowSize, 42);
		targets = DatasetMaker.uniformCoordinates(numQueries, extent, 42);
	}

	// ----------------------------
	// Build
	// ----------------------------

	@Benchmark
	public void b0buildPoints(Blackhole bh) {
		StaticBoxTree<Feature<Coordinate>> tree = new StaticBoxTree<>(SpatialKeyAdapter.coordinates(Feature::getKey));
		tree.create(points);
		bh.consume(tree);
	}

	@Benchmark
	public void b0buildBoxes(Blackhole bh) {
		StaticBoxTree<Feature<Envelope>> tree = new StaticBoxTree<>(SpatialKeyAdapter.envelopes(Feature::getKey));
		tree.create(boxes);
		bh.consume(tree);
	}

	// ----------------------------
	// Range query: Boxes
	// ----------------------------

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void b1rangeTreeBoxes(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			RangeQueryIterator<Feature<Envelope>> it = boxTree.rangeQuery(windows[i]);
			int count = 0;
			while (it.hasNext()) {
				bh.consume(it.next());
				count++;
			}
			bh.consume(count);
		}
	}

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void b1rangeSTRtreeBoxes(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			bh.consume(strBoxes.query(windows[i]));
		}
	}

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void b1rangeHPRtreeBoxes(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			bh.consume(hprBoxes.query(windows[i]));
		}
	}

	// ----------------------------
	// Nearest neighbor
	// ----------------------------

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void b2nearestTreePoints(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			bh.consume(pointTree.queryNearest(targets[i], nearestCount, 0));
		}
	}

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void b2nearestTreeBoxes(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			bh.consume(boxTree.queryNearest(targets[i], nearestCount, 0));
		}
	}

	@Benchmark
	@OperationsPerInvocation(numQueries)
	public void b2nearestSTRtreeBoxes(Blackhole bh) {
		for (int i = 0; i < numQueries; i++) {
			Envelope q = new Envelope(targets[i]);
			bh.consume(strBoxes.nearestNeighbour(q, null, (a, b) -> ((Envelope) a.getBounds()).distance((Envelope) b.getBounds()), nearestCount));
		}
	}
}
