package com.github.micycle1.boxtree;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Synthetic uniform datasets of point and box features.
 */
class DatasetMaker {

	static List<Feature<Coordinate>> uniformPoints(int count, double extent, long seed) {
		SplittableRandom rnd = new SplittableRandom(seed);
		List<Feature<Coordinate>> out = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			out.add(new Feature<>(i, new Coordinate(rnd.nextDouble(0, extent), rnd.nextDouble(0, extent))));
		}
		return out;
	}

	/**
	 * Squares of random size up to {@code maxSize}, centred uniformly and clipped
	 * to {@code [0, extent]}.
	 */
	static List<Feature<Envelope>> uniformBoxes(int count, double extent, double maxSize, long seed) {
		SplittableRandom rnd = new SplittableRandom(seed);
		Envelope clip = new Envelope(0, extent, 0, extent);
		List<Feature<Envelope>> out = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			double x = rnd.nextDouble(0, extent);
			double y = rnd.nextDouble(0, extent);
			double half = rnd.nextDouble() * maxSize / 2;
			Envelope env = new Envelope(x - half, x + half, y - half, y + half).intersection(clip);
			out.add(new Feature<>(i, env));
		}
		return out;
	}

	static Coordinate[] uniformCoordinates(int count, double extent, long seed) {
		SplittableRandom rnd = new SplittableRandom(seed);
		Coordinate[] out = new Coordinate[count];
		for (int i = 0; i < count; i++) {
			out[i] = new Coordinate(rnd.nextDouble(0, extent), rnd.nextDouble(0, extent));
		}
		return out;
	}

	static Envelope[] queryWindows(int count, double extent, double size, long seed) {
		SplittableRandom rnd = new SplittableRandom(seed);
		Envelope[] out = new Envelope[count];
		for (int i = 0; i < count; i++) {
			double x = rnd.nextDouble(0, extent - size);
			double y = rnd.nextDouble(0, extent - size);
			out[i] = new Envelope(x, x + size, y, y + size);
		}
		return out;
	}
}
