package com.github.micycle1.boxtree;

import java.util.Arrays;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * An immutable N-dimensional axis-aligned box.
 * <p>
 * A box is either <em>empty</em> (the sentinel returned by {@link #empty(int)},
 * which intersects and contains nothing) or spans the closed interval
 * {@code [min[i], max[i]]} on every axis {@code i}. Boxes are the query shape
 * for range queries and the bounding shape stored per tree node. For
 * two-dimensional data, {@link #fromEnvelope(Envelope)} and
 * {@link #toEnvelope()} convert to and from JTS envelopes.
 */
public final class Box {

	private final double[] min;
	private final double[] max;
	private final boolean empty;

	private Box(double[] min, double[] max, boolean empty) {
		this.min = min;
		this.max = max;
		this.empty = empty;
	}

	/**
	 * Returns the empty box of the given dimension count.
	 *
	 * @param dimensions the number of axes (must be &gt; 0)
	 * @return an empty box
	 */
	public static Box empty(int dimensions) {
		if (dimensions <= 0) {
			throw new IllegalArgumentException("dimensions must be > 0");
		}
		double[] nan = new double[dimensions];
		Arrays.fill(nan, Double.NaN);
		return new Box(nan, nan.clone(), true);
	}

	/**
	 * Creates a box from its minimum and maximum corners. The arrays are copied.
	 *
	 * @param min the low corner
	 * @param max the high corner
	 * @return the box
	 * @throws IllegalArgumentException if the corners have different or zero
	 *                                  lengths, contain NaN, or
	 *                                  {@code min[i] > max[i]} on any axis
	 */
	public static Box of(double[] min, double[] max) {
		if (min.length == 0 || min.length != max.length) {
			throw new IllegalArgumentException("min and max must have the same, non-zero dimension count");
		}
		for (int i = 0; i < min.length; i++) {
			if (Double.isNaN(min[i]) || Double.isNaN(max[i]) || min[i] > max[i]) {
				throw new IllegalArgumentException("Invalid extent on axis " + i + ": [" + min[i] + ", " + max[i] + "]");
			}
		}
		return new Box(min.clone(), max.clone(), false);
	}

	/**
	 * Creates the degenerate box covering a single point.
	 *
	 * @param point the point coordinates
	 * @return a zero-extent box at {@code point}
	 */
	public static Box ofPoint(double... point) {
		return of(point, point);
	}

	/**
	 * Creates the smallest box enclosing both corners, whatever their order.
	 *
	 * @param a one corner
	 * @param b the opposite corner
	 * @return the enclosing box
	 */
	public static Box bound(double[] a, double[] b) {
		if (a.length != b.length) {
			throw new IllegalArgumentException("Corners must have the same dimension count");
		}
		double[] lo = new double[a.length];
		double[] hi = new double[a.length];
		for (int i = 0; i < a.length; i++) {
			lo[i] = Math.min(a[i], b[i]);
			hi[i] = Math.max(a[i], b[i]);
		}
		return of(lo, hi);
	}

	/**
	 * Converts a JTS envelope into a two-dimensional box. A null envelope
	 * ({@link Envelope#isNull()}) maps to the empty box.
	 *
	 * @param env the envelope
	 * @return the equivalent box
	 */
	public static Box fromEnvelope(Envelope env) {
		if (env.isNull()) {
			return empty(2);
		}
		return new Box(new double[] { env.getMinX(), env.getMinY() }, new double[] { env.getMaxX(), env.getMaxY() }, false);
	}

	/**
	 * Creates the degenerate two-dimensional box at a JTS coordinate (the z
	 * ordinate is ignored).
	 *
	 * @param c the coordinate
	 * @return a zero-extent box
	 */
	public static Box fromCoordinate(Coordinate c) {
		return ofPoint(c.x, c.y);
	}

	// takes ownership of the arrays
	static Box wrap(double[] min, double[] max) {
		return new Box(min, max, false);
	}

	/**
	 * Converts this two-dimensional box to a JTS envelope.
	 *
	 * @return the envelope; a null envelope if this box is empty
	 * @throws IllegalStateException if this box is not two-dimensional
	 */
	public Envelope toEnvelope() {
		if (min.length != 2) {
			throw new IllegalStateException("Only 2D boxes convert to an Envelope, this box has " + min.length + " dimensions");
		}
		if (empty) {
			return new Envelope();
		}
		return new Envelope(min[0], max[0], min[1], max[1]);
	}

	public int getDimensions() {
		return min.length;
	}

	public boolean isEmpty() {
		return empty;
	}

	public double getMin(int axis) {
		return min[axis];
	}

	public double getMax(int axis) {
		return max[axis];
	}

	/**
	 * @return a copy of the low corner
	 */
	public double[] getMin() {
		return min.clone();
	}

	/**
	 * @return a copy of the high corner
	 */
	public double[] getMax() {
		return max.clone();
	}

	/**
	 * Returns the extent of this box along an axis ({@code 0} for an empty box).
	 */
	public double getSize(int axis) {
		return empty ? 0 : max[axis] - min[axis];
	}

	public double[] getCenter() {
		double[] c = new double[min.length];
		for (int i = 0; i < c.length; i++) {
			c[i] = (min[i] + max[i]) * 0.5;
		}
		return c;
	}

	/**
	 * Tests whether this box and another share at least one point. Touching
	 * boundaries count as intersecting. Empty boxes intersect nothing.
	 *
	 * @param other a box of the same dimension count
	 * @return true if the boxes overlap
	 */
	public boolean intersects(Box other) {
		checkDimensions(other.min.length);
		if (empty || other.empty) {
			return false;
		}
		for (int i = 0; i < min.length; i++) {
			if (max[i] < other.min[i] || min[i] > other.max[i]) {
				return false;
			}
		}
		return true;
	}

	public boolean contains(double... point) {
		checkDimensions(point.length);
		if (empty) {
			return false;
		}
		for (int i = 0; i < min.length; i++) {
			if (point[i] < min[i] || point[i] > max[i]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Tests whether {@code other} lies entirely inside this box. The empty box is
	 * contained by every non-empty box.
	 */
	public boolean contains(Box other) {
		checkDimensions(other.min.length);
		if (empty) {
			return false;
		}
		if (other.empty) {
			return true;
		}
		for (int i = 0; i < min.length; i++) {
			if (other.min[i] < min[i] || other.max[i] > max[i]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Computes the squared Euclidean distance from a point to the closest point of
	 * this box. Points inside the box are at distance {@code 0}.
	 *
	 * @param point a point of the same dimension count
	 * @return the squared distance, or {@link Double#POSITIVE_INFINITY} for an
	 *         empty box
	 */
	public double distanceSquared(double... point) {
		checkDimensions(point.length);
		if (empty) {
			return Double.POSITIVE_INFINITY;
		}
		double sum = 0;
		for (int i = 0; i < min.length; i++) {
			double d = 0;
			if (point[i] < min[i]) {
				d = min[i] - point[i];
			} else if (point[i] > max[i]) {
				d = point[i] - max[i];
			}
			sum += d * d;
		}
		return sum;
	}

	/**
	 * Returns the smallest box enclosing this box and {@code other}.
	 */
	public Box expandToInclude(Box other) {
		checkDimensions(other.min.length);
		if (other.empty) {
			return this;
		}
		if (empty) {
			return other;
		}
		double[] lo = new double[min.length];
		double[] hi = new double[min.length];
		for (int i = 0; i < lo.length; i++) {
			lo[i] = Math.min(min[i], other.min[i]);
			hi[i] = Math.max(max[i], other.max[i]);
		}
		return new Box(lo, hi, false);
	}

	private void checkDimensions(int dimensions) {
		if (dimensions != min.length) {
			throw new IllegalArgumentException("Dimension mismatch: expected " + min.length + " but was " + dimensions);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Box)) {
			return false;
		}
		Box other = (Box) obj;
		if (min.length != other.min.length) {
			return false;
		}
		if (empty || other.empty) {
			return empty == other.empty;
		}
		return Arrays.equals(min, other.min) && Arrays.equals(max, other.max);
	}

	@Override
	public int hashCode() {
		if (empty) {
			return 31 * min.length;
		}
		return 31 * Arrays.hashCode(min) + Arrays.hashCode(max);
	}

	@Override
	public String toString() {
		if (empty) {
			return "Box[empty, " + min.length + "D]";
		}
		return "Box[" + Arrays.toString(min) + " - " + Arrays.toString(max) + "]";
	}
}
