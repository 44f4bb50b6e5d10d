package com.github.micycle1.boxtree;

import java.util.Objects;
import java.util.function.Function;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Extracts the spatial key of a tree element.
 * <p>
 * A {@link StaticBoxTree} never inspects its elements directly; it reads each
 * element's key through an adapter exactly once, when the tree is created, and
 * caches the coordinates. Adapters for point keys report the same value from
 * {@link #getLow(Object, int)} and {@link #getHigh(Object, int)}.
 * <p>
 * Use the static factories for the common cases, e.g.
 *
 * <pre>{@code
 * SpatialKeyAdapter<Feature<Envelope>> keys = SpatialKeyAdapter.envelopes(Feature::getKey);
 * }</pre>
 *
 * @param <T> the element type
 */
public interface SpatialKeyAdapter<T> {

	/** Axis-lock flags are stored in an {@code int} bit set. */
	int MAX_DIMENSIONS = 32;

	SpatialKeyKind kind();

	int dimensions();

	/**
	 * Returns the lower bound of the element's key on an axis.
	 */
	double getLow(T element, int axis);

	/**
	 * Returns the upper bound of the element's key on an axis.
	 */
	double getHigh(T element, int axis);

	default boolean isBox() {
		return kind() == SpatialKeyKind.BOX;
	}

	/**
	 * Accessor for one ordinate of a point key.
	 *
	 * @param <T> the element type
	 */
	@FunctionalInterface
	interface PointAccessor<T> {
		double get(T element, int axis);
	}

	/**
	 * Accessor for one bound of a box key; {@code high} selects the upper bound.
	 *
	 * @param <T> the element type
	 */
	@FunctionalInterface
	interface BoxAccessor<T> {
		double get(T element, int axis, boolean high);
	}

	/**
	 * Creates an adapter for N-dimensional point keys.
	 *
	 * @param dimensions number of axes, in {@code [1, MAX_DIMENSIONS]}
	 * @param accessor   reads ordinate {@code axis} of an element
	 */
	static <T> SpatialKeyAdapter<T> points(int dimensions, PointAccessor<T> accessor) {
		checkDimensions(dimensions);
		Objects.requireNonNull(accessor, "accessor");
		return new SpatialKeyAdapter<>() {
			@Override
			public SpatialKeyKind kind() {
				return SpatialKeyKind.POINT;
			}

			@Override
			public int dimensions() {
				return dimensions;
			}

			@Override
			public double getLow(T element, int axis) {
				return accessor.get(element, axis);
			}

			@Override
			public double getHigh(T element, int axis) {
				return accessor.get(element, axis);
			}
		};
	}

	/**
	 * Creates an adapter for N-dimensional box keys.
	 *
	 * @param dimensions number of axes, in {@code [1, MAX_DIMENSIONS]}
	 * @param accessor   reads the low or high bound on {@code axis} of an element
	 */
	static <T> SpatialKeyAdapter<T> boxes(int dimensions, BoxAccessor<T> accessor) {
		checkDimensions(dimensions);
		Objects.requireNonNull(accessor, "accessor");
		return new SpatialKeyAdapter<>() {
			@Override
			public SpatialKeyKind kind() {
				return SpatialKeyKind.BOX;
			}

			@Override
			public int dimensions() {
				return dimensions;
			}

			@Override
			public double getLow(T element, int axis) {
				return accessor.get(element, axis, false);
			}

			@Override
			public double getHigh(T element, int axis) {
				return accessor.get(element, axis, true);
			}
		};
	}

	/**
	 * Adapter for elements that are themselves {@code double[]} points.
	 */
	static SpatialKeyAdapter<double[]> identityPoints(int dimensions) {
		return points(dimensions, (p, axis) -> p[axis]);
	}

	/**
	 * Adapter for elements that are themselves {@link Box}es.
	 */
	static SpatialKeyAdapter<Box> identityBoxes(int dimensions) {
		return boxes(dimensions, (b, axis, high) -> high ? b.getMax(axis) : b.getMin(axis));
	}

	/**
	 * Creates a two-dimensional point adapter reading a JTS {@link Coordinate}
	 * (x, y) from each element.
	 */
	static <T> SpatialKeyAdapter<T> coordinates(Function<? super T, Coordinate> key) {
		Objects.requireNonNull(key, "key");
		return points(2, (e, axis) -> axis == 0 ? key.apply(e).x : key.apply(e).y);
	}

	/**
	 * Creates a two-dimensional box adapter reading a JTS {@link Envelope} from
	 * each element.
	 */
	static <T> SpatialKeyAdapter<T> envelopes(Function<? super T, Envelope> key) {
		Objects.requireNonNull(key, "key");
		return boxes(2, (e, axis, high) -> {
			Envelope env = key.apply(e);
			if (axis == 0) {
				return high ? env.getMaxX() : env.getMinX();
			}
			return high ? env.getMaxY() : env.getMinY();
		});
	}

	private static void checkDimensions(int dimensions) {
		if (dimensions <= 0 || dimensions > MAX_DIMENSIONS) {
			throw new IllegalArgumentException("dimensions must be in [1, " + MAX_DIMENSIONS + "], was " + dimensions);
		}
	}
}
