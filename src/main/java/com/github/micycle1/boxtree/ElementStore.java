package com.github.micycle1.boxtree;

import java.util.Collection;

/**
 * The permuted, contiguous element sequence of a tree, with each element's key
 * cached in flat coordinate arrays ({@code index * dimensions + axis}).
 * <p>
 * Point stores share one coordinate array for low and high bounds. The builder
 * reorders elements with {@link #swap(int, int)}, which moves values and keys
 * together; nothing else mutates a store.
 *
 * @param <T> the element type
 */
final class ElementStore<T> {

	private final Object[] values; // Java cannot create a generic array of T
	private final double[] lows;
	private final double[] highs;
	private final int dimensions;
	private final boolean boxKeys;

	ElementStore(Collection<? extends T> elements, SpatialKeyAdapter<? super T> adapter) {
		this.dimensions = adapter.dimensions();
		this.boxKeys = adapter.isBox();
		int n = elements.size();
		this.values = new Object[n];
		this.lows = new double[n * dimensions];
		this.highs = boxKeys ? new double[n * dimensions] : lows;

		int i = 0;
		for (T element : elements) {
			values[i] = element;
			int offset = i * dimensions;
			for (int axis = 0; axis < dimensions; axis++) {
				double lo = adapter.getLow(element, axis);
				if (!Double.isFinite(lo)) {
					throw new IllegalArgumentException("Element " + i + " has a non-finite key ordinate on axis " + axis + ": " + lo);
				}
				lows[offset + axis] = lo;
				if (boxKeys) {
					double hi = adapter.getHigh(element, axis);
					if (!Double.isFinite(hi) || hi < lo) {
						throw new IllegalArgumentException("Element " + i + " has an invalid box extent on axis " + axis + ": [" + lo + ", " + hi + "]");
					}
					highs[offset + axis] = hi;
				}
			}
			i++;
		}
	}

	int size() {
		return values.length;
	}

	int dimensions() {
		return dimensions;
	}

	boolean hasBoxKeys() {
		return boxKeys;
	}

	@SuppressWarnings("unchecked")
	T get(int index) {
		return (T) values[index];
	}

	double getLow(int index, int axis) {
		return lows[index * dimensions + axis];
	}

	double getHigh(int index, int axis) {
		return highs[index * dimensions + axis];
	}

	/**
	 * Returns the key of an element as a box (degenerate for points).
	 */
	Box getKey(int index) {
		int offset = index * dimensions;
		double[] lo = new double[dimensions];
		double[] hi = new double[dimensions];
		System.arraycopy(lows, offset, lo, 0, dimensions);
		System.arraycopy(highs, offset, hi, 0, dimensions);
		return Box.wrap(lo, hi);
	}

	void swap(int i, int j) {
		Object tmp = values[i];
		values[i] = values[j];
		values[j] = tmp;

		swapCoords(lows, i, j);
		if (boxKeys) {
			swapCoords(highs, i, j);
		}
	}

	private void swapCoords(double[] coords, int i, int j) {
		int a = i * dimensions;
		int b = j * dimensions;
		for (int axis = 0; axis < dimensions; axis++) {
			double tmp = coords[a + axis];
			coords[a + axis] = coords[b + axis];
			coords[b + axis] = tmp;
		}
	}

	/**
	 * Computes the bounding box of the elements in {@code [begin, end)} into
	 * {@code min}/{@code max}.
	 *
	 * @return false if the range is empty (the arrays are left untouched)
	 */
	boolean bound(int begin, int end, double[] min, double[] max) {
		if (begin >= end) {
			return false;
		}
		int offset = begin * dimensions;
		System.arraycopy(lows, offset, min, 0, dimensions);
		System.arraycopy(highs, offset, max, 0, dimensions);
		for (int i = begin + 1; i < end; i++) {
			offset = i * dimensions;
			for (int axis = 0; axis < dimensions; axis++) {
				double lo = lows[offset + axis];
				double hi = highs[offset + axis];
				if (lo < min[axis]) {
					min[axis] = lo;
				}
				if (hi > max[axis]) {
					max[axis] = hi;
				}
			}
		}
		return true;
	}

	/**
	 * Tests whether an element's key intersects the closed box
	 * {@code [min, max]}.
	 */
	boolean intersects(int index, double[] min, double[] max) {
		int offset = index * dimensions;
		for (int axis = 0; axis < dimensions; axis++) {
			if (highs[offset + axis] < min[axis] || lows[offset + axis] > max[axis]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Squared distance from a point to an element's key (zero inside a box key).
	 */
	double distanceSquared(int index, double[] point) {
		int offset = index * dimensions;
		double sum = 0;
		for (int axis = 0; axis < dimensions; axis++) {
			double p = point[axis];
			double lo = lows[offset + axis];
			double d;
			if (p < lo) {
				d = lo - p;
			} else {
				double hi = highs[offset + axis];
				d = p > hi ? p - hi : 0;
			}
			sum += d * d;
		}
		return sum;
	}
}
