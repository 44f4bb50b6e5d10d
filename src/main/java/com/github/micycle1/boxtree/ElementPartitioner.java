package com.github.micycle1.boxtree;

/**
 * In-place partitioning of an element range around an axis-aligned split plane.
 * <p>
 * Both partitions are single O(n) passes with O(1) extra space and are
 * unstable: no ordering is kept within a zone.
 */
final class ElementPartitioner {

	private static final int LOW = 0;
	private static final int MIDDLE = 1;
	private static final int HIGH = 2;

	private ElementPartitioner() {
	}

	/**
	 * Partitions the point keys in {@code [begin, end)} so that every element with
	 * an ordinate below {@code splitPosition} on {@code axis} precedes every
	 * element at or above it.
	 *
	 * @return the number of elements on the low side
	 */
	static int partitionPoints(ElementStore<?> store, int begin, int end, int axis, double splitPosition) {
		int lo = begin;
		int hi = end - 1;
		while (true) {
			while (lo <= hi && store.getLow(lo, axis) < splitPosition) {
				lo++;
			}
			while (lo <= hi && store.getLow(hi, axis) >= splitPosition) {
				hi--;
			}
			if (lo >= hi) {
				return lo - begin;
			}
			store.swap(lo, hi);
			lo++;
			hi--;
		}
	}

	/**
	 * Partitions the box keys in {@code [begin, end)} into three contiguous zones:
	 * boxes entirely below {@code splitPosition} on {@code axis} (upper bound
	 * {@code < splitPosition}), boxes straddling it, and boxes entirely at or
	 * above it (lower bound {@code >= splitPosition}).
	 * <p>
	 * Cursor layout during the scan:
	 *
	 * <pre>
	 * [begin, lowEnd)          low
	 * [lowEnd, currentLow)     middle
	 * [currentLow, currentHigh] not yet classified
	 * (currentHigh, highEnd]   middle
	 * (highEnd, end)           high
	 * </pre>
	 *
	 * @return {@code {lowCount, highCount}}; the middle count is the remainder
	 */
	static int[] partitionBoxes(ElementStore<?> store, int begin, int end, int axis, double splitPosition) {
		int lowEnd = begin;
		int currentLow = begin;
		int currentHigh = end - 1;
		int highEnd = end - 1;

		while (true) {
			// stops at the first high element, or once everything is classified
			for (; currentLow <= currentHigh; currentLow++) {
				int zone = classify(store, currentLow, axis, splitPosition);
				if (zone == HIGH) {
					break;
				}
				if (zone == LOW) {
					store.swap(lowEnd++, currentLow);
				}
			}

			// element at currentLow (if still unclassified) is high; find a low one to trade
			for (; currentLow < currentHigh; currentHigh--) {
				int zone = classify(store, currentHigh, axis, splitPosition);
				if (zone == LOW) {
					break;
				}
				if (zone == HIGH) {
					store.swap(currentHigh, highEnd--);
				}
			}

			if (currentLow < currentHigh) {
				// high at currentLow, low at currentHigh
				store.swap(currentLow, currentHigh);
				store.swap(lowEnd++, currentLow++);
				store.swap(currentHigh--, highEnd--);
				continue;
			}

			if (currentLow == currentHigh) {
				// a single high element left at the crossing point
				store.swap(currentLow, highEnd--);
			}
			return new int[] { lowEnd - begin, end - 1 - highEnd };
		}
	}

	private static int classify(ElementStore<?> store, int index, int axis, double splitPosition) {
		if (store.getHigh(index, axis) < splitPosition) {
			return LOW;
		}
		if (store.getLow(index, axis) >= splitPosition) {
			return HIGH;
		}
		return MIDDLE;
	}
}
