package com.github.micycle1.boxtree;

/**
 * One result of a nearest-neighbour query: the index of an element in
 * {@link StaticBoxTree#getElements()} and its squared distance to the query
 * location.
 */
public final class Neighbor {

	private final int elementIndex;
	private final double distanceSquared;

	Neighbor(int elementIndex, double distanceSquared) {
		this.elementIndex = elementIndex;
		this.distanceSquared = distanceSquared;
	}

	public int getElementIndex() {
		return elementIndex;
	}

	public double getDistanceSquared() {
		return distanceSquared;
	}

	public double getDistance() {
		return Math.sqrt(distanceSquared);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Neighbor)) {
			return false;
		}
		Neighbor other = (Neighbor) obj;
		return elementIndex == other.elementIndex && Double.compare(distanceSquared, other.distanceSquared) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * elementIndex + Double.hashCode(distanceSquared);
	}

	@Override
	public String toString() {
		return "Neighbor[" + elementIndex + ", d2=" + distanceSquared + "]";
	}
}
