package com.github.micycle1.boxtree;

import java.util.Locale;

/**
 * The kind of spatial key an index is built over.
 * <p>
 * Point keys are N-dimensional coordinate tuples; box keys are axis-aligned
 * boxes that may straddle a split plane, which is what makes the box tree need
 * middle nodes and axis locking.
 */
public enum SpatialKeyKind {

	POINT, BOX;

	/**
	 * Parses a kind from its lower-case name ({@code "point"} or {@code "box"}).
	 *
	 * @param name the name to parse (case-insensitive, surrounding whitespace
	 *             ignored)
	 * @return the matching kind
	 * @throws IllegalArgumentException if {@code name} is null or unknown
	 */
	public static SpatialKeyKind fromString(String name) {
		if (name != null) {
			switch (name.trim().toLowerCase(Locale.ROOT)) {
				case "point":
					return POINT;
				case "box":
					return BOX;
				default:
					break;
			}
		}
		throw new IllegalArgumentException("Unknown spatial key kind: " + name);
	}

	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}
}
