package com.github.micycle1.boxtree;

import java.util.Objects;

/**
 * A simple identified spatial element: a numeric id and a spatial key.
 * <p>
 * Two features are equal when their ids are equal, regardless of their keys.
 * Pair with {@link SpatialKeyAdapter#coordinates(java.util.function.Function)}
 * or {@link SpatialKeyAdapter#envelopes(java.util.function.Function)} using
 * {@code Feature::getKey}.
 *
 * @param <K> the key type, e.g. a JTS {@code Coordinate} or {@code Envelope}
 */
public final class Feature<K> {

	private final long id;
	private final K key;

	public Feature(long id, K key) {
		this.id = id;
		this.key = Objects.requireNonNull(key, "key");
	}

	public long getId() {
		return id;
	}

	public K getKey() {
		return key;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		return obj instanceof Feature && ((Feature<?>) obj).id == id;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(id);
	}

	@Override
	public String toString() {
		return "Feature[" + id + ": " + key + "]";
	}
}
