package com.github.micycle1.inscribedj;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;

/**
 * A circle given by its center and a non-negative radius.
 */
public final class InscribedCircle {

	private final Coordinate center;
	private final double radius;

	public InscribedCircle(Coordinate center, double radius) {
		Objects.requireNonNull(center, "center");
		if (!(radius >= 0)) { // also rejects NaN
			throw new IllegalArgumentException("Radius must be non-negative: " + radius);
		}
		this.center = new CoordinateXY(center.x, center.y);
		this.radius = radius;
	}

	public Coordinate getCenter() {
		return center.copy();
	}

	public double getRadius() {
		return radius;
	}

	public double getDiameter() {
		return 2 * radius;
	}

	/**
	 * Whether the point lies inside or on the circle.
	 */
	public boolean contains(Coordinate p) {
		return center.distance(p) <= radius;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof InscribedCircle)) {
			return false;
		}
		InscribedCircle other = (InscribedCircle) o;
		return Double.compare(radius, other.radius) == 0 && Double.compare(center.x, other.center.x) == 0
				&& Double.compare(center.y, other.center.y) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(center.x, center.y, radius);
	}

	@Override
	public String toString() {
		return "InscribedCircle{c=(" + center.x + ", " + center.y + "), r=" + radius + '}';
	}
}
