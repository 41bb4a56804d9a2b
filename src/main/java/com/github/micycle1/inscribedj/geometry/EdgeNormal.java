package com.github.micycle1.inscribedj.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.math.Vector2D;

import com.github.micycle1.inscribedj.DegenerateEdgeException;
import com.github.micycle1.inscribedj.InscribedConstants;

/**
 * A polygon edge together with the unit normal of its supporting line.
 * <p>
 * The normal is the edge direction rotated by -90 degrees, i.e. (dy, -dx) for
 * direction (dx, dy). On a clockwise ring this points into the polygon; on a
 * counter-clockwise ring it points out of it (see {@link #flip()}).
 */
public class EdgeNormal {

	private final int index;
	private final LineSegment segment;
	private final Vector2D normalUnit; /* unit length */

	/**
	 * @param index   position of the edge in its ring
	 * @param segment edge from vertex index to vertex index+1
	 * @throws DegenerateEdgeException if the segment has zero length
	 */
	public EdgeNormal(int index, LineSegment segment) {
		this.index = index;
		this.segment = new LineSegment(segment.p0.copy(), segment.p1.copy());

		Vector2D direction = new Vector2D(segment.p0, segment.p1);
		if (direction.lengthSquared() <= InscribedConstants.ZERO_DIST_SQ) {
			throw new DegenerateEdgeException(index, segment);
		}
		// [dx dy] * [[0 1] [-1 0]]
		this.normalUnit = new Vector2D(direction.getY(), -direction.getX()).normalize();
	}

	private EdgeNormal(int index, LineSegment segment, Vector2D normalUnit) {
		this.index = index;
		this.segment = segment;
		this.normalUnit = normalUnit;
	}

	/**
	 * The same edge with its normal pointing the other way.
	 */
	public EdgeNormal flip() {
		return new EdgeNormal(index, segment, normalUnit.negate());
	}

	public int getIndex() {
		return index;
	}

	public LineSegment getSegment() {
		return new LineSegment(segment.p0.copy(), segment.p1.copy());
	}

	/**
	 * Edge start; the point the supporting line is anchored at.
	 */
	public Coordinate getStart() {
		return segment.p0.copy();
	}

	public Vector2D getUnitNormal() {
		return normalUnit;
	}

	/**
	 * Dot product of the normal with the edge start. The supporting line is the
	 * set of points p with n.p = offset.
	 */
	public double getOffset() {
		return normalUnit.getX() * segment.p0.x + normalUnit.getY() * segment.p0.y;
	}

	/**
	 * Signed perpendicular distance n.(p - start) from the supporting line;
	 * positive on the side the normal points to.
	 */
	public double signedDistance(Coordinate p) {
		return normalUnit.getX() * (p.x - segment.p0.x) + normalUnit.getY() * (p.y - segment.p0.y);
	}

	@Override
	public String toString() {
		return "EdgeNormal{" + index + ": " + segment + ", n=" + normalUnit + '}';
	}
}
