package com.github.micycle1.inscribedj.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.algorithm.PointLocation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.inscribedj.DegeneratePolygonException;
import com.github.micycle1.inscribedj.InscribedConstants;

/**
 * The boundary of a simple polygon as an open ring of vertices. Edge i runs
 * from vertex i to vertex (i+1) mod n, so the closing edge is implicit.
 * <p>
 * Construction strips an explicit closing vertex (first vertex repeated as
 * last) and rejects inputs without an interior: fewer than three distinct
 * vertices, non-finite ordinates, or a ring whose area has collapsed to zero.
 * Consecutive duplicate vertices are kept, so that edge extraction can report
 * the zero-length edge they produce.
 * <p>
 * Self-intersection is not checked.
 */
public final class PolygonBoundary {

	private static final Logger LOGGER = LoggerFactory.getLogger(PolygonBoundary.class);

	private final Coordinate[] vertices; // open ring
	private final double signedArea; // positive when counter-clockwise
	private final boolean counterClockwise;
	private final Envelope envelope;

	private PolygonBoundary(Coordinate[] vertices) {
		this.vertices = vertices;
		this.envelope = new Envelope();
		for (Coordinate c : vertices) {
			envelope.expandToInclude(c);
		}
		Coordinate[] ring = getClosedRing();
		this.signedArea = -Area.ofRingSigned(ring); // JTS: positive for CW
		this.counterClockwise = Orientation.isCCWArea(ring);
	}

	/**
	 * Creates a boundary from an ordered vertex sequence, in either winding order.
	 * The sequence may or may not repeat its first vertex at the end.
	 *
	 * @throws DegeneratePolygonException if the vertices do not enclose an area
	 */
	public static PolygonBoundary of(Coordinate... vertices) {
		Objects.requireNonNull(vertices, "vertices");
		return of(Arrays.asList(vertices));
	}

	/**
	 * @see #of(Coordinate...)
	 */
	public static PolygonBoundary of(List<Coordinate> vertices) {
		Objects.requireNonNull(vertices, "vertices");
		List<Coordinate> ring = new ArrayList<>(vertices.size());
		for (Coordinate c : vertices) {
			Objects.requireNonNull(c, "vertex");
			if (!Double.isFinite(c.x) || !Double.isFinite(c.y)) {
				throw new DegeneratePolygonException("Vertex has non-finite ordinates: " + c);
			}
			ring.add(new CoordinateXY(c.x, c.y));
		}
		if (ring.size() > 1 && ring.get(0).equals2D(ring.get(ring.size() - 1))) {
			ring.remove(ring.size() - 1); // drop explicit closing vertex
		}

		Set<Coordinate> distinct = new HashSet<>(ring);
		if (distinct.size() < 3) {
			throw new DegeneratePolygonException("A polygon needs at least 3 distinct vertices, got " + distinct.size());
		}

		PolygonBoundary boundary = new PolygonBoundary(ring.toArray(new Coordinate[0]));
		double extent = boundary.getExtent();
		if (Math.abs(boundary.signedArea) <= InscribedConstants.ZERO_AREA * extent * extent) {
			throw new DegeneratePolygonException("Polygon has zero area (all vertices collinear)");
		}
		return boundary;
	}

	/**
	 * Creates a boundary from the shell of a JTS polygon. Holes play no part in
	 * the half-plane formulation and are dropped.
	 */
	public static PolygonBoundary fromPolygon(Polygon polygon) {
		Objects.requireNonNull(polygon, "polygon");
		if (polygon.isEmpty()) {
			throw new DegeneratePolygonException("Polygon is empty");
		}
		if (polygon.getNumInteriorRing() > 0) {
			LOGGER.warn("Ignoring {} interior ring(s); only the shell is used.", polygon.getNumInteriorRing());
		}
		return of(polygon.getExteriorRing().getCoordinates());
	}

	public static PolygonBoundary fromRing(LinearRing ring) {
		Objects.requireNonNull(ring, "ring");
		return of(ring.getCoordinates());
	}

	/**
	 * Number of vertices, which equals the number of edges.
	 */
	public int size() {
		return vertices.length;
	}

	public Coordinate getVertex(int i) {
		return vertices[i].copy();
	}

	/**
	 * Vertices in input order, without the closing vertex.
	 */
	public List<Coordinate> getVertices() {
		List<Coordinate> list = new ArrayList<>(vertices.length);
		for (Coordinate c : vertices) {
			list.add(c.copy());
		}
		return Collections.unmodifiableList(list);
	}

	/**
	 * Vertices with the first one repeated at the end, as JTS rings expect.
	 */
	public Coordinate[] getClosedRing() {
		Coordinate[] ring = new Coordinate[vertices.length + 1];
		for (int i = 0; i < vertices.length; i++) {
			ring[i] = vertices[i].copy();
		}
		ring[vertices.length] = vertices[0].copy();
		return ring;
	}

	/**
	 * Edge i, from vertex i to vertex (i+1) mod n.
	 */
	public LineSegment getEdge(int i) {
		return new LineSegment(vertices[i].copy(), vertices[(i + 1) % vertices.length].copy());
	}

	/**
	 * Ring area; positive for counter-clockwise rings, negative for clockwise.
	 */
	public double getSignedArea() {
		return signedArea;
	}

	public double getArea() {
		return Math.abs(signedArea);
	}

	public boolean isCounterClockwise() {
		return counterClockwise;
	}

	/**
	 * Larger side of the bounding box. Used to scale tolerances.
	 */
	public double getExtent() {
		return Math.max(envelope.getWidth(), envelope.getHeight());
	}

	/**
	 * Whether no vertex turns against the winding of the ring. Collinear vertices
	 * are allowed.
	 */
	public boolean isConvex() {
		int winding = isCounterClockwise() ? Orientation.COUNTERCLOCKWISE : Orientation.CLOCKWISE;
		final int n = vertices.length;
		for (int i = 0; i < n; i++) {
			int turn = Orientation.index(vertices[(i + n - 1) % n], vertices[i], vertices[(i + 1) % n]);
			if (turn == -winding) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Whether the point lies inside the polygon or on its boundary.
	 */
	public boolean contains(Coordinate p) {
		return PointLocation.isInRing(p, getClosedRing());
	}

	/**
	 * Euclidean distance from the point to the nearest edge segment.
	 */
	public double distanceToBoundary(Coordinate p) {
		double min = Double.POSITIVE_INFINITY;
		for (int i = 0; i < vertices.length; i++) {
			min = Math.min(min, getEdge(i).distance(p));
		}
		return min;
	}

	/**
	 * The same polygon with its winding order reversed.
	 */
	public PolygonBoundary reverse() {
		Coordinate[] reversed = new Coordinate[vertices.length];
		for (int i = 0; i < vertices.length; i++) {
			reversed[i] = vertices[vertices.length - 1 - i].copy();
		}
		return new PolygonBoundary(reversed);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PolygonBoundary)) {
			return false;
		}
		return Arrays.equals(vertices, ((PolygonBoundary) o).vertices);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(vertices);
	}

	@Override
	public String toString() {
		return "PolygonBoundary{n=" + vertices.length + ", area=" + signedArea + ", " + Arrays.toString(vertices) + '}';
	}
}
