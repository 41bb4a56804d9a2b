package com.github.micycle1.inscribedj.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import com.github.micycle1.inscribedj.DegeneratePolygonException;
import com.github.micycle1.inscribedj.LargestInscribedCircle;

class PolygonBoundaryTest {

	private static final double DELTA = 1e-12;

	private final WKTReader reader = new WKTReader(new GeometryFactory());

	private static PolygonBoundary ccwSquare() {
		return PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(4, 0), new Coordinate(4, 4), new Coordinate(0, 4));
	}

	@Test
	void testClosingVertexIsStripped() {
		PolygonBoundary open = ccwSquare();
		PolygonBoundary closed = PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(4, 0), new Coordinate(4, 4), new Coordinate(0, 4),
				new Coordinate(0, 0));

		assertEquals(4, closed.size());
		assertEquals(open, closed);
		assertEquals(new LineSegment(new Coordinate(0, 4), new Coordinate(0, 0)), closed.getEdge(3), "Closing edge should be implicit");
	}

	@Test
	void testClosedRingRepeatsFirstVertex() {
		Coordinate[] ring = ccwSquare().getClosedRing();
		assertEquals(5, ring.length);
		assertTrue(ring[0].equals2D(ring[4]));
	}

	@Test
	void testSignedAreaFollowsWinding() {
		PolygonBoundary ccw = ccwSquare();
		PolygonBoundary cw = ccw.reverse();

		assertEquals(16, ccw.getSignedArea(), DELTA);
		assertEquals(-16, cw.getSignedArea(), DELTA);
		assertTrue(ccw.isCounterClockwise());
		assertFalse(cw.isCounterClockwise());
		assertEquals(16, cw.getArea(), DELTA);
	}

	@Test
	void testFewerThanThreeDistinctVertices() {
		assertThrows(DegeneratePolygonException.class, () -> PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(1, 1)));
		assertThrows(DegeneratePolygonException.class, () -> PolygonBoundary.of(new Coordinate(0, 0)));
		assertThrows(DegeneratePolygonException.class, () -> PolygonBoundary.of(List.of()));
		// closing vertex does not count as a third vertex
		assertThrows(DegeneratePolygonException.class,
				() -> PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(1, 1), new Coordinate(0, 0)));
		// nor do repeats
		assertThrows(DegeneratePolygonException.class,
				() -> PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(1, 1), new Coordinate(1, 1), new Coordinate(0, 0)));
	}

	@Test
	void testCollinearVerticesRejected() {
		assertThrows(DegeneratePolygonException.class,
				() -> PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(1, 1), new Coordinate(2, 2), new Coordinate(3, 3)));
	}

	@Test
	void testNonFiniteVertexRejected() {
		assertThrows(DegeneratePolygonException.class,
				() -> PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(Double.NaN, 1), new Coordinate(2, 0)));
		assertThrows(DegeneratePolygonException.class,
				() -> PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(1, Double.POSITIVE_INFINITY), new Coordinate(2, 0)));
	}

	@Test
	void testConsecutiveDuplicatesKept() {
		PolygonBoundary boundary = PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(4, 0), new Coordinate(4, 0), new Coordinate(4, 4),
				new Coordinate(0, 4));
		assertEquals(5, boundary.size());
		assertEquals(0, boundary.getEdge(1).getLength(), DELTA);
	}

	@Test
	void testConvexity() throws ParseException {
		assertTrue(ccwSquare().isConvex());
		assertTrue(ccwSquare().reverse().isConvex());

		PolygonBoundary lShape = PolygonBoundary.fromPolygon((Polygon) reader.read("POLYGON ((0 0, 4 0, 4 2, 2 2, 2 4, 0 4, 0 0))"));
		assertFalse(lShape.isConvex());
		assertFalse(lShape.reverse().isConvex());

		// a collinear vertex along an edge does not break convexity
		PolygonBoundary withMidpoint = PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(2, 0), new Coordinate(4, 0), new Coordinate(4, 4),
				new Coordinate(0, 4));
		assertTrue(withMidpoint.isConvex());
	}

	@Test
	void testContainsAndDistance() {
		PolygonBoundary square = ccwSquare();
		assertTrue(square.contains(new Coordinate(2, 2)));
		assertTrue(square.contains(new Coordinate(0, 2)), "Boundary points count as contained");
		assertFalse(square.contains(new Coordinate(5, 2)));

		assertEquals(2, square.distanceToBoundary(new Coordinate(2, 2)), DELTA);
		assertEquals(1, square.distanceToBoundary(new Coordinate(3, 2)), DELTA);
		assertEquals(1, square.distanceToBoundary(new Coordinate(5, 2)), DELTA);
	}

	@Test
	void testFromPolygonUsesShellOnly() throws ParseException {
		Polygon withHole = (Polygon) reader.read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0), (3 3, 7 3, 7 7, 3 7, 3 3))");
		PolygonBoundary boundary = PolygonBoundary.fromPolygon(withHole);

		assertEquals(4, boundary.size());
		assertEquals(100, boundary.getArea(), DELTA);
	}

	@Test
	void testEmptyPolygonRejected() throws ParseException {
		Polygon empty = (Polygon) reader.read("POLYGON EMPTY");
		assertThrows(DegeneratePolygonException.class, () -> PolygonBoundary.fromPolygon(empty));
	}

	@Test
	void testExtent() {
		PolygonBoundary rectangle = PolygonBoundary.of(new Coordinate(1, 1), new Coordinate(9, 1), new Coordinate(9, 3), new Coordinate(1, 3));
		assertEquals(8, rectangle.getExtent(), DELTA);
		assertEquals(16, rectangle.getSignedArea(), DELTA);
	}

	@Test
	void testVerticesAreCopies() {
		PolygonBoundary square = ccwSquare();
		square.getVertex(0).x = 100;
		assertEquals(0, square.getVertex(0).x, DELTA);
		assertThrows(UnsupportedOperationException.class, () -> square.getVertices().clear());
	}

	@Test
	void testEdgesAreCopies() {
		PolygonBoundary square = ccwSquare();
		double radius = LargestInscribedCircle.of(square.getVertices().toArray(new Coordinate[0])).getRadius();

		LineSegment edge = square.getEdge(1);
		edge.p0.x = 40;
		edge.p1.y = -100;

		assertEquals(4, square.getVertex(1).x, DELTA);
		assertEquals(4, square.getVertex(2).y, DELTA);
		assertEquals(16, square.getSignedArea(), DELTA);
		assertEquals(radius, new LargestInscribedCircle().compute(square).getRadius(), DELTA);
	}

	@Test
	void testAreaAndWindingMatchJts() {
		PolygonBoundary ccw = PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(5, 0), new Coordinate(6, 3), new Coordinate(3, 6),
				new Coordinate(-1, 3));
		for (PolygonBoundary boundary : List.of(ccw, ccw.reverse())) {
			Coordinate[] ring = boundary.getClosedRing();
			assertEquals(-Area.ofRingSigned(ring), boundary.getSignedArea(), DELTA);
			assertEquals(Orientation.isCCWArea(ring), boundary.isCounterClockwise());
		}
		assertTrue(ccw.getSignedArea() > 0);
		assertEquals(ccw.getArea(), ccw.reverse().getArea(), DELTA);
	}
}
