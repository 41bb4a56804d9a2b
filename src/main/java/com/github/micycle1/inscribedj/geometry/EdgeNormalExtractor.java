package com.github.micycle1.inscribedj.geometry;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.inscribedj.DegenerateEdgeException;

/**
 * Derives the directed edges of a polygon and their unit normals, index-aligned
 * with the polygon's vertices.
 */
public class EdgeNormalExtractor {

	private static final Logger LOGGER = LoggerFactory.getLogger(EdgeNormalExtractor.class);

	private EdgeNormalExtractor() {
	}

	/**
	 * Computes one normal per edge, each pointing into the polygon.
	 * <p>
	 * The raw rotation of {@link EdgeNormal} points inwards only for clockwise
	 * rings, so the normals of a counter-clockwise ring are flipped. The winding
	 * is read from the sign of the ring's area.
	 *
	 * @throws DegenerateEdgeException if any edge has zero length
	 */
	public static List<EdgeNormal> extract(PolygonBoundary boundary) {
		List<EdgeNormal> normals = extractRaw(boundary);
		if (boundary.isCounterClockwise()) {
			normals.replaceAll(EdgeNormal::flip);
		}
		LOGGER.debug("Extracted {} inward normals ({} input).", normals.size(), boundary.isCounterClockwise() ? "CCW" : "CW");
		return normals;
	}

	/**
	 * Computes one normal per edge using the fixed -90 degree rotation, without
	 * regard to winding.
	 *
	 * @throws DegenerateEdgeException if any edge has zero length
	 */
	public static List<EdgeNormal> extractRaw(PolygonBoundary boundary) {
		final int n = boundary.size();
		List<EdgeNormal> normals = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			normals.add(new EdgeNormal(i, boundary.getEdge(i)));
		}
		return normals;
	}
}
