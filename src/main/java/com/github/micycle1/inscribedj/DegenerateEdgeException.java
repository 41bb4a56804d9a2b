package com.github.micycle1.inscribedj;

import org.locationtech.jts.geom.LineSegment;

/**
 * Thrown when a polygon edge has zero length, so its normal is undefined.
 */
public class DegenerateEdgeException extends InscribedCircleException {

	private static final long serialVersionUID = 1L;

	private final int edgeIndex;

	public DegenerateEdgeException(int edgeIndex, LineSegment edge) {
		super("Edge " + edgeIndex + " has zero length: " + edge);
		this.edgeIndex = edgeIndex;
	}

	/**
	 * Index of the offending edge; edge i runs from vertex i to vertex i+1.
	 */
	public int getEdgeIndex() {
		return edgeIndex;
	}
}
