package com.github.micycle1.inscribedj;

/**
 * Thrown when the input does not describe a polygon with an interior: fewer
 * than three distinct vertices, a ring of zero area, or a linear program the
 * solver reports as unbounded.
 */
public class DegeneratePolygonException extends InscribedCircleException {

	private static final long serialVersionUID = 1L;

	public DegeneratePolygonException(String message) {
		super(message);
	}
}
