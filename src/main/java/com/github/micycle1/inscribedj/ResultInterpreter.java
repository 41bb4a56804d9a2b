package com.github.micycle1.inscribedj;

import static com.github.micycle1.inscribedj.lp.LinearProgram.CENTER_X;
import static com.github.micycle1.inscribedj.lp.LinearProgram.CENTER_Y;
import static com.github.micycle1.inscribedj.lp.LinearProgram.RADIUS;
import static com.github.micycle1.inscribedj.lp.LinearProgram.SLACK_OFFSET;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Coordinate;

/**
 * Reads the circle out of an optimal solution vector [cx, cy, r, s1 ... sn].
 */
public class ResultInterpreter {

	private ResultInterpreter() {
	}

	/**
	 * The radius is taken as |r|. With inward normals the optimal r is already
	 * non-negative (up to round-off); with outward normals it comes out negated.
	 *
	 * @param solution  solver output
	 * @param edgeCount number of polygon edges n; the solution must have n+3
	 *                  entries
	 */
	public static InscribedCircle interpret(double[] solution, int edgeCount) {
		Validate.isTrue(solution.length == edgeCount + SLACK_OFFSET, "Expected %d variables, got %d", edgeCount + SLACK_OFFSET,
				solution.length);
		final double cx = solution[CENTER_X];
		final double cy = solution[CENTER_Y];
		final double r = solution[RADIUS];
		if (!Double.isFinite(cx) || !Double.isFinite(cy) || !Double.isFinite(r)) {
			throw new NumericalException("Solver returned non-finite circle: c=(" + cx + ", " + cy + "), r=" + r);
		}
		return new InscribedCircle(new Coordinate(cx, cy), Math.abs(r));
	}
}
