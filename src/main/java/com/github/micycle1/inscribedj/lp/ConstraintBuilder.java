package com.github.micycle1.inscribedj.lp;

import static com.github.micycle1.inscribedj.lp.LinearProgram.CENTER_X;
import static com.github.micycle1.inscribedj.lp.LinearProgram.CENTER_Y;
import static com.github.micycle1.inscribedj.lp.LinearProgram.RADIUS;
import static com.github.micycle1.inscribedj.lp.LinearProgram.SLACK_OFFSET;
import static com.github.micycle1.inscribedj.lp.LinearProgram.slack;

import java.util.List;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.math.Vector2D;

import com.github.micycle1.inscribedj.geometry.EdgeNormal;
import com.github.micycle1.inscribedj.geometry.PolygonBoundary;

/**
 * Assembles the Chebyshev-center linear program of a polygon from its edge
 * normals.
 * <p>
 * For each edge i with normal Ni and start vertex Ai, the slack si is pinned to
 * the signed distance of the center c from the edge's supporting line:
 *
 * <pre>
 * Ni.c - si = Ni.Ai    (equality row i)
 * r - si   &lt;= 0       (inequality row i)
 * </pre>
 *
 * and the objective minimizes -r. No bounds are placed on individual variables.
 */
public class ConstraintBuilder {

	private ConstraintBuilder() {
	}

	/**
	 * @param boundary polygon the normals were extracted from
	 * @param normals  one normal per edge, index-aligned with the vertices
	 * @return program over n+3 variables with n inequality and n equality rows
	 */
	public static LinearProgram build(PolygonBoundary boundary, List<EdgeNormal> normals) {
		final int n = boundary.size();
		Validate.isTrue(normals.size() == n, "Expected %d normals, got %d", n, normals.size());
		final int vars = n + SLACK_OFFSET;

		double[][] aeq = new double[n][vars];
		double[] beq = new double[n];
		double[][] a = new double[n][vars];
		double[] b = new double[n];

		for (int i = 0; i < n; i++) {
			EdgeNormal normal = normals.get(i);
			Validate.isTrue(normal.getStart().equals2D(boundary.getVertex(i)), "Normal %d is not anchored at vertex %d", i, i);
			Vector2D ni = normal.getUnitNormal();

			aeq[i][CENTER_X] = ni.getX();
			aeq[i][CENTER_Y] = ni.getY();
			aeq[i][slack(i)] = -1;
			beq[i] = normal.getOffset();

			a[i][RADIUS] = 1;
			a[i][slack(i)] = -1;
		}

		double[] f = new double[vars];
		f[RADIUS] = -1; // maximize r

		return new LinearProgram(f, a, b, aeq, beq);
	}
}
