package com.github.micycle1.inscribedj;

import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.inscribedj.geometry.EdgeNormal;
import com.github.micycle1.inscribedj.geometry.EdgeNormalExtractor;
import com.github.micycle1.inscribedj.geometry.PolygonBoundary;
import com.github.micycle1.inscribedj.lp.ConstraintBuilder;
import com.github.micycle1.inscribedj.lp.LinearProgram;
import com.github.micycle1.inscribedj.lp.LinearProgramResult;
import com.github.micycle1.inscribedj.lp.LinearProgramSolver;
import com.github.micycle1.inscribedj.lp.SimplexLinearProgramSolver;

/**
 * Computes the largest circle inscribed in a polygon (its Chebyshev center) by
 * linear programming.
 * <p>
 * Each edge contributes the half-plane on the polygon's inner side of its
 * supporting line; the program maximizes a radius r such that the center lies
 * at least r inside every one of these half-planes. The computation runs as
 * four stages:
 * <ol>
 * <li>edges and inward unit normals are extracted ({@link EdgeNormalExtractor})
 * </li>
 * <li>the linear program is assembled ({@link ConstraintBuilder})</li>
 * <li>the program is handed to a {@link LinearProgramSolver}</li>
 * <li>center and radius are read from the solution
 * ({@link ResultInterpreter})</li>
 * </ol>
 * <p>
 * For a convex polygon the result is exact. For a non-convex polygon the
 * half-planes intersect in the polygon's kernel, so the circle returned is the
 * largest circle centered in the kernel: it never crosses the boundary but may
 * be smaller than the true largest inscribed circle. If the kernel is empty an
 * {@link InfeasibleGeometryException} is thrown.
 * <p>
 * Instances hold no mutable state and may be shared between threads, provided
 * the solver is thread-safe.
 */
public class LargestInscribedCircle {

	private static final Logger LOGGER = LoggerFactory.getLogger(LargestInscribedCircle.class);

	private final LinearProgramSolver solver;

	public LargestInscribedCircle() {
		this(new SimplexLinearProgramSolver());
	}

	public LargestInscribedCircle(LinearProgramSolver solver) {
		this.solver = Objects.requireNonNull(solver, "solver");
	}

	/**
	 * Computes the circle with the default simplex solver.
	 *
	 * @see #compute(Coordinate...)
	 */
	public static InscribedCircle of(Coordinate... vertices) {
		return new LargestInscribedCircle().compute(vertices);
	}

	/**
	 * @param vertices polygon vertices in either winding order, optionally with
	 *                 the first vertex repeated at the end
	 */
	public InscribedCircle compute(Coordinate... vertices) {
		return compute(PolygonBoundary.of(vertices));
	}

	public InscribedCircle compute(List<Coordinate> vertices) {
		return compute(PolygonBoundary.of(vertices));
	}

	/**
	 * Uses the shell of the polygon; holes are ignored.
	 */
	public InscribedCircle compute(Polygon polygon) {
		return compute(PolygonBoundary.fromPolygon(polygon));
	}

	/**
	 * @throws DegenerateEdgeException      if an edge has zero length
	 * @throws DegeneratePolygonException   if the solver reports the program
	 *                                      unbounded
	 * @throws InfeasibleGeometryException  if no point is inside every edge's
	 *                                      half-plane
	 * @throws NumericalException           if the solver fails numerically
	 */
	public InscribedCircle compute(PolygonBoundary boundary) {
		Objects.requireNonNull(boundary, "boundary");
		if (!boundary.isConvex()) {
			LOGGER.warn("Polygon is not convex; the circle is limited to the polygon's kernel and may be smaller than the largest inscribed circle.");
		}

		List<EdgeNormal> normals = EdgeNormalExtractor.extract(boundary);
		LinearProgram program = ConstraintBuilder.build(boundary, normals);
		LOGGER.debug("Built {}", program);

		LinearProgramResult result = solver.solve(program);
		double[] solution = requireOptimal(result);

		double r = solution[LinearProgram.RADIUS];
		double tolerance = InscribedConstants.FEASIBILITY_TOL * Math.max(1, boundary.getExtent());
		if (r < -tolerance) {
			// the best center still lies outside some half-plane
			throw new InfeasibleGeometryException("Edge half-planes have no common interior (optimal r = " + r + ")");
		}

		InscribedCircle circle = ResultInterpreter.interpret(solution, boundary.size());
		LOGGER.debug("Found {}", circle);
		return circle;
	}

	public LinearProgramSolver getSolver() {
		return solver;
	}

	private static double[] requireOptimal(LinearProgramResult result) {
		switch (result.getStatus()) {
			case OPTIMAL:
				return result.getSolution();
			case INFEASIBLE:
				throw new InfeasibleGeometryException("Solver found no feasible circle: " + result.getMessage());
			case UNBOUNDED:
				throw new DegeneratePolygonException("Solver reports an unbounded radius: " + result.getMessage());
			case NUMERICAL_FAILURE:
				throw new NumericalException("Solver failed numerically: " + result.getMessage());
			default:
				throw new IllegalStateException("Unknown solver status " + result.getStatus());
		}
	}
}
