package com.github.micycle1.inscribedj.lp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.inscribedj.geometry.EdgeNormalExtractor;
import com.github.micycle1.inscribedj.geometry.PolygonBoundary;
import com.github.micycle1.inscribedj.lp.LinearProgramResult.Status;

class SimplexLinearProgramSolverTest {

	private static final double DELTA = 1e-9;

	private final SimplexLinearProgramSolver solver = new SimplexLinearProgramSolver();

	private static LinearProgram squareProgram() {
		PolygonBoundary square = PolygonBoundary.of(new Coordinate(0, 0), new Coordinate(4, 0), new Coordinate(4, 4), new Coordinate(0, 4));
		return ConstraintBuilder.build(square, EdgeNormalExtractor.extract(square));
	}

	@Test
	void testMixedConstraints() {
		// min -x0 - x1 s.t. x0 + x1 <= 4, x0 - x1 = 0
		LinearProgram lp = new LinearProgram(new double[] { -1, -1 }, new double[][] { { 1, 1 } }, new double[] { 4 },
				new double[][] { { 1, -1 } }, new double[] { 0 });

		LinearProgramResult result = solver.solve(lp);
		assertEquals(Status.OPTIMAL, result.getStatus());
		assertArrayEquals(new double[] { 2, 2 }, result.getSolution(), DELTA);
	}

	@Test
	void testVariablesMayBeNegative() {
		// min x0 s.t. -x0 <= 3, i.e. x0 >= -3
		LinearProgram lp = new LinearProgram(new double[] { 1 }, new double[][] { { -1 } }, new double[] { 3 }, new double[0][], new double[0]);

		LinearProgramResult result = solver.solve(lp);
		assertTrue(result.isOptimal());
		assertEquals(-3, result.getSolution()[0], DELTA);
	}

	@Test
	void testInfeasible() {
		// x0 <= 1 and x0 >= 2
		LinearProgram lp = new LinearProgram(new double[] { 1 }, new double[][] { { 1 }, { -1 } }, new double[] { 1, -2 }, new double[0][],
				new double[0]);

		LinearProgramResult result = solver.solve(lp);
		assertEquals(Status.INFEASIBLE, result.getStatus());
		assertFalse(result.isOptimal());
		assertThrows(IllegalStateException.class, result::getSolution);
	}

	@Test
	void testUnbounded() {
		// min -x0 s.t. -x0 <= 0
		LinearProgram lp = new LinearProgram(new double[] { -1 }, new double[][] { { -1 } }, new double[] { 0 }, new double[0][], new double[0]);

		assertEquals(Status.UNBOUNDED, solver.solve(lp).getStatus());
	}

	@Test
	void testIterationCap() {
		SimplexLinearProgramSolver capped = new SimplexLinearProgramSolver(1, 1e-6, 10);
		assertEquals(Status.NUMERICAL_FAILURE, capped.solve(squareProgram()).getStatus());
	}

	@Test
	void testSquareProgram() {
		LinearProgram lp = squareProgram();
		LinearProgramResult result = solver.solve(lp);

		assertTrue(result.isOptimal());
		double[] x = result.getSolution();
		assertEquals(2, x[LinearProgram.CENTER_X], DELTA);
		assertEquals(2, x[LinearProgram.CENTER_Y], DELTA);
		assertEquals(2, x[LinearProgram.RADIUS], DELTA);
		assertTrue(lp.isFeasible(x, 1e-9));
	}

	@Test
	void testRepeatableSolutions() {
		LinearProgram lp = squareProgram();
		assertArrayEquals(solver.solve(lp).getSolution(), solver.solve(lp).getSolution(), 0.0);
	}

	@Test
	void testInvalidConfiguration() {
		assertThrows(IllegalArgumentException.class, () -> new SimplexLinearProgramSolver(0, 1e-6, 10));
		assertThrows(IllegalArgumentException.class, () -> new SimplexLinearProgramSolver(100, 0, 10));
		assertThrows(IllegalArgumentException.class, () -> new SimplexLinearProgramSolver(100, 1e-6, -1));
	}
}
