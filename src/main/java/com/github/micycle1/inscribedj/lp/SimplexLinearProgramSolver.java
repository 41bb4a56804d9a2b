package com.github.micycle1.inscribedj.lp;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.PivotSelectionRule;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.inscribedj.InscribedConstants;

/**
 * {@link LinearProgramSolver} backed by the Commons Math two-phase simplex
 * method. Bland's pivot rule is used so that identical programs always follow
 * the same pivot sequence and yield identical solutions.
 * <p>
 * A fresh {@link SimplexSolver} is created per call, so one instance can be
 * shared between threads.
 */
public class SimplexLinearProgramSolver implements LinearProgramSolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(SimplexLinearProgramSolver.class);

	private final int maxIterations;
	private final double epsilon;
	private final int maxUlps;

	public SimplexLinearProgramSolver() {
		this(InscribedConstants.SIMPLEX_MAX_ITERATIONS, InscribedConstants.SIMPLEX_EPSILON, InscribedConstants.SIMPLEX_MAX_ULPS);
	}

	/**
	 * @param maxIterations pivot limit before giving up with a numerical failure
	 * @param epsilon       tolerance for comparing tableau entries
	 * @param maxUlps       ulp tolerance for comparing tableau entries
	 */
	public SimplexLinearProgramSolver(int maxIterations, double epsilon, int maxUlps) {
		Validate.isTrue(maxIterations > 0, "maxIterations must be positive: %d", maxIterations);
		Validate.isTrue(epsilon > 0, "epsilon must be positive: %f", epsilon);
		Validate.isTrue(maxUlps >= 0, "maxUlps must be non-negative: %d", maxUlps);
		this.maxIterations = maxIterations;
		this.epsilon = epsilon;
		this.maxUlps = maxUlps;
	}

	@Override
	public LinearProgramResult solve(LinearProgram program) {
		LinearObjectiveFunction objective = new LinearObjectiveFunction(program.getObjective(), 0);
		List<LinearConstraint> constraints = new ArrayList<>();

		double[][] a = program.getInequalityMatrix();
		double[] b = program.getInequalityBounds();
		for (int i = 0; i < a.length; i++) {
			constraints.add(new LinearConstraint(a[i], Relationship.LEQ, b[i]));
		}
		double[][] aeq = program.getEqualityMatrix();
		double[] beq = program.getEqualityBounds();
		for (int i = 0; i < aeq.length; i++) {
			constraints.add(new LinearConstraint(aeq[i], Relationship.EQ, beq[i]));
		}

		SimplexSolver solver = new SimplexSolver(epsilon, maxUlps, InscribedConstants.SIMPLEX_CUTOFF);
		PointValuePair optimum;
		try {
			optimum = solver.optimize(new MaxIter(maxIterations), objective, new LinearConstraintSet(constraints), GoalType.MINIMIZE,
					new NonNegativeConstraint(false), PivotSelectionRule.BLAND);
		} catch (NoFeasibleSolutionException e) {
			LOGGER.debug("Simplex found no feasible solution for {}", program);
			return LinearProgramResult.infeasible(e.getMessage());
		} catch (UnboundedSolutionException e) {
			LOGGER.debug("Simplex found the objective unbounded for {}", program);
			return LinearProgramResult.unbounded(e.getMessage());
		} catch (TooManyIterationsException e) {
			LOGGER.warn("Simplex did not converge within {} iterations.", maxIterations);
			return LinearProgramResult.numericalFailure("No convergence within " + maxIterations + " iterations");
		} catch (MathIllegalStateException e) {
			return LinearProgramResult.numericalFailure(e.getMessage());
		}

		double[] x = optimum.getPoint();
		for (int i = 0; i < x.length; i++) {
			if (!Double.isFinite(x[i])) {
				return LinearProgramResult.numericalFailure("Non-finite value " + x[i] + " for variable " + i);
			}
		}
		LOGGER.debug("Simplex converged after {} iterations, objective {}", solver.getIterations(), optimum.getValue());
		return LinearProgramResult.optimal(x);
	}
}
