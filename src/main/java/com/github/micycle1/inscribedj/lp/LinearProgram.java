package com.github.micycle1.inscribedj.lp;

import java.util.Arrays;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.linear.MatrixUtils;

/**
 * A linear program in the form
 *
 * <pre>
 * minimize    f.x
 * subject to  A.x   &lt;= b
 *             Aeq.x  = beq
 * </pre>
 *
 * with every variable free in sign. The variable vector is laid out as
 * [cx, cy, r, s1 ... sn]: candidate center, candidate radius, then one slack
 * per polygon edge holding the center's distance to that edge's supporting
 * line.
 * <p>
 * Instances are immutable; all accessors return copies.
 */
public final class LinearProgram {

	public static final int CENTER_X = 0;
	public static final int CENTER_Y = 1;
	public static final int RADIUS = 2;
	/** Column of the first slack variable. */
	public static final int SLACK_OFFSET = 3;

	private final double[] objective;
	private final double[][] inequalityMatrix;
	private final double[] inequalityBounds;
	private final double[][] equalityMatrix;
	private final double[] equalityBounds;

	public LinearProgram(double[] objective, double[][] inequalityMatrix, double[] inequalityBounds, double[][] equalityMatrix,
			double[] equalityBounds) {
		Validate.notNull(objective, "objective");
		Validate.isTrue(inequalityMatrix.length == inequalityBounds.length, "A has %d rows but b has %d entries", inequalityMatrix.length,
				inequalityBounds.length);
		Validate.isTrue(equalityMatrix.length == equalityBounds.length, "Aeq has %d rows but beq has %d entries", equalityMatrix.length,
				equalityBounds.length);
		for (double[] row : inequalityMatrix) {
			Validate.isTrue(row.length == objective.length, "A row has %d columns, expected %d", row.length, objective.length);
		}
		for (double[] row : equalityMatrix) {
			Validate.isTrue(row.length == objective.length, "Aeq row has %d columns, expected %d", row.length, objective.length);
		}
		this.objective = objective.clone();
		this.inequalityMatrix = deepCopy(inequalityMatrix);
		this.inequalityBounds = inequalityBounds.clone();
		this.equalityMatrix = deepCopy(equalityMatrix);
		this.equalityBounds = equalityBounds.clone();
	}

	/**
	 * Column of the slack variable belonging to edge i.
	 */
	public static int slack(int edge) {
		return SLACK_OFFSET + edge;
	}

	public int getVariableCount() {
		return objective.length;
	}

	/**
	 * Number of polygon edges the program was built for.
	 */
	public int getEdgeCount() {
		return objective.length - SLACK_OFFSET;
	}

	/** f */
	public double[] getObjective() {
		return objective.clone();
	}

	/** A */
	public double[][] getInequalityMatrix() {
		return deepCopy(inequalityMatrix);
	}

	/** b */
	public double[] getInequalityBounds() {
		return inequalityBounds.clone();
	}

	/** Aeq */
	public double[][] getEqualityMatrix() {
		return deepCopy(equalityMatrix);
	}

	/** beq */
	public double[] getEqualityBounds() {
		return equalityBounds.clone();
	}

	/**
	 * Whether x satisfies every constraint to within the given tolerance.
	 */
	public boolean isFeasible(double[] x, double tolerance) {
		Validate.isTrue(x.length == objective.length, "Expected %d variables, got %d", objective.length, x.length);
		double[] ax = product(inequalityMatrix, x);
		for (int i = 0; i < ax.length; i++) {
			if (ax[i] > inequalityBounds[i] + tolerance) {
				return false;
			}
		}
		double[] aeqx = product(equalityMatrix, x);
		for (int i = 0; i < aeqx.length; i++) {
			if (Math.abs(aeqx[i] - equalityBounds[i]) > tolerance) {
				return false;
			}
		}
		return true;
	}

	private static double[] product(double[][] m, double[] x) {
		if (m.length == 0) {
			return new double[0]; // MatrixUtils rejects empty matrices
		}
		return MatrixUtils.createRealMatrix(m).operate(x);
	}

	private static double[][] deepCopy(double[][] m) {
		double[][] copy = new double[m.length][];
		for (int i = 0; i < m.length; i++) {
			copy[i] = m[i].clone();
		}
		return copy;
	}

	@Override
	public String toString() {
		return "LinearProgram{vars=" + objective.length + ", f=" + Arrays.toString(objective) + ", ineq=" + inequalityMatrix.length + ", eq="
				+ equalityMatrix.length + '}';
	}
}
