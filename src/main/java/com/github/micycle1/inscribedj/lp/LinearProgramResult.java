package com.github.micycle1.inscribedj.lp;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of solving a {@link LinearProgram}: an optimal solution vector, or the
 * reason none was found.
 */
public final class LinearProgramResult {

	public enum Status {
		OPTIMAL, INFEASIBLE, UNBOUNDED, NUMERICAL_FAILURE
	}

	private final Status status;
	private final double[] solution;
	private final String message;

	private LinearProgramResult(Status status, double[] solution, String message) {
		this.status = status;
		this.solution = solution;
		this.message = message;
	}

	public static LinearProgramResult optimal(double[] solution) {
		Objects.requireNonNull(solution, "solution");
		return new LinearProgramResult(Status.OPTIMAL, solution.clone(), "optimal");
	}

	public static LinearProgramResult infeasible(String message) {
		return new LinearProgramResult(Status.INFEASIBLE, null, message);
	}

	public static LinearProgramResult unbounded(String message) {
		return new LinearProgramResult(Status.UNBOUNDED, null, message);
	}

	public static LinearProgramResult numericalFailure(String message) {
		return new LinearProgramResult(Status.NUMERICAL_FAILURE, null, message);
	}

	public Status getStatus() {
		return status;
	}

	public boolean isOptimal() {
		return status == Status.OPTIMAL;
	}

	/**
	 * @throws IllegalStateException if the result is not optimal
	 */
	public double[] getSolution() {
		if (solution == null) {
			throw new IllegalStateException("No solution; status is " + status);
		}
		return solution.clone();
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return "LinearProgramResult{" + status + (solution != null ? ", x=" + Arrays.toString(solution) : ", " + message) + '}';
	}
}
