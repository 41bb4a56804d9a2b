package com.github.micycle1.inscribedj;

/**
 * Thrown when no point lies on the inner side of every edge's supporting line.
 * Typically caused by self-intersecting input, or by a non-convex polygon whose
 * kernel is empty.
 * <p>
 * Raised both when the solver reports the program infeasible and when it
 * returns an optimum whose radius is negative beyond tolerance. The latter is
 * how an empty half-plane intersection usually shows up, since the free radius
 * keeps the program itself feasible.
 */
public class InfeasibleGeometryException extends InscribedCircleException {

	private static final long serialVersionUID = 1L;

	public InfeasibleGeometryException(String message) {
		super(message);
	}
}
