package com.github.micycle1.inscribedj;

/**
 * Thrown when the solver fails to converge or produces a non-finite solution,
 * e.g. for ill-conditioned constraints from near-duplicate vertices.
 */
public class NumericalException extends InscribedCircleException {

	private static final long serialVersionUID = 1L;

	public NumericalException(String message) {
		super(message);
	}
}
