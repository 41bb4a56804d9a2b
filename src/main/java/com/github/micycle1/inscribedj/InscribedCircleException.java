package com.github.micycle1.inscribedj;

/**
 * Base type of every failure raised while computing an inscribed circle. All
 * failures are surfaced to the caller as they are first observed; nothing is
 * retried or approximated.
 */
public class InscribedCircleException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public InscribedCircleException(String message) {
		super(message);
	}

	public InscribedCircleException(String message, Throwable cause) {
		super(message, cause);
	}
}
