package com.github.micycle1.inscribedj;

public class PolygonFormatException extends InscribedCircleException {

	private static final long serialVersionUID = 1L;

	public PolygonFormatException(String message) {
		super(message);
	}

	public PolygonFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
