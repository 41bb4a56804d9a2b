package com.github.micycle1.inscribedj;

public class InscribedConstants {

	/** Squared length below which an edge is treated as zero-length. */
	public static final double ZERO_DIST_SQ = 1e-24;
	/**
	 * Ring area below which a polygon is considered to have collapsed onto a line.
	 * Relative to the squared extent of the ring.
	 */
	public static final double ZERO_AREA = 1e-12;
	/**
	 * How far below zero the optimal radius may be before the half-plane
	 * intersection is considered empty. Relative to the extent of the ring.
	 */
	public static final double FEASIBILITY_TOL = 1e-9;

	// simplex defaults (same values as commons-math's own defaults)
	public static final double SIMPLEX_EPSILON = 1e-6;
	public static final int SIMPLEX_MAX_ULPS = 10;
	public static final double SIMPLEX_CUTOFF = 1e-10;
	public static final int SIMPLEX_MAX_ITERATIONS = 10_000;
}
