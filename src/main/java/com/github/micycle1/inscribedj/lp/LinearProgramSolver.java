package com.github.micycle1.inscribedj.lp;

/**
 * Solves a {@link LinearProgram} whose variables are all free in sign.
 * Implementations report failure through the result status rather than by
 * throwing, and must be safe to call from several threads at once.
 * <p>
 * No timeout is imposed here; callers needing bounded latency should wrap the
 * call themselves.
 */
public interface LinearProgramSolver {

	LinearProgramResult solve(LinearProgram program);
}
