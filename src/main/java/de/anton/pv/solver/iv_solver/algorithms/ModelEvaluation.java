package de.anton.pv.solver.iv_solver.algorithms;

/**
 * Modeled currents for a voltage array. {@code finite} is false when any
 * sample could not be solved to a finite value; callers must not feed such
 * an evaluation into an objective.
 */
public record ModelEvaluation(double[] currents, boolean finite) {
}
