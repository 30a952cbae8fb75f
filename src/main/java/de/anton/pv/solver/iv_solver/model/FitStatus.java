package de.anton.pv.solver.iv_solver.model;

/**
 * Outcome of a fit.
 * VALID: converged and physically plausible.
 * INVALID: rejected input or an implausible result.
 * FAILED: the optimizer did not converge within its budget.
 */
public enum FitStatus {
    VALID,
    INVALID,
    FAILED
}
