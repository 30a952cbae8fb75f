package de.anton.pv.solver.iv_solver.model;

/**
 * Error taxonomy of the engine and the status each kind maps to.
 */
public enum FitErrorKind {
    VALIDATION(FitStatus.INVALID),
    CONVERGENCE(FitStatus.FAILED),
    NUMERICAL(FitStatus.FAILED),
    PHYSICAL_IMPLAUSIBILITY(FitStatus.INVALID);

    private final FitStatus status;

    FitErrorKind(FitStatus status) {
        this.status = status;
    }

    public FitStatus status() {
        return status;
    }
}
