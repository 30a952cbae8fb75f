package de.anton.pv.solver.iv_solver.model;

/**
 * Shape class of the fit residuals.
 */
public enum ResidualPattern {
    RANDOM("random"),
    LINEAR_TREND("linear_trend"),
    SYSTEMATIC_CURVATURE("systematic_curvature"),
    S_SHAPED("s_shaped");

    private final String displayName;

    ResidualPattern(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
