package de.anton.pv.solver.iv_solver.model;

/**
 * Equivalent-circuit model used for the fit. The tag of the
 * {@link FittedParameters} variant.
 */
public enum ModelKind {
    ONE_DIODE("One-Diode"),
    TWO_DIODE("Two-Diode");

    private final String displayName;

    ModelKind(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
