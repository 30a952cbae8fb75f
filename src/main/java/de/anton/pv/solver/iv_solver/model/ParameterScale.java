package de.anton.pv.solver.iv_solver.model;

/**
 * Scale on which a model parameter is searched. Quantities spanning many
 * decades (saturation currents, shunt resistance) are searched in log10.
 */
public enum ParameterScale {
    LINEAR("Linear"),
    LOG10("Log10");

    private final String displayName;

    ParameterScale(String displayName) {
        this.displayName = displayName;
    }

    /** Maps a physical value into search space. */
    public double toSearch(double physical) {
        return this == LOG10 ? Math.log10(physical) : physical;
    }

    /** Maps a search-space value back to the physical value. */
    public double toPhysical(double search) {
        return this == LOG10 ? Math.pow(10.0, search) : search;
    }

    /**
     * Derivative of the physical value with respect to the search coordinate,
     * used to carry Jacobian columns into search space.
     */
    public double chainFactor(double physical) {
        return this == LOG10 ? Math.log(10.0) * physical : 1.0;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
