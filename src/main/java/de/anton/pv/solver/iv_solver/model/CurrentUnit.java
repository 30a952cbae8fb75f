package de.anton.pv.solver.iv_solver.model;

/**
 * Unit of the current column of a measurement.
 * Density units are converted to absolute current with the active area.
 */
public enum CurrentUnit {
    AMPERE("A", 1.0, false),
    MILLIAMPERE("mA", 1e-3, false),
    MICROAMPERE("uA", 1e-6, false),
    AMPERE_PER_CM2("A/cm2", 1.0, true),
    MILLIAMPERE_PER_CM2("mA/cm2", 1e-3, true);

    private final String displayName;
    private final double factor;
    private final boolean density;

    CurrentUnit(String displayName, double factor, boolean density) {
        this.displayName = displayName;
        this.factor = factor;
        this.density = density;
    }

    /**
     * Factor converting a value in this unit to ampere.
     * @param areaCm2 Active area, only used for density units.
     * @return The multiplicative factor.
     */
    public double toAmpereFactor(double areaCm2) {
        return density ? factor * areaCm2 : factor;
    }

    public boolean isDensity() {
        return density;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Finds a unit by its display name (case-insensitive, "µ" accepted for "u").
     *
     * @param displayName The name to look up.
     * @return The matching unit, or null if none matches.
     */
    public static CurrentUnit fromDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        String normalized = displayName.trim().replace('µ', 'u').replace('μ', 'u');
        for (CurrentUnit unit : CurrentUnit.values()) {
            if (unit.displayName.equalsIgnoreCase(normalized)) {
                return unit;
            }
        }
        return null;
    }
}
