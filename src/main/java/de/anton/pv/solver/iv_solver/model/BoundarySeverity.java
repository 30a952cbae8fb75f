package de.anton.pv.solver.iv_solver.model;

/**
 * WARNING: inside the safety margin of a physical bound (bound included).
 * ERROR: beyond the bound.
 */
public enum BoundarySeverity {
    WARNING(20),
    ERROR(40);

    private final int riskPoints;

    BoundarySeverity(int riskPoints) {
        this.riskPoints = riskPoints;
    }

    public int riskPoints() {
        return riskPoints;
    }
}
