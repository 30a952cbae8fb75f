package de.anton.pv.solver.iv_solver.model;

/**
 * Severity of a residual pattern, with its contribution to the risk score.
 */
public enum WarningLevel {
    LOW(10),
    MEDIUM(40),
    HIGH(70),
    CRITICAL(90);

    private final int riskPoints;

    WarningLevel(int riskPoints) {
        this.riskPoints = riskPoints;
    }

    public int riskPoints() {
        return riskPoints;
    }
}
