package de.anton.pv.solver.iv_solver.model;

/**
 * Analysis profile. REFERENCE locks seed, budgets and single-threaded execution
 * so that results are bit-reproducible, EXPLORATION trades that for speed.
 */
public enum AnalysisMode {
    EXPLORATION("Exploration"),
    REFERENCE("Reference");

    private final String displayName;

    AnalysisMode(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
