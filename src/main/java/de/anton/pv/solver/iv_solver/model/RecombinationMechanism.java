package de.anton.pv.solver.iv_solver.model;

/**
 * Dominant recombination mechanism suggested by the ideality factor.
 */
public enum RecombinationMechanism {
    RADIATIVE("Radiative / band-to-band", 0.8, 1.2),
    SRH_DEPLETION("Shockley-Read-Hall in depletion region", 1.2, 1.8),
    SRH_DIFFUSION("Shockley-Read-Hall in quasi-neutral region", 1.8, 2.2),
    COMPLEX("Complex / multiple mechanisms", 2.2, Double.POSITIVE_INFINITY),
    UNKNOWN("Not determinable", Double.NaN, Double.NaN);

    private final String description;
    private final double lowerIdeality;
    private final double upperIdeality;

    RecombinationMechanism(String description, double lowerIdeality, double upperIdeality) {
        this.description = description;
        this.lowerIdeality = lowerIdeality;
        this.upperIdeality = upperIdeality;
    }

    public String description() {
        return description;
    }

    /**
     * Classifies an ideality factor. Bands are half-open [lower, upper).
     *
     * @param ideality Ideality factor, non-finite or below 0.8 gives UNKNOWN.
     * @return The mechanism.
     */
    public static RecombinationMechanism fromIdeality(double ideality) {
        if (!Double.isFinite(ideality)) {
            return UNKNOWN;
        }
        for (RecombinationMechanism mechanism : values()) {
            if (mechanism != UNKNOWN && ideality >= mechanism.lowerIdeality && ideality < mechanism.upperIdeality) {
                return mechanism;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return description;
    }
}
