package de.anton.pv.solver.iv_solver.model;

import java.util.List;

/**
 * Outcome of the noise-injection refits.
 *
 * @param noiseLevel        relative Gaussian noise amplitude
 * @param requestedTrials   configured number of trials
 * @param successfulTrials  trials that produced a valid fit
 * @param drifts            per-quantity drift statistics
 * @param score             stability score, 0..100
 * @param stable            every drift within twice the noise level and no failed trial
 * @param complete          false when the wall-clock budget ended the loop early
 */
public record NoiseStability(
        double noiseLevel,
        int requestedTrials,
        int successfulTrials,
        List<ParameterDrift> drifts,
        double score,
        boolean stable,
        boolean complete
) {
    public NoiseStability {
        drifts = List.copyOf(drifts);
    }

    /** Largest drift of any quantity, 0 when there are none. */
    public double worstDrift() {
        double max = 0.0;
        for (ParameterDrift drift : drifts) {
            max = Math.max(max, drift.maxDrift());
        }
        return max;
    }
}
