package de.anton.pv.solver.iv_solver.model;

/**
 * Classification of the fit residuals.
 *
 * @param pattern            shape class
 * @param level              severity of the pattern
 * @param confidencePercent  confidence of the classification, 0..100
 * @param rms                residual RMS in A
 * @param runsZScore         Wald-Wolfowitz z-score of the residual signs (NaN when not computed)
 * @param linearR2           share of the residual energy explained by a linear trend
 * @param quadraticR2        share explained by a quadratic trend
 * @param message            human-readable summary
 */
public record ResidualAnalysis(
        ResidualPattern pattern,
        WarningLevel level,
        double confidencePercent,
        double rms,
        double runsZScore,
        double linearR2,
        double quadraticR2,
        String message
) {
}
