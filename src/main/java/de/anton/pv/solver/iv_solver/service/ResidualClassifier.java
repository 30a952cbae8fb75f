package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.ResidualStatistics;
import de.anton.pv.solver.iv_solver.model.ResidualAnalysis;
import de.anton.pv.solver.iv_solver.model.ResidualPattern;
import de.anton.pv.solver.iv_solver.model.WarningLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies fit residuals as random, linear trend, systematic curvature or
 * s-shaped.
 * <p>
 * Residuals below {@value #NEGLIGIBLE_RMS_FRACTION} of the peak current, or
 * whose signs pass a one-sided runs test, are random. Structured residuals
 * are matched against polynomial trends: a significant cubic gain over the
 * quadratic fit marks an s-shape (extraction barrier), otherwise a linear or
 * quadratic trend. Structure none of them explains is also an s-shape.
 */
public class ResidualClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ResidualClassifier.class);

    static final double NEGLIGIBLE_RMS_FRACTION = 1e-6;
    static final double RUNS_Z_THRESHOLD = -1.96;
    static final double TREND_SHARE_THRESHOLD = 0.5;
    static final double CURVATURE_GAIN_THRESHOLD = 0.15;
    static final double INFLECTION_GAIN_THRESHOLD = 0.1;
    static final double CRITICAL_RMS_FRACTION = 0.01;

    /**
     * @param voltages    sample voltages
     * @param residuals   measured minus modeled current
     * @param peakCurrent largest absolute measured current, the scale of the curve
     * @return The classification.
     */
    public ResidualAnalysis classify(double[] voltages, double[] residuals, double peakCurrent) {
        double rms = ResidualStatistics.rms(residuals);
        double scale = peakCurrent > 0 ? peakCurrent : 1.0;
        double autocorrelation = ResidualStatistics.meanAbsAutocorrelation(residuals);

        if (!(rms > NEGLIGIBLE_RMS_FRACTION * scale)) {
            return new ResidualAnalysis(ResidualPattern.RANDOM, WarningLevel.LOW, 100.0, rms, Double.NaN,
                    0.0, 0.0, "Residuals are at numerical noise level.");
        }

        double z = ResidualStatistics.runsTestZ(residuals);
        double linear = ResidualStatistics.trendShare(voltages, residuals, 1);
        double quadratic = ResidualStatistics.trendShare(voltages, residuals, 2);
        double cubic = ResidualStatistics.trendShare(voltages, residuals, 3);
        boolean structured = Double.isFinite(z) ? z < RUNS_Z_THRESHOLD : linear >= TREND_SHARE_THRESHOLD;
        logger.debug("Diagnostics: residual rms={}, runs z={}, linear={}, quadratic={}, cubic={}", rms, z, linear,
                quadratic, cubic);

        if (!structured) {
            return new ResidualAnalysis(ResidualPattern.RANDOM, WarningLevel.LOW,
                    percent(1.0 - autocorrelation), rms, z, linear, quadratic,
                    "Residuals are randomly distributed; the model describes the data.");
        }
        double confidence = percent(autocorrelation);
        WarningLevel sShapeLevel = rms >= CRITICAL_RMS_FRACTION * scale ? WarningLevel.CRITICAL : WarningLevel.HIGH;
        if (cubic >= TREND_SHARE_THRESHOLD && cubic - quadratic >= INFLECTION_GAIN_THRESHOLD) {
            return new ResidualAnalysis(ResidualPattern.S_SHAPED, sShapeLevel, confidence, rms, z, linear, quadratic,
                    String.format("S-shaped residual structure with an inflection (cubic term explains %.0f %%,"
                            + " rms %.2f %% of peak current).", 100 * cubic, 100 * rms / scale));
        }
        if (linear >= TREND_SHARE_THRESHOLD && quadratic - linear < CURVATURE_GAIN_THRESHOLD) {
            return new ResidualAnalysis(ResidualPattern.LINEAR_TREND, WarningLevel.MEDIUM, confidence, rms, z,
                    linear, quadratic, String.format(
                    "Linear trend in the residuals (%.0f %% of residual energy).", 100 * linear));
        }
        if (quadratic >= TREND_SHARE_THRESHOLD) {
            return new ResidualAnalysis(ResidualPattern.SYSTEMATIC_CURVATURE, WarningLevel.HIGH, confidence, rms,
                    z, linear, quadratic, String.format(
                    "Systematic curvature in the residuals (%.0f %% of residual energy).", 100 * quadratic));
        }
        return new ResidualAnalysis(ResidualPattern.S_SHAPED, sShapeLevel, confidence, rms, z, linear, quadratic,
                String.format("S-shaped residual structure (rms %.2f %% of peak current).", 100 * rms / scale));
    }

    private static double percent(double fraction) {
        return Math.max(0.0, Math.min(100.0, 100.0 * fraction));
    }
}
