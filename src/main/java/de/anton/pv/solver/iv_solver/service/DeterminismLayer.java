package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.Deadline;
import de.anton.pv.solver.iv_solver.model.AnalysisMode;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.FitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixes the execution contract of an analysis mode and hashes its results.
 * <p>
 * REFERENCE runs single-threaded with seed {@link ModelConfiguration#DEFAULT_SEED}
 * and the budgets and tolerances of {@link SolverSettings#reference()}, so
 * identical input gives an identical hash. Only the noise trial count, the
 * noise level, the incident power density and the time budget may differ
 * from the reference profile. EXPLORATION runs as configured and may evaluate
 * in parallel; its hash is informational.
 */
public class DeterminismLayer {

    private static final Logger logger = LoggerFactory.getLogger(DeterminismLayer.class);

    /** Relative tolerances for comparing metrics across platforms. */
    public static final double JSC_TOLERANCE = 0.001;
    public static final double VOC_TOLERANCE = 0.0005;
    public static final double FF_TOLERANCE = 0.001;
    public static final double PCE_TOLERANCE = 0.0015;

    private final ResultHasher hasher;

    public DeterminismLayer(ResultHasher hasher) {
        this.hasher = hasher;
    }

    /** The configuration actually run. */
    public ModelConfiguration lock(ModelConfiguration config) {
        if (config.mode() != AnalysisMode.REFERENCE) {
            return config;
        }
        SolverSettings requested = config.settings();
        SolverSettings pinned = SolverSettings.reference()
                .withNoiseTrials(requested.noiseTrials())
                .withNoiseLevel(requested.noiseLevel())
                .withIncidentPowerDensity(requested.incidentPowerDensity())
                .withTimeBudget(requested.timeBudget());
        ModelConfiguration locked = config;
        if (!pinned.equals(requested)) {
            logger.info("Determinism: REFERENCE mode runs with the reference budgets and tolerances,"
                    + " requested solver settings overridden.");
            locked = locked.withSettings(pinned);
        }
        if (config.seed() != ModelConfiguration.DEFAULT_SEED) {
            logger.info("Determinism: REFERENCE mode runs with seed {}, requested seed {} ignored.",
                    ModelConfiguration.DEFAULT_SEED, config.seed());
            locked = locked.withSeed(ModelConfiguration.DEFAULT_SEED);
        }
        return locked;
    }

    public Deadline deadline(ModelConfiguration config) {
        return Deadline.after(config.settings().timeBudget());
    }

    public String hash(FitResult result, ModelConfiguration config) {
        return hasher.hash(result, config);
    }

    public boolean isHashStable(ModelConfiguration config) {
        return config.mode() == AnalysisMode.REFERENCE;
    }

    /** Whether a result carries the expected hash. */
    public boolean verify(FitResult result, String expectedHash) {
        boolean match = expectedHash != null && expectedHash.equals(result.getResultHash());
        if (!match) {
            logger.warn("Determinism: hash mismatch, expected {} but got {}.", expectedHash, result.getResultHash());
        }
        return match;
    }

    /**
     * Whether two metric sets agree within the cross-platform tolerances.
     */
    public static boolean metricsAgree(DerivedMetrics a, DerivedMetrics b) {
        if (a == null || b == null) {
            return a == b;
        }
        return withinRelative(a.shortCircuitCurrentDensity(), b.shortCircuitCurrentDensity(), JSC_TOLERANCE)
                && withinRelative(a.openCircuitVoltage(), b.openCircuitVoltage(), VOC_TOLERANCE)
                && withinRelative(a.fillFactor(), b.fillFactor(), FF_TOLERANCE)
                && withinRelative(a.efficiencyPercent(), b.efficiencyPercent(), PCE_TOLERANCE);
    }

    private static boolean withinRelative(double a, double b, double tolerance) {
        double scale = Math.max(Math.abs(a), Math.abs(b));
        return scale == 0.0 || Math.abs(a - b) <= tolerance * scale;
    }
}
