package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.Deadline;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.NoiseStability;
import de.anton.pv.solver.iv_solver.model.ParameterDrift;
import de.anton.pv.solver.iv_solver.model.ParameterName;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Re-fits the curve with injected Gaussian noise (sigma_i = level |I_i|) and
 * measures how far figures of merit and parameters drift from the clean fit.
 * Every drift counts towards the score and the stable verdict.
 * The noise of all trials is drawn up front from one seeded stream, so the
 * outcome does not depend on whether trials run in parallel.
 */
public class NoiseStabilityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(NoiseStabilityAnalyzer.class);

    /** Offset separating the noise stream from the global search stream. */
    static final long NOISE_SEED_OFFSET = 7919L;

    private final CurveFitter fitter;
    private final MetricExtractor metricExtractor;

    public NoiseStabilityAnalyzer(CurveFitter fitter, MetricExtractor metricExtractor) {
        this.fitter = fitter;
        this.metricExtractor = metricExtractor;
    }

    /** Figures of merit and parameters of one trial, null when the trial failed. */
    private record TrialOutcome(Map<String, Double> values) {
    }

    /**
     * @param curve        preconditioned clean curve
     * @param clean        parameters of the clean fit
     * @param cleanMetrics metrics of the clean fit, null for dark curves
     * @param config       locked configuration
     * @param deadline     wall-clock budget; expiry ends the loop and marks the result incomplete
     * @return The stability assessment, null when no trials are configured.
     */
    public NoiseStability assess(PreconditionedCurve curve, FittedParameters clean, DerivedMetrics cleanMetrics,
                                 ModelConfiguration config, Deadline deadline) {
        SolverSettings settings = config.settings();
        int trials = settings.noiseTrials();
        if (trials == 0) {
            return null;
        }
        double level = settings.noiseLevel();
        logger.info("Diagnostics: running {} noise trials at {} % relative noise.", trials, 100 * level);

        double[] currents = curve.getCurrents();
        RandomGenerator random = new MersenneTwister(config.seed() + NOISE_SEED_OFFSET);
        double[][] noisy = new double[trials][currents.length];
        for (int t = 0; t < trials; t++) {
            for (int k = 0; k < currents.length; k++) {
                noisy[t][k] = currents[k] + level * Math.abs(currents[k]) * random.nextGaussian();
            }
        }

        TrialOutcome[] outcomes = new TrialOutcome[trials];
        boolean[] attempted = new boolean[trials];
        IntStream indices = IntStream.range(0, trials);
        if (settings.parallelEvaluation()) {
            indices = indices.parallel();
        }
        indices.forEach(t -> {
            if (deadline.isExpired()) {
                return;
            }
            attempted[t] = true;
            outcomes[t] = runTrial(curve.withCurrents(noisy[t]), clean, config, config.seed() + 1 + t, deadline);
        });

        boolean complete = true;
        int successful = 0;
        List<Map<String, Double>> values = new ArrayList<>();
        for (int t = 0; t < trials; t++) {
            if (!attempted[t]) {
                complete = false;
            } else if (outcomes[t] != null) {
                successful++;
                values.add(outcomes[t].values());
            }
        }
        if (!complete) {
            logger.warn("Diagnostics: time budget ended the noise loop after {} of {} trials.",
                    countAttempted(attempted), trials);
        }

        Map<String, Double> cleanValues = quantities(clean, cleanMetrics);
        List<ParameterDrift> drifts = new ArrayList<>();
        for (Map.Entry<String, Double> entry : cleanValues.entrySet()) {
            String quantity = entry.getKey();
            double reference = entry.getValue();
            if (reference == 0.0 || values.isEmpty()) {
                continue;
            }
            DescriptiveStatistics stats = new DescriptiveStatistics();
            for (Map<String, Double> trial : values) {
                stats.addValue(Math.abs(trial.get(quantity) - reference) / Math.abs(reference));
            }
            drifts.add(new ParameterDrift(quantity, reference, stats.getMean(), stats.getStandardDeviation(),
                    stats.getMax()));
        }

        int attemptedCount = countAttempted(attempted);
        double score = score(drifts, successful / (double) Math.max(1, attemptedCount));
        boolean stable = isStable(drifts, level, successful, attemptedCount);
        logger.info("Diagnostics: noise stability score {} ({}/{} trials ok, stable={}).",
                String.format("%.1f", score), successful, trials, stable);
        return new NoiseStability(level, trials, successful, drifts, score, stable, complete);
    }

    private TrialOutcome runTrial(PreconditionedCurve noisyCurve, FittedParameters clean, ModelConfiguration config,
                                  long seed, Deadline deadline) {
        try {
            CurveFitter.CurveFit fit = fitter.refit(noisyCurve, config, clean,
                    config.settings().noiseTrialGenerations(), seed, deadline);
            DerivedMetrics metrics = null;
            if (noisyCurve.getKind().hasPhotocurrent()) {
                metrics = metricExtractor.extract(noisyCurve, fit.parameters(), fit.evaluator(), config.mode(),
                        config.settings().incidentPowerDensity());
            }
            return new TrialOutcome(quantities(fit.parameters(), metrics));
        } catch (IvAnalysisException e) {
            logger.debug("Diagnostics: noise trial failed: {}", e.getMessage());
            return null;
        } catch (RuntimeException e) {
            logger.warn("Diagnostics: noise trial failed unexpectedly", e);
            return null;
        }
    }

    /** Figures of merit (when present) followed by the parameters, in a fixed order. */
    static Map<String, Double> quantities(FittedParameters parameters, DerivedMetrics metrics) {
        Map<String, Double> values = new LinkedHashMap<>();
        if (metrics != null) {
            values.put("Jsc", metrics.shortCircuitCurrentDensity());
            values.put("Voc", metrics.openCircuitVoltage());
            values.put("FF", metrics.fillFactor());
            values.put("PCE", metrics.efficiencyPercent());
        }
        for (Map.Entry<ParameterName, Double> entry : parameters.asMap().entrySet()) {
            if (entry.getKey() == ParameterName.PHOTOCURRENT && metrics == null) continue;
            values.put(entry.getKey().symbol(), entry.getValue());
        }
        return values;
    }

    /**
     * 100 (1 - 10 mean(max drift)) scaled by the fraction of successful
     * trials, clipped to [0, 100]; 0 without drifts.
     */
    static double score(List<ParameterDrift> drifts, double successFraction) {
        if (drifts.isEmpty()) {
            return 0.0;
        }
        DescriptiveStatistics maxDrifts = new DescriptiveStatistics();
        for (ParameterDrift drift : drifts) {
            maxDrifts.addValue(drift.maxDrift());
        }
        double score = 100.0 * (1.0 - 10.0 * maxDrifts.getMean()) * successFraction;
        return Math.max(0.0, Math.min(100.0, score));
    }

    /** Every trial succeeded and no quantity drifted beyond twice the noise level. */
    static boolean isStable(List<ParameterDrift> drifts, double level, int successful, int attempted) {
        if (successful == 0 || successful != attempted) {
            return false;
        }
        for (ParameterDrift drift : drifts) {
            if (drift.maxDrift() > 2.0 * level) {
                return false;
            }
        }
        return true;
    }

    private static int countAttempted(boolean[] attempted) {
        int count = 0;
        for (boolean a : attempted) if (a) count++;
        return count;
    }
}
