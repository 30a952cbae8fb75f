package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.AnalysisOutcome;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.DiagnosticReport;
import de.anton.pv.solver.iv_solver.model.FitErrorKind;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.FitStatus;
import de.anton.pv.solver.iv_solver.model.Measurement;
import de.anton.pv.solver.iv_solver.model.MppSensitivity;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import de.anton.pv.solver.iv_solver.algorithms.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the engine: preconditions a measurement, fits the
 * configured diode model, extracts the figures of merit, validates them and
 * runs the diagnostics.
 * <p>
 * Stateless; one instance may serve concurrent requests. Data and numerical
 * problems never escape as exceptions, they end up as the status of the
 * returned {@link FitResult}.
 */
public class IvAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(IvAnalysisService.class);

    public static final String ENGINE_VERSION = "1.0.0";

    private final Preconditioner preconditioner;
    private final CurveFitter fitter;
    private final MetricExtractor metricExtractor;
    private final PlausibilityCheck plausibilityCheck;
    private final DiagnosticsEngine diagnosticsEngine;
    private final DeterminismLayer determinismLayer;

    public IvAnalysisService() {
        this.preconditioner = new Preconditioner();
        this.fitter = new CurveFitter();
        this.metricExtractor = new MetricExtractor();
        this.plausibilityCheck = new PlausibilityCheck();
        this.diagnosticsEngine = new DiagnosticsEngine(new ResidualClassifier(),
                new NoiseStabilityAnalyzer(fitter, metricExtractor), new BoundaryStressAnalyzer(),
                new PhysicsInsightService());
        this.determinismLayer = new DeterminismLayer(new ResultHasher());
    }

    public IvAnalysisService(Preconditioner preconditioner, CurveFitter fitter, MetricExtractor metricExtractor,
                             PlausibilityCheck plausibilityCheck, DiagnosticsEngine diagnosticsEngine,
                             DeterminismLayer determinismLayer) {
        this.preconditioner = preconditioner;
        this.fitter = fitter;
        this.metricExtractor = metricExtractor;
        this.plausibilityCheck = plausibilityCheck;
        this.diagnosticsEngine = diagnosticsEngine;
        this.determinismLayer = determinismLayer;
    }

    /**
     * Analyzes one measurement.
     *
     * @param measurement The measurement.
     * @param config      The model configuration.
     * @return Fit result and diagnostic report, never null.
     * @throws NullPointerException if an argument is null.
     */
    public AnalysisOutcome analyze(Measurement measurement, ModelConfiguration config) {
        Objects.requireNonNull(measurement, "Measurement cannot be null.");
        Objects.requireNonNull(config, "Configuration cannot be null.");
        ModelConfiguration locked = determinismLayer.lock(config);
        Deadline deadline = determinismLayer.deadline(locked);
        logger.info("Service: Starting analysis of '{}' ({}, {} model, {} mode, seed {}).", measurement.getLabel(),
                measurement.getKind(), locked.modelKind(), locked.mode(), locked.seed());

        FitResult.Builder builder = FitResult.builder()
                .modelKind(locked.modelKind())
                .measurementKind(measurement.getKind())
                .analysisMode(locked.mode())
                .fingerprint(measurement.getFingerprint())
                .areaCm2(measurement.getAreaCm2())
                .temperatureK(measurement.getTemperatureK());

        PreconditionedCurve curve = null;
        try {
            // 1. Precondition
            curve = preconditioner.precondition(measurement);
            builder.temperatureK(curve.getTemperatureK());

            // 2. Fit
            CurveFitter.CurveFit fit = fitter.fit(curve, locked, deadline);
            builder.parameters(fit.parameters())
                    .globalCandidate(fit.globalCandidate())
                    .curve(curve.getVoltages(), curve.getCurrents(), fit.modeled(), fit.residuals())
                    .residualRms(fit.residualRms())
                    .objective(fit.objective())
                    .globalGenerations(fit.generations())
                    .refinerIterations(fit.iterations())
                    .refinerEvaluations(fit.evaluations());

            // 3. Metrics and plausibility
            if (curve.getKind().hasPhotocurrent()) {
                DerivedMetrics metrics = metricExtractor.extract(curve, fit.parameters(), fit.evaluator(),
                        locked.mode(), locked.settings().incidentPowerDensity());
                builder.metrics(metrics);
                MppSensitivity sensitivity = metricExtractor.sensitivityAtMpp(fit.parameters(), fit.evaluator(),
                        metrics.mppVoltage());
                builder.sensitivity(sensitivity);
                plausibilityCheck.check(fit.parameters(), metrics, sensitivity);
            } else {
                plausibilityCheck.check(fit.parameters(), null, null);
            }
            builder.status(FitStatus.VALID).message("Fit converged.");
        } catch (FitConvergenceException e) {
            logger.warn("Service: Fit of '{}' failed: {}", measurement.getLabel(), e.getMessage());
            builder.error(e.getKind(), e.getMessage()).globalCandidate(e.getGlobalCandidate());
        } catch (IvAnalysisException e) {
            logger.warn("Service: '{}' is {}: {}", measurement.getLabel(), e.getKind().status(), e.getMessage());
            builder.error(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Service: Unexpected error while analyzing '{}'", measurement.getLabel(), e);
            builder.error(FitErrorKind.NUMERICAL, "Unexpected error: " + e);
        }

        // 4. Hash
        FitResult provisional = builder.build();
        String hash = determinismLayer.hash(provisional, locked);
        FitResult result = builder.resultHash(hash, determinismLayer.isHashStable(locked)).build();
        logger.info("Service: '{}' finished with status {} (hash {}).", measurement.getLabel(), result.getStatus(),
                hash.substring(0, 12));

        // 5. Diagnostics
        return new AnalysisOutcome(result, diagnose(result, curve, locked, deadline));
    }

    private DiagnosticReport diagnose(FitResult result, PreconditionedCurve curve, ModelConfiguration config,
                                      Deadline deadline) {
        if (!result.isValid() || curve == null) {
            return DiagnosticReport.unavailable(result.getStatus() + ": " + result.getMessage());
        }
        try {
            return diagnosticsEngine.diagnose(result, curve, config, deadline);
        } catch (RuntimeException e) {
            logger.error("Service: Diagnostics failed", e);
            return DiagnosticReport.unavailable("diagnostics failed: " + e);
        }
    }
}
