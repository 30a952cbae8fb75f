package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.Deadline;
import de.anton.pv.solver.iv_solver.model.BoundaryHit;
import de.anton.pv.solver.iv_solver.model.DiagnosticReport;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.NoiseStability;
import de.anton.pv.solver.iv_solver.model.PhysicsInsight;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import de.anton.pv.solver.iv_solver.model.ResidualAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles the diagnostic report of a valid fit: residual pattern, noise
 * stability, boundary stress, physics insight, risk score and
 * recommendations.
 */
public class DiagnosticsEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsEngine.class);

    static final double RESIDUAL_WEIGHT = 0.4;
    static final double STABILITY_WEIGHT = 0.3;
    static final double BOUNDARY_WEIGHT = 0.3;
    static final double PASS_THRESHOLD = 50.0;

    private final ResidualClassifier residualClassifier;
    private final NoiseStabilityAnalyzer noiseAnalyzer;
    private final BoundaryStressAnalyzer boundaryAnalyzer;
    private final PhysicsInsightService physicsInsight;

    public DiagnosticsEngine(ResidualClassifier residualClassifier, NoiseStabilityAnalyzer noiseAnalyzer,
                             BoundaryStressAnalyzer boundaryAnalyzer, PhysicsInsightService physicsInsight) {
        this.residualClassifier = residualClassifier;
        this.noiseAnalyzer = noiseAnalyzer;
        this.boundaryAnalyzer = boundaryAnalyzer;
        this.physicsInsight = physicsInsight;
    }

    /**
     * @param result   a VALID fit result with its curve
     * @param curve    the preconditioned curve the result was fitted to
     * @param config   locked configuration
     * @param deadline budget shared with the fit
     */
    public DiagnosticReport diagnose(FitResult result, PreconditionedCurve curve, ModelConfiguration config,
                                     Deadline deadline) {
        if (!result.isValid()) {
            return DiagnosticReport.unavailable(result.getMessage());
        }
        ResidualAnalysis residuals = residualClassifier.classify(result.getVoltages(), result.getResiduals(),
                curve.peakAbsCurrent());
        logger.info("Diagnostics: residuals {} ({}).", residuals.pattern(), residuals.level());

        NoiseStability stability = noiseAnalyzer.assess(curve, result.getParameters(), result.getMetrics(), config,
                deadline);
        List<BoundaryHit> hits = boundaryAnalyzer.analyze(result.getParameters(), result.getMetrics(),
                curve.getAreaCm2(), config.settings().boundaryMargin());
        PhysicsInsight insight = physicsInsight.insight(result, curve);

        double risk = riskScore(residuals, stability, hits);
        boolean passed = risk < PASS_THRESHOLD;
        List<String> recommendations = recommendations(residuals, stability, hits, insight, config.modelKind());
        logger.info("Diagnostics: risk score {} ({}).", String.format("%.1f", risk), passed ? "passed" : "not passed");
        return new DiagnosticReport(residuals, stability, hits, insight, risk, passed, recommendations);
    }

    /**
     * Weighted risk from the residual level, the instability (100 - score)
     * and the boundary hits. Weights are renormalised over the components
     * present; the noise component is absent when no trials ran.
     */
    static double riskScore(ResidualAnalysis residuals, NoiseStability stability, List<BoundaryHit> hits) {
        double weighted = 0.0;
        double weights = 0.0;
        if (residuals != null) {
            weighted += RESIDUAL_WEIGHT * residuals.level().riskPoints();
            weights += RESIDUAL_WEIGHT;
        }
        if (stability != null) {
            weighted += STABILITY_WEIGHT * (100.0 - stability.score());
            weights += STABILITY_WEIGHT;
        }
        int boundaryPoints = 0;
        for (BoundaryHit hit : hits) {
            boundaryPoints += hit.severity().riskPoints();
        }
        weighted += BOUNDARY_WEIGHT * Math.min(100, boundaryPoints);
        weights += BOUNDARY_WEIGHT;
        double risk = weighted / weights;
        return Math.max(0.0, Math.min(100.0, risk));
    }

    private static List<String> recommendations(ResidualAnalysis residuals, NoiseStability stability,
                                                List<BoundaryHit> hits, PhysicsInsight insight, ModelKind modelKind) {
        Set<String> out = new LinkedHashSet<>();
        switch (residuals.pattern()) {
            case S_SHAPED -> out.add("S-shaped residuals: look for an extraction barrier or a non-ohmic contact;"
                    + " a diode model cannot describe the kink.");
            case SYSTEMATIC_CURVATURE -> out.add(modelKind == ModelKind.ONE_DIODE
                    ? "Curved residuals: try the two-diode model."
                    : "Curved residuals: check for voltage-dependent collection or a temperature drift.");
            case LINEAR_TREND -> out.add("Linear residual trend: the resistances are poorly constrained;"
                    + " extend the sweep into reverse bias and beyond Voc.");
            default -> {
            }
        }
        if (stability != null) {
            if (!stability.stable()) {
                out.add(String.format("Fit is sensitive to %.1f %% measurement noise (score %.0f):"
                        + " average repeated sweeps or add points.", 100 * stability.noiseLevel(), stability.score()));
            }
            if (!stability.complete()) {
                out.add("Noise stability check stopped early by the time budget; the score covers fewer trials.");
            }
        }
        for (BoundaryHit hit : hits) {
            out.add(hit.quantity() + ": " + hit.recommendation());
        }
        if (insight != null && !insight.fillFactorPlausible()) {
            out.add(String.format("Fill factor above the empirical limit %.3f for this Voc and ideality:"
                    + " check the active area.", insight.idealFillFactor()));
        }
        return new ArrayList<>(out);
    }
}
