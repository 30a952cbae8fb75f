package de.anton.pv.solver.iv_solver.model;

import java.util.List;

/**
 * Diagnostics derived from a completed fit.
 * Residual analysis, noise stability and physics insight are null when the
 * fit produced no curve to analyse.
 */
public record DiagnosticReport(
        ResidualAnalysis residualAnalysis,
        NoiseStability noiseStability,
        List<BoundaryHit> boundaryHits,
        PhysicsInsight physicsInsight,
        double riskScore,
        boolean validationPassed,
        List<String> recommendations
) {
    public DiagnosticReport {
        boundaryHits = List.copyOf(boundaryHits);
        recommendations = List.copyOf(recommendations);
        if (riskScore < 0 || riskScore > 100 || Double.isNaN(riskScore)) {
            throw new IllegalArgumentException("Risk score must be within [0, 100]: " + riskScore);
        }
    }

    /**
     * Report for a fit that ended INVALID or FAILED.
     */
    public static DiagnosticReport unavailable(String reason) {
        return new DiagnosticReport(null, null, List.of(), null, 100.0, false,
                List.of("No diagnostics available: " + reason));
    }

    public boolean hasBoundaryErrors() {
        return boundaryHits.stream().anyMatch(hit -> hit.severity() == BoundarySeverity.ERROR);
    }
}
