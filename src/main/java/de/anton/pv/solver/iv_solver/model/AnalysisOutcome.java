package de.anton.pv.solver.iv_solver.model;

import java.util.Objects;

/**
 * The pair returned by one analysis. Both parts are always present.
 */
public record AnalysisOutcome(FitResult fitResult, DiagnosticReport diagnosticReport) {

    public AnalysisOutcome {
        Objects.requireNonNull(fitResult, "Fit result cannot be null.");
        Objects.requireNonNull(diagnosticReport, "Diagnostic report cannot be null.");
    }
}
