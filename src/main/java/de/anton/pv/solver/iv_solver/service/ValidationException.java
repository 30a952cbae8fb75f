package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.FitErrorKind;

/**
 * Malformed input: too few points, non-finite samples, non-monotonic voltage,
 * a bad area or configuration. Maps to INVALID.
 */
public class ValidationException extends IvAnalysisException {

    public ValidationException(String message) {
        super(FitErrorKind.VALIDATION, message, null);
    }
}
