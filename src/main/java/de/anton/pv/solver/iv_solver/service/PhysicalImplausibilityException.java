package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.FitErrorKind;

/**
 * A converged fit whose parameters or metrics violate the physical
 * plausibility table. Maps to INVALID.
 */
public class PhysicalImplausibilityException extends IvAnalysisException {

    public PhysicalImplausibilityException(String message) {
        super(FitErrorKind.PHYSICAL_IMPLAUSIBILITY, message, null);
    }
}
