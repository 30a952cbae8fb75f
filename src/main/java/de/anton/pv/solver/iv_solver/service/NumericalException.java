package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.FitErrorKind;

/**
 * Overflow or NaN while evaluating the model. The fitter retries once with a
 * tighter exponent cap before giving up with a {@link FitConvergenceException}.
 */
public class NumericalException extends IvAnalysisException {

    public NumericalException(String message, Throwable cause) {
        super(FitErrorKind.NUMERICAL, message, cause);
    }
}
