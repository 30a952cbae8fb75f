package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.FitErrorKind;
import de.anton.pv.solver.iv_solver.model.FittedParameters;

/**
 * The optimizers did not converge within their budget. Maps to FAILED.
 * Carries the best global-search candidate as diagnostic context.
 */
public class FitConvergenceException extends IvAnalysisException {

    private final transient FittedParameters globalCandidate;

    public FitConvergenceException(String message, FittedParameters globalCandidate, Throwable cause) {
        super(FitErrorKind.CONVERGENCE, message, cause);
        this.globalCandidate = globalCandidate;
    }

    /** Best candidate of the global stage, null if the global stage did not finish. */
    public FittedParameters getGlobalCandidate() {
        return globalCandidate;
    }
}
