package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.FitErrorKind;

/**
 * Base of the engine's error taxonomy. Thrown by the pipeline stages and
 * converted into a result status by {@link IvAnalysisService#analyze}.
 */
public abstract class IvAnalysisException extends Exception {

    private final FitErrorKind kind;

    protected IvAnalysisException(FitErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FitErrorKind getKind() {
        return kind;
    }
}
