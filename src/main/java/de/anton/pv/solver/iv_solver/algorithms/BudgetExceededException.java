package de.anton.pv.solver.iv_solver.algorithms;

/**
 * Thrown by the optimizers when the wall-clock budget of an analysis runs out.
 */
public class BudgetExceededException extends RuntimeException {

    public BudgetExceededException(String message) {
        super(message);
    }
}
