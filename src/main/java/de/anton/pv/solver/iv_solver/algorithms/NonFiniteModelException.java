package de.anton.pv.solver.iv_solver.algorithms;

/**
 * Thrown by the local refiner when the model cannot be evaluated to finite
 * currents at a trial point.
 */
public class NonFiniteModelException extends RuntimeException {

    public NonFiniteModelException(String message) {
        super(message);
    }
}
