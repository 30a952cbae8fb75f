package de.anton.pv.solver.iv_solver.model;

/**
 * Physical interpretation attached to a diagnostic report.
 *
 * @param idealityFromSlope     ideality from the ln|I| vs V slope, 0 when not extractable
 * @param mechanism             recombination mechanism suggested by the fitted ideality
 * @param idealFillFactor       empirical FF for the normalised Voc, NaN without metrics
 * @param fillFactorPlausible   fitted FF does not exceed the empirical one by more than 0.05
 */
public record PhysicsInsight(
        double idealityFromSlope,
        RecombinationMechanism mechanism,
        double idealFillFactor,
        boolean fillFactorPlausible
) {
}
