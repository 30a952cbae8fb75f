package de.anton.pv.solver.iv_solver.model;

/**
 * A fitted quantity sitting at, near or beyond a physical bound.
 *
 * @param quantity         name of the quantity
 * @param value            fitted (area-normalised) value
 * @param lower            lower physical bound
 * @param upper            upper physical bound
 * @param severity         WARNING or ERROR
 * @param distancePercent  distance to the nearest bound in percent of the bound magnitude (0 at or beyond it)
 * @param recommendation   suggested follow-up
 */
public record BoundaryHit(
        String quantity,
        double value,
        double lower,
        double upper,
        BoundarySeverity severity,
        double distancePercent,
        String recommendation
) {
}
