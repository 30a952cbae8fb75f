package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.MppSensitivity;
import de.anton.pv.solver.iv_solver.model.ParameterName;

/**
 * Physical plausibility table a VALID result must satisfy.
 */
public class PlausibilityCheck {

    public static final double MIN_IDEALITY = 0.8;
    public static final double MAX_IDEALITY = 2.5;
    public static final double MIN_SECONDARY_IDEALITY = 1.0;
    public static final double MAX_SECONDARY_IDEALITY = 7.0;
    public static final double MAX_FILL_FACTOR = 0.95;

    /**
     * @param parameters  fitted parameters
     * @param metrics     derived metrics, null for dark curves
     * @param sensitivity MPP sensitivity, null for dark curves
     * @throws PhysicalImplausibilityException on the first violated rule
     */
    public void check(FittedParameters parameters, DerivedMetrics metrics, MppSensitivity sensitivity)
            throws PhysicalImplausibilityException {
        if (parameters.seriesResistance() < 0) {
            throw new PhysicalImplausibilityException("Negative series resistance: " + parameters.seriesResistance());
        }
        if (parameters.shuntResistance() < 0) {
            throw new PhysicalImplausibilityException("Negative shunt resistance: " + parameters.shuntResistance());
        }
        double n = parameters.primaryIdeality();
        if (n < MIN_IDEALITY || n > MAX_IDEALITY) {
            throw new PhysicalImplausibilityException(String.format(
                    "Ideality factor %.4f outside [%.1f, %.1f].", n, MIN_IDEALITY, MAX_IDEALITY));
        }
        if (parameters.kind() == ModelKind.TWO_DIODE) {
            double n2 = parameters.get(ParameterName.SECONDARY_IDEALITY);
            if (n2 < MIN_SECONDARY_IDEALITY || n2 > MAX_SECONDARY_IDEALITY) {
                throw new PhysicalImplausibilityException(String.format(
                        "Secondary ideality factor %.4f outside [%.1f, %.1f].", n2,
                        MIN_SECONDARY_IDEALITY, MAX_SECONDARY_IDEALITY));
            }
        }
        if (metrics == null) {
            return;
        }
        if (!metrics.isFinite()) {
            throw new PhysicalImplausibilityException("Derived metrics are not finite: " + metrics);
        }
        if (!(metrics.shortCircuitCurrentDensity() > 0)) {
            throw new PhysicalImplausibilityException("Jsc must be positive.");
        }
        if (!(metrics.openCircuitVoltage() > 0)) {
            throw new PhysicalImplausibilityException("Voc must be positive.");
        }
        if (!(metrics.fillFactor() > 0) || metrics.fillFactor() > MAX_FILL_FACTOR) {
            throw new PhysicalImplausibilityException(String.format(
                    "Fill factor %.4f outside (0, %.2f].", metrics.fillFactor(), MAX_FILL_FACTOR));
        }
        if (!(metrics.efficiencyPercent() > 0)) {
            throw new PhysicalImplausibilityException("PCE must be positive.");
        }
        if (sensitivity != null && sensitivity.powerSensitivityToSeriesResistance() > 0) {
            throw new PhysicalImplausibilityException(
                    "Output power increases with series resistance (dP/dRs = "
                            + sensitivity.powerSensitivityToSeriesResistance() + ").");
        }
    }
}
