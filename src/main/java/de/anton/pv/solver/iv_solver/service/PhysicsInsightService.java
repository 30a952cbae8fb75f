package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.LightDarkComparison;
import de.anton.pv.solver.iv_solver.model.MeasurementKind;
import de.anton.pv.solver.iv_solver.model.ParameterEstimationUtils;
import de.anton.pv.solver.iv_solver.model.PhysicsInsight;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import de.anton.pv.solver.iv_solver.model.RecombinationMechanism;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Physical interpretation of a valid fit: ideality read off the semi-log
 * slope, recombination mechanism and an empirical fill-factor cross-check.
 * None of it changes the fitted parameters or the metrics.
 */
public class PhysicsInsightService {

    private static final Logger logger = LoggerFactory.getLogger(PhysicsInsightService.class);

    /** Tolerance above the empirical fill factor before it is reported as implausible. */
    static final double FILL_FACTOR_TOLERANCE = 0.05;

    public PhysicsInsight insight(FitResult result, PreconditionedCurve curve) {
        FittedParameters parameters = result.getParameters();
        if (parameters == null) {
            throw new IllegalArgumentException("Physics insight needs fitted parameters.");
        }
        double photocurrent = curve.getKind() == MeasurementKind.DARK ? 0.0 : parameters.photocurrent();
        double slopeIdeality = ParameterEstimationUtils.idealityFromSlope(curve.getVoltages(), curve.getCurrents(),
                curve.getThermalVoltage(), photocurrent);
        RecombinationMechanism mechanism = RecombinationMechanism.fromIdeality(parameters.primaryIdeality());

        double idealFillFactor = Double.NaN;
        boolean plausible = true;
        DerivedMetrics metrics = result.getMetrics();
        if (metrics != null) {
            idealFillFactor = empiricalFillFactor(metrics.openCircuitVoltage(), parameters.primaryIdeality(),
                    curve.getThermalVoltage());
            plausible = !Double.isFinite(idealFillFactor)
                    || metrics.fillFactor() <= idealFillFactor + FILL_FACTOR_TOLERANCE;
        }
        logger.debug("Diagnostics: slope ideality {}, mechanism {}, empirical FF {}", slopeIdeality, mechanism,
                idealFillFactor);
        return new PhysicsInsight(slopeIdeality, mechanism, idealFillFactor, plausible);
    }

    /**
     * Empirical fill factor of an ideal diode,
     * FF = (voc - ln(voc + 0.72)) / (voc + 1) with voc = Voc / (n Vt).
     *
     * @return The fill factor, NaN when voc is not positive.
     */
    public static double empiricalFillFactor(double openCircuitVoltage, double ideality, double thermalVoltage) {
        double voc = openCircuitVoltage / (ideality * thermalVoltage);
        if (!(voc > 0)) {
            return Double.NaN;
        }
        return (voc - Math.log(voc + 0.72)) / (voc + 1.0);
    }

    /**
     * Compares an illuminated fit with a dark fit of the same device.
     *
     * @throws IllegalArgumentException if either result is not valid or the kinds are swapped.
     */
    public LightDarkComparison compare(FitResult light, FitResult dark) {
        if (!light.isValid() || !dark.isValid()) {
            throw new IllegalArgumentException("Light/dark comparison needs two valid fits.");
        }
        if (light.getMeasurementKind() == MeasurementKind.DARK || dark.getMeasurementKind() != MeasurementKind.DARK) {
            throw new IllegalArgumentException("Expected an illuminated and a dark fit, got "
                    + light.getMeasurementKind() + " and " + dark.getMeasurementKind() + ".");
        }
        FittedParameters l = light.getParameters();
        FittedParameters d = dark.getParameters();
        double delta = l.primaryIdeality() - d.primaryIdeality();
        logger.info("Diagnostics: light/dark ideality difference {}", String.format("%.3f", delta));
        return new LightDarkComparison(l.primaryIdeality(), d.primaryIdeality(), delta,
                l.primarySaturationCurrent(), d.primarySaturationCurrent(),
                l.seriesResistance(), d.seriesResistance(), l.shuntResistance(), d.shuntResistance());
    }
}
