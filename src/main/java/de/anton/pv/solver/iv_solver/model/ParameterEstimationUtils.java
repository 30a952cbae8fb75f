package de.anton.pv.solver.iv_solver.model;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Heuristic parameter estimates read directly off a curve: photocurrent at
 * V = 0, ideality from the semi-log slope, shunt resistance from the slope
 * near short circuit and series resistance from the slope at Voc.
 * Used to seed the global search and for the physics insight.
 */
public final class ParameterEstimationUtils {

    private static final Logger logger = LoggerFactory.getLogger(ParameterEstimationUtils.class);

    private static final int MIN_SLOPE_POINTS = 5;
    private static final double MIN_DIODE_CURRENT = 1e-9;   // A
    private static final double MAX_PLAUSIBLE_IDEALITY = 10.0;
    private static final double FALLBACK_IDEALITY = 1.5;
    private static final double FALLBACK_SHUNT = 1e4;        // Ohm

    private ParameterEstimationUtils() { throw new IllegalStateException("Utility class"); }

    /**
     * Linear interpolation of y at x0 over ascending x. Returns NaN when x0
     * lies outside the sampled range.
     */
    public static double interpolateAt(double[] x, double[] y, double x0) {
        for (int i = 1; i < x.length; i++) {
            if (x[i - 1] <= x0 && x0 <= x[i]) {
                double span = x[i] - x[i - 1];
                if (span == 0.0) return y[i - 1];
                double t = (x0 - x[i - 1]) / span;
                return y[i - 1] + t * (y[i] - y[i - 1]);
            }
        }
        return Double.NaN;
    }

    /**
     * Voltage of the first downward zero crossing of the current at V >= 0,
     * linearly interpolated. NaN when the current never crosses zero.
     */
    public static double zeroCrossingVoltage(double[] voltages, double[] currents) {
        for (int i = 1; i < voltages.length; i++) {
            if (voltages[i] < 0) continue;
            double i0 = currents[i - 1];
            double i1 = currents[i];
            if (i0 > 0 && i1 <= 0) {
                double t = i0 / (i0 - i1);
                return voltages[i - 1] + t * (voltages[i] - voltages[i - 1]);
            }
        }
        return Double.NaN;
    }

    /**
     * Ideality factor from the slope of ln(I_diode) against V in forward bias.
     * The diode current is {@code photocurrent - I} (generator convention, pass
     * 0 for dark curves). Only points with V > 3 Vt and a diode current above
     * 1 nA are used.
     *
     * @return The ideality factor, or 0 if fewer than five points qualify,
     *         the slope is not positive or the result is implausibly large.
     */
    public static double idealityFromSlope(double[] voltages, double[] currents, double thermalVoltage,
                                           double photocurrent) {
        SimpleRegression regression = new SimpleRegression();
        double minDiodeCurrent = Math.max(MIN_DIODE_CURRENT, 0.05 * Math.abs(photocurrent));
        for (int i = 0; i < voltages.length; i++) {
            double diodeCurrent = photocurrent - currents[i];
            if (voltages[i] > 3 * thermalVoltage && diodeCurrent > minDiodeCurrent) {
                regression.addData(voltages[i], Math.log(diodeCurrent));
            }
        }
        if (regression.getN() < MIN_SLOPE_POINTS) {
            logger.debug("Ideality from slope: only {} usable points.", regression.getN());
            return 0.0;
        }
        double slope = regression.getSlope();
        if (!(slope > 0)) {
            logger.debug("Ideality from slope: non-positive slope {}.", slope);
            return 0.0;
        }
        double ideality = 1.0 / (slope * thermalVoltage);
        return ideality < MAX_PLAUSIBLE_IDEALITY ? ideality : 0.0;
    }

    /**
     * Rough parameter estimate for a preconditioned curve. Not a fit: the
     * values only need to be of the right order of magnitude.
     *
     * @param curve Preconditioned curve.
     * @param kind  Model kind of the estimate.
     * @return Estimated device-level parameters (never null).
     */
    public static FittedParameters estimate(PreconditionedCurve curve, ModelKind kind) {
        double[] v = curve.getVoltages();
        double[] i = curve.getCurrents();
        double vt = curve.getThermalVoltage();
        boolean light = curve.getKind().hasPhotocurrent();

        double iph = 0.0;
        if (light) {
            double atZero = interpolateAt(v, i, 0.0);
            iph = Double.isFinite(atZero) ? Math.abs(atZero) : Math.abs(i[0]);
        }

        double n = idealityFromSlope(v, i, vt, iph);
        if (!(n > 0)) n = FALLBACK_IDEALITY;

        double voc = light ? zeroCrossingVoltage(v, i) : Double.NaN;
        double i0;
        if (Double.isFinite(voc) && iph > 0) {
            i0 = iph / Math.expm1(voc / (n * vt));
        } else {
            // dark: match the current at the highest voltage
            double vMax = v[v.length - 1];
            i0 = Math.max(Math.abs(i[i.length - 1]), MIN_DIODE_CURRENT) / Math.expm1(vMax / (n * vt));
        }

        double rsh = FALLBACK_SHUNT;
        double slopeNearZero = localSlope(v, i, 0.0);
        if (Double.isFinite(slopeNearZero) && slopeNearZero < 0) {
            rsh = -1.0 / slopeNearZero;
        }

        double rs = 0.0;
        if (Double.isFinite(voc)) {
            double slopeAtVoc = localSlope(v, i, voc);
            if (Double.isFinite(slopeAtVoc) && slopeAtVoc < 0) {
                rs = Math.max(0.0, -1.0 / slopeAtVoc - n * vt / (iph + i0));
            }
        }

        Map<ParameterName, Double> values = new EnumMap<>(ParameterName.class);
        values.put(ParameterName.PHOTOCURRENT, iph);
        values.put(ParameterName.SATURATION_CURRENT, i0);
        values.put(ParameterName.IDEALITY, n);
        values.put(ParameterName.SERIES_RESISTANCE, rs);
        values.put(ParameterName.SHUNT_RESISTANCE, rsh);
        if (kind == ModelKind.TWO_DIODE) {
            values.put(ParameterName.SECONDARY_SATURATION_CURRENT, i0 * 1e3);
            values.put(ParameterName.SECONDARY_IDEALITY, 2.0);
        }
        sanitize(values);
        logger.debug("Heuristic estimate: {}", values);
        return FittedParameters.of(kind, values);
    }

    /** Slope dI/dV from the two samples around x0, NaN outside the range. */
    private static double localSlope(double[] v, double[] i, double x0) {
        for (int k = 1; k < v.length; k++) {
            if (v[k - 1] <= x0 && x0 <= v[k] && v[k] > v[k - 1]) {
                int lo = Math.max(0, k - 2);
                int hi = Math.min(v.length - 1, k + 1);
                return (i[hi] - i[lo]) / (v[hi] - v[lo]);
            }
        }
        return Double.NaN;
    }

    private static void sanitize(Map<ParameterName, Double> values) {
        for (Map.Entry<ParameterName, Double> entry : values.entrySet()) {
            if (!Double.isFinite(entry.getValue())) {
                logger.trace("Heuristic estimate for {} not finite, using neutral value.", entry.getKey());
                entry.setValue(entry.getKey() == ParameterName.SHUNT_RESISTANCE ? FALLBACK_SHUNT : 0.0);
            }
        }
    }
}
