package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.CurrentUnit;
import de.anton.pv.solver.iv_solver.model.Measurement;
import de.anton.pv.solver.iv_solver.model.MeasurementKind;
import de.anton.pv.solver.iv_solver.model.PhysicalConstants;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates a raw measurement and normalises it for fitting: ascending
 * duplicate-free voltages, currents in ampere, generator sign convention.
 * Never modifies the measurement.
 */
public class Preconditioner {

    private static final Logger logger = LoggerFactory.getLogger(Preconditioner.class);

    public static final int MIN_POINTS = 5;
    /** Largest plausible current density in A/cm2 when inferring the unit. */
    private static final double MAX_PLAUSIBLE_DENSITY = 1.0;
    private static final double[] CANDIDATE_SCALES = {1.0, 1e-3, 1e-6};
    private static final double SIGN_WINDOW_FRACTION = 0.9;

    /**
     * @param measurement Raw measurement.
     * @return The preconditioned curve.
     * @throws ValidationException if the measurement cannot be fitted.
     */
    public PreconditionedCurve precondition(Measurement measurement) throws ValidationException {
        double[] voltages = measurement.getVoltages();
        double[] currents = measurement.getCurrents();
        logger.debug("Preconditioner: '{}' with {} samples.", measurement.getLabel(), voltages.length);

        double area = measurement.getAreaCm2();
        if (!Double.isFinite(area) || area <= 0) {
            throw new ValidationException("Active area must be positive and finite, got " + area + " cm2.");
        }
        if (voltages.length != currents.length) {
            throw new ValidationException("Voltage and current arrays differ in length ("
                    + voltages.length + " vs " + currents.length + ").");
        }
        if (voltages.length < MIN_POINTS) {
            throw new ValidationException("At least " + MIN_POINTS + " samples required, got " + voltages.length + ".");
        }
        for (int k = 0; k < voltages.length; k++) {
            if (!Double.isFinite(voltages[k]) || !Double.isFinite(currents[k])) {
                throw new ValidationException("Non-finite sample at index " + k + ".");
            }
        }

        double temperature = measurement.hasTemperature()
                ? measurement.getTemperatureK()
                : PhysicalConstants.STC_TEMPERATURE_K;
        if (!measurement.hasTemperature()) {
            logger.debug("Preconditioner: temperature unspecified, using {} K.", temperature);
        }

        // collapse adjacent duplicate voltages, first sample wins
        List<double[]> samples = new ArrayList<>(voltages.length);
        int dropped = 0;
        for (int k = 0; k < voltages.length; k++) {
            if (k > 0 && voltages[k] == voltages[k - 1]) {
                dropped++;
                continue;
            }
            samples.add(new double[]{voltages[k], currents[k]});
        }
        if (dropped > 0) {
            logger.warn("Preconditioner: dropped {} duplicate voltage samples.", dropped);
        }
        if (samples.size() < MIN_POINTS) {
            throw new ValidationException("At least " + MIN_POINTS + " distinct voltages required, got "
                    + samples.size() + ".");
        }

        boolean ascending = true;
        boolean descending = true;
        for (int k = 1; k < samples.size(); k++) {
            double step = samples.get(k)[0] - samples.get(k - 1)[0];
            ascending &= step > 0;
            descending &= step < 0;
        }
        if (!ascending && !descending) {
            throw new ValidationException("Voltage sweep is not monotonic.");
        }
        int n = samples.size();
        double[] v = new double[n];
        double[] i = new double[n];
        for (int k = 0; k < n; k++) {
            double[] sample = samples.get(descending ? n - 1 - k : k);
            v[k] = sample[0];
            i[k] = sample[1];
        }

        double scale;
        boolean inferred = false;
        CurrentUnit unit = measurement.getCurrentUnit();
        if (unit != null) {
            scale = unit.toAmpereFactor(area);
        } else {
            scale = inferScale(i, area);
            inferred = true;
            logger.warn("Preconditioner: current unit not given, inferred scale factor {}.", scale);
        }
        for (int k = 0; k < n; k++) {
            i[k] *= scale;
        }

        boolean flip = needsSignFlip(v, i, measurement.getKind());
        if (flip) {
            logger.info("Preconditioner: current follows the load convention, flipping sign.");
            for (int k = 0; k < n; k++) {
                i[k] = -i[k];
            }
        }

        return new PreconditionedCurve(measurement.getLabel(), measurement.getFingerprint(), measurement.getKind(),
                v, i, area, temperature, scale, inferred, flip, descending, dropped);
    }

    /**
     * First of A, mA, uA for which the peak current density stays plausible.
     */
    static double inferScale(double[] currents, double areaCm2) {
        double peak = 0.0;
        for (double value : currents) peak = Math.max(peak, Math.abs(value));
        for (double candidate : CANDIDATE_SCALES) {
            if (peak * candidate / areaCm2 <= MAX_PLAUSIBLE_DENSITY) {
                return candidate;
            }
        }
        return CANDIDATE_SCALES[CANDIDATE_SCALES.length - 1];
    }

    /**
     * Light curves: flip when the median current in 0 < V < 0.9 Vmax is negative.
     * Dark curves: flip when the median forward-bias current is positive.
     */
    static boolean needsSignFlip(double[] voltages, double[] currents, MeasurementKind kind) {
        double vMax = voltages[voltages.length - 1];
        List<Double> window = new ArrayList<>();
        for (int k = 0; k < voltages.length; k++) {
            boolean forward = voltages[k] > 0;
            boolean inWindow = kind == MeasurementKind.DARK || voltages[k] < SIGN_WINDOW_FRACTION * vMax;
            if (forward && inWindow) {
                window.add(currents[k]);
            }
        }
        if (window.isEmpty()) {
            return false;
        }
        double median = new Median().evaluate(window.stream().mapToDouble(Double::doubleValue).toArray());
        return kind == MeasurementKind.DARK ? median > 0 : median < 0;
    }
}
