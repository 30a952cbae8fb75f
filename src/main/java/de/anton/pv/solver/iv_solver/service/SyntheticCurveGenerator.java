package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.DiodeModelEvaluator;
import de.anton.pv.solver.iv_solver.algorithms.ModelEvaluation;
import de.anton.pv.solver.iv_solver.model.CurrentUnit;
import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.Measurement;
import de.anton.pv.solver.iv_solver.model.MeasurementKind;
import de.anton.pv.solver.iv_solver.model.OneDiodeParameters;
import de.anton.pv.solver.iv_solver.model.PhysicalConstants;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Curves generated from known parameters, for demonstrations, calibration
 * runs and tests.
 */
public final class SyntheticCurveGenerator {

    private SyntheticCurveGenerator() { throw new IllegalStateException("Utility class"); }

    /** Reference cell: Iph 30 mA, I0 1e-10 A, n 1.1, Rs 0.5 Ohm, Rsh 2000 Ohm on 1 cm2. */
    public static OneDiodeParameters referenceCell() {
        return new OneDiodeParameters(0.030, 1e-10, 1.1, 0.5, 2000.0);
    }

    /** {@code count} evenly spaced values from {@code from} to {@code to}, both included. */
    public static double[] linspace(double from, double to, int count) {
        if (count < 2) throw new IllegalArgumentException("At least two points required.");
        double[] values = new double[count];
        double step = (to - from) / (count - 1);
        for (int k = 0; k < count; k++) {
            values[k] = from + k * step;
        }
        values[count - 1] = to;
        return values;
    }

    /** Model currents (generator convention) at the given voltages. */
    public static double[] currents(FittedParameters parameters, double[] voltages, double temperatureK) {
        DiodeModelEvaluator evaluator = new DiodeModelEvaluator(PhysicalConstants.thermalVoltage(temperatureK));
        ModelEvaluation evaluation = evaluator.evaluate(parameters, voltages);
        if (!evaluation.finite()) {
            throw new IllegalArgumentException("Parameters give a non-finite curve: " + parameters);
        }
        return evaluation.currents();
    }

    /**
     * Noise-free measurement in ampere. The kind is DARK when the
     * photocurrent is zero.
     */
    public static Measurement measurement(String label, FittedParameters parameters, double[] voltages,
                                          double areaCm2, double temperatureK) {
        MeasurementKind kind = parameters.photocurrent() == 0.0 ? MeasurementKind.DARK : MeasurementKind.ILLUMINATED;
        return new Measurement(label, voltages, currents(parameters, voltages, temperatureK), areaCm2, temperatureK,
                kind, CurrentUnit.AMPERE, null);
    }

    /** The reference cell on -0.2..0.7 V with 181 samples at 298.15 K. */
    public static Measurement referenceMeasurement() {
        return measurement("reference-cell", referenceCell(), linspace(-0.2, 0.7, 181), 1.0,
                PhysicalConstants.STC_TEMPERATURE_K);
    }

    /** Adds Gaussian noise with sigma_i = level |I_i|. */
    public static double[] withRelativeNoise(double[] currents, double level, long seed) {
        RandomGenerator random = new MersenneTwister(seed);
        double[] noisy = new double[currents.length];
        for (int k = 0; k < currents.length; k++) {
            noisy[k] = currents[k] + level * Math.abs(currents[k]) * random.nextGaussian();
        }
        return noisy;
    }
}
