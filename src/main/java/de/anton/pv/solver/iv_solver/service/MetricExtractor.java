package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.DiodeModelEvaluator;
import de.anton.pv.solver.iv_solver.model.AnalysisMode;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.MppSensitivity;
import de.anton.pv.solver.iv_solver.model.ParameterEstimationUtils;
import de.anton.pv.solver.iv_solver.model.ParameterName;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Figures of merit of an illuminated curve.
 * <ul>
 *   <li>Jsc: |I| at V = 0 by linear interpolation, x1000 / area, mA/cm2</li>
 *   <li>Voc: voltage of the first downward zero crossing, linear interpolation</li>
 *   <li>MPP: maximum of a cubic spline through P = V I restricted to the
 *       power quadrant (V &gt; 0, I &gt; 0)</li>
 *   <li>FF = Pmax / (Voc Isc), PCE = Pmax / (area Pin) x 100</li>
 * </ul>
 * In REFERENCE mode the curve is the fitted model sampled densely, in
 * EXPLORATION mode the preconditioned measurement itself.
 */
public class MetricExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MetricExtractor.class);

    static final int DENSE_GRID_POINTS = 401;
    private static final int COARSE_STEPS_PER_INTERVAL = 10;
    private static final int MAX_BRENT_EVALUATIONS = 200;

    /**
     * @throws PhysicalImplausibilityException if Jsc, Voc or the MPP cannot be determined.
     */
    public DerivedMetrics extract(PreconditionedCurve curve, FittedParameters parameters,
                                  DiodeModelEvaluator evaluator, AnalysisMode mode, double incidentPowerDensity)
            throws PhysicalImplausibilityException {
        double[] v;
        double[] i;
        if (mode == AnalysisMode.REFERENCE) {
            v = denseGrid(Math.min(curve.minVoltage(), 0.0), curve.maxVoltage());
            i = evaluator.evaluate(parameters, v).currents();
        } else {
            v = curve.getVoltages();
            i = curve.getCurrents();
        }

        double iscSigned = ParameterEstimationUtils.interpolateAt(v, i, 0.0);
        if (!Double.isFinite(iscSigned)) {
            throw new PhysicalImplausibilityException("Short-circuit point V = 0 is not within the measured range.");
        }
        if (!(iscSigned > 0)) {
            throw new PhysicalImplausibilityException("No photocurrent at short circuit (I(0) = " + iscSigned + " A).");
        }
        double isc = Math.abs(iscSigned);
        double area = curve.getAreaCm2();
        double jsc = isc * 1000.0 / area;

        double voc = ParameterEstimationUtils.zeroCrossingVoltage(v, i);
        if (!Double.isFinite(voc)) {
            throw new PhysicalImplausibilityException("Open-circuit voltage is not within the measured range.");
        }

        double[] mpp = maximumPowerPoint(v, i);
        double vmpp = mpp[0];
        double pmax = mpp[1];
        double impp = pmax / vmpp;

        double fillFactor = pmax / (voc * isc);
        double efficiency = (pmax * 1000.0 / area) / incidentPowerDensity * 100.0;

        logger.debug("Metrics: Jsc={} mA/cm2, Voc={} V, FF={}, PCE={} %", jsc, voc, fillFactor, efficiency);
        return new DerivedMetrics(jsc, voc, fillFactor, efficiency, pmax, vmpp, impp, isc,
                parameters.seriesResistance() * area, parameters.shuntResistance() * area, incidentPowerDensity);
    }

    /**
     * Sensitivity of the modeled current to each parameter at the MPP voltage,
     * and dP/dRs = Vmpp dI/dRs.
     */
    public MppSensitivity sensitivityAtMpp(FittedParameters parameters, DiodeModelEvaluator evaluator,
                                           double mppVoltage) {
        double current = evaluator.currentAt(parameters, mppVoltage);
        double[][] jacobian = evaluator.currentSensitivities(parameters, new double[]{mppVoltage},
                new double[]{current});
        List<ParameterName> names = ParameterName.forModel(parameters.kind());
        Map<ParameterName, Double> sensitivity = new EnumMap<>(ParameterName.class);
        for (int k = 0; k < names.size(); k++) {
            sensitivity.put(names.get(k), jacobian[0][k]);
        }
        double dPdRs = mppVoltage * sensitivity.get(ParameterName.SERIES_RESISTANCE);
        return new MppSensitivity(mppVoltage, current, sensitivity, dPdRs);
    }

    /**
     * Maximum of the spline through the power-quadrant samples.
     *
     * @return {Vmpp, Pmax}
     */
    double[] maximumPowerPoint(double[] v, double[] i) throws PhysicalImplausibilityException {
        int first = -1;
        int last = -1;
        for (int k = 0; k < v.length; k++) {
            boolean producing = v[k] > 0 && i[k] > 0;
            if (producing && first < 0) {
                first = k;
            }
            if (first >= 0) {
                if (!producing) break;
                last = k;
            }
        }
        if (first < 0) {
            throw new PhysicalImplausibilityException("No samples in the power-producing quadrant.");
        }
        int count = last - first + 1;
        double[] vq = new double[count];
        double[] pq = new double[count];
        int best = 0;
        for (int k = 0; k < count; k++) {
            vq[k] = v[first + k];
            pq[k] = vq[k] * i[first + k];
            if (pq[k] > pq[best]) best = k;
        }
        if (count < 3) {
            logger.debug("Metrics: only {} power-quadrant samples, using the best sample as MPP.", count);
            return new double[]{vq[best], pq[best]};
        }

        PolynomialSplineFunction spline = new SplineInterpolator().interpolate(vq, pq);
        // coarse scan of every knot interval, then Brent around the best scan point
        double bestV = vq[best];
        double bestP = pq[best];
        for (int k = 0; k < count - 1; k++) {
            for (int s = 1; s < COARSE_STEPS_PER_INTERVAL; s++) {
                double x = vq[k] + (vq[k + 1] - vq[k]) * s / COARSE_STEPS_PER_INTERVAL;
                double p = spline.value(x);
                if (p > bestP) {
                    bestP = p;
                    bestV = x;
                }
            }
        }
        int knot = 0;
        while (knot < count - 1 && vq[knot + 1] < bestV) knot++;
        double lo = vq[Math.max(0, knot - 1)];
        double hi = vq[Math.min(count - 1, knot + 2)];
        if (bestV > lo && bestV < hi) {
            BrentOptimizer optimizer = new BrentOptimizer(1e-10, 1e-14);
            UnivariatePointValuePair optimum = optimizer.optimize(
                    new MaxEval(MAX_BRENT_EVALUATIONS),
                    new UnivariateObjectiveFunction(spline),
                    GoalType.MAXIMIZE,
                    new SearchInterval(lo, hi, bestV));
            if (optimum.getValue() > bestP) {
                bestV = optimum.getPoint();
                bestP = optimum.getValue();
            }
        }
        if (!(bestP > 0)) {
            throw new PhysicalImplausibilityException("Maximum power is not positive.");
        }
        return new double[]{bestV, bestP};
    }

    static double[] denseGrid(double from, double to) {
        double[] grid = new double[DENSE_GRID_POINTS];
        for (int k = 0; k < DENSE_GRID_POINTS; k++) {
            grid[k] = from + (to - from) * k / (DENSE_GRID_POINTS - 1);
        }
        grid[DENSE_GRID_POINTS - 1] = to;
        return grid;
    }
}
