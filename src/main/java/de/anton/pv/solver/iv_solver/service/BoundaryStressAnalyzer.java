package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.BoundaryHit;
import de.anton.pv.solver.iv_solver.model.BoundarySeverity;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.FittedParameters;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags fitted quantities at, near or beyond their physical bounds
 * (area-normalised resistances).
 */
public class BoundaryStressAnalyzer {

    static final double[] IDEALITY_BOUNDS = {0.8, 2.5};
    static final double[] SERIES_RESISTANCE_BOUNDS = {0.0, 1000.0};  // Ohm cm2
    static final double[] SHUNT_RESISTANCE_BOUNDS = {1.0, 1e9};      // Ohm cm2
    static final double[] FILL_FACTOR_BOUNDS = {0.0, 0.9};

    /**
     * @param parameters fitted parameters
     * @param metrics    derived metrics, may be null
     * @param areaCm2    active area used to normalise the resistances
     * @param margin     relative safety margin, e.g. 0.1
     * @return Hits in the order n, Rs, Rsh, FF.
     */
    public List<BoundaryHit> analyze(FittedParameters parameters, DerivedMetrics metrics, double areaCm2,
                                     double margin) {
        List<BoundaryHit> hits = new ArrayList<>();
        inspect(hits, "n", parameters.primaryIdeality(), IDEALITY_BOUNDS, margin,
                "Ideality factor near its lower bound: check the temperature and the voltage calibration.",
                "Ideality factor near its upper bound: consider the two-diode model.");
        inspect(hits, "Rs", parameters.seriesResistance() * areaCm2, SERIES_RESISTANCE_BOUNDS, margin,
                "Series resistance at zero: the curve constrains Rs poorly, extend the sweep beyond Voc.",
                "High series resistance: check contacts, fingers and wiring.");
        inspect(hits, "Rsh", parameters.shuntResistance() * areaCm2, SHUNT_RESISTANCE_BOUNDS, margin,
                "Low shunt resistance: check for leakage paths or edge shunts.",
                "Shunt resistance at its upper bound: extend the sweep into reverse bias to constrain Rsh.");
        if (metrics != null) {
            inspect(hits, "FF", metrics.fillFactor(), FILL_FACTOR_BOUNDS, margin,
                    "Fill factor close to zero: the curve is barely rectifying.",
                    "Fill factor unusually high: check the active area and the current unit.");
        }
        return hits;
    }

    private static void inspect(List<BoundaryHit> hits, String quantity, double value, double[] bounds,
                                double margin, String lowRecommendation, String highRecommendation) {
        double lower = bounds[0];
        double upper = bounds[1];
        if (value < lower) {
            hits.add(new BoundaryHit(quantity, value, lower, upper, BoundarySeverity.ERROR, 0.0, lowRecommendation));
        } else if (value > upper) {
            hits.add(new BoundaryHit(quantity, value, lower, upper, BoundarySeverity.ERROR, 0.0, highRecommendation));
        } else if (value - lower <= margin * Math.abs(lower)) {
            hits.add(new BoundaryHit(quantity, value, lower, upper, BoundarySeverity.WARNING,
                    distancePercent(value - lower, lower), lowRecommendation));
        } else if (upper - value <= margin * Math.abs(upper)) {
            hits.add(new BoundaryHit(quantity, value, lower, upper, BoundarySeverity.WARNING,
                    distancePercent(upper - value, upper), highRecommendation));
        }
    }

    private static double distancePercent(double distance, double bound) {
        return bound != 0 ? 100.0 * distance / Math.abs(bound) : 0.0;
    }
}
