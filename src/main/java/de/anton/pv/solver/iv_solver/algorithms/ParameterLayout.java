package de.anton.pv.solver.iv_solver.algorithms;

import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.ParameterBounds;
import de.anton.pv.solver.iv_solver.model.ParameterName;
import de.anton.pv.solver.iv_solver.model.ParameterScale;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps between device-level parameters and the two coordinate systems of the
 * optimizers: the search space (log10 or linear per parameter, see
 * {@link ParameterScale}) used by the local refiner, and the unit hypercube
 * (min-max scaled search space) used by the global search.
 * <p>
 * For dark curves the photocurrent is not a free coordinate and is fixed at 0 A.
 */
public final class ParameterLayout {

    private final ModelKind modelKind;
    private final List<ParameterName> free;
    private final double[] lower;
    private final double[] upper;

    private ParameterLayout(ModelKind modelKind, List<ParameterName> free, double[] lower, double[] upper) {
        this.modelKind = modelKind;
        this.free = Collections.unmodifiableList(free);
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Creates the layout for a model kind.
     *
     * @param kind             Model kind.
     * @param photocurrentFree False for dark curves.
     * @param bounds           Physical bounds table covering the kind.
     * @return The layout.
     * @throws IllegalArgumentException if a bound is missing or a log-scaled bound is not positive.
     */
    public static ParameterLayout of(ModelKind kind, boolean photocurrentFree, ParameterBounds bounds) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(bounds, "bounds");
        List<ParameterName> free = new ArrayList<>();
        for (ParameterName name : ParameterName.forModel(kind)) {
            if (name == ParameterName.PHOTOCURRENT && !photocurrentFree) continue;
            free.add(name);
        }
        double[] lower = new double[free.size()];
        double[] upper = new double[free.size()];
        for (int k = 0; k < free.size(); k++) {
            ParameterName name = free.get(k);
            ParameterBounds.Bound bound = bounds.get(name);
            if (name.scale() == ParameterScale.LOG10 && !(bound.lower() > 0)) {
                throw new IllegalArgumentException("Log-scaled parameter " + name + " needs a positive lower bound.");
            }
            lower[k] = name.scale().toSearch(bound.lower());
            upper[k] = name.scale().toSearch(bound.upper());
        }
        return new ParameterLayout(kind, free, lower, upper);
    }

    public ModelKind getModelKind() { return modelKind; }
    public List<ParameterName> getFreeParameters() { return free; }
    public int dimension() { return free.size(); }
    public double[] getLowerBounds() { return lower.clone(); }
    public double[] getUpperBounds() { return upper.clone(); }

    /** Search-space vector of the parameters, clamped into the bounds. */
    public double[] toSearch(FittedParameters parameters) {
        double[] point = new double[free.size()];
        for (int k = 0; k < free.size(); k++) {
            ParameterName name = free.get(k);
            point[k] = name.scale().toSearch(parameters.get(name));
        }
        return clamp(point);
    }

    /** Device-level parameters of a search-space vector. */
    public FittedParameters toParameters(double[] searchPoint) {
        Map<ParameterName, Double> values = new EnumMap<>(ParameterName.class);
        values.put(ParameterName.PHOTOCURRENT, 0.0);
        for (int k = 0; k < free.size(); k++) {
            ParameterName name = free.get(k);
            values.put(name, name.scale().toPhysical(searchPoint[k]));
        }
        return FittedParameters.of(modelKind, values);
    }

    public double[] toUnit(double[] searchPoint) {
        double[] unit = new double[free.size()];
        for (int k = 0; k < unit.length; k++) {
            double range = upper[k] - lower[k];
            unit[k] = range > 0 ? (searchPoint[k] - lower[k]) / range : 0.5;
            unit[k] = Math.max(0.0, Math.min(1.0, unit[k]));
        }
        return unit;
    }

    public double[] fromUnit(double[] unitPoint) {
        double[] point = new double[free.size()];
        for (int k = 0; k < point.length; k++) {
            point[k] = lower[k] + unitPoint[k] * (upper[k] - lower[k]);
        }
        return point;
    }

    /** Clamps a search-space vector into the bounds (NaN goes to the lower bound). */
    public double[] clamp(double[] searchPoint) {
        double[] clamped = new double[free.size()];
        for (int k = 0; k < clamped.length; k++) {
            double value = searchPoint[k];
            clamped[k] = Double.isNaN(value) ? lower[k] : Math.max(lower[k], Math.min(upper[k], value));
        }
        return clamped;
    }

    /**
     * Converts a sensitivity matrix from {@link DiodeModelEvaluator#currentSensitivities}
     * (all model parameters, physical units) into search coordinates of the
     * free parameters.
     */
    public double[][] toSearchJacobian(double[][] physicalJacobian, FittedParameters parameters) {
        List<ParameterName> all = ParameterName.forModel(modelKind);
        int[] columns = new int[free.size()];
        double[] factors = new double[free.size()];
        for (int k = 0; k < free.size(); k++) {
            ParameterName name = free.get(k);
            columns[k] = all.indexOf(name);
            factors[k] = name.scale().chainFactor(parameters.get(name));
        }
        double[][] jacobian = new double[physicalJacobian.length][free.size()];
        for (int row = 0; row < physicalJacobian.length; row++) {
            for (int k = 0; k < free.size(); k++) {
                jacobian[row][k] = physicalJacobian[row][columns[k]] * factors[k];
            }
        }
        return jacobian;
    }
}
