package de.anton.pv.solver.iv_solver.model;

import java.util.Map;

/**
 * Device-level parameters of a fitted equivalent circuit (ampere, ohm).
 * A tagged variant: {@link #kind()} names the concrete record,
 * {@link OneDiodeParameters} or {@link TwoDiodeParameters}.
 */
public interface FittedParameters {

    ModelKind kind();

    double photocurrent();

    /** Saturation current of the (first) diode. */
    double primarySaturationCurrent();

    /** Ideality factor of the (first) diode. */
    double primaryIdeality();

    double seriesResistance();

    double shuntResistance();

    /**
     * All parameters keyed by name, in the canonical order of
     * {@link ParameterName#forModel(ModelKind)}.
     */
    Map<ParameterName, Double> asMap();

    /**
     * Value of a single parameter.
     * @throws IllegalArgumentException if the parameter does not belong to this model kind.
     */
    default double get(ParameterName name) {
        Double value = asMap().get(name);
        if (value == null) {
            throw new IllegalArgumentException("Parameter " + name + " is not part of the " + kind() + " model.");
        }
        return value;
    }

    /**
     * Builds the variant for the given kind from a parameter map.
     *
     * @param kind   Model kind selecting the record type.
     * @param values Values for every parameter of that kind.
     * @return The parameter record.
     */
    static FittedParameters of(ModelKind kind, Map<ParameterName, Double> values) {
        switch (kind) {
            case ONE_DIODE:
                return new OneDiodeParameters(
                        values.get(ParameterName.PHOTOCURRENT),
                        values.get(ParameterName.SATURATION_CURRENT),
                        values.get(ParameterName.IDEALITY),
                        values.get(ParameterName.SERIES_RESISTANCE),
                        values.get(ParameterName.SHUNT_RESISTANCE));
            case TWO_DIODE:
                return new TwoDiodeParameters(
                        values.get(ParameterName.PHOTOCURRENT),
                        values.get(ParameterName.SATURATION_CURRENT),
                        values.get(ParameterName.IDEALITY),
                        values.get(ParameterName.SECONDARY_SATURATION_CURRENT),
                        values.get(ParameterName.SECONDARY_IDEALITY),
                        values.get(ParameterName.SERIES_RESISTANCE),
                        values.get(ParameterName.SHUNT_RESISTANCE));
            default:
                throw new IllegalArgumentException("Unknown model kind: " + kind);
        }
    }
}
