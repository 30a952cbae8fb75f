package de.anton.pv.solver.iv_solver.model;

import java.util.List;

/**
 * Names of the equivalent-circuit parameters, with their unit and search scale.
 */
public enum ParameterName {
    PHOTOCURRENT("Iph", "A", ParameterScale.LINEAR),
    SATURATION_CURRENT("I0", "A", ParameterScale.LOG10),
    IDEALITY("n", "", ParameterScale.LINEAR),
    SECONDARY_SATURATION_CURRENT("I02", "A", ParameterScale.LOG10),
    SECONDARY_IDEALITY("n2", "", ParameterScale.LINEAR),
    SERIES_RESISTANCE("Rs", "Ohm", ParameterScale.LINEAR),
    SHUNT_RESISTANCE("Rsh", "Ohm", ParameterScale.LOG10);

    private static final List<ParameterName> ONE_DIODE = List.of(
            PHOTOCURRENT, SATURATION_CURRENT, IDEALITY, SERIES_RESISTANCE, SHUNT_RESISTANCE);
    private static final List<ParameterName> TWO_DIODE = List.of(
            PHOTOCURRENT, SATURATION_CURRENT, IDEALITY, SECONDARY_SATURATION_CURRENT, SECONDARY_IDEALITY,
            SERIES_RESISTANCE, SHUNT_RESISTANCE);

    private final String symbol;
    private final String unit;
    private final ParameterScale scale;

    ParameterName(String symbol, String unit, ParameterScale scale) {
        this.symbol = symbol;
        this.unit = unit;
        this.scale = scale;
    }

    public String symbol() {
        return symbol;
    }

    public String unit() {
        return unit;
    }

    public ParameterScale scale() {
        return scale;
    }

    /**
     * All parameters of a model kind in canonical order (photocurrent first).
     */
    public static List<ParameterName> forModel(ModelKind kind) {
        return kind == ModelKind.TWO_DIODE ? TWO_DIODE : ONE_DIODE;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
