package de.anton.pv.solver.iv_solver.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Parameters of the single-diode model
 * {@code I = Iph - I0 (exp((V + I Rs) / (n Vt)) - 1) - (V + I Rs) / Rsh}.
 */
public record OneDiodeParameters(
        double photocurrent,
        double saturationCurrent,
        double ideality,
        double seriesResistance,
        double shuntResistance
) implements FittedParameters {

    public OneDiodeParameters {
        if (!Double.isFinite(photocurrent) || !Double.isFinite(saturationCurrent) || !Double.isFinite(ideality)
                || !Double.isFinite(seriesResistance) || !Double.isFinite(shuntResistance)) {
            throw new IllegalArgumentException("One-diode parameters must be finite.");
        }
    }

    @Override
    public ModelKind kind() {
        return ModelKind.ONE_DIODE;
    }

    @Override
    public double primarySaturationCurrent() {
        return saturationCurrent;
    }

    @Override
    public double primaryIdeality() {
        return ideality;
    }

    @Override
    public Map<ParameterName, Double> asMap() {
        Map<ParameterName, Double> map = new EnumMap<>(ParameterName.class);
        map.put(ParameterName.PHOTOCURRENT, photocurrent);
        map.put(ParameterName.SATURATION_CURRENT, saturationCurrent);
        map.put(ParameterName.IDEALITY, ideality);
        map.put(ParameterName.SERIES_RESISTANCE, seriesResistance);
        map.put(ParameterName.SHUNT_RESISTANCE, shuntResistance);
        return Collections.unmodifiableMap(map);
    }
}
