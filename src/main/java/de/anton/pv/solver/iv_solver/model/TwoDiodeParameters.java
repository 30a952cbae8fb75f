package de.anton.pv.solver.iv_solver.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Parameters of the two-diode model. The first diode models diffusion
 * recombination, the second (n2 typically near 2) recombination in the
 * depletion region.
 */
public record TwoDiodeParameters(
        double photocurrent,
        double saturationCurrent1,
        double ideality1,
        double saturationCurrent2,
        double ideality2,
        double seriesResistance,
        double shuntResistance
) implements FittedParameters {

    public TwoDiodeParameters {
        double[] all = {photocurrent, saturationCurrent1, ideality1, saturationCurrent2, ideality2,
                seriesResistance, shuntResistance};
        for (double value : all) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Two-diode parameters must be finite.");
            }
        }
    }

    @Override
    public ModelKind kind() {
        return ModelKind.TWO_DIODE;
    }

    @Override
    public double primarySaturationCurrent() {
        return saturationCurrent1;
    }

    @Override
    public double primaryIdeality() {
        return ideality1;
    }

    @Override
    public Map<ParameterName, Double> asMap() {
        Map<ParameterName, Double> map = new EnumMap<>(ParameterName.class);
        map.put(ParameterName.PHOTOCURRENT, photocurrent);
        map.put(ParameterName.SATURATION_CURRENT, saturationCurrent1);
        map.put(ParameterName.IDEALITY, ideality1);
        map.put(ParameterName.SECONDARY_SATURATION_CURRENT, saturationCurrent2);
        map.put(ParameterName.SECONDARY_IDEALITY, ideality2);
        map.put(ParameterName.SERIES_RESISTANCE, seriesResistance);
        map.put(ParameterName.SHUNT_RESISTANCE, shuntResistance);
        return Collections.unmodifiableMap(map);
    }
}
