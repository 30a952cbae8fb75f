package de.anton.pv.solver.iv_solver.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Local sensitivity of the modeled current to each parameter at the maximum
 * power point, and the resulting change of output power with Rs.
 */
public record MppSensitivity(
        double mppVoltage,
        double mppCurrent,
        Map<ParameterName, Double> currentSensitivity,
        double powerSensitivityToSeriesResistance
) {
    public MppSensitivity {
        Map<ParameterName, Double> copy = new EnumMap<>(ParameterName.class);
        copy.putAll(currentSensitivity);
        currentSensitivity = Collections.unmodifiableMap(copy);
    }
}
