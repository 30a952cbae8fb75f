package de.anton.pv.solver.iv_solver.model;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FittedParameters} and its two variants.
 */
class FittedParametersTest {

    @Test
    void of_oneDiode_buildsOneDiodeRecordInCanonicalOrder() {
        OneDiodeParameters expected = new OneDiodeParameters(0.03, 1e-10, 1.1, 0.5, 2000.0);

        FittedParameters built = FittedParameters.of(ModelKind.ONE_DIODE, expected.asMap());

        assertThat(built).isEqualTo(expected);
        assertThat(built.asMap().keySet()).containsExactlyElementsOf(ParameterName.forModel(ModelKind.ONE_DIODE));
    }

    @Test
    void of_twoDiode_exposesPrimaryDiode() {
        Map<ParameterName, Double> values = new EnumMap<>(ParameterName.class);
        values.put(ParameterName.PHOTOCURRENT, 0.03);
        values.put(ParameterName.SATURATION_CURRENT, 1e-12);
        values.put(ParameterName.IDEALITY, 1.0);
        values.put(ParameterName.SECONDARY_SATURATION_CURRENT, 1e-8);
        values.put(ParameterName.SECONDARY_IDEALITY, 2.0);
        values.put(ParameterName.SERIES_RESISTANCE, 0.3);
        values.put(ParameterName.SHUNT_RESISTANCE, 5000.0);

        FittedParameters built = FittedParameters.of(ModelKind.TWO_DIODE, values);

        assertThat(built).isInstanceOf(TwoDiodeParameters.class);
        assertThat(built.kind()).isEqualTo(ModelKind.TWO_DIODE);
        assertThat(built.primarySaturationCurrent()).isEqualTo(1e-12);
        assertThat(built.primaryIdeality()).isEqualTo(1.0);
        assertThat(built.get(ParameterName.SECONDARY_IDEALITY)).isEqualTo(2.0);
    }

    @Test
    void get_withParameterOfOtherVariant_throwsException() {
        FittedParameters parameters = new OneDiodeParameters(0.03, 1e-10, 1.1, 0.5, 2000.0);

        assertThatThrownBy(() -> parameters.get(ParameterName.SECONDARY_SATURATION_CURRENT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not part of");
    }

    @Test
    void constructor_withNonFiniteValue_throwsException() {
        assertThatThrownBy(() -> new OneDiodeParameters(0.03, Double.NaN, 1.1, 0.5, 2000.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
