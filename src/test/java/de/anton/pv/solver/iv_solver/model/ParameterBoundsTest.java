package de.anton.pv.solver.iv_solver.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ParameterBounds}.
 */
class ParameterBoundsTest {

    @Test
    void defaults_oneDiode_coversOnlyOneDiodeParameters() {
        ParameterBounds bounds = ParameterBounds.defaults(ModelKind.ONE_DIODE);

        assertThat(bounds.covers(ModelKind.ONE_DIODE)).isTrue();
        assertThat(bounds.covers(ModelKind.TWO_DIODE)).isFalse();
        assertThat(bounds.get(ParameterName.IDEALITY)).isEqualTo(new ParameterBounds.Bound(0.5, 5.0));
    }

    @Test
    void defaults_twoDiode_limitsSecondaryIdeality() {
        ParameterBounds bounds = ParameterBounds.defaults(ModelKind.TWO_DIODE);

        assertThat(bounds.covers(ModelKind.TWO_DIODE)).isTrue();
        assertThat(bounds.get(ParameterName.SECONDARY_IDEALITY).lower()).isEqualTo(1.0);
        assertThat(bounds.get(ParameterName.SECONDARY_IDEALITY).upper()).isEqualTo(7.0);
    }

    @Test
    void with_replacesSingleBound_leavesOriginalUntouched() {
        ParameterBounds original = ParameterBounds.defaults(ModelKind.ONE_DIODE);
        ParameterBounds narrowed = original.with(ParameterName.SERIES_RESISTANCE, 0.0, 10.0);

        assertThat(narrowed.get(ParameterName.SERIES_RESISTANCE).upper()).isEqualTo(10.0);
        assertThat(original.get(ParameterName.SERIES_RESISTANCE).upper()).isEqualTo(1000.0);
        assertThat(narrowed).isNotEqualTo(original);
    }

    @Test
    void get_withMissingParameter_throwsException() {
        ParameterBounds bounds = ParameterBounds.defaults(ModelKind.ONE_DIODE);

        assertThatThrownBy(() -> bounds.get(ParameterName.SECONDARY_IDEALITY))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No bound defined");
    }

    @Test
    void bound_withInvertedLimits_throwsException() {
        assertThatThrownBy(() -> new ParameterBounds.Bound(2.0, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bound_clampAndContains() {
        ParameterBounds.Bound bound = new ParameterBounds.Bound(1.0, 2.0);

        assertThat(bound.contains(1.0)).isTrue();
        assertThat(bound.contains(2.5)).isFalse();
        assertThat(bound.clamp(2.5)).isEqualTo(2.0);
        assertThat(bound.clamp(0.5)).isEqualTo(1.0);
    }
}
