package de.anton.pv.solver.iv_solver.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CurrentUnit}.
 */
class CurrentUnitTest {

    @Test
    void toAmpereFactor_forDensity_usesArea() {
        assertThat(CurrentUnit.MILLIAMPERE_PER_CM2.toAmpereFactor(4.0)).isCloseTo(4e-3, within(1e-15));
        assertThat(CurrentUnit.MILLIAMPERE.toAmpereFactor(4.0)).isCloseTo(1e-3, within(1e-15));
    }

    @Test
    void fromDisplayName_acceptsMicroSign() {
        assertThat(CurrentUnit.fromDisplayName("µA")).isEqualTo(CurrentUnit.MICROAMPERE);
        assertThat(CurrentUnit.fromDisplayName(" ma/CM2 ")).isEqualTo(CurrentUnit.MILLIAMPERE_PER_CM2);
        assertThat(CurrentUnit.fromDisplayName("volt")).isNull();
        assertThat(CurrentUnit.fromDisplayName(null)).isNull();
    }
}
