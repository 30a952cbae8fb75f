package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.MppSensitivity;
import de.anton.pv.solver.iv_solver.model.OneDiodeParameters;
import de.anton.pv.solver.iv_solver.model.ParameterName;
import de.anton.pv.solver.iv_solver.model.TwoDiodeParameters;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PlausibilityCheck}.
 */
class PlausibilityCheckTest {

    private final PlausibilityCheck check = new PlausibilityCheck();
    private final OneDiodeParameters cell = SyntheticCurveGenerator.referenceCell();

    private static DerivedMetrics metrics(double jsc, double voc, double ff, double pce) {
        return new DerivedMetrics(jsc, voc, ff, pce, 0.0128, 0.46, 0.0278, 0.03, 0.5, 2000.0, 100.0);
    }

    private static MppSensitivity sensitivity(double dPdRs) {
        return new MppSensitivity(0.46, 0.0278, Map.of(ParameterName.SERIES_RESISTANCE, dPdRs / 0.46), dPdRs);
    }

    @Test
    void check_referenceCell_passes() {
        assertThatCode(() -> check.check(cell, metrics(30.0, 0.55, 0.775, 12.8), sensitivity(-0.01)))
            .doesNotThrowAnyException();
    }

    @Test
    void check_darkCurveWithoutMetrics_onlyChecksParameters() {
        OneDiodeParameters dark = new OneDiodeParameters(0.0, 1e-10, 1.1, 0.5, 2000.0);

        assertThatCode(() -> check.check(dark, null, null)).doesNotThrowAnyException();
    }

    @Test
    void check_idealityOutsideTable_throwsImplausibility() {
        OneDiodeParameters p = new OneDiodeParameters(0.03, 1e-6, 2.6, 0.5, 2000.0);

        assertThatThrownBy(() -> check.check(p, null, null))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("Ideality factor");
    }

    @Test
    void check_negativeSeriesResistance_throwsImplausibility() {
        OneDiodeParameters p = new OneDiodeParameters(0.03, 1e-10, 1.1, -0.1, 2000.0);

        assertThatThrownBy(() -> check.check(p, null, null))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("series resistance");
    }

    @Test
    void check_secondaryIdealityOutsideTable_throwsImplausibility() {
        TwoDiodeParameters p = new TwoDiodeParameters(0.03, 1e-11, 1.0, 1e-8, 0.9, 0.5, 2000.0);

        assertThatThrownBy(() -> check.check(p, null, null))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("Secondary ideality");
    }

    @Test
    void check_fillFactorAboveLimit_throwsImplausibility() {
        assertThatThrownBy(() -> check.check(cell, metrics(30.0, 0.55, 0.96, 12.8), null))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("Fill factor");
    }

    @Test
    void check_nonPositiveVoc_throwsImplausibility() {
        assertThatThrownBy(() -> check.check(cell, metrics(30.0, 0.0, 0.7, 12.8), null))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("Voc");
    }

    @Test
    void check_nonFiniteMetrics_throwsImplausibility() {
        assertThatThrownBy(() -> check.check(cell, metrics(Double.NaN, 0.55, 0.7, 12.8), null))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("not finite");
    }

    @Test
    void check_powerRisingWithSeriesResistance_throwsImplausibility() {
        assertThatThrownBy(() -> check.check(cell, metrics(30.0, 0.55, 0.775, 12.8), sensitivity(0.002)))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("dP/dRs");
    }
}
