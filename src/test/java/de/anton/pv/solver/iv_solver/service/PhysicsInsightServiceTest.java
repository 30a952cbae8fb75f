package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.FitErrorKind;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.FitStatus;
import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.LightDarkComparison;
import de.anton.pv.solver.iv_solver.model.MeasurementKind;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.OneDiodeParameters;
import de.anton.pv.solver.iv_solver.model.PhysicalConstants;
import de.anton.pv.solver.iv_solver.model.PhysicsInsight;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import de.anton.pv.solver.iv_solver.model.RecombinationMechanism;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PhysicsInsightService}.
 */
class PhysicsInsightServiceTest {

    private static final double VT = PhysicalConstants.thermalVoltage(PhysicalConstants.STC_TEMPERATURE_K);

    private final PhysicsInsightService service = new PhysicsInsightService();
    private PreconditionedCurve curve;

    @BeforeEach
    void setUp() throws Exception {
        curve = new Preconditioner().precondition(SyntheticCurveGenerator.referenceMeasurement());
    }

    private static FitResult valid(MeasurementKind kind, FittedParameters parameters, DerivedMetrics metrics) {
        return FitResult.builder()
                .status(FitStatus.VALID)
                .modelKind(ModelKind.ONE_DIODE)
                .measurementKind(kind)
                .parameters(parameters)
                .metrics(metrics)
                .build();
    }

    private static DerivedMetrics metricsWithFillFactor(double ff) {
        return new DerivedMetrics(29.99, 0.5514, ff, 12.81, 0.01281, 0.46, 0.02785, 0.02999, 0.5, 2000.0, 100.0);
    }

    @Test
    void empiricalFillFactor_referenceCell_matchesClosedForm() {
        assertThat(PhysicsInsightService.empiricalFillFactor(0.5514, 1.1, VT)).isCloseTo(0.8046, within(1e-4));
        assertThat(PhysicsInsightService.empiricalFillFactor(0.6, 1.0, 0.025)).isCloseTo(0.8317, within(1e-4));
    }

    @Test
    void empiricalFillFactor_nonPositiveVoc_isNaN() {
        assertThat(PhysicsInsightService.empiricalFillFactor(0.0, 1.1, VT)).isNaN();
    }

    @Test
    void insight_referenceCell_isRadiativeAndPlausible() {
        FitResult result = valid(MeasurementKind.ILLUMINATED, SyntheticCurveGenerator.referenceCell(),
                metricsWithFillFactor(0.7747));

        PhysicsInsight insight = service.insight(result, curve);

        assertThat(insight.mechanism()).isEqualTo(RecombinationMechanism.RADIATIVE);
        assertThat(insight.idealityFromSlope()).isPositive();
        assertThat(insight.idealFillFactor()).isCloseTo(0.8046, within(1e-3));
        assertThat(insight.fillFactorPlausible()).isTrue();
    }

    @Test
    void insight_fillFactorFarAboveEmpirical_isImplausible() {
        FitResult result = valid(MeasurementKind.ILLUMINATED, SyntheticCurveGenerator.referenceCell(),
                metricsWithFillFactor(0.90));

        assertThat(service.insight(result, curve).fillFactorPlausible()).isFalse();
    }

    @Test
    void insight_withoutParameters_throwsException() {
        FitResult failed = FitResult.builder().error(FitErrorKind.CONVERGENCE, "budget").build();

        assertThatThrownBy(() -> service.insight(failed, curve))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("parameters");
    }

    @Test
    void compare_lightAndDark_reportsIdealityDifference() {
        FitResult light = valid(MeasurementKind.ILLUMINATED, new OneDiodeParameters(0.03, 1e-9, 1.4, 0.5, 2000.0),
                null);
        FitResult dark = valid(MeasurementKind.DARK, new OneDiodeParameters(0.0, 1e-10, 1.1, 0.4, 5000.0), null);

        LightDarkComparison comparison = service.compare(light, dark);

        assertThat(comparison.deltaIdeality()).isCloseTo(0.3, within(1e-12));
        assertThat(comparison.seriesResistanceDark()).isEqualTo(0.4);
        assertThat(comparison.shuntResistanceLight()).isEqualTo(2000.0);
    }

    @Test
    void compare_swappedKinds_throwsException() {
        FitResult light = valid(MeasurementKind.ILLUMINATED, SyntheticCurveGenerator.referenceCell(), null);

        assertThatThrownBy(() -> service.compare(light, light))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dark");
    }

    @Test
    void compare_invalidResult_throwsException() {
        FitResult light = valid(MeasurementKind.ILLUMINATED, SyntheticCurveGenerator.referenceCell(), null);
        FitResult failed = FitResult.builder().error(FitErrorKind.NUMERICAL, "overflow").build();

        assertThatThrownBy(() -> service.compare(light, failed))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("two valid fits");
    }
}
