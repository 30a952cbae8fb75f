package de.anton.pv.solver.iv_solver.algorithms;

import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.OneDiodeParameters;
import de.anton.pv.solver.iv_solver.model.ParameterBounds;
import de.anton.pv.solver.iv_solver.model.PhysicalConstants;
import de.anton.pv.solver.iv_solver.service.SyntheticCurveGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LevenbergMarquardtRefiner}.
 */
class LevenbergMarquardtRefinerTest {

    private static final double T = PhysicalConstants.STC_TEMPERATURE_K;
    private static final LevenbergMarquardtRefiner.Settings SETTINGS =
            new LevenbergMarquardtRefiner.Settings(1e-12, 1e-12, 1e-12, 5000, 1000);

    private final DiodeModelEvaluator evaluator = new DiodeModelEvaluator(PhysicalConstants.thermalVoltage(T));
    private final ParameterLayout layout =
            ParameterLayout.of(ModelKind.ONE_DIODE, true, ParameterBounds.defaults(ModelKind.ONE_DIODE));
    private final OneDiodeParameters truth = SyntheticCurveGenerator.referenceCell();
    private final double[] voltages = SyntheticCurveGenerator.linspace(-0.2, 0.7, 91);
    private final double[] measured = SyntheticCurveGenerator.currents(truth, voltages, T);

    @Test
    void refine_fromNearbyStart_recoversExactParameters() {
        OneDiodeParameters start = new OneDiodeParameters(0.0295, 3e-10, 1.15, 0.4, 2500.0);
        LevenbergMarquardtRefiner refiner = new LevenbergMarquardtRefiner(evaluator, layout, voltages, measured,
                null, SETTINGS, Deadline.none());

        LevenbergMarquardtRefiner.Result result = refiner.refine(layout.toSearch(start));

        assertThat(result.rms()).isLessThan(1e-7);
        assertThat(result.parameters().photocurrent()).isCloseTo(0.03, within(3e-5));
        assertThat(result.parameters().primaryIdeality()).isCloseTo(1.1, within(0.011));
        assertThat(result.parameters().seriesResistance()).isCloseTo(0.5, within(0.005));
        assertThat(result.parameters().shuntResistance()).isCloseTo(2000.0, within(20.0));
        assertThat(result.iterations()).isPositive();
    }

    @Test
    void refine_resultStaysInsideBounds() {
        OneDiodeParameters start = new OneDiodeParameters(0.03, 1e-10, 1.1, 0.0, 2000.0);
        LevenbergMarquardtRefiner refiner = new LevenbergMarquardtRefiner(evaluator, layout, voltages, measured,
                null, SETTINGS, Deadline.none());

        double[] point = refiner.refine(layout.toSearch(start)).point();

        double[] lower = layout.getLowerBounds();
        double[] upper = layout.getUpperBounds();
        for (int k = 0; k < point.length; k++) {
            assertThat(point[k]).isBetween(lower[k], upper[k]);
        }
    }

    @Test
    void constructor_withMismatchedWeights_throwsException() {
        assertThatThrownBy(() -> new LevenbergMarquardtRefiner(evaluator, layout, voltages, measured,
                new double[3], SETTINGS, Deadline.none()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Weight array");
    }

    @Test
    void settings_withZeroBudget_throwsException() {
        assertThatThrownBy(() -> new LevenbergMarquardtRefiner.Settings(1e-10, 1e-10, 1e-10, 0, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("budgets");
    }
}
