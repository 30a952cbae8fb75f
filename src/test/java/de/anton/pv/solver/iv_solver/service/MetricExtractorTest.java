package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.DiodeModelEvaluator;
import de.anton.pv.solver.iv_solver.model.AnalysisMode;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.MppSensitivity;
import de.anton.pv.solver.iv_solver.model.OneDiodeParameters;
import de.anton.pv.solver.iv_solver.model.ParameterName;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MetricExtractor}.
 */
class MetricExtractorTest {

    private static final double PIN = 100.0;

    private final MetricExtractor extractor = new MetricExtractor();
    private final Preconditioner preconditioner = new Preconditioner();
    private final OneDiodeParameters cell = SyntheticCurveGenerator.referenceCell();

    private PreconditionedCurve curve;
    private DiodeModelEvaluator evaluator;

    @BeforeEach
    void setUp() throws Exception {
        curve = preconditioner.precondition(SyntheticCurveGenerator.referenceMeasurement());
        evaluator = new DiodeModelEvaluator(curve.getThermalVoltage());
    }

    @Test
    void extract_referenceMode_matchesKnownFiguresOfMerit() throws Exception {
        DerivedMetrics metrics = extractor.extract(curve, cell, evaluator, AnalysisMode.REFERENCE, PIN);

        assertThat(metrics.shortCircuitCurrentDensity()).isCloseTo(29.9925, within(0.005));
        assertThat(metrics.openCircuitVoltage()).isCloseTo(0.5514, within(0.001));
        assertThat(metrics.fillFactor()).isCloseTo(0.7747, within(0.002));
        assertThat(metrics.efficiencyPercent()).isCloseTo(12.81, within(0.03));
        assertThat(metrics.seriesResistanceOhmCm2()).isEqualTo(0.5);
        assertThat(metrics.shuntResistanceOhmCm2()).isEqualTo(2000.0);
        assertThat(metrics.incidentPowerDensity()).isEqualTo(PIN);
    }

    @Test
    void extract_efficiencyEqualsJscVocFfOverPin() throws Exception {
        DerivedMetrics m = extractor.extract(curve, cell, evaluator, AnalysisMode.REFERENCE, PIN);

        double identity = m.shortCircuitCurrentDensity() * m.openCircuitVoltage() * m.fillFactor() / PIN * 100.0;

        assertThat(m.efficiencyPercent()).isCloseTo(identity, within(1e-9));
        assertThat(m.mppCurrent() * m.mppVoltage()).isCloseTo(m.maxPowerWatts(), within(1e-15));
    }

    @Test
    void extract_explorationMode_agreesWithReferenceMode() throws Exception {
        DerivedMetrics reference = extractor.extract(curve, cell, evaluator, AnalysisMode.REFERENCE, PIN);
        DerivedMetrics exploration = extractor.extract(curve, cell, evaluator, AnalysisMode.EXPLORATION, PIN);

        assertThat(exploration.shortCircuitCurrentDensity())
            .isCloseTo(reference.shortCircuitCurrentDensity(), within(0.01));
        assertThat(exploration.openCircuitVoltage()).isCloseTo(reference.openCircuitVoltage(), within(0.002));
        assertThat(exploration.fillFactor()).isCloseTo(reference.fillFactor(), within(0.005));
    }

    @Test
    void extract_areaScalesDensities() throws Exception {
        PreconditionedCurve big = new PreconditionedCurve("big", "fp", curve.getKind(), curve.getVoltages(),
                curve.getCurrents(), 4.0, curve.getTemperatureK(), 1.0, false, false, false, 0);

        DerivedMetrics metrics = extractor.extract(big, cell, evaluator, AnalysisMode.REFERENCE, PIN);

        assertThat(metrics.shortCircuitCurrentDensity()).isCloseTo(29.9925 / 4.0, within(0.002));
        assertThat(metrics.seriesResistanceOhmCm2()).isEqualTo(2.0);
    }

    @Test
    void extract_withoutZeroVoltage_throwsImplausibility() {
        double[] v = SyntheticCurveGenerator.linspace(0.1, 0.7, 61);
        PreconditionedCurve shifted = new PreconditionedCurve("shifted", "fp", curve.getKind(), v,
                SyntheticCurveGenerator.currents(cell, v, curve.getTemperatureK()), 1.0, curve.getTemperatureK(),
                1.0, false, false, false, 0);

        assertThatThrownBy(() -> extractor.extract(shifted, cell, evaluator, AnalysisMode.EXPLORATION, PIN))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("Short-circuit");
    }

    @Test
    void extract_noPhotocurrent_throwsImplausibility() {
        double[] v = SyntheticCurveGenerator.linspace(-0.2, 0.7, 19);
        double[] i = new double[v.length];
        Arrays.fill(i, -1e-3);
        PreconditionedCurve reverse = new PreconditionedCurve("reverse", "fp", curve.getKind(), v, i, 1.0,
                curve.getTemperatureK(), 1.0, false, false, false, 0);

        assertThatThrownBy(() -> extractor.extract(reverse, cell, evaluator, AnalysisMode.EXPLORATION, PIN))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("photocurrent");
    }

    @Test
    void extract_sweepEndingBeforeVoc_throwsImplausibility() {
        double[] v = SyntheticCurveGenerator.linspace(-0.1, 0.4, 51);
        PreconditionedCurve truncated = new PreconditionedCurve("truncated", "fp", curve.getKind(), v,
                SyntheticCurveGenerator.currents(cell, v, curve.getTemperatureK()), 1.0, curve.getTemperatureK(),
                1.0, false, false, false, 0);

        assertThatThrownBy(() -> extractor.extract(truncated, cell, evaluator, AnalysisMode.EXPLORATION, PIN))
            .isInstanceOf(PhysicalImplausibilityException.class)
            .hasMessageContaining("Open-circuit");
    }

    @Test
    void sensitivityAtMpp_powerDropsWithSeriesResistance() {
        MppSensitivity sensitivity = extractor.sensitivityAtMpp(cell, evaluator, 0.46);

        assertThat(sensitivity.currentSensitivity()).hasSize(5);
        assertThat(sensitivity.currentSensitivity().get(ParameterName.PHOTOCURRENT)).isGreaterThan(0.9);
        assertThat(sensitivity.powerSensitivityToSeriesResistance()).isNegative();
        assertThat(sensitivity.mppCurrent()).isPositive();
    }

    @Test
    void denseGrid_endsExactlyAtUpperVoltage() {
        double[] grid = MetricExtractor.denseGrid(-0.2, 0.7);

        assertThat(grid).hasSize(MetricExtractor.DENSE_GRID_POINTS);
        assertThat(grid[0]).isEqualTo(-0.2);
        assertThat(grid[grid.length - 1]).isEqualTo(0.7);
    }
}
