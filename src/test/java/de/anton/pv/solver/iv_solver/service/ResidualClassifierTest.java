package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.Deadline;
import de.anton.pv.solver.iv_solver.model.Measurement;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import de.anton.pv.solver.iv_solver.model.ResidualAnalysis;
import de.anton.pv.solver.iv_solver.model.ResidualPattern;
import de.anton.pv.solver.iv_solver.model.WarningLevel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ResidualClassifier}.
 */
class ResidualClassifierTest {

    private static final double PEAK = 0.03;

    private final ResidualClassifier classifier = new ResidualClassifier();
    private final double[] v = SyntheticCurveGenerator.linspace(0.0, 0.5, 101);

    @Test
    void classify_alternatingSigns_isRandom() {
        double[] r = new double[v.length];
        for (int k = 0; k < r.length; k++) r[k] = k % 2 == 0 ? 1e-4 : -1e-4;

        ResidualAnalysis analysis = classifier.classify(v, r, PEAK);

        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.RANDOM);
        assertThat(analysis.level()).isEqualTo(WarningLevel.LOW);
        assertThat(analysis.runsZScore()).isPositive();
    }

    @Test
    void classify_negligibleResiduals_isRandomWithFullConfidence() {
        double[] r = new double[v.length];
        for (int k = 0; k < r.length; k++) r[k] = 1e-10 * (v[k] - 0.25);

        ResidualAnalysis analysis = classifier.classify(v, r, PEAK);

        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.RANDOM);
        assertThat(analysis.confidencePercent()).isEqualTo(100.0);
        assertThat(analysis.runsZScore()).isNaN();
    }

    @Test
    void classify_linearResiduals_isLinearTrend() {
        double[] r = new double[v.length];
        for (int k = 0; k < r.length; k++) r[k] = 1e-3 * (v[k] - 0.25);

        ResidualAnalysis analysis = classifier.classify(v, r, PEAK);

        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.LINEAR_TREND);
        assertThat(analysis.level()).isEqualTo(WarningLevel.MEDIUM);
        assertThat(analysis.linearR2()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void classify_centredParabola_isSystematicCurvature() {
        double[] r = new double[v.length];
        for (int k = 0; k < r.length; k++) {
            double t = (v[k] - 0.25) / 0.25;
            r[k] = 1e-3 * (t * t - 1.0 / 3.0);
        }

        ResidualAnalysis analysis = classifier.classify(v, r, PEAK);

        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.SYSTEMATIC_CURVATURE);
        assertThat(analysis.level()).isEqualTo(WarningLevel.HIGH);
        assertThat(analysis.quadraticR2()).isGreaterThan(0.99);
    }

    @Test
    void classify_cubicResidual_isSShaped() {
        double[] r = new double[v.length];
        for (int k = 0; k < r.length; k++) {
            double t = (v[k] - 0.25) / 0.25;
            r[k] = 1e-3 * t * t * t;
        }

        ResidualAnalysis analysis = classifier.classify(v, r, PEAK);

        assertThat(analysis.linearR2()).isGreaterThan(0.8);
        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.S_SHAPED);
        assertThat(analysis.level()).isEqualTo(WarningLevel.CRITICAL);
        assertThat(analysis.message()).contains("inflection");
    }

    @Test
    void classify_smallCubicResidual_isSShapedButOnlyHigh() {
        double[] r = new double[v.length];
        for (int k = 0; k < r.length; k++) {
            double t = (v[k] - 0.25) / 0.25;
            r[k] = 1e-4 * t * t * t;
        }

        ResidualAnalysis analysis = classifier.classify(v, r, PEAK);

        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.S_SHAPED);
        assertThat(analysis.level()).isEqualTo(WarningLevel.HIGH);
    }

    @Test
    void classify_oscillatingResiduals_isSShaped() {
        double[] r = new double[v.length];
        for (int k = 0; k < r.length; k++) r[k] = 1e-3 * Math.sin(2 * Math.PI * 3 * v[k] / 0.5);

        ResidualAnalysis analysis = classifier.classify(v, r, PEAK);

        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.S_SHAPED);
        assertThat(analysis.level()).isEqualTo(WarningLevel.CRITICAL);
        assertThat(analysis.runsZScore()).isLessThan(-1.96);
        assertThat(analysis.message()).contains("S-shaped");
    }

    @Test
    void classify_smallOscillation_isSShapedButOnlyHigh() {
        double[] r = new double[v.length];
        for (int k = 0; k < r.length; k++) r[k] = 1e-4 * Math.sin(2 * Math.PI * 3 * v[k] / 0.5);

        ResidualAnalysis analysis = classifier.classify(v, r, PEAK);

        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.S_SHAPED);
        assertThat(analysis.level()).isEqualTo(WarningLevel.HIGH);
    }

    @Test
    void classify_fitOfCurveWithExtractionBarrier_detectsSShape() throws Exception {
        double[] voltages = SyntheticCurveGenerator.linspace(-0.2, 0.7, 181);
        double[] currents = SyntheticCurveGenerator.currents(SyntheticCurveGenerator.referenceCell(), voltages, 298.15);
        for (int k = 0; k < currents.length; k++) {
            double d = (voltages[k] - 0.45) / 0.03;
            currents[k] -= 0.006 * Math.exp(-0.5 * d * d);
        }
        PreconditionedCurve curve = new Preconditioner().precondition(
                Measurement.illuminated("s-shape", voltages, currents, 1.0));
        ModelConfiguration config = ModelConfiguration.reference(ModelKind.ONE_DIODE);

        CurveFitter.CurveFit fit = new CurveFitter().fit(curve, config, Deadline.none());
        ResidualAnalysis analysis = classifier.classify(voltages, fit.residuals(), curve.peakAbsCurrent());

        assertThat(analysis.pattern()).isEqualTo(ResidualPattern.S_SHAPED);
        assertThat(analysis.level()).isIn(WarningLevel.HIGH, WarningLevel.CRITICAL);
    }
}
