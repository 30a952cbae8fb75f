package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.Deadline;
import de.anton.pv.solver.iv_solver.model.AnalysisMode;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.NoiseStability;
import de.anton.pv.solver.iv_solver.model.OneDiodeParameters;
import de.anton.pv.solver.iv_solver.model.ParameterDrift;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NoiseStabilityAnalyzer}.
 */
class NoiseStabilityAnalyzerTest {

    private static final CurveFitter FITTER = new CurveFitter();
    private static final MetricExtractor EXTRACTOR = new MetricExtractor();

    private static PreconditionedCurve curve;
    private static CurveFitter.CurveFit cleanFit;
    private static DerivedMetrics cleanMetrics;

    private final NoiseStabilityAnalyzer analyzer = new NoiseStabilityAnalyzer(FITTER, EXTRACTOR);

    @BeforeAll
    static void fitCleanCurve() throws Exception {
        curve = new Preconditioner().precondition(SyntheticCurveGenerator.referenceMeasurement());
        ModelConfiguration config = ModelConfiguration.reference(ModelKind.ONE_DIODE);
        cleanFit = FITTER.fit(curve, config, Deadline.none());
        cleanMetrics = EXTRACTOR.extract(curve, cleanFit.parameters(), cleanFit.evaluator(), AnalysisMode.REFERENCE,
                config.settings().incidentPowerDensity());
    }

    private static ModelConfiguration configWithTrials(int trials) {
        ModelConfiguration config = ModelConfiguration.reference(ModelKind.ONE_DIODE);
        return config.withSettings(config.settings().withNoiseTrials(trials));
    }

    @Test
    void assess_referenceCellAtOnePercentNoise_judgesEveryParameterDrift() {
        NoiseStability stability = analyzer.assess(curve, cleanFit.parameters(), cleanMetrics, configWithTrials(20),
                Deadline.none());

        assertThat(stability.requestedTrials()).isEqualTo(20);
        assertThat(stability.successfulTrials()).isEqualTo(20);
        assertThat(stability.complete()).isTrue();
        assertThat(stability.drifts()).extracting(ParameterDrift::quantity)
            .containsExactly("Jsc", "Voc", "FF", "PCE", "Iph", "I0", "n", "Rs", "Rsh");
        for (ParameterDrift drift : stability.drifts().subList(0, 4)) {
            assertThat(drift.maxDrift()).as(drift.quantity()).isLessThanOrEqualTo(0.02);
        }

        double meanMax = stability.drifts().stream().mapToDouble(ParameterDrift::maxDrift).average().orElseThrow();
        assertThat(stability.score()).isCloseTo(Math.max(0.0, Math.min(100.0, 100.0 * (1.0 - 10.0 * meanMax))),
            within(1e-9));
        assertThat(stability.stable()).isEqualTo(stability.worstDrift() <= 0.02);
    }

    @Test
    void assess_withSameSeed_isReproducible() {
        NoiseStability first = analyzer.assess(curve, cleanFit.parameters(), cleanMetrics, configWithTrials(4),
                Deadline.none());
        NoiseStability second = analyzer.assess(curve, cleanFit.parameters(), cleanMetrics, configWithTrials(4),
                Deadline.none());

        assertThat(second.drifts()).isEqualTo(first.drifts());
        assertThat(second.score()).isEqualTo(first.score());
    }

    @Test
    void assess_withoutTrials_returnsNull() {
        assertThat(analyzer.assess(curve, cleanFit.parameters(), cleanMetrics, configWithTrials(0), Deadline.none()))
            .isNull();
    }

    @Test
    void assess_afterDeadline_isIncompleteAndUnstable() throws InterruptedException {
        Deadline deadline = Deadline.after(Duration.ofNanos(1));
        Thread.sleep(5);

        NoiseStability stability = analyzer.assess(curve, cleanFit.parameters(), cleanMetrics, configWithTrials(3),
                deadline);

        assertThat(stability.complete()).isFalse();
        assertThat(stability.successfulTrials()).isZero();
        assertThat(stability.stable()).isFalse();
        assertThat(stability.score()).isZero();
    }

    @Test
    void quantities_darkCurve_omitsPhotocurrentAndMetrics() {
        OneDiodeParameters dark = new OneDiodeParameters(0.0, 1e-10, 1.1, 0.5, 2000.0);

        Map<String, Double> values = NoiseStabilityAnalyzer.quantities(dark, null);

        assertThat(values).containsOnlyKeys("I0", "n", "Rs", "Rsh");
    }

    @Test
    void isStable_parameterDriftBeyondTwiceNoise_isUnstable() {
        List<ParameterDrift> drifts = List.of(
            new ParameterDrift("Jsc", 30.0, 0.002, 0.001, 0.005),
            new ParameterDrift("FF", 0.77, 0.003, 0.001, 0.006),
            new ParameterDrift("n", 1.1, 0.015, 0.008, 0.038));

        assertThat(NoiseStabilityAnalyzer.isStable(drifts, 0.01, 50, 50)).isFalse();
        assertThat(NoiseStabilityAnalyzer.isStable(drifts.subList(0, 2), 0.01, 50, 50)).isTrue();
    }

    @Test
    void isStable_failedTrial_isUnstable() {
        List<ParameterDrift> drifts = List.of(new ParameterDrift("Jsc", 30.0, 0.002, 0.001, 0.005));

        assertThat(NoiseStabilityAnalyzer.isStable(drifts, 0.01, 49, 50)).isFalse();
        assertThat(NoiseStabilityAnalyzer.isStable(drifts, 0.01, 0, 0)).isFalse();
    }

    @Test
    void score_averagesMaxDriftOfAllQuantities() {
        List<ParameterDrift> drifts = List.of(
            new ParameterDrift("Jsc", 30.0, 0.0, 0.0, 0.01),
            new ParameterDrift("I0", 1e-10, 0.02, 0.01, 0.05));

        assertThat(NoiseStabilityAnalyzer.score(drifts, 1.0)).isCloseTo(70.0, within(1e-9));
        assertThat(NoiseStabilityAnalyzer.score(drifts, 0.5)).isCloseTo(35.0, within(1e-9));
        assertThat(NoiseStabilityAnalyzer.score(List.of(new ParameterDrift("I0", 1e-10, 0.5, 0.2, 1.06)), 1.0))
            .isZero();
        assertThat(NoiseStabilityAnalyzer.score(List.of(), 1.0)).isZero();
    }
}
