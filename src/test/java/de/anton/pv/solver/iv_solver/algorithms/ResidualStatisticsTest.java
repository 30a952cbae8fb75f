package de.anton.pv.solver.iv_solver.algorithms;

import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ResidualStatistics}.
 */
class ResidualStatisticsTest {

    @Test
    void rms_computesRootMeanSquare() {
        assertThat(ResidualStatistics.rms(new double[]{3.0, -4.0})).isCloseTo(Math.sqrt(12.5), within(1e-12));
        assertThat(ResidualStatistics.rms(new double[0])).isNaN();
    }

    @Test
    void runsTestZ_blockSigns_isStronglyNegative() {
        double[] residuals = new double[40];
        for (int i = 0; i < residuals.length; i++) {
            residuals[i] = i < 20 ? 1.0 : -1.0;
        }

        assertThat(ResidualStatistics.runsTestZ(residuals)).isLessThan(-5.0);
    }

    @Test
    void runsTestZ_alternatingSigns_isPositive() {
        double[] residuals = new double[40];
        for (int i = 0; i < residuals.length; i++) {
            residuals[i] = i % 2 == 0 ? 1.0 : -1.0;
        }

        assertThat(ResidualStatistics.runsTestZ(residuals)).isGreaterThan(5.0);
    }

    @Test
    void runsTestZ_singleSign_isNaN() {
        assertThat(ResidualStatistics.runsTestZ(new double[]{1.0, 2.0, 0.0, 3.0})).isNaN();
    }

    @Test
    void trendShare_linearResiduals_areFullyExplainedByLine() {
        double[] x = new double[50];
        double[] residuals = new double[50];
        for (int i = 0; i < x.length; i++) {
            x[i] = 0.01 * i;
            residuals[i] = 1e-3 * (x[i] - 0.1);
        }

        assertThat(ResidualStatistics.trendShare(x, residuals, 1)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void trendShare_whiteNoise_isSmall() {
        MersenneTwister random = new MersenneTwister(1L);
        double[] x = new double[200];
        double[] residuals = new double[200];
        for (int i = 0; i < x.length; i++) {
            x[i] = i;
            residuals[i] = random.nextGaussian();
        }

        assertThat(ResidualStatistics.trendShare(x, residuals, 2)).isLessThan(0.1);
    }

    @Test
    void trendShare_zeroResiduals_isZero() {
        assertThat(ResidualStatistics.trendShare(new double[]{0, 1, 2, 3}, new double[4], 1)).isZero();
    }

    @Test
    void trendShare_withDegreeZero_throwsException() {
        assertThatThrownBy(() -> ResidualStatistics.trendShare(new double[]{0, 1}, new double[]{1, 1}, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void meanAbsAutocorrelation_separatesSmoothFromWhiteResiduals() {
        MersenneTwister random = new MersenneTwister(3L);
        double[] smooth = new double[200];
        double[] white = new double[200];
        for (int i = 0; i < smooth.length; i++) {
            smooth[i] = Math.sin(2 * Math.PI * i / 200.0);
            white[i] = random.nextGaussian();
        }

        assertThat(ResidualStatistics.meanAbsAutocorrelation(smooth)).isGreaterThan(0.8);
        assertThat(ResidualStatistics.meanAbsAutocorrelation(white)).isLessThan(0.2);
    }
}
