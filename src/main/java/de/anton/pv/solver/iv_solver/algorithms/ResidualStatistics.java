package de.anton.pv.solver.iv_solver.algorithms;

import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statistics on fit residuals: RMS, Wald-Wolfowitz runs test, polynomial
 * trend strength and autocorrelation.
 */
public final class ResidualStatistics {

    private static final Logger logger = LoggerFactory.getLogger(ResidualStatistics.class);
    private static final int AUTOCORRELATION_LAGS = 4;

    private ResidualStatistics() { throw new IllegalStateException("Utility class"); }

    public static double rms(double[] residuals) {
        if (residuals.length == 0) return Double.NaN;
        double sum = 0.0;
        for (double r : residuals) sum += r * r;
        return Math.sqrt(sum / residuals.length);
    }

    /**
     * z-score of the number of sign runs against its expectation for
     * independent signs. Strongly negative values mean too few runs, i.e.
     * structured residuals. Exact zeros are skipped.
     *
     * @return The z-score, NaN when either sign occurs fewer than two times.
     */
    public static double runsTestZ(double[] residuals) {
        int positives = 0;
        int negatives = 0;
        int runs = 0;
        int lastSign = 0;
        for (double r : residuals) {
            int sign = r > 0 ? 1 : (r < 0 ? -1 : 0);
            if (sign == 0) continue;
            if (sign > 0) positives++; else negatives++;
            if (sign != lastSign) runs++;
            lastSign = sign;
        }
        if (positives < 2 || negatives < 2) {
            return Double.NaN;
        }
        double n = positives + negatives;
        double expected = 2.0 * positives * negatives / n + 1.0;
        double variance = (expected - 1.0) * (expected - 2.0) / (n - 1.0);
        if (!(variance > 0)) {
            return Double.NaN;
        }
        return (runs - expected) / Math.sqrt(variance);
    }

    /**
     * Share of the residual energy (sum of squares about zero) explained by a
     * polynomial in x of the given degree, intercept included.
     *
     * @param x         abscissa, at least degree + 2 distinct values
     * @param residuals residuals
     * @param degree    polynomial degree, 1 or more
     * @return Value in [0, 1]; 0 when the residuals vanish or the fit is singular.
     */
    public static double trendShare(double[] x, double[] residuals, int degree) {
        if (degree < 1) throw new IllegalArgumentException("Degree must be at least 1.");
        double energy = 0.0;
        for (double r : residuals) energy += r * r;
        if (!(energy > 0) || residuals.length < degree + 2) {
            return 0.0;
        }
        // centre and scale the abscissa to keep the normal equations well conditioned
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : x) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double mid = 0.5 * (max + min);
        double half = 0.5 * (max - min);
        if (!(half > 0)) return 0.0;

        double[][] design = new double[x.length][degree];
        for (int i = 0; i < x.length; i++) {
            double t = (x[i] - mid) / half;
            double power = 1.0;
            for (int d = 0; d < degree; d++) {
                power *= t;
                design[i][d] = power;
            }
        }
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            regression.newSampleData(residuals.clone(), design);
            double remaining = regression.calculateResidualSumOfSquares();
            return Math.max(0.0, Math.min(1.0, 1.0 - remaining / energy));
        } catch (SingularMatrixException e) {
            logger.debug("Trend fit of degree {} singular, treating as no trend.", degree);
            return 0.0;
        }
    }

    /**
     * Mean absolute normalised autocorrelation over lags 1..4, in [0, 1].
     * Close to 0 for white residuals, close to 1 for smooth structured ones.
     */
    public static double meanAbsAutocorrelation(double[] residuals) {
        double mean = 0.0;
        for (double r : residuals) mean += r;
        mean /= residuals.length;
        double denominator = 0.0;
        for (double r : residuals) denominator += (r - mean) * (r - mean);
        if (!(denominator > 0)) return 0.0;

        int lags = Math.min(AUTOCORRELATION_LAGS, residuals.length - 1);
        if (lags < 1) return 0.0;
        double sum = 0.0;
        for (int lag = 1; lag <= lags; lag++) {
            double numerator = 0.0;
            for (int i = 0; i + lag < residuals.length; i++) {
                numerator += (residuals[i] - mean) * (residuals[i + lag] - mean);
            }
            sum += Math.abs(numerator / denominator);
        }
        return Math.min(1.0, sum / lags);
    }
}
