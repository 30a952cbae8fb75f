package de.anton.pv.solver.iv_solver.algorithms;

import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.OneDiodeParameters;
import de.anton.pv.solver.iv_solver.model.ParameterName;
import de.anton.pv.solver.iv_solver.model.TwoDiodeParameters;

import java.util.List;

/**
 * Evaluates the implicit one- and two-diode equations
 * <pre>
 *   I = Iph - sum_k I0k (exp((V + I Rs) / (nk Vt)) - 1) - (V + I Rs) / Rsh
 * </pre>
 * by Newton iteration per voltage sample. The residual function is strictly
 * decreasing and concave in I, so Newton started right of the root converges
 * monotonically; the start is the analytic upper bound of the root or the
 * solution of the previous (lower) voltage sample, both right of the root.
 * Steps that leave the analytic bracket of the root are replaced by
 * bisection.
 * <p>
 * Exponent arguments are capped at {@link #DEFAULT_EXPONENT_CAP}. Instances
 * are immutable and thread-safe.
 */
public final class DiodeModelEvaluator {

    public static final double DEFAULT_EXPONENT_CAP = 700.0;
    public static final double RETRY_EXPONENT_CAP = 100.0;

    private static final int MAX_NEWTON_ITERATIONS = 200;
    private static final double RELATIVE_TOLERANCE = 1e-14;
    private static final double SCALE_TOLERANCE = 1e-16;
    private static final double ABSOLUTE_TOLERANCE = 1e-30;

    private final double thermalVoltage;
    private final double exponentCap;

    public DiodeModelEvaluator(double thermalVoltage) {
        this(thermalVoltage, DEFAULT_EXPONENT_CAP);
    }

    public DiodeModelEvaluator(double thermalVoltage, double exponentCap) {
        if (!(thermalVoltage > 0) || !Double.isFinite(thermalVoltage)) {
            throw new IllegalArgumentException("Thermal voltage must be positive: " + thermalVoltage);
        }
        if (!(exponentCap > 0)) {
            throw new IllegalArgumentException("Exponent cap must be positive: " + exponentCap);
        }
        this.thermalVoltage = thermalVoltage;
        this.exponentCap = exponentCap;
    }

    public double getThermalVoltage() {
        return thermalVoltage;
    }

    public double getExponentCap() {
        return exponentCap;
    }

    /** Same evaluator with a different exponent cap. */
    public DiodeModelEvaluator withExponentCap(double cap) {
        return new DiodeModelEvaluator(thermalVoltage, cap);
    }

    /**
     * Modeled current for every voltage sample.
     *
     * @param parameters Device-level parameters.
     * @param voltages   Voltages in V; any order, ascending order is fastest.
     * @return Currents in A (generator convention) and a finiteness flag.
     */
    public ModelEvaluation evaluate(FittedParameters parameters, double[] voltages) {
        Circuit circuit = Circuit.of(parameters, thermalVoltage);
        double[] currents = new double[voltages.length];
        boolean finite = true;
        double previousVoltage = Double.NEGATIVE_INFINITY;
        double previousCurrent = Double.NaN;
        for (int k = 0; k < voltages.length; k++) {
            double v = voltages[k];
            double start = circuit.upperBound(v);
            if (v >= previousVoltage && Double.isFinite(previousCurrent)) {
                start = Math.min(start, previousCurrent);
            }
            double current = solve(circuit, v, start);
            currents[k] = current;
            if (!Double.isFinite(current)) {
                finite = false;
            }
            previousVoltage = v;
            previousCurrent = current;
        }
        return new ModelEvaluation(currents, finite);
    }

    /**
     * Modeled current at a single voltage.
     */
    public double currentAt(FittedParameters parameters, double voltage) {
        Circuit circuit = Circuit.of(parameters, thermalVoltage);
        return solve(circuit, voltage, circuit.upperBound(voltage));
    }

    /**
     * Partial derivatives dI/dp of the solved current at each sample, by the
     * implicit function theorem. Columns follow
     * {@link ParameterName#forModel(ModelKind)}.
     *
     * @param parameters Device-level parameters.
     * @param voltages   Voltages in V.
     * @param currents   Solved currents for those voltages (from {@link #evaluate}).
     * @return Matrix [sample][parameter].
     */
    public double[][] currentSensitivities(FittedParameters parameters, double[] voltages, double[] currents) {
        Circuit c = Circuit.of(parameters, thermalVoltage);
        List<ParameterName> names = ParameterName.forModel(parameters.kind());
        double[][] jacobian = new double[voltages.length][names.size()];
        for (int k = 0; k < voltages.length; k++) {
            double current = currents[k];
            double vj = voltages[k] + current * c.rs;

            double dFdI = -1.0 - c.rs / c.rsh;
            double dFdRs = -current / c.rsh;
            double[] dFdI0 = new double[c.i0.length];
            double[] dFdN = new double[c.i0.length];
            for (int d = 0; d < c.i0.length; d++) {
                double arg = vj / c.a[d];
                boolean capped = arg > exponentCap;
                double e = Math.exp(capped ? exponentCap : arg);
                dFdI0[d] = -(e - 1.0);
                if (!capped) {
                    double slope = c.i0[d] * e / c.a[d];
                    dFdI -= slope * c.rs;
                    dFdRs -= slope * current;
                    dFdN[d] = slope * vj / c.n[d];
                }
            }
            double dFdRsh = vj / (c.rsh * c.rsh);

            double[] row = jacobian[k];
            for (int p = 0; p < names.size(); p++) {
                double dFdp;
                switch (names.get(p)) {
                    case PHOTOCURRENT: dFdp = 1.0; break;
                    case SATURATION_CURRENT: dFdp = dFdI0[0]; break;
                    case IDEALITY: dFdp = dFdN[0]; break;
                    case SECONDARY_SATURATION_CURRENT: dFdp = dFdI0[1]; break;
                    case SECONDARY_IDEALITY: dFdp = dFdN[1]; break;
                    case SERIES_RESISTANCE: dFdp = dFdRs; break;
                    case SHUNT_RESISTANCE: dFdp = dFdRsh; break;
                    default: throw new IllegalStateException("Unhandled parameter " + names.get(p));
                }
                row[p] = -dFdp / dFdI;
            }
        }
        return jacobian;
    }

    /**
     * Residual of the implicit equation, F(I) = RHS - I. Zero at the solution.
     */
    public double implicitResidual(FittedParameters parameters, double voltage, double current) {
        Circuit c = Circuit.of(parameters, thermalVoltage);
        return c.residual(voltage, current, exponentCap);
    }

    private double solve(Circuit c, double voltage, double start) {
        double current = start;
        double tolerance = SCALE_TOLERANCE * (Math.abs(c.iph) + c.sumI0() + Math.abs(voltage) / c.rsh)
                + ABSOLUTE_TOLERANCE;
        // bracket of the root; the capped exponential breaks concavity, so
        // Newton steps leaving the bracket fall back to bisection
        double lo = c.lowerBound(voltage);
        double hi = Math.max(c.upperBound(voltage), current);
        for (int iteration = 0; iteration < MAX_NEWTON_ITERATIONS; iteration++) {
            double vj = voltage + current * c.rs;
            double f = c.iph - vj / c.rsh - current;
            double df = -1.0 - c.rs / c.rsh;
            for (int d = 0; d < c.i0.length; d++) {
                double arg = vj / c.a[d];
                if (arg > exponentCap) {
                    f -= c.i0[d] * (Math.exp(exponentCap) - 1.0);
                } else {
                    double e = Math.exp(arg);
                    f -= c.i0[d] * (e - 1.0);
                    df -= c.i0[d] * e * c.rs / c.a[d];
                }
            }
            if (!Double.isFinite(f) || !Double.isFinite(df)) {
                return Double.NaN;
            }
            if (f == 0.0) {
                return current;
            }
            if (f > 0) {
                lo = current;
            } else {
                hi = current;
            }
            double next = current - f / df;
            if (!(next > lo && next < hi) && Double.isFinite(lo) && Double.isFinite(hi)) {
                next = 0.5 * (lo + hi);
            }
            double step = next - current;
            current = next;
            if (Math.abs(step) <= RELATIVE_TOLERANCE * Math.abs(current) + tolerance) {
                return current;
            }
        }
        return current;
    }

    /** Parameters unpacked into arrays so one- and two-diode share the solver. */
    private static final class Circuit {
        final double iph;
        final double[] i0;
        final double[] n;
        final double[] a; // n * Vt
        final double rs;
        final double rsh;

        private Circuit(double iph, double[] i0, double[] n, double rs, double rsh, double vt) {
            this.iph = iph;
            this.i0 = i0;
            this.n = n;
            this.rs = rs;
            this.rsh = rsh;
            this.a = new double[n.length];
            for (int d = 0; d < n.length; d++) {
                a[d] = n[d] * vt;
            }
        }

        static Circuit of(FittedParameters p, double vt) {
            switch (p.kind()) {
                case ONE_DIODE: {
                    OneDiodeParameters one = (OneDiodeParameters) p;
                    return new Circuit(one.photocurrent(), new double[]{one.saturationCurrent()},
                            new double[]{one.ideality()}, one.seriesResistance(), one.shuntResistance(), vt);
                }
                case TWO_DIODE: {
                    TwoDiodeParameters two = (TwoDiodeParameters) p;
                    return new Circuit(two.photocurrent(),
                            new double[]{two.saturationCurrent1(), two.saturationCurrent2()},
                            new double[]{two.ideality1(), two.ideality2()},
                            two.seriesResistance(), two.shuntResistance(), vt);
                }
                default:
                    throw new IllegalArgumentException("Unknown model kind: " + p.kind());
            }
        }

        /**
         * Upper bound of the root: with every exponential term at least -I0,
         * F(I) <= Iph + sum I0 - V/Rsh - I (1 + Rs/Rsh), which is zero here.
         */
        double upperBound(double voltage) {
            return (iph + sumI0() - voltage / rsh) / (1.0 + rs / rsh);
        }

        /**
         * Lower bound of the root for Rs > 0: where V + I Rs <= 0 every
         * exponential term is at most I0, so F(I) >= Iph - (V + I Rs)/Rsh - I,
         * which is non-negative up to the returned current. Without series
         * resistance F is linear in I and needs no bracket.
         */
        double lowerBound(double voltage) {
            if (!(rs > 0)) {
                return Double.NEGATIVE_INFINITY;
            }
            double linearRoot = (iph - voltage / rsh) / (1.0 + rs / rsh);
            return Math.min(linearRoot, -voltage / rs);
        }

        double sumI0() {
            double sum = 0.0;
            for (double value : i0) sum += value;
            return sum;
        }

        double residual(double voltage, double current, double cap) {
            double vj = voltage + current * rs;
            double f = iph - vj / rsh - current;
            for (int d = 0; d < i0.length; d++) {
                f -= i0[d] * (Math.exp(Math.min(vj / a[d], cap)) - 1.0);
            }
            return f;
        }
    }
}
