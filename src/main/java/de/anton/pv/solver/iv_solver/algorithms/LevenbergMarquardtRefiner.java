package de.anton.pv.solver.iv_solver.algorithms;

import de.anton.pv.solver.iv_solver.model.FittedParameters;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Local least-squares refinement of a global-search candidate with the
 * Commons Math Levenberg-Marquardt optimizer. Works in search coordinates of
 * a {@link ParameterLayout}; the parameter validator clamps every trial
 * point into the bounds. The Jacobian is analytic
 * ({@link DiodeModelEvaluator#currentSensitivities}).
 * <p>
 * Budget overruns surface as the Commons Math exceptions
 * ({@code TooManyEvaluationsException}, {@code TooManyIterationsException},
 * {@code ConvergenceException}) or as {@link BudgetExceededException};
 * an unsolvable model surfaces as {@link NonFiniteModelException}.
 */
public class LevenbergMarquardtRefiner {

    private static final Logger logger = LoggerFactory.getLogger(LevenbergMarquardtRefiner.class);

    /**
     * @param costRelativeTolerance      relative change of the objective
     * @param parameterRelativeTolerance relative step size
     * @param orthoTolerance             gradient (orthogonality) tolerance
     * @param maxEvaluations             evaluation budget
     * @param maxIterations              iteration budget
     */
    public record Settings(double costRelativeTolerance, double parameterRelativeTolerance, double orthoTolerance,
                           int maxEvaluations, int maxIterations) {
        public Settings {
            if (!(costRelativeTolerance > 0) || !(parameterRelativeTolerance > 0) || !(orthoTolerance > 0)) {
                throw new IllegalArgumentException("Refiner tolerances must be positive.");
            }
            if (maxEvaluations <= 0 || maxIterations <= 0) {
                throw new IllegalArgumentException("Refiner budgets must be positive.");
            }
        }
    }

    /**
     * @param point       refined search-space point
     * @param parameters  refined device-level parameters
     * @param cost        sqrt of the weighted sum of squared residuals
     * @param rms         weighted RMS of the residuals
     * @param iterations  optimizer iterations
     * @param evaluations model evaluations
     */
    public record Result(double[] point, FittedParameters parameters, double cost, double rms, int iterations,
                         int evaluations) {
    }

    private final DiodeModelEvaluator evaluator;
    private final ParameterLayout layout;
    private final double[] voltages;
    private final double[] measured;
    private final double[] weights;
    private final Settings settings;
    private final Deadline deadline;

    /**
     * @param evaluator diode model
     * @param layout    parameter layout
     * @param voltages  sample voltages, ascending
     * @param measured  measured currents (generator convention)
     * @param weights   per-sample weights, null for uniform weights
     * @param settings  tolerances and budgets
     * @param deadline  wall-clock budget
     */
    public LevenbergMarquardtRefiner(DiodeModelEvaluator evaluator, ParameterLayout layout, double[] voltages,
                                     double[] measured, double[] weights, Settings settings, Deadline deadline) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.voltages = Objects.requireNonNull(voltages, "voltages").clone();
        this.measured = Objects.requireNonNull(measured, "measured").clone();
        if (voltages.length != measured.length) {
            throw new IllegalArgumentException("Voltage and current arrays differ in length.");
        }
        if (weights != null && weights.length != voltages.length) {
            throw new IllegalArgumentException("Weight array length does not match the sample count.");
        }
        this.weights = weights != null ? weights.clone() : null;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.deadline = deadline != null ? deadline : Deadline.none();
    }

    /**
     * Refines a starting point.
     *
     * @param start Search-space start point (clamped into the bounds).
     * @return The refined point.
     */
    public Result refine(double[] start) {
        double[] initial = layout.clamp(start);

        LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
                withCostRelativeTolerance(settings.costRelativeTolerance()).
                withParameterRelativeTolerance(settings.parameterRelativeTolerance()).
                withOrthoTolerance(settings.orthoTolerance());

        LeastSquaresBuilder builder = new LeastSquaresBuilder().
                start(initial).
                target(measured).
                model(new DiodeJacobianFunction()).
                parameterValidator(new BoundsValidator()).
                lazyEvaluation(false).
                maxEvaluations(settings.maxEvaluations()).
                maxIterations(settings.maxIterations());
        if (weights != null) {
            builder.weight(new DiagonalMatrix(weights));
        }
        LeastSquaresProblem problem = builder.build();

        logger.debug("Starting LM refinement from {}", (Object) initial);
        LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
        double[] point = layout.clamp(optimum.getPoint().toArray());
        logger.debug("LM finished: iterations={}, evaluations={}, rms={}",
                optimum.getIterations(), optimum.getEvaluations(), optimum.getRMS());
        return new Result(point, layout.toParameters(point), optimum.getCost(), optimum.getRMS(),
                optimum.getIterations(), optimum.getEvaluations());
    }

    private final class DiodeJacobianFunction implements MultivariateJacobianFunction {
        @Override
        public Pair<RealVector, RealMatrix> value(RealVector point) {
            deadline.check("local refinement");
            FittedParameters parameters = layout.toParameters(point.toArray());
            ModelEvaluation evaluation = evaluator.evaluate(parameters, voltages);
            if (!evaluation.finite()) {
                throw new NonFiniteModelException("Model not finite at " + parameters);
            }
            double[][] physical = evaluator.currentSensitivities(parameters, voltages, evaluation.currents());
            double[][] jacobian = layout.toSearchJacobian(physical, parameters);
            for (double[] row : jacobian) {
                for (double entry : row) {
                    if (!Double.isFinite(entry)) {
                        throw new NonFiniteModelException("Jacobian not finite at " + parameters);
                    }
                }
            }
            return new Pair<>(new ArrayRealVector(evaluation.currents(), false),
                    new Array2DRowRealMatrix(jacobian, false));
        }
    }

    private final class BoundsValidator implements ParameterValidator {
        @Override
        public RealVector validate(RealVector params) {
            return new ArrayRealVector(layout.clamp(params.toArray()), false);
        }
    }
}
