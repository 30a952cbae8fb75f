package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.BudgetExceededException;
import de.anton.pv.solver.iv_solver.algorithms.Deadline;
import de.anton.pv.solver.iv_solver.algorithms.DifferentialEvolution;
import de.anton.pv.solver.iv_solver.algorithms.DiodeModelEvaluator;
import de.anton.pv.solver.iv_solver.algorithms.LevenbergMarquardtRefiner;
import de.anton.pv.solver.iv_solver.algorithms.ModelEvaluation;
import de.anton.pv.solver.iv_solver.algorithms.NonFiniteModelException;
import de.anton.pv.solver.iv_solver.algorithms.ParameterLayout;
import de.anton.pv.solver.iv_solver.algorithms.ResidualStatistics;
import de.anton.pv.solver.iv_solver.model.FittedParameters;
import de.anton.pv.solver.iv_solver.model.ParameterEstimationUtils;
import de.anton.pv.solver.iv_solver.model.PreconditionedCurve;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-stage fit of a diode model to a preconditioned curve: seeded
 * Differential Evolution over the bounded parameter space, then
 * Levenberg-Marquardt refinement of the best candidate.
 */
public class CurveFitter {

    private static final Logger logger = LoggerFactory.getLogger(CurveFitter.class);

    /**
     * A converged fit.
     *
     * @param parameters       refined parameters
     * @param globalCandidate  best candidate of the global stage
     * @param modeled          modeled currents at the curve voltages
     * @param residuals        measured minus modeled
     * @param residualRms      unweighted residual RMS in A
     * @param objective        sum of squared (weighted) residuals
     * @param generations      generations of the global stage
     * @param iterations       refiner iterations
     * @param evaluations      refiner evaluations
     * @param evaluator        evaluator the final curve was computed with
     */
    public record CurveFit(FittedParameters parameters, FittedParameters globalCandidate, double[] modeled,
                           double[] residuals, double residualRms, double objective, int generations,
                           int iterations, int evaluations, DiodeModelEvaluator evaluator) {
    }

    /**
     * Full fit: global stage with the configured budget and seed, population
     * seeded with a heuristic estimate.
     *
     * @throws FitConvergenceException if the refiner does not converge, the budget runs out
     *                                 or the model stays non-finite after the retry.
     */
    public CurveFit fit(PreconditionedCurve curve, ModelConfiguration config, Deadline deadline)
            throws FitConvergenceException {
        FittedParameters estimate = ParameterEstimationUtils.estimate(curve, config.modelKind());
        return run(curve, config, estimate, config.settings().maxGenerations(), config.seed(), deadline);
    }

    /**
     * Warm-started fit used by the noise trials: short global stage whose
     * population contains the given parameters, then the full refiner.
     */
    public CurveFit refit(PreconditionedCurve curve, ModelConfiguration config, FittedParameters warmStart,
                          int generations, long seed, Deadline deadline) throws FitConvergenceException {
        return run(curve, config, warmStart, generations, seed, deadline);
    }

    private CurveFit run(PreconditionedCurve curve, ModelConfiguration config, FittedParameters seedMember,
                         int generations, long seed, Deadline deadline) throws FitConvergenceException {
        double[] voltages = curve.getVoltages();
        double[] measured = curve.getCurrents();
        ParameterLayout layout = ParameterLayout.of(config.modelKind(), curve.getKind().hasPhotocurrent(),
                config.bounds());
        DiodeModelEvaluator evaluator = new DiodeModelEvaluator(curve.getThermalVoltage());
        double[] weights = config.settings().kneeWeighting() ? kneeWeights(voltages, measured) : null;

        List<double[]> initialMembers = new ArrayList<>();
        if (seedMember != null && seedMember.kind() == config.modelKind()) {
            initialMembers.add(layout.toUnit(layout.toSearch(seedMember)));
        }

        DifferentialEvolution globalSearch = new DifferentialEvolution(
                unit -> objective(evaluator, layout.toParameters(layout.fromUnit(unit)), voltages, measured, weights),
                layout.dimension(),
                config.settings().globalSettings(seed, generations),
                initialMembers,
                deadline);

        DifferentialEvolution.Result global;
        try {
            global = globalSearch.run();
        } catch (BudgetExceededException e) {
            throw new FitConvergenceException(e.getMessage(), null, e);
        }
        double[] candidatePoint = layout.fromUnit(global.best());
        FittedParameters candidate = layout.toParameters(candidatePoint);
        logger.debug("Fit: global candidate {} (energy {}, {} generations)", candidate, global.bestEnergy(),
                global.generations());

        LevenbergMarquardtRefiner.Result refined;
        DiodeModelEvaluator finalEvaluator = evaluator;
        try {
            try {
                refined = refine(evaluator, layout, voltages, measured, weights, config, deadline, candidatePoint);
            } catch (NumericalException first) {
                logger.warn("Fit: {} Retrying with exponent cap {}.", first.getMessage(),
                        DiodeModelEvaluator.RETRY_EXPONENT_CAP);
                finalEvaluator = evaluator.withExponentCap(DiodeModelEvaluator.RETRY_EXPONENT_CAP);
                refined = refine(finalEvaluator, layout, voltages, measured, weights, config, deadline,
                        candidatePoint);
            }
        } catch (NumericalException second) {
            throw new FitConvergenceException("Model evaluation stayed non-finite after retry: "
                    + second.getMessage(), candidate, second);
        } catch (MathIllegalStateException | BudgetExceededException e) {
            throw new FitConvergenceException("Local refinement did not converge: " + e.getMessage(), candidate, e);
        }

        ModelEvaluation evaluation = finalEvaluator.evaluate(refined.parameters(), voltages);
        if (!evaluation.finite()) {
            throw new FitConvergenceException("Refined model is not finite.", candidate, null);
        }
        double[] modeled = evaluation.currents();
        double[] residuals = new double[voltages.length];
        for (int k = 0; k < residuals.length; k++) {
            residuals[k] = measured[k] - modeled[k];
        }
        double objective = refined.cost() * refined.cost();
        return new CurveFit(refined.parameters(), candidate, modeled, residuals,
                ResidualStatistics.rms(residuals), objective, global.generations(), refined.iterations(),
                refined.evaluations(), finalEvaluator);
    }

    private LevenbergMarquardtRefiner.Result refine(DiodeModelEvaluator evaluator, ParameterLayout layout,
                                                    double[] voltages, double[] measured, double[] weights,
                                                    ModelConfiguration config, Deadline deadline, double[] start)
            throws NumericalException {
        LevenbergMarquardtRefiner refiner = new LevenbergMarquardtRefiner(evaluator, layout, voltages, measured,
                weights, config.settings().refinerSettings(), deadline);
        try {
            return refiner.refine(start);
        } catch (NonFiniteModelException e) {
            throw new NumericalException(e.getMessage(), e);
        }
    }

    /** Weighted sum of squared residuals, +infinity when the model is not finite. */
    static double objective(DiodeModelEvaluator evaluator, FittedParameters parameters, double[] voltages,
                            double[] measured, double[] weights) {
        ModelEvaluation evaluation = evaluator.evaluate(parameters, voltages);
        if (!evaluation.finite()) {
            return Double.POSITIVE_INFINITY;
        }
        double[] modeled = evaluation.currents();
        double sum = 0.0;
        for (int k = 0; k < voltages.length; k++) {
            double r = measured[k] - modeled[k];
            sum += (weights != null ? weights[k] : 1.0) * r * r;
        }
        return sum;
    }

    /**
     * Weights de-emphasising samples where the curve is steep (the knee near
     * Voc): w = 1 / (1 + |dI/dV| / median |dI/dV|), normalised to mean 1.
     */
    static double[] kneeWeights(double[] voltages, double[] currents) {
        int n = voltages.length;
        double[] slopes = new double[n];
        for (int k = 0; k < n; k++) {
            int lo = Math.max(0, k - 1);
            int hi = Math.min(n - 1, k + 1);
            slopes[k] = Math.abs((currents[hi] - currents[lo]) / (voltages[hi] - voltages[lo]));
        }
        double median = new Median().evaluate(slopes);
        double[] weights = new double[n];
        double sum = 0.0;
        for (int k = 0; k < n; k++) {
            weights[k] = median > 0 ? 1.0 / (1.0 + slopes[k] / median) : 1.0;
            sum += weights[k];
        }
        for (int k = 0; k < n; k++) {
            weights[k] *= n / sum;
        }
        return weights;
    }
}
