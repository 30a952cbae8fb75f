package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.algorithms.DifferentialEvolution;
import de.anton.pv.solver.iv_solver.algorithms.LevenbergMarquardtRefiner;
import de.anton.pv.solver.iv_solver.model.PhysicalConstants;

import java.time.Duration;
import java.util.Objects;

/**
 * Budgets and tolerances of the fit and the diagnostics.
 * Use {@link #reference()} or {@link #exploration()} and the {@code with...}
 * methods for overrides.
 */
public record SolverSettings(
    int populationMultiplier,     // DE population per dimension
    int maxGenerations,           // DE generation budget
    double globalTolerance,       // DE relative spread of energies
    double mutationMin,           // dithered differential weight
    double mutationMax,
    double recombination,         // DE crossover probability
    double costTolerance,         // LM relative objective change
    double stepTolerance,         // LM relative step size
    double gradientTolerance,     // LM orthogonality
    int maxEvaluations,           // LM evaluation budget
    int maxIterations,            // LM iteration budget
    int noiseTrials,              // 0 disables the noise stability check
    double noiseLevel,            // relative Gaussian noise per sample
    int noiseTrialGenerations,    // DE budget of each noise trial
    double boundaryMargin,        // relative safety margin of the boundary check
    double incidentPowerDensity,  // mW/cm2
    boolean kneeWeighting,        // de-emphasise the steep knee region in the objective
    boolean parallelEvaluation,   // allowed in EXPLORATION only
    Duration timeBudget           // wall clock per analysis, zero = unbounded
) {

    public SolverSettings {
        Objects.requireNonNull(timeBudget, "Time budget cannot be null (use Duration.ZERO).");
        if (noiseTrials < 0) throw new IllegalArgumentException("Noise trial count cannot be negative.");
        if (!(noiseLevel > 0) || noiseLevel >= 1) throw new IllegalArgumentException("Noise level must be within (0, 1).");
        if (noiseTrialGenerations < 0) throw new IllegalArgumentException("Noise trial generations cannot be negative.");
        if (!(boundaryMargin >= 0) || boundaryMargin >= 1) throw new IllegalArgumentException("Boundary margin must be within [0, 1).");
        if (!(incidentPowerDensity > 0)) throw new IllegalArgumentException("Incident power density must be positive.");
        // remaining ranges are checked by the optimizer settings
        new DifferentialEvolution.Settings(populationMultiplier, maxGenerations, globalTolerance,
                mutationMin, mutationMax, recombination, 0L, parallelEvaluation);
        new LevenbergMarquardtRefiner.Settings(costTolerance, stepTolerance, gradientTolerance,
                maxEvaluations, maxIterations);
    }

    public static SolverSettings reference() {
        return new SolverSettings(15, 1000, 0.01, 0.5, 1.0, 0.7,
                1e-10, 1e-10, 1e-10, 10000, 1000,
                50, 0.01, 30, 0.10, PhysicalConstants.STC_IRRADIANCE_MW_PER_CM2,
                false, false, Duration.ofMinutes(5));
    }

    public static SolverSettings exploration() {
        return new SolverSettings(5, 100, 0.05, 0.5, 1.0, 0.7,
                1e-8, 1e-8, 1e-8, 5000, 500,
                20, 0.01, 15, 0.10, PhysicalConstants.STC_IRRADIANCE_MW_PER_CM2,
                false, true, Duration.ofMinutes(1));
    }

    /** Differential Evolution settings with the given seed. */
    public DifferentialEvolution.Settings globalSettings(long seed) {
        return globalSettings(seed, maxGenerations);
    }

    public DifferentialEvolution.Settings globalSettings(long seed, int generations) {
        return new DifferentialEvolution.Settings(populationMultiplier, generations, globalTolerance,
                mutationMin, mutationMax, recombination, seed, parallelEvaluation);
    }

    public LevenbergMarquardtRefiner.Settings refinerSettings() {
        return new LevenbergMarquardtRefiner.Settings(costTolerance, stepTolerance, gradientTolerance,
                maxEvaluations, maxIterations);
    }

    public SolverSettings withNoiseTrials(int trials) {
        return new SolverSettings(populationMultiplier, maxGenerations, globalTolerance, mutationMin, mutationMax,
                recombination, costTolerance, stepTolerance, gradientTolerance, maxEvaluations, maxIterations,
                trials, noiseLevel, noiseTrialGenerations, boundaryMargin, incidentPowerDensity, kneeWeighting,
                parallelEvaluation, timeBudget);
    }

    public SolverSettings withNoiseLevel(double level) {
        return new SolverSettings(populationMultiplier, maxGenerations, globalTolerance, mutationMin, mutationMax,
                recombination, costTolerance, stepTolerance, gradientTolerance, maxEvaluations, maxIterations,
                noiseTrials, level, noiseTrialGenerations, boundaryMargin, incidentPowerDensity, kneeWeighting,
                parallelEvaluation, timeBudget);
    }

    public SolverSettings withMaxGenerations(int generations) {
        return new SolverSettings(populationMultiplier, generations, globalTolerance, mutationMin, mutationMax,
                recombination, costTolerance, stepTolerance, gradientTolerance, maxEvaluations, maxIterations,
                noiseTrials, noiseLevel, noiseTrialGenerations, boundaryMargin, incidentPowerDensity, kneeWeighting,
                parallelEvaluation, timeBudget);
    }

    public SolverSettings withRefinerBudget(int evaluations, int iterations) {
        return new SolverSettings(populationMultiplier, maxGenerations, globalTolerance, mutationMin, mutationMax,
                recombination, costTolerance, stepTolerance, gradientTolerance, evaluations, iterations,
                noiseTrials, noiseLevel, noiseTrialGenerations, boundaryMargin, incidentPowerDensity, kneeWeighting,
                parallelEvaluation, timeBudget);
    }

    public SolverSettings withIncidentPowerDensity(double milliwattPerCm2) {
        return new SolverSettings(populationMultiplier, maxGenerations, globalTolerance, mutationMin, mutationMax,
                recombination, costTolerance, stepTolerance, gradientTolerance, maxEvaluations, maxIterations,
                noiseTrials, noiseLevel, noiseTrialGenerations, boundaryMargin, milliwattPerCm2, kneeWeighting,
                parallelEvaluation, timeBudget);
    }

    public SolverSettings withKneeWeighting(boolean enabled) {
        return new SolverSettings(populationMultiplier, maxGenerations, globalTolerance, mutationMin, mutationMax,
                recombination, costTolerance, stepTolerance, gradientTolerance, maxEvaluations, maxIterations,
                noiseTrials, noiseLevel, noiseTrialGenerations, boundaryMargin, incidentPowerDensity, enabled,
                parallelEvaluation, timeBudget);
    }

    public SolverSettings withParallelEvaluation(boolean enabled) {
        return new SolverSettings(populationMultiplier, maxGenerations, globalTolerance, mutationMin, mutationMax,
                recombination, costTolerance, stepTolerance, gradientTolerance, maxEvaluations, maxIterations,
                noiseTrials, noiseLevel, noiseTrialGenerations, boundaryMargin, incidentPowerDensity, kneeWeighting,
                enabled, timeBudget);
    }

    public SolverSettings withTimeBudget(Duration budget) {
        return new SolverSettings(populationMultiplier, maxGenerations, globalTolerance, mutationMin, mutationMax,
                recombination, costTolerance, stepTolerance, gradientTolerance, maxEvaluations, maxIterations,
                noiseTrials, noiseLevel, noiseTrialGenerations, boundaryMargin, incidentPowerDensity, kneeWeighting,
                parallelEvaluation, budget);
    }
}
