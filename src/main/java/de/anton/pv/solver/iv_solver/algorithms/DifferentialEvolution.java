package de.anton.pv.solver.iv_solver.algorithms;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.stream.IntStream;

/**
 * Differential Evolution (best/1/bin) on the unit hypercube, with dithered
 * mutation, Latin hypercube initialisation and deferred updating: a whole
 * generation of trial vectors is built first, then evaluated, then selected.
 * All random draws come from one seeded Mersenne Twister in a fixed order,
 * so a run is reproducible for a given seed whether or not the trial
 * evaluation is parallel.
 */
public class DifferentialEvolution {

    private static final Logger logger = LoggerFactory.getLogger(DifferentialEvolution.class);

    /** Energy assigned to candidates whose objective is not finite. */
    public static final double PENALTY = 1e30;
    private static final int MIN_POPULATION = 5;

    /**
     * @param populationMultiplier population size per dimension
     * @param maxGenerations       generation budget
     * @param tolerance            relative convergence tolerance on the spread of energies
     * @param mutationMin          lower end of the dithered differential weight
     * @param mutationMax          upper end of the dithered differential weight
     * @param recombination        crossover probability
     * @param seed                 seed of the random stream
     * @param parallel             evaluate the trial vectors of a generation in parallel
     */
    public record Settings(int populationMultiplier, int maxGenerations, double tolerance, double mutationMin,
                           double mutationMax, double recombination, long seed, boolean parallel) {
        public Settings {
            if (populationMultiplier <= 0) throw new IllegalArgumentException("Population multiplier must be positive.");
            if (maxGenerations < 0) throw new IllegalArgumentException("Generation budget cannot be negative.");
            if (!(tolerance >= 0)) throw new IllegalArgumentException("Tolerance cannot be negative.");
            if (!(mutationMin > 0) || mutationMax < mutationMin || mutationMax > 2.0) {
                throw new IllegalArgumentException("Mutation range must satisfy 0 < min <= max <= 2.");
            }
            if (!(recombination >= 0 && recombination <= 1)) {
                throw new IllegalArgumentException("Recombination must be within [0, 1].");
            }
        }
    }

    /**
     * @param best        best member, unit hypercube coordinates
     * @param bestEnergy  its objective value
     * @param generations generations run
     * @param evaluations objective evaluations
     * @param converged   whether the spread criterion was met within the budget
     */
    public record Result(double[] best, double bestEnergy, int generations, int evaluations, boolean converged) {
    }

    private final ToDoubleFunction<double[]> objective;
    private final int dimension;
    private final Settings settings;
    private final List<double[]> initialMembers;
    private final Deadline deadline;

    /**
     * @param objective      objective on unit-hypercube coordinates; must be thread-safe when parallel
     * @param dimension      number of coordinates
     * @param settings       algorithm settings
     * @param initialMembers members replacing the first Latin hypercube samples (unit coordinates, may be empty)
     * @param deadline       wall-clock budget
     */
    public DifferentialEvolution(ToDoubleFunction<double[]> objective, int dimension, Settings settings,
                                 List<double[]> initialMembers, Deadline deadline) {
        this.objective = Objects.requireNonNull(objective, "Objective cannot be null.");
        if (dimension <= 0) throw new IllegalArgumentException("Dimension must be positive.");
        this.dimension = dimension;
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null.");
        this.initialMembers = initialMembers != null ? List.copyOf(initialMembers) : List.of();
        this.deadline = deadline != null ? deadline : Deadline.none();
        for (double[] member : this.initialMembers) {
            if (member.length != dimension) {
                throw new IllegalArgumentException("Initial member has dimension " + member.length + ", expected " + dimension);
            }
        }
    }

    /**
     * Runs the search.
     *
     * @return The best member found.
     * @throws BudgetExceededException if the deadline passes between generations.
     */
    public Result run() {
        RandomGenerator random = new MersenneTwister(settings.seed());
        int size = Math.max(MIN_POPULATION, settings.populationMultiplier() * dimension);
        logger.debug("Starting DE: dimension={}, population={}, maxGenerations={}, seed={}",
                dimension, size, settings.maxGenerations(), settings.seed());

        double[][] population = latinHypercube(size, random);
        for (int k = 0; k < initialMembers.size() && k < size; k++) {
            double[] member = initialMembers.get(k);
            for (int j = 0; j < dimension; j++) {
                population[k][j] = Math.max(0.0, Math.min(1.0, member[j]));
            }
        }

        double[] energies = evaluate(population);
        int evaluations = size;
        int best = argMin(energies);
        boolean converged = false;
        int generation = 0;

        while (generation < settings.maxGenerations()) {
            deadline.check("global search");
            generation++;
            double weight = settings.mutationMin()
                    + random.nextDouble() * (settings.mutationMax() - settings.mutationMin());

            double[][] trials = new double[size][];
            for (int i = 0; i < size; i++) {
                trials[i] = trialVector(population, i, best, weight, random);
            }
            double[] trialEnergies = evaluate(trials);
            evaluations += size;

            for (int i = 0; i < size; i++) {
                if (trialEnergies[i] < energies[i]) {
                    population[i] = trials[i];
                    energies[i] = trialEnergies[i];
                }
            }
            best = argMin(energies);

            if (logger.isTraceEnabled()) {
                logger.trace("DE generation {}: best energy {}", generation, energies[best]);
            }
            if (hasConverged(energies)) {
                converged = true;
                break;
            }
        }

        logger.debug("DE finished after {} generations ({} evaluations), best energy {}, converged={}",
                generation, evaluations, energies[best], converged);
        return new Result(population[best].clone(), energies[best], generation, evaluations, converged);
    }

    private double[] trialVector(double[][] population, int target, int best, double weight, RandomGenerator random) {
        int size = population.length;
        int r0;
        do {
            r0 = random.nextInt(size);
        } while (r0 == target);
        int r1;
        do {
            r1 = random.nextInt(size);
        } while (r1 == target || r1 == r0);

        double[] trial = population[target].clone();
        int forced = random.nextInt(dimension);
        for (int j = 0; j < dimension; j++) {
            if (j == forced || random.nextDouble() < settings.recombination()) {
                trial[j] = population[best][j] + weight * (population[r0][j] - population[r1][j]);
            }
        }
        // out-of-range coordinates are redrawn uniformly
        for (int j = 0; j < dimension; j++) {
            if (trial[j] < 0.0 || trial[j] > 1.0) {
                trial[j] = random.nextDouble();
            }
        }
        return trial;
    }

    private double[][] latinHypercube(int size, RandomGenerator random) {
        double[][] population = new double[size][dimension];
        int[] permutation = new int[size];
        for (int j = 0; j < dimension; j++) {
            for (int i = 0; i < size; i++) permutation[i] = i;
            for (int i = size - 1; i > 0; i--) {
                int swap = random.nextInt(i + 1);
                int tmp = permutation[i];
                permutation[i] = permutation[swap];
                permutation[swap] = tmp;
            }
            for (int i = 0; i < size; i++) {
                population[i][j] = (permutation[i] + random.nextDouble()) / size;
            }
        }
        return population;
    }

    private double[] evaluate(double[][] members) {
        double[] energies = new double[members.length];
        if (settings.parallel()) {
            IntStream.range(0, members.length).parallel().forEach(k -> energies[k] = energy(members[k]));
        } else {
            for (int k = 0; k < members.length; k++) {
                energies[k] = energy(members[k]);
            }
        }
        return energies;
    }

    private double energy(double[] member) {
        double value = objective.applyAsDouble(member);
        return Double.isFinite(value) ? Math.min(value, PENALTY) : PENALTY;
    }

    private boolean hasConverged(double[] energies) {
        double mean = 0.0;
        for (double e : energies) mean += e;
        mean /= energies.length;
        double variance = 0.0;
        for (double e : energies) variance += (e - mean) * (e - mean);
        double std = Math.sqrt(variance / energies.length);
        return std <= settings.tolerance() * Math.abs(mean);
    }

    private static int argMin(double[] values) {
        int index = 0;
        for (int k = 1; k < values.length; k++) {
            if (values[k] < values[index]) index = k;
        }
        return index;
    }
}
