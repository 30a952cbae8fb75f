package de.anton.pv.solver.iv_solver.model;

/**
 * Relative drift of one quantity across noise-injection trials.
 *
 * @param quantity   name of the figure of merit or parameter
 * @param cleanValue value from the clean fit
 * @param meanDrift  mean of |trial - clean| / |clean|
 * @param stdDrift   standard deviation of the relative drift
 * @param maxDrift   largest relative drift
 */
public record ParameterDrift(
        String quantity,
        double cleanValue,
        double meanDrift,
        double stdDrift,
        double maxDrift
) {
}
