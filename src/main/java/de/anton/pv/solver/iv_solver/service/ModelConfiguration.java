package de.anton.pv.solver.iv_solver.service;

import de.anton.pv.solver.iv_solver.model.AnalysisMode;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.ParameterBounds;

import java.util.Objects;

/**
 * Immutable configuration of one analysis: model kind, analysis mode, search
 * bounds, solver settings and the seed of every random stream.
 */
public record ModelConfiguration(
    ModelKind modelKind,
    AnalysisMode mode,
    ParameterBounds bounds,
    SolverSettings settings,
    long seed
) {
    public static final long DEFAULT_SEED = 42L;

    public ModelConfiguration {
        Objects.requireNonNull(modelKind, "Model kind cannot be null.");
        Objects.requireNonNull(mode, "Analysis mode cannot be null.");
        Objects.requireNonNull(bounds, "Bounds cannot be null.");
        Objects.requireNonNull(settings, "Solver settings cannot be null.");
        if (!bounds.covers(modelKind)) {
            throw new IllegalArgumentException("Bounds do not cover every parameter of the " + modelKind + " model.");
        }
    }

    /** Reference profile: default bounds, reference budgets, seed 42. */
    public static ModelConfiguration reference(ModelKind kind) {
        return new ModelConfiguration(kind, AnalysisMode.REFERENCE, ParameterBounds.defaults(kind),
                SolverSettings.reference(), DEFAULT_SEED);
    }

    /** Exploration profile: default bounds, reduced budgets, parallel evaluation. */
    public static ModelConfiguration exploration(ModelKind kind) {
        return new ModelConfiguration(kind, AnalysisMode.EXPLORATION, ParameterBounds.defaults(kind),
                SolverSettings.exploration(), DEFAULT_SEED);
    }

    public ModelConfiguration withSettings(SolverSettings newSettings) {
        return new ModelConfiguration(modelKind, mode, bounds, newSettings, seed);
    }

    public ModelConfiguration withBounds(ParameterBounds newBounds) {
        return new ModelConfiguration(modelKind, mode, newBounds, settings, seed);
    }

    public ModelConfiguration withSeed(long newSeed) {
        return new ModelConfiguration(modelKind, mode, bounds, settings, newSeed);
    }
}
