package de.anton.pv.solver.iv_solver.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Search bounds per parameter, in physical device-level units (A, Ohm).
 */
public final class ParameterBounds {

    /** Closed interval [lower, upper]. */
    public record Bound(double lower, double upper) {
        public Bound {
            if (!Double.isFinite(lower) || !Double.isFinite(upper) || lower > upper) {
                throw new IllegalArgumentException("Invalid bound [" + lower + ", " + upper + "]");
            }
        }

        public boolean contains(double value) {
            return value >= lower && value <= upper;
        }

        public double clamp(double value) {
            return Math.max(lower, Math.min(upper, value));
        }
    }

    private final Map<ParameterName, Bound> bounds;

    private ParameterBounds(Map<ParameterName, Bound> bounds) {
        this.bounds = Collections.unmodifiableMap(new EnumMap<>(bounds));
    }

    /**
     * Default bounds table for a model kind.
     */
    public static ParameterBounds defaults(ModelKind kind) {
        Map<ParameterName, Bound> map = new EnumMap<>(ParameterName.class);
        map.put(ParameterName.PHOTOCURRENT, new Bound(1e-6, 2.0));
        map.put(ParameterName.SATURATION_CURRENT, new Bound(1e-18, 1e-3));
        map.put(ParameterName.SERIES_RESISTANCE, new Bound(0.0, 1000.0));
        map.put(ParameterName.SHUNT_RESISTANCE, new Bound(1.0, 1e9));
        if (kind == ModelKind.TWO_DIODE) {
            map.put(ParameterName.IDEALITY, new Bound(0.5, 3.0));
            map.put(ParameterName.SECONDARY_SATURATION_CURRENT, new Bound(1e-18, 1e-3));
            map.put(ParameterName.SECONDARY_IDEALITY, new Bound(1.0, 7.0));
        } else {
            map.put(ParameterName.IDEALITY, new Bound(0.5, 5.0));
        }
        return new ParameterBounds(map);
    }

    /**
     * Copy with one bound replaced.
     */
    public ParameterBounds with(ParameterName name, double lower, double upper) {
        Map<ParameterName, Bound> map = new EnumMap<>(bounds);
        map.put(Objects.requireNonNull(name), new Bound(lower, upper));
        return new ParameterBounds(map);
    }

    /**
     * @throws IllegalArgumentException if no bound is defined for the parameter.
     */
    public Bound get(ParameterName name) {
        Bound bound = bounds.get(name);
        if (bound == null) {
            throw new IllegalArgumentException("No bound defined for parameter " + name);
        }
        return bound;
    }

    public boolean covers(ModelKind kind) {
        return bounds.keySet().containsAll(ParameterName.forModel(kind));
    }

    public Map<ParameterName, Bound> asMap() {
        return bounds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterBounds)) return false;
        return bounds.equals(((ParameterBounds) o).bounds);
    }

    @Override
    public int hashCode() {
        return bounds.hashCode();
    }

    @Override
    public String toString() {
        return "ParameterBounds" + bounds;
    }
}
