package de.anton.pv.solver.iv_solver.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A raw IV measurement as handed to the engine. Immutable: the sample arrays
 * are copied on the way in and on the way out.
 * <p>
 * Plausibility of the samples (count, finiteness, monotonic voltage) is not
 * checked here but by the preconditioner, so that bad data ends up as an
 * Invalid result instead of an exception.
 */
public final class Measurement {

    private final String label;
    private final double[] voltages;
    private final double[] currents;
    private final double areaCm2;
    private final double temperatureK; // NaN = unspecified
    private final MeasurementKind kind;
    private final CurrentUnit currentUnit; // null = unknown, inferred heuristically
    private final String fingerprint;

    public Measurement(String label, double[] voltages, double[] currents, double areaCm2,
                       double temperatureK, MeasurementKind kind, CurrentUnit currentUnit, String fingerprint) {
        Objects.requireNonNull(voltages, "Voltage array cannot be null.");
        Objects.requireNonNull(currents, "Current array cannot be null.");
        this.label = label != null ? label : "";
        this.voltages = voltages.clone();
        this.currents = currents.clone();
        this.areaCm2 = areaCm2;
        this.temperatureK = temperatureK;
        this.kind = Objects.requireNonNull(kind, "Measurement kind cannot be null.");
        this.currentUnit = currentUnit;
        this.fingerprint = (fingerprint == null || fingerprint.isBlank())
                ? HashUtils.fingerprintOf(this.voltages, this.currents)
                : fingerprint;
    }

    /**
     * Illuminated measurement in ampere with unspecified temperature.
     */
    public static Measurement illuminated(String label, double[] voltages, double[] currents, double areaCm2) {
        return new Measurement(label, voltages, currents, areaCm2, Double.NaN,
                MeasurementKind.ILLUMINATED, CurrentUnit.AMPERE, null);
    }

    public String getLabel() { return label; }
    public double[] getVoltages() { return voltages.clone(); }
    public double[] getCurrents() { return currents.clone(); }
    public int size() { return voltages.length; }
    public double getAreaCm2() { return areaCm2; }
    public double getTemperatureK() { return temperatureK; }
    public boolean hasTemperature() { return Double.isFinite(temperatureK) && temperatureK > 0; }
    public MeasurementKind getKind() { return kind; }
    public CurrentUnit getCurrentUnit() { return currentUnit; }
    public String getFingerprint() { return fingerprint; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Measurement that = (Measurement) o;
        return Double.compare(that.areaCm2, areaCm2) == 0
                && Double.compare(that.temperatureK, temperatureK) == 0
                && label.equals(that.label)
                && Arrays.equals(voltages, that.voltages)
                && Arrays.equals(currents, that.currents)
                && kind == that.kind
                && currentUnit == that.currentUnit
                && fingerprint.equals(that.fingerprint);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(label, areaCm2, temperatureK, kind, currentUnit, fingerprint);
        result = 31 * result + Arrays.hashCode(voltages);
        result = 31 * result + Arrays.hashCode(currents);
        return result;
    }

    @Override
    public String toString() {
        return "Measurement{" + "label='" + label + '\'' + ", points=" + voltages.length + ", areaCm2=" + areaCm2
                + ", kind=" + kind + ", unit=" + currentUnit + '}';
    }
}
