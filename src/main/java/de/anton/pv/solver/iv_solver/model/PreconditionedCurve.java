package de.anton.pv.solver.iv_solver.model;

import java.util.Objects;

/**
 * Measurement after preconditioning: ascending, duplicate-free voltages and
 * currents in ampere, generator-referenced (positive in the power quadrant
 * of an illuminated cell).
 */
public final class PreconditionedCurve {

    private final String label;
    private final String fingerprint;
    private final MeasurementKind kind;
    private final double[] voltages;
    private final double[] currents;
    private final double areaCm2;
    private final double temperatureK;
    private final double currentScale;
    private final boolean unitInferred;
    private final boolean signFlipped;
    private final boolean reversed;
    private final int droppedDuplicates;

    public PreconditionedCurve(String label, String fingerprint, MeasurementKind kind, double[] voltages,
                               double[] currents, double areaCm2, double temperatureK, double currentScale,
                               boolean unitInferred, boolean signFlipped, boolean reversed, int droppedDuplicates) {
        Objects.requireNonNull(voltages, "voltages");
        Objects.requireNonNull(currents, "currents");
        if (voltages.length != currents.length) {
            throw new IllegalArgumentException("Voltage and current arrays differ in length.");
        }
        this.label = label;
        this.fingerprint = fingerprint;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.voltages = voltages.clone();
        this.currents = currents.clone();
        this.areaCm2 = areaCm2;
        this.temperatureK = temperatureK;
        this.currentScale = currentScale;
        this.unitInferred = unitInferred;
        this.signFlipped = signFlipped;
        this.reversed = reversed;
        this.droppedDuplicates = droppedDuplicates;
    }

    /**
     * Same curve with different current samples. Used for noise-injection trials.
     */
    public PreconditionedCurve withCurrents(double[] newCurrents) {
        return new PreconditionedCurve(label, fingerprint, kind, voltages, newCurrents, areaCm2, temperatureK,
                currentScale, unitInferred, signFlipped, reversed, droppedDuplicates);
    }

    public String getLabel() { return label; }
    public String getFingerprint() { return fingerprint; }
    public MeasurementKind getKind() { return kind; }
    public double[] getVoltages() { return voltages.clone(); }
    public double[] getCurrents() { return currents.clone(); }
    public int size() { return voltages.length; }
    public double getAreaCm2() { return areaCm2; }
    public double getTemperatureK() { return temperatureK; }
    public double getThermalVoltage() { return PhysicalConstants.thermalVoltage(temperatureK); }
    public double getCurrentScale() { return currentScale; }
    public boolean isUnitInferred() { return unitInferred; }
    public boolean isSignFlipped() { return signFlipped; }
    public boolean isReversed() { return reversed; }
    public int getDroppedDuplicates() { return droppedDuplicates; }

    /** Largest absolute current, the natural scale of the curve. */
    public double peakAbsCurrent() {
        double max = 0.0;
        for (double i : currents) max = Math.max(max, Math.abs(i));
        return max;
    }

    public double minVoltage() { return voltages[0]; }
    public double maxVoltage() { return voltages[voltages.length - 1]; }
}
