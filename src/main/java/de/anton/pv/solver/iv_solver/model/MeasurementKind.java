package de.anton.pv.solver.iv_solver.model;

/**
 * Kind of IV measurement. Determines sign handling during preconditioning and
 * whether the photocurrent is a free parameter of the fit.
 */
public enum MeasurementKind {
    ILLUMINATED("Illuminated"),
    DARK("Dark"),
    SUNS_VOC("Suns-Voc");

    private final String displayName;

    MeasurementKind(String displayName) {
        this.displayName = displayName;
    }

    /** Illuminated and Suns-Voc curves carry a photocurrent, dark curves do not. */
    public boolean hasPhotocurrent() {
        return this != DARK;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
