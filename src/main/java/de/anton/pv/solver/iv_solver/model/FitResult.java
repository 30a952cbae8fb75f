package de.anton.pv.solver.iv_solver.model;

import java.util.Objects;

/**
 * Result of fitting one measurement. Always well-formed: a FAILED or INVALID
 * result carries its error kind and message, a VALID result carries
 * parameters, the modeled curve and (for illuminated curves) derived metrics.
 * <p>
 * Curve arrays are aligned with the preconditioned voltage array.
 */
public final class FitResult {

    private static final double[] EMPTY = new double[0];

    private final FitStatus status;
    private final FitErrorKind errorKind;
    private final String message;
    private final ModelKind modelKind;
    private final MeasurementKind measurementKind;
    private final AnalysisMode analysisMode;
    private final String fingerprint;
    private final double areaCm2;
    private final double temperatureK;
    private final FittedParameters parameters;
    private final FittedParameters globalCandidate;
    private final double[] voltages;
    private final double[] measuredCurrents;
    private final double[] modeledCurrents;
    private final double[] residuals;
    private final DerivedMetrics metrics;
    private final MppSensitivity sensitivity;
    private final double residualRms;
    private final double objective;
    private final int globalGenerations;
    private final int refinerIterations;
    private final int refinerEvaluations;
    private final String resultHash;
    private final boolean hashStable;

    private FitResult(Builder b) {
        this.status = Objects.requireNonNull(b.status, "status");
        this.errorKind = b.errorKind;
        this.message = b.message != null ? b.message : "";
        this.modelKind = b.modelKind;
        this.measurementKind = b.measurementKind;
        this.analysisMode = b.analysisMode;
        this.fingerprint = b.fingerprint;
        this.areaCm2 = b.areaCm2;
        this.temperatureK = b.temperatureK;
        this.parameters = b.parameters;
        this.globalCandidate = b.globalCandidate;
        this.voltages = b.voltages != null ? b.voltages.clone() : EMPTY;
        this.measuredCurrents = b.measuredCurrents != null ? b.measuredCurrents.clone() : EMPTY;
        this.modeledCurrents = b.modeledCurrents != null ? b.modeledCurrents.clone() : EMPTY;
        this.residuals = b.residuals != null ? b.residuals.clone() : EMPTY;
        this.metrics = b.metrics;
        this.sensitivity = b.sensitivity;
        this.residualRms = b.residualRms;
        this.objective = b.objective;
        this.globalGenerations = b.globalGenerations;
        this.refinerIterations = b.refinerIterations;
        this.refinerEvaluations = b.refinerEvaluations;
        this.resultHash = b.resultHash;
        this.hashStable = b.hashStable;
        if (status == FitStatus.VALID && parameters == null) {
            throw new IllegalStateException("A valid fit result requires parameters.");
        }
        if (status != FitStatus.VALID && errorKind == null) {
            throw new IllegalStateException("A " + status + " fit result requires an error kind.");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with every field of this result. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.status = status;
        b.errorKind = errorKind;
        b.message = message;
        b.modelKind = modelKind;
        b.measurementKind = measurementKind;
        b.analysisMode = analysisMode;
        b.fingerprint = fingerprint;
        b.areaCm2 = areaCm2;
        b.temperatureK = temperatureK;
        b.parameters = parameters;
        b.globalCandidate = globalCandidate;
        b.voltages = voltages;
        b.measuredCurrents = measuredCurrents;
        b.modeledCurrents = modeledCurrents;
        b.residuals = residuals;
        b.metrics = metrics;
        b.sensitivity = sensitivity;
        b.residualRms = residualRms;
        b.objective = objective;
        b.globalGenerations = globalGenerations;
        b.refinerIterations = refinerIterations;
        b.refinerEvaluations = refinerEvaluations;
        b.resultHash = resultHash;
        b.hashStable = hashStable;
        return b;
    }

    public FitStatus getStatus() { return status; }
    public boolean isValid() { return status == FitStatus.VALID; }
    public FitErrorKind getErrorKind() { return errorKind; }
    public String getMessage() { return message; }
    public ModelKind getModelKind() { return modelKind; }
    public MeasurementKind getMeasurementKind() { return measurementKind; }
    public AnalysisMode getAnalysisMode() { return analysisMode; }
    public String getFingerprint() { return fingerprint; }
    public double getAreaCm2() { return areaCm2; }
    public double getTemperatureK() { return temperatureK; }
    /** Fitted parameters, null unless the refiner produced a finite estimate. */
    public FittedParameters getParameters() { return parameters; }
    /** Best candidate of the global stage; diagnostic context only. */
    public FittedParameters getGlobalCandidate() { return globalCandidate; }
    public double[] getVoltages() { return voltages.clone(); }
    public double[] getMeasuredCurrents() { return measuredCurrents.clone(); }
    public double[] getModeledCurrents() { return modeledCurrents.clone(); }
    public double[] getResiduals() { return residuals.clone(); }
    public boolean hasCurve() { return modeledCurrents.length > 0; }
    /** Derived metrics, null for dark curves and for results without a fit. */
    public DerivedMetrics getMetrics() { return metrics; }
    public MppSensitivity getSensitivity() { return sensitivity; }
    public double getResidualRms() { return residualRms; }
    public double getObjective() { return objective; }
    public int getGlobalGenerations() { return globalGenerations; }
    public int getRefinerIterations() { return refinerIterations; }
    public int getRefinerEvaluations() { return refinerEvaluations; }
    public String getResultHash() { return resultHash; }
    public boolean isHashStable() { return hashStable; }

    @Override
    public String toString() {
        return "FitResult{" + "status=" + status + (errorKind != null ? ", error=" + errorKind : "")
                + ", model=" + modelKind + ", parameters=" + parameters + ", metrics=" + metrics
                + ", hash=" + resultHash + '}';
    }

    public static final class Builder {
        private FitStatus status;
        private FitErrorKind errorKind;
        private String message;
        private ModelKind modelKind;
        private MeasurementKind measurementKind;
        private AnalysisMode analysisMode;
        private String fingerprint;
        private double areaCm2 = Double.NaN;
        private double temperatureK = Double.NaN;
        private FittedParameters parameters;
        private FittedParameters globalCandidate;
        private double[] voltages;
        private double[] measuredCurrents;
        private double[] modeledCurrents;
        private double[] residuals;
        private DerivedMetrics metrics;
        private MppSensitivity sensitivity;
        private double residualRms = Double.NaN;
        private double objective = Double.NaN;
        private int globalGenerations;
        private int refinerIterations;
        private int refinerEvaluations;
        private String resultHash;
        private boolean hashStable;

        private Builder() {
        }

        public Builder status(FitStatus status) { this.status = status; return this; }

        /** Sets the error kind together with the status it maps to. */
        public Builder error(FitErrorKind kind, String message) {
            this.errorKind = kind;
            this.status = kind.status();
            this.message = message;
            return this;
        }

        public Builder message(String message) { this.message = message; return this; }
        public Builder modelKind(ModelKind modelKind) { this.modelKind = modelKind; return this; }
        public Builder measurementKind(MeasurementKind kind) { this.measurementKind = kind; return this; }
        public Builder analysisMode(AnalysisMode mode) { this.analysisMode = mode; return this; }
        public Builder fingerprint(String fingerprint) { this.fingerprint = fingerprint; return this; }
        public Builder areaCm2(double areaCm2) { this.areaCm2 = areaCm2; return this; }
        public Builder temperatureK(double temperatureK) { this.temperatureK = temperatureK; return this; }
        public Builder parameters(FittedParameters parameters) { this.parameters = parameters; return this; }
        public Builder globalCandidate(FittedParameters candidate) { this.globalCandidate = candidate; return this; }

        public Builder curve(double[] voltages, double[] measured, double[] modeled, double[] residuals) {
            this.voltages = voltages;
            this.measuredCurrents = measured;
            this.modeledCurrents = modeled;
            this.residuals = residuals;
            return this;
        }

        public Builder metrics(DerivedMetrics metrics) { this.metrics = metrics; return this; }
        public Builder sensitivity(MppSensitivity sensitivity) { this.sensitivity = sensitivity; return this; }
        public Builder residualRms(double residualRms) { this.residualRms = residualRms; return this; }
        public Builder objective(double objective) { this.objective = objective; return this; }
        public Builder globalGenerations(int generations) { this.globalGenerations = generations; return this; }
        public Builder refinerIterations(int iterations) { this.refinerIterations = iterations; return this; }
        public Builder refinerEvaluations(int evaluations) { this.refinerEvaluations = evaluations; return this; }

        public Builder resultHash(String hash, boolean stable) {
            this.resultHash = hash;
            this.hashStable = stable;
            return this;
        }

        public FitResult build() {
            return new FitResult(this);
        }
    }
}
