package de.anton.pv.solver.iv_solver.report;

import de.anton.pv.solver.iv_solver.model.AnalysisMode;
import de.anton.pv.solver.iv_solver.model.AnalysisOutcome;
import de.anton.pv.solver.iv_solver.model.BoundaryHit;
import de.anton.pv.solver.iv_solver.model.BoundarySeverity;
import de.anton.pv.solver.iv_solver.model.DiagnosticReport;
import de.anton.pv.solver.iv_solver.model.FitErrorKind;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.FitStatus;
import de.anton.pv.solver.iv_solver.model.Measurement;
import de.anton.pv.solver.iv_solver.model.MeasurementKind;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.model.OneDiodeParameters;
import de.anton.pv.solver.iv_solver.model.PhysicalConstants;
import de.anton.pv.solver.iv_solver.model.ResidualAnalysis;
import de.anton.pv.solver.iv_solver.model.ResidualPattern;
import de.anton.pv.solver.iv_solver.model.WarningLevel;
import de.anton.pv.solver.iv_solver.service.SyntheticCurveGenerator;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

/** Hand-built outcomes for the report tests. */
final class ReportFixtures {

    private ReportFixtures() {
    }

    /** A valid result whose model curve is the reference cell with a small offset. */
    static AnalysisOutcome validOutcome(Measurement measurement) {
        OneDiodeParameters parameters = SyntheticCurveGenerator.referenceCell();
        double[] v = measurement.getVoltages();
        double[] measured = measurement.getCurrents();
        double[] modeled = new double[v.length];
        double[] residuals = new double[v.length];
        for (int k = 0; k < v.length; k++) {
            residuals[k] = (k % 2 == 0 ? 1e-7 : -1e-7);
            modeled[k] = measured[k] - residuals[k];
        }
        FitResult result = FitResult.builder()
                .status(FitStatus.VALID)
                .modelKind(ModelKind.ONE_DIODE)
                .measurementKind(MeasurementKind.ILLUMINATED)
                .analysisMode(AnalysisMode.REFERENCE)
                .fingerprint(measurement.getFingerprint())
                .areaCm2(measurement.getAreaCm2())
                .temperatureK(PhysicalConstants.STC_TEMPERATURE_K)
                .parameters(parameters)
                .curve(v, measured, modeled, residuals)
                .residualRms(1e-7)
                .resultHash("ab".repeat(32), true)
                .build();
        ResidualAnalysis residualAnalysis = new ResidualAnalysis(ResidualPattern.RANDOM, WarningLevel.LOW, 95.0,
                1e-7, 12.0, 0.0, 0.0, "Residuals look random.");
        BoundaryHit hit = new BoundaryHit("Rs", 0.0, 0.0, 1000.0, BoundarySeverity.WARNING, 0.0,
                "Series resistance at zero.");
        DiagnosticReport report = new DiagnosticReport(residualAnalysis, null, List.of(hit), null, 12.5, true,
                List.of("Rs: Series resistance at zero."));
        return new AnalysisOutcome(result, report);
    }

    static AnalysisOutcome invalidOutcome(Measurement measurement) {
        FitResult result = FitResult.builder()
                .error(FitErrorKind.VALIDATION, "At least 5 samples are required.")
                .measurementKind(measurement.getKind())
                .fingerprint(measurement.getFingerprint())
                .areaCm2(measurement.getAreaCm2())
                .build();
        return new AnalysisOutcome(result, DiagnosticReport.unavailable("INVALID: At least 5 samples are required."));
    }

    /** True when the AWT font stack can lay out text, which chart rendering needs. */
    static boolean fontsAvailable() {
        try {
            BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = image.createGraphics();
            try {
                return g.getFontMetrics().stringWidth("Voltage") > 0;
            } finally {
                g.dispose();
            }
        } catch (Throwable t) {
            return false;
        }
    }
}
