package de.anton.pv.solver.iv_solver;

import de.anton.pv.solver.iv_solver.model.AnalysisOutcome;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.DiagnosticReport;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.Measurement;
import de.anton.pv.solver.iv_solver.model.ModelKind;
import de.anton.pv.solver.iv_solver.report.SupplementaryBundleWriter;
import de.anton.pv.solver.iv_solver.service.IvAnalysisService;
import de.anton.pv.solver.iv_solver.service.ModelConfiguration;
import de.anton.pv.solver.iv_solver.service.SyntheticCurveGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Console entry point. Analyzes the synthetic reference cell in REFERENCE
 * mode, prints the result and optionally writes the supplementary bundle to
 * the ZIP file given as first argument.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        try {
            // 1. Input and configuration
            Measurement measurement = SyntheticCurveGenerator.referenceMeasurement();
            ModelConfiguration config = ModelConfiguration.reference(ModelKind.ONE_DIODE);

            // 2. Analysis
            AnalysisOutcome outcome = new IvAnalysisService().analyze(measurement, config);
            print(outcome);

            // 3. Optional bundle
            if (args.length > 0) {
                Path target = Path.of(args[0]);
                try (OutputStream out = Files.newOutputStream(target)) {
                    new SupplementaryBundleWriter().write(measurement, config, outcome, out);
                }
                logger.info("Bundle written to {}", target.toAbsolutePath());
            }
            if (!outcome.fitResult().isValid()) {
                System.exit(2);
            }
        } catch (IOException e) {
            logger.error("Could not write the bundle", e);
            System.exit(1);
        }
    }

    private static void print(AnalysisOutcome outcome) {
        FitResult result = outcome.fitResult();
        DiagnosticReport report = outcome.diagnosticReport();
        System.out.println("Status:      " + result.getStatus() + (result.isValid() ? "" : " (" + result.getMessage() + ")"));
        System.out.println("Parameters:  " + result.getParameters());
        DerivedMetrics m = result.getMetrics();
        if (m != null) {
            System.out.printf("Jsc = %.3f mA/cm2, Voc = %.4f V, FF = %.4f, PCE = %.3f %%%n",
                    m.shortCircuitCurrentDensity(), m.openCircuitVoltage(), m.fillFactor(), m.efficiencyPercent());
        }
        if (report.residualAnalysis() != null) {
            System.out.println("Residuals:   " + report.residualAnalysis().pattern() + " / " + report.residualAnalysis().level());
        }
        System.out.printf("Risk score:  %.1f (%s)%n", report.riskScore(), report.validationPassed() ? "passed" : "not passed");
        report.recommendations().forEach(r -> System.out.println("  - " + r));
        System.out.println("Hash:        " + result.getResultHash());
    }
}
