package de.anton.pv.solver.iv_solver.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import de.anton.pv.solver.iv_solver.model.AnalysisOutcome;
import de.anton.pv.solver.iv_solver.model.BoundaryHit;
import de.anton.pv.solver.iv_solver.model.DiagnosticReport;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.Measurement;
import de.anton.pv.solver.iv_solver.model.NoiseStability;
import de.anton.pv.solver.iv_solver.model.ParameterDrift;
import de.anton.pv.solver.iv_solver.model.PhysicsInsight;
import de.anton.pv.solver.iv_solver.model.ResidualAnalysis;
import de.anton.pv.solver.iv_solver.service.IvAnalysisService;
import de.anton.pv.solver.iv_solver.service.ModelConfiguration;
import de.anton.pv.solver.iv_solver.service.ResultHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes the supplementary bundle of one analysis as a ZIP archive:
 * {@code audit.json}, {@code results.xlsx} and, when the result has a fitted
 * curve, {@code iv_curve.png} and {@code residuals.png}.
 */
public class SupplementaryBundleWriter {

    private static final Logger logger = LoggerFactory.getLogger(SupplementaryBundleWriter.class);

    public static final String AUDIT_ENTRY = "audit.json";
    public static final String WORKBOOK_ENTRY = "results.xlsx";
    public static final String CURVE_CHART_ENTRY = "iv_curve.png";
    public static final String RESIDUAL_CHART_ENTRY = "residuals.png";

    private final FitResultExcelExporter excelExporter;
    private final IvCurveChartRenderer chartRenderer;
    private final ObjectMapper mapper = JsonMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build();

    public SupplementaryBundleWriter() {
        this(new FitResultExcelExporter(), new IvCurveChartRenderer());
    }

    public SupplementaryBundleWriter(FitResultExcelExporter excelExporter, IvCurveChartRenderer chartRenderer) {
        this.excelExporter = excelExporter;
        this.chartRenderer = chartRenderer;
    }

    /**
     * Writes the bundle to {@code out}; the stream is finished but not closed.
     */
    public void write(Measurement measurement, ModelConfiguration config, AnalysisOutcome outcome, OutputStream out)
            throws IOException {
        FitResult result = outcome.fitResult();
        ZipOutputStream zip = new ZipOutputStream(out);
        putEntry(zip, AUDIT_ENTRY, mapper.writeValueAsBytes(audit(measurement, config, outcome)));

        ByteArrayOutputStream workbook = new ByteArrayOutputStream();
        excelExporter.export(measurement, outcome, workbook);
        putEntry(zip, WORKBOOK_ENTRY, workbook.toByteArray());

        if (result.hasCurve()) {
            putEntry(zip, CURVE_CHART_ENTRY, chartRenderer.renderCurve(result));
            putEntry(zip, RESIDUAL_CHART_ENTRY, chartRenderer.renderResiduals(result));
        }
        zip.finish();
        logger.info("Report: bundle for '{}' written ({} curve).", measurement.getLabel(),
                result.hasCurve() ? "with" : "without");
    }

    private static void putEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
    }

    Map<String, Object> audit(Measurement measurement, ModelConfiguration config, AnalysisOutcome outcome) {
        FitResult result = outcome.fitResult();
        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("engineVersion", IvAnalysisService.ENGINE_VERSION);
        audit.put("label", measurement.getLabel());
        audit.put("fingerprint", result.getFingerprint());
        audit.put("configuration", ResultHasher.configuration(config));

        Map<String, Object> determinism = new LinkedHashMap<>();
        determinism.put("mode", config.mode().name());
        determinism.put("seed", config.seed());
        determinism.put("hashStable", result.isHashStable());
        determinism.put("parallelEvaluation", config.settings().parallelEvaluation());
        determinism.put("timeBudgetSeconds", config.settings().timeBudget().toSeconds());
        audit.put("determinism", determinism);

        audit.put("status", result.getStatus().name());
        audit.put("errorKind", result.getErrorKind() != null ? result.getErrorKind().name() : null);
        audit.put("message", result.getMessage());
        audit.put("parameters", ResultHasher.parameters(result.getParameters()));
        audit.put("metrics", ResultHasher.metrics(result.getMetrics()));
        audit.put("residualRms", finiteOrNull(result.getResidualRms()));
        audit.put("diagnostics", diagnostics(outcome.diagnosticReport()));
        audit.put("resultHash", result.getResultHash());
        return audit;
    }

    private static Map<String, Object> diagnostics(DiagnosticReport report) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("riskScore", report.riskScore());
        map.put("validationPassed", report.validationPassed());
        ResidualAnalysis residuals = report.residualAnalysis();
        if (residuals != null) {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("pattern", residuals.pattern().toString());
            r.put("level", residuals.level().name());
            r.put("confidencePercent", residuals.confidencePercent());
            r.put("rms", residuals.rms());
            r.put("runsZScore", finiteOrNull(residuals.runsZScore()));
            map.put("residuals", r);
        }
        NoiseStability stability = report.noiseStability();
        if (stability != null) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("noiseLevel", stability.noiseLevel());
            s.put("requestedTrials", stability.requestedTrials());
            s.put("successfulTrials", stability.successfulTrials());
            s.put("score", stability.score());
            s.put("stable", stability.stable());
            s.put("worstDrift", stability.worstDrift());
            s.put("complete", stability.complete());
            List<Map<String, Object>> drifts = new ArrayList<>();
            for (ParameterDrift drift : stability.drifts()) {
                Map<String, Object> d = new LinkedHashMap<>();
                d.put("quantity", drift.quantity());
                d.put("meanDrift", drift.meanDrift());
                d.put("maxDrift", drift.maxDrift());
                drifts.add(d);
            }
            s.put("drifts", drifts);
            map.put("noiseStability", s);
        }
        List<Map<String, Object>> hits = new ArrayList<>();
        for (BoundaryHit hit : report.boundaryHits()) {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("quantity", hit.quantity());
            h.put("value", hit.value());
            h.put("severity", hit.severity().name());
            h.put("distancePercent", hit.distancePercent());
            hits.add(h);
        }
        map.put("boundaryHits", hits);
        PhysicsInsight insight = report.physicsInsight();
        if (insight != null) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("idealityFromSlope", insight.idealityFromSlope());
            p.put("mechanism", insight.mechanism().name());
            p.put("idealFillFactor", finiteOrNull(insight.idealFillFactor()));
            p.put("fillFactorPlausible", insight.fillFactorPlausible());
            map.put("physics", p);
        }
        map.put("recommendations", report.recommendations());
        return map;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
