package de.anton.pv.solver.iv_solver.report;

import de.anton.pv.solver.iv_solver.model.AnalysisOutcome;
import de.anton.pv.solver.iv_solver.model.BoundaryHit;
import de.anton.pv.solver.iv_solver.model.DerivedMetrics;
import de.anton.pv.solver.iv_solver.model.DiagnosticReport;
import de.anton.pv.solver.iv_solver.model.FitResult;
import de.anton.pv.solver.iv_solver.model.Measurement;
import de.anton.pv.solver.iv_solver.model.NoiseStability;
import de.anton.pv.solver.iv_solver.model.ParameterDrift;
import de.anton.pv.solver.iv_solver.model.ParameterName;
import de.anton.pv.solver.iv_solver.model.ResidualAnalysis;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * Writes a fit result and its diagnostics to an Excel workbook (.xlsx) with
 * the sheets Summary, Curve and Diagnostics. The Curve sheet is omitted when
 * the result has no fitted curve.
 */
public class FitResultExcelExporter {

    private static final Logger logger = LoggerFactory.getLogger(FitResultExcelExporter.class);

    static final String SUMMARY_SHEET = "Summary";
    static final String CURVE_SHEET = "Curve";
    static final String DIAGNOSTICS_SHEET = "Diagnostics";
    private static final List<String> CURVE_COLUMNS = List.of("Voltage (V)", "Measured (A)", "Model (A)", "Residual (A)");
    private static final int LABEL_COLUMN_WIDTH = 40 * 256;
    private static final int VALUE_COLUMN_WIDTH = 24 * 256;

    /**
     * Writes the workbook to {@code out}. The stream is not closed.
     */
    public void export(Measurement measurement, AnalysisOutcome outcome, OutputStream out) throws IOException {
        FitResult result = outcome.fitResult();
        logger.info("Report: starting Excel export for '{}' (status {}).", measurement.getLabel(), result.getStatus());
        try (Workbook workbook = new XSSFWorkbook()) {
            Font headerFont = workbook.createFont(); headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle(); headerStyle.setFont(headerFont);

            writeSummary(workbook.createSheet(SUMMARY_SHEET), headerStyle, measurement, result);
            if (result.hasCurve()) {
                writeCurve(workbook.createSheet(CURVE_SHEET), headerStyle, result);
            }
            writeDiagnostics(workbook.createSheet(DIAGNOSTICS_SHEET), headerStyle, outcome.diagnosticReport());

            workbook.write(out);
            logger.info("Report: Excel export completed for '{}'.", measurement.getLabel());
        } catch (IOException e) { logger.error("IOException during Excel export of '{}'", measurement.getLabel(), e); throw e; }
        catch (RuntimeException e) { logger.error("Unexpected error during Excel export of '{}'", measurement.getLabel(), e); throw new IOException("Unexpected error during Excel export: " + e.getMessage(), e); }
    }

    private void writeSummary(Sheet sheet, CellStyle headerStyle, Measurement measurement, FitResult result) {
        int rowNum = header(sheet, headerStyle, List.of("Quantity", "Value", "Unit"));
        rowNum = textRow(sheet, rowNum, "Label", measurement.getLabel());
        rowNum = textRow(sheet, rowNum, "Measurement kind", String.valueOf(result.getMeasurementKind()));
        rowNum = textRow(sheet, rowNum, "Status", result.getStatus().name());
        rowNum = textRow(sheet, rowNum, "Error kind", result.getErrorKind() != null ? result.getErrorKind().name() : "");
        rowNum = textRow(sheet, rowNum, "Message", result.getMessage());
        rowNum = textRow(sheet, rowNum, "Model", String.valueOf(result.getModelKind()));
        rowNum = textRow(sheet, rowNum, "Analysis mode", String.valueOf(result.getAnalysisMode()));
        rowNum = textRow(sheet, rowNum, "Result hash", result.getResultHash());
        rowNum = textRow(sheet, rowNum, "Hash stable", result.isHashStable() ? "yes" : "no");
        rowNum = textRow(sheet, rowNum, "Input fingerprint", result.getFingerprint());
        rowNum = numericRow(sheet, rowNum, "Area", result.getAreaCm2(), "cm2");
        rowNum = numericRow(sheet, rowNum, "Temperature", result.getTemperatureK(), "K");
        rowNum = numericRow(sheet, rowNum, "Residual RMS", result.getResidualRms(), "A");
        if (result.getParameters() != null) {
            for (Map.Entry<ParameterName, Double> entry : result.getParameters().asMap().entrySet()) {
                rowNum = numericRow(sheet, rowNum, entry.getKey().symbol(), entry.getValue(), entry.getKey().unit());
            }
        }
        DerivedMetrics m = result.getMetrics();
        if (m != null) {
            rowNum = numericRow(sheet, rowNum, "Jsc", m.shortCircuitCurrentDensity(), "mA/cm2");
            rowNum = numericRow(sheet, rowNum, "Voc", m.openCircuitVoltage(), "V");
            rowNum = numericRow(sheet, rowNum, "FF", m.fillFactor(), "");
            rowNum = numericRow(sheet, rowNum, "PCE", m.efficiencyPercent(), "%");
            rowNum = numericRow(sheet, rowNum, "Pmax", m.maxPowerWatts(), "W");
            rowNum = numericRow(sheet, rowNum, "Vmpp", m.mppVoltage(), "V");
            rowNum = numericRow(sheet, rowNum, "Impp", m.mppCurrent(), "A");
            rowNum = numericRow(sheet, rowNum, "Rs (area)", m.seriesResistanceOhmCm2(), "Ohm cm2");
            rowNum = numericRow(sheet, rowNum, "Rsh (area)", m.shuntResistanceOhmCm2(), "Ohm cm2");
            numericRow(sheet, rowNum, "Pin", m.incidentPowerDensity(), "mW/cm2");
        }
        sheet.setColumnWidth(0, LABEL_COLUMN_WIDTH); sheet.setColumnWidth(1, VALUE_COLUMN_WIDTH);
    }

    private void writeCurve(Sheet sheet, CellStyle headerStyle, FitResult result) {
        int rowNum = header(sheet, headerStyle, CURVE_COLUMNS);
        double[] v = result.getVoltages(); double[] measured = result.getMeasuredCurrents();
        double[] modeled = result.getModeledCurrents(); double[] residuals = result.getResiduals();
        for (int k = 0; k < v.length; k++) {
            Row row = sheet.createRow(rowNum++);
            createNumericCell(row, 0, v[k]); createNumericCell(row, 1, measured[k]); createNumericCell(row, 2, modeled[k]); createNumericCell(row, 3, residuals[k]);
        }
        for (int i = 0; i < CURVE_COLUMNS.size(); i++) { sheet.setColumnWidth(i, VALUE_COLUMN_WIDTH); }
    }

    private void writeDiagnostics(Sheet sheet, CellStyle headerStyle, DiagnosticReport report) {
        int rowNum = header(sheet, headerStyle, List.of("Diagnostic", "Value", "Detail"));
        rowNum = numericRow(sheet, rowNum, "Risk score", report.riskScore(), "0..100");
        rowNum = textRow(sheet, rowNum, "Validation passed", report.validationPassed() ? "yes" : "no");
        ResidualAnalysis residuals = report.residualAnalysis();
        if (residuals != null) {
            rowNum = textRow(sheet, rowNum, "Residual pattern", residuals.pattern().toString());
            rowNum = textRow(sheet, rowNum, "Residual warning level", residuals.level().name());
            rowNum = numericRow(sheet, rowNum, "Residual confidence", residuals.confidencePercent(), "%");
            rowNum = numericRow(sheet, rowNum, "Runs test z", residuals.runsZScore(), "");
        }
        NoiseStability stability = report.noiseStability();
        if (stability != null) {
            rowNum = numericRow(sheet, rowNum, "Stability score", stability.score(), "0..100");
            rowNum = textRow(sheet, rowNum, "Stable", stability.stable() ? "yes" : "no");
            rowNum = textRow(sheet, rowNum, "Trials", stability.successfulTrials() + " / " + stability.requestedTrials());
            for (ParameterDrift drift : stability.drifts()) {
                rowNum = numericRow(sheet, rowNum, "Max drift " + drift.quantity(), drift.maxDrift(), drift.maxDrift() > 2.0 * stability.noiseLevel() ? "above 2x noise" : "");
            }
        }
        for (BoundaryHit hit : report.boundaryHits()) {
            Row row = sheet.createRow(rowNum++);
            row.createCell(0).setCellValue("Boundary " + hit.quantity() + " (" + hit.severity() + ")"); createNumericCell(row, 1, hit.value()); row.createCell(2).setCellValue(hit.recommendation());
        }
        for (String recommendation : report.recommendations()) {
            rowNum = textRow(sheet, rowNum, "Recommendation", recommendation);
        }
        sheet.setColumnWidth(0, LABEL_COLUMN_WIDTH); sheet.setColumnWidth(1, VALUE_COLUMN_WIDTH);
    }

    private int header(Sheet sheet, CellStyle headerStyle, List<String> columns) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < columns.size(); i++) { Cell cell = headerRow.createCell(i); cell.setCellValue(columns.get(i)); cell.setCellStyle(headerStyle); }
        return 1;
    }

    private int textRow(Sheet sheet, int rowNum, String label, String value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label); row.createCell(1).setCellValue(value != null ? value : "");
        return rowNum + 1;
    }

    private int numericRow(Sheet sheet, int rowNum, String label, double value, String unit) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label); createNumericCell(row, 1, value); row.createCell(2).setCellValue(unit);
        return rowNum + 1;
    }

    private void createNumericCell(Row row, int colIndex, double value) { if (!Double.isNaN(value) && !Double.isInfinite(value)) { row.createCell(colIndex).setCellValue(value); } else { row.createCell(colIndex, CellType.BLANK); } }
}
