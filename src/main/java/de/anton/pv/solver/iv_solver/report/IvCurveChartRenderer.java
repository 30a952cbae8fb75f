package de.anton.pv.solver.iv_solver.report;

import de.anton.pv.solver.iv_solver.model.FitResult;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.geom.Ellipse2D;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Renders the measured and modeled curve and the residuals of a fit as PNG.
 */
public class IvCurveChartRenderer {

    private static final Logger logger = LoggerFactory.getLogger(IvCurveChartRenderer.class);

    static final int WIDTH = 900;
    static final int HEIGHT = 600;
    private static final Color MEASURED_COLOR = new Color(31, 119, 180);
    private static final Color MODEL_COLOR = new Color(214, 39, 40);

    /**
     * @throws IllegalArgumentException if the result carries no fitted curve.
     */
    public byte[] renderCurve(FitResult result) throws IOException {
        requireCurve(result);
        double[] v = result.getVoltages();
        XYSeries measured = series("Measured", v, result.getMeasuredCurrents(), 1000.0);
        XYSeries model = series("Model (" + result.getModelKind() + ")", v, result.getModeledCurrents(), 1000.0);
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(measured);
        dataset.addSeries(model);

        JFreeChart chart = ChartFactory.createXYLineChart("IV curve", "Voltage (V)", "Current (mA)", dataset,
                PlotOrientation.VERTICAL, true, false, false);
        XYPlot plot = stylePlot(chart);
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
        renderer.setSeriesLinesVisible(0, false);
        renderer.setSeriesShapesVisible(0, true);
        renderer.setSeriesShape(0, new Ellipse2D.Double(-2.5, -2.5, 5, 5));
        renderer.setSeriesPaint(0, MEASURED_COLOR);
        renderer.setSeriesLinesVisible(1, true);
        renderer.setSeriesShapesVisible(1, false);
        renderer.setSeriesPaint(1, MODEL_COLOR);
        renderer.setSeriesStroke(1, new BasicStroke(2.0f));
        plot.setRenderer(renderer);
        return toPng(chart);
    }

    public byte[] renderResiduals(FitResult result) throws IOException {
        requireCurve(result);
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(series("Residual", result.getVoltages(), result.getResiduals(), 1e6));
        JFreeChart chart = ChartFactory.createScatterPlot("Residuals (measured - model)", "Voltage (V)",
                "Residual (uA)", dataset, PlotOrientation.VERTICAL, false, false, false);
        XYPlot plot = stylePlot(chart);
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(false, true);
        renderer.setSeriesPaint(0, MEASURED_COLOR);
        renderer.setSeriesShape(0, new Ellipse2D.Double(-2, -2, 4, 4));
        plot.setRenderer(renderer);
        return toPng(chart);
    }

    private static XYSeries series(String name, double[] x, double[] y, double scale) {
        XYSeries series = new XYSeries(name, false, true);
        for (int k = 0; k < x.length; k++) {
            series.add(x[k], y[k] * scale);
        }
        return series;
    }

    private static XYPlot stylePlot(JFreeChart chart) {
        XYPlot plot = (XYPlot) chart.getPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));
        return plot;
    }

    private static byte[] toPng(JFreeChart chart) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ChartUtils.writeChartAsPNG(out, chart, WIDTH, HEIGHT);
        logger.debug("Report: rendered '{}' ({} bytes).", chart.getTitle().getText(), out.size());
        return out.toByteArray();
    }

    private static void requireCurve(FitResult result) {
        if (!result.hasCurve()) {
            throw new IllegalArgumentException("Result has no fitted curve to plot (status " + result.getStatus() + ").");
        }
    }
}
