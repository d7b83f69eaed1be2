package de.anton.battery.analyser.cycle_analyzer.view;

import de.anton.battery.analyser.cycle_analyzer.algorithms.CurveRetentionMseStrategy.CurveComparison;
import de.anton.battery.analyser.cycle_analyzer.algorithms.CycleWeights.CurveMetric;
import de.anton.battery.analyser.cycle_analyzer.algorithms.ReferenceSelectionStrategy.Selection;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceSelectionDiagnostics;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
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
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the capacity-retention curves compared by the curve method as PNG line charts,
 * one per batch: every candidate in grey, the batch mean dashed, the chosen channel highlighted.
 */
public class RetentionCurveChartRenderer {

    private static final Logger logger = LoggerFactory.getLogger(RetentionCurveChartRenderer.class);

    private static final Color CANDIDATE_COLOR = new Color(160, 160, 160);
    private static final Color MEAN_COLOR = Color.BLACK;
    private static final Color CHOSEN_COLOR = new Color(200, 30, 30);
    private static final BasicStroke THIN = new BasicStroke(1.0f);
    private static final BasicStroke THICK = new BasicStroke(2.5f);
    private static final BasicStroke DASHED = new BasicStroke(2.0f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
            10.0f, new float[]{6.0f, 4.0f}, 0.0f);

    private final int width;
    private final int height;

    public RetentionCurveChartRenderer(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Chart size must be positive. Got: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    /**
     * Writes one chart per decision that carries curve-method results.
     *
     * @return the files written
     * @throws IOException if the folder cannot be created or a chart cannot be written
     */
    public List<Path> renderAll(List<ReferenceSelectionDiagnostics> decisions, Path folder) throws IOException {
        Objects.requireNonNull(decisions, "Decisions cannot be null.");
        Objects.requireNonNull(folder, "Output folder cannot be null.");
        Files.createDirectories(folder);
        List<Path> written = new ArrayList<>();
        for (ReferenceSelectionDiagnostics decision : decisions) {
            Selection selection = decision.getSelections().get(ReferenceMethod.CURVE_RETENTION_MSE);
            if (selection == null || selection.curves() == null) {
                continue;
            }
            Path file = folder.resolve(fileName(decision));
            JFreeChart chart = createChart(decision.getBatchKey().toString(), selection.curves(),
                    selection.chosen().getChannelKey());
            ChartUtils.saveChartAsPNG(file.toFile(), chart, width, height);
            written.add(file);
            logger.debug("Retention chart written: {}", file);
        }
        logger.info("Rendered {} retention charts to {}", written.size(), folder.toAbsolutePath());
        return written;
    }

    JFreeChart createChart(String title, CurveComparison comparison, String chosenKey) {
        XYSeriesCollection dataset = new XYSeriesCollection();
        double[] grid = comparison.grid();
        List<String> order = new ArrayList<>();

        for (Map.Entry<String, Map<CurveMetric, double[]>> entry : comparison.curves().entrySet()) {
            if (entry.getKey().equals(chosenKey)) {
                continue;
            }
            dataset.addSeries(toSeries(entry.getKey(), grid, entry.getValue().get(CurveMetric.CAPACITY)));
            order.add(entry.getKey());
        }
        double[] mean = comparison.meanCurves().get(CurveMetric.CAPACITY);
        if (mean != null) {
            dataset.addSeries(toSeries("Batch mean", grid, mean));
            order.add("Batch mean");
        }
        Map<CurveMetric, double[]> chosen = comparison.curves().get(chosenKey);
        if (chosen != null) {
            dataset.addSeries(toSeries(chosenKey + " (reference)", grid, chosen.get(CurveMetric.CAPACITY)));
            order.add(chosenKey);
        }

        JFreeChart chart = ChartFactory.createXYLineChart(
                "Capacity retention " + title, "Cycles after baseline", "Capacity retention (%)", dataset,
                PlotOrientation.VERTICAL, true, false, false);

        XYPlot plot = (XYPlot) chart.getPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));

        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        for (int i = 0; i < order.size(); i++) {
            String key = order.get(i);
            if (key.equals(chosenKey)) {
                renderer.setSeriesPaint(i, CHOSEN_COLOR);
                renderer.setSeriesStroke(i, THICK);
            } else if (key.equals("Batch mean")) {
                renderer.setSeriesPaint(i, MEAN_COLOR);
                renderer.setSeriesStroke(i, DASHED);
            } else {
                renderer.setSeriesPaint(i, CANDIDATE_COLOR);
                renderer.setSeriesStroke(i, THIN);
                renderer.setSeriesVisibleInLegend(i, false);
            }
        }
        plot.setRenderer(renderer);

        NumberAxis domainAxis = (NumberAxis) plot.getDomainAxis();
        domainAxis.setStandardTickUnits(NumberAxis.createIntegerTickUnits());
        NumberAxis rangeAxis = (NumberAxis) plot.getRangeAxis();
        rangeAxis.setAutoRangeIncludesZero(false);
        return chart;
    }

    private static XYSeries toSeries(String name, double[] grid, double[] values) {
        XYSeries series = new XYSeries(name, false, true);
        if (values == null) {
            return series;
        }
        for (int i = 0; i < grid.length && i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                series.add(grid[i], values[i]);
            }
        }
        return series;
    }

    static String fileName(ReferenceSelectionDiagnostics decision) {
        String raw = "retention_" + decision.getBatchKey().series() + "_" + decision.getBatchKey().unifiedBatchId();
        return raw.replaceAll("[^A-Za-z0-9._-]", "_") + ".png";
    }
}
