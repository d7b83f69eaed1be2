package de.anton.battery.analyser.cycle_analyzer.view;

import de.anton.battery.analyser.cycle_analyzer.algorithms.ReferenceSelectionStrategy.Selection;
import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.RateStatus;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceSelectionDiagnostics;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ReferenceSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ReferenceChannelSelector;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.XYPlot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.channel;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.fadingCycles;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.rate;
import static org.junit.jupiter.api.Assertions.*;

class RetentionCurveChartRendererTest {

    private static final BatchKey KEY = new BatchKey("Q3", "Q3-2405-A/12");

    @TempDir
    Path tempDir;

    private final RetentionCurveChartRenderer renderer = new RetentionCurveChartRenderer(400, 300);

    private static ChannelSummary fading(String channelId, double fadePerCycle) {
        return channel(channelId, 300)
                .rateCycle(rate(RateStatus.NORMAL, 98.0))
                .cycles(fadingCycles(30, 300, fadePerCycle))
                .build();
    }

    private static ReferenceSelectionDiagnostics curveDecision() {
        ReferenceChannelSelector selector = new ReferenceChannelSelector(ReferenceSettings.defaults());
        List<ChannelSummary> batch = List.of(fading("CH-01", 0.5), fading("CH-02", 1.0), fading("CH-03", 1.5));
        return selector.decide(KEY, batch).orElseThrow().diagnostics();
    }

    @Test
    void writes_one_png_per_curve_decision() throws IOException {
        ReferenceSelectionDiagnostics decision = curveDecision();
        assertEquals(ReferenceMethod.CURVE_RETENTION_MSE, decision.getWinner());
        ReferenceSelectionDiagnostics withoutCurves = new ReferenceSelectionDiagnostics(
                new BatchKey("Q3", "other"), 2, Map.of(), Map.of(), null);

        List<Path> written = renderer.renderAll(List.of(decision, withoutCurves), tempDir.resolve("charts"));

        assertEquals(1, written.size());
        assertEquals("retention_Q3_Q3-2405-A_12.png", written.get(0).getFileName().toString());
        assertTrue(Files.size(written.get(0)) > 0);
    }

    @Test
    void chosen_channel_and_mean_are_plotted() {
        ReferenceSelectionDiagnostics decision = curveDecision();
        Selection selection = decision.getSelections().get(ReferenceMethod.CURVE_RETENTION_MSE);

        JFreeChart chart = renderer.createChart("Q3", selection.curves(), selection.chosen().getChannelKey());

        XYPlot plot = (XYPlot) chart.getPlot();
        // two other candidates, the mean and the reference
        assertEquals(4, plot.getDataset().getSeriesCount());
        assertEquals(selection.chosen().getChannelKey() + " (reference)", plot.getDataset().getSeriesKey(3));
    }

    @Test
    void chart_size_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionCurveChartRenderer(0, 300));
    }
}
