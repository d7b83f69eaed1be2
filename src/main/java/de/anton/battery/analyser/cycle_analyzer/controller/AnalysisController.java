package de.anton.battery.analyser.cycle_analyzer.controller;

import de.anton.battery.analyser.cycle_analyzer.model.AnalysisReport;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.ResultWorkbookExporter;
import de.anton.battery.analyser.cycle_analyzer.model.ScreenedChannel;
import de.anton.battery.analyser.cycle_analyzer.service.BatteryAnalysisService;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration;
import de.anton.battery.analyser.cycle_analyzer.service.WorkbookDataService;
import de.anton.battery.analyser.cycle_analyzer.view.RetentionCurveChartRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wires the services of one run: load and screen a folder, consolidate the accepted channels,
 * write the result workbook and, on request, the retention charts.
 */
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);
    static final int CHART_WIDTH = 1000;
    static final int CHART_HEIGHT = 600;

    private final ProcessingConfiguration config;
    private final WorkbookDataService dataService;
    private final BatteryAnalysisService analysisService;

    public AnalysisController(ProcessingConfiguration config) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null.");
        this.dataService = new WorkbookDataService(config);
        this.analysisService = new BatteryAnalysisService(config);
    }

    public AnalysisReport analyzeFolder(File folder) throws IOException {
        WorkbookDataService.LoadResult loaded = dataService.loadFolder(folder);

        List<ChannelSummary> accepted = new ArrayList<>();
        List<ScreenedChannel> abnormal = new ArrayList<>();
        List<ScreenedChannel> firstCycleOnly = new ArrayList<>();
        for (ScreenedChannel channel : loaded.channels) {
            switch (channel.status()) {
                case ACCEPTED:
                    accepted.add(channel.summary());
                    break;
                case ABNORMAL_FIRST_CYCLE:
                    abnormal.add(channel);
                    break;
                case FIRST_CYCLE_ONLY:
                default:
                    firstCycleOnly.add(channel);
                    break;
            }
        }
        logger.info("Screening: {} accepted, {} abnormal first cycle, {} first cycle only, {} skipped files.",
                accepted.size(), abnormal.size(), firstCycleOnly.size(), loaded.skippedFiles.size());

        BatteryAnalysisService.AnalysisResult result = analysisService.runFullAnalysis(accepted);
        return new AnalysisReport(result.statistics, result.filteredChannels, result.inconsistentBatches,
                abnormal, firstCycleOnly, result.diagnostics, result.failures, loaded.skippedFiles);
    }

    public void exportReport(AnalysisReport report, Path output) throws IOException {
        new ResultWorkbookExporter(config.retention().offsets()).exportResults(report, output);
    }

    /**
     * @return the chart files written next to the output workbook
     */
    public List<Path> renderCharts(AnalysisReport report, Path output) throws IOException {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Path parent = output.toAbsolutePath().getParent();
        Path folder = parent != null ? parent.resolve(stem + "_charts") : Path.of(stem + "_charts");
        return new RetentionCurveChartRenderer(CHART_WIDTH, CHART_HEIGHT).renderAll(report.diagnostics(), folder);
    }
}
