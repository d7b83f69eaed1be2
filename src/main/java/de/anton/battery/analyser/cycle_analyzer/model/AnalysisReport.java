package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.List;

/**
 * Everything one run writes to the result workbook.
 */
public record AnalysisReport(
    List<BatchStatistics> statistics,
    List<ChannelSummary> filteredChannels,
    List<InconsistentBatch> inconsistentBatches,
    List<ScreenedChannel> abnormalChannels,
    List<ScreenedChannel> firstCycleOnlyChannels,
    List<ReferenceSelectionDiagnostics> diagnostics,
    List<BatchFailure> failures,
    List<SkippedFile> skippedFiles
) {
    public AnalysisReport {
        statistics = statistics != null ? List.copyOf(statistics) : List.of();
        filteredChannels = filteredChannels != null ? List.copyOf(filteredChannels) : List.of();
        inconsistentBatches = inconsistentBatches != null ? List.copyOf(inconsistentBatches) : List.of();
        abnormalChannels = abnormalChannels != null ? List.copyOf(abnormalChannels) : List.of();
        firstCycleOnlyChannels = firstCycleOnlyChannels != null ? List.copyOf(firstCycleOnlyChannels) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        skippedFiles = skippedFiles != null ? List.copyOf(skippedFiles) : List.of();
    }
}
