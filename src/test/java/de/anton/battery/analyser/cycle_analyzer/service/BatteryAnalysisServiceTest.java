package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.SERIES;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.channel;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.rateChannel;
import static org.junit.jupiter.api.Assertions.*;

class BatteryAnalysisServiceTest {

    private final BatteryAnalysisService service = new BatteryAnalysisService(ProcessingConfiguration.defaults());

    private static ChannelSummary subBatch(ChannelSummary.Builder builder, String batchId) {
        return builder.batchId(batchId).unifiedBatchId(null).build();
    }

    @Test
    void empty_input_gives_empty_result() {
        BatteryAnalysisService.AnalysisResult result = service.runFullAnalysis(List.of());

        assertTrue(result.channels.isEmpty());
        assertTrue(result.batches.isEmpty());
        assertTrue(result.statistics.isEmpty());
        assertTrue(result.failures.isEmpty());
    }

    @Test
    void sub_batches_are_consolidated_under_their_unified_id() {
        List<ChannelSummary> summaries = List.of(
                subBatch(rateChannel("CH-01", 300), "Q3-2405-A-12-1C-0620-1011"),
                subBatch(rateChannel("CH-02", 302), "Q3-2405-A-12-1C-0621-0930"),
                subBatch(rateChannel("CH-03", 280), "Q3-2405-B-03-1C-0620-1011"));

        BatteryAnalysisService.AnalysisResult result = service.runFullAnalysis(summaries);

        assertEquals(2, result.batches.size());
        BatchKey batchA = new BatchKey(SERIES, "Q3-2405-A-12");
        assertEquals(2, result.batches.get(batchA).size());
        assertEquals("Q3-2405-A-12", result.channels.get(0).getUnifiedBatchId());
        assertEquals(2, result.statistics.size());
        assertEquals(batchA, result.statistics.get(0).getBatchKey());
        assertEquals(301.0, result.statistics.get(0).getMeanFirstDischarge());
        assertEquals(3, result.filteredChannels.size());
        assertTrue(result.removedChannels.isEmpty());
    }

    @Test
    void outliers_are_removed_before_statistics() {
        List<ChannelSummary> summaries = new ArrayList<>();
        double[] discharges = {300, 302, 298, 301, 150};
        for (int i = 0; i < discharges.length; i++) {
            summaries.add(rateChannel(String.format("CH-%02d", i + 1), discharges[i]).build());
        }

        BatteryAnalysisService.AnalysisResult result = service.runFullAnalysis(summaries);

        assertEquals(1, result.removedChannels.size());
        assertEquals(150.0, result.removedChannels.get(0).getFirstDischarge());
        assertEquals(5, result.statistics.get(0).getTotalCount());
        assertEquals(4, result.statistics.get(0).getValidCount());
        assertEquals(300.25, result.statistics.get(0).getMeanFirstDischarge());
    }

    @Test
    void existing_unified_id_is_kept() {
        ChannelSummary summary = channel("CH-01", 300).batchId("Q3-2405-A-12-1C").unifiedBatchId("custom").build();

        List<ChannelSummary> attached = BatteryAnalysisService.attachUnifiedBatchIds(List.of(summary));

        assertSame(summary, attached.get(0));
    }

    @Test
    void grouping_keeps_input_order() {
        ChannelSummary first = channel("CH-02", 300).build();
        ChannelSummary second = channel("CH-01", 300).build();

        Map<BatchKey, List<ChannelSummary>> batches = BatteryAnalysisService.groupByBatch(List.of(first, second));

        assertEquals(List.of(first, second), batches.values().iterator().next());
    }
}
