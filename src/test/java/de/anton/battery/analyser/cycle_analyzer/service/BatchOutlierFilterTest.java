package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.algorithms.ShrinkingBoxplotStrategy;
import de.anton.battery.analyser.cycle_analyzer.algorithms.ZScoreMadStrategy;
import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.OutlierFilterResult;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.BoxplotSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.OutlierMethod;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.OutlierSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ZScoreMadSettings;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.SERIES;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.batch;
import static org.junit.jupiter.api.Assertions.*;

class BatchOutlierFilterTest {

    @Test
    void boxplot_is_the_default_method() {
        BatchOutlierFilter filter = new BatchOutlierFilter(OutlierSettings.defaults());

        assertInstanceOf(ShrinkingBoxplotStrategy.class, filter.getStrategy());
    }

    @Test
    void zscore_method_selects_the_robust_strategy() {
        BatchOutlierFilter filter = new BatchOutlierFilter(new OutlierSettings(OutlierMethod.ZSCORE_MAD,
                BoxplotSettings.defaults(), ZScoreMadSettings.defaults()));

        assertInstanceOf(ZScoreMadStrategy.class, filter.getStrategy());
    }

    @Test
    void filters_each_batch_independently() {
        BatchKey good = new BatchKey(SERIES, "2405-A");
        BatchKey withOutlier = new BatchKey(SERIES, "2405-B");
        List<ChannelSummary> goodChannels = batch(300, 301, 302);
        List<ChannelSummary> outlierChannels = batch(300, 302, 298, 301, 150);
        Map<BatchKey, List<ChannelSummary>> batches = new LinkedHashMap<>();
        batches.put(good, goodChannels);
        batches.put(withOutlier, outlierChannels);

        OutlierFilterResult result = new BatchOutlierFilter(OutlierSettings.defaults()).filter(batches);

        assertEquals(goodChannels, result.getFiltered().get(good));
        assertEquals(4, result.getFiltered().get(withOutlier).size());
        assertEquals(List.of(outlierChannels.get(4)), result.getRemovedChannels());
        assertEquals(7, result.getFilteredChannels().size());
    }

    @Test
    void empty_input_gives_empty_result() {
        OutlierFilterResult result = new BatchOutlierFilter(OutlierSettings.defaults()).filter(Map.of());

        assertTrue(result.getFiltered().isEmpty());
        assertTrue(result.getRemovedChannels().isEmpty());
        assertTrue(result.getFullyRemoved().isEmpty());
    }
}
