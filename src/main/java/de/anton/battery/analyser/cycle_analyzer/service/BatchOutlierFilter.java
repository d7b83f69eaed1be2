package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.algorithms.BatchOutlierStrategy;
import de.anton.battery.analyser.cycle_analyzer.algorithms.ShrinkingBoxplotStrategy;
import de.anton.battery.analyser.cycle_analyzer.algorithms.ZScoreMadStrategy;
import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.OutlierFilterResult;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.OutlierSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies the configured outlier strategy to all batches of a run.
 */
public class BatchOutlierFilter {

    private static final Logger logger = LoggerFactory.getLogger(BatchOutlierFilter.class);

    private final OutlierSettings settings;
    private final BatchOutlierStrategy strategy;

    public BatchOutlierFilter(OutlierSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Outlier settings cannot be null.");
        this.strategy = createStrategy(settings);
    }

    static BatchOutlierStrategy createStrategy(OutlierSettings settings) {
        switch (settings.method()) {
            case ZSCORE_MAD:
                return new ZScoreMadStrategy(settings.zScoreMad());
            case BOXPLOT:
            default:
                return new ShrinkingBoxplotStrategy(settings.boxplot());
        }
    }

    public OutlierFilterResult filter(Map<BatchKey, List<ChannelSummary>> batches) {
        Objects.requireNonNull(batches, "Batches cannot be null.");
        int before = batches.values().stream().mapToInt(List::size).sum();
        logger.info("Service: Filtering {} channels in {} batches with {}.", before, batches.size(), settings.method());
        OutlierFilterResult result = strategy.filter(batches);
        logger.info("Service: Outlier filtering kept {} channels; {} batches fully removed.",
                result.getFilteredChannels().size(), result.getFullyRemoved().size());
        return result;
    }

    public BatchOutlierStrategy getStrategy() {
        return strategy;
    }
}
