package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.OutlierFilterResult;

import java.util.List;
import java.util.Map;

/**
 * Removes outlier channels batch by batch using the metrics the strategy was configured with.
 * <p>
 * Implementations never add channels, never throw on degenerate batches (one channel, identical
 * values) and report batches that lose every channel in {@link OutlierFilterResult#getFullyRemoved()}.
 */
public interface BatchOutlierStrategy {

    OutlierFilterResult filter(Map<BatchKey, List<ChannelSummary>> batches);
}
