package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.model.BatchFailure;
import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.BatchStatistics;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelFileNameParser;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.InconsistentBatch;
import de.anton.battery.analyser.cycle_analyzer.model.OutlierFilterResult;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceSelectionDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service performing the batch consolidation of one run:
 * grouping by batch, outlier filtering, reference selection and statistics aggregation.
 * Holds no state between runs.
 */
public class BatteryAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(BatteryAnalysisService.class);

    /**
     * Represents the comprehensive result of a full analysis run.
     */
    public static class AnalysisResult {
        public final List<ChannelSummary> channels;
        public final Map<BatchKey, List<ChannelSummary>> batches;
        public final List<ChannelSummary> filteredChannels;
        public final List<ChannelSummary> removedChannels;
        public final List<BatchStatistics> statistics;
        public final List<InconsistentBatch> inconsistentBatches;
        public final List<ReferenceSelectionDiagnostics> diagnostics;
        public final List<BatchFailure> failures;

        private AnalysisResult(List<ChannelSummary> channels, Map<BatchKey, List<ChannelSummary>> batches,
                               OutlierFilterResult filterResult, BatchStatisticsAggregator.AggregationResult aggregation) {
            this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
            this.batches = Collections.unmodifiableMap(new LinkedHashMap<>(batches));
            this.filteredChannels = filterResult != null ? filterResult.getFilteredChannels() : Collections.emptyList();
            this.removedChannels = filterResult != null ? filterResult.getRemovedChannels() : Collections.emptyList();
            this.statistics = aggregation != null ? aggregation.statistics : Collections.emptyList();
            this.inconsistentBatches = aggregation != null ? aggregation.inconsistentBatches : Collections.emptyList();
            this.diagnostics = aggregation != null ? aggregation.diagnostics : Collections.emptyList();
            this.failures = aggregation != null ? aggregation.failures : Collections.emptyList();
        }
    }

    private final BatchOutlierFilter outlierFilter;
    private final BatchStatisticsAggregator aggregator;

    public BatteryAnalysisService(ProcessingConfiguration config) {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        this.outlierFilter = new BatchOutlierFilter(config.outlier());
        this.aggregator = new BatchStatisticsAggregator(new ReferenceChannelSelector(config.reference()), config.rateThresholds());
    }

    BatteryAnalysisService(BatchOutlierFilter outlierFilter, BatchStatisticsAggregator aggregator) {
        this.outlierFilter = Objects.requireNonNull(outlierFilter, "Outlier filter cannot be null.");
        this.aggregator = Objects.requireNonNull(aggregator, "Aggregator cannot be null.");
    }

    /**
     * Executes the consolidation pipeline on screened channel summaries.
     *
     * @param summaries accepted channels of one run, in any order
     * @return the per-batch statistics together with the intermediate results
     */
    public AnalysisResult runFullAnalysis(List<ChannelSummary> summaries) {
        Objects.requireNonNull(summaries, "Channel summaries cannot be null.");
        logger.info("Service: Starting full analysis of {} channels.", summaries.size());

        if (summaries.isEmpty()) {
            logger.warn("Service: Analysis aborted: no channels to consolidate.");
            return new AnalysisResult(Collections.emptyList(), Collections.emptyMap(), null, null);
        }

        List<ChannelSummary> channels = attachUnifiedBatchIds(summaries);
        Map<BatchKey, List<ChannelSummary>> batches = groupByBatch(channels);
        logger.info("Service: Grouped channels into {} batches.", batches.size());

        OutlierFilterResult filterResult = outlierFilter.filter(batches);
        BatchStatisticsAggregator.AggregationResult aggregation = aggregator.aggregate(batches, filterResult);

        logger.info("Service: Full analysis completed: {} statistics rows, {} inconsistent batches, {} failures.",
                aggregation.statistics.size(), aggregation.inconsistentBatches.size(), aggregation.failures.size());
        return new AnalysisResult(channels, batches, filterResult, aggregation);
    }

    static List<ChannelSummary> attachUnifiedBatchIds(List<ChannelSummary> summaries) {
        List<ChannelSummary> result = new ArrayList<>(summaries.size());
        for (ChannelSummary summary : summaries) {
            Objects.requireNonNull(summary, "Channel summary cannot be null.");
            if (summary.getUnifiedBatchId() == null) {
                result.add(summary.withUnifiedBatchId(ChannelFileNameParser.unifiedBatchId(summary.getBatchId())));
            } else {
                result.add(summary);
            }
        }
        return result;
    }

    /** Groups by (series, unified batch id), keeping the input order inside each batch. */
    static Map<BatchKey, List<ChannelSummary>> groupByBatch(List<ChannelSummary> channels) {
        Map<BatchKey, List<ChannelSummary>> batches = new LinkedHashMap<>();
        for (ChannelSummary channel : channels) {
            batches.computeIfAbsent(BatchKey.of(channel), k -> new ArrayList<>()).add(channel);
        }
        return batches;
    }
}
