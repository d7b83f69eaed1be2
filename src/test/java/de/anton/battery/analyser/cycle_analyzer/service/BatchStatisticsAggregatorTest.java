package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.BatchStatistics;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.InconsistentBatch;
import de.anton.battery.analyser.cycle_analyzer.model.OutlierFilterResult;
import de.anton.battery.analyser.cycle_analyzer.model.RateStatus;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.model.RetentionMetrics;
import de.anton.battery.analyser.cycle_analyzer.model.RetentionPoint;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RateThresholds;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ReferenceSettings;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.SERIES;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.channel;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.rate;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.rateChannel;
import static org.junit.jupiter.api.Assertions.*;

class BatchStatisticsAggregatorTest {

    private static final BatchKey BATCH_A = new BatchKey(SERIES, "2405-A");
    private static final BatchKey BATCH_B = new BatchKey(SERIES, "2405-B");

    private final BatchStatisticsAggregator aggregator = new BatchStatisticsAggregator(
            new ReferenceChannelSelector(ReferenceSettings.defaults()), RateThresholds.defaults());

    private static ChannelSummary inBatch(ChannelSummary.Builder builder, BatchKey key) {
        return builder.batchId(key.unifiedBatchId()).unifiedBatchId(key.unifiedBatchId()).build();
    }

    @Test
    void means_come_from_survivors_and_rate_values_from_the_reference() {
        ChannelSummary a1 = inBatch(rateChannel("CH-01", 300).cycleDischarge(2, 290.0).activeMass(10.0), BATCH_A);
        ChannelSummary a2 = inBatch(rateChannel("CH-02", 302).cycleDischarge(2, 292.0).activeMass(10.5), BATCH_A);
        ChannelSummary a3 = inBatch(rateChannel("CH-03", 304).cycleDischarge(2, null), BATCH_A);
        ChannelSummary outlier = inBatch(rateChannel("CH-04", 150), BATCH_A);
        Map<BatchKey, List<ChannelSummary>> batches = Map.of(BATCH_A, List.of(a1, a2, a3, outlier));
        OutlierFilterResult filtered = new OutlierFilterResult(Map.of(BATCH_A, List.of(a1, a2, a3)), Set.of(), List.of(outlier));

        BatchStatisticsAggregator.AggregationResult result = aggregator.aggregate(batches, filtered);

        assertEquals(1, result.statistics.size());
        BatchStatistics stats = result.statistics.get(0);
        assertEquals(4, stats.getTotalCount());
        assertEquals(3, stats.getValidCount());
        assertEquals(302.0, stats.getMeanFirstDischarge());
        assertEquals(3.8, stats.getMeanFirstVoltage());
        assertEquals(291.0, stats.getMeanCycleDischarge(2));
        assertNull(stats.getMeanCycleDischarge(3));
        assertEquals(10.25, stats.getMeanActiveMass());
        // PCA on first discharge: the middle channel sits on the centroid
        assertEquals(ReferenceMethod.PCA, stats.getReferenceMethod());
        assertEquals(a2.getChannelKey(), stats.getReferenceChannel());
        assertEquals(280.0, stats.getRateDischarge());
        assertEquals(RateStatus.NORMAL, stats.getRateStatus());
        assertEquals(1, result.diagnostics.size());
    }

    @Test
    void fully_removed_batch_is_reported_as_inconsistent() {
        ChannelSummary a1 = inBatch(rateChannel("CH-01", 300), BATCH_A);
        ChannelSummary b1 = inBatch(channel("CH-01", 200).rateCycle(rate(RateStatus.OVERCHARGE, 90.0)), BATCH_B);
        ChannelSummary b2 = inBatch(channel("CH-02", 330).rateCycle(rate(RateStatus.NORMAL, 98.0)), BATCH_B);
        Map<BatchKey, List<ChannelSummary>> batches = new LinkedHashMap<>();
        batches.put(BATCH_B, List.of(b1, b2));
        batches.put(BATCH_A, List.of(a1));
        OutlierFilterResult filtered = new OutlierFilterResult(Map.of(BATCH_A, List.of(a1)), Set.of(BATCH_B), List.of(b1, b2));

        BatchStatisticsAggregator.AggregationResult result = aggregator.aggregate(batches, filtered);

        assertEquals(1, result.statistics.size());
        assertEquals(BATCH_A, result.statistics.get(0).getBatchKey());
        assertEquals(ReferenceMethod.SINGLE_CANDIDATE, result.statistics.get(0).getReferenceMethod());
        assertEquals(1, result.inconsistentBatches.size());
        InconsistentBatch inconsistent = result.inconsistentBatches.get(0);
        assertEquals(BATCH_B, inconsistent.getBatchKey());
        assertEquals(List.of(b1, b2), inconsistent.getChannels());
        assertEquals(InconsistentBatch.Cause.LIKELY_TRUE_DEFECT, inconsistent.getCause());
    }

    @Test
    void statistics_are_ordered_by_batch_key() {
        ChannelSummary a1 = inBatch(rateChannel("CH-01", 300), BATCH_A);
        ChannelSummary b1 = inBatch(rateChannel("CH-01", 300), BATCH_B);
        Map<BatchKey, List<ChannelSummary>> batches = new LinkedHashMap<>();
        batches.put(BATCH_B, List.of(b1));
        batches.put(BATCH_A, List.of(a1));
        OutlierFilterResult filtered = new OutlierFilterResult(batches, Set.of(), List.of());

        BatchStatisticsAggregator.AggregationResult result = aggregator.aggregate(batches, filtered);

        assertEquals(BATCH_A, result.statistics.get(0).getBatchKey());
        assertEquals(BATCH_B, result.statistics.get(1).getBatchKey());
    }

    @Test
    void batch_without_rate_channels_has_statistics_but_no_reference() {
        ChannelSummary plain = inBatch(channel("CH-01", 300), BATCH_A);
        Map<BatchKey, List<ChannelSummary>> batches = Map.of(BATCH_A, List.of(plain));

        BatchStatisticsAggregator.AggregationResult result = aggregator.aggregate(batches,
                new OutlierFilterResult(batches, Set.of(), List.of()));

        BatchStatistics stats = result.statistics.get(0);
        assertNull(stats.getReferenceChoice());
        assertNull(stats.getReferenceChannel());
        assertEquals(300.0, stats.getMeanFirstDischarge());
        assertTrue(result.diagnostics.isEmpty());
    }

    @Test
    void failing_batch_does_not_stop_the_others() {
        ReferenceChannelSelector broken = new ReferenceChannelSelector(ReferenceSettings.defaults()) {
            @Override
            public Optional<Decision> decide(BatchKey key, List<ChannelSummary> batch) {
                if (key.equals(BATCH_A)) {
                    throw new IllegalStateException("broken batch");
                }
                return super.decide(key, batch);
            }
        };
        BatchStatisticsAggregator withBrokenSelector = new BatchStatisticsAggregator(broken, RateThresholds.defaults());
        Map<BatchKey, List<ChannelSummary>> batches = new LinkedHashMap<>();
        batches.put(BATCH_A, List.of(inBatch(rateChannel("CH-01", 300), BATCH_A)));
        batches.put(BATCH_B, List.of(inBatch(rateChannel("CH-01", 300), BATCH_B)));

        BatchStatisticsAggregator.AggregationResult result = withBrokenSelector.aggregate(batches,
                new OutlierFilterResult(batches, Set.of(), List.of()));

        assertEquals(1, result.failures.size());
        assertEquals(BATCH_A, result.failures.get(0).batchKey());
        assertTrue(result.failures.get(0).message().contains("broken batch"));
        assertEquals(1, result.statistics.size());
        assertEquals(BATCH_B, result.statistics.get(0).getBatchKey());
    }

    @Test
    void severe_share_below_half_is_natural_variance() {
        List<ChannelSummary> channels = List.of(
                channel("CH-01", 300).rateCycle(rate(RateStatus.VERY_LOW_EFFICIENCY, 70.0)).build(),
                channel("CH-02", 300).rateCycle(rate(RateStatus.NORMAL, 98.0)).build(),
                channel("CH-03", 300).rateCycle(rate(RateStatus.LOW_EFFICIENCY, 82.0)).build());

        InconsistentBatch entry = aggregator.classifyInconsistent(BATCH_A, channels);

        assertEquals(1, entry.getSevereCount());
        assertEquals(InconsistentBatch.Cause.HIGH_NATURAL_VARIANCE, entry.getCause());
    }

    @Test
    void very_low_first_efficiency_counts_as_severe() {
        List<ChannelSummary> channels = List.of(
                channel("CH-01", 300).firstEfficiency(75.0).build(),
                channel("CH-02", 300).build());

        InconsistentBatch entry = aggregator.classifyInconsistent(BATCH_A, channels);

        assertEquals(1, entry.getSevereCount());
        assertEquals(InconsistentBatch.Cause.LIKELY_TRUE_DEFECT, entry.getCause());
    }

    @Test
    void reference_rate_and_retention_values_are_copied_unchanged() {
        RetentionPoint current = new RetentionPoint(91.23456789, 98.7654321, 89.1111111);
        RetentionPoint at100 = new RetentionPoint(95.5, 99.1, 94.7);
        RetentionPoint at200 = new RetentionPoint(90.25, 98.3, 88.9);
        Map<Integer, RetentionPoint> offsets = new LinkedHashMap<>();
        offsets.put(100, at100);
        offsets.put(200, at200);
        ChannelSummary reference = inBatch(rateChannel("CH-01", 300)
                .currentCycleCount(250)
                .retention(new RetentionMetrics(1, current, 0.123456789, offsets)), BATCH_A);
        Map<BatchKey, List<ChannelSummary>> batches = Map.of(BATCH_A, List.of(reference));

        BatchStatistics stats = aggregator.aggregate(batches,
                new OutlierFilterResult(batches, Set.of(), List.of())).statistics.get(0);

        assertSame(reference, stats.getReferenceChoice().getChosen());
        assertEquals(reference.getRateCycleIndex(), stats.getRateCycleIndex());
        assertSame(reference.getRateCharge(), stats.getRateCharge());
        assertSame(reference.getRateDischarge(), stats.getRateDischarge());
        assertSame(reference.getRateEfficiency(), stats.getRateEfficiency());
        assertSame(reference.getRateRatio(), stats.getRateRatio());
        assertSame(reference.getRateStatus(), stats.getRateStatus());
        assertEquals(250, stats.getReferenceCycleCount());
        assertSame(reference.getCurrentCapacityRetention(), stats.getCurrentCapacityRetention());
        assertSame(reference.getCurrentVoltageRetention(), stats.getCurrentVoltageRetention());
        assertSame(reference.getCurrentEnergyRetention(), stats.getCurrentEnergyRetention());
        assertSame(reference.getVoltageDecayRate(), stats.getVoltageDecayRate());
        assertSame(at100, stats.getRetentionAtOffset(100));
        assertSame(at200, stats.getRetentionAtOffset(200));
        assertEquals(Double.doubleToRawLongBits(91.23456789),
                Double.doubleToRawLongBits(stats.getCurrentCapacityRetention()));
    }

    @Test
    void severity_uses_unrounded_first_cycle_efficiency() {
        // 239.88 / 300 is 79.96 %, stored as 80.0
        ChannelSummary borderline = channel("CH-01", 239.88).firstEfficiency(80.0)
                .cycles(List.of(new CycleRecord(0, 300, 239.88, 3.8, 911.5))).build();
        ChannelSummary healthy = channel("CH-02", 300).build();

        InconsistentBatch entry = aggregator.classifyInconsistent(BATCH_A, List.of(borderline, healthy));

        assertEquals(79.96, BatchStatisticsAggregator.firstCycleEfficiency(borderline), 1e-9);
        assertEquals(1, entry.getSevereCount());
        assertEquals(InconsistentBatch.Cause.LIKELY_TRUE_DEFECT, entry.getCause());
    }
}
