package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.algorithms.RateCycleLocator;
import de.anton.battery.analyser.cycle_analyzer.algorithms.StatisticsUtils;
import de.anton.battery.analyser.cycle_analyzer.model.BatchFailure;
import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.BatchStatistics;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.InconsistentBatch;
import de.anton.battery.analyser.cycle_analyzer.model.OutlierFilterResult;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceSelectionDiagnostics;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RateThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns grouped channels into one statistics row per batch.
 * <p>
 * Means are taken over the channels that survived outlier filtering; rate-cycle and retention values
 * come unchanged from the batch's reference channel. Batches without survivors are reported as
 * inconsistent together with all their original channels. A batch that fails unexpectedly is
 * recorded as a {@link BatchFailure} and does not stop the others.
 */
public class BatchStatisticsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(BatchStatisticsAggregator.class);
    static final double TRUE_DEFECT_SHARE = 0.5;

    /** Everything produced for the batches of one run. */
    public static class AggregationResult {
        public final List<BatchStatistics> statistics;
        public final List<InconsistentBatch> inconsistentBatches;
        public final List<ReferenceSelectionDiagnostics> diagnostics;
        public final List<BatchFailure> failures;

        AggregationResult(List<BatchStatistics> statistics, List<InconsistentBatch> inconsistent,
                          List<ReferenceSelectionDiagnostics> diagnostics, List<BatchFailure> failures) {
            this.statistics = Collections.unmodifiableList(new ArrayList<>(statistics));
            this.inconsistentBatches = Collections.unmodifiableList(new ArrayList<>(inconsistent));
            this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
            this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
        }
    }

    private final ReferenceChannelSelector selector;
    private final RateThresholds rateThresholds;

    public BatchStatisticsAggregator(ReferenceChannelSelector selector, RateThresholds rateThresholds) {
        this.selector = Objects.requireNonNull(selector, "Reference selector cannot be null.");
        this.rateThresholds = Objects.requireNonNull(rateThresholds, "Rate thresholds cannot be null.");
    }

    /**
     * @param preFilter    all channels per batch before outlier filtering
     * @param filterResult survivors per batch
     */
    public AggregationResult aggregate(Map<BatchKey, List<ChannelSummary>> preFilter, OutlierFilterResult filterResult) {
        Objects.requireNonNull(preFilter, "Pre-filter batches cannot be null.");
        Objects.requireNonNull(filterResult, "Filter result cannot be null.");

        List<BatchStatistics> statistics = new ArrayList<>();
        List<InconsistentBatch> inconsistent = new ArrayList<>();
        List<ReferenceSelectionDiagnostics> diagnostics = new ArrayList<>();
        List<BatchFailure> failures = new ArrayList<>();

        List<BatchKey> keys = new ArrayList<>(preFilter.keySet());
        Collections.sort(keys);
        for (BatchKey key : keys) {
            List<ChannelSummary> original = preFilter.get(key);
            List<ChannelSummary> survivors = filterResult.getFiltered().getOrDefault(key, Collections.emptyList());
            MDC.put("series", key.series());
            MDC.put("batch", key.unifiedBatchId());
            try {
                if (survivors.isEmpty()) {
                    InconsistentBatch entry = classifyInconsistent(key, original);
                    logger.warn("Batch {} has no consistent channels left ({} originally), cause: {}.",
                            key, original.size(), entry.getCause());
                    inconsistent.add(entry);
                    continue;
                }
                Optional<ReferenceChannelSelector.Decision> decision = selector.decide(key, survivors);
                decision.map(ReferenceChannelSelector.Decision::diagnostics).ifPresent(diagnostics::add);
                statistics.add(buildStatistics(key, original.size(), survivors, decision.orElse(null)));
            } catch (RuntimeException e) {
                logger.error("Failed to aggregate batch {}; continuing with the remaining batches.", key, e);
                failures.add(new BatchFailure(key, "aggregation", e.getClass().getSimpleName() + ": " + e.getMessage()));
            } finally {
                MDC.remove("series");
                MDC.remove("batch");
            }
        }
        logger.info("Aggregated {} batches: {} statistics rows, {} inconsistent, {} failed.",
                keys.size(), statistics.size(), inconsistent.size(), failures.size());
        return new AggregationResult(statistics, inconsistent, diagnostics, failures);
    }

    BatchStatistics buildStatistics(BatchKey key, int totalCount, List<ChannelSummary> survivors,
                                    ReferenceChannelSelector.Decision decision) {
        BatchStatistics.Builder builder = BatchStatistics.builder(key)
                .shelfTime(survivors.get(0).getShelfTime())
                .totalCount(totalCount)
                .validCount(survivors.size())
                .meanFirstCharge(meanOf(survivors, ChannelSummary::getFirstCharge, 2))
                .meanFirstDischarge(meanOf(survivors, ChannelSummary::getFirstDischarge, 2))
                .meanFirstEfficiency(meanOf(survivors, ChannelSummary::getFirstEfficiency, 2))
                .meanFirstVoltage(meanOf(survivors, ChannelSummary::getFirstVoltage, 3))
                .meanFirstEnergy(meanOf(survivors, ChannelSummary::getFirstEnergy, 2))
                .meanActiveMass(meanOf(survivors, ChannelSummary::getActiveMass, 2));
        for (int cycle = ChannelSummary.FIRST_EARLY_CYCLE; cycle <= ChannelSummary.LAST_EARLY_CYCLE; cycle++) {
            final int n = cycle;
            builder.meanCycleDischarge(n, meanOf(survivors, c -> c.getCycleDischarge(n), 2));
            builder.meanCycleCharge(n, meanOf(survivors, c -> c.getCycleCharge(n), 2));
        }
        if (decision != null) {
            builder.referenceChoice(decision.choice());
        }
        return builder.build();
    }

    /**
     * A batch is a likely true defect when at least half of its channels are overcharged or have very
     * low efficiency on the rate cycle or the first cycle.
     */
    InconsistentBatch classifyInconsistent(BatchKey key, List<ChannelSummary> channels) {
        int severe = 0;
        for (ChannelSummary channel : channels) {
            if (isSevere(channel)) severe++;
        }
        boolean defect = !channels.isEmpty() && (double) severe / channels.size() >= TRUE_DEFECT_SHARE;
        return new InconsistentBatch(key, channels,
                defect ? InconsistentBatch.Cause.LIKELY_TRUE_DEFECT : InconsistentBatch.Cause.HIGH_NATURAL_VARIANCE, severe);
    }

    private boolean isSevere(ChannelSummary channel) {
        if (channel.getRateStatus().isSevere()) {
            return true;
        }
        Double efficiency = firstCycleEfficiency(channel);
        return efficiency != null && efficiency < rateThresholds.veryLowEfficiencyThreshold();
    }

    /** Unrounded first-cycle efficiency from the recorded cycles, else the summary's rounded value. */
    static Double firstCycleEfficiency(ChannelSummary channel) {
        List<CycleRecord> cycles = channel.getCycles();
        if (cycles != null && !cycles.isEmpty()) {
            CycleRecord first = cycles.get(0);
            return RateCycleLocator.efficiency(first.getChargeCapacity(), first.getDischargeCapacity());
        }
        return channel.getFirstEfficiency();
    }

    private static Double meanOf(List<ChannelSummary> channels, Function<ChannelSummary, Double> getter, int places) {
        List<Double> values = new ArrayList<>();
        for (ChannelSummary channel : channels) {
            Double v = getter.apply(channel);
            if (StatisticsUtils.isUsable(v)) values.add(v);
        }
        return StatisticsUtils.round(StatisticsUtils.mean(values), places);
    }
}
