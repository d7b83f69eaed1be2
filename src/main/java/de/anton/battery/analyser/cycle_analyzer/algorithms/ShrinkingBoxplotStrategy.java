package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.OutlierFilterResult;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.BoxplotSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Iterative boxplot filter whose whiskers shrink every round.
 * <p>
 * Round {@code i} (1-based) keeps channels inside {@code [Q1 - IQR*shrink^i, Q3 + IQR*shrink^i]}, with
 * quartiles taken over the current survivors. Rounds continue while the survivors' range exceeds the
 * metric's max range, a round still removes something and the iteration cap is not reached.
 * Metrics configured in {@link BoxplotSettings#maxRanges()} are applied one after the other.
 */
public class ShrinkingBoxplotStrategy implements BatchOutlierStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ShrinkingBoxplotStrategy.class);

    /** One filtering round, kept for diagnostics and tests. */
    public record Iteration(int iteration, double q1, double q3, double lowerBound, double upperBound,
                            int removed, double rangeAfter) {
    }

    /** Survivors of one batch for one metric, plus the rounds that produced them. */
    public record BatchOutcome(List<ChannelSummary> survivors, List<Iteration> iterations) {
        public BatchOutcome {
            survivors = Collections.unmodifiableList(new ArrayList<>(survivors));
            iterations = Collections.unmodifiableList(new ArrayList<>(iterations));
        }
    }

    private final BoxplotSettings settings;

    public ShrinkingBoxplotStrategy(BoxplotSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Boxplot settings cannot be null.");
    }

    @Override
    public OutlierFilterResult filter(Map<BatchKey, List<ChannelSummary>> batches) {
        Objects.requireNonNull(batches, "Batches cannot be null.");
        Map<BatchKey, List<ChannelSummary>> current = new LinkedHashMap<>(batches);
        Set<BatchKey> fullyRemoved = new LinkedHashSet<>();
        List<ChannelSummary> removed = new ArrayList<>();

        for (Map.Entry<ChannelMetric, Double> entry : settings.maxRanges().entrySet()) {
            OutlierFilterResult step = filter(current, entry.getKey(), entry.getValue());
            fullyRemoved.addAll(step.getFullyRemoved());
            removed.addAll(step.getRemovedChannels());
            current = new LinkedHashMap<>(step.getFiltered());
        }
        return new OutlierFilterResult(current, fullyRemoved, removed);
    }

    /**
     * Filters every batch on a single metric.
     *
     * @param maxRange range of the survivors at which filtering stops
     */
    public OutlierFilterResult filter(Map<BatchKey, List<ChannelSummary>> batches, ChannelMetric metric, double maxRange) {
        Objects.requireNonNull(batches, "Batches cannot be null.");
        Objects.requireNonNull(metric, "Metric cannot be null.");
        Map<BatchKey, List<ChannelSummary>> filtered = new LinkedHashMap<>();
        Set<BatchKey> fullyRemoved = new LinkedHashSet<>();
        List<ChannelSummary> removed = new ArrayList<>();

        for (Map.Entry<BatchKey, List<ChannelSummary>> entry : batches.entrySet()) {
            List<ChannelSummary> channels = entry.getValue();
            BatchOutcome outcome = filterBatch(channels, metric, maxRange);
            if (outcome.survivors().isEmpty()) {
                logger.warn("Batch {} lost all {} channels in boxplot filtering on {}.", entry.getKey(), channels.size(), metric.name());
                fullyRemoved.add(entry.getKey());
            } else {
                filtered.put(entry.getKey(), outcome.survivors());
            }
            for (ChannelSummary channel : channels) {
                if (!outcome.survivors().contains(channel)) {
                    removed.add(channel);
                }
            }
            if (outcome.survivors().size() < channels.size()) {
                logger.info("Batch {}: boxplot on {} kept {}/{} channels after {} rounds.", entry.getKey(), metric.name(),
                        outcome.survivors().size(), channels.size(), outcome.iterations().size());
            }
        }
        return new OutlierFilterResult(filtered, fullyRemoved, removed);
    }

    /** Runs the shrinking rounds on one batch. Batches with at most one channel are returned unchanged. */
    public BatchOutcome filterBatch(List<ChannelSummary> channels, ChannelMetric metric, double maxRange) {
        Objects.requireNonNull(channels, "Channel list cannot be null.");
        List<Iteration> iterations = new ArrayList<>();
        if (channels.size() <= 1) {
            return new BatchOutcome(channels, iterations);
        }

        List<ChannelSummary> survivors = new ArrayList<>(channels);
        double range = StatisticsUtils.range(values(survivors, metric));
        int iteration = 0;

        while (range > maxRange && iteration < settings.maxIterations() && survivors.size() > 1) {
            iteration++;
            double[] values = values(survivors, metric);
            double q1 = StatisticsUtils.quantile(values, 0.25);
            double q3 = StatisticsUtils.quantile(values, 0.75);
            double lower = lowerBound(q1, q3, iteration);
            double upper = upperBound(q1, q3, iteration);

            List<ChannelSummary> kept = new ArrayList<>();
            for (ChannelSummary channel : survivors) {
                Double value = metric.extract(channel);
                if (value != null && value >= lower && value <= upper) {
                    kept.add(channel);
                }
            }
            int removedCount = survivors.size() - kept.size();
            survivors = kept;
            range = survivors.isEmpty() ? 0.0 : StatisticsUtils.range(values(survivors, metric));
            iterations.add(new Iteration(iteration, q1, q3, lower, upper, removedCount, range));
            logger.debug("Boxplot round {} on {}: Q1={}, Q3={}, bounds=[{}, {}], removed={}, range={}",
                    iteration, metric.name(), q1, q3, lower, upper, removedCount, range);
            if (removedCount == 0) {
                break;
            }
        }
        return new BatchOutcome(survivors, iterations);
    }

    public double lowerBound(double q1, double q3, int iteration) {
        return q1 - (q3 - q1) * Math.pow(settings.shrinkFactor(), iteration);
    }

    public double upperBound(double q1, double q3, int iteration) {
        return q3 + (q3 - q1) * Math.pow(settings.shrinkFactor(), iteration);
    }

    private static double[] values(List<ChannelSummary> channels, ChannelMetric metric) {
        return channels.stream()
                .map(metric::extract)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }
}
