package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.OutlierFilterResult;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ZScoreMadSettings;
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
 * Robust outlier filter based on the modified Z-score {@code c * (x - median) / MAD}.
 * <p>
 * The MAD is never smaller than {@code median * minMadRatio}. With enough channels the score is
 * also computed on the linearly detrended series (in channel order) and the larger absolute score counts,
 * which catches a channel that breaks a steady drift while staying close to the median. A channel flagged
 * on any metric is removed.
 */
public class ZScoreMadStrategy implements BatchOutlierStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ZScoreMadStrategy.class);

    /** Scores of one metric within one batch. Channels without a value have no entry. */
    public record MetricScores(ChannelMetric metric, double median, double effectiveMad, double madFloor,
                               boolean detrended, Map<ChannelSummary, Double> scores, Set<ChannelSummary> outliers) {
        public MetricScores {
            scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
            outliers = Collections.unmodifiableSet(new LinkedHashSet<>(outliers));
        }
    }

    private final ZScoreMadSettings settings;

    public ZScoreMadStrategy(ZScoreMadSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Z-score settings cannot be null.");
    }

    @Override
    public OutlierFilterResult filter(Map<BatchKey, List<ChannelSummary>> batches) {
        Objects.requireNonNull(batches, "Batches cannot be null.");
        Map<BatchKey, List<ChannelSummary>> filtered = new LinkedHashMap<>();
        Set<BatchKey> fullyRemoved = new LinkedHashSet<>();
        List<ChannelSummary> removed = new ArrayList<>();

        for (Map.Entry<BatchKey, List<ChannelSummary>> entry : batches.entrySet()) {
            List<ChannelSummary> channels = entry.getValue();
            if (channels.size() < 2) {
                filtered.put(entry.getKey(), channels);
                continue;
            }
            Set<ChannelSummary> outliers = new LinkedHashSet<>();
            for (Map.Entry<ChannelMetric, Double> threshold : settings.thresholds().entrySet()) {
                MetricScores scores = score(channels, threshold.getKey(), threshold.getValue());
                if (scores != null) {
                    outliers.addAll(scores.outliers());
                }
            }
            List<ChannelSummary> survivors = new ArrayList<>();
            for (ChannelSummary channel : channels) {
                if (outliers.contains(channel)) {
                    removed.add(channel);
                } else {
                    survivors.add(channel);
                }
            }
            if (!outliers.isEmpty()) {
                logger.info("Batch {}: Z-score/MAD removed {} of {} channels.", entry.getKey(), outliers.size(), channels.size());
            }
            if (survivors.isEmpty()) {
                logger.warn("Batch {} lost all channels in Z-score/MAD filtering.", entry.getKey());
                fullyRemoved.add(entry.getKey());
            } else {
                filtered.put(entry.getKey(), survivors);
            }
        }
        return new OutlierFilterResult(filtered, fullyRemoved, removed);
    }

    /**
     * Scores one metric over one batch.
     *
     * @return the scores, or null if fewer than two values exist or the effective MAD is zero
     */
    public MetricScores score(List<ChannelSummary> channels, ChannelMetric metric, double threshold) {
        List<ChannelSummary> withValue = new ArrayList<>();
        List<Double> valueList = new ArrayList<>();
        for (ChannelSummary channel : channels) {
            Double value = metric.extract(channel);
            if (value != null) {
                withValue.add(channel);
                valueList.add(value);
            }
        }
        if (valueList.size() < 2) {
            return null;
        }
        double[] values = valueList.stream().mapToDouble(Double::doubleValue).toArray();

        double median = StatisticsUtils.median(values);
        double floor = Math.abs(median) * settings.minMadRatio();
        double mad = Math.max(StatisticsUtils.mad(values), floor);
        if (mad <= 0) {
            logger.debug("Z-score on {} skipped: MAD is zero (median={}).", metric.name(), median);
            return null;
        }

        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = Math.abs(settings.madConstant() * (values[i] - median) / mad);
        }

        boolean detrended = false;
        if (settings.useTimeSeries() && values.length >= settings.minSamplesForDetrend()) {
            double[] residuals = StatisticsUtils.detrend(values);
            double residualMedian = StatisticsUtils.median(residuals);
            double residualMad = Math.max(StatisticsUtils.mad(residuals), floor);
            if (residualMad > 0) {
                detrended = true;
                for (int i = 0; i < values.length; i++) {
                    double z = Math.abs(settings.madConstant() * (residuals[i] - residualMedian) / residualMad);
                    scores[i] = Math.max(scores[i], z);
                }
            }
        }

        Map<ChannelSummary, Double> scoreMap = new LinkedHashMap<>();
        Set<ChannelSummary> outliers = new LinkedHashSet<>();
        for (int i = 0; i < scores.length; i++) {
            scoreMap.put(withValue.get(i), scores[i]);
            if (scores[i] > threshold) {
                outliers.add(withValue.get(i));
                logger.debug("Channel {} is an outlier on {}: score={} > {}", withValue.get(i).getChannelKey(),
                        metric.name(), scores[i], threshold);
            }
        }
        return new MetricScores(metric, median, mad, floor, detrended, scoreMap, outliers);
    }
}
