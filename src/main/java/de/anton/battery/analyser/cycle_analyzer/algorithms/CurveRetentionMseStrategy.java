package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.algorithms.CycleWeights.CurveMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.CurveSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.WeightingScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Picks the candidate whose retention curves deviate least from the batch mean curves.
 * <p>
 * Each candidate's curves start at its own rate-cycle baseline (position 0 = 100%). All curves are
 * resampled onto the cycle positions shared by every candidate, averaged, and every candidate is scored
 * with a (late-weighted) mean squared deviation per metric. Capacity is always compared; voltage and
 * energy only if enabled and available on every candidate. The metric scores are combined with
 * weights renormalized over the compared metrics.
 */
public class CurveRetentionMseStrategy implements ReferenceSelectionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(CurveRetentionMseStrategy.class);

    /** Resampled curves and scores of one comparison, used for charts and diagnostics. */
    public record CurveComparison(double[] grid, Map<String, Map<CurveMetric, double[]>> curves,
                                  Map<CurveMetric, double[]> meanCurves, Map<CurveMetric, Double> metricWeights,
                                  Map<String, Double> compositeScores) {
        public CurveComparison {
            curves = Collections.unmodifiableMap(new LinkedHashMap<>(curves));
            meanCurves = Collections.unmodifiableMap(new EnumMap<>(meanCurves));
            metricWeights = Collections.unmodifiableMap(new EnumMap<>(metricWeights));
            compositeScores = Collections.unmodifiableMap(new LinkedHashMap<>(compositeScores));
        }
    }

    /** A retention curve at the candidate's own cycle positions relative to its baseline. */
    record RawCurve(double[] positions, double[] values) {
        double maxPosition() {
            return positions[positions.length - 1];
        }
    }

    private final CurveSettings settings;

    public CurveRetentionMseStrategy(CurveSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Curve settings cannot be null.");
    }

    @Override
    public ReferenceMethod method() {
        return ReferenceMethod.CURVE_RETENTION_MSE;
    }

    @Override
    public Optional<Selection> select(List<ChannelSummary> candidates) {
        Objects.requireNonNull(candidates, "Candidates cannot be null.");
        if (candidates.size() < settings.minChannels()) {
            logger.debug("Curve selection skipped: {} candidates, need {}.", candidates.size(), settings.minChannels());
            return Optional.empty();
        }

        // capacity curves decide which candidates take part
        List<ChannelSummary> usable = new ArrayList<>();
        Map<String, Map<CurveMetric, RawCurve>> rawCurves = new LinkedHashMap<>();
        for (ChannelSummary candidate : candidates) {
            if (rawCurves.containsKey(candidate.getChannelKey())) {
                logger.warn("Curve selection: duplicate channel {} ignored.", candidate.getChannelKey());
                continue;
            }
            RawCurve capacity = buildCurve(candidate, CycleRecord::getDischargeCapacity);
            if (capacity == null) {
                logger.debug("Curve selection: channel {} has no usable capacity curve.", candidate.getChannelKey());
                continue;
            }
            Map<CurveMetric, RawCurve> perMetric = new EnumMap<>(CurveMetric.class);
            perMetric.put(CurveMetric.CAPACITY, capacity);
            putIfPresent(perMetric, CurveMetric.VOLTAGE, buildCurve(candidate, CycleRecord::getMedianDischargeVoltage));
            putIfPresent(perMetric, CurveMetric.ENERGY, buildCurve(candidate, CycleRecord::getDischargeEnergy));
            usable.add(candidate);
            rawCurves.put(candidate.getChannelKey(), perMetric);
        }
        if (usable.size() < settings.minChannels()) {
            logger.debug("Curve selection skipped: only {} candidates have capacity curves.", usable.size());
            return Optional.empty();
        }

        // common range: positions every capacity curve reaches
        double commonMax = Double.POSITIVE_INFINITY;
        for (Map<CurveMetric, RawCurve> perMetric : rawCurves.values()) {
            commonMax = Math.min(commonMax, perMetric.get(CurveMetric.CAPACITY).maxPosition());
        }
        int gridSize = (int) Math.floor(commonMax) + 1;
        if (gridSize < settings.minCycles()) {
            logger.debug("Curve selection skipped: common range covers {} cycles, need {}.", gridSize, settings.minCycles());
            return Optional.empty();
        }
        double[] grid = new double[gridSize];
        for (int i = 0; i < gridSize; i++) grid[i] = i;

        boolean voltage = settings.includeVoltage() && allHave(rawCurves, CurveMetric.VOLTAGE, commonMax);
        boolean energy = settings.includeEnergy() && allHave(rawCurves, CurveMetric.ENERGY, commonMax);
        Map<CurveMetric, Double> metricWeights = CycleWeights.metricWeights(settings.capacityWeight(),
                settings.voltageWeight(), settings.energyWeight(), voltage, energy);

        Map<String, Map<CurveMetric, double[]>> resampled = new LinkedHashMap<>();
        for (Map.Entry<String, Map<CurveMetric, RawCurve>> entry : rawCurves.entrySet()) {
            Map<CurveMetric, double[]> perMetric = new EnumMap<>(CurveMetric.class);
            for (CurveMetric metric : metricWeights.keySet()) {
                RawCurve raw = entry.getValue().get(metric);
                perMetric.put(metric, CurveInterpolator.resample(raw.positions(), raw.values(), grid, settings.interpolation()));
            }
            resampled.put(entry.getKey(), perMetric);
        }

        Map<CurveMetric, double[]> means = new EnumMap<>(CurveMetric.class);
        for (CurveMetric metric : metricWeights.keySet()) {
            double[] mean = new double[gridSize];
            for (Map<CurveMetric, double[]> perMetric : resampled.values()) {
                double[] curve = perMetric.get(metric);
                for (int i = 0; i < gridSize; i++) mean[i] += curve[i] / resampled.size();
            }
            means.put(metric, mean);
        }

        double[] weights = settings.useWeightedMse()
                ? CycleWeights.cycleWeights(gridSize, settings.weighting(), settings.weightFactor(),
                        settings.lateEmphasis(), settings.lateFraction())
                : CycleWeights.cycleWeights(gridSize, WeightingScheme.CONSTANT,
                        0.0, 1.0, settings.lateFraction());

        Map<String, Double> composite = new LinkedHashMap<>();
        ChannelSummary best = null;
        double bestScore = Double.POSITIVE_INFINITY;
        for (ChannelSummary candidate : usable) {
            Map<CurveMetric, double[]> perMetric = resampled.get(candidate.getChannelKey());
            double score = 0;
            for (Map.Entry<CurveMetric, Double> w : metricWeights.entrySet()) {
                score += w.getValue() * CycleWeights.weightedMse(perMetric.get(w.getKey()), means.get(w.getKey()), weights);
            }
            composite.put(candidate.getChannelKey(), score);
            logger.trace("Curve score of {}: {}", candidate.getChannelKey(), score);
            if (score < bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        logger.debug("Curve selection over {} cycles and metrics {}: chosen={} (score={})",
                gridSize, metricWeights.keySet(), best.getChannelKey(), bestScore);
        CurveComparison comparison = new CurveComparison(grid, resampled, means, metricWeights, composite);
        return Optional.of(new Selection(method(), best, composite, comparison));
    }

    /**
     * Retention curve (%) from the channel's rate-cycle baseline to its last cycle.
     * Cycles with a missing value are skipped.
     *
     * @return the curve, or null if the baseline value is not positive or fewer than one point remains
     */
    RawCurve buildCurve(ChannelSummary channel, ToDoubleFunction<CycleRecord> value) {
        List<CycleRecord> cycles = channel.getCycles();
        Integer rateIndex = channel.getRateCycleIndex();
        int baselineIndex = rateIndex != null ? rateIndex : 0;
        if (baselineIndex >= cycles.size()) {
            return null;
        }
        CycleRecord baseline = cycles.get(baselineIndex);
        double reference = value.applyAsDouble(baseline);
        if (Double.isNaN(reference) || reference <= 0) {
            return null;
        }

        List<double[]> points = new ArrayList<>();
        for (int i = baselineIndex; i < cycles.size(); i++) {
            double v = value.applyAsDouble(cycles.get(i));
            if (Double.isNaN(v)) continue;
            double position = cycles.get(i).getCycleIndex() - baseline.getCycleIndex();
            points.add(new double[]{position, 100.0 * v / reference});
        }
        double[] positions = new double[points.size()];
        double[] values = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            positions[i] = points.get(i)[0];
            values[i] = points.get(i)[1];
        }
        return new RawCurve(positions, values);
    }

    private static void putIfPresent(Map<CurveMetric, RawCurve> map, CurveMetric metric, RawCurve curve) {
        if (curve != null) map.put(metric, curve);
    }

    private static boolean allHave(Map<String, Map<CurveMetric, RawCurve>> curves, CurveMetric metric, double commonMax) {
        for (Map<CurveMetric, RawCurve> perMetric : curves.values()) {
            RawCurve curve = perMetric.get(metric);
            if (curve == null || curve.maxPosition() < commonMax) {
                return false;
            }
        }
        return true;
    }
}
