package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.model.ChannelMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration snapshot for one processing run.
 * Every section validates its ranges on construction; components receive the section they need.
 */
public record ProcessingConfiguration(
    RateThresholds rateThresholds,
    ScreeningThresholds screening,
    RetentionSettings retention,
    OutlierSettings outlier,
    ReferenceSettings reference,
    WorkbookSettings workbook
) {

    public ProcessingConfiguration {
        Objects.requireNonNull(rateThresholds, "Rate thresholds cannot be null.");
        Objects.requireNonNull(screening, "Screening thresholds cannot be null.");
        Objects.requireNonNull(retention, "Retention settings cannot be null.");
        Objects.requireNonNull(outlier, "Outlier settings cannot be null.");
        Objects.requireNonNull(reference, "Reference settings cannot be null.");
        Objects.requireNonNull(workbook, "Workbook settings cannot be null.");
    }

    public static ProcessingConfiguration defaults() {
        return new ProcessingConfiguration(RateThresholds.defaults(), ScreeningThresholds.defaults(),
                RetentionSettings.defaults(), OutlierSettings.defaults(), ReferenceSettings.defaults(),
                WorkbookSettings.defaults());
    }

    public ProcessingConfiguration withOutlier(OutlierSettings newOutlier) {
        return new ProcessingConfiguration(rateThresholds, screening, retention, newOutlier, reference, workbook);
    }

    public ProcessingConfiguration withReference(ReferenceSettings newReference) {
        return new ProcessingConfiguration(rateThresholds, screening, retention, outlier, newReference, workbook);
    }

    // ------------------------------------------------------------------------------------------

    /** Rate (1C) cycle detection and status classification. */
    public record RateThresholds(
        double ratioThreshold,
        double dischargeDiffThreshold,
        double overchargeThreshold,
        double lowEfficiencyThreshold,
        double veryLowEfficiencyThreshold,
        int maxCandidateIndex,
        int fallbackIndex
    ) {
        public RateThresholds {
            if (!(ratioThreshold > 0)) {
                throw new IllegalArgumentException("Rate ratio threshold must be positive. Got: " + ratioThreshold);
            }
            if (dischargeDiffThreshold < 0) {
                throw new IllegalArgumentException("Discharge difference threshold cannot be negative. Got: " + dischargeDiffThreshold);
            }
            if (veryLowEfficiencyThreshold >= lowEfficiencyThreshold) {
                throw new IllegalArgumentException("Very-low efficiency threshold (" + veryLowEfficiencyThreshold
                        + ") must be below the low efficiency threshold (" + lowEfficiencyThreshold + ").");
            }
            if (maxCandidateIndex < 1) {
                throw new IllegalArgumentException("Last candidate index must be at least 1. Got: " + maxCandidateIndex);
            }
            if (fallbackIndex < 1) {
                throw new IllegalArgumentException("Fallback index must be at least 1. Got: " + fallbackIndex);
            }
        }

        public static RateThresholds defaults() {
            return new RateThresholds(0.85, 15.0, 350.0, 85.0, 80.0, 3, 3);
        }
    }

    /** First-cycle plausibility limits; channels outside are reported instead of analysed. */
    public record ScreeningThresholds(double highCharge, double lowCharge, double lowDischarge) {
        public ScreeningThresholds {
            if (lowCharge >= highCharge) {
                throw new IllegalArgumentException("Low charge limit (" + lowCharge + ") must be below high charge limit (" + highCharge + ").");
            }
        }

        public static ScreeningThresholds defaults() {
            return new ScreeningThresholds(380.0, 200.0, 200.0);
        }
    }

    /**
     * @param minCycleCountExclusive retention is computed only for channels with more cycles than this
     * @param offsets                fixed cycle offsets from the baseline, e.g. 100 and 200
     */
    public record RetentionSettings(int minCycleCountExclusive, List<Integer> offsets) {
        public RetentionSettings {
            if (minCycleCountExclusive < 1) {
                throw new IllegalArgumentException("Minimum cycle count must be at least 1. Got: " + minCycleCountExclusive);
            }
            offsets = List.copyOf(Objects.requireNonNull(offsets, "Retention offsets cannot be null."));
            for (Integer offset : offsets) {
                if (offset == null || offset <= 0) {
                    throw new IllegalArgumentException("Retention offsets must be positive. Got: " + offsets);
                }
            }
        }

        public static RetentionSettings defaults() {
            return new RetentionSettings(4, List.of(100, 200));
        }
    }

    public enum OutlierMethod { BOXPLOT, ZSCORE_MAD }

    public record OutlierSettings(OutlierMethod method, BoxplotSettings boxplot, ZScoreMadSettings zScoreMad) {
        public OutlierSettings {
            Objects.requireNonNull(method, "Outlier method cannot be null.");
            Objects.requireNonNull(boxplot, "Boxplot settings cannot be null.");
            Objects.requireNonNull(zScoreMad, "Z-score settings cannot be null.");
        }

        public static OutlierSettings defaults() {
            return new OutlierSettings(OutlierMethod.BOXPLOT, BoxplotSettings.defaults(), ZScoreMadSettings.defaults());
        }
    }

    /**
     * @param maxRanges metrics filtered in iteration order, each with the range (max - min) at which
     *                  filtering of that metric stops
     */
    public record BoxplotSettings(int maxIterations, double shrinkFactor, Map<ChannelMetric, Double> maxRanges) {
        public BoxplotSettings {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("Boxplot iteration cap must be positive. Got: " + maxIterations);
            }
            if (!(shrinkFactor > 0 && shrinkFactor <= 1)) {
                throw new IllegalArgumentException("Boxplot shrink factor must be in (0, 1]. Got: " + shrinkFactor);
            }
            Objects.requireNonNull(maxRanges, "Boxplot max ranges cannot be null.");
            maxRanges.forEach((metric, range) -> {
                if (range == null || range < 0) {
                    throw new IllegalArgumentException("Max range for " + metric.name() + " must be non-negative. Got: " + range);
                }
            });
            maxRanges = Collections.unmodifiableMap(new LinkedHashMap<>(maxRanges));
        }

        public static BoxplotSettings defaults() {
            Map<ChannelMetric, Double> ranges = new LinkedHashMap<>();
            ranges.put(ChannelMetric.FIRST_DISCHARGE, 10.0);
            ranges.put(ChannelMetric.FIRST_EFFICIENCY, 3.0);
            return new BoxplotSettings(10, 0.95, ranges);
        }
    }

    public record ZScoreMadSettings(
        double madConstant,
        double minMadRatio,
        Map<ChannelMetric, Double> thresholds,
        boolean useTimeSeries,
        int minSamplesForDetrend
    ) {
        public ZScoreMadSettings {
            if (!(madConstant > 0)) {
                throw new IllegalArgumentException("MAD constant must be positive. Got: " + madConstant);
            }
            if (minMadRatio < 0) {
                throw new IllegalArgumentException("Minimum MAD ratio cannot be negative. Got: " + minMadRatio);
            }
            Objects.requireNonNull(thresholds, "Z-score thresholds cannot be null.");
            thresholds.forEach((metric, limit) -> {
                if (limit == null || !(limit > 0)) {
                    throw new IllegalArgumentException("Z-score threshold for " + metric.name() + " must be positive. Got: " + limit);
                }
            });
            thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
            if (minSamplesForDetrend < 3) {
                throw new IllegalArgumentException("Detrending needs at least 3 samples. Got: " + minSamplesForDetrend);
            }
        }

        public static ZScoreMadSettings defaults() {
            Map<ChannelMetric, Double> limits = new LinkedHashMap<>();
            limits.put(ChannelMetric.FIRST_DISCHARGE, 3.0);
            limits.put(ChannelMetric.FIRST_EFFICIENCY, 2.5);
            limits.put(ChannelMetric.FIRST_VOLTAGE, 3.0);
            limits.put(ChannelMetric.FIRST_ENERGY, 3.0);
            return new ZScoreMadSettings(0.6745, 0.01, limits, true, 10);
        }
    }

    public record ReferenceSettings(
        List<ReferenceMethod> priority,
        ChannelMetric traditionalMetric,
        PcaSettings pca,
        CurveSettings curve
    ) {
        public ReferenceSettings {
            Objects.requireNonNull(priority, "Reference method priority cannot be null.");
            if (priority.isEmpty()) {
                throw new IllegalArgumentException("Reference method priority cannot be empty.");
            }
            EnumSet<ReferenceMethod> seen = EnumSet.noneOf(ReferenceMethod.class);
            for (ReferenceMethod method : priority) {
                if (method == null || !method.isScoringMethod()) {
                    throw new IllegalArgumentException("Not a scoring method: " + method);
                }
                if (!seen.add(method)) {
                    throw new IllegalArgumentException("Duplicate reference method in priority list: " + method.name());
                }
            }
            priority = List.copyOf(priority);
            Objects.requireNonNull(traditionalMetric, "Traditional metric cannot be null.");
            Objects.requireNonNull(pca, "PCA settings cannot be null.");
            Objects.requireNonNull(curve, "Curve settings cannot be null.");
        }

        public static ReferenceSettings defaults() {
            return new ReferenceSettings(
                    List.of(ReferenceMethod.CURVE_RETENTION_MSE, ReferenceMethod.PCA, ReferenceMethod.TRADITIONAL),
                    ChannelMetric.FIRST_DISCHARGE, PcaSettings.defaults(), CurveSettings.defaults());
        }
    }

    public record PcaSettings(List<ChannelMetric> features, int components, int minSamples, int minFeatures) {
        public PcaSettings {
            features = List.copyOf(Objects.requireNonNull(features, "PCA features cannot be null."));
            if (components < 1) {
                throw new IllegalArgumentException("PCA component count must be positive. Got: " + components);
            }
            if (minSamples < 2) {
                throw new IllegalArgumentException("PCA needs at least 2 samples. Got: " + minSamples);
            }
            if (minFeatures < 1) {
                throw new IllegalArgumentException("PCA needs at least 1 feature. Got: " + minFeatures);
            }
        }

        public static PcaSettings defaults() {
            return new PcaSettings(List.of(ChannelMetric.FIRST_DISCHARGE, ChannelMetric.FIRST_VOLTAGE,
                    ChannelMetric.CYCLE4_DISCHARGE), 2, 3, 2);
        }
    }

    public enum InterpolationKind { LINEAR, CUBIC }

    public enum WeightingScheme { CONSTANT, LINEAR, EXPONENTIAL }

    public record CurveSettings(
        int minChannels,
        int minCycles,
        InterpolationKind interpolation,
        boolean includeVoltage,
        boolean includeEnergy,
        double capacityWeight,
        double voltageWeight,
        double energyWeight,
        boolean useWeightedMse,
        WeightingScheme weighting,
        double weightFactor,
        double lateEmphasis,
        double lateFraction
    ) {
        public CurveSettings {
            if (minChannels < 2) {
                throw new IllegalArgumentException("Curve comparison needs at least 2 channels. Got: " + minChannels);
            }
            if (minCycles < 2) {
                throw new IllegalArgumentException("Curve comparison needs at least 2 cycles. Got: " + minCycles);
            }
            Objects.requireNonNull(interpolation, "Interpolation kind cannot be null.");
            Objects.requireNonNull(weighting, "Weighting scheme cannot be null.");
            if (capacityWeight < 0 || voltageWeight < 0 || energyWeight < 0) {
                throw new IllegalArgumentException("Metric weights cannot be negative.");
            }
            if (!(capacityWeight > 0)) {
                throw new IllegalArgumentException("Capacity weight must be positive. Got: " + capacityWeight);
            }
            if (weightFactor < 0) {
                throw new IllegalArgumentException("Weight factor cannot be negative. Got: " + weightFactor);
            }
            if (!(lateEmphasis > 0)) {
                throw new IllegalArgumentException("Late emphasis must be positive. Got: " + lateEmphasis);
            }
            if (!(lateFraction > 0 && lateFraction < 1)) {
                throw new IllegalArgumentException("Late fraction must be in (0, 1). Got: " + lateFraction);
            }
        }

        public static CurveSettings defaults() {
            return new CurveSettings(2, 5, InterpolationKind.LINEAR, true, true, 0.6, 0.1, 0.3,
                    true, WeightingScheme.LINEAR, 1.0, 2.0, 0.3);
        }
    }

    /** Include tokens that must appear in a file name, exclude tokens that must not. */
    public record SeriesRule(String name, List<String> include, List<String> exclude) {
        public SeriesRule {
            Objects.requireNonNull(name, "Series name cannot be null.");
            include = List.copyOf(Objects.requireNonNull(include, "Include tokens cannot be null."));
            exclude = exclude != null ? List.copyOf(exclude) : List.of();
        }

        public boolean matches(String fileName) {
            return include.stream().anyMatch(fileName::contains) && exclude.stream().noneMatch(fileName::contains);
        }
    }

    public record WorkbookSettings(String cycleSheetName, String testSheetName, List<SeriesRule> seriesRules,
                                   String defaultSeries, boolean excludeRunningCycle) {
        public WorkbookSettings {
            Objects.requireNonNull(cycleSheetName, "Cycle sheet name cannot be null.");
            Objects.requireNonNull(testSheetName, "Test sheet name cannot be null.");
            seriesRules = List.copyOf(Objects.requireNonNull(seriesRules, "Series rules cannot be null."));
            Objects.requireNonNull(defaultSeries, "Default series cannot be null.");
        }

        public static WorkbookSettings defaults() {
            return new WorkbookSettings("Cycle", "test", List.of(
                    new SeriesRule("G", List.of("-G-"), List.of("-M-")),
                    new SeriesRule("Q3", List.of("-Q3-"), List.of()),
                    new SeriesRule("M", List.of("-M-"), List.of()),
                    new SeriesRule("D", List.of("-D-"), List.of()),
                    new SeriesRule("Z", List.of("-Z-"), List.of())),
                    "Q3", true);
        }
    }
}
