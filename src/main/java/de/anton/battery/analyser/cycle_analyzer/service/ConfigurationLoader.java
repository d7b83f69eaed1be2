package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.model.ChannelMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.BoxplotSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.CurveSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.InterpolationKind;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.OutlierMethod;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.OutlierSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.PcaSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RateThresholds;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ReferenceSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RetentionSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ScreeningThresholds;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.SeriesRule;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.WeightingScheme;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.WorkbookSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ZScoreMadSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Builds a {@link ProcessingConfiguration} from properties. Every key is optional; missing keys keep
 * the value of {@link ProcessingConfiguration#defaults()}. Lists are comma separated, metric maps are
 * written as {@code METRIC:value} pairs.
 */
public final class ConfigurationLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    public static final String DEFAULT_RESOURCE = "/cycle-analyzer.properties";

    private ConfigurationLoader() {
        throw new IllegalStateException("Utility class");
    }

    /** Classpath defaults, or the built-in defaults if the resource is absent. */
    public static ProcessingConfiguration loadDefaults() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = ConfigurationLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.warn("Configuration resource {} not found, using built-in defaults.", DEFAULT_RESOURCE);
                return ProcessingConfiguration.defaults();
            }
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        return fromProperties(properties);
    }

    /**
     * Classpath defaults overridden by the given properties file.
     *
     * @throws IOException if the file cannot be read
     */
    public static ProcessingConfiguration load(Path overrideFile) throws IOException {
        Objects.requireNonNull(overrideFile, "Configuration file cannot be null.");
        Properties properties = new Properties();
        try (InputStream in = ConfigurationLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        }
        try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new IOException("Could not read configuration file " + overrideFile + ": " + e.getMessage(), e);
        }
        logger.info("Loaded configuration overrides from {}", overrideFile.toAbsolutePath());
        return fromProperties(properties);
    }

    /**
     * @throws IllegalArgumentException if a value cannot be parsed or violates a section's constraints
     */
    public static ProcessingConfiguration fromProperties(Properties p) {
        Objects.requireNonNull(p, "Properties cannot be null.");
        ProcessingConfiguration d = ProcessingConfiguration.defaults();

        RateThresholds r = d.rateThresholds();
        RateThresholds rate = new RateThresholds(
                getDouble(p, "rate.ratioThreshold", r.ratioThreshold()),
                getDouble(p, "rate.dischargeDiffThreshold", r.dischargeDiffThreshold()),
                getDouble(p, "rate.overchargeThreshold", r.overchargeThreshold()),
                getDouble(p, "rate.lowEfficiencyThreshold", r.lowEfficiencyThreshold()),
                getDouble(p, "rate.veryLowEfficiencyThreshold", r.veryLowEfficiencyThreshold()),
                getInt(p, "rate.maxCandidateIndex", r.maxCandidateIndex()),
                getInt(p, "rate.fallbackIndex", r.fallbackIndex()));

        ScreeningThresholds s = d.screening();
        ScreeningThresholds screening = new ScreeningThresholds(
                getDouble(p, "screening.highCharge", s.highCharge()),
                getDouble(p, "screening.lowCharge", s.lowCharge()),
                getDouble(p, "screening.lowDischarge", s.lowDischarge()));

        RetentionSettings ret = d.retention();
        RetentionSettings retention = new RetentionSettings(
                getInt(p, "retention.minCycleCountExclusive", ret.minCycleCountExclusive()),
                getList(p, "retention.offsets", ret.offsets(), v -> parseInt("retention.offsets", v)));

        OutlierSettings o = d.outlier();
        BoxplotSettings b = o.boxplot();
        ZScoreMadSettings z = o.zScoreMad();
        OutlierSettings outlier = new OutlierSettings(
                getEnum(p, "outlier.method", OutlierMethod.class, o.method()),
                new BoxplotSettings(
                        getInt(p, "outlier.boxplot.maxIterations", b.maxIterations()),
                        getDouble(p, "outlier.boxplot.shrinkFactor", b.shrinkFactor()),
                        getMetricMap(p, "outlier.boxplot.maxRanges", b.maxRanges())),
                new ZScoreMadSettings(
                        getDouble(p, "outlier.zscore.madConstant", z.madConstant()),
                        getDouble(p, "outlier.zscore.minMadRatio", z.minMadRatio()),
                        getMetricMap(p, "outlier.zscore.thresholds", z.thresholds()),
                        getBoolean(p, "outlier.zscore.useTimeSeries", z.useTimeSeries()),
                        getInt(p, "outlier.zscore.minSamplesForDetrend", z.minSamplesForDetrend())));

        ReferenceSettings ref = d.reference();
        PcaSettings pca = ref.pca();
        CurveSettings c = ref.curve();
        ReferenceSettings reference = new ReferenceSettings(
                getList(p, "reference.priority", ref.priority(), ConfigurationLoader::parseMethod),
                getMetric(p, "reference.traditionalMetric", ref.traditionalMetric()),
                new PcaSettings(
                        getList(p, "reference.pca.features", pca.features(), ChannelMetric::fromConfigName),
                        getInt(p, "reference.pca.components", pca.components()),
                        getInt(p, "reference.pca.minSamples", pca.minSamples()),
                        getInt(p, "reference.pca.minFeatures", pca.minFeatures())),
                new CurveSettings(
                        getInt(p, "reference.curve.minChannels", c.minChannels()),
                        getInt(p, "reference.curve.minCycles", c.minCycles()),
                        getEnum(p, "reference.curve.interpolation", InterpolationKind.class, c.interpolation()),
                        getBoolean(p, "reference.curve.includeVoltage", c.includeVoltage()),
                        getBoolean(p, "reference.curve.includeEnergy", c.includeEnergy()),
                        getDouble(p, "reference.curve.capacityWeight", c.capacityWeight()),
                        getDouble(p, "reference.curve.voltageWeight", c.voltageWeight()),
                        getDouble(p, "reference.curve.energyWeight", c.energyWeight()),
                        getBoolean(p, "reference.curve.useWeightedMse", c.useWeightedMse()),
                        getEnum(p, "reference.curve.weighting", WeightingScheme.class, c.weighting()),
                        getDouble(p, "reference.curve.weightFactor", c.weightFactor()),
                        getDouble(p, "reference.curve.lateEmphasis", c.lateEmphasis()),
                        getDouble(p, "reference.curve.lateFraction", c.lateFraction())));

        WorkbookSettings w = d.workbook();
        WorkbookSettings workbook = new WorkbookSettings(
                getString(p, "workbook.cycleSheet", w.cycleSheetName()),
                getString(p, "workbook.testSheet", w.testSheetName()),
                getSeriesRules(p, w.seriesRules()),
                getString(p, "workbook.defaultSeries", w.defaultSeries()),
                getBoolean(p, "workbook.excludeRunningCycle", w.excludeRunningCycle()));

        ProcessingConfiguration config = new ProcessingConfiguration(rate, screening, retention, outlier, reference, workbook);
        logger.debug("Configuration: {}", config);
        return config;
    }

    // --- Value parsing ---

    private static String value(Properties p, String key) {
        String raw = p.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        return raw.trim();
    }

    private static String getString(Properties p, String key, String defaultValue) {
        String v = value(p, key);
        return v != null ? v : defaultValue;
    }

    private static double getDouble(Properties p, String key, double defaultValue) {
        String v = value(p, key);
        if (v == null) return defaultValue;
        try {
            return Double.parseDouble(v.replace(',', '.'));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not a number: '" + v + "'", e);
        }
    }

    private static int getInt(Properties p, String key, int defaultValue) {
        String v = value(p, key);
        return v == null ? defaultValue : parseInt(key, v);
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not an integer: '" + v + "'", e);
        }
    }

    private static boolean getBoolean(Properties p, String key, boolean defaultValue) {
        String v = value(p, key);
        if (v == null) return defaultValue;
        if ("true".equalsIgnoreCase(v)) return true;
        if ("false".equalsIgnoreCase(v)) return false;
        throw new IllegalArgumentException("Property '" + key + "' must be true or false: '" + v + "'");
    }

    private static <E extends Enum<E>> E getEnum(Properties p, String key, Class<E> type, E defaultValue) {
        String v = value(p, key);
        if (v == null) return defaultValue;
        try {
            return Enum.valueOf(type, v.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Property '" + key + "' has unknown value '" + v + "'", e);
        }
    }

    private static ChannelMetric getMetric(Properties p, String key, ChannelMetric defaultValue) {
        String v = value(p, key);
        return v == null ? defaultValue : ChannelMetric.fromConfigName(v);
    }

    private static ReferenceMethod parseMethod(String name) {
        ReferenceMethod method = ReferenceMethod.fromConfigName(name);
        if (method == null) {
            throw new IllegalArgumentException("Unknown reference method: '" + name + "'");
        }
        return method;
    }

    private static <T> List<T> getList(Properties p, String key, List<T> defaultValue, Function<String, T> parser) {
        String v = value(p, key);
        if (v == null) return defaultValue;
        List<T> result = new ArrayList<>();
        for (String item : v.split(",")) {
            if (!item.trim().isEmpty()) {
                result.add(parser.apply(item.trim()));
            }
        }
        return result;
    }

    /** Parses {@code FIRST_DISCHARGE:10, FIRST_EFFICIENCY:3}, keeping the written order. */
    private static Map<ChannelMetric, Double> getMetricMap(Properties p, String key, Map<ChannelMetric, Double> defaultValue) {
        String v = value(p, key);
        if (v == null) return defaultValue;
        Map<ChannelMetric, Double> result = new LinkedHashMap<>();
        for (String entry : v.split(",")) {
            if (entry.trim().isEmpty()) continue;
            String[] pair = entry.split(":");
            if (pair.length != 2) {
                throw new IllegalArgumentException("Property '" + key + "' entry must be METRIC:value, got '" + entry.trim() + "'");
            }
            try {
                result.put(ChannelMetric.fromConfigName(pair[0]), Double.parseDouble(pair[1].trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property '" + key + "' has a non-numeric value in '" + entry.trim() + "'", e);
            }
        }
        return result;
    }

    /**
     * {@code workbook.series.rules=G,Q3} lists the rule names in match order; each rule reads
     * {@code workbook.series.<name>.include} and {@code workbook.series.<name>.exclude}.
     */
    private static List<SeriesRule> getSeriesRules(Properties p, List<SeriesRule> defaultValue) {
        String names = value(p, "workbook.series.rules");
        if (names == null) return defaultValue;
        List<SeriesRule> rules = new ArrayList<>();
        for (String name : names.split(",")) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) continue;
            String prefix = "workbook.series." + trimmed;
            List<String> include = getList(p, prefix + ".include", List.of("-" + trimmed + "-"), Function.identity());
            List<String> exclude = getList(p, prefix + ".exclude", List.of(), Function.identity());
            rules.add(new SeriesRule(trimmed, include, exclude));
        }
        return rules;
    }
}
