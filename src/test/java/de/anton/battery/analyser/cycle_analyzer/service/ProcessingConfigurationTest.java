package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.model.ChannelMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.BoxplotSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.PcaSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RateThresholds;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ReferenceSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RetentionSettings;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.SeriesRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingConfigurationTest {

    @Test
    void defaults_use_the_documented_thresholds() {
        ProcessingConfiguration config = ProcessingConfiguration.defaults();

        assertEquals(0.85, config.rateThresholds().ratioThreshold());
        assertEquals(15.0, config.rateThresholds().dischargeDiffThreshold());
        assertEquals(350.0, config.rateThresholds().overchargeThreshold());
        assertEquals(List.of(100, 200), config.retention().offsets());
        assertEquals(List.of(ChannelMetric.FIRST_DISCHARGE, ChannelMetric.FIRST_EFFICIENCY),
                List.copyOf(config.outlier().boxplot().maxRanges().keySet()));
        assertEquals(ReferenceMethod.CURVE_RETENTION_MSE, config.reference().priority().get(0));
    }

    @Test
    void efficiency_thresholds_must_be_ordered() {
        assertThrows(IllegalArgumentException.class, () -> new RateThresholds(0.85, 15, 350, 80, 85, 3, 3));
    }

    @Test
    void shrink_factor_must_be_in_unit_interval() {
        Map<ChannelMetric, Double> ranges = Map.of(ChannelMetric.FIRST_DISCHARGE, 10.0);

        assertThrows(IllegalArgumentException.class, () -> new BoxplotSettings(10, 0.0, ranges));
        assertThrows(IllegalArgumentException.class, () -> new BoxplotSettings(10, 1.5, ranges));
        assertDoesNotThrow(() -> new BoxplotSettings(10, 1.0, ranges));
    }

    @Test
    void retention_offsets_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionSettings(4, List.of(100, 0)));
    }

    @Test
    void priority_rejects_duplicates_and_non_scoring_methods() {
        ReferenceSettings d = ReferenceSettings.defaults();

        assertThrows(IllegalArgumentException.class, () -> new ReferenceSettings(
                List.of(ReferenceMethod.PCA, ReferenceMethod.PCA), d.traditionalMetric(), d.pca(), d.curve()));
        assertThrows(IllegalArgumentException.class, () -> new ReferenceSettings(
                List.of(ReferenceMethod.SINGLE_CANDIDATE), d.traditionalMetric(), d.pca(), d.curve()));
        assertThrows(IllegalArgumentException.class, () -> new ReferenceSettings(
                List.of(), d.traditionalMetric(), d.pca(), d.curve()));
    }

    @Test
    void pca_needs_at_least_two_samples() {
        assertThrows(IllegalArgumentException.class, () -> new PcaSettings(List.of(ChannelMetric.FIRST_DISCHARGE), 1, 1, 1));
    }

    @Test
    void series_rule_matches_include_without_exclude() {
        SeriesRule g = new SeriesRule("G", List.of("-G-"), List.of("-M-"));

        assertTrue(g.matches("240501-G-2405-A1-1C-CH01.xlsx"));
        assertFalse(g.matches("240501-G-M-2405-A1-1C-CH01.xlsx"));
        assertFalse(g.matches("240501-Q3-2405-A1-1C-CH01.xlsx"));
    }
}
