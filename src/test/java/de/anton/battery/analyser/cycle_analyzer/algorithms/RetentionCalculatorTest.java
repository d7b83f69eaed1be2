package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.RetentionMetrics;
import de.anton.battery.analyser.cycle_analyzer.model.RetentionPoint;
import de.anton.battery.analyser.cycle_analyzer.model.TestMode;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RetentionSettings;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.cycles;
import static org.junit.jupiter.api.Assertions.*;

class RetentionCalculatorTest {

    private final RetentionCalculator calculator = new RetentionCalculator(RetentionSettings.defaults());

    @Test
    void four_cycles_are_not_enough() {
        assertNull(calculator.compute(cycles(300, 280, 270, 260), 1));
    }

    @Test
    void current_retention_uses_the_last_cycle() {
        RetentionMetrics metrics = calculator.compute(cycles(300, 280, 270, 260, 252), 1);

        assertNotNull(metrics);
        assertEquals(1, metrics.getBaselineIndex());
        assertEquals(90.0, metrics.getCurrent().capacityRetention());
        assertEquals(100.0, metrics.getCurrent().voltageRetention());
        assertEquals(90.0, metrics.getCurrent().energyRetention());
    }

    @Test
    void offsets_not_reached_are_empty() {
        RetentionMetrics metrics = calculator.compute(cycles(300, 280, 270, 260, 252), 1);

        assertSame(RetentionPoint.EMPTY, metrics.getAtOffset(100));
        assertTrue(metrics.getAtOffset(200).isEmpty());
        assertTrue(metrics.getAtOffset(300).isEmpty());
    }

    @Test
    void offset_is_counted_from_the_baseline() {
        List<CycleRecord> cycles = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            double discharge = 300 - i * 0.5;
            cycles.add(new CycleRecord(i, discharge + 5, discharge, 3.8, discharge * 3.8));
        }

        RetentionMetrics metrics = calculator.compute(cycles, 1);

        // cycle 101 against cycle 1: 249.5 / 299.5
        assertEquals(83.3, metrics.getAtOffset(100).capacityRetention());
        assertTrue(metrics.getAtOffset(200).isEmpty());
    }

    @Test
    void voltage_decay_is_millivolts_per_elapsed_cycle() {
        List<CycleRecord> cycles = List.of(
                new CycleRecord(0, 310, 300, 3.80, 1140),
                new CycleRecord(1, 300, 290, 3.78, 1096),
                new CycleRecord(2, 300, 288, 3.75, 1080),
                new CycleRecord(3, 300, 286, 3.72, 1064),
                new CycleRecord(4, 300, 284, 3.70, 1051));

        RetentionMetrics metrics = calculator.compute(cycles, 0);

        assertEquals(25.0, metrics.getVoltageDecayRate());
    }

    @Test
    void zero_baseline_leaves_metric_null() {
        List<CycleRecord> cycles = List.of(
                new CycleRecord(0, 310, 0, 3.8, 1140),
                new CycleRecord(1, 300, 290, 3.8, 1096),
                new CycleRecord(2, 300, 288, 3.8, 1080),
                new CycleRecord(3, 300, 286, 3.8, 1064),
                new CycleRecord(4, 300, 284, 3.8, 1051));

        RetentionMetrics metrics = calculator.compute(cycles, 0);

        assertNull(metrics.getCurrent().capacityRetention());
        assertEquals(100.0, metrics.getCurrent().voltageRetention());
    }

    @Test
    void baseline_on_last_cycle_gives_nothing() {
        assertNull(calculator.compute(cycles(300, 280, 270, 260, 252), 4));
        assertNull(calculator.compute(cycles(300, 280, 270, 260, 252), -1));
    }

    @Test
    void single_point_entry_uses_first_cycle_for_non_rate_tests() {
        List<CycleRecord> cycles = cycles(300, 280, 270, 260, 240);

        RetentionPoint rate = calculator.compute(cycles, 1, TestMode.RATE_1C, null);
        RetentionPoint lowRate = calculator.compute(cycles, 1, TestMode.LOW_RATE_0P1C, null);

        assertEquals(85.7, rate.capacityRetention());
        assertEquals(80.0, lowRate.capacityRetention());
    }

    @Test
    void baseline_index_resolution() {
        assertEquals(2, RetentionCalculator.resolveBaselineIndex(TestMode.RATE_1C, 2, 10, 3));
        assertEquals(3, RetentionCalculator.resolveBaselineIndex(TestMode.RATE_1C, null, 10, 3));
        assertEquals(2, RetentionCalculator.resolveBaselineIndex(TestMode.RATE_1C, null, 3, 3));
        assertEquals(0, RetentionCalculator.resolveBaselineIndex(TestMode.BASELINE, 2, 10, 3));
        assertEquals(0, RetentionCalculator.resolveBaselineIndex(TestMode.OTHER, null, 10, 3));
    }
}
