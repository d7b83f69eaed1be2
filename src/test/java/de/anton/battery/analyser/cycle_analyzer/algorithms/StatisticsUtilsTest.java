package de.anton.battery.analyser.cycle_analyzer.algorithms;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsUtilsTest {

    @Test
    void round_is_half_up_and_keeps_missing_values_null() {
        assertEquals(97.9, StatisticsUtils.round(97.85, 1));
        assertEquals(2.68, StatisticsUtils.round(2.675, 2));
        assertNull(StatisticsUtils.round(null, 1));
        assertNull(StatisticsUtils.round(Double.NaN, 1));
    }

    @Test
    void mean_skips_missing_values() {
        assertEquals(2.0, StatisticsUtils.mean(Arrays.asList(1.0, null, 3.0, Double.NaN)));
        assertNull(StatisticsUtils.mean(Arrays.asList(null, Double.NaN)));
    }

    @Test
    void quantile_interpolates_between_ranks() {
        double[] values = {150, 298, 300, 301, 302};

        assertEquals(298.0, StatisticsUtils.quantile(values, 0.25), 1e-12);
        assertEquals(301.0, StatisticsUtils.quantile(values, 0.75), 1e-12);
        assertEquals(2.5, StatisticsUtils.quantile(new double[]{1, 2, 3, 4}, 0.5), 1e-12);
        assertEquals(7.0, StatisticsUtils.quantile(new double[]{7}, 0.25), 1e-12);
    }

    @Test
    void mad_is_median_of_absolute_deviations() {
        assertEquals(1.5, StatisticsUtils.mad(new double[]{300, 302, 298, 301, 299, 250}), 1e-12);
        assertEquals(0.0, StatisticsUtils.mad(new double[]{5, 5, 5}), 1e-12);
    }

    @Test
    void detrend_removes_a_perfect_line() {
        double[] residuals = StatisticsUtils.detrend(new double[]{10, 12, 14, 16});

        assertArrayEquals(new double[]{0, 0, 0, 0}, residuals, 1e-9);
    }

    @Test
    void range_of_empty_is_zero() {
        assertEquals(0.0, StatisticsUtils.range(new double[0]));
        assertEquals(4.0, StatisticsUtils.range(new double[]{298, 302, 300}));
    }
}
