package de.anton.battery.analyser.cycle_analyzer.algorithms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DataScalerTest {

    @Test
    void missing_entries_take_the_column_median() {
        double[][] data = {
                {1.0, 10.0},
                {Double.NaN, 20.0},
                {3.0, Double.NaN},
                {5.0, 40.0}
        };

        double[][] imputed = DataScaler.imputeColumnMedians(data);

        assertEquals(3.0, imputed[1][0], 1e-12);
        assertEquals(20.0, imputed[2][1], 1e-12);
        assertTrue(Double.isNaN(data[1][0]), "input must stay untouched");
    }

    @Test
    void column_without_values_stays_missing() {
        double[][] imputed = DataScaler.imputeColumnMedians(new double[][]{{1.0, Double.NaN}, {2.0, Double.NaN}});

        assertTrue(Double.isNaN(imputed[0][1]));
    }

    @Test
    void standardize_gives_zero_mean_and_unit_deviation() {
        double[][] scaled = DataScaler.standardize(new double[][]{{1.0, 7.0}, {2.0, 7.0}, {3.0, 7.0}});

        double factor = Math.sqrt(2.0 / 3.0);
        assertEquals(-1.0 / factor, scaled[0][0], 1e-9);
        assertEquals(0.0, scaled[1][0], 1e-9);
        assertEquals(1.0 / factor, scaled[2][0], 1e-9);
        // constant column
        assertEquals(0.0, scaled[0][1], 1e-12);
        assertEquals(0.0, scaled[2][1], 1e-12);
    }

    @Test
    void ragged_matrix_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> DataScaler.standardize(new double[][]{{1.0, 2.0}, {3.0}}));
    }
}
