package de.anton.battery.analyser.cycle_analyzer.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Column-wise preparation of feature matrices (rows = channels, columns = features):
 * median imputation of missing (NaN) entries and Z-score standardization.
 * All methods work on a copy and leave the caller's array untouched.
 */
public final class DataScaler {

    private static final Logger logger = LoggerFactory.getLogger(DataScaler.class);
    private static final double EPSILON = 1e-9; // near-zero standard deviation

    private DataScaler() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * Replaces NaN entries with the median of the column's known values.
     * Columns without any known value are left as NaN.
     */
    public static double[][] imputeColumnMedians(double[][] data) {
        double[][] result = copy(data);
        if (result.length == 0) return result;
        int cols = result[0].length;

        for (int j = 0; j < cols; j++) {
            int known = 0;
            for (double[] row : result) {
                if (!Double.isNaN(row[j])) known++;
            }
            if (known == 0 || known == result.length) continue;

            double[] values = new double[known];
            int k = 0;
            for (double[] row : result) {
                if (!Double.isNaN(row[j])) values[k++] = row[j];
            }
            double median = StatisticsUtils.median(values);
            for (double[] row : result) {
                if (Double.isNaN(row[j])) row[j] = median;
            }
            logger.trace("Imputed {} missing values in column {} with median {}.", result.length - known, j, median);
        }
        return result;
    }

    /**
     * Standardizes each column to mean 0 and unit (population) standard deviation.
     * Constant columns become 0.
     */
    public static double[][] standardize(double[][] data) {
        double[][] result = copy(data);
        if (result.length == 0) return result;
        int rows = result.length;
        int cols = result[0].length;

        for (int j = 0; j < cols; j++) {
            double sum = 0;
            double sumSq = 0;
            for (double[] row : result) {
                sum += row[j];
                sumSq += row[j] * row[j];
            }
            double mean = sum / rows;
            // E[X^2] - E[X]^2, clamped against rounding below zero
            double variance = Math.max(0.0, sumSq / rows - mean * mean);
            double stdDev = Math.sqrt(variance);

            if (stdDev < EPSILON) {
                logger.trace("Column {} is constant (mean={}), standardized to 0.", j, mean);
                for (double[] row : result) row[j] = 0.0;
            } else {
                for (double[] row : result) row[j] = (row[j] - mean) / stdDev;
            }
        }
        return result;
    }

    private static double[][] copy(double[][] data) {
        if (data == null) {
            throw new IllegalArgumentException("Feature matrix cannot be null.");
        }
        double[][] copy = new double[data.length][];
        int cols = data.length > 0 ? data[0].length : 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == null || data[i].length != cols) {
                throw new IllegalArgumentException("Inconsistent number of columns at row " + i + ". Expected " + cols + ".");
            }
            copy[i] = data[i].clone();
        }
        return copy;
    }
}
