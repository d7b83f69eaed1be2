package de.anton.battery.analyser.cycle_analyzer.algorithms;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Objects;

/**
 * Small numeric helpers shared by the batch algorithms. Null and NaN inputs are treated as missing.
 */
public final class StatisticsUtils {

    private StatisticsUtils() { throw new IllegalStateException("Utility class"); }

    /** Half-up rounding to {@code places} decimals; null and non-finite values stay null. */
    public static Double round(Double value, int places) {
        if (value == null || value.isNaN() || value.isInfinite()) return null;
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /** Mean over the non-missing values, or null if there are none. */
    public static Double mean(Collection<Double> values) {
        double sum = 0; int count = 0;
        for (Double v : values) {
            if (v != null && !v.isNaN()) { sum += v; count++; }
        }
        return count == 0 ? null : sum / count;
    }

    public static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        return new Median().evaluate(values);
    }

    /**
     * Quantile with linear interpolation between closest ranks (R type 7, the spreadsheet/pandas default).
     *
     * @param p quantile in [0, 1]
     */
    public static double quantile(double[] values, double p) {
        if (values.length == 0) return Double.NaN;
        if (values.length == 1) return values[0];
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        return percentile.evaluate(values, p * 100.0);
    }

    /** Median absolute deviation around the median. */
    public static double mad(double[] values) {
        if (values.length == 0) return Double.NaN;
        double med = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - med);
        }
        return median(deviations);
    }

    /**
     * Removes the least-squares linear trend over the sample position.
     *
     * @return residuals, same length as the input
     */
    public static double[] detrend(double[] values) {
        Objects.requireNonNull(values, "Values cannot be null.");
        if (values.length < 2) return values.clone();
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        double[] residuals = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            residuals[i] = values[i] - (intercept + slope * i);
        }
        return residuals;
    }

    public static double range(double[] values) {
        if (values.length == 0) return 0.0;
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : values) { min = Math.min(min, v); max = Math.max(max, v); }
        return max - min;
    }

    public static boolean isUsable(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }
}
