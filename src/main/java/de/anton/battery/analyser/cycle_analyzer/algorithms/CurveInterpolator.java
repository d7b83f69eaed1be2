package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.InterpolationKind;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;

import java.util.Arrays;

/**
 * Resamples a curve given at strictly increasing positions onto another grid.
 * Grid points outside the known positions take the nearest end value.
 */
public final class CurveInterpolator {

    private CurveInterpolator() { throw new IllegalStateException("Utility class"); }

    public static double[] resample(double[] x, double[] y, double[] grid, InterpolationKind kind) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Positions and values differ in length: " + x.length + " vs " + y.length);
        }
        if (x.length == 0) {
            throw new IllegalArgumentException("Cannot resample an empty curve.");
        }
        double[] result = new double[grid.length];
        if (x.length == 1) {
            Arrays.fill(result, y[0]);
            return result;
        }

        // cubic needs three knots
        UnivariateInterpolator interpolator = (kind == InterpolationKind.CUBIC && x.length >= 3)
                ? new SplineInterpolator()
                : new LinearInterpolator();
        UnivariateFunction function = interpolator.interpolate(x, y);

        double first = x[0];
        double last = x[x.length - 1];
        for (int i = 0; i < grid.length; i++) {
            double g = grid[i];
            if (g <= first) {
                result[i] = y[0];
            } else if (g >= last) {
                result[i] = y[y.length - 1];
            } else {
                result[i] = function.value(g);
            }
        }
        return result;
    }
}
